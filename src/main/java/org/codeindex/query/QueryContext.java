package org.codeindex.query;

import org.codeindex.index.SymbolIndex;

import java.util.EnumSet;
import java.util.Objects;
import java.util.Set;

/**
 * 作业运行环境：符号索引、系统路径判定、逐行输出观察者与默认作业选项。
 *
 * @param index      符号索引（只读）
 * @param classifier 系统路径判定
 * @param observer   逐行输出观察者
 * @param jobFlags   作业选项
 */
public record QueryContext(SymbolIndex index, SystemPathClassifier classifier, LineObserver observer, Set<JobFlag> jobFlags) {

    public QueryContext {
        Objects.requireNonNull(index, "index 不能为空");
        classifier = Objects.requireNonNullElse(classifier, SystemPathClassifier.NEVER);
        observer = Objects.requireNonNullElse(observer, LineObserver.NONE);
        jobFlags = (jobFlags == null || jobFlags.isEmpty()) ? Set.of() : Set.copyOf(jobFlags);
    }

    public static QueryContext of(SymbolIndex index) {
        return new QueryContext(index, SystemPathClassifier.NEVER, LineObserver.NONE, Set.of());
    }

    public QueryContext withJobFlag(JobFlag flag, boolean enabled) {
        Set<JobFlag> flags = jobFlags.isEmpty() ? EnumSet.noneOf(JobFlag.class) : EnumSet.copyOf(jobFlags);
        if (enabled) {
            flags.add(flag);
        } else {
            flags.remove(flag);
        }
        return new QueryContext(index, classifier, observer, flags);
    }

    public QueryContext withObserver(LineObserver observer) {
        return new QueryContext(index, classifier, observer, jobFlags);
    }
}
