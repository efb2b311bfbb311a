package org.codeindex.config;

import org.codeindex.index.SymbolIndex;
import org.codeindex.index.SymbolIndexSnapshotLoader;
import org.codeindex.index.TreeMapSymbolIndex;
import org.codeindex.query.JobFlag;
import org.codeindex.query.LineObserver;
import org.codeindex.query.QueryContext;
import org.codeindex.query.SystemPathClassifier;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.nio.file.Path;
import java.util.EnumSet;
import java.util.Set;

/**
 * 代码索引查询服务的 Bean 装配。
 * <p>
 * 说明：
 * <ul>
 *   <li>启动时按 {@link CodeIndexProperties#getSnapshotFile()} 加载符号索引快照；快照不合法时启动失败。</li>
 *   <li>把索引、系统路径判定、逐行日志与默认作业选项组装成 {@link QueryContext}，供各个查询作业共用。</li>
 * </ul>
 */
@Configuration(proxyBeanMethods = false)
public class CodeIndexConfiguration {

    @Bean
    public SymbolIndexSnapshotLoader symbolIndexSnapshotLoader() {
        return new SymbolIndexSnapshotLoader();
    }

    @Bean
    public SymbolIndex symbolIndex(CodeIndexProperties properties, SymbolIndexSnapshotLoader loader) {
        String snapshot = properties.getSnapshotFile();
        if (snapshot == null || snapshot.isBlank()) {
            return TreeMapSymbolIndex.empty();
        }
        return loader.load(Path.of(snapshot).toAbsolutePath().normalize());
    }

    @Bean
    public SystemPathClassifier systemPathClassifier(CodeIndexProperties properties) {
        return SystemPathClassifier.prefixes(properties.getSystemPathPrefixes());
    }

    @Bean
    public QueryContext queryContext(CodeIndexProperties properties, SymbolIndex symbolIndex, SystemPathClassifier classifier) {
        Set<JobFlag> flags = EnumSet.noneOf(JobFlag.class);
        if (!properties.isLogOutput()) {
            flags.add(JobFlag.QUIET);
        }
        if (properties.isQuoteOutput()) {
            flags.add(JobFlag.QUOTE_OUTPUT);
        }
        return new QueryContext(symbolIndex, classifier, LineObserver.logging(), flags);
    }
}
