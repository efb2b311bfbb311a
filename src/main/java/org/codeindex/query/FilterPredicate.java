package org.codeindex.query;

import java.util.Objects;

/**
 * 输出行过滤：组合路径过滤与“系统头文件”过滤，决定一行候选结果是否写出。
 * <p>
 * 无状态、无副作用；匹配前会去掉候选文本的前导空白（仅用于匹配，不影响输出）。
 */
public final class FilterPredicate {

    private final PathFilterSet pathFilters;
    private final boolean filterSystemPaths;
    private final SystemPathClassifier classifier;

    public FilterPredicate(PathFilterSet pathFilters, boolean filterSystemPaths, SystemPathClassifier classifier) {
        this.pathFilters = Objects.requireNonNull(pathFilters, "pathFilters 不能为空");
        this.filterSystemPaths = filterSystemPaths;
        this.classifier = Objects.requireNonNull(classifier, "classifier 不能为空");
    }

    public static FilterPredicate from(QueryRequest request, SystemPathClassifier classifier) {
        return new FilterPredicate(
                PathFilterSet.from(request),
                request.has(QueryFlag.FILTER_SYSTEM_INCLUDES),
                classifier
        );
    }

    public boolean accept(String candidate) {
        if (pathFilters.isEmpty() && !filterSystemPaths) {
            return true;
        }
        String normalized = stripLeadingWhitespace(candidate);
        if (filterSystemPaths && classifier.isSystem(normalized)) {
            return false;
        }
        if (pathFilters.isEmpty()) {
            return true;
        }
        return pathFilters.matches(normalized);
    }

    public PathFilterSet pathFilters() {
        return pathFilters;
    }

    static String stripLeadingWhitespace(String value) {
        int i = 0;
        while (i < value.length() && Character.isWhitespace(value.charAt(i))) {
            i++;
        }
        return i == 0 ? value : value.substring(i);
    }
}
