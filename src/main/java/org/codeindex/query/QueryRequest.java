package org.codeindex.query;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;

/**
 * 已解析的查询请求（查询描述符）。
 * <p>
 * 约束在构造时校验：
 * <ul>
 *   <li>{@code maxResults} 为 -1（不限）或非负数。</li>
 *   <li>行范围限制必须同时给出 minLine 与 maxLine（都为 -1 表示不限制），且 minLine ≤ maxLine。</li>
 * </ul>
 *
 * @param maxResults  最大结果条数（-1 表示不限）
 * @param minLine     行范围下界（包含；-1 表示不限制）
 * @param maxLine     行范围上界（包含；-1 表示不限制）
 * @param pathFilters 路径过滤条件（字面前缀或正则，取决于 {@link QueryFlag#MATCH_REGEX}）
 * @param flags       查询选项
 */
public record QueryRequest(int maxResults, int minLine, int maxLine, List<String> pathFilters, Set<QueryFlag> flags) {

    public static final int UNLIMITED = -1;

    public QueryRequest {
        if (maxResults < UNLIMITED) {
            throw new IllegalArgumentException("参数错误：maxResults 只能为 -1（不限）或非负数：" + maxResults);
        }
        if ((minLine == UNLIMITED) != (maxLine == UNLIMITED)) {
            throw new IllegalArgumentException("参数错误：行范围必须同时指定 minLine 与 maxLine（" + minLine + ", " + maxLine + "）");
        }
        if (minLine < UNLIMITED || maxLine < UNLIMITED) {
            throw new IllegalArgumentException("参数错误：行号不能为负数（" + minLine + ", " + maxLine + "）");
        }
        if (minLine > maxLine) {
            throw new IllegalArgumentException("参数错误：minLine 不能大于 maxLine（" + minLine + " > " + maxLine + "）");
        }
        List<String> filters = new ArrayList<>();
        if (pathFilters != null) {
            for (String filter : pathFilters) {
                if (filter != null && !filter.isEmpty() && !filters.contains(filter)) {
                    filters.add(filter);
                }
            }
        }
        pathFilters = List.copyOf(filters);
        flags = (flags == null || flags.isEmpty()) ? Set.of() : Set.copyOf(flags);
    }

    public static QueryRequest unrestricted(QueryFlag... flags) {
        return builder().flags(flags).build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public boolean has(QueryFlag flag) {
        return flags.contains(flag);
    }

    public boolean isLineRestricted() {
        return minLine != UNLIMITED;
    }

    public static final class Builder {

        private int maxResults = UNLIMITED;
        private int minLine = UNLIMITED;
        private int maxLine = UNLIMITED;
        private final List<String> pathFilters = new ArrayList<>();
        private final Set<QueryFlag> flags = EnumSet.noneOf(QueryFlag.class);

        private Builder() {
        }

        public Builder maxResults(int maxResults) {
            this.maxResults = maxResults;
            return this;
        }

        public Builder lineRange(int minLine, int maxLine) {
            this.minLine = minLine;
            this.maxLine = maxLine;
            return this;
        }

        public Builder pathFilters(List<String> pathFilters) {
            if (pathFilters != null) {
                this.pathFilters.addAll(pathFilters);
            }
            return this;
        }

        public Builder pathFilter(String pathFilter) {
            this.pathFilters.add(pathFilter);
            return this;
        }

        public Builder flags(QueryFlag... flags) {
            this.flags.addAll(Arrays.asList(flags));
            return this;
        }

        public Builder flag(QueryFlag flag, boolean enabled) {
            if (enabled) {
                this.flags.add(flag);
            } else {
                this.flags.remove(flag);
            }
            return this;
        }

        public QueryRequest build() {
            return new QueryRequest(maxResults, minLine, maxLine, pathFilters, flags);
        }
    }
}
