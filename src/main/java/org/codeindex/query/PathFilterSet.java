package org.codeindex.query;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/**
 * 路径过滤集合：字面前缀模式与正则模式二选一（由类型保证互斥），或不过滤。
 */
public sealed interface PathFilterSet permits PathFilterSet.None, PathFilterSet.Literal, PathFilterSet.Regex {

    None NONE = new None();

    /**
     * 候选文本是否匹配任一过滤条件。
     */
    boolean matches(String candidate);

    default boolean isEmpty() {
        return false;
    }

    /**
     * 根据查询请求构建过滤集合。
     *
     * @throws IllegalArgumentException 正则模式下存在不合法的正则（cause 为 {@link PatternSyntaxException}）
     */
    static PathFilterSet from(QueryRequest request) {
        return of(request.pathFilters(), request.has(QueryFlag.MATCH_REGEX));
    }

    static PathFilterSet of(List<String> filters, boolean regex) {
        if (filters == null || filters.isEmpty()) {
            return NONE;
        }
        return regex ? Regex.compile(filters) : new Literal(filters);
    }

    record None() implements PathFilterSet {

        @Override
        public boolean matches(String candidate) {
            return true;
        }

        @Override
        public boolean isEmpty() {
            return true;
        }
    }

    /**
     * 字面前缀匹配（区分大小写）。
     */
    record Literal(List<String> prefixes) implements PathFilterSet {

        public Literal {
            prefixes = List.copyOf(prefixes);
        }

        @Override
        public boolean matches(String candidate) {
            for (String prefix : prefixes) {
                if (candidate.startsWith(prefix)) {
                    return true;
                }
            }
            return false;
        }
    }

    /**
     * 正则匹配：任一正则在候选文本中“找到”匹配即可（不要求整串匹配）。
     */
    record Regex(List<Pattern> patterns) implements PathFilterSet {

        public Regex {
            patterns = List.copyOf(patterns);
        }

        static Regex compile(List<String> sources) {
            List<Pattern> compiled = new ArrayList<>(sources.size());
            for (String source : sources) {
                try {
                    compiled.add(Pattern.compile(source));
                } catch (PatternSyntaxException e) {
                    throw new IllegalArgumentException("路径过滤正则不合法：" + source + "（" + e.getDescription() + "）", e);
                }
            }
            return new Regex(compiled);
        }

        @Override
        public boolean matches(String candidate) {
            for (Pattern pattern : patterns) {
                if (pattern.matcher(candidate).find()) {
                    return true;
                }
            }
            return false;
        }
    }
}
