package org.codeindex.query;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class FilterPredicateTest {

    private static final SystemPathClassifier SYSTEM = SystemPathClassifier.prefixes(List.of("/usr/", "/System/"));

    @Test
    void acceptsEverythingWithoutFilters() {
        FilterPredicate predicate = FilterPredicate.from(QueryRequest.unrestricted(), SYSTEM);

        assertThat(predicate.accept("/usr/include/stdio.h")).isTrue();
        assertThat(predicate.accept("")).isTrue();
        assertThat(predicate.accept("   anything at all")).isTrue();
    }

    @Test
    void rejectsSystemPathsWhenRequested() {
        FilterPredicate predicate = FilterPredicate.from(
                QueryRequest.unrestricted(QueryFlag.FILTER_SYSTEM_INCLUDES), SYSTEM);

        assertThat(predicate.accept("/usr/include/stdio.h:1:1:")).isFalse();
        // 前导空白在判定前会被去掉
        assertThat(predicate.accept("  \t/usr/include/stdio.h")).isFalse();
        assertThat(predicate.accept("/work/app/main.cpp")).isTrue();
    }

    @Test
    void systemCheckRunsBeforePathFilters() {
        QueryRequest request = QueryRequest.builder()
                .pathFilter("/usr/include")
                .flags(QueryFlag.FILTER_SYSTEM_INCLUDES)
                .build();
        FilterPredicate predicate = FilterPredicate.from(request, SYSTEM);

        assertThat(predicate.accept("/usr/include/stdio.h")).isFalse();
    }

    @Test
    void matchesPathFiltersOnNormalizedCandidate() {
        FilterPredicate literal = FilterPredicate.from(QueryRequest.builder().pathFilter("/work/app/").build(), SYSTEM);
        FilterPredicate regex = FilterPredicate.from(
                QueryRequest.builder().pathFilter("^/work/.*\\.h").flags(QueryFlag.MATCH_REGEX).build(), SYSTEM);

        assertThat(literal.accept("   /work/app/main.cpp")).isTrue();
        assertThat(literal.accept("/usr/include/stdio.h")).isFalse();
        assertThat(regex.accept(" /work/app/a.h:3:1:")).isTrue();
        assertThat(regex.accept("/work/app/a.cpp")).isFalse();
    }

    @Test
    void neverClassifierKeepsSystemPaths() {
        FilterPredicate predicate = FilterPredicate.from(
                QueryRequest.unrestricted(QueryFlag.FILTER_SYSTEM_INCLUDES), SystemPathClassifier.NEVER);

        assertThat(predicate.accept("/usr/include/stdio.h")).isTrue();
    }
}
