package org.codeindex.query.job;

import org.codeindex.index.SampleIndex;
import org.codeindex.query.QueryContext;
import org.codeindex.query.QueryFlag;
import org.codeindex.query.QueryJob;
import org.codeindex.query.QueryRequest;
import org.codeindex.query.RecordingTransport;
import org.codeindex.query.SystemPathClassifier;
import org.codeindex.query.LineObserver;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class QueryJobsTest {

    private final QueryContext context = new QueryContext(
            SampleIndex.create(), SystemPathClassifier.prefixes(List.of("/usr/")), LineObserver.NONE, Set.of());
    private final RecordingTransport transport = new RecordingTransport();

    @Test
    void listFiles_filtersSystemIncludesAndRendersRelativePaths() {
        QueryRequest request = QueryRequest.unrestricted(QueryFlag.FILTER_SYSTEM_INCLUDES, QueryFlag.RELATIVE_PATH);

        int code = new ListFilesJob(request, context).run(transport);

        assertThat(code).isEqualTo(QueryJob.EXIT_OK);
        assertThat(transport.lines()).containsExactly("src/main.cpp", "src/util.cpp");
    }

    @Test
    void listFiles_stopsAtCap() {
        ListFilesJob job = new ListFilesJob(QueryRequest.builder().maxResults(1).build(), context);

        job.run(transport);

        assertThat(transport.lines()).containsExactly(SampleIndex.MAIN_CPP);
        assertThat(job.isCapReached()).isTrue();
        assertThat(job.linesWritten()).isEqualTo(1);
    }

    @Test
    void listSymbols_singleFileFilterEnumeratesOnlyThatFile() {
        QueryRequest request = QueryRequest.builder()
                .pathFilter(SampleIndex.UTIL_CPP)
                .flags(QueryFlag.CONTAINING_FUNCTION)
                .build();

        new ListSymbolsJob(request, context).run(transport);

        assertThat(transport.lines()).containsExactly(
                "/work/app/src/util.cpp:1:1:",
                "/work/app/src/util.cpp:3:6:",
                "/work/app/src/util.cpp:5:5:\tfunction: helper(int)"
        );
    }

    @Test
    void listSymbols_lineRangeSkipsWithoutStopping() {
        QueryRequest request = QueryRequest.builder()
                .lineRange(12, 25)
                .pathFilter("/work/app/src/main.cpp")
                .build();

        ListSymbolsJob job = new ListSymbolsJob(request, context);
        job.run(transport);

        assertThat(transport.lines()).containsExactly(
                "/work/app/src/main.cpp:12:5:",
                "/work/app/src/main.cpp:15:9:",
                "/work/app/src/main.cpp:25:3:"
        );
        assertThat(job.isCapReached()).isFalse();
    }

    @Test
    void findSymbol_listsDefinitionsFirst() {
        QueryRequest request = QueryRequest.unrestricted(QueryFlag.CURSOR_KIND);

        new FindSymbolJob(request, context, "helper(int)", false).run(transport);

        assertThat(transport.lines()).containsExactly(
                "/work/app/src/util.cpp:3:6:\tFunctionDecl",
                "/work/app/src/main.cpp:15:9:\tCallExpr",
                "/work/app/src/main.cpp:25:3:\tCallExpr"
        );
    }

    @Test
    void findSymbol_partialMatchHonoursCapAndSystemFilter() {
        QueryRequest request = QueryRequest.builder()
                .maxResults(2)
                .flags(QueryFlag.FILTER_SYSTEM_INCLUDES)
                .build();
        FindSymbolJob job = new FindSymbolJob(request, context, "u", true);

        job.run(transport);

        // Outer、run()、run()::count 都包含 "u"；/usr 下的 puts 被过滤
        assertThat(transport.lines()).containsExactly(
                "/work/app/src/main.cpp:10:6:",
                "/work/app/src/main.cpp:12:5:"
        );
        assertThat(job.isCapReached()).isTrue();
    }

    @Test
    void findSymbol_requiresName() {
        assertThatThrownBy(() -> new FindSymbolJob(QueryRequest.unrestricted(), context, " ", false))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
