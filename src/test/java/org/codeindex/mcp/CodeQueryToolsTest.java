package org.codeindex.mcp;

import org.codeindex.config.CodeIndexProperties;
import org.codeindex.index.SampleIndex;
import org.codeindex.query.JobFlag;
import org.codeindex.query.LineObserver;
import org.codeindex.query.QueryContext;
import org.codeindex.query.SystemPathClassifier;
import org.codeindex.query.dto.IndexStatusResult;
import org.codeindex.query.dto.QueryResult;
import org.junit.jupiter.api.Test;
import org.springframework.util.unit.DataSize;

import java.util.List;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class CodeQueryToolsTest {

    private final CodeIndexProperties properties = new CodeIndexProperties();
    private final QueryContext context = new QueryContext(
            SampleIndex.create(),
            SystemPathClassifier.prefixes(properties.getSystemPathPrefixes()),
            LineObserver.NONE,
            Set.of(JobFlag.QUIET)
    );

    @Test
    void status_reportsIndexSize() {
        IndexStatusResult status = new CodeQueryTools(properties, context).status();

        assertThat(status.sourceRoot()).isEqualTo("/work/app/");
        assertThat(status.files()).isEqualTo(3);
        assertThat(status.symbols()).isEqualTo(9);
        assertThat(status.snapshotFile()).isNull();
    }

    @Test
    void listFiles_appliesMaxResultsLimitAndWarns() {
        properties.setMaxResultsLimit(2);
        CodeQueryTools tools = new CodeQueryTools(properties, context);

        QueryResult result = tools.listFiles(null, null, null, null, 50, null);

        assertThat(result.maxResults()).isEqualTo(2);
        assertThat(result.lines()).containsExactly(SampleIndex.MAIN_CPP, SampleIndex.UTIL_CPP);
        assertThat(result.capReached()).isTrue();
        assertThat(result.aborted()).isFalse();
        assertThat(result.exitCode()).isZero();
        assertThat(result.warnings()).hasSize(1);
    }

    @Test
    void listFiles_quotesWhenRequested() {
        QueryResult result = new CodeQueryTools(properties, context)
                .listFiles(List.of("/work/app/src/m"), false, null, null, null, true);

        assertThat(result.lines()).containsExactly("\"" + SampleIndex.MAIN_CPP + "\"");
    }

    @Test
    void listSymbols_passesAnnotationsAndLineRange() {
        QueryResult result = new CodeQueryTools(properties, context).listSymbols(
                List.of("main\\.cpp"), true, null, true, null, 15, 25, true, true, false, null);

        assertThat(result.lines()).containsExactly(
                "src/main.cpp:15:9:\tCallExpr\tfunction: run()",
                "src/main.cpp:25:3:\tCallExpr"
        );
        assertThat(result.linesWritten()).isEqualTo(2);
    }

    @Test
    void relativePaths_stillFilterOnRegisteredPath() {
        CodeQueryTools tools = new CodeQueryTools(properties, context);

        QueryResult symbols = tools.listSymbols(
                List.of(SampleIndex.UTIL_CPP), null, null, true, null, null, null, null, null, null, null);
        QueryResult files = tools.listFiles(List.of(SampleIndex.UTIL_CPP), null, null, true, null, null);

        assertThat(symbols.lines()).containsExactly(
                "src/util.cpp:1:1:",
                "src/util.cpp:3:6:",
                "src/util.cpp:5:5:"
        );
        assertThat(files.lines()).containsExactly("src/util.cpp");
    }

    @Test
    void relativePaths_doNotMatchRelativeFilters() {
        QueryResult result = new CodeQueryTools(properties, context)
                .listFiles(List.of("src/"), null, null, true, null, null);

        assertThat(result.lines()).isEmpty();
    }

    @Test
    void listSymbols_requiresBothLineBounds() {
        CodeQueryTools tools = new CodeQueryTools(properties, context);

        assertThatThrownBy(() -> tools.listSymbols(null, null, null, null, null, 5, null, null, null, null, null))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void listSymbols_rejectsMalformedRegex() {
        CodeQueryTools tools = new CodeQueryTools(properties, context);

        assertThatThrownBy(() -> tools.listSymbols(List.of("(("), true, null, null, null, null, null, null, null, null, null))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void findSymbol_abortsWhenTransportBudgetIsExceeded() {
        properties.setTransportMaxBytes(DataSize.ofBytes(40));
        CodeQueryTools tools = new CodeQueryTools(properties, context);

        QueryResult result = tools.findSymbol("helper(int)", false, null, null, null, null, null, null, null, null, null, null);

        assertThat(result.lines()).containsExactly("/work/app/src/util.cpp:3:6:");
        assertThat(result.aborted()).isTrue();
        assertThat(result.exitCode()).isEqualTo(1);
        assertThat(result.warnings()).anyMatch(w -> w.contains("transport-max-bytes"));
    }

    @Test
    void collectingTransport_refusesEverythingAfterOverflow() {
        CollectingTransport transport = new CollectingTransport(4);

        assertThat(transport.write("abc")).isTrue();
        assertThat(transport.write("d")).isFalse();
        assertThat(transport.write("")).isFalse();
        assertThat(transport.lines()).containsExactly("abc");
        assertThat(transport.isOverflowed()).isTrue();
    }
}
