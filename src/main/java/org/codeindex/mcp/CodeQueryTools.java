package org.codeindex.mcp;

import org.codeindex.config.CodeIndexProperties;
import org.codeindex.query.JobFlag;
import org.codeindex.query.QueryContext;
import org.codeindex.query.QueryFlag;
import org.codeindex.query.QueryJob;
import org.codeindex.query.QueryRequest;
import org.codeindex.query.dto.IndexStatusResult;
import org.codeindex.query.dto.QueryResult;
import org.codeindex.query.job.FindSymbolJob;
import org.codeindex.query.job.ListFilesJob;
import org.codeindex.query.job.ListSymbolsJob;
import org.springframework.ai.tool.annotation.Tool;
import org.springframework.ai.tool.annotation.ToolParam;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * 代码索引查询 MCP 工具集合。
 * <p>
 * 提供能力：
 * <ul>
 *   <li>索引概况（{@code index_status}）。</li>
 *   <li>列出文件（{@code index_list_files}）与符号位置（{@code index_list_symbols}）。</li>
 *   <li>按符号名查找位置（{@code index_find_symbol}）。</li>
 * </ul>
 * <p>
 * 每次调用都会新建一个查询作业，绑定内存收集通道执行，执行结束即解绑；
 * 结果条数与字节数都有上限保护，达到上限时通过 {@code capReached}/{@code aborted} 告知调用方。
 */
@Component
public class CodeQueryTools {

    private final CodeIndexProperties properties;
    private final QueryContext context;

    public CodeQueryTools(CodeIndexProperties properties, QueryContext context) {
        // properties：服务端配置（结果条数/字节上限等）
        this.properties = properties;
        // context：符号索引、系统路径判定与默认作业选项
        this.context = context;
    }

    @Tool(
            name = "index_status",
            description = "查看符号索引概况：工程根目录、文件数、符号数。"
    )
    public IndexStatusResult status() {
        return new IndexStatusResult(
                context.index().files().sourceRoot(),
                context.index().files().size(),
                context.index().size(),
                properties.getSnapshotFile()
        );
    }

    @Tool(
            name = "index_list_files",
            description = "列出索引中的文件路径；支持路径前缀/正则过滤、过滤系统头文件与结果条数上限。"
    )
    public QueryResult listFiles(
            @ToolParam(required = false, description = "路径过滤条件（默认按前缀匹配；regex=true 时按正则查找）") List<String> pathFilters,
            @ToolParam(required = false, description = "pathFilters 是否按正则匹配（默认 false）") Boolean regex,
            @ToolParam(required = false, description = "是否过滤系统头文件（默认 false）") Boolean filterSystemIncludes,
            @ToolParam(required = false, description = "是否输出相对工程根目录的路径（默认 false）") Boolean relativePaths,
            @ToolParam(required = false, description = "最大返回条数（默认 app.index.default-max-results，上限 app.index.max-results-limit）") Integer maxResults,
            @ToolParam(required = false, description = "是否给每行加双引号（默认 app.index.quote-output）") Boolean quote
    ) {
        QueryRequest request = baseRequest(pathFilters, regex, filterSystemIncludes, relativePaths, maxResults).build();
        return run(new ListFilesJob(request, jobContext(quote)));
    }

    @Tool(
            name = "index_list_symbols",
            description = "列出符号位置（path:line:column:），可附加展示名、符号种类与所在函数；支持路径过滤、行范围与结果条数上限。"
    )
    public QueryResult listSymbols(
            @ToolParam(required = false, description = "路径过滤条件（默认按前缀匹配；只给一个完整文件路径时只扫描该文件）") List<String> pathFilters,
            @ToolParam(required = false, description = "pathFilters 是否按正则匹配（默认 false）") Boolean regex,
            @ToolParam(required = false, description = "是否过滤系统头文件（默认 false）") Boolean filterSystemIncludes,
            @ToolParam(required = false, description = "是否输出相对工程根目录的路径（默认 false）") Boolean relativePaths,
            @ToolParam(required = false, description = "最大返回条数（默认 app.index.default-max-results，上限 app.index.max-results-limit）") Integer maxResults,
            @ToolParam(required = false, description = "起始行号（包含；需与 maxLine 同时指定）") Integer minLine,
            @ToolParam(required = false, description = "结束行号（包含；需与 minLine 同时指定）") Integer maxLine,
            @ToolParam(required = false, description = "是否附加所在函数（默认 false）") Boolean containingFunction,
            @ToolParam(required = false, description = "是否附加符号种类（默认 false）") Boolean cursorKind,
            @ToolParam(required = false, description = "是否附加展示名（默认 false）") Boolean displayName,
            @ToolParam(required = false, description = "是否给每行加双引号（默认 app.index.quote-output）") Boolean quote
    ) {
        QueryRequest request = annotatedRequest(pathFilters, regex, filterSystemIncludes, relativePaths, maxResults,
                minLine, maxLine, containingFunction, cursorKind, displayName);
        return run(new ListSymbolsJob(request, jobContext(quote)));
    }

    @Tool(
            name = "index_find_symbol",
            description = "按符号名查找位置（定义优先）；支持包含匹配、路径过滤、行范围与附加信息。"
    )
    public QueryResult findSymbol(
            @ToolParam(description = "符号名（默认精确匹配，例如 Foo::bar(int)）") String symbolName,
            @ToolParam(required = false, description = "是否按包含匹配（默认 false）") Boolean partial,
            @ToolParam(required = false, description = "路径过滤条件（默认按前缀匹配）") List<String> pathFilters,
            @ToolParam(required = false, description = "pathFilters 是否按正则匹配（默认 false）") Boolean regex,
            @ToolParam(required = false, description = "是否过滤系统头文件（默认 false）") Boolean filterSystemIncludes,
            @ToolParam(required = false, description = "是否输出相对工程根目录的路径（默认 false）") Boolean relativePaths,
            @ToolParam(required = false, description = "最大返回条数（默认 app.index.default-max-results，上限 app.index.max-results-limit）") Integer maxResults,
            @ToolParam(required = false, description = "起始行号（包含；需与 maxLine 同时指定）") Integer minLine,
            @ToolParam(required = false, description = "结束行号（包含；需与 minLine 同时指定）") Integer maxLine,
            @ToolParam(required = false, description = "是否附加所在函数（默认 false）") Boolean containingFunction,
            @ToolParam(required = false, description = "是否附加符号种类（默认 false）") Boolean cursorKind,
            @ToolParam(required = false, description = "是否附加展示名（默认 false）") Boolean displayName
    ) {
        QueryRequest request = annotatedRequest(pathFilters, regex, filterSystemIncludes, relativePaths, maxResults,
                minLine, maxLine, containingFunction, cursorKind, displayName);
        return run(new FindSymbolJob(request, jobContext(null), symbolName, Boolean.TRUE.equals(partial)));
    }

    private QueryRequest annotatedRequest(
            List<String> pathFilters,
            Boolean regex,
            Boolean filterSystemIncludes,
            Boolean relativePaths,
            Integer maxResults,
            Integer minLine,
            Integer maxLine,
            Boolean containingFunction,
            Boolean cursorKind,
            Boolean displayName
    ) {
        QueryRequest.Builder builder = baseRequest(pathFilters, regex, filterSystemIncludes, relativePaths, maxResults)
                .flag(QueryFlag.CONTAINING_FUNCTION, Boolean.TRUE.equals(containingFunction))
                .flag(QueryFlag.CURSOR_KIND, Boolean.TRUE.equals(cursorKind))
                .flag(QueryFlag.DISPLAY_NAME, Boolean.TRUE.equals(displayName));
        if (minLine != null || maxLine != null) {
            if (minLine == null || maxLine == null) {
                throw new IllegalArgumentException("参数错误：minLine 与 maxLine 必须同时指定");
            }
            builder.lineRange(Math.max(0, minLine), Math.max(0, maxLine));
        }
        return builder.build();
    }

    private QueryRequest.Builder baseRequest(
            List<String> pathFilters,
            Boolean regex,
            Boolean filterSystemIncludes,
            Boolean relativePaths,
            Integer maxResults
    ) {
        return QueryRequest.builder()
                .maxResults(resolveMaxResults(maxResults))
                .pathFilters(pathFilters)
                .flag(QueryFlag.MATCH_REGEX, Boolean.TRUE.equals(regex))
                .flag(QueryFlag.FILTER_SYSTEM_INCLUDES, Boolean.TRUE.equals(filterSystemIncludes))
                .flag(QueryFlag.RELATIVE_PATH, Boolean.TRUE.equals(relativePaths));
    }

    private QueryContext jobContext(Boolean quote) {
        if (quote == null) {
            return context;
        }
        return context.withJobFlag(JobFlag.QUOTE_OUTPUT, quote);
    }

    private QueryResult run(QueryJob job) {
        CollectingTransport transport = new CollectingTransport(properties.getTransportMaxBytes().toBytes());
        int exitCode = job.run(transport);

        List<String> warnings = new ArrayList<>();
        if (job.isCapReached()) {
            warnings.add("已达到 maxResults 上限（" + job.request().maxResults() + "），结果可能不完整；可缩小过滤范围或增大 maxResults。");
        }
        if (transport.isOverflowed()) {
            warnings.add("结果超过 app.index.transport-max-bytes 上限，已中止输出；可缩小过滤范围后重试。");
        }
        return new QueryResult(
                transport.lines(),
                job.linesWritten(),
                job.request().maxResults(),
                job.isCapReached(),
                job.isAborted(),
                exitCode,
                warnings
        );
    }

    private int resolveMaxResults(Integer requested) {
        int limit = Math.max(1, properties.getMaxResultsLimit());
        if (requested == null || requested <= 0) {
            return Math.min(Math.max(1, properties.getDefaultMaxResults()), limit);
        }
        return Math.min(requested, limit);
    }
}
