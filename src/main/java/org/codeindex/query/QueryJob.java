package org.codeindex.query;

import org.codeindex.index.Location;
import org.codeindex.index.LocationFormatter;
import org.codeindex.index.SymbolIndex;
import org.codeindex.index.SymbolRecord;

import java.util.Collections;
import java.util.EnumSet;
import java.util.Objects;
import java.util.Set;

/**
 * 一次查询的执行上下文：持有查询选项、过滤条件、条数上限与中止状态，并负责绑定/解绑传输通道。
 * <p>
 * 生命周期：构造 → {@link #run(Transport)}（绑定通道 → {@link #execute()} → 解绑）。
 * 子类在 {@link #execute()} 中决定“枚举什么”，通过 {@code write(...)} 系列方法写出结果；
 * 任何一次写出返回 false 且 {@link #isAborted()} / {@link #isCapReached()} 为 true 时应尽快停止枚举。
 * <p>
 * 非线程安全：同一个作业不能被多个线程同时执行。
 */
public abstract class QueryJob {

    public static final int EXIT_OK = 0;
    public static final int EXIT_ABORTED = 1;

    private final QueryRequest request;
    private final Set<JobFlag> jobFlags;
    private final SymbolIndex index;
    private final LocationFormatter formatter;
    private final FilterPredicate filter;
    private final ResultWriter writer;
    private final AnnotatedLocationWriter locationWriter;

    /**
     * @throws IllegalArgumentException 路径过滤正则不合法
     */
    protected QueryJob(QueryRequest request, QueryContext context) {
        this.request = Objects.requireNonNull(request, "request 不能为空");
        Objects.requireNonNull(context, "context 不能为空");
        Set<JobFlag> flags = context.jobFlags().isEmpty() ? EnumSet.noneOf(JobFlag.class) : EnumSet.copyOf(context.jobFlags());
        if (request.has(QueryFlag.SILENT)) {
            flags.add(JobFlag.QUIET);
        }
        this.jobFlags = Collections.unmodifiableSet(flags);
        this.index = context.index();
        this.formatter = new LocationFormatter(index.files(), request.has(QueryFlag.RELATIVE_PATH));
        this.filter = FilterPredicate.from(request, context.classifier());
        this.writer = new ResultWriter(filter, jobFlags, request.maxResults(), context.observer());
        this.locationWriter = new AnnotatedLocationWriter(writer, index, formatter, request);
    }

    /**
     * 绑定通道并执行查询；无论正常返回还是抛出异常，返回前都会解绑通道。
     *
     * @return {@link #execute()} 的返回值；执行期间通道失败时返回 {@link #EXIT_ABORTED}
     */
    public final int run(Transport transport) {
        try (ResultWriter.Binding ignored = writer.bind(transport)) {
            int code = execute();
            return writer.isAborted() ? EXIT_ABORTED : code;
        }
    }

    protected abstract int execute();

    protected boolean write(String text, WriteOption... options) {
        return writer.write(text, options);
    }

    protected boolean writeFiltered(String filterKey, String text, WriteOption... options) {
        return writer.writeFiltered(filterKey, text, options);
    }

    protected boolean writeRaw(String text, WriteOption... options) {
        return writer.writeRaw(text, options);
    }

    protected boolean write(Location location, WriteOption... options) {
        return locationWriter.write(location, options);
    }

    protected boolean write(SymbolRecord record, WriteOption... options) {
        return locationWriter.write(record, options);
    }

    /**
     * 只配置了一个字面路径过滤且它正好是已注册文件时，返回该文件的 fileId；否则返回 0。
     * <p>
     * 子类可据此只枚举这一个文件。
     */
    public int fileFilter() {
        if (filter.pathFilters() instanceof PathFilterSet.Literal literal && literal.prefixes().size() == 1) {
            return index.files().fileId(literal.prefixes().get(0));
        }
        return 0;
    }

    /**
     * 写出被拒绝后是否应该停止枚举（通道失败或达到条数上限）。
     */
    protected boolean shouldStop() {
        return writer.isAborted() || writer.isCapReached();
    }

    public void abort() {
        writer.abort();
    }

    public boolean isAborted() {
        return writer.isAborted();
    }

    public boolean isCapReached() {
        return writer.isCapReached();
    }

    public int linesWritten() {
        return writer.linesWritten();
    }

    public QueryRequest request() {
        return request;
    }

    public Set<JobFlag> jobFlags() {
        return jobFlags;
    }

    protected SymbolIndex index() {
        return index;
    }

    protected LocationFormatter formatter() {
        return formatter;
    }
}
