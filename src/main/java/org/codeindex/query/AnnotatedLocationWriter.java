package org.codeindex.query;

import org.codeindex.index.Location;
import org.codeindex.index.LocationFormatter;
import org.codeindex.index.SymbolIndex;
import org.codeindex.index.SymbolRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;
import java.util.Optional;

/**
 * 位置写出器：把 {@link Location} 渲染为 key，并按查询选项附加展示名、符号种类与所在函数，
 * 然后交给 {@link ResultWriter} 写出。
 * <p>
 * 附加信息之间以制表符分隔，例如：
 * <pre>
 * /src/a.cpp:15:9:	foo(int)	CallExpr	function: Bar::run()
 * </pre>
 */
public class AnnotatedLocationWriter {

    private static final Logger log = LoggerFactory.getLogger(AnnotatedLocationWriter.class);

    private final ResultWriter writer;
    private final SymbolIndex index;
    private final LocationFormatter formatter;
    private final QueryRequest request;

    public AnnotatedLocationWriter(ResultWriter writer, SymbolIndex index, LocationFormatter formatter, QueryRequest request) {
        this.writer = Objects.requireNonNull(writer, "writer 不能为空");
        this.index = Objects.requireNonNull(index, "index 不能为空");
        this.formatter = Objects.requireNonNull(formatter, "formatter 不能为空");
        this.request = Objects.requireNonNull(request, "request 不能为空");
    }

    /**
     * @return false 表示位置被拒绝（空位置/超出行范围）、达到条数上限或通道失败
     */
    public boolean write(Location location, WriteOption... options) {
        if (location == null || location.isNull()) {
            return false;
        }
        if (request.isLineRestricted()) {
            if (request.maxLine() == QueryRequest.UNLIMITED) {
                throw new IllegalStateException("行范围限制缺少 maxLine：minLine=" + request.minLine());
            }
            int line = location.line();
            if (line < request.minLine() || line > request.maxLine()) {
                return false;
            }
        }

        StringBuilder out = new StringBuilder();
        boolean containingFunction = request.has(QueryFlag.CONTAINING_FUNCTION);
        boolean cursorKind = request.has(QueryFlag.CURSOR_KIND);
        boolean displayName = request.has(QueryFlag.DISPLAY_NAME);
        if (containingFunction || cursorKind || displayName) {
            Optional<SymbolIndex.Cursor> found = index.find(location);
            if (found.isEmpty()) {
                log.warn("符号索引中找不到位置 {}，已跳过附加信息", formatter.registeredKey(location));
            } else {
                SymbolIndex.Cursor cursor = found.get();
                if (displayName) {
                    out.append('\t').append(cursor.record().displayName());
                }
                if (cursorKind) {
                    out.append('\t').append(cursor.record().kindSpelling());
                }
                if (containingFunction) {
                    findContainingFunction(cursor)
                            .ifPresent(fn -> out.append("\tfunction: ").append(fn.symbolName()));
                }
            }
        }
        return writeLine(location, out.toString(), options);
    }

    /**
     * 写出一条符号记录：{@code key\tkind\tsymbolName[\tdefinition]}。
     */
    public boolean write(SymbolRecord record, WriteOption... options) {
        if (record == null || record.location().isNull()) {
            return false;
        }
        StringBuilder out = new StringBuilder()
                .append('\t').append(record.kindSpelling())
                .append('\t').append(record.symbolName());
        if (record.definition()) {
            out.append("\tdefinition");
        }
        return writeLine(record.location(), out.toString(), options);
    }

    /**
     * 过滤总是基于注册路径的 key；输出的 key 可能是相对路径。
     */
    private boolean writeLine(Location location, String annotations, WriteOption... options) {
        return writer.writeFiltered(formatter.registeredKey(location) + annotations,
                formatter.key(location) + annotations, options);
    }

    /**
     * 从游标所在条目向前逐条查找：第一个“容器类定义且范围包含该位置”的条目即所在函数。
     * <p>
     * 越过文件边界或到达索引开头时停止；游标自身的条目不参与匹配。
     */
    static Optional<SymbolRecord> findContainingFunction(SymbolIndex.Cursor start) {
        Location location = start.location();
        Optional<SymbolIndex.Cursor> current = start.previous();
        while (current.isPresent()) {
            SymbolIndex.Cursor cursor = current.get();
            if (cursor.location().fileId() != location.fileId()) {
                break;
            }
            SymbolRecord candidate = cursor.record();
            if (candidate.definition()
                    && candidate.isContainerKind()
                    && candidate.spans(location.line(), location.column())) {
                return Optional.of(candidate);
            }
            current = cursor.previous();
        }
        return Optional.empty();
    }
}
