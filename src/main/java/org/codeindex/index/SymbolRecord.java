package org.codeindex.index;

import java.util.Objects;

/**
 * 符号索引中的一条记录（某个符号在某个位置上的一次出现）。
 * <p>
 * 记录由外部索引构建并持有，查询层只读。
 *
 * @param location    出现位置（同时也是索引 key）
 * @param symbolName  全限定符号名，例如 {@code Foo::bar(int)}
 * @param displayName 展示名，例如 {@code bar(int)}
 * @param kind        符号种类
 * @param definition  是否为定义（而非声明/引用）
 * @param startLine   符号范围起始行
 * @param startColumn 符号范围起始列
 * @param endLine     符号范围结束行（包含）
 * @param endColumn   符号范围结束列（包含）
 */
public record SymbolRecord(
        Location location,
        String symbolName,
        String displayName,
        SymbolKind kind,
        boolean definition,
        int startLine,
        int startColumn,
        int endLine,
        int endColumn
) {

    public SymbolRecord {
        Objects.requireNonNull(location, "location 不能为空");
        symbolName = Objects.requireNonNullElse(symbolName, "");
        displayName = Objects.requireNonNullElse(displayName, "");
        kind = Objects.requireNonNullElse(kind, SymbolKind.UNKNOWN);
    }

    public String kindSpelling() {
        return kind.spelling();
    }

    public boolean isContainerKind() {
        return kind.isContainer();
    }

    /**
     * (line, column) 是否落在 [start, end] 范围内（两端包含）。
     */
    public boolean spans(int line, int column) {
        return Location.comparePosition(line, column, startLine, startColumn) >= 0
                && Location.comparePosition(line, column, endLine, endColumn) <= 0;
    }
}
