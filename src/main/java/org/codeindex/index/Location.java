package org.codeindex.index;

/**
 * 源码位置：(fileId, line, column)，按 fileId → line → column 字典序全序排列。
 * <p>
 * fileId 为 0 表示“空位置”（不存在），写出结果时总是被拒绝。
 * <p>
 * 三个分量都是非负 int，取值范围 0 ~ {@link Integer#MAX_VALUE}；外部索引中更大的无符号值不受支持，
 * 快照加载时会被拒绝（见 {@link SymbolIndexSnapshotLoader}）。
 *
 * @param fileId 文件标识（见 {@link FileRegistry}；0 表示空位置）
 * @param line   行号（1-based）
 * @param column 列号（1-based）
 */
public record Location(int fileId, int line, int column) implements Comparable<Location> {

    public static final Location NULL = new Location(0, 0, 0);

    public Location {
        if (fileId < 0 || line < 0 || column < 0) {
            throw new IllegalArgumentException("位置参数不能为负数：" + fileId + ":" + line + ":" + column);
        }
    }

    public boolean isNull() {
        return fileId == 0;
    }

    @Override
    public int compareTo(Location other) {
        int c = Integer.compare(fileId, other.fileId);
        if (c != 0) {
            return c;
        }
        return comparePosition(line, column, other.line, other.column);
    }

    /**
     * 比较两个 (line, column) 位置：先比行号，行号相同再比列号。
     *
     * @return 负数/0/正数，分别表示小于/等于/大于参照位置
     */
    public static int comparePosition(int line, int column, int refLine, int refColumn) {
        if (line != refLine) {
            return line < refLine ? -1 : 1;
        }
        if (column != refColumn) {
            return column < refColumn ? -1 : 1;
        }
        return 0;
    }
}
