package org.codeindex.index;

import java.util.Collection;
import java.util.Optional;

/**
 * 有序符号索引：{@link Location} → {@link SymbolRecord}，按 Location 升序迭代。
 * <p>
 * 查询层只持有索引的只读引用（生命周期为一次查询），不负责索引的构建与更新。
 */
public interface SymbolIndex {

    /**
     * 精确查找某个位置，返回指向该条目的游标；不存在时返回空。
     */
    Optional<Cursor> find(Location location);

    default Optional<SymbolRecord> lookup(Location location) {
        return find(location).map(Cursor::record);
    }

    /**
     * 全部记录（按 Location 升序）。
     */
    Collection<SymbolRecord> symbols();

    /**
     * 某个文件内的全部记录（按 Location 升序）。
     */
    Collection<SymbolRecord> symbolsInFile(int fileId);

    int size();

    FileRegistry files();

    /**
     * 索引游标：指向某一条目，可向前（更小的 Location）逐条移动。
     */
    interface Cursor {

        Location location();

        SymbolRecord record();

        /**
         * 前一条目；已经位于索引开头时返回空。
         */
        Optional<Cursor> previous();
    }
}
