package org.codeindex.index;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.NavigableMap;
import java.util.Objects;
import java.util.Optional;
import java.util.TreeMap;

/**
 * 基于 {@link TreeMap} 的只读符号索引。
 * <p>
 * 游标向前移动使用 {@link NavigableMap#lowerEntry}，每一步 O(log n)，不需要复制或扫描整个索引。
 */
public final class TreeMapSymbolIndex implements SymbolIndex {

    private static final Logger log = LoggerFactory.getLogger(TreeMapSymbolIndex.class);

    private final FileRegistry files;
    private final NavigableMap<Location, SymbolRecord> symbols;

    public TreeMapSymbolIndex(FileRegistry files, Collection<SymbolRecord> records) {
        this.files = Objects.requireNonNull(files, "files 不能为空");
        TreeMap<Location, SymbolRecord> map = new TreeMap<>();
        for (SymbolRecord record : records) {
            Location location = record.location();
            if (location.isNull()) {
                throw new IllegalArgumentException("符号位置不能为空位置：" + record.symbolName());
            }
            if (files.path(location.fileId()) == null) {
                throw new IllegalArgumentException("符号引用了未注册的 fileId：" + location.fileId() + "（" + record.symbolName() + "）");
            }
            if (map.put(location, record) != null) {
                log.debug("位置 {} 存在重复符号记录，保留最后一条：{}", location, record.symbolName());
            }
        }
        this.symbols = Collections.unmodifiableNavigableMap(map);
    }

    public static TreeMapSymbolIndex empty() {
        return new TreeMapSymbolIndex(FileRegistry.empty(), List.of());
    }

    @Override
    public Optional<Cursor> find(Location location) {
        if (location == null) {
            return Optional.empty();
        }
        SymbolRecord record = symbols.get(location);
        if (record == null) {
            return Optional.empty();
        }
        return Optional.of(new EntryCursor(location, record));
    }

    @Override
    public Collection<SymbolRecord> symbols() {
        return symbols.values();
    }

    @Override
    public Collection<SymbolRecord> symbolsInFile(int fileId) {
        if (fileId <= 0) {
            return List.of();
        }
        Location from = new Location(fileId, 0, 0);
        if (fileId == Integer.MAX_VALUE) {
            return symbols.tailMap(from, true).values();
        }
        return symbols.subMap(from, true, new Location(fileId + 1, 0, 0), false).values();
    }

    @Override
    public int size() {
        return symbols.size();
    }

    @Override
    public FileRegistry files() {
        return files;
    }

    private final class EntryCursor implements Cursor {

        private final Location location;
        private final SymbolRecord record;

        private EntryCursor(Location location, SymbolRecord record) {
            this.location = location;
            this.record = record;
        }

        @Override
        public Location location() {
            return location;
        }

        @Override
        public SymbolRecord record() {
            return record;
        }

        @Override
        public Optional<Cursor> previous() {
            Map.Entry<Location, SymbolRecord> entry = symbols.lowerEntry(location);
            if (entry == null) {
                return Optional.empty();
            }
            return Optional.of(new EntryCursor(entry.getKey(), entry.getValue()));
        }
    }
}
