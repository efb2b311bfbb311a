package org.codeindex.index;

import java.util.Collections;
import java.util.HashMap;
import java.util.Map;
import java.util.NavigableMap;
import java.util.TreeMap;

/**
 * fileId 与文件路径的双向映射。
 * <p>
 * fileId 0 保留给“空位置”，不能注册。{@code sourceRoot} 为可选的工程根目录，用于渲染相对路径。
 */
public final class FileRegistry {

    private static final FileRegistry EMPTY = new FileRegistry(null, Map.of());

    private final String sourceRoot;
    private final NavigableMap<Integer, String> pathsById;
    private final Map<String, Integer> idsByPath;

    private FileRegistry(String sourceRoot, Map<Integer, String> paths) {
        this.sourceRoot = (sourceRoot == null || sourceRoot.isBlank()) ? null : sourceRoot;
        TreeMap<Integer, String> byId = new TreeMap<>();
        Map<String, Integer> byPath = new HashMap<>(Math.max(16, paths.size() * 2));
        for (Map.Entry<Integer, String> e : paths.entrySet()) {
            Integer id = e.getKey();
            String path = e.getValue();
            if (id == null || id <= 0) {
                throw new IllegalArgumentException("fileId 必须为正整数：" + id);
            }
            if (path == null || path.isBlank()) {
                throw new IllegalArgumentException("fileId " + id + " 对应的路径不能为空");
            }
            Integer previous = byPath.putIfAbsent(path, id);
            if (previous != null) {
                throw new IllegalArgumentException("路径被重复注册：" + path + "（fileId " + previous + " 与 " + id + "）");
            }
            byId.put(id, path);
        }
        this.pathsById = Collections.unmodifiableNavigableMap(byId);
        this.idsByPath = Collections.unmodifiableMap(byPath);
    }

    public static FileRegistry empty() {
        return EMPTY;
    }

    public static FileRegistry of(String sourceRoot, Map<Integer, String> paths) {
        return new FileRegistry(sourceRoot, paths == null ? Map.of() : paths);
    }

    /**
     * @return 路径；未注册时返回 null
     */
    public String path(int fileId) {
        return pathsById.get(fileId);
    }

    /**
     * @return fileId；未注册时返回 0
     */
    public int fileId(String path) {
        if (path == null) {
            return 0;
        }
        Integer id = idsByPath.get(path);
        return id == null ? 0 : id;
    }

    /**
     * 全部文件（按 fileId 升序）。
     */
    public NavigableMap<Integer, String> paths() {
        return pathsById;
    }

    public String sourceRoot() {
        return sourceRoot;
    }

    public int size() {
        return pathsById.size();
    }
}
