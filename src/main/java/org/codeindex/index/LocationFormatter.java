package org.codeindex.index;

/**
 * 把 {@link Location} 渲染成文本 key：{@code path:line:column:}。
 * <p>
 * 默认使用注册时的路径（通常是绝对路径）；{@code relative=true} 且路径位于 sourceRoot 之下时，输出相对 sourceRoot 的路径。
 */
public final class LocationFormatter {

    private final FileRegistry files;
    private final boolean relative;

    public LocationFormatter(FileRegistry files, boolean relative) {
        this.files = files;
        this.relative = relative;
    }

    public String key(Location location) {
        return path(location.fileId()) + suffix(location);
    }

    /**
     * 始终使用注册路径的 key，不受 {@code relative} 影响；路径过滤与系统路径判定以它为准。
     */
    public String registeredKey(Location location) {
        return registeredPath(location.fileId()) + suffix(location);
    }

    public String registeredPath(int fileId) {
        String path = files.path(fileId);
        return path == null ? "<unknown file " + fileId + ">" : path;
    }

    public String path(int fileId) {
        String path = files.path(fileId);
        if (path == null) {
            return registeredPath(fileId);
        }
        String root = files.sourceRoot();
        if (!relative || root == null || !path.startsWith(root)) {
            return path;
        }
        String rel = path.substring(root.length());
        while (rel.startsWith("/")) {
            rel = rel.substring(1);
        }
        return rel.isEmpty() ? path : rel;
    }

    private static String suffix(Location location) {
        return ":" + location.line() + ':' + location.column() + ':';
    }
}
