package org.codeindex.query;

import java.util.List;

/**
 * 判断一个（已去掉前导空白的）路径是否属于系统/外部头文件。
 */
@FunctionalInterface
public interface SystemPathClassifier {

    SystemPathClassifier NEVER = path -> false;

    boolean isSystem(String path);

    /**
     * 按路径前缀判断（区分大小写）。
     */
    static SystemPathClassifier prefixes(List<String> prefixes) {
        List<String> copy = prefixes == null
                ? List.of()
                : prefixes.stream().filter(p -> p != null && !p.isEmpty()).toList();
        if (copy.isEmpty()) {
            return NEVER;
        }
        return path -> {
            for (String prefix : copy) {
                if (path.startsWith(prefix)) {
                    return true;
                }
            }
            return false;
        };
    }
}
