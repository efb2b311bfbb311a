package org.codeindex.mcp;

import org.codeindex.query.Transport;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;

/**
 * 把结果行收集到内存中的传输通道，带字节上限。
 * <p>
 * 累计字节数（UTF-8，每行额外计 1 字节换行）超过上限时写入失败，作业随之中止；
 * 失败之后的写入一律拒绝。
 */
class CollectingTransport implements Transport {

    private final long maxBytes;
    private final List<String> lines = new ArrayList<>();
    private long bytes;
    private boolean overflowed;

    CollectingTransport(long maxBytes) {
        this.maxBytes = maxBytes;
    }

    @Override
    public boolean write(String line) {
        if (overflowed) {
            return false;
        }
        long size = line.getBytes(StandardCharsets.UTF_8).length + 1L;
        if (bytes + size > maxBytes) {
            overflowed = true;
            return false;
        }
        bytes += size;
        lines.add(line);
        return true;
    }

    List<String> lines() {
        return List.copyOf(lines);
    }

    boolean isOverflowed() {
        return overflowed;
    }
}
