package org.codeindex.query;

import java.util.ArrayList;
import java.util.List;

/**
 * 记录型传输通道：记录每次写入；可指定第 n 次写入（1-based）起失败。
 */
public class RecordingTransport implements Transport {

    private final int failFromCall;
    private final List<String> lines = new ArrayList<>();
    private int calls;

    public RecordingTransport() {
        this(0);
    }

    public RecordingTransport(int failFromCall) {
        this.failFromCall = failFromCall;
    }

    @Override
    public boolean write(String line) {
        calls++;
        if (failFromCall > 0 && calls >= failFromCall) {
            return false;
        }
        lines.add(line);
        return true;
    }

    public List<String> lines() {
        return lines;
    }

    public int calls() {
        return calls;
    }
}
