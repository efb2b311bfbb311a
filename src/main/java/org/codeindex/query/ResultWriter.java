package org.codeindex.query;

import java.util.EnumSet;
import java.util.Objects;
import java.util.Set;

/**
 * 流式结果写出器：过滤 → 可选加引号 → 条数上限 → 写入传输通道。
 * <p>
 * 规则：
 * <ul>
 *   <li>被过滤掉的候选行视为“成功的空操作”（返回 true），不占用条数上限，也不会写入通道。</li>
 *   <li>达到条数上限时 {@link #writeRaw} 返回 false（不是错误），调用方据此停止枚举。</li>
 *   <li>通道写入失败后作业进入中止状态，之后的写出直接返回 false，不再访问通道。</li>
 * </ul>
 * 非线程安全：一个写出器同一时刻只能由一个线程驱动。
 */
public class ResultWriter {

    private final FilterPredicate filter;
    private final Set<JobFlag> jobFlags;
    private final int maxLines;
    private final LineObserver observer;

    private Transport transport;
    private boolean aborted;
    private boolean capReached;
    private int linesWritten;

    public ResultWriter(FilterPredicate filter, Set<JobFlag> jobFlags, int maxLines, LineObserver observer) {
        this.filter = Objects.requireNonNull(filter, "filter 不能为空");
        this.jobFlags = jobFlags.isEmpty() ? EnumSet.noneOf(JobFlag.class) : EnumSet.copyOf(jobFlags);
        this.maxLines = maxLines;
        this.observer = observer == null ? LineObserver.NONE : observer;
    }

    /**
     * 绑定传输通道，开始一次新的执行；关闭返回的 {@link Binding} 即解除绑定。
     * <p>
     * 每次绑定都会重置中止状态与计数，解除绑定后这些状态仍可读取。
     *
     * @throws IllegalStateException 已经绑定了其他通道（不支持并发执行）
     */
    public Binding bind(Transport transport) {
        Objects.requireNonNull(transport, "transport 不能为空");
        if (this.transport != null) {
            throw new IllegalStateException("结果写出器已绑定传输通道，不支持并发执行同一个作业");
        }
        this.transport = transport;
        this.aborted = false;
        this.capReached = false;
        this.linesWritten = 0;
        return new Binding();
    }

    public boolean write(String text, WriteOption... options) {
        return writeFiltered(text, text, options);
    }

    /**
     * 用 {@code filterKey} 做过滤判断，通过后写出 {@code text}。
     * <p>
     * 用于输出文本与过滤依据不同的场景，例如输出相对路径、但按注册路径过滤。
     */
    public boolean writeFiltered(String filterKey, String text, WriteOption... options) {
        boolean unfiltered = has(options, WriteOption.UNFILTERED) || jobFlags.contains(JobFlag.WRITE_UNFILTERED);
        if (!unfiltered && !filter.accept(filterKey)) {
            return true;
        }
        boolean quote = (jobFlags.contains(JobFlag.QUOTE_OUTPUT) || has(options, WriteOption.QUOTE))
                && !has(options, WriteOption.DONT_QUOTE);
        return writeRaw(quote ? quote(text) : text, options);
    }

    /**
     * 不经过滤与加引号，直接写出。
     *
     * @throws IllegalStateException 当前没有绑定传输通道（只能在作业执行期间调用）
     */
    public boolean writeRaw(String text, WriteOption... options) {
        if (transport == null) {
            throw new IllegalStateException("未绑定传输通道：只能在作业执行期间写出结果");
        }
        if (aborted) {
            return false;
        }
        if (!has(options, WriteOption.IGNORE_MAX)) {
            if (maxLines != QueryRequest.UNLIMITED && linesWritten >= maxLines) {
                capReached = true;
                return false;
            }
            ++linesWritten;
        }
        if (!jobFlags.contains(JobFlag.QUIET)) {
            observer.lineWritten(text);
        }
        if (!transport.write(text)) {
            abort();
            return false;
        }
        return true;
    }

    /**
     * 加双引号，并把内部的 {@code "} 转义为 {@code \"}；其他字符保持不变。
     */
    public static String quote(String text) {
        StringBuilder sb = new StringBuilder(text.length() * 2 + 2);
        sb.append('"');
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            if (c == '"') {
                sb.append('\\');
            }
            sb.append(c);
        }
        sb.append('"');
        return sb.toString();
    }

    public void abort() {
        aborted = true;
    }

    public boolean isAborted() {
        return aborted;
    }

    /**
     * 本次执行中是否因为达到条数上限而拒绝过写出。
     */
    public boolean isCapReached() {
        return capReached;
    }

    public int linesWritten() {
        return linesWritten;
    }

    public int maxLines() {
        return maxLines;
    }

    public boolean isBound() {
        return transport != null;
    }

    private static boolean has(WriteOption[] options, WriteOption option) {
        for (WriteOption o : options) {
            if (o == option) {
                return true;
            }
        }
        return false;
    }

    /**
     * 一次执行期间的通道绑定；close 后写出器不再持有通道引用。
     */
    public final class Binding implements AutoCloseable {

        private Binding() {
        }

        @Override
        public void close() {
            transport = null;
        }
    }
}
