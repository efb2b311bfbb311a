package org.codeindex.query;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * 逐行输出观察者：写出的每一行在发往传输通道前都会回调一次（静默作业除外）。
 * <p>
 * 生产环境使用 {@link #logging()} 记录日志；测试中可以替换为记录型实现。
 */
@FunctionalInterface
public interface LineObserver {

    LineObserver NONE = line -> {
    };

    void lineWritten(String line);

    static LineObserver logging() {
        Logger log = LoggerFactory.getLogger("org.codeindex.query.output");
        return line -> log.info("=> {}", line);
    }
}
