package org.codeindex.query;

/**
 * 作业级选项：由服务端决定，而不是由查询请求决定。
 */
public enum JobFlag {
    /** 全局跳过过滤。 */
    WRITE_UNFILTERED,
    /** 输出加双引号，并把内部的 {@code "} 转义为 {@code \"}。 */
    QUOTE_OUTPUT,
    /** 不记录逐行输出日志。 */
    QUIET
}
