package org.codeindex.query;

/**
 * 单次写出的选项。
 */
public enum WriteOption {
    /** 本次写出跳过过滤。 */
    UNFILTERED,
    /** 本次写出不检查、也不占用结果条数上限。 */
    IGNORE_MAX,
    /** 本次写出不加引号（调用方已自行格式化）。 */
    DONT_QUOTE,
    /** 本次写出强制加引号（即使作业未开启 {@link JobFlag#QUOTE_OUTPUT}）。 */
    QUOTE
}
