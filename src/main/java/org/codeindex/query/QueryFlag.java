package org.codeindex.query;

/**
 * 查询级选项（随查询请求传入，在一次查询的生命周期内不可变）。
 */
public enum QueryFlag {
    /** 不记录逐行输出日志（会给作业打上 {@link JobFlag#QUIET}）。 */
    SILENT,
    /** 路径过滤按正则匹配（默认按字面前缀匹配）。 */
    MATCH_REGEX,
    /** 过滤掉系统头文件路径。 */
    FILTER_SYSTEM_INCLUDES,
    /** 附加所在函数：{@code \tfunction: <symbolName>}。 */
    CONTAINING_FUNCTION,
    /** 附加符号种类拼写。 */
    CURSOR_KIND,
    /** 附加展示名。 */
    DISPLAY_NAME,
    /** 位置 key 使用相对 sourceRoot 的路径。 */
    RELATIVE_PATH
}
