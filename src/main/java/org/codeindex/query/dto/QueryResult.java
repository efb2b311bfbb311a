package org.codeindex.query.dto;

import java.util.List;

/**
 * 一次查询的返回结果。
 * <p>
 * 设计目标：
 * <ul>
 *   <li>返回“按写出顺序排列的结果行”，与流式输出看到的内容一致。</li>
 *   <li>通过 {@code capReached}/{@code aborted} 告知调用方结果是否完整，以便缩小范围后重试。</li>
 * </ul>
 *
 * @param lines        结果行（按写出顺序）
 * @param linesWritten 计入条数上限的行数
 * @param maxResults   本次实际使用的最大结果条数（已应用上限保护）
 * @param capReached   是否因达到 maxResults 而提前停止
 * @param aborted      是否因超过传输字节上限而中止
 * @param exitCode     作业返回码：0 成功，1 中止
 * @param warnings     非致命告警
 */
public record QueryResult(
        List<String> lines,
        int linesWritten,
        int maxResults,
        boolean capReached,
        boolean aborted,
        int exitCode,
        List<String> warnings
) {
}
