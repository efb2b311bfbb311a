package org.codeindex.query.dto;

/**
 * {@code index_status} 的返回结果。
 *
 * @param sourceRoot   工程根目录（快照未提供时为 null）
 * @param files        已注册文件数
 * @param symbols      符号记录数
 * @param snapshotFile 启动时加载的快照文件（未配置时为 null）
 */
public record IndexStatusResult(String sourceRoot, int files, int symbols, String snapshotFile) {
}
