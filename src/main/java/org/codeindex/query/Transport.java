package org.codeindex.query;

/**
 * 结果输出通道（一次查询执行期间由 {@link QueryJob#run(Transport)} 绑定）。
 */
@FunctionalInterface
public interface Transport {

    /**
     * 写出一行结果。
     *
     * @return false 表示通道已永久失败，本次执行不应再写出
     */
    boolean write(String line);
}
