package org.codeindex.config;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.util.unit.DataSize;
import org.springframework.validation.annotation.Validated;

import java.util.List;

/**
 * 代码索引查询服务的业务配置（{@code app.index.*}）。
 * <p>
 * 重点：
 * <ul>
 *   <li>通过 {@link #snapshotFile} 指定启动时加载的符号索引快照；未配置时索引为空。</li>
 *   <li>通过 {@link #defaultMaxResults}/{@link #maxResultsLimit} 与 {@link #transportMaxBytes} 控制返回体积。</li>
 *   <li>通过 {@link #systemPathPrefixes} 定义“系统头文件”路径，供 filterSystemIncludes 使用。</li>
 * </ul>
 */
@Validated
@ConfigurationProperties(prefix = "app.index")
public class CodeIndexProperties {

    /**
     * 符号索引快照文件（JSON）。为空表示不加载，索引为空。
     */
    private String snapshotFile;

    /**
     * 查询默认最大结果条数（工具调用未指定 maxResults 时使用）。
     */
    @Min(1)
    @Max(1_000_000)
    private int defaultMaxResults = 200;

    /**
     * 查询允许的最大结果条数（上限保护）。
     */
    @Min(1)
    @Max(1_000_000)
    private int maxResultsLimit = 5_000;

    /**
     * 单次查询结果的最大字节数。
     * <p>
     * 超过后视为传输失败：作业进入中止状态，已写出的结果照常返回。
     */
    @NotNull
    private DataSize transportMaxBytes = DataSize.ofMegabytes(1);

    /**
     * 系统头文件路径前缀（区分大小写）。
     */
    @NotNull
    private List<String> systemPathPrefixes = List.of("/usr/", "/System/", "/Library/", "/opt/local/");

    /**
     * 是否记录逐行输出日志（默认 false：所有作业以 QUIET 方式运行）。
     */
    private boolean logOutput = false;

    /**
     * 默认是否给输出加双引号（工具调用可覆盖）。
     */
    private boolean quoteOutput = false;

    public String getSnapshotFile() {
        return snapshotFile;
    }

    public void setSnapshotFile(String snapshotFile) {
        this.snapshotFile = snapshotFile;
    }

    public int getDefaultMaxResults() {
        return defaultMaxResults;
    }

    public void setDefaultMaxResults(int defaultMaxResults) {
        this.defaultMaxResults = defaultMaxResults;
    }

    public int getMaxResultsLimit() {
        return maxResultsLimit;
    }

    public void setMaxResultsLimit(int maxResultsLimit) {
        this.maxResultsLimit = maxResultsLimit;
    }

    public DataSize getTransportMaxBytes() {
        return transportMaxBytes;
    }

    public void setTransportMaxBytes(DataSize transportMaxBytes) {
        this.transportMaxBytes = transportMaxBytes;
    }

    public List<String> getSystemPathPrefixes() {
        return systemPathPrefixes;
    }

    public void setSystemPathPrefixes(List<String> systemPathPrefixes) {
        this.systemPathPrefixes = systemPathPrefixes;
    }

    public boolean isLogOutput() {
        return logOutput;
    }

    public void setLogOutput(boolean logOutput) {
        this.logOutput = logOutput;
    }

    public boolean isQuoteOutput() {
        return quoteOutput;
    }

    public void setQuoteOutput(boolean quoteOutput) {
        this.quoteOutput = quoteOutput;
    }
}
