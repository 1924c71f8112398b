package com.chih.JSugar.core.spi;

/**
 * 监控指标 SPI 接口
 */
public interface CompileMetrics {

    /**
     * 记录一次模板编译
     *
     * @param templatePath 模板路径
     * @param durationNs   耗时 (纳秒)
     * @param success      是否成功
     */
    void recordCompile(String templatePath, long durationNs, boolean success);
}
