package com.chih.JSugar.core.impl;

import com.chih.JSugar.core.spi.CompileMetrics;

public class NoOpCompileMetrics implements CompileMetrics {
    @Override
    public void recordCompile(String templatePath, long durationNs, boolean success) {
        // Do nothing
    }
}
