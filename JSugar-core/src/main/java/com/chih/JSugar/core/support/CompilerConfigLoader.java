package com.chih.JSugar.core.support;

import com.chih.JSugar.core.domain.CompilerConfig;
import com.chih.JSugar.core.exception.JSugarException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Locale;

/**
 * 编译器配置加载器
 * <p>
 * 支持 YAML（.yaml/.yml）和 JSON（.json）文件以及 classpath 资源。
 * 加载后统一调用 {@link CompilerConfig#validate()}。
 * </p>
 *
 * @author lizhiyuan
 * @since 2026/01/12
 */
public class CompilerConfigLoader {

    private static final Logger log = LoggerFactory.getLogger(CompilerConfigLoader.class);

    public static final String DEFAULT_RESOURCE = "jsugar-default.yaml";

    private final ObjectMapper yamlMapper = JSugarObjectMapperFactory.createYamlMapper();
    private final ObjectMapper jsonMapper = JSugarObjectMapperFactory.createJsonMapper();

    /**
     * 加载 classpath 上的默认配置，资源不存在时退回内置默认值
     */
    public CompilerConfig loadDefault() {
        return loadResource(DEFAULT_RESOURCE);
    }

    public CompilerConfig loadResource(String resource) {
        ClassLoader classLoader = Thread.currentThread().getContextClassLoader();
        if (classLoader == null) {
            classLoader = CompilerConfigLoader.class.getClassLoader();
        }

        try (InputStream in = classLoader.getResourceAsStream(resource)) {
            if (in == null) {
                log.debug("Config resource {} not found, using built-in defaults", resource);
                return validated(new CompilerConfig(), resource);
            }
            CompilerConfig config = mapperFor(resource).readValue(in, CompilerConfig.class);
            return validated(config != null ? config : new CompilerConfig(), resource);
        } catch (IOException e) {
            throw new JSugarException("Failed to read compiler config resource: " + resource, e);
        }
    }

    public CompilerConfig load(Path path) {
        if (!Files.isRegularFile(path)) {
            throw new JSugarException("Compiler config file not found: " + path);
        }

        try (InputStream in = Files.newInputStream(path)) {
            CompilerConfig config = mapperFor(path.getFileName().toString()).readValue(in, CompilerConfig.class);
            return validated(config != null ? config : new CompilerConfig(), path.toString());
        } catch (IOException e) {
            throw new JSugarException("Failed to read compiler config: " + path, e);
        }
    }

    private CompilerConfig validated(CompilerConfig config, String source) {
        try {
            config.validate();
        } catch (IllegalArgumentException e) {
            throw new JSugarException("Invalid compiler config " + source + ": " + e.getMessage(), e);
        }
        log.debug("Loaded compiler config from {}: {}", source, config);
        return config;
    }

    private ObjectMapper mapperFor(String name) {
        return name.toLowerCase(Locale.ROOT).endsWith(".json") ? jsonMapper : yamlMapper;
    }
}
