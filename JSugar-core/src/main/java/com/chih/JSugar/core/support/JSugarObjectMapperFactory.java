package com.chih.JSugar.core.support;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;

/**
 * 编译器配置使用的 ObjectMapper 工厂
 * <p>
 * YAML 与 JSON 两种格式共用同一套配置策略：
 * </p>
 * <ul>
 *   <li>FAIL_ON_UNKNOWN_PROPERTIES: false - 容忍未知字段，新旧版本配置文件可以互相读取</li>
 *   <li>FAIL_ON_EMPTY_BEANS: false - 空对象序列化不报错</li>
 * </ul>
 *
 * @author lizhiyuan
 * @since 2026/01/12
 */
public class JSugarObjectMapperFactory {

    /**
     * 创建用于 YAML 解析的 ObjectMapper
     *
     * @return 配置好的 YAML ObjectMapper，线程安全可重用
     */
    public static ObjectMapper createYamlMapper() {
        return configure(new ObjectMapper(new YAMLFactory()));
    }

    /**
     * 创建用于 JSON 解析的 ObjectMapper，与 YAML 映射器保持一致的配置
     */
    public static ObjectMapper createJsonMapper() {
        return configure(new ObjectMapper());
    }

    private static ObjectMapper configure(ObjectMapper mapper) {
        /* 反序列化配置：遇到未知属性时不抛出异常 */
        mapper.configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);

        mapper.configure(SerializationFeature.FAIL_ON_EMPTY_BEANS, false);
        return mapper;
    }
}
