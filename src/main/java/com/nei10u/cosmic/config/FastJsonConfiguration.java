package com.nei10u.cosmic.config;

import com.alibaba.fastjson2.JSONWriter;
import com.alibaba.fastjson2.support.config.FastJsonConfig;
import com.alibaba.fastjson2.support.spring6.http.converter.FastJsonHttpMessageConverter;
import org.springframework.boot.autoconfigure.http.HttpMessageConverters;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.MediaType;

import java.util.List;

/**
 * fastjson2 作为 HTTP JSON 序列化器。
 * <p>
 * 枚举按 toString 输出展示名（如 "Aries"、"Manifesting Generator"），空字段照常输出 null。
 * 时间类型用 fastjson2 默认的 ISO 格式，generatedAt 需要保留时区信息。
 */
@Configuration
public class FastJsonConfiguration {

    static FastJsonConfig fastJsonConfig() {
        FastJsonConfig config = new FastJsonConfig();
        config.setWriterFeatures(
                JSONWriter.Feature.WriteMapNullValue,
                JSONWriter.Feature.PrettyFormat,
                JSONWriter.Feature.WriteEnumUsingToString
        );
        return config;
    }

    public static FastJsonHttpMessageConverter fastJsonConverter() {
        FastJsonHttpMessageConverter converter = new FastJsonHttpMessageConverter();
        converter.setFastJsonConfig(fastJsonConfig());
        converter.setSupportedMediaTypes(List.of(
                MediaType.APPLICATION_JSON,
                new MediaType("application", "*+json")
        ));
        return converter;
    }

    @Bean
    public HttpMessageConverters fastJsonHttpMessageConverters() {
        // fastjson2 排在默认转换器之前；String 与 ProblemDetail 仍走默认转换器
        return new HttpMessageConverters(fastJsonConverter());
    }
}
