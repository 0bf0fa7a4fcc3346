package com.nei10u.cosmic.config;

import org.springframework.ai.openai.OpenAiChatModel;
import org.springframework.ai.openai.OpenAiChatOptions;
import org.springframework.ai.openai.api.OpenAiApi;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Primary;
import org.springframework.util.StringUtils;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 叙事层走 OpenRouter 的 OpenAI 兼容接口。
 */
@Configuration
public class OpenRouterConfig {

    @Value("${spring.ai.openai.api-key}")
    private String apiKey;

    @Value("${spring.ai.openai.base-url}")
    private String baseUrl;

    @Value("${spring.ai.openai.chat.options.model}")
    private String model;

    @Value("${spring.ai.openai.chat.options.temperature:0.8}")
    private Double temperature;

    @Value("${spring.ai.openai.chat.options.headers.HTTP-Referer:}")
    private String httpReferer;

    @Value("${spring.ai.openai.chat.options.headers.X-Title:}")
    private String xTitle;

    @Bean
    @Primary
    public OpenAiApi openAiApi() {
        // base-url 已带 /api/v1，路径不能再拼 /v1
        return OpenAiApi.builder()
                .baseUrl(baseUrl)
                .apiKey(apiKey)
                .completionsPath("/chat/completions")
                .embeddingsPath("/embeddings")
                .build();
    }

    @Bean
    @Primary
    public OpenAiChatModel openAiChatModel(OpenAiApi openAiApi) {
        OpenAiChatOptions options = OpenAiChatOptions.builder()
                .model(model)
                .temperature(temperature)
                .httpHeaders(headers(httpReferer, xTitle))
                .build();

        return OpenAiChatModel.builder()
                .openAiApi(openAiApi)
                .defaultOptions(options)
                .build();
    }

    static Map<String, String> headers(String referer, String title) {
        Map<String, String> headers = new LinkedHashMap<>();
        if (StringUtils.hasText(referer)) {
            headers.put("HTTP-Referer", referer);
        }
        if (StringUtils.hasText(title)) {
            headers.put("X-Title", title);
        }
        return headers;
    }
}
