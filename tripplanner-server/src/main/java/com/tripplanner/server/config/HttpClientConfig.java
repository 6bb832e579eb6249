package com.tripplanner.server.config;

import com.tripplanner.common.properties.AiProperties;
import com.tripplanner.common.properties.ProviderProperties;
import lombok.RequiredArgsConstructor;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.net.http.HttpClient;
import java.time.Duration;

/**
 * HTTP 客户端配置：
 * - 使用 JDK 17 自带 HttpClient（连接复用 + 低依赖）
 * - AI 与旅行数据源各用一个实例，连接超时分别由 AiProperties / ProviderProperties 控制
 */
@Configuration
@RequiredArgsConstructor
public class HttpClientConfig {

    private final AiProperties aiProperties;
    private final ProviderProperties providerProperties;

    @Bean
    public HttpClient aiHttpClient() {
        return HttpClient.newBuilder()
                .connectTimeout(Duration.ofMillis(aiProperties.getConnectTimeoutMs()))
                .version(HttpClient.Version.HTTP_1_1)
                .build();
    }

    @Bean
    public HttpClient providerHttpClient() {
        return HttpClient.newBuilder()
                .connectTimeout(Duration.ofMillis(providerProperties.getConnectTimeoutMs()))
                .version(HttpClient.Version.HTTP_1_1)
                .followRedirects(HttpClient.Redirect.NORMAL)
                .build();
    }
}
