package com.tripplanner.server.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.tripplanner.common.properties.ProviderProperties;
import com.tripplanner.pojo.enums.Category;
import com.tripplanner.server.provider.HttpUpstreamSearch;
import com.tripplanner.server.provider.UpstreamSearch;
import lombok.RequiredArgsConstructor;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.net.http.HttpClient;
import java.util.EnumSet;

/**
 * 三个上游能力：航班搜索、住宿搜索、景点/餐厅搜索。
 * 地址与密钥由外部配置层提供（tripplanner.provider.*）。
 */
@Configuration
@RequiredArgsConstructor
public class ProviderClientConfig {

    private final ProviderProperties providerProperties;
    private final ObjectMapper objectMapper;

    @Bean
    public UpstreamSearch flightSearch(@Qualifier("providerHttpClient") HttpClient providerHttpClient) {
        return new HttpUpstreamSearch(providerProperties.getFlight(),
                EnumSet.of(Category.FLIGHT), providerHttpClient, objectMapper);
    }

    @Bean
    public UpstreamSearch lodgingSearch(@Qualifier("providerHttpClient") HttpClient providerHttpClient) {
        return new HttpUpstreamSearch(providerProperties.getLodging(),
                EnumSet.of(Category.LODGING), providerHttpClient, objectMapper);
    }

    @Bean
    public UpstreamSearch poiSearch(@Qualifier("providerHttpClient") HttpClient providerHttpClient) {
        return new HttpUpstreamSearch(providerProperties.getPoi(),
                EnumSet.of(Category.ACTIVITY, Category.MEAL), providerHttpClient, objectMapper);
    }
}
