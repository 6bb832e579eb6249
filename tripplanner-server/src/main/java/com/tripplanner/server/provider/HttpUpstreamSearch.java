package com.tripplanner.server.provider;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.tripplanner.common.properties.ProviderProperties;
import com.tripplanner.pojo.dto.ProviderQuery;
import com.tripplanner.pojo.enums.Category;
import lombok.extern.slf4j.Slf4j;
import org.springframework.util.StringUtils;

import java.io.IOException;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * 基于 JDK HttpClient 的上游搜索：GET + query string，Bearer 鉴权，JSON 响应。
 *
 * 说明：单次调用只负责一次 HTTP 往返，重试与退避由 {@link ProviderAdapter} 统一处理。
 */
@Slf4j
public class HttpUpstreamSearch implements UpstreamSearch {

    private final String name;
    private final ProviderProperties.Endpoint endpoint;
    private final Set<Category> categories;
    private final HttpClient httpClient;
    private final ObjectMapper objectMapper;

    public HttpUpstreamSearch(ProviderProperties.Endpoint endpoint,
                              Set<Category> categories,
                              HttpClient httpClient,
                              ObjectMapper objectMapper) {
        this.name = StringUtils.hasText(endpoint.getName()) ? endpoint.getName() : "unknown";
        this.endpoint = endpoint;
        this.categories = EnumSet.copyOf(categories);
        this.httpClient = httpClient;
        this.objectMapper = objectMapper;
    }

    @Override
    public String name() {
        return name;
    }

    @Override
    public boolean supports(Category category) {
        return categories.contains(category);
    }

    @Override
    public JsonNode search(Category category, ProviderQuery query, Duration timeout) throws UpstreamCallException {
        if (!StringUtils.hasText(endpoint.getBaseUrl())) {
            throw new UpstreamCallException("config_missing", 0, name + " 未配置 baseUrl", false);
        }
        URI uri = URI.create(endpoint.getBaseUrl() + "?" + queryString(category, query));
        HttpRequest.Builder builder = HttpRequest.newBuilder()
                .uri(uri)
                .timeout(timeout)
                .header("Accept", "application/json")
                .GET();
        if (StringUtils.hasText(endpoint.getApiKey())) {
            builder.header("Authorization", "Bearer " + endpoint.getApiKey());
        }

        HttpResponse<String> response;
        try {
            response = httpClient.send(builder.build(), HttpResponse.BodyHandlers.ofString());
        } catch (HttpTimeoutException e) {
            throw new UpstreamCallException("timeout", name + " 请求超时", e);
        } catch (IOException e) {
            throw new UpstreamCallException("io", name + " 请求失败: " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new UpstreamCallException("interrupted", 0, name + " 请求被中断", false);
        }

        int code = response.statusCode();
        String body = response.body();
        if (code / 100 != 2) {
            throw new UpstreamCallException("http_" + code, code, name + " 返回非成功状态 " + code, true);
        }
        if (!StringUtils.hasText(body)) {
            throw UpstreamCallException.malformed(name + " 返回空报文");
        }
        try {
            return objectMapper.readTree(body);
        } catch (IOException e) {
            throw UpstreamCallException.malformed(name + " 返回非 JSON 报文");
        }
    }

    private String queryString(Category category, ProviderQuery query) {
        Map<String, String> params = new LinkedHashMap<>();
        params.put("category", category.getKey());
        if (StringUtils.hasText(query.getOrigin())) {
            params.put("origin", query.getOrigin());
        }
        params.put("destination", query.getDestination());
        params.put("startDate", String.valueOf(query.getStartDate()));
        params.put("endDate", String.valueOf(query.getEndDate()));
        params.put("travelers", String.valueOf(query.getTravelers()));
        params.put("currency", query.getCurrency());
        params.put("limit", String.valueOf(query.getLimit()));
        return params.entrySet().stream()
                .map(e -> encode(e.getKey()) + "=" + encode(e.getValue()))
                .collect(Collectors.joining("&"));
    }

    private static String encode(String s) {
        return URLEncoder.encode(s == null ? "" : s, StandardCharsets.UTF_8);
    }
}
