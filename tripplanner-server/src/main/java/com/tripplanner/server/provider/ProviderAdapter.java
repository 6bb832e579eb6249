package com.tripplanner.server.provider;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.tripplanner.common.constant.RedisConstants;
import com.tripplanner.common.properties.ProviderProperties;
import com.tripplanner.pojo.dto.ProviderQuery;
import com.tripplanner.pojo.enums.Category;
import com.tripplanner.pojo.model.CandidateOption;
import com.tripplanner.server.metrics.MetricsRecorder;
import com.tripplanner.server.utils.CacheClient;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Provider Adapter：把异构的旅行数据源统一成 {@link CandidateOption} 序列。
 *
 * 职责：
 * - 缓存：按 (品类, 归一化查询条件) 缓存成功结果，命中时不发起网络请求；
 * - 单飞：同一 key 并发未命中只回源一次；
 * - 重试：任何上游失败按指数退避重试，达到次数上限后返回空结果并标记 providerUnavailable；
 * - 去重：同一品类下相同 providerId 只保留第一条。
 *
 * 上游异常绝不越过这一层抛给调用方。
 */
@Component
@Slf4j
public class ProviderAdapter {

    private static final TypeReference<List<CandidateOption>> CANDIDATE_LIST = new TypeReference<>() {
    };

    private final List<UpstreamSearch> searches;
    private final List<PayloadNormalizer> normalizers;
    private final CacheClient cacheClient;
    private final ProviderProperties providerProperties;
    private final MetricsRecorder metricsRecorder;

    public ProviderAdapter(List<UpstreamSearch> searches,
                           List<PayloadNormalizer> normalizers,
                           CacheClient cacheClient,
                           ProviderProperties providerProperties,
                           MetricsRecorder metricsRecorder) {
        this.searches = searches;
        this.normalizers = normalizers;
        this.cacheClient = cacheClient;
        this.providerProperties = providerProperties;
        this.metricsRecorder = metricsRecorder;
    }

    public ProviderFetchResult fetch(Category category, ProviderQuery query) {
        return fetch(category, query, Duration.ofMillis(Math.max(1, providerProperties.getRequestTimeoutMs())));
    }

    /**
     * @param requestTimeout 单次上游请求的超时
     */
    public ProviderFetchResult fetch(Category category, ProviderQuery query, Duration requestTimeout) {
        UpstreamSearch search = findSearch(category);
        PayloadNormalizer normalizer = findNormalizer(category);
        if (search == null || normalizer == null) {
            log.warn("品类没有可用的数据源或归一化器: category={}", category);
            return ProviderFetchResult.unavailable(category, "no_upstream");
        }

        String key = cacheKey(category, query);
        AtomicBoolean loaded = new AtomicBoolean(false);
        try {
            List<CandidateOption> candidates = cacheClient.queryWithSingleFlight(
                    key,
                    category.getKey(),
                    CANDIDATE_LIST,
                    () -> {
                        loaded.set(true);
                        return loadWithRetry(category, query, search, normalizer, requestTimeout);
                    },
                    providerProperties.getCacheTtlMinutes(),
                    TimeUnit.MINUTES,
                    RedisConstants.CACHE_EMPTY_TTL
            );
            return ProviderFetchResult.available(category,
                    candidates == null ? List.of() : candidates, !loaded.get());
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            // 被中断的回源只会把失败交给回源方自己，中断标记已由抛出方保留
            if (cause instanceof UpstreamCallException) {
                return ProviderFetchResult.unavailable(category, ((UpstreamCallException) cause).getErrorType());
            }
            log.error("拉取候选项异常: category={}", category, cause);
            return ProviderFetchResult.unavailable(category, "exception");
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return ProviderFetchResult.unavailable(category, "interrupted");
        }
    }

    /**
     * 删除某个查询条件下的缓存，下次拉取会重新回源。
     */
    public void evict(Category category, ProviderQuery query) {
        cacheClient.evict(cacheKey(category, query));
    }

    String cacheKey(Category category, ProviderQuery query) {
        return RedisConstants.CACHE_CANDIDATE_KEY + category.getKey()
                + RedisConstants.KEY_SEPARATOR + query.normalizedKey();
    }

    private List<CandidateOption> loadWithRetry(Category category,
                                                ProviderQuery query,
                                                UpstreamSearch search,
                                                PayloadNormalizer normalizer,
                                                Duration requestTimeout) throws UpstreamCallException {
        int maxAttempts = Math.max(1, providerProperties.getMaxAttempts());
        long backoffMs = Math.max(0, providerProperties.getInitialBackoffMs());
        UpstreamCallException last = null;
        int attempts = 0;
        for (int i = 1; i <= maxAttempts; i++) {
            attempts = i;
            try {
                JsonNode payload = search.search(category, query, requestTimeout);
                List<CandidateOption> candidates = dedupe(
                        normalizer.normalize(category, search.name(), payload, query), query.getLimit());
                metricsRecorder.recordProviderCall(category.getKey(), "success", "ok", attempts);
                log.info("拉取候选项成功: category={}, provider={}, destination={}, count={}, attempts={}",
                        category, search.name(), query.getDestination(), candidates.size(), attempts);
                return candidates;
            } catch (UpstreamCallException e) {
                last = e;
                log.warn("数据源调用失败: category={}, provider={}, attempt={}/{}, errorType={}, msg={}",
                        category, search.name(), i, maxAttempts, e.getErrorType(), e.getMessage());
                if (!e.isRetriable() || i == maxAttempts) {
                    break;
                }
                sleepBackoff(backoffMs);
                backoffMs = Math.min(providerProperties.getMaxBackoffMs(),
                        (long) (backoffMs * Math.max(1.0, providerProperties.getBackoffMultiplier())));
            }
        }
        metricsRecorder.recordProviderCall(category.getKey(), "fail",
                last == null ? "unknown" : last.getErrorType(), attempts);
        throw last;
    }

    private void sleepBackoff(long backoffMs) throws UpstreamCallException {
        if (backoffMs <= 0) {
            return;
        }
        try {
            Thread.sleep(backoffMs);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new UpstreamCallException("interrupted", 0, "退避等待被中断", false);
        }
    }

    private List<CandidateOption> dedupe(List<CandidateOption> candidates, int limit) {
        Map<String, CandidateOption> unique = new LinkedHashMap<>();
        for (CandidateOption c : candidates) {
            unique.putIfAbsent(c.dedupKey(), c);
        }
        List<CandidateOption> result = new ArrayList<>(unique.values());
        if (limit > 0 && result.size() > limit) {
            return new ArrayList<>(result.subList(0, limit));
        }
        return result;
    }

    private UpstreamSearch findSearch(Category category) {
        return searches.stream().filter(s -> s.supports(category)).findFirst().orElse(null);
    }

    private PayloadNormalizer findNormalizer(Category category) {
        return normalizers.stream().filter(n -> n.supports(category)).findFirst().orElse(null);
    }
}
