package com.tripplanner.server.utils;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.tripplanner.server.metrics.MetricsRecorder;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

import java.util.Collection;
import java.util.concurrent.Callable;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;

/**
 * 进程级候选项缓存：Redis 存储 + 进程内单飞回源。
 *
 * 说明：
 * - 值以 JSON 形式写入 Redis，TTL 到期自动清理；
 * - 同一个 key 未命中时只允许一次回源，并发请求者等待同一次回源结果（single-flight）；
 * - 回源失败不写缓存，回源结束（成功/失败/取消）时一定释放进行中的占位；
 * - 回源方被中断时只撤销占位，不让其他规划的等待者拿到这次中断；
 * - Redis 不可用时按未命中处理，只打 warn 日志。
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class CacheClient {

    private final StringRedisTemplate stringRedisTemplate;
    private final ObjectMapper objectMapper;
    private final MetricsRecorder metricsRecorder;

    /**
     * 进行中的回源：key -> 唯一的一次加载。
     */
    private final ConcurrentMap<String, CompletableFuture<Object>> inFlight = new ConcurrentHashMap<>();

    public void set(String key, Object value, long time, TimeUnit unit) {
        try {
            String json = objectMapper.writeValueAsString(value);
            stringRedisTemplate.opsForValue().set(key, json, time, unit);
        } catch (JsonProcessingException e) {
            log.error("序列化缓存对象失败, key={}", key, e);
        } catch (RuntimeException e) {
            log.warn("写入缓存失败, key={}: {}", key, e.getMessage());
        }
    }

    /**
     * 读取缓存；未命中、反序列化失败或 Redis 不可用时返回 null。
     */
    public <R> R get(String key, TypeReference<R> type) {
        String json;
        try {
            json = stringRedisTemplate.opsForValue().get(key);
        } catch (RuntimeException e) {
            log.warn("读取缓存失败，按未命中处理, key={}: {}", key, e.getMessage());
            return null;
        }
        if (!StringUtils.hasText(json)) {
            return null;
        }
        try {
            return objectMapper.readValue(json, type);
        } catch (Exception e) {
            log.error("反序列化缓存失败, key={}", key, e);
            return null;
        }
    }

    public void evict(String key) {
        try {
            stringRedisTemplate.delete(key);
        } catch (RuntimeException e) {
            log.warn("删除缓存失败, key={}: {}", key, e.getMessage());
        }
    }

    /**
     * 缓存命中直接返回；未命中时同一 key 只回源一次，其余并发请求者等待这一次的结果。
     * <p>回源方因自身被中断（规划取消或拉取超时）而放弃时，不把中断结果交给等待者：
     * 占位被撤销，等待者重新竞争回源。</p>
     *
     * @param key          缓存 key
     * @param metricTag    指标 tag（品类）
     * @param type         反序列化类型
     * @param loader       回源逻辑
     * @param time         成功结果的 TTL
     * @param unit         TTL 单位
     * @param emptyTtlMinutes 空集合结果的 TTL（分钟），防止反复回源
     * @throws ExecutionException   回源失败，cause 为 loader 抛出的异常
     * @throws InterruptedException 当前线程在等待或回源时被中断
     */
    @SuppressWarnings("unchecked")
    public <R> R queryWithSingleFlight(String key, String metricTag, TypeReference<R> type,
                                       Callable<R> loader, long time, TimeUnit unit,
                                       long emptyTtlMinutes)
            throws ExecutionException, InterruptedException {
        while (true) {
            R cached = get(key, type);
            if (cached != null) {
                metricsRecorder.recordCandidateCacheHit(metricTag, true);
                return cached;
            }

            CompletableFuture<Object> mine = new CompletableFuture<>();
            CompletableFuture<Object> pending = inFlight.putIfAbsent(key, mine);
            if (pending == null) {
                return load(key, metricTag, type, loader, time, unit, emptyTtlMinutes, mine);
            }

            // 已有回源在进行，等待其结果即可，不再重复打上游
            log.debug("等待进行中的回源, key={}", key);
            try {
                R shared = (R) pending.get();
                metricsRecorder.recordCandidateCacheShared(metricTag);
                return shared;
            } catch (CancellationException e) {
                log.debug("进行中的回源已被发起方放弃，重新竞争回源, key={}", key);
            }
        }
    }

    private <R> R load(String key, String metricTag, TypeReference<R> type,
                       Callable<R> loader, long time, TimeUnit unit, long emptyTtlMinutes,
                       CompletableFuture<Object> mine)
            throws ExecutionException, InterruptedException {
        try {
            // 双重检查：占位成功前可能已有其他线程写好缓存
            R latest = get(key, type);
            if (latest != null) {
                metricsRecorder.recordCandidateCacheHit(metricTag, true);
                mine.complete(latest);
                return latest;
            }
            metricsRecorder.recordCandidateCacheHit(metricTag, false);
            R fresh = loader.call();
            if (fresh != null) {
                boolean empty = fresh instanceof Collection && ((Collection<?>) fresh).isEmpty();
                if (empty) {
                    set(key, fresh, emptyTtlMinutes, TimeUnit.MINUTES);
                } else {
                    set(key, fresh, time, unit);
                }
            }
            mine.complete(fresh);
            return fresh;
        } catch (Exception e) {
            // 先撤销占位再通知等待者，保证重新竞争时拿不到这个已结束的回源
            inFlight.remove(key, mine);
            if (e instanceof InterruptedException) {
                mine.cancel(false);
                throw (InterruptedException) e;
            }
            if (Thread.currentThread().isInterrupted()) {
                log.debug("回源方被中断，放弃本次回源, key={}", key);
                mine.cancel(false);
            } else {
                mine.completeExceptionally(e);
            }
            throw new ExecutionException(e);
        } finally {
            inFlight.remove(key, mine);
        }
    }

    /**
     * 当前进行中的回源数量，仅用于测试与排查。
     */
    public int inFlightCount() {
        return inFlight.size();
    }
}
