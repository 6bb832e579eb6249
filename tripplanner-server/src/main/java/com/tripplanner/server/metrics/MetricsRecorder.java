package com.tripplanner.server.metrics;

import io.micrometer.core.instrument.MeterRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.concurrent.TimeUnit;

/**
 * 统一的业务指标记录器。
 *
 * 说明：
 * - 使用 Micrometer 的 MeterRegistry 记录 Counter / Timer；
 * - 指标记录失败只打 debug 日志，绝不影响规划流程；
 * - 指标命名参考「组件.业务.动作」，便于在监控面板上按模块聚合。
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class MetricsRecorder {

    private final MeterRegistry meterRegistry;

    /**
     * 记录候选项缓存的命中/未命中情况。
     *
     * @param category 品类 key，例如 flight
     * @param hit      true 表示命中缓存，false 表示回源上游
     */
    public void recordCandidateCacheHit(String category, boolean hit) {
        try {
            String outcome = hit ? "hit" : "miss";
            meterRegistry.counter("tripplanner.candidate.cache",
                    "category", safe(category),
                    "outcome", outcome).increment();
        } catch (Exception e) {
            log.debug("记录缓存命中指标失败: {}", e.getMessage());
        }
    }

    /**
     * 记录一次“搭车”：未命中缓存，但等到了其他请求进行中的回源结果。
     */
    public void recordCandidateCacheShared(String category) {
        try {
            meterRegistry.counter("tripplanner.candidate.cache",
                    "category", safe(category),
                    "outcome", "shared").increment();
        } catch (Exception e) {
            log.debug("记录缓存共享指标失败: {}", e.getMessage());
        }
    }

    /**
     * 记录一次上游数据源调用的最终结果（成功/失败）及尝试次数。
     */
    public void recordProviderCall(String category, String outcome, String reason, int attempts) {
        try {
            meterRegistry.counter("tripplanner.provider.call",
                    "category", safe(category),
                    "outcome", safe(outcome),
                    "reason", safe(reason)).increment();
            meterRegistry.summary("tripplanner.provider.attempts", "category", safe(category))
                    .record(attempts);
        } catch (Exception e) {
            log.debug("记录数据源调用指标失败: {}", e.getMessage());
        }
    }

    /**
     * 记录 AI Chat 调用结果（成功/失败/跳过）。
     */
    public void recordAiChatCall(String outcome, String reason, String model) {
        try {
            meterRegistry.counter("tripplanner.ai.chat.call",
                    "outcome", safe(outcome),
                    "reason", safe(reason),
                    "model", safe(model)).increment();
        } catch (Exception e) {
            log.debug("记录 AI 调用指标失败: {}", e.getMessage());
        }
    }

    /**
     * 记录 AI Chat 调用耗时。
     */
    public void recordAiChatLatencyMs(long latencyMs, String outcome, String model) {
        try {
            meterRegistry.timer("tripplanner.ai.chat.latency",
                    "outcome", safe(outcome),
                    "model", safe(model))
                    .record(latencyMs, TimeUnit.MILLISECONDS);
        } catch (Exception e) {
            log.debug("记录 AI 耗时指标失败: {}", e.getMessage());
        }
    }

    /**
     * 记录叙述结果来源：ai / partial_fallback / fallback。
     */
    public void recordNarration(String source, String reason) {
        try {
            meterRegistry.counter("tripplanner.narration",
                    "source", safe(source),
                    "reason", safe(reason)).increment();
        } catch (Exception e) {
            log.debug("记录叙述指标失败: {}", e.getMessage());
        }
    }

    /**
     * 记录一次规划的结果与耗时。
     */
    public void recordPlanningOutcome(String status, String code, long latencyMs) {
        try {
            meterRegistry.counter("tripplanner.planning.outcome",
                    "status", safe(status),
                    "code", safe(code)).increment();
            meterRegistry.timer("tripplanner.planning.latency", "status", safe(status))
                    .record(latencyMs, TimeUnit.MILLISECONDS);
        } catch (Exception e) {
            log.debug("记录规划结果指标失败: {}", e.getMessage());
        }
    }

    private String safe(String s) {
        if (s == null || s.isBlank()) {
            return "unknown";
        }
        // tag 不宜过长，避免高基数/卡面板
        return s.length() > 32 ? s.substring(0, 32) : s;
    }
}
