package com.tripplanner.server.utils;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.tripplanner.common.properties.AiProperties;
import com.tripplanner.server.metrics.MetricsRecorder;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.TimeUnit;

/**
 * 行程叙述的文本生成通道：把叙述提示词发给 OpenAI 兼容的 Chat Completion 接口，取回第一条回复。
 * <p>叙述是尽力而为的：配置缺失、超时、非 2xx、回复为空都只返回 null，
 * 由 {@link com.tripplanner.server.narration.NarrationBridge} 走模板兜底。
 * 429/5xx/超时按 {@code tripplanner.ai.max-retries} 重试，被中断时立即放弃。</p>
 */
@Component
@Slf4j
public class AiClient {

    private final AiProperties aiProperties;
    private final ObjectMapper objectMapper;
    private final HttpClient aiHttpClient;
    private final MetricsRecorder metricsRecorder;

    public AiClient(AiProperties aiProperties,
                    ObjectMapper objectMapper,
                    @Qualifier("aiHttpClient") HttpClient aiHttpClient,
                    MetricsRecorder metricsRecorder) {
        this.aiProperties = aiProperties;
        this.objectMapper = objectMapper;
        this.aiHttpClient = aiHttpClient;
        this.metricsRecorder = metricsRecorder;
    }

    /**
     * 生成一段叙述回复。
     *
     * @param systemPrompt 叙述风格与输出格式约束
     * @param userPrompt   结构化行程摘要
     * @param jsonMode     true 时要求模型只输出 JSON 对象（response_format=json_object）
     * @return 去掉首尾空白的回复内容；失败时为 null
     */
    public String chat(String systemPrompt, String userPrompt, boolean jsonMode) {
        String model = aiProperties.getModel();
        if (!StringUtils.hasText(aiProperties.getBaseUrl())
                || !StringUtils.hasText(aiProperties.getApiKey())
                || !StringUtils.hasText(model)) {
            log.warn("AI 配置不完整，跳过叙述生成调用");
            metricsRecorder.recordAiChatCall("skipped", "config_missing", model);
            return null;
        }

        long startNs = System.nanoTime();
        int promptBytes = safeBytes(systemPrompt) + safeBytes(userPrompt);
        int attempts = 0;
        try {
            int maxRetries = Math.max(0, aiProperties.getMaxRetries());
            int maxAttempts = 1 + maxRetries;
            for (int i = 1; i <= maxAttempts; i++) {
                attempts = i;
                AiHttpResult r = doHttpCall(systemPrompt, userPrompt, jsonMode);
                if (r.success) {
                    long latencyMs = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startNs);
                    metricsRecorder.recordAiChatLatencyMs(latencyMs, "success", model);
                    metricsRecorder.recordAiChatCall("success", "ok", model);
                    log.info("叙述生成成功: model={}, latencyMs={}, attempts={}, promptBytes={}, respBytes={}",
                            model, latencyMs, attempts, promptBytes, r.responseBytes);
                    return r.content;
                }

                boolean retriable = isRetriable(r.statusCode, r.errorType);
                if (!retriable || i == maxAttempts) {
                    long latencyMs = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startNs);
                    metricsRecorder.recordAiChatLatencyMs(latencyMs, "fail", model);
                    metricsRecorder.recordAiChatCall("fail", r.errorType, model);
                    log.warn("叙述生成失败: model={}, latencyMs={}, attempts={}, statusCode={}, errorType={}, promptBytes={}, respBytes={}",
                            model, latencyMs, attempts, r.statusCode, r.errorType, promptBytes, r.responseBytes);
                    return null;
                }
                if (Thread.currentThread().isInterrupted()) {
                    return null;
                }
            }
            return null;
        } catch (Exception e) {
            metricsRecorder.recordAiChatCall("fail", "exception", model);
            log.error("调用外部 LLM 生成叙述失败", e);
            return null;
        }
    }

    private AiHttpResult doHttpCall(String systemPrompt, String userPrompt, boolean jsonMode) {
        try {
            Map<String, Object> body = new HashMap<>();
            body.put("model", aiProperties.getModel());
            body.put("temperature", aiProperties.getTemperature());

            Map<String, String> sysMsg = new HashMap<>();
            sysMsg.put("role", "system");
            sysMsg.put("content", systemPrompt);

            Map<String, String> userMsg = new HashMap<>();
            userMsg.put("role", "user");
            userMsg.put("content", userPrompt);

            body.put("messages", List.of(sysMsg, userMsg));
            if (jsonMode) {
                body.put("response_format", Map.of("type", "json_object"));
            }
            String json = objectMapper.writeValueAsString(body);

            HttpRequest request = HttpRequest.newBuilder()
                    .uri(URI.create(aiProperties.getBaseUrl()))
                    .timeout(Duration.ofMillis(Math.max(1, aiProperties.getRequestTimeoutMs())))
                    .header("Content-Type", "application/json")
                    .header("Authorization", "Bearer " + aiProperties.getApiKey())
                    .POST(HttpRequest.BodyPublishers.ofString(json))
                    .build();

            HttpResponse<String> response = aiHttpClient.send(request, HttpResponse.BodyHandlers.ofString());
            int code = response.statusCode();
            String respBody = response.body();
            int respBytes = safeBytes(respBody);

            if (code / 100 != 2 || !StringUtils.hasText(respBody)) {
                return AiHttpResult.fail(code, "http_" + code, respBytes);
            }

            JsonNode root = objectMapper.readTree(respBody);
            JsonNode choices = root.get("choices");
            if (choices == null || !choices.isArray() || choices.isEmpty()) {
                return AiHttpResult.fail(code, "bad_response_no_choices", respBytes);
            }
            JsonNode message = choices.get(0).get("message");
            if (message == null) {
                return AiHttpResult.fail(code, "bad_response_no_message", respBytes);
            }
            JsonNode content = message.get("content");
            if (content == null || !StringUtils.hasText(content.asText())) {
                return AiHttpResult.fail(code, "bad_response_empty_content", respBytes);
            }
            return AiHttpResult.ok(content.asText().trim(), respBytes);
        } catch (java.net.http.HttpTimeoutException te) {
            return AiHttpResult.fail(0, "timeout", 0);
        } catch (InterruptedException ie) {
            // 叙述被取消或超时：保留中断标记，交给上层走兜底
            Thread.currentThread().interrupt();
            return AiHttpResult.fail(0, "interrupted", 0);
        } catch (Exception e) {
            return AiHttpResult.fail(0, "exception", 0);
        }
    }

    private boolean isRetriable(int statusCode, String errorType) {
        if ("interrupted".equals(errorType)) {
            return false;
        }
        if ("timeout".equals(errorType)) {
            return true;
        }
        if (statusCode == 429) {
            return true;
        }
        return statusCode / 100 == 5;
    }

    private int safeBytes(String s) {
        if (!StringUtils.hasText(s)) {
            return 0;
        }
        return s.getBytes(StandardCharsets.UTF_8).length;
    }

    private static class AiHttpResult {
        private final boolean success;
        private final String content;
        private final int statusCode;
        private final String errorType;
        private final int responseBytes;

        private AiHttpResult(boolean success, String content, int statusCode, String errorType, int responseBytes) {
            this.success = success;
            this.content = content;
            this.statusCode = statusCode;
            this.errorType = errorType;
            this.responseBytes = responseBytes;
        }

        static AiHttpResult ok(String content, int responseBytes) {
            return new AiHttpResult(true, content, 200, "ok", responseBytes);
        }

        static AiHttpResult fail(int statusCode, String errorType, int responseBytes) {
            return new AiHttpResult(false, null, statusCode, errorType, responseBytes);
        }
    }
}
