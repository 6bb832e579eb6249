package com.tripplanner.server.provider;

import com.fasterxml.jackson.databind.JsonNode;
import lombok.extern.slf4j.Slf4j;

import java.math.BigDecimal;
import java.time.LocalTime;
import java.time.format.DateTimeParseException;

/**
 * 归一化器的公共解析工具：宽松读取字段，单条数据异常只跳过该条。
 */
@Slf4j
public abstract class AbstractPayloadNormalizer implements PayloadNormalizer {

    protected JsonNode requireArray(JsonNode payload, String field, String provider) throws UpstreamCallException {
        JsonNode arr = payload == null ? null : payload.get(field);
        if (arr == null || !arr.isArray()) {
            throw UpstreamCallException.malformed(provider + " 报文缺少数组字段 " + field);
        }
        return arr;
    }

    protected String text(JsonNode node, String field) {
        if (node == null) {
            return null;
        }
        JsonNode v = node.get(field);
        if (v == null || v.isNull()) {
            return null;
        }
        String s = v.asText();
        return s.isBlank() ? null : s.trim();
    }

    /**
     * 金额既可能是字符串（"512.30"）也可能是数字。
     */
    protected BigDecimal decimal(JsonNode node, String field) {
        String s = text(node, field);
        if (s == null) {
            return null;
        }
        try {
            return new BigDecimal(s);
        } catch (NumberFormatException e) {
            log.debug("无法解析金额字段 {}={}", field, s);
            return null;
        }
    }

    protected Double number(JsonNode node, String field) {
        if (node == null) {
            return null;
        }
        JsonNode v = node.get(field);
        if (v == null || v.isNull()) {
            return null;
        }
        if (v.isNumber()) {
            return v.asDouble();
        }
        try {
            return Double.parseDouble(v.asText().trim());
        } catch (NumberFormatException e) {
            return null;
        }
    }

    /**
     * 支持 "0930" 与 "09:30" 两种写法。
     */
    protected LocalTime time(String raw) {
        if (raw == null) {
            return null;
        }
        String s = raw.trim();
        if (s.length() == 4 && s.chars().allMatch(Character::isDigit)) {
            s = s.substring(0, 2) + ":" + s.substring(2);
        }
        try {
            return LocalTime.parse(s);
        } catch (DateTimeParseException e) {
            return null;
        }
    }

    protected double clampScore(double score) {
        if (Double.isNaN(score)) {
            return 0.0;
        }
        return Math.max(0.0, Math.min(1.0, score));
    }
}
