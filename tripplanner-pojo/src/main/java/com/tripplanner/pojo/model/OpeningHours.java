package com.tripplanner.pojo.model;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.time.LocalTime;

/**
 * 单日营业时间窗口，close 必须晚于 open（不支持跨午夜）。
 */
@Value
@Builder
@Jacksonized
public class OpeningHours {

    LocalTime open;

    LocalTime close;

    public static OpeningHours of(LocalTime open, LocalTime close) {
        if (open == null || close == null || !close.isAfter(open)) {
            throw new IllegalArgumentException("invalid opening hours: " + open + "-" + close);
        }
        return new OpeningHours(open, close);
    }

    /**
     * [start, end] 是否完整落在营业时间内。
     */
    public boolean covers(LocalTime start, LocalTime end) {
        return !start.isBefore(open) && !end.isAfter(close);
    }
}
