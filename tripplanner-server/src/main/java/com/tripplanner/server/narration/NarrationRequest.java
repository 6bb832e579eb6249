package com.tripplanner.server.narration;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.time.LocalDate;
import java.util.List;

/**
 * 交给文本生成能力的结构化行程摘要。只包含展示所需的字段，不含价格以外的数据源细节。
 */
@Value
@Builder
public class NarrationRequest {

    String origin;

    String destination;

    LocalDate startDate;

    LocalDate endDate;

    int travelers;

    /** 风格/兴趣提示 */
    @Singular
    List<String> interests;

    String flight;

    String lodging;

    String totalCost;

    @Singular
    List<DaySummary> days;

    @Value
    public static class DaySummary {

        int dayIndex;

        LocalDate date;

        boolean unplanned;

        /** 形如 "09:30-12:00 Visit: Louvre" */
        List<String> lines;
    }
}
