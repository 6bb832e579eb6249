package com.tripplanner.pojo.dto;

import lombok.Builder;
import lombok.Value;

import java.time.LocalDate;
import java.time.temporal.ChronoUnit;
import java.util.Locale;

/**
 * 上游数据源的查询条件：地点、日期区间、人数、币种与返回数量上限。
 */
@Value
@Builder(toBuilder = true)
public class ProviderQuery {

    String origin;

    String destination;

    LocalDate startDate;

    LocalDate endDate;

    int travelers;

    String currency;

    int limit;

    public static ProviderQuery from(TripRequest request, int limit) {
        return ProviderQuery.builder()
                .origin(request.getOrigin())
                .destination(request.getDestination())
                .startDate(request.getStartDate())
                .endDate(request.getEndDate())
                .travelers(request.getTravelers())
                .currency(request.currency())
                .limit(limit)
                .build();
    }

    public int nights() {
        return (int) Math.max(1, ChronoUnit.DAYS.between(startDate, endDate));
    }

    /**
     * 归一化后的缓存键片段：大小写与首尾空白不影响命中。
     */
    public String normalizedKey() {
        return String.join("|",
                normalize(origin),
                normalize(destination),
                String.valueOf(startDate),
                String.valueOf(endDate),
                String.valueOf(travelers),
                normalize(currency),
                String.valueOf(limit));
    }

    private static String normalize(String s) {
        return s == null ? "" : s.trim().toLowerCase(Locale.ROOT).replaceAll("\\s+", " ");
    }
}
