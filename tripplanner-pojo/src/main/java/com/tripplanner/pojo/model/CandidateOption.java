package com.tripplanner.pojo.model;

import com.tripplanner.pojo.enums.Category;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.List;

/**
 * 数据源归一化后的候选项。
 * <p>price 是整个出行团体的总价（航班含所有乘客、住宿含所有晚数、活动与餐饮按人数折算）。
 * location/openingHours 对航班为空。</p>
 */
@Value
@Builder(toBuilder = true)
@Jacksonized
public class CandidateOption {

    Category category;

    /** 数据源名称，例如 amadeus */
    String provider;

    /** 数据源给出的报价/地点 ID */
    String providerId;

    String name;

    Money price;

    GeoPoint location;

    OpeningHours openingHours;

    /** 预计耗时（分钟），未知时为 null */
    Integer durationMinutes;

    @Singular
    List<String> tags;

    /** 数据源质量分，归一化到 [0, 1] */
    double qualityScore;

    /**
     * 同一真实报价的去重键：品类 + 数据源 ID。
     */
    public String dedupKey() {
        return category.getKey() + ":" + providerId;
    }
}
