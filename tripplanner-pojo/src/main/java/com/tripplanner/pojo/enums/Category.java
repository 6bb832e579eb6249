package com.tripplanner.pojo.enums;

/**
 * 预算与候选项的品类。MEAL 即预算拆分中的“餐饮”。
 */
public enum Category {

    FLIGHT("flight"),
    LODGING("lodging"),
    ACTIVITY("activity"),
    MEAL("meal");

    private final String key;

    Category(String key) {
        this.key = key;
    }

    public String getKey() {
        return key;
    }

    /**
     * 交通与住宿是组成有效行程的核心品类，缺失即规划失败。
     */
    public boolean isCore() {
        return this == FLIGHT || this == LODGING;
    }

    /**
     * 按时段排入日程的品类。
     */
    public boolean isPerSlot() {
        return this == ACTIVITY || this == MEAL;
    }
}
