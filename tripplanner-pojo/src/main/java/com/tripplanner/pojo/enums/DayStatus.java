package com.tripplanner.pojo.enums;

/**
 * 单日排布状态：EMPTY -> FILLING -> FULL | PARTIAL。
 * PARTIAL 的一天对外标记为“未规划”。
 */
public enum DayStatus {
    EMPTY,
    FILLING,
    FULL,
    PARTIAL
}
