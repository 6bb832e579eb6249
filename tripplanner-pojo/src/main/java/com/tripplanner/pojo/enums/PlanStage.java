package com.tripplanner.pojo.enums;

/**
 * 规划流水线的阶段，也是编排器状态机的状态。
 */
public enum PlanStage {
    VALIDATE_REQUEST,
    ALLOCATE_BUDGET,
    FETCH_CANDIDATES,
    SELECT_CANDIDATES,
    SCHEDULE_DAYS,
    ASSEMBLE,
    NARRATE,
    DONE,
    ERROR
}
