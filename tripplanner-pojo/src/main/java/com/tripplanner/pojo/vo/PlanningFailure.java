package com.tripplanner.pojo.vo;

import com.tripplanner.common.result.ErrorCode;
import com.tripplanner.pojo.enums.PlanStage;
import lombok.Value;

/**
 * 规划失败的类型化结果，由调用方负责面向用户的提示文案。
 */
@Value
public class PlanningFailure {

    ErrorCode code;

    String message;

    /** 失败发生的阶段 */
    PlanStage stage;
}
