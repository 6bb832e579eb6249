package com.tripplanner.common.exception;

import com.tripplanner.common.result.ErrorCode;

/**
 * 规划流水线中的致命错误。
 * <p>由各阶段抛出，编排器统一捕获后转换为失败的规划结果，不会返回半成品行程。</p>
 */
public class PlanningException extends BaseException {

    private final ErrorCode errorCode;

    public PlanningException(ErrorCode errorCode, String message) {
        super(errorCode, message);
        this.errorCode = errorCode;
    }

    public ErrorCode getErrorCode() {
        return errorCode;
    }

    public static PlanningException of(ErrorCode errorCode, String format, Object... args) {
        return new PlanningException(errorCode, String.format(format, args));
    }
}
