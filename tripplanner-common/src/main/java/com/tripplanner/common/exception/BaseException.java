package com.tripplanner.common.exception;

import com.tripplanner.common.result.ErrorCode;

/**
 * 统一的业务异常类型。
 * <p>用于表示“业务规则不通过”等预期内错误，而不是系统级故障。</p>
 */
public class BaseException extends RuntimeException {

    /**
     * 业务错误码
     */
    private final Integer code;

    public BaseException(ErrorCode errorCode) {
        super(errorCode.getMsg());
        this.code = errorCode.getCode();
    }

    public BaseException(ErrorCode errorCode, String message) {
        super(message);
        this.code = errorCode.getCode();
    }

    public Integer getCode() {
        return code;
    }
}
