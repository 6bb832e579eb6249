package com.tripplanner.server.provider;

/**
 * 上游数据源调用失败：超时、非 2xx、报文格式错误、IO 异常等。
 * 只在 Provider Adapter 内部流转，不会越过适配器边界。
 */
public class UpstreamCallException extends Exception {

    private final String errorType;
    private final int statusCode;
    private final boolean retriable;

    public UpstreamCallException(String errorType, int statusCode, String message, boolean retriable) {
        super(message);
        this.errorType = errorType;
        this.statusCode = statusCode;
        this.retriable = retriable;
    }

    public UpstreamCallException(String errorType, String message, Throwable cause) {
        super(message, cause);
        this.errorType = errorType;
        this.statusCode = 0;
        this.retriable = true;
    }

    public static UpstreamCallException malformed(String message) {
        return new UpstreamCallException("malformed_payload", 0, message, true);
    }

    public String getErrorType() {
        return errorType;
    }

    public int getStatusCode() {
        return statusCode;
    }

    public boolean isRetriable() {
        return retriable;
    }
}
