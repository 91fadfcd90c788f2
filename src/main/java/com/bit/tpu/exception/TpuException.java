package com.bit.tpu.exception;

/**
 * TPU 客户端统一异常：携带错误类型，便于调用方分类处理
 */
public class TpuException extends RuntimeException {

    private final ErrorType errorType;

    public TpuException(ErrorType errorType, String message) {
        super("[" + errorType.getDesc() + "]：" + message);
        this.errorType = errorType;
    }

    public TpuException(ErrorType errorType, String message, Throwable cause) {
        super("[" + errorType.getDesc() + "]：" + message, cause);
        this.errorType = errorType;
    }

    public ErrorType getErrorType() {
        return errorType;
    }
}
