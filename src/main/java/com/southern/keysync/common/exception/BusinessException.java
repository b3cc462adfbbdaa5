package com.southern.keysync.common.exception;

/**
 * 业务异常，接口参数或状态不合法时抛出，由 GlobalExceptionHandler 统一返回
 */
public class BusinessException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    public BusinessException(String message) {
        super(message);
    }

    public BusinessException(String message, Throwable cause) {
        super(message, cause);
    }
}
