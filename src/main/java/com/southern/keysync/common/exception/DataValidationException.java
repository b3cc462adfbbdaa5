package com.southern.keysync.common.exception;

/**
 * 源文件数据损坏（策略为 fail）或错误数超过上限
 */
public class DataValidationException extends ReconciliationException {

    private static final long serialVersionUID = 1L;

    public DataValidationException(String message) {
        super(message);
    }
}
