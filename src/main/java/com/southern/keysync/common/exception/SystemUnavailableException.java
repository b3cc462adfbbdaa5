package com.southern.keysync.common.exception;

/**
 * 系统数据不可用：权威系统缺失、文件缺失（策略为 fail）或不允许部分处理
 */
public class SystemUnavailableException extends ReconciliationException {

    private static final long serialVersionUID = 1L;

    public SystemUnavailableException(String message) {
        super(message);
    }
}
