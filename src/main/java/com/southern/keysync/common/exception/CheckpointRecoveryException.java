package com.southern.keysync.common.exception;

public class CheckpointRecoveryException extends ReconciliationException {

    private static final long serialVersionUID = 1L;

    public CheckpointRecoveryException(String message) {
        super(message);
    }
}
