package com.orderschedule.exception;

import lombok.Getter;

@Getter
public abstract class OrderScheduleException extends RuntimeException {
    private final String errorCode;
    protected OrderScheduleException(String errorCode, String message) {
        super(message);
        this.errorCode = errorCode;
    }
    protected OrderScheduleException(String errorCode, String message, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
    }
}
