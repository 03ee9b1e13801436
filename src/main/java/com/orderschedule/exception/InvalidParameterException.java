package com.orderschedule.exception;

/**
 * Raised before any simulation step when replenishment inputs are unusable:
 * a negative count or rate, or an in-transit quantity without an arrival date.
 */
public class InvalidParameterException extends OrderScheduleException {
    public InvalidParameterException(String message) {
        super("INVALID_PARAMETER", message);
    }
}
