package com.orderschedule.exception;

public class DemandFileException extends OrderScheduleException {
    public DemandFileException(String message) {
        super("DEMAND_FILE_ERROR", message);
    }
    public DemandFileException(String message, Throwable cause) {
        super("DEMAND_FILE_ERROR", message, cause);
    }
}
