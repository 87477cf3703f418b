package com.example.residency_scheduler.exception;

public class ScheduleEngineException extends RuntimeException {

    private final String errorCode;
    private final Object[] parameters;

    public ScheduleEngineException(String message) {
        super(message);
        this.errorCode = "SCHEDULE_ENGINE_ERROR";
        this.parameters = new Object[0];
    }

    public ScheduleEngineException(String errorCode, String message, Object... parameters) {
        super(message);
        this.errorCode = errorCode;
        this.parameters = parameters;
    }

    public ScheduleEngineException(String errorCode, String message, Throwable cause, Object... parameters) {
        super(message, cause);
        this.errorCode = errorCode;
        this.parameters = parameters;
    }

    public String getErrorCode() {
        return errorCode;
    }

    public Object[] getParameters() {
        return parameters;
    }
}
