package com.example.servicerota.exception;

public class ScheduleGenerationException extends RuntimeException {

    public static final String DATA_UNAVAILABLE = "DATA_UNAVAILABLE";

    private final String errorCode;

    public ScheduleGenerationException(String errorCode, String message) {
        super(message);
        this.errorCode = errorCode;
    }

    /**
     * No availability table was supplied; generation halts before any date is processed.
     */
    public static ScheduleGenerationException dataUnavailable() {
        return new ScheduleGenerationException(DATA_UNAVAILABLE, "出欠データがありません");
    }

    public String getErrorCode() {
        return errorCode;
    }
}
