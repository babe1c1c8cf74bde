package com.github.anirbanmu.classcal.calendar;

public class CalendarSinkException extends RuntimeException {
    private final int statusCode;

    public CalendarSinkException(String message) {
        this(message, -1, null);
    }

    public CalendarSinkException(String message, Throwable cause) {
        this(message, -1, cause);
    }

    public CalendarSinkException(String message, int statusCode, Throwable cause) {
        super(statusCode > 0 ? message + " (status " + statusCode + ")" : message, cause);
        this.statusCode = statusCode;
    }

    // -1 when the failure did not come from an http response
    public int statusCode() {
        return statusCode;
    }
}
