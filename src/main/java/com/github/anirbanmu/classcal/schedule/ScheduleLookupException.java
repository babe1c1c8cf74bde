package com.github.anirbanmu.classcal.schedule;

// raised when a raw value has no entry in a source table or a mandatory field is missing
public class ScheduleLookupException extends RuntimeException {
    public ScheduleLookupException(String message) {
        super(message);
    }

    public ScheduleLookupException(String message, Throwable cause) {
        super(message, cause);
    }
}
