package com.github.anirbanmu.classcal.source;

public class InvalidSelectionException extends IllegalArgumentException {
    public InvalidSelectionException(String message) {
        super(message);
    }
}
