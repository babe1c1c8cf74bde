package com.github.anirbanmu.classcal.source;

// login or logout failed, or was attempted in the wrong state
public class AuthenticationException extends RuntimeException {
    public AuthenticationException(String message) {
        super(message);
    }

    public AuthenticationException(String message, Throwable cause) {
        super(message, cause);
    }
}
