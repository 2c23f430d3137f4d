package dev.autoapply.service;

import org.springframework.http.HttpStatus;

/**
 * A worker callback was refused before any state was read or written.
 */
public class CallbackRejectedException extends RuntimeException {

    private final HttpStatus status;

    public CallbackRejectedException(HttpStatus status, String message) {
        super(message);
        this.status = status;
    }

    public static CallbackRejectedException unauthorized() {
        return new CallbackRejectedException(HttpStatus.UNAUTHORIZED, "Unauthorized");
    }

    public static CallbackRejectedException malformed(String message) {
        return new CallbackRejectedException(HttpStatus.BAD_REQUEST, message);
    }

    public HttpStatus getStatus() {
        return status;
    }
}
