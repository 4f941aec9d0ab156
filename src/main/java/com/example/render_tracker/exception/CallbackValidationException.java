package com.example.render_tracker.exception;

import org.springframework.http.HttpStatus;

public class CallbackValidationException extends ApiErrorException {
    public CallbackValidationException(String message) {
        super(HttpStatus.BAD_REQUEST, message);
    }
}
