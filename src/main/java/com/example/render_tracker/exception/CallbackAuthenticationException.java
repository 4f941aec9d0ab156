package com.example.render_tracker.exception;

import org.springframework.http.HttpStatus;

public class CallbackAuthenticationException extends ApiErrorException {
    public CallbackAuthenticationException() {
        super(HttpStatus.UNAUTHORIZED, "Unauthorized");
    }
}
