package com.talentforge.exception;

public class CallbackAccessDeniedException extends RuntimeException {

    public CallbackAccessDeniedException(String message) {
        super(message);
    }
}
