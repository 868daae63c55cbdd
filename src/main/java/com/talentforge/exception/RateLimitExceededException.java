package com.talentforge.exception;

import lombok.Getter;

@Getter
public class RateLimitExceededException extends RuntimeException {

    private final long limit;
    private final long retryAfterSeconds;

    public RateLimitExceededException(long limit, long retryAfterSeconds) {
        super("Too many requests. Please try again later.");
        this.limit = limit;
        this.retryAfterSeconds = retryAfterSeconds;
    }
}
