package com.commitpulse.pipeline.client;

/**
 * Thrown when the API kept signalling rate limiting after every allowed retry.
 * A fresh run may succeed once the quota window has reset.
 */
public class RateLimitExceededException extends GitHubApiException {

    private final int attempts;

    public RateLimitExceededException(String url, int attempts) {
        super("Rate limit still exceeded for " + url + " after " + attempts + " attempts");
        this.attempts = attempts;
    }

    public int getAttempts() {
        return attempts;
    }
}
