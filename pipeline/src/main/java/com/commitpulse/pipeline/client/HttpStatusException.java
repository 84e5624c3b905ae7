package com.commitpulse.pipeline.client;

/**
 * Non-2xx response that is not a rate-limit signal.
 */
public class HttpStatusException extends GitHubApiException {

    private final int status;
    private final String body;

    public HttpStatusException(String url, int status, String body) {
        super("GitHub API error: " + status + " for " + url);
        this.status = status;
        this.body = body;
    }

    public int getStatus() {
        return status;
    }

    public String getBody() {
        return body;
    }
}
