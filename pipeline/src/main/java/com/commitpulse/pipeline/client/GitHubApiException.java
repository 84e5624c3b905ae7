package com.commitpulse.pipeline.client;

import java.io.IOException;

/**
 * Base class for failures reported by the GitHub API itself, as opposed to
 * transport failures which surface as plain {@link IOException}.
 */
public class GitHubApiException extends IOException {

    public GitHubApiException(String message) {
        super(message);
    }
}
