package com.commitpulse.pipeline.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Data transfer object representing a GitHub commit.
 * Maps from the nested GitHub API response: /repos/{owner}/{repo}/commits
 *
 * <p>{@code author} and {@code committer} at the top level are the linked platform
 * accounts and are {@code null} when the git identity is not linked to one.</p>
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record Commit(
        @JsonProperty("sha") String sha,
        @JsonProperty("commit") CommitDetail commit,
        @JsonProperty("author") GitHubUser author,
        @JsonProperty("committer") GitHubUser committer
) {

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record CommitDetail(
            @JsonProperty("message") String message,
            @JsonProperty("author") GitSignature author,
            @JsonProperty("committer") GitSignature committer
    ) {}

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record GitSignature(
            @JsonProperty("name") String name,
            @JsonProperty("email") String email,
            @JsonProperty("date") String date
    ) {}

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record GitHubUser(
            @JsonProperty("login") String login,
            @JsonProperty("id") long id
    ) {}
}
