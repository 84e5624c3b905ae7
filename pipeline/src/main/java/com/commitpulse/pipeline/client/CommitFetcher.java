package com.commitpulse.pipeline.client;

import com.commitpulse.pipeline.model.Commit;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Walks the commit listing of one repository page by page.
 *
 * <p>Each call starts a fresh traversal at page 1 and stops at the first empty
 * page. Pages are concatenated in the order the API returns them (newest
 * first). Any failure aborts the whole traversal; no partial list is returned.</p>
 */
public class CommitFetcher {

    private static final Logger logger = LoggerFactory.getLogger(CommitFetcher.class);

    static final int PER_PAGE = 100;

    private static final TypeReference<List<Commit>> COMMIT_PAGE = new TypeReference<>() {};

    private final GitHubApiClient client;
    private final ObjectMapper objectMapper;

    public CommitFetcher(GitHubApiClient client) {
        this.client = client;
        this.objectMapper = new ObjectMapper()
                .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
    }

    /**
     * Fetches every commit of a repository authored since the given instant.
     * Endpoint: GET /repos/{owner}/{repo}/commits?since={iso}&amp;per_page=100&amp;page={n}
     *
     * @param repoFullName the full repository name (owner/repo)
     * @param since        lower bound passed to the API as an ISO-8601 timestamp
     * @return all commits in API order
     */
    public List<Commit> fetchCommits(String repoFullName, Instant since)
            throws IOException, InterruptedException {
        String path = "repos/" + repoFullName + "/commits";
        String sinceParam = since.truncatedTo(ChronoUnit.SECONDS).toString();

        List<Commit> allCommits = new ArrayList<>();
        int page = 1;

        while (true) {
            Map<String, String> params = new LinkedHashMap<>();
            params.put("since", sinceParam);
            params.put("per_page", String.valueOf(PER_PAGE));
            params.put("page", String.valueOf(page));

            JsonNode body = client.fetch(path, params);
            List<Commit> commits = readPage(body, page);
            if (commits.isEmpty()) {
                break;
            }

            allCommits.addAll(commits);
            logger.debug("Fetched page {} with {} commits for {}", page, commits.size(), repoFullName);
            page++;
        }

        logger.info("Fetched {} commits for {} across {} pages since {}",
                allCommits.size(), repoFullName, page - 1, sinceParam);
        return allCommits;
    }

    private List<Commit> readPage(JsonNode body, int page) throws IOException {
        if (body == null || body.isNull()) {
            return List.of();
        }
        if (!body.isArray()) {
            throw new IOException("Expected a JSON array for commit page " + page
                    + " but got " + body.getNodeType());
        }
        return objectMapper.convertValue(body, COMMIT_PAGE);
    }
}
