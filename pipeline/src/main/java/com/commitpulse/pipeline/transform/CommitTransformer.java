package com.commitpulse.pipeline.transform;

import com.commitpulse.pipeline.model.Commit;
import com.commitpulse.pipeline.model.Identity;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Converts raw API commits into normalized identities and commit records.
 *
 * <p>Authors and committers share one identity space keyed by
 * {@link Identity#stableKey()}. The first signature seen for a key wins; later
 * signatures with the same key but a different name or email are folded into it.
 * Commits without a sha or a parseable commit date are skipped.</p>
 *
 * <p>Pure in-memory transformation: no network or storage access.</p>
 */
public class CommitTransformer {

    private static final Logger logger = LoggerFactory.getLogger(CommitTransformer.class);

    public TransformResult transform(List<Commit> rawCommits) {
        Map<String, Identity> identities = new LinkedHashMap<>();
        List<CommitRecord> commits = new ArrayList<>();
        int skipped = 0;

        for (Commit raw : rawCommits) {
            CommitRecord record = toRecord(raw, identities);
            if (record == null) {
                skipped++;
            } else {
                commits.add(record);
            }
        }

        logger.info("Transformed {} raw commits into {} identities and {} commits ({} skipped)",
                rawCommits.size(), identities.size(), commits.size(), skipped);

        return new TransformResult(List.copyOf(identities.values()), commits, skipped);
    }

    private CommitRecord toRecord(Commit raw, Map<String, Identity> identities) {
        if (raw == null || raw.sha() == null || raw.sha().isBlank()) {
            logger.warn("Skipping commit without sha");
            return null;
        }

        Commit.CommitDetail detail = raw.commit();
        Commit.GitSignature gitAuthor = detail != null ? detail.author() : null;
        Commit.GitSignature gitCommitter = detail != null ? detail.committer() : null;

        Instant committedAt = parseDate(gitCommitter, raw.sha());
        if (committedAt == null) {
            logger.warn("Skipping commit {} without a commit date", raw.sha());
            return null;
        }
        Instant authoredAt = parseDate(gitAuthor, raw.sha());

        Identity author = register(identities, raw.author(), gitAuthor);
        Identity committer = register(identities, raw.committer(), gitCommitter);

        return new CommitRecord(
                raw.sha(),
                author.stableKey(),
                committer.stableKey(),
                authoredAt,
                committedAt,
                detail != null ? detail.message() : null);
    }

    /**
     * Resolves the identity for one side of a commit, keeping the first-seen
     * attributes for a key.
     */
    private static Identity register(Map<String, Identity> identities,
                                     Commit.GitHubUser account, Commit.GitSignature signature) {
        Identity candidate = Identity.of(
                account != null ? account.login() : null,
                signature != null ? signature.name() : null,
                signature != null ? signature.email() : null);
        return identities.computeIfAbsent(candidate.stableKey(), key -> candidate);
    }

    private static Instant parseDate(Commit.GitSignature signature, String sha) {
        if (signature == null || signature.date() == null) {
            return null;
        }
        try {
            return OffsetDateTime.parse(signature.date()).toInstant();
        } catch (DateTimeParseException e) {
            logger.warn("Unparseable date '{}' on commit {}", signature.date(), sha);
            return null;
        }
    }
}
