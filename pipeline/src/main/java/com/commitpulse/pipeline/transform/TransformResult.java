package com.commitpulse.pipeline.transform;

import com.commitpulse.pipeline.model.Identity;

import java.util.List;

/**
 * Output of the transform stage. Identities are listed in first-seen order,
 * commits in input order.
 */
public record TransformResult(
        List<Identity> identities,
        List<CommitRecord> commits,
        int skipped
) {}
