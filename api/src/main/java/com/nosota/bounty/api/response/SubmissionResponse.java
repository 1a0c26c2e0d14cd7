package com.nosota.bounty.api.response;

import com.nosota.bounty.api.model.SubmissionStatus;

import java.time.LocalDateTime;
import java.util.List;
import java.util.UUID;

/**
 * @param proofItems     Attachment references in submission order
 * @param reviewFeedback Poster's revision feedback, null unless REVISION_REQUESTED
 */
public record SubmissionResponse(
        UUID id,
        UUID bountyId,
        UUID hunterId,
        String message,
        List<String> proofItems,
        SubmissionStatus status,
        String reviewFeedback,
        LocalDateTime submittedAt,
        LocalDateTime reviewedAt
) {
}
