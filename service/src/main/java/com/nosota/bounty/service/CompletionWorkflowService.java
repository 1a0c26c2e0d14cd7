package com.nosota.bounty.service;

import com.nosota.bounty.api.model.BountyStatus;
import com.nosota.bounty.api.model.CallerIdentity;
import com.nosota.bounty.api.model.DisputeStatus;
import com.nosota.bounty.api.model.LifecycleErrorKind;
import com.nosota.bounty.api.model.SubmissionStatus;
import com.nosota.bounty.error.BountyLifecycleException;
import com.nosota.bounty.model.Bounty;
import com.nosota.bounty.model.CompletionSubmission;
import com.nosota.bounty.notification.LifecycleEvent;
import com.nosota.bounty.notification.LifecycleEventType;
import com.nosota.bounty.repository.BountyRepository;
import com.nosota.bounty.repository.CompletionSubmissionRepository;
import com.nosota.bounty.repository.DisputeRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Hunter submissions and their review state.
 *
 * <p>Owns every write to {@link CompletionSubmission}. Review decisions that change the bounty
 * (approval, revision) are driven by {@link BountyLifecycleService}, which calls back into the
 * {@code approve}/{@code markRevisionRequested} methods here.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class CompletionWorkflowService {

    private final BountyRepository bountyRepository;
    private final CompletionSubmissionRepository submissionRepository;
    private final DisputeRepository disputeRepository;
    private final ApplicationEventPublisher eventPublisher;

    /**
     * Records the accepted hunter's claim that the work is done.
     *
     * @throws BountyLifecycleException NOT_ACCEPTED_HUNTER, BOUNTY_NOT_IN_PROGRESS, SUBMISSION_ALREADY_PENDING,
     *                                  DISPUTE_OPEN, EMAIL_NOT_VERIFIED, BOUNTY_NOT_FOUND
     */
    @Transactional
    public CompletionSubmission submit(CallerIdentity caller, UUID bountyId, String message, List<String> proofItems) {
        CallerGuards.requireVerifiedEmail(caller);

        Bounty bounty = bountyRepository.findByIdForUpdate(bountyId)
                .orElseThrow(() -> new BountyLifecycleException(LifecycleErrorKind.BOUNTY_NOT_FOUND,
                        "Bounty not found: " + bountyId));
        if (!CallerGuards.isAcceptedHunter(bounty, caller)) {
            throw new BountyLifecycleException(LifecycleErrorKind.NOT_ACCEPTED_HUNTER,
                    String.format("Caller is not the accepted hunter: bountyId=%s, callerId=%s", bountyId, caller.userId()));
        }
        if (bounty.getStatus() != BountyStatus.IN_PROGRESS) {
            throw new BountyLifecycleException(LifecycleErrorKind.BOUNTY_NOT_IN_PROGRESS,
                    String.format("Bounty not in progress: bountyId=%s, status=%s", bountyId, bounty.getStatus()));
        }
        if (disputeRepository.existsByBountyIdAndStatus(bountyId, DisputeStatus.OPEN)) {
            throw new BountyLifecycleException(LifecycleErrorKind.DISPUTE_OPEN, "Dispute open: bountyId=" + bountyId);
        }
        if (findPending(bountyId).isPresent()) {
            throw new BountyLifecycleException(LifecycleErrorKind.SUBMISSION_ALREADY_PENDING,
                    "Submission already pending: bountyId=" + bountyId);
        }

        CompletionSubmission submission = new CompletionSubmission();
        submission.setBountyId(bountyId);
        submission.setHunterId(caller.userId());
        submission.setMessage(message);
        submission.setProofItems(proofItems == null ? new ArrayList<>() : new ArrayList<>(proofItems));
        submission.setStatus(SubmissionStatus.PENDING);
        submission.setSubmittedAt(LocalDateTime.now());
        submissionRepository.save(submission);

        log.info("Submission received: bountyId={}, submissionId={}, hunterId={}, proofItems={}",
                bountyId, submission.getId(), caller.userId(), submission.getProofItems().size());
        eventPublisher.publishEvent(LifecycleEvent.of(LifecycleEventType.SUBMISSION_RECEIVED,
                bountyId, bounty.getPosterId(), submission.getId()));
        return submission;
    }

    @Transactional(readOnly = true)
    public List<CompletionSubmission> listForBounty(UUID bountyId) {
        return submissionRepository.findByBountyIdOrderBySubmittedAtAsc(bountyId);
    }

    public Optional<CompletionSubmission> findPending(UUID bountyId) {
        return submissionRepository.findFirstByBountyIdAndStatus(bountyId, SubmissionStatus.PENDING);
    }

    /**
     * @throws BountyLifecycleException NO_PENDING_SUBMISSION
     */
    public CompletionSubmission requirePending(UUID bountyId) {
        return findPending(bountyId)
                .orElseThrow(() -> new BountyLifecycleException(LifecycleErrorKind.NO_PENDING_SUBMISSION,
                        "No pending submission: bountyId=" + bountyId));
    }

    /**
     * @return how many of the hunter's submissions on the bounty were sent back
     */
    public long countRevisions(UUID bountyId, UUID hunterId) {
        return submissionRepository.countByBountyIdAndHunterIdAndStatus(bountyId, hunterId,
                SubmissionStatus.REVISION_REQUESTED);
    }

    public void approve(CompletionSubmission submission) {
        submission.setStatus(SubmissionStatus.APPROVED);
        submission.setReviewedAt(LocalDateTime.now());
        submissionRepository.save(submission);
    }

    public void markRevisionRequested(CompletionSubmission submission, String feedback) {
        submission.setStatus(SubmissionStatus.REVISION_REQUESTED);
        submission.setReviewFeedback(feedback);
        submission.setReviewedAt(LocalDateTime.now());
        submissionRepository.save(submission);
    }

    /**
     * Sends back a removed hunter's pending submission so the next hunter can submit.
     *
     * @return number of submissions affected (0 or 1)
     */
    public int supersedeForRemovedHunter(UUID bountyId, UUID hunterId) {
        List<CompletionSubmission> pending = submissionRepository.findByBountyIdAndHunterIdAndStatus(
                bountyId, hunterId, SubmissionStatus.PENDING);
        pending.forEach(submission -> markRevisionRequested(submission, "Hunter account removed"));
        return pending.size();
    }
}
