package com.nosota.bounty.service;

import com.nosota.bounty.api.model.BountyStatus;
import com.nosota.bounty.api.model.CallerIdentity;
import com.nosota.bounty.api.model.CancellationStatus;
import com.nosota.bounty.api.model.DisputeStatus;
import com.nosota.bounty.api.model.LifecycleErrorKind;
import com.nosota.bounty.api.model.RequestStatus;
import com.nosota.bounty.api.request.CreateBountyRequest;
import com.nosota.bounty.config.BountyProperties;
import com.nosota.bounty.error.BountyLifecycleException;
import com.nosota.bounty.model.Bounty;
import com.nosota.bounty.model.BountyRequest;
import com.nosota.bounty.model.CompletionSubmission;
import com.nosota.bounty.notification.LifecycleEvent;
import com.nosota.bounty.notification.LifecycleEventType;
import com.nosota.bounty.repository.BountyCancellationRepository;
import com.nosota.bounty.repository.BountyRepository;
import com.nosota.bounty.repository.BountyRequestRepository;
import com.nosota.bounty.repository.DisputeRepository;
import com.nosota.bounty.repository.ProfileRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.UUID;

/**
 * The only writer of {@code Bounty.status} and {@code Bounty.acceptedHunterId}.
 *
 * <p>Every mutating operation runs in one transaction that starts by locking the bounty row
 * ({@link BountyRepository#findByIdForUpdate}), checks all preconditions, and only then writes. Escrow movements
 * happen inside the same transaction, so a failed hold, release or refund leaves the bounty unchanged.
 *
 * <p>Happy path:
 * <pre>
 * open ──acceptRequest (hold)──> in_progress ──submit / approveCompletion (release)──> completed
 *                                     │  ^
 *                                     └──┘ requestRevision (bounded by bounty.revision.max-cycles)
 * </pre>
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class BountyLifecycleService {

    private final BountyRepository bountyRepository;
    private final BountyRequestRepository bountyRequestRepository;
    private final DisputeRepository disputeRepository;
    private final BountyCancellationRepository cancellationRepository;
    private final ProfileRepository profileRepository;
    private final BountyRequestService bountyRequestService;
    private final CompletionWorkflowService completionWorkflowService;
    private final EscrowLedgerService escrowLedgerService;
    private final BountyStatusStateMachine stateMachine;
    private final BountyProperties properties;
    private final ApplicationEventPublisher eventPublisher;

    /**
     * Posts a new bounty in status OPEN.
     *
     * @throws BountyLifecycleException INVALID_AMOUNT if the amount is negative, has more than two decimals,
     *                                  or is non-zero on an honor bounty
     */
    @Transactional
    public Bounty open(CallerIdentity caller, CreateBountyRequest details) {
        CallerGuards.requireVerifiedEmail(caller);

        BigDecimal amount = WalletService.normalize(details.amount());
        if (details.isForHonor() && amount.signum() != 0) {
            throw new BountyLifecycleException(LifecycleErrorKind.INVALID_AMOUNT,
                    "Honor bounty with non-zero amount: " + amount);
        }
        if (!profileRepository.existsById(caller.userId())) {
            throw new BountyLifecycleException(LifecycleErrorKind.ACCOUNT_NOT_FOUND,
                    "No profile for userId=" + caller.userId());
        }

        LocalDateTime now = LocalDateTime.now();
        Bounty bounty = new Bounty();
        bounty.setPosterId(caller.userId());
        bounty.setTitle(details.title());
        bounty.setDescription(details.description());
        bounty.setAmount(amount);
        bounty.setForHonor(details.isForHonor());
        bounty.setWorkType(details.workType());
        bounty.setStatus(BountyStatus.OPEN);
        bounty.setCreatedAt(now);
        bounty.setUpdatedAt(now);
        bountyRepository.save(bounty);

        log.info("Bounty opened: bountyId={}, posterId={}, amount={}, forHonor={}",
                bounty.getId(), caller.userId(), amount, bounty.isForHonor());
        return bounty;
    }

    @Transactional(readOnly = true)
    public Bounty getBounty(UUID bountyId) {
        return bountyRepository.findById(bountyId)
                .orElseThrow(() -> new BountyLifecycleException(LifecycleErrorKind.BOUNTY_NOT_FOUND,
                        "Bounty not found: " + bountyId));
    }

    /**
     * Accepts one application: the request becomes ACCEPTED, all sibling pending requests REJECTED,
     * the bounty IN_PROGRESS with the request's hunter, and the reward moves into escrow. All or nothing.
     *
     * @throws BountyLifecycleException BOUNTY_NOT_OPEN (also for the loser of two concurrent acceptances),
     *                                  REQUEST_NOT_PENDING, INSUFFICIENT_BALANCE, NOT_BOUNTY_POSTER
     */
    @Transactional
    public Bounty acceptRequest(CallerIdentity caller, UUID bountyId, UUID requestId) {
        CallerGuards.requireVerifiedEmail(caller);

        Bounty bounty = lockBounty(bountyId);
        CallerGuards.requirePoster(bounty, caller);
        if (bounty.getStatus() != BountyStatus.OPEN) {
            throw new BountyLifecycleException(LifecycleErrorKind.BOUNTY_NOT_OPEN,
                    String.format("Bounty not open: bountyId=%s, status=%s", bountyId, bounty.getStatus()));
        }
        BountyRequest request = bountyRequestService.requireRequestOf(bountyId, requestId);
        if (request.getStatus() != RequestStatus.PENDING || request.getHunterId() == null) {
            throw new BountyLifecycleException(LifecycleErrorKind.REQUEST_NOT_PENDING,
                    String.format("Request not pending: requestId=%s, status=%s", requestId, request.getStatus()));
        }
        stateMachine.validateTransition(bounty.getStatus(), BountyStatus.IN_PROGRESS);

        escrowLedgerService.hold(bounty);

        LocalDateTime now = LocalDateTime.now();
        request.setStatus(RequestStatus.ACCEPTED);
        request.setUpdatedAt(now);
        bountyRequestRepository.save(request);
        int rejected = bountyRequestService.rejectPending(bountyId, requestId);

        bounty.setStatus(BountyStatus.IN_PROGRESS);
        bounty.setAcceptedHunterId(request.getHunterId());
        bounty.setUpdatedAt(now);
        bountyRepository.save(bounty);

        log.info("Request accepted: bountyId={}, requestId={}, hunterId={}, amount={}, siblingsRejected={}",
                bountyId, requestId, request.getHunterId(), bounty.getAmount(), rejected);
        eventPublisher.publishEvent(LifecycleEvent.of(LifecycleEventType.REQUEST_ACCEPTED,
                bountyId, request.getHunterId(), requestId));
        return bounty;
    }

    /**
     * Approves the pending submission, releases escrow to the hunter and completes the bounty.
     * If the release fails nothing is written: the submission stays PENDING and the bounty IN_PROGRESS.
     *
     * @throws BountyLifecycleException BOUNTY_NOT_IN_PROGRESS, NO_PENDING_SUBMISSION, DISPUTE_OPEN,
     *                                  PAYOUT_FAILED, EXTERNAL_PAYMENT_TIMEOUT, NOT_BOUNTY_POSTER
     */
    @Transactional
    public Bounty approveCompletion(CallerIdentity caller, UUID bountyId) {
        CallerGuards.requireVerifiedEmail(caller);

        Bounty bounty = lockBounty(bountyId);
        CallerGuards.requirePoster(bounty, caller);
        requireInProgress(bounty);
        requireNoOpenDispute(bountyId);
        CompletionSubmission submission = completionWorkflowService.requirePending(bountyId);

        complete(bounty, submission);
        return bounty;
    }

    /**
     * Sends the pending submission back to the hunter. The bounty stays IN_PROGRESS.
     *
     * @throws BountyLifecycleException INVALID_FEEDBACK, NO_PENDING_SUBMISSION, REVISION_LIMIT_REACHED,
     *                                  DISPUTE_OPEN, BOUNTY_NOT_IN_PROGRESS, NOT_BOUNTY_POSTER
     */
    @Transactional
    public CompletionSubmission requestRevision(CallerIdentity caller, UUID bountyId, String feedback) {
        Bounty bounty = lockBounty(bountyId);
        CallerGuards.requirePoster(bounty, caller);
        requireInProgress(bounty);
        if (feedback == null || feedback.isBlank()) {
            throw new BountyLifecycleException(LifecycleErrorKind.INVALID_FEEDBACK,
                    "Empty revision feedback: bountyId=" + bountyId);
        }
        requireNoOpenDispute(bountyId);
        CompletionSubmission submission = completionWorkflowService.requirePending(bountyId);

        int maxCycles = properties.getRevision().getMaxCycles();
        long revisions = completionWorkflowService.countRevisions(bountyId, submission.getHunterId());
        if (revisions >= maxCycles) {
            throw new BountyLifecycleException(LifecycleErrorKind.REVISION_LIMIT_REACHED,
                    String.format("Revision limit reached: bountyId=%s, revisions=%d, max=%d", bountyId, revisions, maxCycles));
        }
        stateMachine.validateTransition(bounty.getStatus(), BountyStatus.IN_PROGRESS);

        completionWorkflowService.markRevisionRequested(submission, feedback.trim());
        bounty.setUpdatedAt(LocalDateTime.now());
        bountyRepository.save(bounty);

        log.info("Revision requested: bountyId={}, submissionId={}, revision={}/{}",
                bountyId, submission.getId(), revisions + 1, maxCycles);
        eventPublisher.publishEvent(LifecycleEvent.of(LifecycleEventType.REVISION_REQUESTED,
                bountyId, submission.getHunterId(), submission.getId()));
        return submission;
    }

    /**
     * Withdraws a bounty. From OPEN or IN_PROGRESS only; held escrow is refunded to the poster and pending
     * applications are rejected. Cancelling an already cancelled or archived bounty returns it unchanged.
     *
     * @throws BountyLifecycleException CANNOT_CANCEL_COMPLETED, DISPUTE_OPEN, NOT_BOUNTY_POSTER,
     *                                  PAYOUT_FAILED, EXTERNAL_PAYMENT_TIMEOUT
     */
    @Transactional
    public Bounty cancel(CallerIdentity caller, UUID bountyId) {
        Bounty bounty = lockBounty(bountyId);
        CallerGuards.requirePoster(bounty, caller);
        if (bounty.getStatus() == BountyStatus.COMPLETED) {
            throw new BountyLifecycleException(LifecycleErrorKind.CANNOT_CANCEL_COMPLETED,
                    "Bounty already completed: bountyId=" + bountyId);
        }
        if (bounty.getStatus() == BountyStatus.CANCELLED || bounty.getStatus() == BountyStatus.ARCHIVED) {
            log.info("Bounty already withdrawn: bountyId={}, status={}", bountyId, bounty.getStatus());
            return bounty;
        }
        requireNoOpenDispute(bountyId);

        UUID hunterId = bounty.getAcceptedHunterId();
        withdraw(bounty, BountyStatus.CANCELLED);

        log.info("Bounty cancelled: bountyId={}, hunterId={}", bountyId, hunterId);
        if (hunterId != null) {
            eventPublisher.publishEvent(LifecycleEvent.of(LifecycleEventType.BOUNTY_CANCELLED, bountyId, hunterId, null));
        }
        return bounty;
    }

    // ==================== Transitions driven by disputes and account deletion ====================

    /**
     * Dispute settled in the hunter's favour: approves the pending submission if there is one,
     * releases escrow and completes the bounty. The bounty must already be locked.
     */
    @Transactional
    public void completeByDispute(Bounty bounty) {
        requireInProgress(bounty);
        CompletionSubmission submission = completionWorkflowService.findPending(bounty.getId()).orElse(null);
        complete(bounty, submission);
    }

    /**
     * Dispute settled in the poster's favour: refunds escrow and cancels the bounty. The bounty must already be locked.
     */
    @Transactional
    public void cancelByDispute(Bounty bounty) {
        requireInProgress(bounty);
        withdraw(bounty, BountyStatus.CANCELLED);
        log.info("Bounty cancelled by dispute: bountyId={}", bounty.getId());
    }

    /**
     * The poster's account is being deleted: refunds any held escrow, rejects pending applications,
     * archives the bounty and drops the poster reference. The bounty must already be locked.
     *
     * @return true if escrow was refunded
     */
    @Transactional
    public boolean archiveForRemovedPoster(Bounty bounty) {
        UUID hunterId = bounty.getAcceptedHunterId();
        boolean refunded = withdraw(bounty, BountyStatus.ARCHIVED);
        bounty.setPosterId(null);
        bountyRepository.save(bounty);

        log.info("Bounty archived after poster removal: bountyId={}, refunded={}", bounty.getId(), refunded);
        if (hunterId != null) {
            eventPublisher.publishEvent(LifecycleEvent.of(LifecycleEventType.BOUNTY_CANCELLED, bounty.getId(), hunterId, null));
        }
        return refunded;
    }

    /**
     * The accepted hunter's account is being deleted: the bounty goes back to OPEN with escrow still held,
     * so the next accepted hunter is paid from the same hold. The hunter's accepted request becomes REJECTED
     * and their pending submission is sent back. The bounty must already be locked.
     */
    @Transactional
    public void reopenForRemovedHunter(Bounty bounty) {
        UUID hunterId = bounty.getAcceptedHunterId();
        stateMachine.validateTransition(bounty.getStatus(), BountyStatus.OPEN);

        LocalDateTime now = LocalDateTime.now();
        for (BountyRequest request : bountyRequestRepository.findByBountyIdAndHunterIdAndStatus(
                bounty.getId(), hunterId, RequestStatus.ACCEPTED)) {
            request.setStatus(RequestStatus.REJECTED);
            request.setUpdatedAt(now);
            bountyRequestRepository.save(request);
        }
        completionWorkflowService.supersedeForRemovedHunter(bounty.getId(), hunterId);
        closePendingCancellation(bounty.getId(), now);

        bounty.setStatus(BountyStatus.OPEN);
        bounty.setAcceptedHunterId(null);
        bounty.setUpdatedAt(now);
        bountyRepository.save(bounty);

        log.info("Bounty reopened after hunter removal: bountyId={}, hunterId={}", bounty.getId(), hunterId);
    }

    /**
     * Locks the bounty row for the rest of the transaction.
     *
     * @throws BountyLifecycleException BOUNTY_NOT_FOUND
     */
    public Bounty lockBounty(UUID bountyId) {
        return bountyRepository.findByIdForUpdate(bountyId)
                .orElseThrow(() -> new BountyLifecycleException(LifecycleErrorKind.BOUNTY_NOT_FOUND,
                        "Bounty not found: " + bountyId));
    }

    private void complete(Bounty bounty, CompletionSubmission submission) {
        stateMachine.validateTransition(bounty.getStatus(), BountyStatus.COMPLETED);

        escrowLedgerService.release(bounty);
        if (submission != null) {
            completionWorkflowService.approve(submission);
        }
        LocalDateTime now = LocalDateTime.now();
        closePendingCancellation(bounty.getId(), now);
        bounty.setStatus(BountyStatus.COMPLETED);
        bounty.setUpdatedAt(now);
        bountyRepository.save(bounty);

        log.info("Bounty completed: bountyId={}, hunterId={}, amount={}",
                bounty.getId(), bounty.getAcceptedHunterId(), bounty.getAmount());
        eventPublisher.publishEvent(LifecycleEvent.of(LifecycleEventType.SUBMISSION_APPROVED,
                bounty.getId(), bounty.getAcceptedHunterId(), submission != null ? submission.getId() : null));
    }

    /**
     * Moves an OPEN or IN_PROGRESS bounty to a final withdrawn status, refunding held escrow first.
     *
     * @return true if escrow was refunded
     */
    private boolean withdraw(Bounty bounty, BountyStatus target) {
        stateMachine.validateTransition(bounty.getStatus(), target);

        boolean refunded = false;
        if (bounty.getStatus() == BountyStatus.IN_PROGRESS
                || escrowLedgerService.findPendingEscrow(bounty.getId()).isPresent()) {
            refunded = escrowLedgerService.refund(bounty) != null;
        }
        bountyRequestService.rejectPending(bounty.getId(), null);
        LocalDateTime now = LocalDateTime.now();
        closePendingCancellation(bounty.getId(), now);

        bounty.setStatus(target);
        bounty.setAcceptedHunterId(null);
        bounty.setUpdatedAt(now);
        bountyRepository.save(bounty);
        return refunded;
    }

    /**
     * A hunter's cancellation request that is still unanswered when the bounty leaves IN_PROGRESS
     * has nothing left to decide.
     */
    private void closePendingCancellation(UUID bountyId, LocalDateTime now) {
        cancellationRepository.findFirstByBountyIdAndStatus(bountyId, CancellationStatus.PENDING)
                .filter(cancellation -> cancellation.getStatus() == CancellationStatus.PENDING)
                .ifPresent(cancellation -> {
                    cancellation.setStatus(CancellationStatus.CLOSED);
                    cancellation.setResolvedAt(now);
                    cancellationRepository.save(cancellation);
                    log.info("Unanswered cancellation request closed: bountyId={}, cancellationId={}",
                            bountyId, cancellation.getId());
                });
    }

    private static void requireInProgress(Bounty bounty) {
        if (bounty.getStatus() != BountyStatus.IN_PROGRESS) {
            throw new BountyLifecycleException(LifecycleErrorKind.BOUNTY_NOT_IN_PROGRESS,
                    String.format("Bounty not in progress: bountyId=%s, status=%s", bounty.getId(), bounty.getStatus()));
        }
    }

    private void requireNoOpenDispute(UUID bountyId) {
        if (disputeRepository.existsByBountyIdAndStatus(bountyId, DisputeStatus.OPEN)) {
            throw new BountyLifecycleException(LifecycleErrorKind.DISPUTE_OPEN, "Dispute open: bountyId=" + bountyId);
        }
    }
}
