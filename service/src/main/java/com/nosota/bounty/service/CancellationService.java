package com.nosota.bounty.service;

import com.nosota.bounty.api.model.BountyStatus;
import com.nosota.bounty.api.model.CallerIdentity;
import com.nosota.bounty.api.model.CancellationStatus;
import com.nosota.bounty.api.model.DisputeStatus;
import com.nosota.bounty.api.model.LifecycleErrorKind;
import com.nosota.bounty.error.BountyLifecycleException;
import com.nosota.bounty.model.Bounty;
import com.nosota.bounty.model.BountyCancellation;
import com.nosota.bounty.notification.LifecycleEvent;
import com.nosota.bounty.notification.LifecycleEventType;
import com.nosota.bounty.repository.BountyCancellationRepository;
import com.nosota.bounty.repository.DisputeRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDateTime;
import java.util.List;
import java.util.UUID;

/**
 * Lets the working hunter ask the poster to call off an in-progress bounty.
 *
 * <p>Accepting cancels the bounty through {@link BountyLifecycleService#cancel}, so escrow is refunded in full
 * to the poster. Rejecting leaves the bounty IN_PROGRESS with the same hunter. A pending request that is still
 * unanswered when the bounty completes, is cancelled or loses its hunter is CLOSED by the lifecycle service.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class CancellationService {

    private final BountyCancellationRepository cancellationRepository;
    private final DisputeRepository disputeRepository;
    private final BountyLifecycleService bountyLifecycleService;
    private final ApplicationEventPublisher eventPublisher;

    /**
     * @throws BountyLifecycleException NOT_ACCEPTED_HUNTER, BOUNTY_NOT_IN_PROGRESS, DISPUTE_OPEN,
     *                                  CANCELLATION_ALREADY_PENDING
     */
    @Transactional
    public BountyCancellation requestCancellation(CallerIdentity caller, UUID bountyId, String reason) {
        Bounty bounty = bountyLifecycleService.lockBounty(bountyId);
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
        if (cancellationRepository.findFirstByBountyIdAndStatus(bountyId, CancellationStatus.PENDING).isPresent()) {
            throw new BountyLifecycleException(LifecycleErrorKind.CANCELLATION_ALREADY_PENDING,
                    "Cancellation already pending: bountyId=" + bountyId);
        }

        BountyCancellation cancellation = new BountyCancellation();
        cancellation.setBountyId(bountyId);
        cancellation.setRequesterId(caller.userId());
        cancellation.setReason(reason);
        cancellation.setStatus(CancellationStatus.PENDING);
        cancellation.setCreatedAt(LocalDateTime.now());
        cancellationRepository.save(cancellation);

        log.info("Cancellation requested: bountyId={}, cancellationId={}, hunterId={}",
                bountyId, cancellation.getId(), caller.userId());
        eventPublisher.publishEvent(LifecycleEvent.of(LifecycleEventType.CANCELLATION_REQUESTED,
                bountyId, bounty.getPosterId(), cancellation.getId()));
        return cancellation;
    }

    /**
     * Poster agrees: the bounty is cancelled and the held reward goes back to the poster.
     * A failed refund rolls everything back and the request stays PENDING.
     *
     * @throws BountyLifecycleException CANCELLATION_NOT_FOUND, NOT_BOUNTY_POSTER, CANCELLATION_NOT_PENDING,
     *                                  DISPUTE_OPEN, PAYOUT_FAILED, EXTERNAL_PAYMENT_TIMEOUT
     */
    @Transactional
    public BountyCancellation acceptCancellation(CallerIdentity caller, UUID cancellationId, String message) {
        Bounty bounty = lockBountyOf(cancellationId);
        CallerGuards.requirePoster(bounty, caller);
        BountyCancellation cancellation = requirePending(cancellationId);

        // answered first, so the withdrawal below does not close it as unanswered
        resolve(cancellation, CancellationStatus.ACCEPTED, caller.userId(), message);
        bountyLifecycleService.cancel(caller, bounty.getId());

        log.info("Cancellation accepted: bountyId={}, cancellationId={}", bounty.getId(), cancellationId);
        return cancellation;
    }

    /**
     * Poster declines: the bounty continues IN_PROGRESS with the same hunter.
     *
     * @throws BountyLifecycleException CANCELLATION_NOT_FOUND, NOT_BOUNTY_POSTER, CANCELLATION_NOT_PENDING
     */
    @Transactional
    public BountyCancellation rejectCancellation(CallerIdentity caller, UUID cancellationId, String message) {
        Bounty bounty = lockBountyOf(cancellationId);
        CallerGuards.requirePoster(bounty, caller);
        BountyCancellation cancellation = requirePending(cancellationId);

        resolve(cancellation, CancellationStatus.REJECTED, caller.userId(), message);

        log.info("Cancellation rejected: bountyId={}, cancellationId={}", bounty.getId(), cancellationId);
        eventPublisher.publishEvent(LifecycleEvent.of(LifecycleEventType.CANCELLATION_REJECTED,
                bounty.getId(), cancellation.getRequesterId(), cancellationId));
        return cancellation;
    }

    @Transactional(readOnly = true)
    public BountyCancellation getCancellation(UUID cancellationId) {
        return cancellationRepository.findById(cancellationId)
                .orElseThrow(() -> new BountyLifecycleException(LifecycleErrorKind.CANCELLATION_NOT_FOUND,
                        "Cancellation not found: " + cancellationId));
    }

    @Transactional(readOnly = true)
    public List<BountyCancellation> listForBounty(UUID bountyId) {
        return cancellationRepository.findByBountyIdOrderByCreatedAtAsc(bountyId);
    }

    private Bounty lockBountyOf(UUID cancellationId) {
        UUID bountyId = cancellationRepository.findBountyIdById(cancellationId)
                .orElseThrow(() -> new BountyLifecycleException(LifecycleErrorKind.CANCELLATION_NOT_FOUND,
                        "Cancellation not found: " + cancellationId));
        return bountyLifecycleService.lockBounty(bountyId);
    }

    private BountyCancellation requirePending(UUID cancellationId) {
        BountyCancellation cancellation = getCancellation(cancellationId);
        if (cancellation.getStatus() != CancellationStatus.PENDING) {
            throw new BountyLifecycleException(LifecycleErrorKind.CANCELLATION_NOT_PENDING,
                    String.format("Cancellation not pending: cancellationId=%s, status=%s",
                            cancellationId, cancellation.getStatus()));
        }
        return cancellation;
    }

    private void resolve(BountyCancellation cancellation, CancellationStatus status, UUID responderId, String message) {
        cancellation.setStatus(status);
        cancellation.setResponderId(responderId);
        cancellation.setResponseMessage(message);
        cancellation.setResolvedAt(LocalDateTime.now());
        cancellationRepository.save(cancellation);
    }
}
