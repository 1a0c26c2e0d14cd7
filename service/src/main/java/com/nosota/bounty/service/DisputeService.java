package com.nosota.bounty.service;

import com.nosota.bounty.api.model.BountyStatus;
import com.nosota.bounty.api.model.CallerIdentity;
import com.nosota.bounty.api.model.DisputeResolution;
import com.nosota.bounty.api.model.DisputeStatus;
import com.nosota.bounty.api.model.LifecycleErrorKind;
import com.nosota.bounty.error.BountyLifecycleException;
import com.nosota.bounty.model.Bounty;
import com.nosota.bounty.model.Dispute;
import com.nosota.bounty.notification.LifecycleEvent;
import com.nosota.bounty.notification.LifecycleEventType;
import com.nosota.bounty.repository.DisputeRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDateTime;
import java.util.Optional;
import java.util.UUID;

/**
 * Escalation path for in-progress bounties, including the one a poster reaches after the revision limit.
 *
 * <p>While a dispute is OPEN, approval, revision requests, submissions and cancellation are refused.
 * An administrator resolves it:
 * <ul>
 *   <li>RELEASE_TO_HUNTER - escrow released, bounty COMPLETED</li>
 *   <li>REFUND_TO_POSTER - escrow refunded, bounty CANCELLED</li>
 *   <li>VOID - nothing moves, the bounty continues IN_PROGRESS</li>
 * </ul>
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class DisputeService {

    private final DisputeRepository disputeRepository;
    private final BountyLifecycleService bountyLifecycleService;
    private final ApplicationEventPublisher eventPublisher;

    /**
     * @throws BountyLifecycleException BOUNTY_NOT_IN_PROGRESS, NOT_DISPUTE_PARTICIPANT, DISPUTE_ALREADY_OPEN
     */
    @Transactional
    public Dispute openDispute(CallerIdentity caller, UUID bountyId, String reason) {
        Bounty bounty = bountyLifecycleService.lockBounty(bountyId);
        boolean poster = CallerGuards.isPoster(bounty, caller);
        if (!poster && !CallerGuards.isAcceptedHunter(bounty, caller)) {
            throw new BountyLifecycleException(LifecycleErrorKind.NOT_DISPUTE_PARTICIPANT,
                    String.format("Caller is not a participant: bountyId=%s, callerId=%s", bountyId, caller.userId()));
        }
        if (bounty.getStatus() != BountyStatus.IN_PROGRESS) {
            throw new BountyLifecycleException(LifecycleErrorKind.BOUNTY_NOT_IN_PROGRESS,
                    String.format("Bounty not in progress: bountyId=%s, status=%s", bountyId, bounty.getStatus()));
        }
        if (disputeRepository.existsByBountyIdAndStatus(bountyId, DisputeStatus.OPEN)) {
            throw new BountyLifecycleException(LifecycleErrorKind.DISPUTE_ALREADY_OPEN,
                    "Dispute already open: bountyId=" + bountyId);
        }

        Dispute dispute = new Dispute();
        dispute.setBountyId(bountyId);
        dispute.setInitiatorId(caller.userId());
        dispute.setReason(reason);
        dispute.setStatus(DisputeStatus.OPEN);
        dispute.setCreatedAt(LocalDateTime.now());
        disputeRepository.save(dispute);

        UUID counterpart = poster ? bounty.getAcceptedHunterId() : bounty.getPosterId();
        log.info("Dispute opened: bountyId={}, disputeId={}, initiatorId={}", bountyId, dispute.getId(), caller.userId());
        eventPublisher.publishEvent(LifecycleEvent.of(LifecycleEventType.DISPUTE_OPENED, bountyId, counterpart, dispute.getId()));
        return dispute;
    }

    /**
     * Resolves an open dispute and applies its money outcome in the same transaction.
     *
     * @throws BountyLifecycleException NOT_AUTHORIZED for non-admin callers, DISPUTE_NOT_FOUND,
     *                                  DISPUTE_ALREADY_RESOLVED, PAYOUT_FAILED, EXTERNAL_PAYMENT_TIMEOUT
     */
    @Transactional
    public Dispute resolveDispute(CallerIdentity caller, UUID disputeId, DisputeResolution resolution, String note) {
        if (!caller.admin()) {
            throw new BountyLifecycleException(LifecycleErrorKind.NOT_AUTHORIZED,
                    "Dispute resolution requires ADMIN: callerId=" + caller.userId());
        }

        UUID bountyId = disputeRepository.findBountyIdById(disputeId)
                .orElseThrow(() -> new BountyLifecycleException(LifecycleErrorKind.DISPUTE_NOT_FOUND,
                        "Dispute not found: " + disputeId));
        Bounty bounty = bountyLifecycleService.lockBounty(bountyId);
        Dispute dispute = getDispute(disputeId);
        if (dispute.getStatus() != DisputeStatus.OPEN) {
            throw new BountyLifecycleException(LifecycleErrorKind.DISPUTE_ALREADY_RESOLVED,
                    "Dispute already resolved: disputeId=" + disputeId);
        }

        UUID posterId = bounty.getPosterId();
        UUID hunterId = bounty.getAcceptedHunterId();
        switch (resolution) {
            case RELEASE_TO_HUNTER -> bountyLifecycleService.completeByDispute(bounty);
            case REFUND_TO_POSTER -> bountyLifecycleService.cancelByDispute(bounty);
            case VOID -> log.debug("Dispute voided, bounty continues: bountyId={}", bountyId);
        }
        close(dispute, resolution, note, caller.userId());

        log.info("Dispute resolved: bountyId={}, disputeId={}, resolution={}, resolvedBy={}",
                bountyId, disputeId, resolution, caller.userId());
        eventPublisher.publishEvent(LifecycleEvent.of(LifecycleEventType.DISPUTE_RESOLVED, bountyId, posterId, disputeId));
        eventPublisher.publishEvent(LifecycleEvent.of(LifecycleEventType.DISPUTE_RESOLVED, bountyId, hunterId, disputeId));
        return dispute;
    }

    @Transactional(readOnly = true)
    public Dispute getDispute(UUID disputeId) {
        return disputeRepository.findById(disputeId)
                .orElseThrow(() -> new BountyLifecycleException(LifecycleErrorKind.DISPUTE_NOT_FOUND,
                        "Dispute not found: " + disputeId));
    }

    /**
     * Closes the bounty's open dispute, if any, without moving money. Used by the deletion cascade,
     * which settles escrow itself. The bounty must already be locked.
     *
     * @return true if a dispute was closed
     */
    public boolean closeForRemovedAccount(UUID bountyId, DisputeResolution resolution) {
        Optional<Dispute> open = disputeRepository.findFirstByBountyIdAndStatus(bountyId, DisputeStatus.OPEN);
        open.ifPresent(dispute -> {
            close(dispute, resolution, "Closed because a participant deleted their account", null);
            log.info("Dispute closed after account removal: bountyId={}, disputeId={}, resolution={}",
                    bountyId, dispute.getId(), resolution);
        });
        return open.isPresent();
    }

    private void close(Dispute dispute, DisputeResolution resolution, String note, UUID resolvedBy) {
        dispute.setStatus(DisputeStatus.RESOLVED);
        dispute.setResolution(resolution);
        dispute.setResolutionNote(note);
        dispute.setResolvedBy(resolvedBy);
        dispute.setResolvedAt(LocalDateTime.now());
        disputeRepository.save(dispute);
    }
}
