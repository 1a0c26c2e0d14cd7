package com.nosota.bounty.service;

import com.nosota.bounty.api.model.BountyStatus;
import com.nosota.bounty.api.model.CallerIdentity;
import com.nosota.bounty.api.model.LifecycleErrorKind;
import com.nosota.bounty.api.model.RequestStatus;
import com.nosota.bounty.error.BountyLifecycleException;
import com.nosota.bounty.model.Bounty;
import com.nosota.bounty.model.BountyRequest;
import com.nosota.bounty.notification.LifecycleEvent;
import com.nosota.bounty.notification.LifecycleEventType;
import com.nosota.bounty.repository.BountyRepository;
import com.nosota.bounty.repository.BountyRequestRepository;
import com.nosota.bounty.repository.ProfileRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDateTime;
import java.util.EnumSet;
import java.util.List;
import java.util.UUID;

/**
 * Application intake for bounties.
 *
 * <p>Requests are created PENDING and leave that state exactly once. Acceptance is not available here:
 * it is coupled with the escrow hold and lives in {@link BountyLifecycleService#acceptRequest}.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class BountyRequestService {

    private static final EnumSet<RequestStatus> ACTIVE = EnumSet.of(RequestStatus.PENDING, RequestStatus.ACCEPTED);

    private final BountyRepository bountyRepository;
    private final BountyRequestRepository bountyRequestRepository;
    private final ProfileRepository profileRepository;
    private final ApplicationEventPublisher eventPublisher;

    /**
     * Applies the caller to an open bounty.
     *
     * @throws BountyLifecycleException SELF_APPLICATION, BOUNTY_NOT_OPEN, DUPLICATE_APPLICATION,
     *                                  EMAIL_NOT_VERIFIED, ACCOUNT_NOT_FOUND, BOUNTY_NOT_FOUND
     */
    @Transactional
    public BountyRequest apply(CallerIdentity caller, UUID bountyId) {
        CallerGuards.requireVerifiedEmail(caller);
        UUID hunterId = caller.userId();

        Bounty bounty = bountyRepository.findByIdForUpdate(bountyId)
                .orElseThrow(() -> new BountyLifecycleException(LifecycleErrorKind.BOUNTY_NOT_FOUND,
                        "Bounty not found: " + bountyId));
        if (!profileRepository.existsById(hunterId)) {
            throw new BountyLifecycleException(LifecycleErrorKind.ACCOUNT_NOT_FOUND, "No profile for userId=" + hunterId);
        }
        if (hunterId.equals(bounty.getPosterId())) {
            throw new BountyLifecycleException(LifecycleErrorKind.SELF_APPLICATION,
                    "Poster applied to own bounty: bountyId=" + bountyId);
        }
        if (bounty.getStatus() != BountyStatus.OPEN) {
            throw new BountyLifecycleException(LifecycleErrorKind.BOUNTY_NOT_OPEN,
                    String.format("Bounty not open: bountyId=%s, status=%s", bountyId, bounty.getStatus()));
        }
        if (bountyRequestRepository.existsByBountyIdAndHunterIdAndStatusIn(bountyId, hunterId, ACTIVE)) {
            throw new BountyLifecycleException(LifecycleErrorKind.DUPLICATE_APPLICATION,
                    String.format("Active application exists: bountyId=%s, hunterId=%s", bountyId, hunterId));
        }

        LocalDateTime now = LocalDateTime.now();
        BountyRequest request = new BountyRequest();
        request.setBountyId(bountyId);
        request.setHunterId(hunterId);
        request.setStatus(RequestStatus.PENDING);
        request.setCreatedAt(now);
        request.setUpdatedAt(now);
        bountyRequestRepository.save(request);

        log.info("Application received: bountyId={}, requestId={}, hunterId={}", bountyId, request.getId(), hunterId);
        eventPublisher.publishEvent(LifecycleEvent.of(LifecycleEventType.APPLICATION_RECEIVED,
                bountyId, bounty.getPosterId(), request.getId()));
        return request;
    }

    /**
     * Rejects one pending application. Touches nothing but that request.
     *
     * @throws BountyLifecycleException NOT_BOUNTY_POSTER, REQUEST_NOT_FOUND, REQUEST_NOT_PENDING
     */
    @Transactional
    public BountyRequest reject(CallerIdentity caller, UUID bountyId, UUID requestId) {
        Bounty bounty = bountyRepository.findByIdForUpdate(bountyId)
                .orElseThrow(() -> new BountyLifecycleException(LifecycleErrorKind.BOUNTY_NOT_FOUND,
                        "Bounty not found: " + bountyId));
        CallerGuards.requirePoster(bounty, caller);

        BountyRequest request = requireRequestOf(bountyId, requestId);
        if (request.getStatus() != RequestStatus.PENDING) {
            throw new BountyLifecycleException(LifecycleErrorKind.REQUEST_NOT_PENDING,
                    String.format("Request not pending: requestId=%s, status=%s", requestId, request.getStatus()));
        }

        markRejected(request, LocalDateTime.now());
        log.info("Application rejected: bountyId={}, requestId={}", bountyId, requestId);
        return request;
    }

    @Transactional(readOnly = true)
    public List<BountyRequest> listForBounty(UUID bountyId) {
        return bountyRequestRepository.findByBountyIdOrderByCreatedAtAsc(bountyId);
    }

    @Transactional(readOnly = true)
    public List<BountyRequest> listForUser(UUID hunterId) {
        return bountyRequestRepository.findByHunterIdOrderByCreatedAtDesc(hunterId);
    }

    /**
     * Loads a request and checks it belongs to the bounty.
     *
     * @throws BountyLifecycleException REQUEST_NOT_FOUND
     */
    public BountyRequest requireRequestOf(UUID bountyId, UUID requestId) {
        return bountyRequestRepository.findById(requestId)
                .filter(request -> request.getBountyId().equals(bountyId))
                .orElseThrow(() -> new BountyLifecycleException(LifecycleErrorKind.REQUEST_NOT_FOUND,
                        String.format("Request not found: bountyId=%s, requestId=%s", bountyId, requestId)));
    }

    /**
     * Rejects every pending request of the bounty except {@code keepRequestId} (may be null).
     * The caller must hold the bounty lock.
     *
     * @return number of requests rejected
     */
    public int rejectPending(UUID bountyId, UUID keepRequestId) {
        LocalDateTime now = LocalDateTime.now();
        int rejected = 0;
        for (BountyRequest request : bountyRequestRepository.findByBountyIdAndStatus(bountyId, RequestStatus.PENDING)) {
            if (request.getId().equals(keepRequestId)) {
                continue;
            }
            markRejected(request, now);
            rejected++;
        }
        if (rejected > 0) {
            log.info("Pending applications rejected: bountyId={}, count={}", bountyId, rejected);
        }
        return rejected;
    }

    /**
     * Rejects the hunter's pending applications on the bounty and drops the hunter reference from them.
     * The caller must hold the bounty lock.
     *
     * @return number of requests rejected
     */
    public int rejectPendingOfRemovedHunter(UUID bountyId, UUID hunterId) {
        LocalDateTime now = LocalDateTime.now();
        List<BountyRequest> pending = bountyRequestRepository.findByBountyIdAndHunterIdAndStatus(
                bountyId, hunterId, RequestStatus.PENDING);
        for (BountyRequest request : pending) {
            request.setHunterId(null);
            markRejected(request, now);
        }
        return pending.size();
    }

    private void markRejected(BountyRequest request, LocalDateTime now) {
        request.setStatus(RequestStatus.REJECTED);
        request.setUpdatedAt(now);
        bountyRequestRepository.save(request);
    }
}
