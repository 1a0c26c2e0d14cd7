package com.nosota.bounty.controller;

import com.nosota.bounty.api.BountyApi;
import com.nosota.bounty.api.model.CallerIdentity;
import com.nosota.bounty.api.request.CreateBountyRequest;
import com.nosota.bounty.api.request.OpenCancellationRequest;
import com.nosota.bounty.api.request.OpenDisputeRequest;
import com.nosota.bounty.api.request.RatingRequest;
import com.nosota.bounty.api.request.ResolveDisputeRequest;
import com.nosota.bounty.api.request.RespondCancellationRequest;
import com.nosota.bounty.api.request.RevisionRequest;
import com.nosota.bounty.api.request.SubmitCompletionRequest;
import com.nosota.bounty.api.response.BountyRequestResponse;
import com.nosota.bounty.api.response.BountyResponse;
import com.nosota.bounty.api.response.CancellationResponse;
import com.nosota.bounty.api.response.DisputeResponse;
import com.nosota.bounty.api.response.RatingResponse;
import com.nosota.bounty.api.response.SubmissionResponse;
import com.nosota.bounty.api.response.WalletTransactionResponse;
import com.nosota.bounty.mapper.BountyMapper;
import com.nosota.bounty.model.Bounty;
import com.nosota.bounty.service.BountyLifecycleService;
import com.nosota.bounty.service.BountyRequestService;
import com.nosota.bounty.service.CancellationService;
import com.nosota.bounty.service.CompletionWorkflowService;
import com.nosota.bounty.service.DisputeService;
import com.nosota.bounty.service.EscrowLedgerService;
import com.nosota.bounty.service.RatingService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.UUID;

/**
 * REST controller for the bounty lifecycle.
 *
 * <p>Implements {@link BountyApi}. Every mutating call is delegated to a service method that runs in its own
 * transaction; the controller only maps entities to responses.
 */
@RestController
@Validated
@RequiredArgsConstructor
@Slf4j
public class BountyController implements BountyApi {

    private final BountyLifecycleService bountyLifecycleService;
    private final BountyRequestService bountyRequestService;
    private final CompletionWorkflowService completionWorkflowService;
    private final DisputeService disputeService;
    private final RatingService ratingService;
    private final EscrowLedgerService escrowLedgerService;
    private final CancellationService cancellationService;

    private final BountyMapper mapper = BountyMapper.INSTANCE;

    // ==================== Bounties ====================

    @Override
    public ResponseEntity<BountyResponse> createBounty(CallerIdentity caller, CreateBountyRequest request) {
        log.info("Creating bounty: posterId={}, amount={}, isForHonor={}, workType={}",
                caller.userId(), request.amount(), request.isForHonor(), request.workType());

        Bounty bounty = bountyLifecycleService.open(caller, request);
        return ResponseEntity.status(HttpStatus.CREATED).body(mapper.toResponse(bounty));
    }

    @Override
    public ResponseEntity<BountyResponse> getBounty(UUID bountyId) {
        log.debug("Getting bounty: bountyId={}", bountyId);
        return ResponseEntity.ok(mapper.toResponse(bountyLifecycleService.getBounty(bountyId)));
    }

    @Override
    public ResponseEntity<BountyResponse> cancelBounty(CallerIdentity caller, UUID bountyId) {
        return ResponseEntity.ok(mapper.toResponse(bountyLifecycleService.cancel(caller, bountyId)));
    }

    @Override
    public ResponseEntity<List<WalletTransactionResponse>> getEscrowTransactions(UUID bountyId) {
        log.debug("Getting escrow transactions: bountyId={}", bountyId);
        bountyLifecycleService.getBounty(bountyId);
        return ResponseEntity.ok(mapper.toTransactionResponses(escrowLedgerService.getEscrowTransactions(bountyId)));
    }

    // ==================== Applications ====================

    @Override
    public ResponseEntity<BountyRequestResponse> apply(CallerIdentity caller, UUID bountyId) {
        return ResponseEntity.status(HttpStatus.CREATED)
                .body(mapper.toResponse(bountyRequestService.apply(caller, bountyId)));
    }

    @Override
    public ResponseEntity<List<BountyRequestResponse>> listRequestsForBounty(UUID bountyId) {
        return ResponseEntity.ok(mapper.toRequestResponses(bountyRequestService.listForBounty(bountyId)));
    }

    @Override
    public ResponseEntity<List<BountyRequestResponse>> listRequestsForHunter(UUID hunterId) {
        return ResponseEntity.ok(mapper.toRequestResponses(bountyRequestService.listForUser(hunterId)));
    }

    @Override
    public ResponseEntity<BountyResponse> acceptRequest(CallerIdentity caller, UUID bountyId, UUID requestId) {
        return ResponseEntity.ok(mapper.toResponse(bountyLifecycleService.acceptRequest(caller, bountyId, requestId)));
    }

    @Override
    public ResponseEntity<BountyRequestResponse> rejectRequest(CallerIdentity caller, UUID bountyId, UUID requestId) {
        return ResponseEntity.ok(mapper.toResponse(bountyRequestService.reject(caller, bountyId, requestId)));
    }

    // ==================== Completion ====================

    @Override
    public ResponseEntity<SubmissionResponse> submitCompletion(CallerIdentity caller, UUID bountyId,
                                                               SubmitCompletionRequest request) {
        return ResponseEntity.status(HttpStatus.CREATED).body(mapper.toResponse(
                completionWorkflowService.submit(caller, bountyId, request.message(), request.proofItems())));
    }

    @Override
    public ResponseEntity<List<SubmissionResponse>> listSubmissions(UUID bountyId) {
        return ResponseEntity.ok(mapper.toSubmissionResponses(completionWorkflowService.listForBounty(bountyId)));
    }

    @Override
    public ResponseEntity<BountyResponse> approveCompletion(CallerIdentity caller, UUID bountyId) {
        return ResponseEntity.ok(mapper.toResponse(bountyLifecycleService.approveCompletion(caller, bountyId)));
    }

    @Override
    public ResponseEntity<SubmissionResponse> requestRevision(CallerIdentity caller, UUID bountyId,
                                                              RevisionRequest request) {
        return ResponseEntity.ok(mapper.toResponse(
                bountyLifecycleService.requestRevision(caller, bountyId, request.feedback())));
    }

    // ==================== Disputes ====================

    @Override
    public ResponseEntity<DisputeResponse> openDispute(CallerIdentity caller, UUID bountyId,
                                                       OpenDisputeRequest request) {
        return ResponseEntity.status(HttpStatus.CREATED)
                .body(mapper.toResponse(disputeService.openDispute(caller, bountyId, request.reason())));
    }

    @Override
    public ResponseEntity<DisputeResponse> getDispute(UUID disputeId) {
        return ResponseEntity.ok(mapper.toResponse(disputeService.getDispute(disputeId)));
    }

    @Override
    public ResponseEntity<DisputeResponse> resolveDispute(CallerIdentity caller, UUID disputeId,
                                                          ResolveDisputeRequest request) {
        return ResponseEntity.ok(mapper.toResponse(
                disputeService.resolveDispute(caller, disputeId, request.resolution(), request.note())));
    }

    // ==================== Cancellation requests ====================

    @Override
    public ResponseEntity<CancellationResponse> requestCancellation(CallerIdentity caller, UUID bountyId,
                                                                    OpenCancellationRequest request) {
        return ResponseEntity.status(HttpStatus.CREATED)
                .body(mapper.toResponse(cancellationService.requestCancellation(caller, bountyId, request.reason())));
    }

    @Override
    public ResponseEntity<List<CancellationResponse>> listCancellations(UUID bountyId) {
        return ResponseEntity.ok(mapper.toCancellationResponses(cancellationService.listForBounty(bountyId)));
    }

    @Override
    public ResponseEntity<CancellationResponse> getCancellation(UUID cancellationId) {
        return ResponseEntity.ok(mapper.toResponse(cancellationService.getCancellation(cancellationId)));
    }

    @Override
    public ResponseEntity<CancellationResponse> acceptCancellation(CallerIdentity caller, UUID cancellationId,
                                                                   RespondCancellationRequest request) {
        return ResponseEntity.ok(mapper.toResponse(
                cancellationService.acceptCancellation(caller, cancellationId, request.message())));
    }

    @Override
    public ResponseEntity<CancellationResponse> rejectCancellation(CallerIdentity caller, UUID cancellationId,
                                                                   RespondCancellationRequest request) {
        return ResponseEntity.ok(mapper.toResponse(
                cancellationService.rejectCancellation(caller, cancellationId, request.message())));
    }

    // ==================== Ratings ====================

    @Override
    public ResponseEntity<RatingResponse> rate(CallerIdentity caller, UUID bountyId, RatingRequest request) {
        return ResponseEntity.status(HttpStatus.CREATED)
                .body(mapper.toResponse(ratingService.rate(caller, bountyId, request.rating(), request.comment())));
    }

    @Override
    public ResponseEntity<List<RatingResponse>> listRatings(UUID bountyId) {
        return ResponseEntity.ok(mapper.toRatingResponses(ratingService.listForBounty(bountyId)));
    }
}
