package com.nosota.bounty.api;

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
import jakarta.validation.Valid;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;

import java.util.List;
import java.util.UUID;

/**
 * Bounty lifecycle API.
 *
 * <p>Defines REST endpoints for:
 * <ul>
 *   <li>Posting, reading and cancelling bounties</li>
 *   <li>Applications: apply, accept (holds escrow), reject, list</li>
 *   <li>Completion: submit proof, approve (releases escrow), request revision</li>
 *   <li>Disputes and post-completion ratings</li>
 * </ul>
 *
 * <p>{@link CallerIdentity} parameters are resolved from the identity headers
 * ({@link com.nosota.bounty.api.model.IdentityHeaders}) on the server side and written to them by {@link BountyClient}.
 *
 * <p>This interface is implemented by:
 * <ul>
 *   <li>BountyController - in service module (server-side implementation)</li>
 *   <li>BountyClient - in api module (WebClient-based client for consumers)</li>
 * </ul>
 */
@RequestMapping("/api/v1")
public interface BountyApi {

    // ==================== Bounties ====================

    @PostMapping("/bounties")
    ResponseEntity<BountyResponse> createBounty(
            CallerIdentity caller,
            @RequestBody @Valid CreateBountyRequest request);

    @GetMapping("/bounties/{bountyId}")
    ResponseEntity<BountyResponse> getBounty(
            @PathVariable("bountyId") UUID bountyId);

    /**
     * Withdraws a bounty. Refunds escrow when a hunter was already working on it.
     */
    @PostMapping("/bounties/{bountyId}/cancel")
    ResponseEntity<BountyResponse> cancelBounty(
            CallerIdentity caller,
            @PathVariable("bountyId") UUID bountyId);

    /**
     * Lists the escrow, refund and release rows of a bounty, oldest first.
     */
    @GetMapping("/bounties/{bountyId}/escrow")
    ResponseEntity<List<WalletTransactionResponse>> getEscrowTransactions(
            @PathVariable("bountyId") UUID bountyId);

    // ==================== Applications ====================

    @PostMapping("/bounties/{bountyId}/requests")
    ResponseEntity<BountyRequestResponse> apply(
            CallerIdentity caller,
            @PathVariable("bountyId") UUID bountyId);

    @GetMapping("/bounties/{bountyId}/requests")
    ResponseEntity<List<BountyRequestResponse>> listRequestsForBounty(
            @PathVariable("bountyId") UUID bountyId);

    @GetMapping("/hunters/{hunterId}/requests")
    ResponseEntity<List<BountyRequestResponse>> listRequestsForHunter(
            @PathVariable("hunterId") UUID hunterId);

    /**
     * Accepts one application: the bounty moves to IN_PROGRESS, sibling applications are rejected
     * and the reward is moved into escrow, all in one transaction.
     */
    @PostMapping("/bounties/{bountyId}/requests/{requestId}/accept")
    ResponseEntity<BountyResponse> acceptRequest(
            CallerIdentity caller,
            @PathVariable("bountyId") UUID bountyId,
            @PathVariable("requestId") UUID requestId);

    @PostMapping("/bounties/{bountyId}/requests/{requestId}/reject")
    ResponseEntity<BountyRequestResponse> rejectRequest(
            CallerIdentity caller,
            @PathVariable("bountyId") UUID bountyId,
            @PathVariable("requestId") UUID requestId);

    // ==================== Completion ====================

    @PostMapping("/bounties/{bountyId}/submissions")
    ResponseEntity<SubmissionResponse> submitCompletion(
            CallerIdentity caller,
            @PathVariable("bountyId") UUID bountyId,
            @RequestBody @Valid SubmitCompletionRequest request);

    @GetMapping("/bounties/{bountyId}/submissions")
    ResponseEntity<List<SubmissionResponse>> listSubmissions(
            @PathVariable("bountyId") UUID bountyId);

    /**
     * Approves the pending submission, releases escrow to the hunter and completes the bounty.
     */
    @PostMapping("/bounties/{bountyId}/approve")
    ResponseEntity<BountyResponse> approveCompletion(
            CallerIdentity caller,
            @PathVariable("bountyId") UUID bountyId);

    @PostMapping("/bounties/{bountyId}/revision")
    ResponseEntity<SubmissionResponse> requestRevision(
            CallerIdentity caller,
            @PathVariable("bountyId") UUID bountyId,
            @RequestBody @Valid RevisionRequest request);

    // ==================== Disputes ====================

    @PostMapping("/bounties/{bountyId}/disputes")
    ResponseEntity<DisputeResponse> openDispute(
            CallerIdentity caller,
            @PathVariable("bountyId") UUID bountyId,
            @RequestBody @Valid OpenDisputeRequest request);

    @GetMapping("/disputes/{disputeId}")
    ResponseEntity<DisputeResponse> getDispute(
            @PathVariable("disputeId") UUID disputeId);

    /**
     * Resolves a dispute. Requires the ADMIN role.
     */
    @PostMapping("/disputes/{disputeId}/resolve")
    ResponseEntity<DisputeResponse> resolveDispute(
            CallerIdentity caller,
            @PathVariable("disputeId") UUID disputeId,
            @RequestBody @Valid ResolveDisputeRequest request);

    // ==================== Cancellation requests ====================

    /**
     * The working hunter asks the poster to cancel an in-progress bounty.
     */
    @PostMapping("/bounties/{bountyId}/cancellations")
    ResponseEntity<CancellationResponse> requestCancellation(
            CallerIdentity caller,
            @PathVariable("bountyId") UUID bountyId,
            @RequestBody @Valid OpenCancellationRequest request);

    @GetMapping("/bounties/{bountyId}/cancellations")
    ResponseEntity<List<CancellationResponse>> listCancellations(
            @PathVariable("bountyId") UUID bountyId);

    @GetMapping("/cancellations/{cancellationId}")
    ResponseEntity<CancellationResponse> getCancellation(
            @PathVariable("cancellationId") UUID cancellationId);

    /**
     * Poster accepts: the bounty is cancelled and escrow refunded to the poster.
     */
    @PostMapping("/cancellations/{cancellationId}/accept")
    ResponseEntity<CancellationResponse> acceptCancellation(
            CallerIdentity caller,
            @PathVariable("cancellationId") UUID cancellationId,
            @RequestBody @Valid RespondCancellationRequest request);

    @PostMapping("/cancellations/{cancellationId}/reject")
    ResponseEntity<CancellationResponse> rejectCancellation(
            CallerIdentity caller,
            @PathVariable("cancellationId") UUID cancellationId,
            @RequestBody @Valid RespondCancellationRequest request);

    // ==================== Ratings ====================

    @PostMapping("/bounties/{bountyId}/ratings")
    ResponseEntity<RatingResponse> rate(
            CallerIdentity caller,
            @PathVariable("bountyId") UUID bountyId,
            @RequestBody @Valid RatingRequest request);

    @GetMapping("/bounties/{bountyId}/ratings")
    ResponseEntity<List<RatingResponse>> listRatings(
            @PathVariable("bountyId") UUID bountyId);
}
