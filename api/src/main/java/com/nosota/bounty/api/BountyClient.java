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
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.ParameterizedTypeReference;
import org.springframework.http.ResponseEntity;
import org.springframework.web.reactive.function.client.WebClient;

import java.util.List;
import java.util.UUID;

/**
 * WebClient-based implementation of {@link BountyApi} for services that drive the bounty lifecycle.
 *
 * <p><b>IMPORTANT:</b> This client is NOT a Spring @Component. Consuming services register it themselves:
 * <pre>
 * {@code
 * @Bean
 * public BountyClient bountyClient(WebClient.Builder builder,
 *                                  @Value("${services.bounty.url}") String baseUrl) {
 *     return new BountyClient(builder.baseUrl(baseUrl).build());
 * }
 * }
 * </pre>
 *
 * <p>Error responses surface as {@code WebClientResponseException}; the body is an
 * {@link com.nosota.bounty.api.response.ErrorResponse} whose {@code kind} names the failure.
 */
@RequiredArgsConstructor
@Slf4j
public class BountyClient implements BountyApi {

    private final WebClient webClient;

    // ==================== Bounties ====================

    @Override
    public ResponseEntity<BountyResponse> createBounty(CallerIdentity caller, CreateBountyRequest request) {
        log.debug("Calling createBounty: posterId={}, amount={}, isForHonor={}",
                caller.userId(), request.amount(), request.isForHonor());

        return webClient.post()
                .uri("/api/v1/bounties")
                .headers(CallerHeaders.of(caller))
                .bodyValue(request)
                .retrieve()
                .toEntity(BountyResponse.class)
                .block();
    }

    @Override
    public ResponseEntity<BountyResponse> getBounty(UUID bountyId) {
        log.debug("Calling getBounty: bountyId={}", bountyId);

        return webClient.get()
                .uri("/api/v1/bounties/{bountyId}", bountyId)
                .retrieve()
                .toEntity(BountyResponse.class)
                .block();
    }

    @Override
    public ResponseEntity<BountyResponse> cancelBounty(CallerIdentity caller, UUID bountyId) {
        log.debug("Calling cancelBounty: bountyId={}, callerId={}", bountyId, caller.userId());

        return webClient.post()
                .uri("/api/v1/bounties/{bountyId}/cancel", bountyId)
                .headers(CallerHeaders.of(caller))
                .retrieve()
                .toEntity(BountyResponse.class)
                .block();
    }

    @Override
    public ResponseEntity<List<WalletTransactionResponse>> getEscrowTransactions(UUID bountyId) {
        log.debug("Calling getEscrowTransactions: bountyId={}", bountyId);

        return webClient.get()
                .uri("/api/v1/bounties/{bountyId}/escrow", bountyId)
                .retrieve()
                .toEntity(new ParameterizedTypeReference<List<WalletTransactionResponse>>() {})
                .block();
    }

    // ==================== Applications ====================

    @Override
    public ResponseEntity<BountyRequestResponse> apply(CallerIdentity caller, UUID bountyId) {
        log.debug("Calling apply: bountyId={}, hunterId={}", bountyId, caller.userId());

        return webClient.post()
                .uri("/api/v1/bounties/{bountyId}/requests", bountyId)
                .headers(CallerHeaders.of(caller))
                .retrieve()
                .toEntity(BountyRequestResponse.class)
                .block();
    }

    @Override
    public ResponseEntity<List<BountyRequestResponse>> listRequestsForBounty(UUID bountyId) {
        log.debug("Calling listRequestsForBounty: bountyId={}", bountyId);

        return webClient.get()
                .uri("/api/v1/bounties/{bountyId}/requests", bountyId)
                .retrieve()
                .toEntity(new ParameterizedTypeReference<List<BountyRequestResponse>>() {})
                .block();
    }

    @Override
    public ResponseEntity<List<BountyRequestResponse>> listRequestsForHunter(UUID hunterId) {
        log.debug("Calling listRequestsForHunter: hunterId={}", hunterId);

        return webClient.get()
                .uri("/api/v1/hunters/{hunterId}/requests", hunterId)
                .retrieve()
                .toEntity(new ParameterizedTypeReference<List<BountyRequestResponse>>() {})
                .block();
    }

    @Override
    public ResponseEntity<BountyResponse> acceptRequest(CallerIdentity caller, UUID bountyId, UUID requestId) {
        log.debug("Calling acceptRequest: bountyId={}, requestId={}", bountyId, requestId);

        return webClient.post()
                .uri("/api/v1/bounties/{bountyId}/requests/{requestId}/accept", bountyId, requestId)
                .headers(CallerHeaders.of(caller))
                .retrieve()
                .toEntity(BountyResponse.class)
                .block();
    }

    @Override
    public ResponseEntity<BountyRequestResponse> rejectRequest(CallerIdentity caller, UUID bountyId, UUID requestId) {
        log.debug("Calling rejectRequest: bountyId={}, requestId={}", bountyId, requestId);

        return webClient.post()
                .uri("/api/v1/bounties/{bountyId}/requests/{requestId}/reject", bountyId, requestId)
                .headers(CallerHeaders.of(caller))
                .retrieve()
                .toEntity(BountyRequestResponse.class)
                .block();
    }

    // ==================== Completion ====================

    @Override
    public ResponseEntity<SubmissionResponse> submitCompletion(CallerIdentity caller, UUID bountyId,
                                                               SubmitCompletionRequest request) {
        log.debug("Calling submitCompletion: bountyId={}, proofItems={}", bountyId, request.proofItems().size());

        return webClient.post()
                .uri("/api/v1/bounties/{bountyId}/submissions", bountyId)
                .headers(CallerHeaders.of(caller))
                .bodyValue(request)
                .retrieve()
                .toEntity(SubmissionResponse.class)
                .block();
    }

    @Override
    public ResponseEntity<List<SubmissionResponse>> listSubmissions(UUID bountyId) {
        log.debug("Calling listSubmissions: bountyId={}", bountyId);

        return webClient.get()
                .uri("/api/v1/bounties/{bountyId}/submissions", bountyId)
                .retrieve()
                .toEntity(new ParameterizedTypeReference<List<SubmissionResponse>>() {})
                .block();
    }

    @Override
    public ResponseEntity<BountyResponse> approveCompletion(CallerIdentity caller, UUID bountyId) {
        log.debug("Calling approveCompletion: bountyId={}", bountyId);

        return webClient.post()
                .uri("/api/v1/bounties/{bountyId}/approve", bountyId)
                .headers(CallerHeaders.of(caller))
                .retrieve()
                .toEntity(BountyResponse.class)
                .block();
    }

    @Override
    public ResponseEntity<SubmissionResponse> requestRevision(CallerIdentity caller, UUID bountyId,
                                                              RevisionRequest request) {
        log.debug("Calling requestRevision: bountyId={}", bountyId);

        return webClient.post()
                .uri("/api/v1/bounties/{bountyId}/revision", bountyId)
                .headers(CallerHeaders.of(caller))
                .bodyValue(request)
                .retrieve()
                .toEntity(SubmissionResponse.class)
                .block();
    }

    // ==================== Disputes ====================

    @Override
    public ResponseEntity<DisputeResponse> openDispute(CallerIdentity caller, UUID bountyId,
                                                       OpenDisputeRequest request) {
        log.debug("Calling openDispute: bountyId={}", bountyId);

        return webClient.post()
                .uri("/api/v1/bounties/{bountyId}/disputes", bountyId)
                .headers(CallerHeaders.of(caller))
                .bodyValue(request)
                .retrieve()
                .toEntity(DisputeResponse.class)
                .block();
    }

    @Override
    public ResponseEntity<DisputeResponse> getDispute(UUID disputeId) {
        log.debug("Calling getDispute: disputeId={}", disputeId);

        return webClient.get()
                .uri("/api/v1/disputes/{disputeId}", disputeId)
                .retrieve()
                .toEntity(DisputeResponse.class)
                .block();
    }

    @Override
    public ResponseEntity<DisputeResponse> resolveDispute(CallerIdentity caller, UUID disputeId,
                                                          ResolveDisputeRequest request) {
        log.debug("Calling resolveDispute: disputeId={}, resolution={}", disputeId, request.resolution());

        return webClient.post()
                .uri("/api/v1/disputes/{disputeId}/resolve", disputeId)
                .headers(CallerHeaders.of(caller))
                .bodyValue(request)
                .retrieve()
                .toEntity(DisputeResponse.class)
                .block();
    }

    // ==================== Cancellation requests ====================

    @Override
    public ResponseEntity<CancellationResponse> requestCancellation(CallerIdentity caller, UUID bountyId,
                                                                    OpenCancellationRequest request) {
        log.debug("Calling requestCancellation: bountyId={}", bountyId);

        return webClient.post()
                .uri("/api/v1/bounties/{bountyId}/cancellations", bountyId)
                .headers(CallerHeaders.of(caller))
                .bodyValue(request)
                .retrieve()
                .toEntity(CancellationResponse.class)
                .block();
    }

    @Override
    public ResponseEntity<List<CancellationResponse>> listCancellations(UUID bountyId) {
        log.debug("Calling listCancellations: bountyId={}", bountyId);

        return webClient.get()
                .uri("/api/v1/bounties/{bountyId}/cancellations", bountyId)
                .retrieve()
                .toEntity(new ParameterizedTypeReference<List<CancellationResponse>>() {})
                .block();
    }

    @Override
    public ResponseEntity<CancellationResponse> getCancellation(UUID cancellationId) {
        log.debug("Calling getCancellation: cancellationId={}", cancellationId);

        return webClient.get()
                .uri("/api/v1/cancellations/{cancellationId}", cancellationId)
                .retrieve()
                .toEntity(CancellationResponse.class)
                .block();
    }

    @Override
    public ResponseEntity<CancellationResponse> acceptCancellation(CallerIdentity caller, UUID cancellationId,
                                                                   RespondCancellationRequest request) {
        log.debug("Calling acceptCancellation: cancellationId={}", cancellationId);

        return webClient.post()
                .uri("/api/v1/cancellations/{cancellationId}/accept", cancellationId)
                .headers(CallerHeaders.of(caller))
                .bodyValue(request)
                .retrieve()
                .toEntity(CancellationResponse.class)
                .block();
    }

    @Override
    public ResponseEntity<CancellationResponse> rejectCancellation(CallerIdentity caller, UUID cancellationId,
                                                                   RespondCancellationRequest request) {
        log.debug("Calling rejectCancellation: cancellationId={}", cancellationId);

        return webClient.post()
                .uri("/api/v1/cancellations/{cancellationId}/reject", cancellationId)
                .headers(CallerHeaders.of(caller))
                .bodyValue(request)
                .retrieve()
                .toEntity(CancellationResponse.class)
                .block();
    }

    // ==================== Ratings ====================

    @Override
    public ResponseEntity<RatingResponse> rate(CallerIdentity caller, UUID bountyId, RatingRequest request) {
        log.debug("Calling rate: bountyId={}, rating={}", bountyId, request.rating());

        return webClient.post()
                .uri("/api/v1/bounties/{bountyId}/ratings", bountyId)
                .headers(CallerHeaders.of(caller))
                .bodyValue(request)
                .retrieve()
                .toEntity(RatingResponse.class)
                .block();
    }

    @Override
    public ResponseEntity<List<RatingResponse>> listRatings(UUID bountyId) {
        log.debug("Calling listRatings: bountyId={}", bountyId);

        return webClient.get()
                .uri("/api/v1/bounties/{bountyId}/ratings", bountyId)
                .retrieve()
                .toEntity(new ParameterizedTypeReference<List<RatingResponse>>() {})
                .block();
    }
}
