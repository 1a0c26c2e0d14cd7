package com.nosota.bounty.api;

import com.nosota.bounty.api.model.CallerIdentity;
import com.nosota.bounty.api.request.RegisterAccountRequest;
import com.nosota.bounty.api.response.AccountResponse;
import com.nosota.bounty.api.response.DeletionReportResponse;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.reactive.function.client.WebClient;

import java.util.UUID;

/**
 * WebClient-based implementation of {@link AccountApi}. Not a Spring component, see {@link BountyClient}.
 */
@RequiredArgsConstructor
@Slf4j
public class AccountClient implements AccountApi {

    private final WebClient webClient;

    @Override
    public ResponseEntity<AccountResponse> register(RegisterAccountRequest request) {
        log.debug("Calling register: userId={}", request.userId());

        return webClient.post()
                .uri("/api/v1/accounts")
                .bodyValue(request)
                .retrieve()
                .toEntity(AccountResponse.class)
                .block();
    }

    @Override
    public ResponseEntity<DeletionReportResponse> deleteAccount(CallerIdentity caller, UUID userId) {
        log.debug("Calling deleteAccount: userId={}", userId);

        return webClient.delete()
                .uri("/api/v1/accounts/{userId}", userId)
                .headers(CallerHeaders.of(caller))
                .retrieve()
                .toEntity(DeletionReportResponse.class)
                .block();
    }
}
