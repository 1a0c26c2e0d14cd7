package com.nosota.bounty.api;

import com.nosota.bounty.api.dto.PagedResponse;
import com.nosota.bounty.api.model.CallerIdentity;
import com.nosota.bounty.api.request.DepositRequest;
import com.nosota.bounty.api.request.WithdrawalRequest;
import com.nosota.bounty.api.response.BalanceResponse;
import com.nosota.bounty.api.response.WalletTransactionResponse;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.ParameterizedTypeReference;
import org.springframework.http.ResponseEntity;
import org.springframework.web.reactive.function.client.WebClient;

/**
 * WebClient-based implementation of {@link WalletApi}. Not a Spring component, see {@link BountyClient}.
 */
@RequiredArgsConstructor
@Slf4j
public class WalletClient implements WalletApi {

    private final WebClient webClient;

    @Override
    public ResponseEntity<WalletTransactionResponse> deposit(CallerIdentity caller, DepositRequest request) {
        log.debug("Calling deposit: userId={}, amount={}, externalReference={}",
                caller.userId(), request.amount(), request.externalReference());

        return webClient.post()
                .uri("/api/v1/wallet/deposit")
                .headers(CallerHeaders.of(caller))
                .bodyValue(request)
                .retrieve()
                .toEntity(WalletTransactionResponse.class)
                .block();
    }

    @Override
    public ResponseEntity<WalletTransactionResponse> withdraw(CallerIdentity caller, WithdrawalRequest request) {
        log.debug("Calling withdraw: userId={}, amount={}", caller.userId(), request.amount());

        return webClient.post()
                .uri("/api/v1/wallet/withdraw")
                .headers(CallerHeaders.of(caller))
                .bodyValue(request)
                .retrieve()
                .toEntity(WalletTransactionResponse.class)
                .block();
    }

    @Override
    public ResponseEntity<BalanceResponse> getBalance(CallerIdentity caller) {
        log.debug("Calling getBalance: userId={}", caller.userId());

        return webClient.get()
                .uri("/api/v1/wallet/balance")
                .headers(CallerHeaders.of(caller))
                .retrieve()
                .toEntity(BalanceResponse.class)
                .block();
    }

    @Override
    public ResponseEntity<PagedResponse<WalletTransactionResponse>> getTransactions(
            CallerIdentity caller, int page, int size) {
        log.debug("Calling getTransactions: userId={}, page={}, size={}", caller.userId(), page, size);

        return webClient.get()
                .uri(uriBuilder -> uriBuilder
                        .path("/api/v1/wallet/transactions")
                        .queryParam("page", page)
                        .queryParam("size", size)
                        .build())
                .headers(CallerHeaders.of(caller))
                .retrieve()
                .toEntity(new ParameterizedTypeReference<PagedResponse<WalletTransactionResponse>>() {})
                .block();
    }
}
