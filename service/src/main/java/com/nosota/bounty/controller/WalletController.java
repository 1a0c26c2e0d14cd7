package com.nosota.bounty.controller;

import com.nosota.bounty.api.WalletApi;
import com.nosota.bounty.api.dto.PagedResponse;
import com.nosota.bounty.api.model.CallerIdentity;
import com.nosota.bounty.api.request.DepositRequest;
import com.nosota.bounty.api.request.WithdrawalRequest;
import com.nosota.bounty.api.response.BalanceResponse;
import com.nosota.bounty.api.response.WalletTransactionResponse;
import com.nosota.bounty.mapper.BountyMapper;
import com.nosota.bounty.model.WalletTransaction;
import com.nosota.bounty.service.WalletService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.Page;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.RestController;

/**
 * REST controller for the caller's own wallet.
 */
@RestController
@Validated
@RequiredArgsConstructor
@Slf4j
public class WalletController implements WalletApi {

    private final WalletService walletService;

    private final BountyMapper mapper = BountyMapper.INSTANCE;

    @Override
    public ResponseEntity<WalletTransactionResponse> deposit(CallerIdentity caller, DepositRequest request) {
        WalletTransaction transaction = walletService.deposit(caller.userId(), request.amount(), request.externalReference());
        return ResponseEntity.status(HttpStatus.CREATED).body(mapper.toResponse(transaction));
    }

    @Override
    public ResponseEntity<WalletTransactionResponse> withdraw(CallerIdentity caller, WithdrawalRequest request) {
        WalletTransaction transaction = walletService.withdraw(caller.userId(), request.amount(), request.destinationAccount());
        return ResponseEntity.status(HttpStatus.CREATED).body(mapper.toResponse(transaction));
    }

    @Override
    public ResponseEntity<BalanceResponse> getBalance(CallerIdentity caller) {
        log.debug("Getting balance: userId={}", caller.userId());
        return ResponseEntity.ok(new BalanceResponse(
                caller.userId(),
                walletService.getBalance(caller.userId()),
                walletService.getHeldAmount(caller.userId())
        ));
    }

    @Override
    public ResponseEntity<PagedResponse<WalletTransactionResponse>> getTransactions(CallerIdentity caller, int page, int size) {
        log.debug("Getting wallet history: userId={}, page={}, size={}", caller.userId(), page, size);

        Page<WalletTransaction> history = walletService.getHistory(caller.userId(), page, size);
        return ResponseEntity.ok(PagedResponse.of(
                mapper.toTransactionResponses(history.getContent()),
                page,
                size,
                history.getTotalElements()
        ));
    }
}
