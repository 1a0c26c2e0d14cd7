package com.nosota.bounty.api;

import com.nosota.bounty.api.dto.PagedResponse;
import com.nosota.bounty.api.model.CallerIdentity;
import com.nosota.bounty.api.request.DepositRequest;
import com.nosota.bounty.api.request.WithdrawalRequest;
import com.nosota.bounty.api.response.BalanceResponse;
import com.nosota.bounty.api.response.WalletTransactionResponse;
import jakarta.validation.Valid;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;

import java.util.UUID;

/**
 * Wallet API: funding, payouts and balance history of the caller's own wallet.
 *
 * <p>Implemented by WalletController (service module) and {@link WalletClient}.
 */
@RequestMapping("/api/v1/wallet")
public interface WalletApi {

    @PostMapping("/deposit")
    ResponseEntity<WalletTransactionResponse> deposit(
            CallerIdentity caller,
            @RequestBody @Valid DepositRequest request);

    @PostMapping("/withdraw")
    ResponseEntity<WalletTransactionResponse> withdraw(
            CallerIdentity caller,
            @RequestBody @Valid WithdrawalRequest request);

    @GetMapping("/balance")
    ResponseEntity<BalanceResponse> getBalance(
            CallerIdentity caller);

    /**
     * Gets wallet history with pagination, newest first.
     *
     * @param page Page number (0-indexed)
     * @param size Page size
     */
    @GetMapping("/transactions")
    ResponseEntity<PagedResponse<WalletTransactionResponse>> getTransactions(
            CallerIdentity caller,
            @RequestParam(name = "page", defaultValue = "0") int page,
            @RequestParam(name = "size", defaultValue = "20") int size);
}
