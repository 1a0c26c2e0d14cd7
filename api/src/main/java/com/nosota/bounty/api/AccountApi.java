package com.nosota.bounty.api;

import com.nosota.bounty.api.model.CallerIdentity;
import com.nosota.bounty.api.request.RegisterAccountRequest;
import com.nosota.bounty.api.response.AccountResponse;
import com.nosota.bounty.api.response.DeletionReportResponse;
import jakarta.validation.Valid;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;

import java.util.UUID;

/**
 * Account lifecycle API.
 *
 * <p>Deleting an account runs the deletion cascade: posted bounties are archived with escrow refunded,
 * bounties the user was working on are reopened, pending applications are rejected and personal
 * records are removed. Audit records are kept with the user reference cleared.
 */
@RequestMapping("/api/v1/accounts")
public interface AccountApi {

    @PostMapping
    ResponseEntity<AccountResponse> register(
            @RequestBody @Valid RegisterAccountRequest request);

    /**
     * Deletes an account. Allowed for the account owner and for admins; repeated calls are no-ops.
     */
    @DeleteMapping("/{userId}")
    ResponseEntity<DeletionReportResponse> deleteAccount(
            CallerIdentity caller,
            @PathVariable("userId") UUID userId);
}
