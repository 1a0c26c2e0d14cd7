package com.nosota.bounty.controller;

import com.nosota.bounty.api.AccountApi;
import com.nosota.bounty.api.model.CallerIdentity;
import com.nosota.bounty.api.request.RegisterAccountRequest;
import com.nosota.bounty.api.response.AccountResponse;
import com.nosota.bounty.api.response.DeletionReportResponse;
import com.nosota.bounty.mapper.BountyMapper;
import com.nosota.bounty.service.AccountService;
import com.nosota.bounty.service.DeletionReport;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.RestController;

import java.util.UUID;

@RestController
@Validated
@RequiredArgsConstructor
@Slf4j
public class AccountController implements AccountApi {

    private final AccountService accountService;

    private final BountyMapper mapper = BountyMapper.INSTANCE;

    @Override
    public ResponseEntity<AccountResponse> register(RegisterAccountRequest request) {
        AccountResponse response = mapper.toResponse(accountService.register(request.userId(), request.displayName()));
        return ResponseEntity.status(HttpStatus.CREATED).body(response);
    }

    @Override
    public ResponseEntity<DeletionReportResponse> deleteAccount(CallerIdentity caller, UUID userId) {
        log.info("Deleting account: userId={}, requestedBy={}", userId, caller.userId());

        DeletionReport report = accountService.deleteAccount(caller, userId);
        return ResponseEntity.ok(mapper.toResponse(report));
    }
}
