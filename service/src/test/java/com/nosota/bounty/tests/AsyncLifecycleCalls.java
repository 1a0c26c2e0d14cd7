package com.nosota.bounty.tests;

import com.nosota.bounty.api.model.CallerIdentity;
import com.nosota.bounty.model.Bounty;
import com.nosota.bounty.service.BountyLifecycleService;
import com.nosota.bounty.service.DeletionCascadeService;
import com.nosota.bounty.service.DeletionReport;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.scheduling.annotation.Async;
import org.springframework.stereotype.Service;

import java.util.UUID;
import java.util.concurrent.CompletableFuture;

/**
 * Runs lifecycle operations and account deletion on the test executor so that two of them can race
 * for the same bounty.
 * A thrown exception completes the returned future exceptionally.
 */
@Service
public class AsyncLifecycleCalls {
    @Autowired
    private BountyLifecycleService bountyLifecycleService;

    @Autowired
    private DeletionCascadeService deletionCascadeService;

    @Async("testTaskExecutor")
    public CompletableFuture<Bounty> acceptRequest(CallerIdentity caller, UUID bountyId, UUID requestId) {
        return CompletableFuture.completedFuture(bountyLifecycleService.acceptRequest(caller, bountyId, requestId));
    }

    @Async("testTaskExecutor")
    public CompletableFuture<Bounty> approveCompletion(CallerIdentity caller, UUID bountyId) {
        return CompletableFuture.completedFuture(bountyLifecycleService.approveCompletion(caller, bountyId));
    }

    @Async("testTaskExecutor")
    public CompletableFuture<DeletionReport> deleteUser(UUID userId) {
        return CompletableFuture.completedFuture(deletionCascadeService.deleteUser(userId));
    }
}
