package com.nosota.bounty.service;

import com.nosota.bounty.api.model.BountyStatus;
import com.nosota.bounty.api.model.DisputeResolution;
import com.nosota.bounty.api.model.RequestStatus;
import com.nosota.bounty.model.Bounty;
import com.nosota.bounty.repository.BountyCancellationRepository;
import com.nosota.bounty.repository.BountyRepository;
import com.nosota.bounty.repository.BountyRequestRepository;
import com.nosota.bounty.repository.CompletionSubmissionRepository;
import com.nosota.bounty.repository.DisputeRepository;
import com.nosota.bounty.repository.PaymentMethodRepository;
import com.nosota.bounty.repository.ProfileRepository;
import com.nosota.bounty.repository.RatingRepository;
import com.nosota.bounty.repository.SkillRepository;
import com.nosota.bounty.repository.UserMessageRepository;
import com.nosota.bounty.repository.WalletRepository;
import com.nosota.bounty.repository.WalletTransactionRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDateTime;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;
import java.util.UUID;

/**
 * Removes a user account without orphaning money or work.
 *
 * <p>Before anything is written, every bounty that references the user (as poster, as accepted hunter or
 * through a pending application) is locked in one query ordered by id. Steps 1 to 3 work only on that set,
 * so a concurrent acceptance either finishes first and is seen here, or waits and then finds its request
 * already rejected. Wallet rows are locked later, by the escrow refunds, which keeps the bounty-then-wallet
 * order every other operation uses.
 *
 * <p>Steps, in order, all in one transaction:
 * <ol>
 *   <li>Bounties the user posted that are OPEN or IN_PROGRESS: open dispute closed as REFUND_TO_POSTER,
 *       held escrow refunded, pending applications rejected, status ARCHIVED, poster dropped.</li>
 *   <li>Bounties the user was working on (IN_PROGRESS): open dispute voided, accepted request rejected,
 *       pending submission sent back, pending cancellation request closed, status OPEN again.
 *       Escrow stays held for the next hunter.</li>
 *   <li>The user's pending applications: REJECTED, hunter dropped.</li>
 *   <li>Every remaining reference to the user set to null (the accepted hunter only on settled bounties);
 *       messages, skills and payment methods deleted; profile deleted.</li>
 * </ol>
 *
 * <p>Any failure (a refund that cannot be paid, for instance) rolls back the whole cascade. Running it again
 * for an already deleted user finds nothing to change.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class DeletionCascadeService {

    private static final Set<BountyStatus> WITHDRAWABLE = EnumSet.of(BountyStatus.OPEN, BountyStatus.IN_PROGRESS);

    private static final Set<BountyStatus> SETTLED =
            EnumSet.of(BountyStatus.COMPLETED, BountyStatus.CANCELLED, BountyStatus.ARCHIVED);

    private final BountyRepository bountyRepository;
    private final BountyRequestRepository bountyRequestRepository;
    private final CompletionSubmissionRepository submissionRepository;
    private final WalletTransactionRepository walletTransactionRepository;
    private final WalletRepository walletRepository;
    private final DisputeRepository disputeRepository;
    private final RatingRepository ratingRepository;
    private final UserMessageRepository userMessageRepository;
    private final SkillRepository skillRepository;
    private final PaymentMethodRepository paymentMethodRepository;
    private final ProfileRepository profileRepository;
    private final BountyCancellationRepository cancellationRepository;
    private final BountyRequestService bountyRequestService;
    private final BountyLifecycleService bountyLifecycleService;
    private final DisputeService disputeService;

    @Transactional
    public DeletionReport deleteUser(UUID userId) {
        log.info("Starting account deletion cascade: userId={}", userId);

        // all bounty locks first, in id order, before any wallet is touched
        List<Bounty> locked = bountyRepository.findReferencingUserForUpdate(userId, RequestStatus.PENDING);
        log.debug("Bounties locked for deletion cascade: userId={}, count={}", userId, locked.size());

        // 1. posted bounties
        int archived = 0;
        int refunded = 0;
        for (Bounty bounty : locked) {
            if (userId.equals(bounty.getPosterId()) && WITHDRAWABLE.contains(bounty.getStatus())) {
                disputeService.closeForRemovedAccount(bounty.getId(), DisputeResolution.REFUND_TO_POSTER);
                if (bountyLifecycleService.archiveForRemovedPoster(bounty)) {
                    refunded++;
                }
                archived++;
            }
        }

        // 2. bounties being worked on
        int reopened = 0;
        for (Bounty bounty : locked) {
            if (userId.equals(bounty.getAcceptedHunterId()) && bounty.getStatus() == BountyStatus.IN_PROGRESS) {
                disputeService.closeForRemovedAccount(bounty.getId(), DisputeResolution.VOID);
                bountyLifecycleService.reopenForRemovedHunter(bounty);
                reopened++;
            }
        }

        // 3. pending applications
        int rejected = 0;
        for (Bounty bounty : locked) {
            rejected += bountyRequestService.rejectPendingOfRemovedHunter(bounty.getId(), userId);
        }
        // applications filed on bounties outside the locked set after it was read
        rejected += bountyRequestRepository.rejectPendingOf(userId, RequestStatus.PENDING, RequestStatus.REJECTED,
                LocalDateTime.now());

        // 4. remaining references and personal data
        bountyRepository.clearPoster(userId);
        bountyRepository.clearAcceptedHunter(userId, SETTLED);
        bountyRequestRepository.clearHunter(userId);
        submissionRepository.clearHunter(userId);
        walletTransactionRepository.clearUser(userId);
        walletRepository.clearOwner(userId);
        disputeRepository.clearInitiator(userId);
        disputeRepository.clearResolver(userId);
        cancellationRepository.clearRequester(userId);
        cancellationRepository.clearResponder(userId);
        ratingRepository.clearAuthor(userId);
        ratingRepository.clearSubject(userId);

        int personal = userMessageRepository.deleteAllOwnedBy(userId)
                + skillRepository.deleteAllOwnedBy(userId)
                + paymentMethodRepository.deleteAllOwnedBy(userId);

        boolean profileDeleted = profileRepository.existsById(userId);
        if (profileDeleted) {
            profileRepository.deleteById(userId);
        }

        DeletionReport report = new DeletionReport(userId, archived, refunded, reopened, rejected,
                personal, profileDeleted);
        log.info("Account deletion cascade finished: userId={}, archived={}, refunded={}, reopened={}, " +
                        "rejectedRequests={}, personalRecords={}, profileDeleted={}",
                userId, report.archivedBounties(), report.refundedEscrows(), report.reopenedBounties(),
                report.rejectedRequests(), report.deletedPersonalRecords(), report.profileDeleted());
        return report;
    }
}
