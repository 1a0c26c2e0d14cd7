package com.nosota.bounty.tests;

import com.nosota.bounty.TestBase;
import com.nosota.bounty.api.model.BountyStatus;
import com.nosota.bounty.api.model.CallerIdentity;
import com.nosota.bounty.api.model.DisputeResolution;
import com.nosota.bounty.api.model.DisputeStatus;
import com.nosota.bounty.api.model.LifecycleErrorKind;
import com.nosota.bounty.api.model.RequestStatus;
import com.nosota.bounty.api.model.SubmissionStatus;
import com.nosota.bounty.api.model.WalletTransactionStatus;
import com.nosota.bounty.api.model.WalletTransactionType;
import com.nosota.bounty.api.response.DeletionReportResponse;
import com.nosota.bounty.model.Bounty;
import com.nosota.bounty.model.BountyRequest;
import com.nosota.bounty.model.CompletionSubmission;
import com.nosota.bounty.model.Dispute;
import com.nosota.bounty.model.PaymentMethod;
import com.nosota.bounty.model.Skill;
import com.nosota.bounty.model.UserMessage;
import com.nosota.bounty.model.Wallet;
import com.nosota.bounty.model.WalletTransaction;
import com.nosota.bounty.repository.PaymentMethodRepository;
import com.nosota.bounty.repository.ProfileRepository;
import com.nosota.bounty.repository.SkillRepository;
import com.nosota.bounty.repository.UserMessageRepository;
import com.nosota.bounty.repository.WalletRepository;
import com.nosota.bounty.service.DeletionCascadeService;
import com.nosota.bounty.service.DeletionReport;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.test.web.servlet.MvcResult;

import java.time.LocalDateTime;
import java.util.List;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.delete;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

/**
 * Integration tests for the account deletion cascade.
 *
 * <ul>
 *   <li>DEL-001: poster deleted while work is in progress, escrow refunded, bounty archived</li>
 *   <li>DEL-002: accepted hunter deleted, bounty reopened with escrow still held</li>
 *   <li>DEL-003: running the cascade twice changes nothing the second time</li>
 *   <li>DEL-004: pending applications and personal records</li>
 *   <li>DEL-005: open disputes are closed by the cascade</li>
 * </ul>
 */
@DisplayName("Account Deletion Tests")
public class AccountDeletionTest extends TestBase {

    @Autowired
    private DeletionCascadeService deletionCascadeService;

    @Autowired
    private WalletRepository walletRepository;

    @Autowired
    private ProfileRepository profileRepository;

    @Autowired
    private UserMessageRepository userMessageRepository;

    @Autowired
    private SkillRepository skillRepository;

    @Autowired
    private PaymentMethodRepository paymentMethodRepository;

    @Test
    @DisplayName("DEL-001: poster deleted with $40 in escrow, refund kept on the orphaned wallet")
    void testPosterDeletedRefundsEscrow() throws Exception {
        UUID posterId = registerFundedUser("Poster", "40.00");
        UUID hunterId = registerUser("Hunter");
        UUID applicant = registerUser("Applicant");

        Bounty working = startWork(posterId, hunterId, "40.00");
        Bounty open = postHonorBounty(posterId);
        BountyRequest pending = apply(applicant, open.getId());
        UUID walletId = walletRepository.findByOwnerId(posterId).orElseThrow().getId();

        MvcResult result = mockMvc.perform(as(posterId, delete("/api/v1/accounts/{userId}", posterId)))
                .andExpect(status().isOk())
                .andReturn();
        DeletionReportResponse report = objectMapper.readValue(
                result.getResponse().getContentAsString(), DeletionReportResponse.class);

        assertThat(report.archivedBounties()).isEqualTo(2);
        assertThat(report.refundedEscrows()).isEqualTo(1);
        assertThat(report.profileDeleted()).isTrue();

        Bounty archived = reload(working.getId());
        assertThat(archived.getStatus()).isEqualTo(BountyStatus.ARCHIVED);
        assertThat(archived.getPosterId()).isNull();
        assertThat(archived.getAcceptedHunterId()).isNull();

        assertThat(reload(open.getId()).getStatus()).isEqualTo(BountyStatus.ARCHIVED);
        assertThat(bountyRequestRepository.findById(pending.getId()).orElseThrow().getStatus())
                .isEqualTo(RequestStatus.REJECTED);

        List<WalletTransaction> rows = escrowLedgerService.getEscrowTransactions(working.getId());
        assertThat(rows).extracting(WalletTransaction::getType)
                .containsExactly(WalletTransactionType.ESCROW, WalletTransactionType.REFUND);
        assertThat(rows).extracting(WalletTransaction::getStatus)
                .containsOnly(WalletTransactionStatus.COMPLETED);
        assertThat(rows).extracting(WalletTransaction::getUserId).containsOnlyNulls();

        Wallet orphaned = walletRepository.findById(walletId).orElseThrow();
        assertThat(orphaned.getOwnerId()).isNull();
        assertThat(orphaned.getBalance()).isEqualByComparingTo("40.00");

        assertThat(balanceOf(hunterId)).isEqualByComparingTo("0.00");
        assertThat(profileRepository.existsById(posterId)).isFalse();
    }

    @Test
    @DisplayName("DEL-002: hunter deleted, bounty reopens and the next hunter is paid from the same hold")
    void testHunterDeletedReopensBounty() {
        UUID posterId = registerFundedUser("Poster", "100.00");
        UUID hunterId = registerUser("Hunter");
        UUID nextHunter = registerUser("Next hunter");

        Bounty bounty = startWork(posterId, hunterId, "20.00");
        CompletionSubmission submission = submit(hunterId, bounty.getId());
        assertThat(balanceOf(posterId)).isEqualByComparingTo("80.00");

        DeletionReport report = accountService.deleteAccount(CallerIdentity.unverified(hunterId), hunterId);
        assertThat(report.reopenedBounties()).isEqualTo(1);
        assertThat(report.refundedEscrows()).isZero();

        Bounty reopened = reload(bounty.getId());
        assertThat(reopened.getStatus()).isEqualTo(BountyStatus.OPEN);
        assertThat(reopened.getAcceptedHunterId()).isNull();
        assertThat(escrowLedgerService.findPendingEscrow(bounty.getId())).isPresent();
        assertThat(balanceOf(posterId)).isEqualByComparingTo("80.00");

        CompletionSubmission sentBack = completionWorkflowService.listForBounty(bounty.getId()).get(0);
        assertThat(sentBack.getId()).isEqualTo(submission.getId());
        assertThat(sentBack.getStatus()).isEqualTo(SubmissionStatus.REVISION_REQUESTED);
        assertThat(sentBack.getHunterId()).isNull();

        // The next hunter is accepted without a second debit and paid from the carried-over hold
        BountyRequest request = apply(nextHunter, bounty.getId());
        bountyLifecycleService.acceptRequest(CallerIdentity.verified(posterId), bounty.getId(), request.getId());
        assertThat(balanceOf(posterId)).isEqualByComparingTo("80.00");

        submit(nextHunter, bounty.getId());
        bountyLifecycleService.approveCompletion(CallerIdentity.verified(posterId), bounty.getId());

        assertThat(balanceOf(nextHunter)).isEqualByComparingTo("20.00");
        assertThat(escrowLedgerService.getEscrowTransactions(bounty.getId()))
                .extracting(WalletTransaction::getType)
                .containsExactly(WalletTransactionType.ESCROW, WalletTransactionType.RELEASE);
    }

    @Test
    @DisplayName("DEL-003: second cascade run is a no-op")
    void testCascadeIsIdempotent() {
        UUID posterId = registerFundedUser("Poster", "40.00");
        UUID hunterId = registerUser("Hunter");
        Bounty bounty = startWork(posterId, hunterId, "40.00");

        DeletionReport first = deletionCascadeService.deleteUser(posterId);
        assertThat(first.archivedBounties()).isEqualTo(1);
        assertThat(first.profileDeleted()).isTrue();

        DeletionReport second = deletionCascadeService.deleteUser(posterId);
        assertThat(second).isEqualTo(new DeletionReport(posterId, 0, 0, 0, 0, 0, false));

        assertThat(escrowLedgerService.getEscrowTransactions(bounty.getId())).hasSize(2);
        assertThat(reload(bounty.getId()).getStatus()).isEqualTo(BountyStatus.ARCHIVED);
    }

    @Test
    @DisplayName("DEL-004: pending applications rejected, personal records removed, history kept")
    void testApplicationsAndPersonalRecords() {
        UUID posterId = registerUser("Poster");
        UUID hunterId = registerUser("Hunter");
        Bounty bounty = postHonorBounty(posterId);
        BountyRequest request = apply(hunterId, bounty.getId());

        LocalDateTime now = LocalDateTime.now();
        UserMessage message = new UserMessage();
        message.setUserId(hunterId);
        message.setBountyId(bounty.getId());
        message.setBody("Can I start tomorrow?");
        message.setCreatedAt(now);
        userMessageRepository.save(message);
        Skill skill = new Skill();
        skill.setUserId(hunterId);
        skill.setName("Carpentry");
        skill.setCreatedAt(now);
        skillRepository.save(skill);
        PaymentMethod paymentMethod = new PaymentMethod();
        paymentMethod.setUserId(hunterId);
        paymentMethod.setLabel("Visa *4242");
        paymentMethod.setCreatedAt(now);
        paymentMethodRepository.save(paymentMethod);

        DeletionReport report = deletionCascadeService.deleteUser(hunterId);

        assertThat(report.rejectedRequests()).isEqualTo(1);
        assertThat(report.deletedPersonalRecords()).isEqualTo(3);
        assertThat(userMessageRepository.countByUserId(hunterId)).isZero();
        assertThat(skillRepository.countByUserId(hunterId)).isZero();
        assertThat(paymentMethodRepository.countByUserId(hunterId)).isZero();

        BountyRequest rejected = bountyRequestRepository.findById(request.getId()).orElseThrow();
        assertThat(rejected.getStatus()).isEqualTo(RequestStatus.REJECTED);
        assertThat(rejected.getHunterId()).isNull();
        assertThat(reload(bounty.getId()).getStatus()).isEqualTo(BountyStatus.OPEN);
    }

    @Test
    @DisplayName("DEL-005: open disputes are closed, refund for a deleted poster, void for a deleted hunter")
    void testOpenDisputesClosed() {
        UUID posterId = registerFundedUser("Poster", "50.00");
        UUID hunterA = registerUser("Hunter A");
        UUID hunterB = registerUser("Hunter B");
        UUID otherPoster = registerFundedUser("Other poster", "30.00");

        Bounty posted = startWork(posterId, hunterA, "50.00");
        Dispute posterSide = disputeService.openDispute(CallerIdentity.verified(hunterA), posted.getId(), "No reply");
        Bounty worked = startWork(otherPoster, hunterB, "30.00");
        Dispute hunterSide = disputeService.openDispute(CallerIdentity.verified(otherPoster), worked.getId(), "Wrong work");

        deletionCascadeService.deleteUser(posterId);
        deletionCascadeService.deleteUser(hunterB);

        Dispute first = disputeService.getDispute(posterSide.getId());
        assertThat(first.getStatus()).isEqualTo(DisputeStatus.RESOLVED);
        assertThat(first.getResolution()).isEqualTo(DisputeResolution.REFUND_TO_POSTER);
        assertThat(reload(posted.getId()).getStatus()).isEqualTo(BountyStatus.ARCHIVED);

        Dispute second = disputeService.getDispute(hunterSide.getId());
        assertThat(second.getStatus()).isEqualTo(DisputeStatus.RESOLVED);
        assertThat(second.getResolution()).isEqualTo(DisputeResolution.VOID);
        assertThat(second.getInitiatorId()).isEqualTo(otherPoster);
        assertThat(reload(worked.getId()).getStatus()).isEqualTo(BountyStatus.OPEN);
        assertThat(balanceOf(otherPoster)).isEqualByComparingTo("0.00");
    }

    @Test
    @DisplayName("DEL-006: only the owner or an admin may delete an account")
    void testDeletionRequiresOwnerOrAdmin() {
        UUID userId = registerUser("User");
        UUID stranger = registerUser("Stranger");

        assertRejected(() -> accountService.deleteAccount(CallerIdentity.verified(stranger), userId),
                LifecycleErrorKind.NOT_AUTHORIZED);
        assertThat(profileRepository.existsById(userId)).isTrue();

        DeletionReport report = accountService.deleteAccount(CallerIdentity.admin(stranger), userId);
        assertThat(report.profileDeleted()).isTrue();
    }
}
