package com.nosota.bounty.service;

import com.nosota.bounty.api.model.BountyStatus;
import com.nosota.bounty.api.model.LifecycleErrorKind;
import com.nosota.bounty.api.model.WalletTransactionStatus;
import com.nosota.bounty.api.model.WalletTransactionType;
import com.nosota.bounty.api.model.WorkType;
import com.nosota.bounty.custodian.CustodyInstruction;
import com.nosota.bounty.custodian.PaymentCustodian;
import com.nosota.bounty.error.BountyLifecycleException;
import com.nosota.bounty.error.PaymentProcessorException;
import com.nosota.bounty.model.Bounty;
import com.nosota.bounty.model.Wallet;
import com.nosota.bounty.model.WalletTransaction;
import com.nosota.bounty.repository.WalletTransactionRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.Optional;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class EscrowLedgerServiceTest {

    @Mock
    private WalletTransactionRepository walletTransactionRepository;

    @Mock
    private WalletService walletService;

    @Mock
    private PaymentCustodian paymentCustodian;

    @InjectMocks
    private EscrowLedgerService escrowLedgerService;

    private UUID posterId;
    private UUID hunterId;
    private Bounty bounty;

    @BeforeEach
    void setUp() {
        posterId = UUID.randomUUID();
        hunterId = UUID.randomUUID();

        bounty = new Bounty();
        bounty.setId(UUID.randomUUID());
        bounty.setPosterId(posterId);
        bounty.setTitle("Move boxes");
        bounty.setAmount(new BigDecimal("50.00"));
        bounty.setWorkType(WorkType.IN_PERSON);
        bounty.setStatus(BountyStatus.OPEN);
    }

    @Test
    void holdSkipsHonorBounty() {
        bounty.setForHonor(true);
        bounty.setAmount(new BigDecimal("0.00"));

        assertThat(escrowLedgerService.hold(bounty)).isNull();

        verifyNoInteractions(walletTransactionRepository, walletService, paymentCustodian);
    }

    @Test
    void holdDebitsPosterAndWritesPendingEscrow() {
        Wallet wallet = wallet(posterId, "80.00");
        when(walletTransactionRepository.findByIdempotencyKey(key(WalletTransactionType.ESCROW))).thenReturn(Optional.empty());
        when(walletService.lockWallet(posterId)).thenReturn(Optional.of(wallet));

        WalletTransaction escrow = escrowLedgerService.hold(bounty);

        verify(walletService).debit(wallet, new BigDecimal("50.00"));
        ArgumentCaptor<CustodyInstruction> instruction = ArgumentCaptor.forClass(CustodyInstruction.class);
        verify(paymentCustodian).hold(instruction.capture());
        assertThat(instruction.getValue().idempotencyKey()).isEqualTo("bounty:" + bounty.getId() + ":escrow");
        assertThat(instruction.getValue().userId()).isEqualTo(posterId);

        assertThat(escrow.getType()).isEqualTo(WalletTransactionType.ESCROW);
        assertThat(escrow.getStatus()).isEqualTo(WalletTransactionStatus.PENDING);
        assertThat(escrow.getUserId()).isEqualTo(posterId);
        assertThat(escrow.getIdempotencyKey()).isEqualTo(key(WalletTransactionType.ESCROW));
        verify(walletTransactionRepository).save(escrow);
    }

    @Test
    void holdReusesCarriedOverEscrow() {
        WalletTransaction carried = escrow(WalletTransactionStatus.PENDING);
        when(walletTransactionRepository.findByIdempotencyKey(key(WalletTransactionType.ESCROW))).thenReturn(Optional.of(carried));

        assertThat(escrowLedgerService.hold(bounty)).isSameAs(carried);

        verifyNoInteractions(walletService, paymentCustodian);
    }

    @Test
    void holdWithoutWalletIsInsufficientBalance() {
        when(walletTransactionRepository.findByIdempotencyKey(key(WalletTransactionType.ESCROW))).thenReturn(Optional.empty());
        when(walletService.lockWallet(posterId)).thenReturn(Optional.empty());

        assertThatThrownBy(() -> escrowLedgerService.hold(bounty))
                .isInstanceOf(BountyLifecycleException.class)
                .extracting("kind")
                .isEqualTo(LifecycleErrorKind.INSUFFICIENT_BALANCE);
        verifyNoInteractions(paymentCustodian);
    }

    @Test
    void holdTimeoutWritesNoLedgerRow() {
        Wallet wallet = wallet(posterId, "80.00");
        when(walletTransactionRepository.findByIdempotencyKey(key(WalletTransactionType.ESCROW))).thenReturn(Optional.empty());
        when(walletService.lockWallet(posterId)).thenReturn(Optional.of(wallet));
        doThrow(new PaymentProcessorException("no answer", true, null)).when(paymentCustodian).hold(any());

        assertThatThrownBy(() -> escrowLedgerService.hold(bounty))
                .isInstanceOf(BountyLifecycleException.class)
                .extracting("kind")
                .isEqualTo(LifecycleErrorKind.EXTERNAL_PAYMENT_TIMEOUT);
        verify(walletTransactionRepository, never()).save(any());
    }

    @Test
    void releasePaysHunterAndSettlesEscrow() {
        bounty.setStatus(BountyStatus.IN_PROGRESS);
        bounty.setAcceptedHunterId(hunterId);
        WalletTransaction escrow = escrow(WalletTransactionStatus.PENDING);
        Wallet hunterWallet = wallet(hunterId, "0.00");
        when(walletTransactionRepository.findByIdempotencyKey(key(WalletTransactionType.RELEASE))).thenReturn(Optional.empty());
        when(walletTransactionRepository.findByIdempotencyKey(key(WalletTransactionType.REFUND))).thenReturn(Optional.empty());
        when(walletTransactionRepository.findByIdempotencyKey(key(WalletTransactionType.ESCROW))).thenReturn(Optional.of(escrow));
        when(walletService.lockOrCreateWallet(hunterId)).thenReturn(hunterWallet);
        when(walletTransactionRepository.save(any(WalletTransaction.class))).thenAnswer(inv -> inv.getArgument(0));

        WalletTransaction release = escrowLedgerService.release(bounty);

        verify(paymentCustodian).release(any(CustodyInstruction.class));
        verify(walletService).credit(hunterWallet, new BigDecimal("50.00"));
        assertThat(escrow.getStatus()).isEqualTo(WalletTransactionStatus.COMPLETED);
        assertThat(escrow.getCompletedAt()).isNotNull();
        assertThat(release.getType()).isEqualTo(WalletTransactionType.RELEASE);
        assertThat(release.getUserId()).isEqualTo(hunterId);
        assertThat(release.getAmount()).isEqualByComparingTo("50.00");
        assertThat(release.getIdempotencyKey()).isEqualTo(key(WalletTransactionType.RELEASE));
    }

    @Test
    void repeatedReleaseReturnsExistingRow() {
        bounty.setAcceptedHunterId(hunterId);
        WalletTransaction existing = new WalletTransaction();
        existing.setType(WalletTransactionType.RELEASE);
        when(walletTransactionRepository.findByIdempotencyKey(key(WalletTransactionType.RELEASE))).thenReturn(Optional.of(existing));

        assertThat(escrowLedgerService.release(bounty)).isSameAs(existing);

        verifyNoInteractions(walletService, paymentCustodian);
    }

    @Test
    void releaseAfterRefundFails() {
        bounty.setAcceptedHunterId(hunterId);
        when(walletTransactionRepository.findByIdempotencyKey(key(WalletTransactionType.RELEASE))).thenReturn(Optional.empty());
        when(walletTransactionRepository.findByIdempotencyKey(key(WalletTransactionType.REFUND)))
                .thenReturn(Optional.of(new WalletTransaction()));

        assertThatThrownBy(() -> escrowLedgerService.release(bounty))
                .isInstanceOf(BountyLifecycleException.class)
                .extracting("kind")
                .isEqualTo(LifecycleErrorKind.PAYOUT_FAILED);
        verifyNoInteractions(walletService, paymentCustodian);
    }

    @Test
    void releaseWithoutHeldFundsFails() {
        bounty.setAcceptedHunterId(hunterId);
        when(walletTransactionRepository.findByIdempotencyKey(key(WalletTransactionType.RELEASE))).thenReturn(Optional.empty());
        when(walletTransactionRepository.findByIdempotencyKey(key(WalletTransactionType.REFUND))).thenReturn(Optional.empty());
        when(walletTransactionRepository.findByIdempotencyKey(key(WalletTransactionType.ESCROW))).thenReturn(Optional.empty());

        assertThatThrownBy(() -> escrowLedgerService.release(bounty))
                .isInstanceOf(BountyLifecycleException.class)
                .extracting("kind")
                .isEqualTo(LifecycleErrorKind.PAYOUT_FAILED);
    }

    @Test
    void failedRefundLeavesEscrowPending() {
        WalletTransaction escrow = escrow(WalletTransactionStatus.PENDING);
        when(walletTransactionRepository.findByIdempotencyKey(key(WalletTransactionType.REFUND))).thenReturn(Optional.empty());
        when(walletTransactionRepository.findByIdempotencyKey(key(WalletTransactionType.RELEASE))).thenReturn(Optional.empty());
        when(walletTransactionRepository.findByIdempotencyKey(key(WalletTransactionType.ESCROW))).thenReturn(Optional.of(escrow));
        when(walletService.lockOrCreateWallet(posterId)).thenReturn(wallet(posterId, "0.00"));
        doThrow(new PaymentProcessorException("declined", false, null)).when(paymentCustodian).refund(any());

        assertThatThrownBy(() -> escrowLedgerService.refund(bounty))
                .isInstanceOf(BountyLifecycleException.class)
                .extracting("kind")
                .isEqualTo(LifecycleErrorKind.PAYOUT_FAILED);
        assertThat(escrow.getStatus()).isEqualTo(WalletTransactionStatus.PENDING);
        verify(walletService, never()).credit(any(), any());
        verify(walletTransactionRepository, never()).save(any());
    }

    private String key(WalletTransactionType type) {
        return CustodyInstruction.idempotencyKey(bounty.getId(), type);
    }

    private WalletTransaction escrow(WalletTransactionStatus status) {
        WalletTransaction escrow = new WalletTransaction();
        escrow.setId(UUID.randomUUID());
        escrow.setBountyId(bounty.getId());
        escrow.setUserId(posterId);
        escrow.setType(WalletTransactionType.ESCROW);
        escrow.setAmount(new BigDecimal("50.00"));
        escrow.setStatus(status);
        escrow.setIdempotencyKey(key(WalletTransactionType.ESCROW));
        escrow.setCreatedAt(LocalDateTime.now());
        return escrow;
    }

    private static Wallet wallet(UUID ownerId, String balance) {
        Wallet wallet = new Wallet();
        wallet.setId(UUID.randomUUID());
        wallet.setOwnerId(ownerId);
        wallet.setBalance(new BigDecimal(balance));
        return wallet;
    }
}
