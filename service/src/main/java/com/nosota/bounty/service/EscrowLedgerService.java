package com.nosota.bounty.service;

import com.nosota.bounty.api.model.LifecycleErrorKind;
import com.nosota.bounty.api.model.WalletTransactionStatus;
import com.nosota.bounty.api.model.WalletTransactionType;
import com.nosota.bounty.custodian.CustodyInstruction;
import com.nosota.bounty.custodian.PaymentCustodian;
import com.nosota.bounty.error.BountyLifecycleException;
import com.nosota.bounty.error.PaymentProcessorException;
import com.nosota.bounty.model.Bounty;
import com.nosota.bounty.model.Wallet;
import com.nosota.bounty.model.WalletTransaction;
import com.nosota.bounty.repository.WalletTransactionRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDateTime;
import java.util.EnumSet;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Custody of bounty funds between acceptance and settlement.
 *
 * <p>The only component that writes ESCROW, RELEASE and REFUND wallet transactions. Each operation:
 * <ol>
 *   <li>is called with the bounty row already locked by the caller</li>
 *   <li>locks the affected wallet (bounty lock first, wallet lock second)</li>
 *   <li>calls the {@link PaymentCustodian} after local preconditions pass</li>
 *   <li>writes balance and ledger rows in the caller's transaction</li>
 * </ol>
 *
 * <p>Flow:
 * <pre>
 *   hold:    poster balance -amount, ESCROW/PENDING
 *   release: ESCROW -> COMPLETED, RELEASE/COMPLETED, hunter balance +amount
 *   refund:  ESCROW -> COMPLETED, REFUND/COMPLETED,  payer balance +amount
 * </pre>
 *
 * <p>Release and refund are idempotent per bounty and mutually exclusive: the second settlement of the same
 * kind returns the first one, a settlement of the other kind fails with PAYOUT_FAILED.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class EscrowLedgerService {

    private static final EnumSet<WalletTransactionType> ESCROW_TYPES = EnumSet.of(
            WalletTransactionType.ESCROW,
            WalletTransactionType.REFUND,
            WalletTransactionType.RELEASE
    );

    private final WalletTransactionRepository walletTransactionRepository;
    private final WalletService walletService;
    private final PaymentCustodian paymentCustodian;

    /**
     * Moves the bounty amount from the poster's wallet into escrow.
     *
     * <p>No-op for honor and zero-amount bounties. A PENDING escrow carried over from a previous hunter
     * (the bounty was reopened after that hunter's account was deleted) is reused without a second debit.
     *
     * @param bounty locked bounty
     * @return the pending escrow transaction, or null if the bounty carries no money
     * @throws BountyLifecycleException INSUFFICIENT_BALANCE, PAYOUT_FAILED, EXTERNAL_PAYMENT_TIMEOUT
     */
    @Transactional(propagation = Propagation.MANDATORY)
    public WalletTransaction hold(Bounty bounty) {
        if (!bounty.requiresEscrow()) {
            log.debug("No escrow needed: bountyId={}, amount={}, forHonor={}",
                    bounty.getId(), bounty.getAmount(), bounty.isForHonor());
            return null;
        }

        String key = CustodyInstruction.idempotencyKey(bounty.getId(), WalletTransactionType.ESCROW);
        Optional<WalletTransaction> existing = walletTransactionRepository.findByIdempotencyKey(key);
        if (existing.isPresent()) {
            WalletTransaction escrow = existing.get();
            if (escrow.getStatus() != WalletTransactionStatus.PENDING) {
                throw new IllegalStateException("Escrow already settled for bountyId=" + bounty.getId());
            }
            log.info("Reusing held escrow: bountyId={}, transactionId={}, amount={}",
                    bounty.getId(), escrow.getId(), escrow.getAmount());
            return escrow;
        }

        UUID posterId = bounty.getPosterId();
        Wallet wallet = walletService.lockWallet(posterId)
                .orElseThrow(() -> new BountyLifecycleException(LifecycleErrorKind.INSUFFICIENT_BALANCE,
                        String.format("Poster has no wallet: bountyId=%s, posterId=%s", bounty.getId(), posterId)));
        walletService.debit(wallet, bounty.getAmount());

        callCustodian(() -> paymentCustodian.hold(
                CustodyInstruction.of(bounty.getId(), posterId, bounty.getAmount(), WalletTransactionType.ESCROW)));

        WalletTransaction escrow = new WalletTransaction();
        escrow.setBountyId(bounty.getId());
        escrow.setUserId(posterId);
        escrow.setType(WalletTransactionType.ESCROW);
        escrow.setAmount(bounty.getAmount());
        escrow.setStatus(WalletTransactionStatus.PENDING);
        escrow.setIdempotencyKey(key);
        escrow.setDescription("Escrow hold for bounty " + bounty.getId());
        escrow.setCreatedAt(LocalDateTime.now());
        walletTransactionRepository.save(escrow);

        log.info("Escrow held: bountyId={}, posterId={}, amount={}, transactionId={}",
                bounty.getId(), posterId, bounty.getAmount(), escrow.getId());
        return escrow;
    }

    /**
     * Pays the escrowed amount to the accepted hunter.
     *
     * @param bounty locked bounty with an accepted hunter
     * @return the RELEASE transaction (the existing one on a repeated call), or null if the bounty carries no money
     * @throws BountyLifecycleException PAYOUT_FAILED if nothing is held or the escrow was refunded,
     *                                  EXTERNAL_PAYMENT_TIMEOUT if the custodian did not answer
     */
    @Transactional(propagation = Propagation.MANDATORY)
    public WalletTransaction release(Bounty bounty) {
        if (!bounty.requiresEscrow()) {
            return null;
        }

        Optional<WalletTransaction> released = findTerminal(bounty.getId(), WalletTransactionType.RELEASE);
        if (released.isPresent()) {
            log.info("Escrow already released: bountyId={}, transactionId={}", bounty.getId(), released.get().getId());
            return released.get();
        }
        if (findTerminal(bounty.getId(), WalletTransactionType.REFUND).isPresent()) {
            throw new BountyLifecycleException(LifecycleErrorKind.PAYOUT_FAILED,
                    "Escrow already refunded: bountyId=" + bounty.getId());
        }

        WalletTransaction escrow = requirePendingEscrow(bounty);
        UUID hunterId = bounty.getAcceptedHunterId();
        if (hunterId == null) {
            throw new BountyLifecycleException(LifecycleErrorKind.PAYOUT_FAILED,
                    "No accepted hunter to pay: bountyId=" + bounty.getId());
        }

        Wallet wallet = walletService.lockOrCreateWallet(hunterId);
        callCustodian(() -> paymentCustodian.release(
                CustodyInstruction.of(bounty.getId(), hunterId, escrow.getAmount(), WalletTransactionType.RELEASE)));

        walletService.credit(wallet, escrow.getAmount());
        WalletTransaction release = settle(escrow, WalletTransactionType.RELEASE, hunterId,
                "Escrow release for bounty " + bounty.getId());

        log.info("Escrow released: bountyId={}, hunterId={}, amount={}, transactionId={}",
                bounty.getId(), hunterId, escrow.getAmount(), release.getId());
        return release;
    }

    /**
     * Returns the escrowed amount to the user it was taken from.
     *
     * @param bounty locked bounty
     * @return the REFUND transaction (the existing one on a repeated call), or null if the bounty carries no money
     * @throws BountyLifecycleException PAYOUT_FAILED if nothing is held or the escrow was released,
     *                                  EXTERNAL_PAYMENT_TIMEOUT if the custodian did not answer
     */
    @Transactional(propagation = Propagation.MANDATORY)
    public WalletTransaction refund(Bounty bounty) {
        if (!bounty.requiresEscrow()) {
            return null;
        }

        Optional<WalletTransaction> refunded = findTerminal(bounty.getId(), WalletTransactionType.REFUND);
        if (refunded.isPresent()) {
            log.info("Escrow already refunded: bountyId={}, transactionId={}", bounty.getId(), refunded.get().getId());
            return refunded.get();
        }
        if (findTerminal(bounty.getId(), WalletTransactionType.RELEASE).isPresent()) {
            throw new BountyLifecycleException(LifecycleErrorKind.PAYOUT_FAILED,
                    "Escrow already released: bountyId=" + bounty.getId());
        }

        WalletTransaction escrow = requirePendingEscrow(bounty);
        UUID payerId = escrow.getUserId();
        if (payerId == null) {
            throw new BountyLifecycleException(LifecycleErrorKind.PAYOUT_FAILED,
                    "Escrow payer no longer exists: bountyId=" + bounty.getId());
        }

        Wallet wallet = walletService.lockOrCreateWallet(payerId);
        callCustodian(() -> paymentCustodian.refund(
                CustodyInstruction.of(bounty.getId(), payerId, escrow.getAmount(), WalletTransactionType.REFUND)));

        walletService.credit(wallet, escrow.getAmount());
        WalletTransaction refund = settle(escrow, WalletTransactionType.REFUND, payerId,
                "Escrow refund for bounty " + bounty.getId());

        log.info("Escrow refunded: bountyId={}, payerId={}, amount={}, transactionId={}",
                bounty.getId(), payerId, escrow.getAmount(), refund.getId());
        return refund;
    }

    /**
     * @return the bounty's unsettled escrow, if any
     */
    @Transactional(readOnly = true)
    public Optional<WalletTransaction> findPendingEscrow(UUID bountyId) {
        return walletTransactionRepository
                .findByIdempotencyKey(CustodyInstruction.idempotencyKey(bountyId, WalletTransactionType.ESCROW))
                .filter(escrow -> escrow.getStatus() == WalletTransactionStatus.PENDING);
    }

    /**
     * @return ESCROW, RELEASE and REFUND rows of the bounty in creation order
     */
    @Transactional(readOnly = true)
    public List<WalletTransaction> getEscrowTransactions(UUID bountyId) {
        return walletTransactionRepository.findByBountyIdAndTypeInOrderByCreatedAtAsc(bountyId, ESCROW_TYPES);
    }

    private Optional<WalletTransaction> findTerminal(UUID bountyId, WalletTransactionType type) {
        return walletTransactionRepository.findByIdempotencyKey(CustodyInstruction.idempotencyKey(bountyId, type));
    }

    private WalletTransaction requirePendingEscrow(Bounty bounty) {
        return findPendingEscrow(bounty.getId())
                .orElseThrow(() -> new BountyLifecycleException(LifecycleErrorKind.PAYOUT_FAILED,
                        "No pending escrow: bountyId=" + bounty.getId()));
    }

    private WalletTransaction settle(WalletTransaction escrow, WalletTransactionType type, UUID userId,
                                     String description) {
        LocalDateTime now = LocalDateTime.now();
        escrow.setStatus(WalletTransactionStatus.COMPLETED);
        escrow.setCompletedAt(now);
        walletTransactionRepository.save(escrow);

        WalletTransaction settlement = new WalletTransaction();
        settlement.setBountyId(escrow.getBountyId());
        settlement.setUserId(userId);
        settlement.setType(type);
        settlement.setAmount(escrow.getAmount());
        settlement.setStatus(WalletTransactionStatus.COMPLETED);
        settlement.setIdempotencyKey(CustodyInstruction.idempotencyKey(escrow.getBountyId(), type));
        settlement.setDescription(description);
        settlement.setCreatedAt(now);
        settlement.setCompletedAt(now);
        return walletTransactionRepository.save(settlement);
    }

    private static void callCustodian(Runnable call) {
        try {
            call.run();
        } catch (PaymentProcessorException e) {
            LifecycleErrorKind kind = e.isTimedOut()
                    ? LifecycleErrorKind.EXTERNAL_PAYMENT_TIMEOUT
                    : LifecycleErrorKind.PAYOUT_FAILED;
            throw new BountyLifecycleException(kind, e.getMessage(), e);
        }
    }
}
