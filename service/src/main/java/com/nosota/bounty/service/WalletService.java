package com.nosota.bounty.service;

import com.nosota.bounty.api.model.LifecycleErrorKind;
import com.nosota.bounty.api.model.WalletTransactionStatus;
import com.nosota.bounty.api.model.WalletTransactionType;
import com.nosota.bounty.error.BountyLifecycleException;
import com.nosota.bounty.model.Wallet;
import com.nosota.bounty.model.WalletTransaction;
import com.nosota.bounty.repository.ProfileRepository;
import com.nosota.bounty.repository.WalletRepository;
import com.nosota.bounty.repository.WalletTransactionRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.validation.annotation.Validated;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.LocalDateTime;
import java.util.Optional;
import java.util.UUID;

/**
 * Service for user wallet balances.
 *
 * <p>Deposits and withdrawals are recorded as completed {@code DEPOSIT}/{@code WITHDRAWAL} wallet transactions.
 * The locking helpers are shared with {@link EscrowLedgerService}, whose balance changes must happen in the
 * same transaction as the escrow row they accompany.
 */
@Service
@Validated
@RequiredArgsConstructor
@Slf4j
public class WalletService {

    static final int SCALE = 2;
    static final BigDecimal MAX_AMOUNT = new BigDecimal("9999999999.99");

    private final WalletRepository walletRepository;
    private final WalletTransactionRepository walletTransactionRepository;
    private final ProfileRepository profileRepository;

    /**
     * Deposits funds from an external source, creating the wallet on first use.
     * <p>
     * With an {@code externalReference}, repeating the same deposit returns the first transaction
     * instead of crediting twice.
     * </p>
     *
     * @param userId            wallet owner
     * @param amount            positive amount with at most two decimals
     * @param externalReference optional provider reference (bank transfer id, card charge id)
     * @return the DEPOSIT transaction
     */
    @Transactional
    public WalletTransaction deposit(UUID userId, BigDecimal amount, String externalReference) {
        log.info("Processing deposit: userId={}, amount={}, externalReference={}", userId, amount, externalReference);

        BigDecimal normalized = normalizePositive(amount);
        if (!profileRepository.existsById(userId)) {
            throw new BountyLifecycleException(LifecycleErrorKind.ACCOUNT_NOT_FOUND, "No profile for userId=" + userId);
        }

        String key = externalReference != null && !externalReference.isBlank()
                ? "deposit:" + userId + ":" + externalReference
                : "deposit:" + UUID.randomUUID();
        Optional<WalletTransaction> existing = walletTransactionRepository.findByIdempotencyKey(key);
        if (existing.isPresent()) {
            log.info("Deposit already recorded: userId={}, externalReference={}, transactionId={}",
                    userId, externalReference, existing.get().getId());
            return existing.get();
        }

        Wallet wallet = lockOrCreateWallet(userId);
        credit(wallet, normalized);

        WalletTransaction transaction = completedTransaction(userId, WalletTransactionType.DEPOSIT, normalized, key,
                externalReference != null ? "Deposit " + externalReference : "Deposit");
        walletTransactionRepository.save(transaction);

        log.info("Deposit completed: userId={}, amount={}, balance={}", userId, normalized, wallet.getBalance());
        return transaction;
    }

    /**
     * Withdraws funds to an external account.
     *
     * @throws BountyLifecycleException INSUFFICIENT_BALANCE if the wallet holds less than {@code amount}
     */
    @Transactional
    public WalletTransaction withdraw(UUID userId, BigDecimal amount, String destinationAccount) {
        log.info("Processing withdrawal: userId={}, amount={}", userId, amount);

        BigDecimal normalized = normalizePositive(amount);
        Wallet wallet = lockWallet(userId)
                .orElseThrow(() -> new BountyLifecycleException(LifecycleErrorKind.INSUFFICIENT_BALANCE,
                        "No wallet for userId=" + userId));
        debit(wallet, normalized);

        WalletTransaction transaction = completedTransaction(userId, WalletTransactionType.WITHDRAWAL, normalized,
                "withdrawal:" + UUID.randomUUID(), "Withdrawal to " + destinationAccount);
        walletTransactionRepository.save(transaction);

        log.info("Withdrawal completed: userId={}, amount={}, balance={}", userId, normalized, wallet.getBalance());
        return transaction;
    }

    @Transactional(readOnly = true)
    public BigDecimal getBalance(UUID userId) {
        return walletRepository.findByOwnerId(userId)
                .map(Wallet::getBalance)
                .orElse(BigDecimal.ZERO.setScale(SCALE));
    }

    /**
     * @return sum of the user's escrow holds that are not settled yet
     */
    @Transactional(readOnly = true)
    public BigDecimal getHeldAmount(UUID userId) {
        return walletTransactionRepository.sumAmount(userId, WalletTransactionType.ESCROW, WalletTransactionStatus.PENDING)
                .setScale(SCALE, RoundingMode.UNNECESSARY);
    }

    @Transactional(readOnly = true)
    public Page<WalletTransaction> getHistory(UUID userId, int page, int size) {
        return walletTransactionRepository.findByUserIdOrderByCreatedAtDesc(userId, PageRequest.of(page, size));
    }

    // ==================== Balance primitives ====================

    /**
     * Locks the owner's wallet row. Callers holding a bounty lock must take it first.
     */
    public Optional<Wallet> lockWallet(UUID ownerId) {
        return walletRepository.findByOwnerIdForUpdate(ownerId);
    }

    /**
     * Locks the owner's wallet row, inserting an empty wallet if the owner has none yet.
     */
    public Wallet lockOrCreateWallet(UUID ownerId) {
        return walletRepository.findByOwnerIdForUpdate(ownerId).orElseGet(() -> {
            LocalDateTime now = LocalDateTime.now();
            Wallet wallet = new Wallet();
            wallet.setOwnerId(ownerId);
            wallet.setBalance(BigDecimal.ZERO.setScale(SCALE));
            wallet.setCreatedAt(now);
            wallet.setUpdatedAt(now);
            log.info("Creating wallet: ownerId={}", ownerId);
            return walletRepository.save(wallet);
        });
    }

    /**
     * @throws BountyLifecycleException INSUFFICIENT_BALANCE, leaving the wallet untouched
     */
    public void debit(Wallet wallet, BigDecimal amount) {
        if (wallet.getBalance().compareTo(amount) < 0) {
            throw new BountyLifecycleException(LifecycleErrorKind.INSUFFICIENT_BALANCE,
                    String.format("Insufficient balance: walletId=%s, balance=%s, required=%s",
                            wallet.getId(), wallet.getBalance(), amount));
        }
        wallet.setBalance(wallet.getBalance().subtract(amount));
        wallet.setUpdatedAt(LocalDateTime.now());
        walletRepository.save(wallet);
    }

    public void credit(Wallet wallet, BigDecimal amount) {
        wallet.setBalance(wallet.getBalance().add(amount));
        wallet.setUpdatedAt(LocalDateTime.now());
        walletRepository.save(wallet);
    }

    /**
     * Brings an amount to scale 2.
     *
     * @throws BountyLifecycleException INVALID_AMOUNT if it is null, negative, too large or has more than two decimals
     */
    static BigDecimal normalize(BigDecimal amount) {
        if (amount == null || amount.signum() < 0 || amount.compareTo(MAX_AMOUNT) > 0) {
            throw new BountyLifecycleException(LifecycleErrorKind.INVALID_AMOUNT, "Invalid amount: " + amount);
        }
        try {
            return amount.setScale(SCALE, RoundingMode.UNNECESSARY);
        } catch (ArithmeticException e) {
            throw new BountyLifecycleException(LifecycleErrorKind.INVALID_AMOUNT,
                    "Amount has more than two decimals: " + amount, e);
        }
    }

    private static BigDecimal normalizePositive(BigDecimal amount) {
        BigDecimal normalized = normalize(amount);
        if (normalized.signum() == 0) {
            throw new BountyLifecycleException(LifecycleErrorKind.INVALID_AMOUNT, "Amount must be positive");
        }
        return normalized;
    }

    private static WalletTransaction completedTransaction(UUID userId, WalletTransactionType type, BigDecimal amount,
                                                          String key, String description) {
        LocalDateTime now = LocalDateTime.now();
        WalletTransaction transaction = new WalletTransaction();
        transaction.setUserId(userId);
        transaction.setType(type);
        transaction.setAmount(amount);
        transaction.setStatus(WalletTransactionStatus.COMPLETED);
        transaction.setIdempotencyKey(key);
        transaction.setDescription(description);
        transaction.setCreatedAt(now);
        transaction.setCompletedAt(now);
        return transaction;
    }
}
