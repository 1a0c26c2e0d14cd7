package com.nosota.bounty.model;

import com.nosota.bounty.api.model.WalletTransactionStatus;
import com.nosota.bounty.api.model.WalletTransactionType;
import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.hibernate.annotations.GenericGenerator;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.UUID;

/**
 * Ledger entry for money moving in or out of a wallet.
 *
 * <p>Escrow rows ({@code ESCROW}, {@code REFUND}, {@code RELEASE}) are created only by
 * {@link com.nosota.bounty.service.EscrowLedgerService}:
 * <pre>
 *   ESCROW/PENDING  --release-->  ESCROW/COMPLETED + RELEASE/COMPLETED (user = hunter)
 *                   --refund--->  ESCROW/COMPLETED + REFUND/COMPLETED  (user = poster)
 * </pre>
 *
 * <p>{@code idempotencyKey} is {@code bounty:{bountyId}:{type}} for escrow rows and is unique,
 * so the database rejects a second hold or a second settlement for the same bounty.
 */
@Entity
@Table(name = "wallet_transactions")
@Getter
@Setter
@AllArgsConstructor
@NoArgsConstructor
public class WalletTransaction {

    @Id
    @GeneratedValue(generator = "UUID")
    @GenericGenerator(
            name = "UUID",
            strategy = "org.hibernate.id.UUIDGenerator"
    )
    @Column(name = "id", updatable = false, nullable = false)
    private UUID id;

    @Column(name = "bounty_id")
    private UUID bountyId;

    /**
     * Payer for ESCROW/REFUND/WITHDRAWAL/DEPOSIT rows, payee for RELEASE rows.
     * Null once that user's account is deleted.
     */
    @Column(name = "user_id")
    private UUID userId;

    @Enumerated(EnumType.STRING)
    @Column(name = "type", nullable = false, length = 16)
    private WalletTransactionType type;

    @Column(name = "amount", nullable = false, precision = 12, scale = 2)
    private BigDecimal amount;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false, length = 16)
    private WalletTransactionStatus status;

    @Column(name = "description", length = 500)
    private String description;

    @Column(name = "idempotency_key", nullable = false, length = 320, updatable = false)
    private String idempotencyKey;

    @Column(name = "created_at", nullable = false)
    private LocalDateTime createdAt;

    @Column(name = "completed_at")
    private LocalDateTime completedAt;
}
