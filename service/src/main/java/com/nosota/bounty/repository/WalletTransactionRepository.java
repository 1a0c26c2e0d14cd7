package com.nosota.bounty.repository;

import com.nosota.bounty.api.model.WalletTransactionStatus;
import com.nosota.bounty.api.model.WalletTransactionType;
import com.nosota.bounty.model.WalletTransaction;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.math.BigDecimal;
import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

@Repository
public interface WalletTransactionRepository extends JpaRepository<WalletTransaction, UUID> {

    /**
     * Finds the ledger row written under the given idempotency key.
     * Escrow rows use {@code bounty:{bountyId}:{type}}, so this is also the "does the bounty have an X row" lookup.
     */
    Optional<WalletTransaction> findByIdempotencyKey(String idempotencyKey);

    List<WalletTransaction> findByBountyIdAndTypeInOrderByCreatedAtAsc(UUID bountyId,
                                                                       Collection<WalletTransactionType> types);

    Page<WalletTransaction> findByUserIdOrderByCreatedAtDesc(UUID userId, Pageable pageable);

    /**
     * Sums the amounts of the user's rows of the given type and status.
     * With ESCROW/PENDING this is the money the user currently has held in escrow.
     */
    @Query("""
            SELECT COALESCE(SUM(t.amount), 0)
            FROM WalletTransaction t
            WHERE t.userId = :userId
              AND t.type = :type
              AND t.status = :status
            """)
    BigDecimal sumAmount(@Param("userId") UUID userId,
                         @Param("type") WalletTransactionType type,
                         @Param("status") WalletTransactionStatus status);

    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("UPDATE WalletTransaction t SET t.userId = null WHERE t.userId = :userId")
    int clearUser(@Param("userId") UUID userId);
}
