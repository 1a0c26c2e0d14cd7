package com.nosota.bounty.repository;

import com.nosota.bounty.model.Wallet;
import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.Optional;
import java.util.UUID;

@Repository
public interface WalletRepository extends JpaRepository<Wallet, UUID> {

    Optional<Wallet> findByOwnerId(UUID ownerId);

    /**
     * Retrieves the owner's {@link Wallet} and locks it for update.
     * <p>
     * Balance mutations (hold debit, release/refund credit, deposit, withdrawal) read and write the
     * balance under this lock inside the same transaction as the ledger row they accompany.
     * </p>
     *
     * @param ownerId owner user id
     * @return the locked wallet, empty if the user never funded one
     */
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT w FROM Wallet w WHERE w.ownerId = :ownerId")
    Optional<Wallet> findByOwnerIdForUpdate(@Param("ownerId") UUID ownerId);

    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("UPDATE Wallet w SET w.ownerId = null WHERE w.ownerId = :userId")
    int clearOwner(@Param("userId") UUID userId);
}
