package com.nosota.bounty.repository;

import com.nosota.bounty.api.model.BountyStatus;
import com.nosota.bounty.api.model.RequestStatus;
import com.nosota.bounty.model.Bounty;
import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

@Repository
public interface BountyRepository extends JpaRepository<Bounty, UUID> {

    /**
     * Retrieves the {@link Bounty} with the given id and locks its row for update.
     * <p>
     * Every mutating lifecycle operation starts here: the precondition check and the write happen
     * under this <b>pessimistic write lock</b>, so two concurrent acceptances of the same bounty are
     * serialized and the second one observes the first one's commit.
     * </p>
     * <p>
     * Lock order is always bounty row first, wallet row second.
     * </p>
     *
     * @param id bounty id
     * @return the locked bounty, empty if it does not exist
     */
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT b FROM Bounty b WHERE b.id = :id")
    Optional<Bounty> findByIdForUpdate(@Param("id") UUID id);

    /**
     * Locks every bounty that references the user: as poster, as accepted hunter, or through one of the
     * user's pending applications.
     * <p>
     * Used by the account deletion cascade to take all bounty locks in one statement, ordered by id, before
     * any bounty or wallet row is written.
     * </p>
     */
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("""
            SELECT b FROM Bounty b
            WHERE b.posterId = :userId
               OR b.acceptedHunterId = :userId
               OR b.id IN (SELECT r.bountyId FROM BountyRequest r
                           WHERE r.hunterId = :userId AND r.status = :pending)
            ORDER BY b.id
            """)
    List<Bounty> findReferencingUserForUpdate(@Param("userId") UUID userId,
                                              @Param("pending") RequestStatus pending);

    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("UPDATE Bounty b SET b.posterId = null WHERE b.posterId = :userId")
    int clearPoster(@Param("userId") UUID userId);

    /**
     * Drops the hunter reference from bounties in one of the given (final) statuses only.
     * A non-final bounty is reopened by the cascade instead.
     */
    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("UPDATE Bounty b SET b.acceptedHunterId = null WHERE b.acceptedHunterId = :userId AND b.status IN :statuses")
    int clearAcceptedHunter(@Param("userId") UUID userId, @Param("statuses") Collection<BountyStatus> statuses);
}
