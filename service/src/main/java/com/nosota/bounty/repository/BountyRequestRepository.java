package com.nosota.bounty.repository;

import com.nosota.bounty.api.model.RequestStatus;
import com.nosota.bounty.model.BountyRequest;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.LocalDateTime;
import java.util.Collection;
import java.util.List;
import java.util.UUID;

@Repository
public interface BountyRequestRepository extends JpaRepository<BountyRequest, UUID> {

    List<BountyRequest> findByBountyIdOrderByCreatedAtAsc(UUID bountyId);

    List<BountyRequest> findByHunterIdOrderByCreatedAtDesc(UUID hunterId);

    List<BountyRequest> findByBountyIdAndStatus(UUID bountyId, RequestStatus status);

    List<BountyRequest> findByBountyIdAndHunterIdAndStatus(UUID bountyId, UUID hunterId, RequestStatus status);

    /**
     * Checks for an active (pending or accepted) application of the hunter on the bounty.
     */
    boolean existsByBountyIdAndHunterIdAndStatusIn(UUID bountyId, UUID hunterId, Collection<RequestStatus> statuses);

    /**
     * Rejects the user's applications in status {@code from} and drops the hunter reference in one statement.
     *
     * @return number of applications rejected
     */
    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("""
            UPDATE BountyRequest r
            SET r.status = :to, r.hunterId = null, r.updatedAt = :now
            WHERE r.hunterId = :userId
              AND r.status = :from
            """)
    int rejectPendingOf(@Param("userId") UUID userId,
                        @Param("from") RequestStatus from,
                        @Param("to") RequestStatus to,
                        @Param("now") LocalDateTime now);

    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("UPDATE BountyRequest r SET r.hunterId = null WHERE r.hunterId = :userId")
    int clearHunter(@Param("userId") UUID userId);
}
