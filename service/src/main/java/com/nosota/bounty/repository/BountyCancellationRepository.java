package com.nosota.bounty.repository;

import com.nosota.bounty.api.model.CancellationStatus;
import com.nosota.bounty.model.BountyCancellation;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

@Repository
public interface BountyCancellationRepository extends JpaRepository<BountyCancellation, UUID> {

    Optional<BountyCancellation> findFirstByBountyIdAndStatus(UUID bountyId, CancellationStatus status);

    List<BountyCancellation> findByBountyIdOrderByCreatedAtAsc(UUID bountyId);

    /**
     * Bounty id only, so the request itself is loaded after the bounty lock is taken.
     */
    @Query("SELECT c.bountyId FROM BountyCancellation c WHERE c.id = :id")
    Optional<UUID> findBountyIdById(@Param("id") UUID id);

    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("UPDATE BountyCancellation c SET c.requesterId = null WHERE c.requesterId = :userId")
    int clearRequester(@Param("userId") UUID userId);

    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("UPDATE BountyCancellation c SET c.responderId = null WHERE c.responderId = :userId")
    int clearResponder(@Param("userId") UUID userId);
}
