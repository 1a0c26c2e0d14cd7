package com.nosota.bounty.repository;

import com.nosota.bounty.api.model.DisputeStatus;
import com.nosota.bounty.model.Dispute;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.Optional;
import java.util.UUID;

@Repository
public interface DisputeRepository extends JpaRepository<Dispute, UUID> {

    Optional<Dispute> findFirstByBountyIdAndStatus(UUID bountyId, DisputeStatus status);

    boolean existsByBountyIdAndStatus(UUID bountyId, DisputeStatus status);

    /**
     * Reads only the bounty id, so the dispute entity itself is first loaded after the bounty lock is taken.
     */
    @Query("SELECT d.bountyId FROM Dispute d WHERE d.id = :id")
    Optional<UUID> findBountyIdById(@Param("id") UUID id);

    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("UPDATE Dispute d SET d.initiatorId = null WHERE d.initiatorId = :userId")
    int clearInitiator(@Param("userId") UUID userId);

    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("UPDATE Dispute d SET d.resolvedBy = null WHERE d.resolvedBy = :userId")
    int clearResolver(@Param("userId") UUID userId);
}
