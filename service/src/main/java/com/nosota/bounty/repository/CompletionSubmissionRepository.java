package com.nosota.bounty.repository;

import com.nosota.bounty.api.model.SubmissionStatus;
import com.nosota.bounty.model.CompletionSubmission;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

@Repository
public interface CompletionSubmissionRepository extends JpaRepository<CompletionSubmission, UUID> {

    Optional<CompletionSubmission> findFirstByBountyIdAndStatus(UUID bountyId, SubmissionStatus status);

    List<CompletionSubmission> findByBountyIdOrderBySubmittedAtAsc(UUID bountyId);

    List<CompletionSubmission> findByBountyIdAndHunterIdAndStatus(UUID bountyId, UUID hunterId,
                                                                  SubmissionStatus status);

    /**
     * Number of the hunter's submissions on the bounty that were sent back for revision.
     */
    long countByBountyIdAndHunterIdAndStatus(UUID bountyId, UUID hunterId, SubmissionStatus status);

    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("UPDATE CompletionSubmission s SET s.hunterId = null WHERE s.hunterId = :userId")
    int clearHunter(@Param("userId") UUID userId);
}
