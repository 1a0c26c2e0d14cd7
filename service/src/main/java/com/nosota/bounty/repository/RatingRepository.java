package com.nosota.bounty.repository;

import com.nosota.bounty.model.Rating;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.UUID;

@Repository
public interface RatingRepository extends JpaRepository<Rating, UUID> {

    boolean existsByBountyIdAndFromUserId(UUID bountyId, UUID fromUserId);

    List<Rating> findByBountyIdOrderByCreatedAtAsc(UUID bountyId);

    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("UPDATE Rating r SET r.fromUserId = null WHERE r.fromUserId = :userId")
    int clearAuthor(@Param("userId") UUID userId);

    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("UPDATE Rating r SET r.toUserId = null WHERE r.toUserId = :userId")
    int clearSubject(@Param("userId") UUID userId);
}
