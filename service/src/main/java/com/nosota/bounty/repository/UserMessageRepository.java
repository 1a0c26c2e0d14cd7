package com.nosota.bounty.repository;

import com.nosota.bounty.model.UserMessage;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.UUID;

@Repository
public interface UserMessageRepository extends JpaRepository<UserMessage, UUID> {

    long countByUserId(UUID userId);

    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("DELETE FROM UserMessage m WHERE m.userId = :userId")
    int deleteAllOwnedBy(@Param("userId") UUID userId);
}
