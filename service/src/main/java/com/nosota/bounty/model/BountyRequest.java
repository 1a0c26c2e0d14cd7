package com.nosota.bounty.model;

import com.nosota.bounty.api.model.RequestStatus;
import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.hibernate.annotations.GenericGenerator;

import java.time.LocalDateTime;
import java.util.UUID;

/**
 * A hunter's application to a bounty. Never deleted; {@code hunterId} is nulled when the hunter is removed.
 */
@Entity
@Table(name = "bounty_requests")
@Getter
@Setter
@AllArgsConstructor
@NoArgsConstructor
public class BountyRequest {

    @Id
    @GeneratedValue(generator = "UUID")
    @GenericGenerator(
            name = "UUID",
            strategy = "org.hibernate.id.UUIDGenerator"
    )
    @Column(name = "id", updatable = false, nullable = false)
    private UUID id;

    @Column(name = "bounty_id", nullable = false)
    private UUID bountyId;

    @Column(name = "hunter_id")
    private UUID hunterId;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false, length = 16)
    private RequestStatus status;

    @Column(name = "created_at", nullable = false)
    private LocalDateTime createdAt;

    @Column(name = "updated_at", nullable = false)
    private LocalDateTime updatedAt;
}
