package com.nosota.bounty.model;

import com.nosota.bounty.api.model.CancellationStatus;
import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.hibernate.annotations.GenericGenerator;

import java.time.LocalDateTime;
import java.util.UUID;

/**
 * A hunter asking the poster to call off an in-progress bounty.
 */
@Entity
@Table(name = "bounty_cancellations")
@Getter
@Setter
@AllArgsConstructor
@NoArgsConstructor
public class BountyCancellation {

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

    @Column(name = "requester_id")
    private UUID requesterId;

    @Column(name = "reason", nullable = false)
    private String reason;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false, length = 16)
    private CancellationStatus status;

    @Column(name = "responder_id")
    private UUID responderId;

    @Column(name = "response_message")
    private String responseMessage;

    @Column(name = "created_at", nullable = false)
    private LocalDateTime createdAt;

    @Column(name = "resolved_at")
    private LocalDateTime resolvedAt;
}
