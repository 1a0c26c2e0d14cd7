package com.nosota.bounty.model;

import com.nosota.bounty.api.model.DisputeResolution;
import com.nosota.bounty.api.model.DisputeStatus;
import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.hibernate.annotations.GenericGenerator;

import java.time.LocalDateTime;
import java.util.UUID;

/**
 * Escalation of an in-progress bounty to an administrator.
 * While a dispute is OPEN the bounty's review and cancellation operations are frozen.
 */
@Entity
@Table(name = "disputes")
@Getter
@Setter
@AllArgsConstructor
@NoArgsConstructor
public class Dispute {

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

    @Column(name = "initiator_id")
    private UUID initiatorId;

    @Column(name = "reason", nullable = false)
    private String reason;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false, length = 16)
    private DisputeStatus status;

    @Enumerated(EnumType.STRING)
    @Column(name = "resolution", length = 24)
    private DisputeResolution resolution;

    @Column(name = "resolution_note")
    private String resolutionNote;

    @Column(name = "resolved_by")
    private UUID resolvedBy;

    @Column(name = "created_at", nullable = false)
    private LocalDateTime createdAt;

    @Column(name = "resolved_at")
    private LocalDateTime resolvedAt;
}
