package com.nosota.bounty.model;

import com.nosota.bounty.api.model.BountyStatus;
import com.nosota.bounty.api.model.WorkType;
import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.hibernate.annotations.GenericGenerator;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.UUID;

/**
 * A posted task with a reward (or "for honor", no reward).
 *
 * <p>Invariants (also enforced by CHECK constraints in migration V1):
 * <ul>
 *   <li>{@code forHonor} implies {@code amount == 0}</li>
 *   <li>{@code acceptedHunterId != null} implies status IN_PROGRESS or COMPLETED</li>
 * </ul>
 *
 * <p>{@code status} and {@code acceptedHunterId} are written only through
 * {@link com.nosota.bounty.service.BountyLifecycleService}.
 */
@Entity
@Table(name = "bounties")
@Getter
@Setter
@AllArgsConstructor
@NoArgsConstructor
public class Bounty {

    @Id
    @GeneratedValue(generator = "UUID")
    @GenericGenerator(
            name = "UUID",
            strategy = "org.hibernate.id.UUIDGenerator"
    )
    @Column(name = "id", updatable = false, nullable = false)
    private UUID id;

    /**
     * Owning user. Null once the poster's account has been deleted.
     */
    @Column(name = "poster_id")
    private UUID posterId;

    @Column(name = "title", nullable = false, length = 200)
    private String title;

    @Column(name = "description")
    private String description;

    /**
     * Reward in currency units with two decimals.
     */
    @Column(name = "amount", nullable = false, precision = 12, scale = 2)
    private BigDecimal amount;

    @Column(name = "is_for_honor", nullable = false)
    private boolean forHonor;

    @Enumerated(EnumType.STRING)
    @Column(name = "work_type", nullable = false, length = 16)
    private WorkType workType;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false, length = 16)
    private BountyStatus status;

    @Column(name = "accepted_hunter_id")
    private UUID acceptedHunterId;

    @Column(name = "created_at", nullable = false)
    private LocalDateTime createdAt;

    @Column(name = "updated_at", nullable = false)
    private LocalDateTime updatedAt;

    /**
     * @return true if accepting this bounty moves money into escrow
     */
    public boolean requiresEscrow() {
        return !forHonor && amount != null && amount.signum() > 0;
    }
}
