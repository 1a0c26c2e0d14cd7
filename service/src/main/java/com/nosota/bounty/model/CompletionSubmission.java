package com.nosota.bounty.model;

import com.nosota.bounty.api.model.SubmissionStatus;
import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.hibernate.annotations.GenericGenerator;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * A hunter's declaration of finished work plus ordered proof references.
 * At most one PENDING submission exists per bounty (partial unique index in V1).
 */
@Entity
@Table(name = "completion_submissions")
@Getter
@Setter
@AllArgsConstructor
@NoArgsConstructor
public class CompletionSubmission {

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

    @Column(name = "message")
    private String message;

    @ElementCollection(fetch = FetchType.EAGER)
    @CollectionTable(name = "completion_proof_items", joinColumns = @JoinColumn(name = "submission_id"))
    @OrderColumn(name = "position")
    @Column(name = "item", nullable = false, length = 1000)
    private List<String> proofItems = new ArrayList<>();

    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false, length = 24)
    private SubmissionStatus status;

    @Column(name = "review_feedback")
    private String reviewFeedback;

    @Column(name = "submitted_at", nullable = false)
    private LocalDateTime submittedAt;

    @Column(name = "reviewed_at")
    private LocalDateTime reviewedAt;
}
