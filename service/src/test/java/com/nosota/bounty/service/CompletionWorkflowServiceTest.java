package com.nosota.bounty.service;

import com.nosota.bounty.api.model.BountyStatus;
import com.nosota.bounty.api.model.CallerIdentity;
import com.nosota.bounty.api.model.DisputeStatus;
import com.nosota.bounty.api.model.LifecycleErrorKind;
import com.nosota.bounty.api.model.SubmissionStatus;
import com.nosota.bounty.error.BountyLifecycleException;
import com.nosota.bounty.model.Bounty;
import com.nosota.bounty.model.CompletionSubmission;
import com.nosota.bounty.notification.LifecycleEvent;
import com.nosota.bounty.notification.LifecycleEventType;
import com.nosota.bounty.repository.BountyRepository;
import com.nosota.bounty.repository.CompletionSubmissionRepository;
import com.nosota.bounty.repository.DisputeRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.context.ApplicationEventPublisher;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class CompletionWorkflowServiceTest {

    @Mock
    private BountyRepository bountyRepository;

    @Mock
    private CompletionSubmissionRepository submissionRepository;

    @Mock
    private DisputeRepository disputeRepository;

    @Mock
    private ApplicationEventPublisher eventPublisher;

    @InjectMocks
    private CompletionWorkflowService completionWorkflowService;

    private UUID posterId;
    private UUID hunterId;
    private Bounty bounty;

    @BeforeEach
    void setUp() {
        posterId = UUID.randomUUID();
        hunterId = UUID.randomUUID();
        bounty = new Bounty();
        bounty.setId(UUID.randomUUID());
        bounty.setPosterId(posterId);
        bounty.setAcceptedHunterId(hunterId);
        bounty.setStatus(BountyStatus.IN_PROGRESS);
    }

    @Test
    void submitRecordsPendingSubmissionAndNotifiesPoster() {
        when(bountyRepository.findByIdForUpdate(bounty.getId())).thenReturn(Optional.of(bounty));
        when(submissionRepository.findFirstByBountyIdAndStatus(bounty.getId(), SubmissionStatus.PENDING))
                .thenReturn(Optional.empty());

        CompletionSubmission submission = completionWorkflowService.submit(CallerIdentity.verified(hunterId),
                bounty.getId(), "Done", List.of("https://example.org/photo-1.jpg"));

        assertThat(submission.getStatus()).isEqualTo(SubmissionStatus.PENDING);
        assertThat(submission.getHunterId()).isEqualTo(hunterId);
        assertThat(submission.getProofItems()).containsExactly("https://example.org/photo-1.jpg");
        verify(submissionRepository).save(submission);
        ArgumentCaptor<LifecycleEvent> event = ArgumentCaptor.forClass(LifecycleEvent.class);
        verify(eventPublisher).publishEvent(event.capture());
        assertThat(event.getValue().type()).isEqualTo(LifecycleEventType.SUBMISSION_RECEIVED);
        assertThat(event.getValue().recipientId()).isEqualTo(posterId);
    }

    @Test
    void onlyAcceptedHunterMaySubmit() {
        when(bountyRepository.findByIdForUpdate(bounty.getId())).thenReturn(Optional.of(bounty));

        assertThatThrownBy(() -> completionWorkflowService.submit(CallerIdentity.verified(posterId),
                bounty.getId(), "Done", List.of()))
                .isInstanceOf(BountyLifecycleException.class)
                .extracting("kind")
                .isEqualTo(LifecycleErrorKind.NOT_ACCEPTED_HUNTER);
        verify(submissionRepository, never()).save(any());
    }

    @Test
    void secondPendingSubmissionIsRejected() {
        when(bountyRepository.findByIdForUpdate(bounty.getId())).thenReturn(Optional.of(bounty));
        when(submissionRepository.findFirstByBountyIdAndStatus(bounty.getId(), SubmissionStatus.PENDING))
                .thenReturn(Optional.of(new CompletionSubmission()));

        assertThatThrownBy(() -> completionWorkflowService.submit(CallerIdentity.verified(hunterId),
                bounty.getId(), "Done again", List.of()))
                .isInstanceOf(BountyLifecycleException.class)
                .extracting("kind")
                .isEqualTo(LifecycleErrorKind.SUBMISSION_ALREADY_PENDING);
    }

    @Test
    void openDisputeBlocksSubmission() {
        when(bountyRepository.findByIdForUpdate(bounty.getId())).thenReturn(Optional.of(bounty));
        when(disputeRepository.existsByBountyIdAndStatus(bounty.getId(), DisputeStatus.OPEN)).thenReturn(true);

        assertThatThrownBy(() -> completionWorkflowService.submit(CallerIdentity.verified(hunterId),
                bounty.getId(), "Done", List.of()))
                .isInstanceOf(BountyLifecycleException.class)
                .extracting("kind")
                .isEqualTo(LifecycleErrorKind.DISPUTE_OPEN);
    }

    @Test
    void removedHunterSubmissionIsSentBack() {
        CompletionSubmission pending = new CompletionSubmission();
        pending.setStatus(SubmissionStatus.PENDING);
        when(submissionRepository.findByBountyIdAndHunterIdAndStatus(bounty.getId(), hunterId, SubmissionStatus.PENDING))
                .thenReturn(List.of(pending));

        int affected = completionWorkflowService.supersedeForRemovedHunter(bounty.getId(), hunterId);

        assertThat(affected).isEqualTo(1);
        assertThat(pending.getStatus()).isEqualTo(SubmissionStatus.REVISION_REQUESTED);
        assertThat(pending.getReviewFeedback()).isEqualTo("Hunter account removed");
        assertThat(pending.getReviewedAt()).isNotNull();
    }
}
