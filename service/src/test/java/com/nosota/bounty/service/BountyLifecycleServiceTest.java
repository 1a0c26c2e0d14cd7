package com.nosota.bounty.service;

import com.nosota.bounty.api.model.BountyStatus;
import com.nosota.bounty.api.model.CallerIdentity;
import com.nosota.bounty.api.model.CancellationStatus;
import com.nosota.bounty.api.model.LifecycleErrorKind;
import com.nosota.bounty.api.model.RequestStatus;
import com.nosota.bounty.api.model.SubmissionStatus;
import com.nosota.bounty.api.model.WorkType;
import com.nosota.bounty.api.request.CreateBountyRequest;
import com.nosota.bounty.config.BountyProperties;
import com.nosota.bounty.error.BountyLifecycleException;
import com.nosota.bounty.model.Bounty;
import com.nosota.bounty.model.BountyCancellation;
import com.nosota.bounty.model.BountyRequest;
import com.nosota.bounty.model.CompletionSubmission;
import com.nosota.bounty.notification.LifecycleEvent;
import com.nosota.bounty.notification.LifecycleEventType;
import com.nosota.bounty.repository.BountyCancellationRepository;
import com.nosota.bounty.repository.BountyRepository;
import com.nosota.bounty.repository.BountyRequestRepository;
import com.nosota.bounty.repository.DisputeRepository;
import com.nosota.bounty.repository.ProfileRepository;
import org.assertj.core.api.ThrowableAssert.ThrowingCallable;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.context.ApplicationEventPublisher;

import java.math.BigDecimal;
import java.util.Optional;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class BountyLifecycleServiceTest {

    @Mock
    private BountyRepository bountyRepository;

    @Mock
    private BountyRequestRepository bountyRequestRepository;

    @Mock
    private DisputeRepository disputeRepository;

    @Mock
    private BountyCancellationRepository cancellationRepository;

    @Mock
    private ProfileRepository profileRepository;

    @Mock
    private BountyRequestService bountyRequestService;

    @Mock
    private CompletionWorkflowService completionWorkflowService;

    @Mock
    private EscrowLedgerService escrowLedgerService;

    @Mock
    private ApplicationEventPublisher eventPublisher;

    private BountyLifecycleService lifecycleService;

    private UUID posterId;
    private UUID hunterId;
    private Bounty bounty;

    @BeforeEach
    void setUp() {
        lifecycleService = new BountyLifecycleService(bountyRepository, bountyRequestRepository, disputeRepository,
                cancellationRepository, profileRepository, bountyRequestService, completionWorkflowService, escrowLedgerService,
                new BountyStatusStateMachine(), new BountyProperties(), eventPublisher);

        posterId = UUID.randomUUID();
        hunterId = UUID.randomUUID();
        bounty = new Bounty();
        bounty.setId(UUID.randomUUID());
        bounty.setPosterId(posterId);
        bounty.setAmount(new BigDecimal("50.00"));
        bounty.setWorkType(WorkType.ONLINE);
        bounty.setStatus(BountyStatus.IN_PROGRESS);
        bounty.setAcceptedHunterId(hunterId);
    }

    @Test
    void failedPayoutLeavesBountyInProgress() {
        CompletionSubmission submission = submission();
        when(bountyRepository.findByIdForUpdate(bounty.getId())).thenReturn(Optional.of(bounty));
        when(completionWorkflowService.requirePending(bounty.getId())).thenReturn(submission);
        when(escrowLedgerService.release(bounty))
                .thenThrow(new BountyLifecycleException(LifecycleErrorKind.PAYOUT_FAILED, "processor declined"));

        assertRejected(() -> lifecycleService.approveCompletion(CallerIdentity.verified(posterId), bounty.getId()),
                LifecycleErrorKind.PAYOUT_FAILED);

        assertThat(bounty.getStatus()).isEqualTo(BountyStatus.IN_PROGRESS);
        assertThat(submission.getStatus()).isEqualTo(SubmissionStatus.PENDING);
        verify(completionWorkflowService, never()).approve(any());
        verify(bountyRepository, never()).save(any());
        verifyNoInteractions(eventPublisher);
    }

    @Test
    void approvalCompletesAndNotifiesHunter() {
        CompletionSubmission submission = submission();
        when(bountyRepository.findByIdForUpdate(bounty.getId())).thenReturn(Optional.of(bounty));
        when(completionWorkflowService.requirePending(bounty.getId())).thenReturn(submission);

        lifecycleService.approveCompletion(CallerIdentity.verified(posterId), bounty.getId());

        assertThat(bounty.getStatus()).isEqualTo(BountyStatus.COMPLETED);
        verify(escrowLedgerService).release(bounty);
        verify(completionWorkflowService).approve(submission);
        ArgumentCaptor<LifecycleEvent> event = ArgumentCaptor.forClass(LifecycleEvent.class);
        verify(eventPublisher).publishEvent(event.capture());
        assertThat(event.getValue().type()).isEqualTo(LifecycleEventType.SUBMISSION_APPROVED);
        assertThat(event.getValue().recipientId()).isEqualTo(hunterId);
    }

    @Test
    void approvalClosesUnansweredCancellationRequest() {
        CompletionSubmission submission = submission();
        BountyCancellation cancellation = new BountyCancellation();
        cancellation.setId(UUID.randomUUID());
        cancellation.setBountyId(bounty.getId());
        cancellation.setRequesterId(hunterId);
        cancellation.setStatus(CancellationStatus.PENDING);
        when(bountyRepository.findByIdForUpdate(bounty.getId())).thenReturn(Optional.of(bounty));
        when(completionWorkflowService.requirePending(bounty.getId())).thenReturn(submission);
        when(cancellationRepository.findFirstByBountyIdAndStatus(bounty.getId(), CancellationStatus.PENDING))
                .thenReturn(Optional.of(cancellation));

        lifecycleService.approveCompletion(CallerIdentity.verified(posterId), bounty.getId());

        assertThat(cancellation.getStatus()).isEqualTo(CancellationStatus.CLOSED);
        assertThat(cancellation.getResolvedAt()).isNotNull();
        verify(cancellationRepository).save(cancellation);
    }

    @Test
    void cancelWithdrawsAndNotifiesHunter() {
        when(bountyRepository.findByIdForUpdate(bounty.getId())).thenReturn(Optional.of(bounty));

        lifecycleService.cancel(CallerIdentity.verified(posterId), bounty.getId());

        assertThat(bounty.getStatus()).isEqualTo(BountyStatus.CANCELLED);
        assertThat(bounty.getAcceptedHunterId()).isNull();
        verify(escrowLedgerService).refund(bounty);
        verify(bountyRequestService).rejectPending(bounty.getId(), null);
        ArgumentCaptor<LifecycleEvent> event = ArgumentCaptor.forClass(LifecycleEvent.class);
        verify(eventPublisher).publishEvent(event.capture());
        assertThat(event.getValue().type()).isEqualTo(LifecycleEventType.BOUNTY_CANCELLED);
        assertThat(event.getValue().recipientId()).isEqualTo(hunterId);
    }

    @Test
    void revisionRefusedAtLimit() {
        CompletionSubmission submission = submission();
        when(bountyRepository.findByIdForUpdate(bounty.getId())).thenReturn(Optional.of(bounty));
        when(completionWorkflowService.requirePending(bounty.getId())).thenReturn(submission);
        when(completionWorkflowService.countRevisions(bounty.getId(), hunterId)).thenReturn(3L);

        assertRejected(() -> lifecycleService.requestRevision(CallerIdentity.verified(posterId), bounty.getId(), "Again"),
                LifecycleErrorKind.REVISION_LIMIT_REACHED);

        verify(completionWorkflowService, never()).markRevisionRequested(any(), anyString());
        verifyNoInteractions(eventPublisher);
    }

    @Test
    void revisionBelowLimitSendsSubmissionBack() {
        CompletionSubmission submission = submission();
        when(bountyRepository.findByIdForUpdate(bounty.getId())).thenReturn(Optional.of(bounty));
        when(completionWorkflowService.requirePending(bounty.getId())).thenReturn(submission);
        when(completionWorkflowService.countRevisions(bounty.getId(), hunterId)).thenReturn(2L);

        lifecycleService.requestRevision(CallerIdentity.verified(posterId), bounty.getId(), "  Crop the photos  ");

        verify(completionWorkflowService).markRevisionRequested(submission, "Crop the photos");
        assertThat(bounty.getStatus()).isEqualTo(BountyStatus.IN_PROGRESS);
    }

    @Test
    void blankFeedbackIsRejected() {
        when(bountyRepository.findByIdForUpdate(bounty.getId())).thenReturn(Optional.of(bounty));

        assertRejected(() -> lifecycleService.requestRevision(CallerIdentity.verified(posterId), bounty.getId(), " "),
                LifecycleErrorKind.INVALID_FEEDBACK);
        verifyNoInteractions(completionWorkflowService);
    }

    @Test
    void honorBountyWithAmountIsInvalid() {
        CreateBountyRequest details = new CreateBountyRequest("Walk the dog", null, new BigDecimal("5.00"),
                true, WorkType.IN_PERSON);

        assertRejected(() -> lifecycleService.open(CallerIdentity.verified(posterId), details),
                LifecycleErrorKind.INVALID_AMOUNT);
        verifyNoInteractions(profileRepository, bountyRepository);
    }

    @Test
    void amountWithThreeDecimalsIsInvalid() {
        CreateBountyRequest details = new CreateBountyRequest("Fix a tap", null, new BigDecimal("10.005"),
                false, WorkType.IN_PERSON);

        assertRejected(() -> lifecycleService.open(CallerIdentity.verified(posterId), details),
                LifecycleErrorKind.INVALID_AMOUNT);
    }

    @Test
    void unverifiedCallerCannotPost() {
        CreateBountyRequest details = new CreateBountyRequest("Fix a tap", null, new BigDecimal("10.00"),
                false, WorkType.IN_PERSON);

        assertRejected(() -> lifecycleService.open(CallerIdentity.unverified(posterId), details),
                LifecycleErrorKind.EMAIL_NOT_VERIFIED);
    }

    @Test
    void failedHoldLeavesRequestPending() {
        bounty.setStatus(BountyStatus.OPEN);
        bounty.setAcceptedHunterId(null);
        BountyRequest request = new BountyRequest();
        request.setId(UUID.randomUUID());
        request.setBountyId(bounty.getId());
        request.setHunterId(hunterId);
        request.setStatus(RequestStatus.PENDING);
        when(bountyRepository.findByIdForUpdate(bounty.getId())).thenReturn(Optional.of(bounty));
        when(bountyRequestService.requireRequestOf(bounty.getId(), request.getId())).thenReturn(request);
        when(escrowLedgerService.hold(bounty))
                .thenThrow(new BountyLifecycleException(LifecycleErrorKind.INSUFFICIENT_BALANCE, "balance 10.00"));

        assertRejected(() -> lifecycleService.acceptRequest(CallerIdentity.verified(posterId), bounty.getId(), request.getId()),
                LifecycleErrorKind.INSUFFICIENT_BALANCE);

        assertThat(request.getStatus()).isEqualTo(RequestStatus.PENDING);
        assertThat(bounty.getStatus()).isEqualTo(BountyStatus.OPEN);
        assertThat(bounty.getAcceptedHunterId()).isNull();
        verify(bountyRequestService, never()).rejectPending(any(), any());
    }

    @Test
    void acceptOnStartedBountyIsRejected() {
        when(bountyRepository.findByIdForUpdate(bounty.getId())).thenReturn(Optional.of(bounty));

        assertRejected(() -> lifecycleService.acceptRequest(CallerIdentity.verified(posterId), bounty.getId(), UUID.randomUUID()),
                LifecycleErrorKind.BOUNTY_NOT_OPEN);
        verifyNoInteractions(escrowLedgerService);
    }

    @Test
    void onlyPosterMayCancel() {
        when(bountyRepository.findByIdForUpdate(bounty.getId())).thenReturn(Optional.of(bounty));

        assertRejected(() -> lifecycleService.cancel(CallerIdentity.verified(hunterId), bounty.getId()),
                LifecycleErrorKind.NOT_BOUNTY_POSTER);
        verifyNoInteractions(escrowLedgerService);
    }

    @Test
    void cancellingCancelledBountyChangesNothing() {
        bounty.setStatus(BountyStatus.CANCELLED);
        bounty.setAcceptedHunterId(null);
        when(bountyRepository.findByIdForUpdate(bounty.getId())).thenReturn(Optional.of(bounty));

        Bounty result = lifecycleService.cancel(CallerIdentity.verified(posterId), bounty.getId());

        assertThat(result.getStatus()).isEqualTo(BountyStatus.CANCELLED);
        verifyNoInteractions(escrowLedgerService, eventPublisher);
        verify(bountyRepository, never()).save(any());
    }

    @Test
    void missingBountyIsNotFound() {
        UUID bountyId = UUID.randomUUID();
        when(bountyRepository.findByIdForUpdate(bountyId)).thenReturn(Optional.empty());

        assertRejected(() -> lifecycleService.cancel(CallerIdentity.verified(posterId), bountyId),
                LifecycleErrorKind.BOUNTY_NOT_FOUND);
    }

    private CompletionSubmission submission() {
        CompletionSubmission submission = new CompletionSubmission();
        submission.setId(UUID.randomUUID());
        submission.setBountyId(bounty.getId());
        submission.setHunterId(hunterId);
        submission.setStatus(SubmissionStatus.PENDING);
        return submission;
    }

    private static void assertRejected(ThrowingCallable call, LifecycleErrorKind kind) {
        assertThatThrownBy(call)
                .isInstanceOf(BountyLifecycleException.class)
                .extracting("kind")
                .isEqualTo(kind);
    }
}
