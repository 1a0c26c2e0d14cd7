package com.nosota.bounty.notification;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThatCode;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.verify;

@ExtendWith(MockitoExtension.class)
class NotificationRelayTest {

    @Mock
    private NotificationDispatcher notificationDispatcher;

    @InjectMocks
    private NotificationRelay notificationRelay;

    @Test
    void dispatchesEvent() {
        LifecycleEvent event = LifecycleEvent.of(LifecycleEventType.REQUEST_ACCEPTED,
                UUID.randomUUID(), UUID.randomUUID(), UUID.randomUUID());

        notificationRelay.relay(event);

        verify(notificationDispatcher).dispatch(event);
    }

    @Test
    void dispatcherFailureDoesNotPropagate() {
        LifecycleEvent event = LifecycleEvent.of(LifecycleEventType.BOUNTY_CANCELLED,
                UUID.randomUUID(), UUID.randomUUID(), null);
        doThrow(new IllegalStateException("broker down")).when(notificationDispatcher).dispatch(event);

        assertThatCode(() -> notificationRelay.relay(event)).doesNotThrowAnyException();
        verify(notificationDispatcher).dispatch(event);
    }
}
