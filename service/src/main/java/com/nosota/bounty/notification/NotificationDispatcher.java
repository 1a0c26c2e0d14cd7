package com.nosota.bounty.notification;

/**
 * Delivers lifecycle events to users. Best effort: implementations may throw, the relay logs and drops.
 */
public interface NotificationDispatcher {

    void dispatch(LifecycleEvent event);
}
