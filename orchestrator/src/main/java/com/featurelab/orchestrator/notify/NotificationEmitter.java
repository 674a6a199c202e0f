package com.featurelab.orchestrator.notify;

/**
 * Push channel to a user's live client connections.
 *
 * Delivery is best effort: there is no confirmation and no retry. Callers
 * must not rely on the user being connected, and implementations must not
 * throw when they are not.
 */
public interface NotificationEmitter {

    void push(String username, Notification notification);
}
