package com.rtmbot.core.correlation;

import com.rtmbot.core.action.Action;

/**
 * Invoked when the service confirms delivery of a sent message.
 */
@FunctionalInterface
public interface DeliveryCallback {

    /**
     * @return the next action to run, or {@code null}
     */
    Action onDelivered();
}
