package com.rtmbot.core.registry;

import com.rtmbot.core.action.Action;

/**
 * User-supplied command or message handler.
 */
@FunctionalInterface
public interface Handler {

    /**
     * @return the action to execute, or {@code null} for none
     */
    Action handle(HandlerRequest request) throws Exception;
}
