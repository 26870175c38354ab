package com.rtmbot.core.action;

import java.io.IOException;

/**
 * A side effect requested by a handler.
 * <p>
 * Executing an action may produce a follow-up action, which is executed in
 * turn; {@code null} ends the chain. Handlers may return lambdas for custom
 * effects.
 */
@FunctionalInterface
public interface Action {

    Action execute(ActionContext context) throws IOException, InterruptedException;
}
