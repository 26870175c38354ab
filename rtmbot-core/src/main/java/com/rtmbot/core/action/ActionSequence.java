package com.rtmbot.core.action;

import java.io.IOException;
import java.util.List;

/**
 * An ordered group of actions. The executor expands it on its work stack;
 * see {@link ActionExecutor} for the resulting order.
 */
public final class ActionSequence implements Action {

    private final List<Action> actions;

    public ActionSequence(List<Action> actions) {
        this.actions = List.copyOf(actions);
    }

    public List<Action> getActions() {
        return actions;
    }

    /**
     * Runs the whole sequence on a private executor, for callers holding a
     * sequence outside of {@link ActionExecutor}. The executor itself never
     * calls this; it expands the sequence on its own stack.
     */
    @Override
    public Action execute(ActionContext context) throws IOException, InterruptedException {
        new ActionExecutor().execute(this, context);
        return null;
    }

    @Override
    public String toString() {
        return "ActionSequence" + actions;
    }
}
