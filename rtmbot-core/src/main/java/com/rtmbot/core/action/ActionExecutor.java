package com.rtmbot.core.action;

import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.util.ArrayDeque;
import java.util.Deque;

/**
 * Runs an action tree to completion.
 * <p>
 * Uses an explicit work stack. A sequence pushes its elements in list order,
 * so the last element runs first, and everything an action yields runs before
 * the next element of the enclosing sequence. For {@code [A, B, C]} the order
 * is C (and C's follow-ups), then B, then A. Exceptions stop the run and
 * propagate.
 */
@Slf4j
public class ActionExecutor {

    public void execute(Action root, ActionContext context) throws IOException, InterruptedException {
        if (root == null) {
            return;
        }
        Deque<Action> stack = new ArrayDeque<>();
        stack.push(root);
        while (!stack.isEmpty()) {
            Action action = stack.pop();
            if (action instanceof ActionSequence sequence) {
                for (Action element : sequence.getActions()) {
                    if (element != null) {
                        stack.push(element);
                    }
                }
                continue;
            }
            log.trace("Executing {}", action);
            Action next = action.execute(context);
            if (next != null) {
                stack.push(next);
            }
        }
    }
}
