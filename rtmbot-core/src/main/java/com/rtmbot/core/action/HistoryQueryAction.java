package com.rtmbot.core.action;

import com.rtmbot.core.history.HistoryRecord;

import java.io.IOException;
import java.util.List;
import java.util.function.Function;

/**
 * Query archived history and hand the records to a continuation, whose
 * returned action runs next. A {@code null} filter matches everything.
 */
public final class HistoryQueryAction implements Action {

    private final String channelName;
    private final String userId;
    private final Function<List<HistoryRecord>, Action> continuation;

    public HistoryQueryAction(String channelName, String userId,
                              Function<List<HistoryRecord>, Action> continuation) {
        this.channelName = channelName;
        this.userId = userId;
        this.continuation = continuation;
    }

    @Override
    public Action execute(ActionContext context) throws IOException {
        List<HistoryRecord> records = context.history().query(channelName, userId);
        return continuation.apply(records);
    }

    @Override
    public String toString() {
        return "HistoryQuery[channel=" + channelName + ", user=" + userId + "]";
    }
}
