package com.rtmbot.core.dispatch;

import com.rtmbot.core.action.Action;
import com.rtmbot.core.action.ActionContext;
import com.rtmbot.core.action.ActionExecutor;
import com.rtmbot.core.action.SendMessageAction;
import com.rtmbot.core.correlation.PendingResponse;
import com.rtmbot.core.correlation.PendingResponses;
import com.rtmbot.core.grammar.CommandGrammar;
import com.rtmbot.core.grammar.GrammarMatch;
import com.rtmbot.core.grammar.ParsedArgs;
import com.rtmbot.core.history.HistoryStore;
import com.rtmbot.core.history.MessageArchiver;
import com.rtmbot.core.identity.IdentityMap;
import com.rtmbot.core.registry.HandlerRegistrar;
import com.rtmbot.core.registry.HandlerRegistry;
import com.rtmbot.core.registry.HandlerRequest;
import com.rtmbot.core.registry.HandlerSpec;
import com.rtmbot.core.transport.ChatTransport;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Routes inbound events to handlers and runs what they return.
 * <p>
 * Messages are matched against the command grammar; a match runs the named
 * handler, subject to its channel restriction and admin flag. Channel
 * messages that are not commands go to every unfiltered handler and then to
 * the archive. A direct message that is not a command gets the help text.
 * Delivery confirmations fire the callback registered with the send.
 */
@Slf4j
public class EventDispatcher implements HandlerRegistrar {

    public static final String ADMIN_ONLY_REPLY = "That command is admin only.";

    private final CommandGrammar grammar;
    private final HandlerRegistry registry;
    private final ActionExecutor executor;
    private final ChatTransport transport;
    private final PendingResponses pendingResponses;
    private final MessageArchiver archiver;

    private volatile IdentityMap identity = new IdentityMap();
    private volatile Set<String> adminIds = Set.of();

    public EventDispatcher(CommandGrammar grammar, HandlerRegistry registry, ActionExecutor executor,
                           ChatTransport transport, PendingResponses pendingResponses,
                           MessageArchiver archiver) {
        this.grammar = grammar;
        this.registry = registry;
        this.executor = executor;
        this.transport = transport;
        this.pendingResponses = pendingResponses;
        this.archiver = archiver;
    }

    // =========================================================================
    // Registration
    // =========================================================================

    @Override
    public void register(HandlerSpec spec) {
        if (spec.getName() == null || spec.getHandler() == null) {
            throw new IllegalArgumentException("Handler needs a name and a callback");
        }
        if (spec.isUnfiltered()) {
            registry.register(spec, true);
            return;
        }
        grammar.add(spec.getExpression(), spec.getName(), spec.getPriority());
        registry.register(spec, false);
    }

    /**
     * Install the lookups of a new connection.
     */
    public void bind(IdentityMap identity, Set<String> adminIds) {
        this.identity = identity;
        this.adminIds = Set.copyOf(adminIds);
    }

    public IdentityMap getIdentity() {
        return identity;
    }

    public Set<String> getAdminIds() {
        return adminIds;
    }

    public CommandGrammar getGrammar() {
        return grammar;
    }

    public HandlerRegistry getRegistry() {
        return registry;
    }

    public boolean isAdmin(String userId) {
        return adminIds.contains(userId);
    }

    // =========================================================================
    // Dispatch
    // =========================================================================

    public void dispatch(InboundEvent event) throws IOException, InterruptedException {
        switch (event.kind()) {
            case MESSAGE -> handleMessage(event);
            case DELIVERY_CONFIRMATION -> handleConfirmation(event);
            case GROUP_JOIN -> handleGroupJoin(event);
            case TEAM_JOIN -> handleTeamJoin(event);
            case OTHER -> log.trace("Ignoring event type {}", event.getType());
        }
    }

    /**
     * Run an action outside of any handler, e.g. one queued before connecting.
     */
    public void execute(Action action, InboundEvent event) throws IOException, InterruptedException {
        executor.execute(action, contextFor(event));
    }

    void handleMessage(InboundEvent event) throws IOException, InterruptedException {
        String userId = event.getUser();
        String channelId = event.getChannel();
        String text = event.getText();
        boolean directMessage = IdentityMap.isDirectMessage(channelId);
        String channelName = directMessage ? null : identity.findChannelName(channelId).orElse(channelId);

        GrammarMatch match = GrammarMatch.noMatch();
        if (directMessage || grammar.hasAlertPrefix(text)) {
            match = grammar.match(text, directMessage);
            Optional<HandlerSpec> handler = match instanceof GrammarMatch.Matched matched
                    ? registry.lookupFiltered(matched.name())
                    : Optional.empty();
            if (handler.isEmpty()) {
                if (directMessage) {
                    execute(new SendMessageAction(null, userId, registry.helpText(isAdmin(userId))), event);
                }
            } else if (directMessage || handler.get().allowsChannel(channelName)) {
                HandlerSpec spec = handler.get();
                Action result;
                if (spec.isAdminOnly() && !isAdmin(userId)) {
                    log.info("User {} denied admin command {}", userId, spec.getName());
                    result = new SendMessageAction(null, null, ADMIN_ONLY_REPLY);
                } else {
                    ParsedArgs args = ((GrammarMatch.Matched) match).args();
                    result = invoke(spec, new HandlerRequest(userId, channelName, text, args,
                            spec.isIncludeTimestamp() ? event.getTimestamp() : null));
                }
                execute(result, event);
            } else {
                log.debug("Command {} not allowed in {}", handler.get().getName(), channelName);
            }
        }

        if (!directMessage && !match.isMatched()) {
            for (HandlerSpec spec : registry.unfilteredHandlers()) {
                if (!spec.allowsChannel(channelName)) {
                    continue;
                }
                Action result = invoke(spec, new HandlerRequest(userId, channelName, text, ParsedArgs.empty(),
                        spec.isIncludeTimestamp() ? event.getTimestamp() : null));
                execute(result, event);
            }
            archiver.archive(userId, channelName, text, event.getTimestamp());
        }
    }

    void handleConfirmation(InboundEvent event) throws IOException, InterruptedException {
        Optional<Long> replyTo = event.getReplyTo();
        if (replyTo.isEmpty()) {
            return;
        }
        long id = replyTo.get();
        Optional<PendingResponse> pending = pendingResponses.get(id);
        if (pending.isEmpty()) {
            log.trace("No pending response for message {}", id);
            return;
        }
        event.setChannel(pending.get().channelId());
        execute(pending.get().callback().onDelivered(), event);
        pendingResponses.remove(id);
    }

    void handleGroupJoin(InboundEvent event) {
        Map<String, Object> channel = event.getObject("channel");
        Object name = channel.get("name");
        Object id = channel.get("id");
        if (name != null && id != null) {
            identity.addChannel(name.toString(), id.toString());
            log.info("Joined group {} ({})", name, id);
        }
    }

    void handleTeamJoin(InboundEvent event) {
        Map<String, Object> user = event.getObject("user");
        Object name = user.get("name");
        Object id = user.get("id");
        if (name != null && id != null) {
            identity.addUser(name.toString(), id.toString());
            log.info("New team member {} ({})", name, id);
        }
    }

    private Action invoke(HandlerSpec spec, HandlerRequest request) {
        try {
            return spec.getHandler().handle(request);
        } catch (Exception e) {
            if (e instanceof InterruptedException) {
                Thread.currentThread().interrupt();
            }
            throw new HandlerInvocationException(spec.getName(), request.userId(), request.channelName(), e);
        }
    }

    private ActionContext contextFor(InboundEvent event) {
        HistoryStore history = archiver.getStore();
        return new ActionContext(transport, identity, history, event);
    }
}
