package com.rtmbot.app.examples;

import com.rtmbot.core.action.Action;
import com.rtmbot.core.action.Actions;
import com.rtmbot.core.history.HistoryRecord;
import com.rtmbot.core.registry.BotPlugin;
import com.rtmbot.core.registry.HandlerRegistrar;
import com.rtmbot.core.registry.HandlerRequest;
import com.rtmbot.core.registry.HandlerSpec;
import org.springframework.stereotype.Component;

import java.util.List;

import static com.rtmbot.core.grammar.CommandExpressions.CHANNEL_NAME;
import static com.rtmbot.core.grammar.CommandExpressions.WORD;
import static com.rtmbot.core.grammar.CommandExpressions.compile;
import static com.rtmbot.core.grammar.CommandExpressions.end;
import static com.rtmbot.core.grammar.CommandExpressions.literal;
import static com.rtmbot.core.grammar.CommandExpressions.named;
import static com.rtmbot.core.grammar.CommandExpressions.optional;

/**
 * Minimal example bot: say hello, greet someone by name, and (for admins)
 * count archived messages.
 */
@Component
public class GreeterPlugin implements BotPlugin {

    @Override
    public String getName() {
        return "greeter";
    }

    @Override
    public void registerHandlers(HandlerRegistrar registrar) {
        registrar.register(HandlerSpec.builder()
                .name("Hello World")
                .expression(compile(literal("hello"), end()))
                .doc("Say hello.")
                .handler(this::hello)
                .build());
        registrar.register(HandlerSpec.builder()
                .name("Greeter")
                .expression(compile(literal("greet"), optional(named("name", WORD)), end()))
                .doc("Greet a user\n\tgreet [name]")
                .handler(this::greet)
                .build());
        registrar.register(HandlerSpec.builder()
                .name("History")
                .expression(compile(literal("history"), optional(named("channel", CHANNEL_NAME)), end()))
                .doc("Count archived messages\n\thistory [channel]")
                .adminOnly(true)
                .handler(this::history)
                .build());
    }

    Action hello(HandlerRequest request) {
        return Actions.respond(request.channelName(), request.userId(), "Hello World");
    }

    Action greet(HandlerRequest request) {
        String greeting = request.args().get("name")
                .map(name -> "Hello " + name)
                .orElse("Hello");
        return Actions.respond(request.channelName(), request.userId(), greeting);
    }

    Action history(HandlerRequest request) {
        String channel = request.args().getOrDefault("channel", request.channelName());
        return Actions.history(channel, null, records -> Actions.respond(
                request.channelName(), request.userId(), describe(channel, records)));
    }

    static String describe(String channel, List<HistoryRecord> records) {
        String where = channel != null ? "#" + channel : "all channels";
        return records.size() + (records.size() == 1 ? " message" : " messages") + " archived for " + where;
    }
}
