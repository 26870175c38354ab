package com.rtmbot.core.registry;

/**
 * A bundle of handlers installed together.
 */
public interface BotPlugin {

    String getName();

    void registerHandlers(HandlerRegistrar registrar);
}
