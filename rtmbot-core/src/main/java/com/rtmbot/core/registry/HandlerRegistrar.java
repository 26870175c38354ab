package com.rtmbot.core.registry;

/**
 * Accepts handler registrations, wiring commands into the grammar as well as
 * the registry.
 */
public interface HandlerRegistrar {

    void register(HandlerSpec spec);
}
