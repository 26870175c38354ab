package com.rtmbot.core.registry;

import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeSet;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Filtered handlers keyed by name, plus the ordered list of unfiltered ones.
 */
@Slf4j
public class HandlerRegistry {

    private final Map<String, HandlerSpec> filtered = new LinkedHashMap<>();
    private final List<HandlerSpec> unfiltered = new CopyOnWriteArrayList<>();

    // =========================================================================
    // Registration
    // =========================================================================

    /**
     * Register a handler. A filtered handler replaces any earlier one with the
     * same name and keeps that one's position in the help listing.
     */
    public void register(HandlerSpec spec, boolean unfilteredHandler) {
        if (unfilteredHandler) {
            unfiltered.add(spec);
            log.debug("Registered unfiltered handler: {}", spec.getName());
            return;
        }
        synchronized (filtered) {
            HandlerSpec previous = filtered.put(spec.getName(), spec);
            if (previous != null) {
                log.warn("Handler {} replaced", spec.getName());
            } else {
                log.debug("Registered command handler: {}", spec.getName());
            }
        }
    }

    // =========================================================================
    // Lookup
    // =========================================================================

    public Optional<HandlerSpec> lookupFiltered(String name) {
        synchronized (filtered) {
            return Optional.ofNullable(filtered.get(name));
        }
    }

    public List<HandlerSpec> filteredHandlers() {
        synchronized (filtered) {
            return List.copyOf(filtered.values());
        }
    }

    public List<HandlerSpec> unfilteredHandlers() {
        return List.copyOf(unfiltered);
    }

    /**
     * Documentation for every documented command the requester may use, one
     * block per command in registration order.
     */
    public String helpText(boolean requesterIsAdmin) {
        List<String> blocks = new ArrayList<>();
        for (HandlerSpec spec : filteredHandlers()) {
            if (!spec.hasDoc() || (spec.isAdminOnly() && !requesterIsAdmin)) {
                continue;
            }
            String allowed = spec.getChannels() == null
                    ? "All"
                    : String.join(", ", new TreeSet<>(spec.getChannels()));
            blocks.add(spec.getName() + ":\n\t" + spec.getDoc() + "\n\tAllowed channels: " + allowed);
        }
        return String.join("\n", blocks);
    }
}
