package com.rtmbot.core.dispatch;

/**
 * What an inbound event means to the dispatcher.
 */
public enum EventKind {
    MESSAGE,
    DELIVERY_CONFIRMATION,
    GROUP_JOIN,
    TEAM_JOIN,
    OTHER
}
