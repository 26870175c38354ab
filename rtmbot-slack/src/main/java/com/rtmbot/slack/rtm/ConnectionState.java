package com.rtmbot.slack.rtm;

public enum ConnectionState {
    DISCONNECTED,
    CONNECTING,
    CONNECTED
}
