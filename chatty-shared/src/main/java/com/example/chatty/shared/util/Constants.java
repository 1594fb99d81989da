package com.example.chatty.shared.util;

public final class Constants {

    private Constants() {}

    public static final String CORRELATION_ID_HEADER = "X-Correlation-ID";
    public static final String CORRELATION_ID_KEY = "correlation_id";

    public static final String SESSION_ATTRIBUTE = "chatty.session";
    public static final String QUERY_POLLUTED_ATTRIBUTE = "chatty.queryPolluted";

    public static final String SIGNATURE_COOKIE_SUFFIX = ".sig";

    public static final String UNEXPECTED_FAILURE_MESSAGE = "An unexpected error occurred. Please try again later.";

    public enum FrameType {
        CONNECTED,
        EVENT,
        SUBSCRIBED,
        UNSUBSCRIBED,
        ERROR,
        HEARTBEAT,
        SERVER_SHUTDOWN
    }

    public enum ChannelAction {
        SUBSCRIBE,
        UNSUBSCRIBE,
        PUBLISH
    }
}
