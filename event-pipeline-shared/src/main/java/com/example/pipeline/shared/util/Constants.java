package com.example.pipeline.shared.util;

public final class Constants {

    private Constants() {}

    public static final String EVENT_ID_PREFIX = "evt_";
    public static final String SUBSCRIBER_ID_PREFIX = "sub_";

    public static final String API_KEY_HEADER = "X-API-Key";
    public static final String API_KEY_QUERY_PARAM = "api_key";

    /**
     * Application-level close codes sent on the WebSocket endpoints.
     */
    public static final class CloseCodes {
        private CloseCodes() {}
        public static final int UNAUTHORIZED = 4001;
        public static final int TOO_MANY_CONNECTIONS = 4002;
    }

    /**
     * Values of the {@code type} and {@code status} fields exchanged on the sockets.
     */
    public static final class SocketMessages {
        private SocketMessages() {}
        public static final String TYPE_PING = "ping";
        public static final String TYPE_PONG = "pong";
        public static final String TYPE_KEEPALIVE = "keepalive";
        public static final String TYPE_UPDATE_FILTERS = "update_filters";

        public static final String STATUS_OK = "ok";
        public static final String STATUS_ERROR = "error";
        public static final String STATUS_SUBSCRIBED = "subscribed";
        public static final String STATUS_FILTERS_UPDATED = "filters_updated";
    }
}
