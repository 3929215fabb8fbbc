package org.abstractica.stompsocket.engine;

/**
 * Layer reported by {@link StompEngineDelegate#onConnect(ConnectType)}.
 */
public enum ConnectType
{
    /**
     * The web-socket opened.
     */
    TO_SOCKET_ENDPOINT,

    /**
     * The STOMP handshake completed.
     */
    TO_STOMP
}
