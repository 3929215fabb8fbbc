package org.abstractica.stompsocket.engine;

/**
 * Layer reported by {@link StompEngineDelegate#onDisconnect(DisconnectType)}.
 */
public enum DisconnectType
{
    /**
     * The web-socket closed. Terminal for the connection.
     */
    FROM_SOCKET,

    /**
     * The STOMP sub-protocol dropped; the web-socket may still be open.
     */
    FROM_STOMP
}
