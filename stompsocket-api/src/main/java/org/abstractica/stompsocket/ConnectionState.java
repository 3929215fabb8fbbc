package org.abstractica.stompsocket;

/**
 * Connection state of a {@link StompSocket}.
 */
public enum ConnectionState
{
    /**
     * Neither the web-socket nor the STOMP sub-protocol is connected.
     */
    DISCONNECTED,

    /**
     * A connect command has been issued and nothing has been established yet.
     */
    CONNECTING,

    /**
     * The web-socket is open but the STOMP handshake has not completed.
     *
     * <p>Also entered when STOMP drops while the engine reconnects on its own.
     * An engine that reconnects after losing the web-socket itself reports
     * only the STOMP drop, so the web-socket may be closed in that case.</p>
     */
    SOCKET_CONNECTED,

    /**
     * Both the web-socket and the STOMP sub-protocol are connected.
     */
    FULLY_CONNECTED
}
