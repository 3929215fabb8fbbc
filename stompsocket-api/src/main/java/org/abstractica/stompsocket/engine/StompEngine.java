package org.abstractica.stompsocket.engine;

import java.time.Duration;

/**
 * A STOMP client engine: web-socket transport, STOMP framing and reconnection.
 *
 * <p>The engine executes commands issued by a StompSocket and reports what
 * happens on the connection through a {@link StompEngineDelegate}. Commands
 * return immediately; their results surface later as delegate callbacks.</p>
 */
public interface StompEngine extends AutoCloseable
{
    /**
     * Sets the callback target.
     *
     * @param delegate the delegate, or null to stop delivering callbacks
     */
    void setDelegate(StompEngineDelegate delegate);

    /**
     * Opens the web-socket and performs the STOMP handshake.
     *
     * @param timeout       how long to wait for the connection
     * @param autoReconnect true to re-establish the connection after it drops
     */
    void connect(Duration timeout, boolean autoReconnect);

    /**
     * Closes the connection.
     *
     * @param force true to destroy the socket without a STOMP DISCONNECT
     */
    void disconnect(boolean force);

    /**
     * Subscribes to a destination.
     *
     * @param destination the destination
     */
    void subscribe(String destination);

    /**
     * Unsubscribes from a destination.
     *
     * @param destination the destination
     */
    void unsubscribe(String destination);

    /**
     * Encodes a body and sends it to a destination.
     *
     * @param body        the body to encode and send
     * @param destination the destination
     */
    void send(Object body, String destination);

    /**
     * Enables periodic keep-alive pings.
     *
     * @param interval the ping interval
     */
    void enableAutoPing(Duration interval);

    /**
     * Enables or disables automatic reconnect.
     *
     * @param autoReconnect true to reconnect after the connection drops
     */
    void setAutoReconnect(boolean autoReconnect);

    /**
     * Releases resources held by the engine.
     */
    @Override
    void close();
}
