package org.abstractica.stompsocket;

import org.abstractica.stompsocket.handlers.EventHandler;

/**
 * A client-side STOMP session over a persistent web-socket connection.
 *
 * <p>The socket enforces which operations are allowed in the current
 * connection state and forwards them to an underlying STOMP engine.
 * Everything the engine reports back arrives asynchronously as a
 * {@link StompSocketEvent} delivered to the registered {@link EventHandler}.</p>
 *
 * <p>Example usage:</p>
 * <pre>{@code
 * StompSocket socket = socketFactory.builder()
 *     .endpoint(URI.create("wss://chat.example.com/ws"))
 *     .engineFactory(engineFactory)
 *     .receive(ChatMessage.class)
 *     .eventHandler((s, event) -> {
 *         if (event instanceof StompSocketEvent.Connected)
 *         {
 *             s.subscribe("/topic/chat");
 *         }
 *     })
 *     .build();
 *
 * socket.connect();
 * }</pre>
 *
 * <p>All operations and engine callbacks are expected to run on a single
 * execution context. The socket does no locking of its own.</p>
 */
public interface StompSocket extends AutoCloseable
{
    /**
     * Connects the web-socket and the STOMP sub-protocol.
     *
     * <p>Does nothing if a connection attempt is already in progress.
     * Otherwise the connect command is issued with automatic reconnect enabled
     * and a {@link StompSocketEvent.Connecting} event is emitted.</p>
     *
     * @throws AlreadyConnectedException if the STOMP sub-protocol is already connected
     * @throws IllegalStateException if the socket has been closed
     */
    void connect();

    /**
     * Disconnects gracefully.
     *
     * <p>Equivalent to {@code disconnect(false)}.</p>
     */
    void disconnect();

    /**
     * Disconnects and disables automatic reconnect.
     *
     * <p>A forced disconnect destroys the connection without notifying the
     * server and emits {@link StompSocketEvent.Disconnected} immediately.
     * A graceful disconnect emits it once the engine reports the socket closed.</p>
     *
     * @param force true to tear the connection down without a protocol shutdown
     */
    void disconnect(boolean force);

    /**
     * Subscribes to a destination.
     *
     * @param destination the destination to subscribe to
     * @throws NotConnectedException if the STOMP sub-protocol is not connected
     */
    void subscribe(String destination);

    /**
     * Unsubscribes from a destination.
     *
     * @param destination the destination to unsubscribe from
     * @throws NotConnectedException if the STOMP sub-protocol is not connected
     */
    void unsubscribe(String destination);

    /**
     * Sends a payload to a destination.
     *
     * <p>The engine encodes the payload before transmission.</p>
     *
     * @param payload     the payload to send
     * @param destination the destination to send to
     * @throws NotConnectedException if the STOMP sub-protocol is not connected
     */
    void send(Object payload, String destination);

    /**
     * Replaces the event handler.
     *
     * <p>Only one handler is registered at a time.</p>
     *
     * @param handler the handler that receives all subsequent events
     */
    void onEvent(EventHandler handler);

    /**
     * Returns true iff the web-socket is connected via the STOMP sub-protocol.
     *
     * @return true when fully connected
     */
    boolean isConnectedViaStomp();

    /**
     * Returns true while a connection attempt is in progress.
     *
     * @return true when connecting
     */
    boolean isConnecting();

    /**
     * Returns the current connection state.
     *
     * @return the connection state
     */
    ConnectionState getConnectionState();

    /**
     * Closes the socket.
     *
     * <p>Forces a disconnect and releases the underlying engine. Further
     * calls, and any later disconnect, do nothing.</p>
     */
    @Override
    void close();
}
