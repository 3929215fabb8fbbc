package org.abstractica.stompsocket;

/**
 * Events emitted by a {@link StompSocket}.
 *
 * <p>Sealed interface enabling exhaustive handling of the event vocabulary.</p>
 */
public sealed interface StompSocketEvent
{
    /**
     * A connection request has just been sent to the server.
     */
    record Connecting() implements StompSocketEvent {}

    /**
     * Both the STOMP sub-protocol and the web-socket are connected and ready to send messages.
     */
    record Connected() implements StompSocketEvent {}

    /**
     * Both the STOMP sub-protocol and the web-socket are disconnected.
     *
     * <p>The socket will not reconnect on its own; call {@link StompSocket#connect()} again.</p>
     */
    record Disconnected() implements StompSocketEvent {}

    /**
     * The STOMP sub-protocol dropped while the web-socket stayed open.
     *
     * <p>If automatic reconnect is enabled the engine re-establishes the
     * sub-protocol and a {@link Connected} event follows.</p>
     */
    record ProtocolDropped() implements StompSocketEvent {}

    /**
     * A payload was received from a subscribed destination and decoded.
     *
     * @param payload     the decoded payload, an instance of one of the candidate types
     * @param destination the destination the payload was received from
     */
    record PayloadReceived(Object payload, String destination) implements StompSocketEvent {}

    /**
     * An error was reported by the web-socket or the STOMP server.
     *
     * @param description brief description of the error
     */
    record ErrorReceived(String description) implements StompSocketEvent {}
}
