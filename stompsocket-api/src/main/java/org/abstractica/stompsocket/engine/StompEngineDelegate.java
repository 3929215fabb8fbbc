package org.abstractica.stompsocket.engine;

import java.util.Map;

/**
 * Callbacks from a {@link StompEngine}.
 */
public interface StompEngineDelegate
{
    /**
     * The web-socket or the STOMP sub-protocol connected.
     *
     * @param type which layer connected
     */
    void onConnect(ConnectType type);

    /**
     * The web-socket or the STOMP sub-protocol disconnected.
     *
     * @param type which layer disconnected
     */
    void onDisconnect(DisconnectType type);

    /**
     * A MESSAGE frame was received.
     *
     * @param message     the body, typically a String or byte[]
     * @param messageId   the message id
     * @param destination the destination the message was sent to
     * @param headers     the frame headers
     */
    void onMessageReceived(Object message, String messageId, String destination, Map<String, String> headers);

    /**
     * An error was reported.
     *
     * @param briefDescription short description
     * @param fullDescription  long description, may be null
     * @param receiptId        receipt the error refers to, may be null
     * @param type             the layer that reported the error
     */
    void onError(String briefDescription, String fullDescription, String receiptId, StompErrorType type);

    /**
     * A RECEIPT frame was received.
     *
     * @param receiptId the receipt id
     */
    void onReceipt(String receiptId);

    /**
     * A low-level web-socket event occurred.
     *
     * @param eventName   the event name
     * @param description the event description
     */
    void onSocketEvent(String eventName, String description);
}
