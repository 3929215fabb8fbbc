package org.abstractica.stompsocket.handlers;

import org.abstractica.stompsocket.StompSocket;
import org.abstractica.stompsocket.StompSocketEvent;

/**
 * Handles events emitted by a {@link StompSocket}.
 *
 * <p>Handlers are called from the engine's callback context. Exceptions
 * thrown by a handler are caught and logged by the socket.</p>
 */
@FunctionalInterface
public interface EventHandler
{
    /**
     * Handler that ignores every event.
     */
    EventHandler NONE = (socket, event) -> {};

    /**
     * Handles an event.
     *
     * @param socket the socket that emitted the event
     * @param event  the event
     */
    void handle(StompSocket socket, StompSocketEvent event);
}
