package org.abstractica.stompsocket.engine;

/**
 * Source of an error reported by {@link StompEngineDelegate#onError}.
 */
public enum StompErrorType
{
    FROM_SOCKET,
    FROM_STOMP
}
