package org.abstractica.stompsocket;

/**
 * Base class for operations rejected in the current connection state.
 */
public abstract class StompSocketException extends IllegalStateException
{
    protected StompSocketException(String message)
    {
        super(message);
    }
}
