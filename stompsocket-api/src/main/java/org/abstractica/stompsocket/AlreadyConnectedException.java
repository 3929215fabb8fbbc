package org.abstractica.stompsocket;

/**
 * Thrown by {@link StompSocket#connect()} when the STOMP sub-protocol is already connected.
 *
 * <p>Disconnect first to start a new connection.</p>
 */
public class AlreadyConnectedException extends StompSocketException
{
    public AlreadyConnectedException()
    {
        super("Already connected via STOMP");
    }
}
