package org.abstractica.stompsocket;

/**
 * Thrown when subscribing, unsubscribing or sending while the STOMP
 * sub-protocol is not connected.
 */
public class NotConnectedException extends StompSocketException
{
    public NotConnectedException()
    {
        super("Not connected via STOMP");
    }
}
