package org.abstractica.stompsocket;

/**
 * Thrown when a message body cannot be decoded into the requested type.
 */
public class PayloadDecodingException extends Exception
{
    public PayloadDecodingException(String message)
    {
        super(message);
    }

    public PayloadDecodingException(String message, Throwable cause)
    {
        super(message, cause);
    }
}
