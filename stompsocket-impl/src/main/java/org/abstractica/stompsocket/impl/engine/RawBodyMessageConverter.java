package org.abstractica.stompsocket.impl.engine;

import org.springframework.messaging.MessageHeaders;
import org.springframework.messaging.converter.ByteArrayMessageConverter;

/**
 * Byte array converter that accepts every content type.
 *
 * <p>Received bodies are handed to the socket undecoded, whatever content
 * type the server declared, so that decoding stays with the socket's
 * candidate types.</p>
 */
class RawBodyMessageConverter extends ByteArrayMessageConverter
{
    @Override
    protected boolean supportsMimeType(MessageHeaders headers)
    {
        return true;
    }
}
