package org.abstractica.stompsocket;

import java.util.Objects;
import java.util.Optional;

/**
 * An application type that received message bodies may decode into.
 *
 * <p>Candidate types are tried in the order they were configured; the first
 * one that decodes a body wins. A body that no candidate decodes is dropped
 * without an event.</p>
 *
 * @param <T> the decoded value type
 */
@FunctionalInterface
public interface CandidateType<T>
{
    /**
     * Attempts to decode a message body.
     *
     * <p>Implementations must not throw on a mismatch; they return empty instead.</p>
     *
     * @param data    the raw body bytes
     * @param decoder the decoder configured on the socket
     * @return the decoded value, or empty if the body is not of this type
     */
    Optional<T> tryDecode(byte[] data, PayloadDecoder decoder);

    /**
     * Creates a candidate type decoded by the socket's configured decoder.
     *
     * @param type the class to decode into
     * @param <T>  the decoded value type
     * @return a candidate type for {@code type}
     */
    static <T> CandidateType<T> of(Class<T> type)
    {
        Objects.requireNonNull(type, "type");
        return new CandidateType<>()
        {
            @Override
            public Optional<T> tryDecode(byte[] data, PayloadDecoder decoder)
            {
                try
                {
                    return Optional.ofNullable(decoder.decode(data, type));
                }
                catch (PayloadDecodingException e)
                {
                    return Optional.empty();
                }
            }

            @Override
            public String toString()
            {
                return "CandidateType[" + type.getName() + "]";
            }
        };
    }
}
