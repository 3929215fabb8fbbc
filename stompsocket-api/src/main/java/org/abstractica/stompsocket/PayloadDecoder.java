package org.abstractica.stompsocket;

/**
 * Decodes raw message bodies into application types.
 *
 * <p>The socket hands every received body to each configured
 * {@link CandidateType} together with this decoder.</p>
 */
@FunctionalInterface
public interface PayloadDecoder
{
    /**
     * Decodes a message body.
     *
     * @param data the raw body bytes
     * @param type the target type
     * @param <T>  the target type
     * @return the decoded value, never null
     * @throws PayloadDecodingException if the body does not decode as {@code type}
     */
    <T> T decode(byte[] data, Class<T> type) throws PayloadDecodingException;
}
