package org.abstractica.stompsocket.impl.socket;

import org.abstractica.stompsocket.CandidateType;
import org.abstractica.stompsocket.PayloadDecoder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Resolves raw message bodies into the first candidate type that decodes them.
 *
 * <p>Text bodies are taken as UTF-8; binary bodies are used as-is. Any other
 * body representation resolves to nothing.</p>
 */
final class PayloadResolver
{
    private static final Logger LOG = LoggerFactory.getLogger(PayloadResolver.class);

    private final List<CandidateType<?>> candidateTypes;
    private final PayloadDecoder decoder;

    PayloadResolver(List<CandidateType<?>> candidateTypes, PayloadDecoder decoder)
    {
        this.candidateTypes = List.copyOf(candidateTypes);
        this.decoder = Objects.requireNonNull(decoder, "decoder");
    }

    /**
     * Decodes a raw body against the candidate types in order.
     *
     * @param raw the raw body delivered by the engine
     * @return the first successfully decoded value, or empty
     */
    Optional<Object> resolve(Object raw)
    {
        Optional<byte[]> bytes = toBytes(raw);
        if (bytes.isEmpty())
        {
            LOG.debug("Dropping body of unsupported representation: {}",
                    raw == null ? "null" : raw.getClass().getName());
            return Optional.empty();
        }

        byte[] data = bytes.get();
        for (CandidateType<?> candidateType : candidateTypes)
        {
            Optional<?> decoded;
            try
            {
                decoded = candidateType.tryDecode(data, decoder);
            }
            catch (RuntimeException e)
            {
                LOG.debug("Candidate {} failed while decoding", candidateType, e);
                continue;
            }

            if (decoded != null && decoded.isPresent())
            {
                return Optional.of(decoded.get());
            }
        }

        LOG.debug("No candidate type decoded a body of {} bytes", data.length);
        return Optional.empty();
    }

    List<CandidateType<?>> getCandidateTypes()
    {
        return candidateTypes;
    }

    static Optional<byte[]> toBytes(Object raw)
    {
        if (raw instanceof String text)
        {
            return Optional.of(text.getBytes(StandardCharsets.UTF_8));
        }
        if (raw instanceof byte[] data)
        {
            return Optional.of(data);
        }
        if (raw instanceof ByteBuffer buffer)
        {
            ByteBuffer view = buffer.duplicate();
            byte[] copy = new byte[view.remaining()];
            view.get(copy);
            return Optional.of(copy);
        }
        return Optional.empty();
    }
}
