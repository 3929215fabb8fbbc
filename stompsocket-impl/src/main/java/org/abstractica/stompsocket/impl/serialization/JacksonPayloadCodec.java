package org.abstractica.stompsocket.impl.serialization;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.json.JsonMapper;
import org.abstractica.stompsocket.PayloadDecoder;
import org.abstractica.stompsocket.PayloadDecodingException;

import java.io.IOException;
import java.util.Objects;

/**
 * JSON encoding and decoding of message bodies using Jackson.
 *
 * <p>The standard configuration decodes leniently on shape and strictly on
 * content:</p>
 * <ul>
 *   <li>Unknown properties are ignored</li>
 *   <li>Missing or null creator properties (record components) are rejected</li>
 *   <li>Trailing tokens after the JSON value are rejected</li>
 * </ul>
 *
 * <p>A body therefore decodes as a record only when it carries every
 * component of that record.</p>
 */
public final class JacksonPayloadCodec implements PayloadDecoder
{
    private final ObjectMapper mapper;

    /**
     * Creates a codec with a custom ObjectMapper.
     *
     * @param mapper the ObjectMapper to use
     */
    public JacksonPayloadCodec(ObjectMapper mapper)
    {
        this.mapper = Objects.requireNonNull(mapper, "mapper");
    }

    /**
     * Creates a codec with the standard configuration.
     *
     * @return a new codec
     */
    public static JacksonPayloadCodec standard()
    {
        return new JacksonPayloadCodec(standardMapper());
    }

    /**
     * Creates an ObjectMapper with the standard configuration.
     *
     * @return a new ObjectMapper
     */
    public static ObjectMapper standardMapper()
    {
        return JsonMapper.builder()
                .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
                .enable(DeserializationFeature.FAIL_ON_MISSING_CREATOR_PROPERTIES)
                .enable(DeserializationFeature.FAIL_ON_NULL_CREATOR_PROPERTIES)
                .enable(DeserializationFeature.FAIL_ON_TRAILING_TOKENS)
                .build();
    }

    /**
     * Returns the underlying ObjectMapper.
     *
     * @return the mapper
     */
    public ObjectMapper getMapper()
    {
        return mapper;
    }

    @Override
    public <T> T decode(byte[] data, Class<T> type) throws PayloadDecodingException
    {
        Objects.requireNonNull(data, "data");
        Objects.requireNonNull(type, "type");

        T value;
        try
        {
            value = mapper.readValue(data, type);
        }
        catch (IOException e)
        {
            throw new PayloadDecodingException("Failed to decode body as " + type.getName(), e);
        }

        if (value == null)
        {
            throw new PayloadDecodingException("Body is JSON null, expected " + type.getName());
        }
        return value;
    }

    /**
     * Encodes a value to JSON bytes.
     *
     * @param value the value to encode
     * @return JSON bytes
     * @throws IllegalArgumentException if the value cannot be serialized
     */
    public byte[] encode(Object value)
    {
        try
        {
            return mapper.writeValueAsBytes(value);
        }
        catch (JsonProcessingException e)
        {
            throw new IllegalArgumentException("Failed to encode " + value.getClass().getName(), e);
        }
    }
}
