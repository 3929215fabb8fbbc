package org.abstractica.stompsocket.impl.engine;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.abstractica.stompsocket.engine.StompEngine;
import org.abstractica.stompsocket.engine.StompEngineFactory;
import org.abstractica.stompsocket.impl.serialization.JacksonPayloadCodec;
import org.springframework.web.socket.client.WebSocketClient;

import java.net.URI;
import java.time.Duration;
import java.util.Map;
import java.util.Objects;

/**
 * Creates {@link SpringStompEngine} instances sharing one web-socket client.
 *
 * <p>Example usage:</p>
 * <pre>{@code
 * StompEngineFactory engines = new SpringStompEngineFactory(new StandardWebSocketClient())
 *     .reconnectDelay(Duration.ofSeconds(2));
 * }</pre>
 */
public class SpringStompEngineFactory implements StompEngineFactory
{
    private final WebSocketClient webSocketClient;
    private ObjectMapper objectMapper = JacksonPayloadCodec.standardMapper();
    private Duration reconnectDelay = SpringStompEngine.DEFAULT_RECONNECT_DELAY;

    /**
     * Creates a factory.
     *
     * @param webSocketClient the web-socket client used by every engine
     */
    public SpringStompEngineFactory(WebSocketClient webSocketClient)
    {
        this.webSocketClient = Objects.requireNonNull(webSocketClient, "webSocketClient");
    }

    /**
     * Sets the mapper used to encode sent bodies.
     *
     * <p>Optional. Defaults to {@link JacksonPayloadCodec#standardMapper()}.</p>
     *
     * @param objectMapper the mapper
     * @return this factory
     */
    public SpringStompEngineFactory objectMapper(ObjectMapper objectMapper)
    {
        this.objectMapper = Objects.requireNonNull(objectMapper, "objectMapper");
        return this;
    }

    /**
     * Sets the delay before an automatic reconnect attempt.
     *
     * <p>Optional. Defaults to 5 seconds.</p>
     *
     * @param delay the reconnect delay
     * @return this factory
     */
    public SpringStompEngineFactory reconnectDelay(Duration delay)
    {
        Objects.requireNonNull(delay, "delay");
        if (delay.isNegative())
        {
            throw new IllegalArgumentException("Reconnect delay must be non-negative: " + delay);
        }
        this.reconnectDelay = delay;
        return this;
    }

    @Override
    public StompEngine create(URI endpoint, Map<String, String> connectionHeaders)
    {
        return new SpringStompEngine(webSocketClient, endpoint, connectionHeaders, objectMapper, reconnectDelay);
    }
}
