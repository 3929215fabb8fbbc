package org.abstractica.stompsocket.impl.socket;

import org.abstractica.stompsocket.CandidateType;
import org.abstractica.stompsocket.PayloadDecoder;
import org.abstractica.stompsocket.StompSocket;
import org.abstractica.stompsocket.StompSocketFactory;
import org.abstractica.stompsocket.engine.StompEngine;
import org.abstractica.stompsocket.engine.StompEngineFactory;
import org.abstractica.stompsocket.handlers.EventHandler;
import org.abstractica.stompsocket.impl.serialization.JacksonPayloadCodec;

import java.net.URI;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Default implementation of StompSocketFactory.
 */
public class DefaultStompSocketFactory implements StompSocketFactory
{
    public static final Duration DEFAULT_CONNECTION_TIMEOUT = Duration.ofSeconds(10);
    public static final Duration DEFAULT_AUTO_PING_INTERVAL = Duration.ofSeconds(10);

    @Override
    public Builder builder()
    {
        return new DefaultBuilder();
    }

    public static class DefaultBuilder implements Builder
    {
        private URI endpoint;
        private final Map<String, String> connectionHeaders = new LinkedHashMap<>();
        private Duration connectionTimeout = DEFAULT_CONNECTION_TIMEOUT;
        private Duration autoPingInterval = DEFAULT_AUTO_PING_INTERVAL;
        private final List<CandidateType<?>> candidateTypes = new ArrayList<>();
        private PayloadDecoder decoder; // Optional (defaults to JacksonPayloadCodec)
        private EventHandler eventHandler = EventHandler.NONE;
        private StompEngineFactory engineFactory;

        @Override
        public Builder endpoint(URI endpoint)
        {
            this.endpoint = Objects.requireNonNull(endpoint, "endpoint");
            return this;
        }

        @Override
        public Builder connectionHeaders(Map<String, String> headers)
        {
            Objects.requireNonNull(headers, "headers");
            connectionHeaders.clear();
            connectionHeaders.putAll(headers);
            return this;
        }

        @Override
        public Builder connectionTimeout(Duration timeout)
        {
            this.connectionTimeout = requirePositive(timeout, "timeout");
            return this;
        }

        @Override
        public Builder autoPingInterval(Duration interval)
        {
            this.autoPingInterval = requirePositive(interval, "interval");
            return this;
        }

        @Override
        public Builder candidateType(CandidateType<?> type)
        {
            candidateTypes.add(Objects.requireNonNull(type, "type"));
            return this;
        }

        @Override
        public Builder receive(Class<?> type)
        {
            return candidateType(CandidateType.of(type));
        }

        @Override
        public Builder decoder(PayloadDecoder decoder)
        {
            this.decoder = Objects.requireNonNull(decoder, "decoder");
            return this;
        }

        @Override
        public Builder eventHandler(EventHandler handler)
        {
            this.eventHandler = Objects.requireNonNull(handler, "handler");
            return this;
        }

        @Override
        public Builder engineFactory(StompEngineFactory engineFactory)
        {
            this.engineFactory = Objects.requireNonNull(engineFactory, "engineFactory");
            return this;
        }

        @Override
        public StompSocket build()
        {
            if (endpoint == null)
            {
                throw new IllegalStateException("Endpoint must be specified");
            }
            if (engineFactory == null)
            {
                throw new IllegalStateException("Engine factory must be specified");
            }

            StompEngine engine = engineFactory.create(endpoint, Map.copyOf(connectionHeaders));
            if (engine == null)
            {
                throw new IllegalStateException("Engine factory returned no engine");
            }

            PayloadDecoder payloadDecoder = (decoder != null) ? decoder : JacksonPayloadCodec.standard();

            return new DefaultStompSocket(
                    endpoint,
                    engine,
                    connectionTimeout,
                    autoPingInterval,
                    candidateTypes,
                    payloadDecoder,
                    eventHandler
            );
        }

        private static Duration requirePositive(Duration duration, String name)
        {
            Objects.requireNonNull(duration, name);
            if (duration.isZero() || duration.isNegative())
            {
                throw new IllegalArgumentException(name + " must be positive: " + duration);
            }
            return duration;
        }
    }
}
