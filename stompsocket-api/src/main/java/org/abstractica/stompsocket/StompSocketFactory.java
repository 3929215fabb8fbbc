package org.abstractica.stompsocket;

import org.abstractica.stompsocket.engine.StompEngineFactory;
import org.abstractica.stompsocket.handlers.EventHandler;

import java.net.URI;
import java.time.Duration;
import java.util.Map;

/**
 * Factory for creating StompSocket instances.
 *
 * <p>Use the builder to configure the socket before creation:</p>
 * <pre>{@code
 * StompSocketFactory factory = new DefaultStompSocketFactory();
 * StompSocket socket = factory.builder()
 *     .endpoint(URI.create("wss://chat.example.com/ws"))
 *     .connectionHeaders(Map.of("Authorization", "Bearer " + token))
 *     .engineFactory(new SpringStompEngineFactory(webSocketClient))
 *     .receive(ChatMessage.class)
 *     .receive(Notification.class)
 *     .build();
 * }</pre>
 */
public interface StompSocketFactory
{
    /**
     * Creates a new socket builder.
     *
     * @return a new builder instance
     */
    Builder builder();

    /**
     * Builder for configuring and creating a StompSocket.
     */
    interface Builder
    {
        /**
         * Sets the endpoint that accepts the web-socket connection.
         *
         * @param endpoint the web-socket endpoint
         * @return this builder
         */
        Builder endpoint(URI endpoint);

        /**
         * Sets additional connection headers.
         *
         * <p>Optional. Defaults to no headers.</p>
         *
         * @param headers the connection headers
         * @return this builder
         */
        Builder connectionHeaders(Map<String, String> headers);

        /**
         * Sets the connection timeout.
         *
         * <p>Optional. Defaults to 10 seconds.</p>
         *
         * @param timeout the connection timeout
         * @return this builder
         */
        Builder connectionTimeout(Duration timeout);

        /**
         * Sets the interval between automatic pings once connected via STOMP.
         *
         * <p>Optional. Defaults to 10 seconds.</p>
         *
         * @param interval the ping interval
         * @return this builder
         */
        Builder autoPingInterval(Duration interval);

        /**
         * Appends a candidate type that received bodies are decoded into.
         *
         * <p>Candidates are tried in the order they were added.</p>
         *
         * @param type the candidate type
         * @return this builder
         */
        Builder candidateType(CandidateType<?> type);

        /**
         * Appends a class as a candidate type decoded by the configured decoder.
         *
         * @param type the class to decode into
         * @return this builder
         */
        Builder receive(Class<?> type);

        /**
         * Sets the decoder for received bodies.
         *
         * <p>Optional. Defaults to a JSON decoder.</p>
         *
         * @param decoder the payload decoder
         * @return this builder
         */
        Builder decoder(PayloadDecoder decoder);

        /**
         * Sets the event handler.
         *
         * <p>Optional. Defaults to a handler that ignores events.</p>
         *
         * @param handler the event handler
         * @return this builder
         */
        Builder eventHandler(EventHandler handler);

        /**
         * Sets the factory that creates the underlying STOMP engine.
         *
         * @param engineFactory the engine factory
         * @return this builder
         */
        Builder engineFactory(StompEngineFactory engineFactory);

        /**
         * Builds the socket.
         *
         * @return the configured socket
         * @throws IllegalStateException if required parameters are missing
         */
        StompSocket build();
    }
}
