package org.abstractica.stompsocket.impl.engine;

import org.abstractica.stompsocket.engine.ConnectType;
import org.abstractica.stompsocket.engine.DisconnectType;
import org.abstractica.stompsocket.engine.StompEngine;
import org.abstractica.stompsocket.engine.StompEngineDelegate;
import org.abstractica.stompsocket.engine.StompErrorType;
import org.abstractica.stompsocket.impl.serialization.JacksonPayloadCodec;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Consumer;

/**
 * In-memory STOMP engine for testing and local development.
 *
 * <p>The engine never opens a connection. It records every command it is
 * given and lets the caller fire each delegate callback explicitly, so the
 * full connection lifecycle can be driven step by step on one thread.</p>
 *
 * <p>With echo enabled, bodies sent to a subscribed destination are looped
 * back as received messages. Records and other objects are JSON-encoded;
 * strings and byte arrays are sent unchanged.</p>
 */
public class SimulatedStompEngine implements StompEngine
{
    private static final Logger LOG = LoggerFactory.getLogger(SimulatedStompEngine.class);
    private static final URI DEFAULT_ENDPOINT = URI.create("ws://localhost/simulated");

    private final URI endpoint;
    private final Map<String, String> connectionHeaders;
    private final JacksonPayloadCodec codec;
    private final List<Command> commands = new ArrayList<>();
    private final Set<String> subscriptions = new LinkedHashSet<>();
    private final AtomicInteger messageCounter = new AtomicInteger(0);

    private StompEngineDelegate delegate;
    private boolean autoReconnect;
    private Duration autoPingInterval;
    private boolean echoSends;
    private boolean closed;

    /**
     * Commands issued to the engine, in the order they were received.
     */
    public sealed interface Command
    {
        record Connect(Duration timeout, boolean autoReconnect) implements Command {}
        record Disconnect(boolean force) implements Command {}
        record Subscribe(String destination) implements Command {}
        record Unsubscribe(String destination) implements Command {}
        record Send(Object body, String destination) implements Command {}
        record EnableAutoPing(Duration interval) implements Command {}
        record SetAutoReconnect(boolean autoReconnect) implements Command {}
    }

    /**
     * Creates a simulated engine with a placeholder endpoint.
     */
    public SimulatedStompEngine()
    {
        this(DEFAULT_ENDPOINT, Map.of());
    }

    /**
     * Creates a simulated engine for an endpoint.
     *
     * @param endpoint          the endpoint the engine pretends to connect to
     * @param connectionHeaders the connection headers
     */
    public SimulatedStompEngine(URI endpoint, Map<String, String> connectionHeaders)
    {
        this(endpoint, connectionHeaders, JacksonPayloadCodec.standard());
    }

    /**
     * Creates a simulated engine encoding echoed bodies with the given codec.
     *
     * @param endpoint          the endpoint the engine pretends to connect to
     * @param connectionHeaders the connection headers
     * @param codec             the codec for echoed bodies
     */
    public SimulatedStompEngine(URI endpoint, Map<String, String> connectionHeaders, JacksonPayloadCodec codec)
    {
        this.endpoint = Objects.requireNonNull(endpoint, "endpoint");
        this.connectionHeaders = Map.copyOf(connectionHeaders);
        this.codec = Objects.requireNonNull(codec, "codec");
    }

    // ========== Configuration ==========

    /**
     * Enables or disables loopback of sent bodies to subscribed destinations.
     *
     * @param echoSends true to echo
     */
    public void setEchoSends(boolean echoSends)
    {
        this.echoSends = echoSends;
    }

    // ========== StompEngine Interface ==========

    @Override
    public void setDelegate(StompEngineDelegate delegate)
    {
        this.delegate = delegate;
    }

    @Override
    public void connect(Duration timeout, boolean autoReconnect)
    {
        requireOpen();
        commands.add(new Command.Connect(timeout, autoReconnect));
        this.autoReconnect = autoReconnect;
        LOG.debug("Connect requested to {} (timeout={}, autoReconnect={})", endpoint, timeout, autoReconnect);
    }

    @Override
    public void disconnect(boolean force)
    {
        commands.add(new Command.Disconnect(force));
        subscriptions.clear();
        autoPingInterval = null;
        LOG.debug("Disconnect requested (force={})", force);
    }

    @Override
    public void subscribe(String destination)
    {
        commands.add(new Command.Subscribe(destination));
        subscriptions.add(destination);
    }

    @Override
    public void unsubscribe(String destination)
    {
        commands.add(new Command.Unsubscribe(destination));
        subscriptions.remove(destination);
    }

    @Override
    public void send(Object body, String destination)
    {
        commands.add(new Command.Send(body, destination));

        if (echoSends && subscriptions.contains(destination))
        {
            deliver(encode(body), destination);
        }
    }

    @Override
    public void enableAutoPing(Duration interval)
    {
        commands.add(new Command.EnableAutoPing(interval));
        this.autoPingInterval = interval;
    }

    @Override
    public void setAutoReconnect(boolean autoReconnect)
    {
        commands.add(new Command.SetAutoReconnect(autoReconnect));
        this.autoReconnect = autoReconnect;
    }

    @Override
    public void close()
    {
        if (closed)
        {
            return;
        }
        closed = true;
        delegate = null;
        subscriptions.clear();
        LOG.debug("Simulated engine closed");
    }

    // ========== Simulation ==========

    /**
     * Reports that the web-socket opened.
     */
    public void completeSocketConnect()
    {
        fire(d -> d.onConnect(ConnectType.TO_SOCKET_ENDPOINT));
    }

    /**
     * Reports that the STOMP handshake completed.
     */
    public void completeStompConnect()
    {
        fire(d -> d.onConnect(ConnectType.TO_STOMP));
    }

    /**
     * Reports the web-socket opening followed by the STOMP handshake.
     */
    public void completeConnect()
    {
        completeSocketConnect();
        completeStompConnect();
    }

    /**
     * Reports that the STOMP sub-protocol dropped while the web-socket stays open.
     */
    public void dropStomp()
    {
        fire(d -> d.onDisconnect(DisconnectType.FROM_STOMP));
    }

    /**
     * Reports that the web-socket closed.
     */
    public void dropSocket()
    {
        subscriptions.clear();
        fire(d -> d.onDisconnect(DisconnectType.FROM_SOCKET));
    }

    /**
     * Reports the end of a graceful shutdown: STOMP first, then the web-socket.
     */
    public void completeDisconnect()
    {
        dropStomp();
        dropSocket();
    }

    /**
     * Delivers a message with no extra headers.
     *
     * @param body        the raw body
     * @param destination the destination
     */
    public void deliver(Object body, String destination)
    {
        deliver(body, destination, Map.of());
    }

    /**
     * Delivers a message.
     *
     * @param body        the raw body
     * @param destination the destination
     * @param headers     the frame headers
     */
    public void deliver(Object body, String destination, Map<String, String> headers)
    {
        String messageId = "message-" + messageCounter.incrementAndGet();
        fire(d -> d.onMessageReceived(body, messageId, destination, headers));
    }

    /**
     * Reports an error.
     *
     * @param briefDescription short description
     * @param fullDescription  long description, may be null
     * @param receiptId        receipt id, may be null
     * @param type             the layer reporting the error
     */
    public void raiseError(String briefDescription, String fullDescription, String receiptId, StompErrorType type)
    {
        fire(d -> d.onError(briefDescription, fullDescription, receiptId, type));
    }

    /**
     * Reports a receipt.
     *
     * @param receiptId the receipt id
     */
    public void receipt(String receiptId)
    {
        fire(d -> d.onReceipt(receiptId));
    }

    /**
     * Reports a low-level socket event.
     *
     * @param eventName   the event name
     * @param description the description
     */
    public void socketEvent(String eventName, String description)
    {
        fire(d -> d.onSocketEvent(eventName, description));
    }

    // ========== Inspection ==========

    /**
     * Returns the commands received so far.
     */
    public List<Command> getCommands()
    {
        return List.copyOf(commands);
    }

    /**
     * Forgets the commands received so far.
     */
    public void clearCommands()
    {
        commands.clear();
    }

    /**
     * Returns the destinations currently subscribed.
     */
    public Set<String> getSubscriptions()
    {
        return Set.copyOf(subscriptions);
    }

    public boolean hasDelegate()
    {
        return delegate != null;
    }

    public boolean isAutoReconnect()
    {
        return autoReconnect;
    }

    /**
     * Returns the ping interval, or null if pings are not enabled.
     */
    public Duration getAutoPingInterval()
    {
        return autoPingInterval;
    }

    public URI getEndpoint()
    {
        return endpoint;
    }

    public Map<String, String> getConnectionHeaders()
    {
        return connectionHeaders;
    }

    public boolean isClosed()
    {
        return closed;
    }

    // ========== Internal ==========

    private void fire(Consumer<StompEngineDelegate> callback)
    {
        StompEngineDelegate target = delegate;
        if (target == null)
        {
            LOG.debug("No delegate registered, callback dropped");
            return;
        }
        callback.accept(target);
    }

    private Object encode(Object body)
    {
        if (body instanceof String || body instanceof byte[])
        {
            return body;
        }
        return new String(codec.encode(body), StandardCharsets.UTF_8);
    }

    private void requireOpen()
    {
        if (closed)
        {
            throw new IllegalStateException("Engine closed");
        }
    }
}
