package org.abstractica.stompsocket.impl.engine;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.abstractica.stompsocket.engine.ConnectType;
import org.abstractica.stompsocket.engine.DisconnectType;
import org.abstractica.stompsocket.engine.StompEngine;
import org.abstractica.stompsocket.engine.StompEngineDelegate;
import org.abstractica.stompsocket.engine.StompErrorType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.messaging.MessagingException;
import org.springframework.messaging.converter.CompositeMessageConverter;
import org.springframework.messaging.converter.MappingJackson2MessageConverter;
import org.springframework.messaging.converter.MessageConverter;
import org.springframework.messaging.converter.StringMessageConverter;
import org.springframework.messaging.simp.stomp.ConnectionLostException;
import org.springframework.messaging.simp.stomp.StompCommand;
import org.springframework.messaging.simp.stomp.StompFrameHandler;
import org.springframework.messaging.simp.stomp.StompHeaders;
import org.springframework.messaging.simp.stomp.StompSession;
import org.springframework.messaging.simp.stomp.StompSessionHandlerAdapter;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;
import org.springframework.web.socket.WebSocketHttpHeaders;
import org.springframework.web.socket.client.WebSocketClient;
import org.springframework.web.socket.messaging.WebSocketStompClient;

import java.lang.reflect.Type;
import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Consumer;

/**
 * STOMP engine backed by Spring's {@link WebSocketStompClient}.
 *
 * <p>Bodies are sent as JSON through Jackson unless they already are a
 * String or byte array. Received bodies are delivered to the delegate as raw
 * bytes. Subscriptions are remembered and restored after an automatic
 * reconnect.</p>
 *
 * <p>Spring negotiates heart-beats in the CONNECT frame, so
 * {@link #enableAutoPing(Duration)} takes effect from the next connection,
 * including automatic reconnects.</p>
 */
public class SpringStompEngine implements StompEngine
{
    private static final Logger LOG = LoggerFactory.getLogger(SpringStompEngine.class);

    public static final Duration DEFAULT_RECONNECT_DELAY = Duration.ofSeconds(5);

    private final URI endpoint;
    private final WebSocketStompClient stompClient;
    private final ThreadPoolTaskScheduler scheduler;
    private final WebSocketHttpHeaders handshakeHeaders;
    private final StompHeaders connectHeaders;
    private final Duration reconnectDelay;

    private final Set<String> destinations = ConcurrentHashMap.newKeySet();
    private final Map<String, StompSession.Subscription> activeSubscriptions = new ConcurrentHashMap<>();
    private final AtomicInteger attemptCounter = new AtomicInteger(0);

    private volatile StompEngineDelegate delegate;
    private volatile StompSession session;
    private volatile boolean autoReconnect;
    private volatile Duration timeout = Duration.ofSeconds(10);
    private volatile ScheduledFuture<?> reconnectTask;
    private volatile boolean closed;

    /**
     * Creates an engine.
     *
     * @param webSocketClient   the web-socket client used for the transport
     * @param endpoint          the web-socket endpoint
     * @param connectionHeaders headers sent with the handshake and the CONNECT frame
     * @param objectMapper      the mapper used to encode sent bodies
     * @param reconnectDelay    delay before an automatic reconnect attempt
     */
    public SpringStompEngine(
            WebSocketClient webSocketClient,
            URI endpoint,
            Map<String, String> connectionHeaders,
            ObjectMapper objectMapper,
            Duration reconnectDelay
    )
    {
        Objects.requireNonNull(webSocketClient, "webSocketClient");
        Objects.requireNonNull(connectionHeaders, "connectionHeaders");
        Objects.requireNonNull(objectMapper, "objectMapper");
        this.endpoint = Objects.requireNonNull(endpoint, "endpoint");
        this.reconnectDelay = Objects.requireNonNull(reconnectDelay, "reconnectDelay");

        this.scheduler = new ThreadPoolTaskScheduler();
        scheduler.setPoolSize(1);
        scheduler.setThreadNamePrefix("stomp-engine-");
        scheduler.setDaemon(true);
        scheduler.initialize();

        this.stompClient = new WebSocketStompClient(webSocketClient);
        stompClient.setMessageConverter(createMessageConverter(objectMapper));
        stompClient.setTaskScheduler(scheduler);

        this.handshakeHeaders = new WebSocketHttpHeaders();
        this.connectHeaders = new StompHeaders();
        connectionHeaders.forEach((name, value) ->
        {
            handshakeHeaders.add(name, value);
            connectHeaders.add(name, value);
        });
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
        if (closed)
        {
            throw new IllegalStateException("Engine closed");
        }

        this.timeout = Objects.requireNonNull(timeout, "timeout");
        this.autoReconnect = autoReconnect;
        cancelReconnect();

        StompSession current = session;
        if (current != null && current.isConnected())
        {
            LOG.debug("Already connected to {}, reporting existing connection", endpoint);
            notifyDelegate(d -> d.onConnect(ConnectType.TO_SOCKET_ENDPOINT));
            notifyDelegate(d -> d.onConnect(ConnectType.TO_STOMP));
            return;
        }

        openConnection();
    }

    @Override
    public void disconnect(boolean force)
    {
        // Invalidates any connection attempt still in flight
        attemptCounter.incrementAndGet();
        cancelReconnect();

        StompSession current = session;
        session = null;
        destinations.clear();
        activeSubscriptions.clear();

        if (current != null)
        {
            closeSession(current);
        }

        if (!force)
        {
            notifyDelegate(d -> d.onDisconnect(DisconnectType.FROM_STOMP));
            notifyDelegate(d -> d.onDisconnect(DisconnectType.FROM_SOCKET));
        }
    }

    @Override
    public void subscribe(String destination)
    {
        destinations.add(destination);

        StompSession current = session;
        if (current != null && current.isConnected())
        {
            activate(current, destination);
        }
    }

    @Override
    public void unsubscribe(String destination)
    {
        destinations.remove(destination);

        StompSession.Subscription subscription = activeSubscriptions.remove(destination);
        if (subscription == null)
        {
            return;
        }

        try
        {
            subscription.unsubscribe();
        }
        catch (MessagingException e)
        {
            reportError(e, StompErrorType.FROM_STOMP);
        }
    }

    @Override
    public void send(Object body, String destination)
    {
        StompSession current = session;
        if (current == null || !current.isConnected())
        {
            LOG.warn("Cannot send to {}, not connected", destination);
            notifyDelegate(d -> d.onError("Not connected", null, null, StompErrorType.FROM_SOCKET));
            return;
        }

        try
        {
            StompSession.Receiptable receiptable = current.send(destination, body);
            String receiptId = receiptable.getReceiptId();
            if (receiptId != null)
            {
                receiptable.addReceiptTask(() -> notifyDelegate(d -> d.onReceipt(receiptId)));
            }
        }
        catch (MessagingException e)
        {
            reportError(e, StompErrorType.FROM_STOMP);
        }
    }

    @Override
    public void enableAutoPing(Duration interval)
    {
        long intervalMs = interval.toMillis();
        stompClient.setDefaultHeartbeat(new long[]{intervalMs, intervalMs});
        LOG.debug("Heart-beat set to {} ms", intervalMs);
    }

    @Override
    public void setAutoReconnect(boolean autoReconnect)
    {
        this.autoReconnect = autoReconnect;
        if (!autoReconnect)
        {
            cancelReconnect();
        }
    }

    @Override
    public void close()
    {
        if (closed)
        {
            return;
        }
        closed = true;

        LOG.info("Closing STOMP engine for {}", endpoint);

        autoReconnect = false;
        delegate = null;
        disconnect(true);
        scheduler.shutdown();
    }

    // ========== Connection ==========

    private void openConnection()
    {
        int attempt = attemptCounter.incrementAndGet();
        SessionHandler handler = new SessionHandler(attempt);

        LOG.info("Opening STOMP connection to {}", endpoint);

        stompClient.connectAsync(endpoint, handshakeHeaders, connectHeaders, handler)
                .orTimeout(timeout.toMillis(), TimeUnit.MILLISECONDS)
                .whenComplete((stompSession, failure) ->
                {
                    if (failure != null)
                    {
                        handler.terminate(failure);
                    }
                });
    }

    private void connectionEstablished(StompSession stompSession)
    {
        session = stompSession;
        stompSession.setAutoReceipt(true);

        activeSubscriptions.clear();
        for (String destination : destinations)
        {
            activate(stompSession, destination);
        }

        LOG.info("STOMP session {} established with {}", stompSession.getSessionId(), endpoint);

        notifyDelegate(d -> d.onConnect(ConnectType.TO_SOCKET_ENDPOINT));
        notifyDelegate(d -> d.onConnect(ConnectType.TO_STOMP));
    }

    private void connectionTerminated(boolean wasConnected, Throwable cause)
    {
        session = null;
        activeSubscriptions.clear();

        if (wasConnected)
        {
            LOG.warn("STOMP connection to {} lost", endpoint);
        }
        else
        {
            LOG.warn("Failed to connect to {}: {}", endpoint, describe(cause));
            notifyDelegate(d -> d.onError(describe(cause), null, null, StompErrorType.FROM_SOCKET));
        }

        if (autoReconnect && !closed)
        {
            // Reported as a STOMP drop even when the web-socket is gone, FROM_SOCKET would end the session
            notifyDelegate(d -> d.onDisconnect(DisconnectType.FROM_STOMP));
            scheduleReconnect();
            return;
        }

        if (wasConnected)
        {
            notifyDelegate(d -> d.onDisconnect(DisconnectType.FROM_STOMP));
        }
        notifyDelegate(d -> d.onDisconnect(DisconnectType.FROM_SOCKET));
    }

    private void scheduleReconnect()
    {
        LOG.info("Reconnecting to {} in {} ms", endpoint, reconnectDelay.toMillis());
        reconnectTask = scheduler.schedule(() ->
        {
            if (autoReconnect && !closed)
            {
                openConnection();
            }
        }, Instant.now().plus(reconnectDelay));
    }

    private void cancelReconnect()
    {
        ScheduledFuture<?> task = reconnectTask;
        reconnectTask = null;
        if (task != null)
        {
            task.cancel(false);
        }
    }

    private void activate(StompSession stompSession, String destination)
    {
        try
        {
            activeSubscriptions.computeIfAbsent(destination,
                    d -> stompSession.subscribe(d, new DestinationHandler(d)));
        }
        catch (MessagingException e)
        {
            reportError(e, StompErrorType.FROM_STOMP);
        }
    }

    private void closeSession(StompSession stompSession)
    {
        try
        {
            stompSession.disconnect();
        }
        catch (MessagingException | IllegalStateException e)
        {
            LOG.debug("STOMP session did not close cleanly: {}", describe(e));
        }
    }

    // ========== Helpers ==========

    private void reportError(Exception e, StompErrorType type)
    {
        LOG.warn("STOMP command failed: {}", describe(e));
        notifyDelegate(d -> d.onError(describe(e), null, null, type));
    }

    private void notifyDelegate(Consumer<StompEngineDelegate> callback)
    {
        StompEngineDelegate target = delegate;
        if (target == null)
        {
            return;
        }

        try
        {
            callback.accept(target);
        }
        catch (RuntimeException e)
        {
            LOG.error("Delegate callback error", e);
        }
    }

    private static String describe(Throwable throwable)
    {
        String message = throwable.getMessage();
        return (message != null) ? message : throwable.getClass().getSimpleName();
    }

    static MessageConverter createMessageConverter(ObjectMapper objectMapper)
    {
        MappingJackson2MessageConverter jsonConverter = new MappingJackson2MessageConverter();
        jsonConverter.setObjectMapper(objectMapper);
        return new CompositeMessageConverter(List.of(
                new RawBodyMessageConverter(),
                new StringMessageConverter(),
                jsonConverter
        ));
    }

    // ========== Spring Callbacks ==========

    /**
     * Session callbacks for one connection attempt.
     *
     * <p>Callbacks from an attempt that has been superseded by a newer
     * connect or by a disconnect are ignored.</p>
     */
    private final class SessionHandler extends StompSessionHandlerAdapter
    {
        private final int attempt;
        private final AtomicBoolean terminated = new AtomicBoolean(false);
        private volatile boolean connected;

        SessionHandler(int attempt)
        {
            this.attempt = attempt;
        }

        @Override
        public void afterConnected(StompSession stompSession, StompHeaders connectedHeaders)
        {
            if (isStale() || terminated.get())
            {
                LOG.debug("Closing STOMP session from superseded attempt {}", attempt);
                closeSession(stompSession);
                return;
            }
            connected = true;
            connectionEstablished(stompSession);
        }

        @Override
        public Type getPayloadType(StompHeaders headers)
        {
            return byte[].class;
        }

        @Override
        public void handleFrame(StompHeaders headers, Object payload)
        {
            // Only ERROR frames reach the session handler
            if (isStale())
            {
                return;
            }
            String message = headers.getFirst("message");
            String brief = (message != null) ? message : "STOMP error";
            String full = (payload instanceof byte[] body) ? new String(body, StandardCharsets.UTF_8) : null;
            String receiptId = headers.getReceiptId();
            notifyDelegate(d -> d.onError(brief, full, receiptId, StompErrorType.FROM_STOMP));
        }

        @Override
        public void handleException(
                StompSession stompSession,
                StompCommand command,
                StompHeaders headers,
                byte[] payload,
                Throwable exception
        )
        {
            if (isStale())
            {
                return;
            }
            LOG.warn("Error handling {} frame: {}", command, describe(exception));
            notifyDelegate(d -> d.onError(describe(exception), null, null, StompErrorType.FROM_STOMP));
        }

        @Override
        public void handleTransportError(StompSession stompSession, Throwable exception)
        {
            if (isStale())
            {
                return;
            }
            if (exception instanceof ConnectionLostException)
            {
                terminate(exception);
            }
            else if (connected)
            {
                LOG.warn("Transport error on {}: {}", endpoint, describe(exception));
                notifyDelegate(d -> d.onError(describe(exception), null, null, StompErrorType.FROM_SOCKET));
            }
        }

        void terminate(Throwable cause)
        {
            if (isStale() || !terminated.compareAndSet(false, true))
            {
                return;
            }
            connectionTerminated(connected, cause);
        }

        private boolean isStale()
        {
            return attempt != attemptCounter.get();
        }
    }

    /**
     * Forwards MESSAGE frames for one destination to the delegate.
     */
    private final class DestinationHandler implements StompFrameHandler
    {
        private final String destination;

        DestinationHandler(String destination)
        {
            this.destination = destination;
        }

        @Override
        public Type getPayloadType(StompHeaders headers)
        {
            return byte[].class;
        }

        @Override
        public void handleFrame(StompHeaders headers, Object payload)
        {
            String messageId = headers.getMessageId();
            String frameDestination = (headers.getDestination() != null) ? headers.getDestination() : destination;
            Map<String, String> frameHeaders = headers.toSingleValueMap();
            Object body = (payload != null) ? payload : new byte[0];
            notifyDelegate(d -> d.onMessageReceived(body, messageId, frameDestination, frameHeaders));
        }
    }
}
