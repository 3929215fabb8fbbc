package org.abstractica.stompsocket.impl.socket;

import org.abstractica.stompsocket.AlreadyConnectedException;
import org.abstractica.stompsocket.CandidateType;
import org.abstractica.stompsocket.ConnectionState;
import org.abstractica.stompsocket.NotConnectedException;
import org.abstractica.stompsocket.PayloadDecoder;
import org.abstractica.stompsocket.StompSocket;
import org.abstractica.stompsocket.StompSocketEvent;
import org.abstractica.stompsocket.engine.ConnectType;
import org.abstractica.stompsocket.engine.DisconnectType;
import org.abstractica.stompsocket.engine.StompEngine;
import org.abstractica.stompsocket.engine.StompEngineDelegate;
import org.abstractica.stompsocket.engine.StompErrorType;
import org.abstractica.stompsocket.handlers.EventHandler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.URI;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Default implementation of the StompSocket interface.
 *
 * <p>Acts both as the connection controller for the application and as the
 * delegate of the engine it owns. While a connection is open the engine holds
 * a reference back to this socket; that reference is cleared on a forced
 * disconnect or when the engine reports the web-socket closed.</p>
 */
public class DefaultStompSocket implements StompSocket, StompEngineDelegate
{
    private static final Logger LOG = LoggerFactory.getLogger(DefaultStompSocket.class);

    private final URI endpoint;
    private final StompEngine engine;
    private final Duration connectionTimeout;
    private final Duration autoPingInterval;
    private final PayloadResolver payloadResolver;

    private volatile EventHandler eventHandler;
    private volatile ConnectionState state;
    private volatile boolean disconnecting;
    private volatile boolean closed;

    DefaultStompSocket(
            URI endpoint,
            StompEngine engine,
            Duration connectionTimeout,
            Duration autoPingInterval,
            List<CandidateType<?>> candidateTypes,
            PayloadDecoder decoder,
            EventHandler eventHandler
    )
    {
        this.endpoint = Objects.requireNonNull(endpoint, "endpoint");
        this.engine = Objects.requireNonNull(engine, "engine");
        this.connectionTimeout = Objects.requireNonNull(connectionTimeout, "connectionTimeout");
        this.autoPingInterval = Objects.requireNonNull(autoPingInterval, "autoPingInterval");
        this.payloadResolver = new PayloadResolver(candidateTypes, decoder);
        this.eventHandler = Objects.requireNonNull(eventHandler, "eventHandler");
        this.state = ConnectionState.DISCONNECTED;
    }

    // ========== StompSocket Interface ==========

    @Override
    public void connect()
    {
        if (closed)
        {
            throw new IllegalStateException("StompSocket is closed");
        }
        if (state == ConnectionState.CONNECTING)
        {
            LOG.debug("Connect ignored, already connecting to {}", endpoint);
            return;
        }
        if (state == ConnectionState.FULLY_CONNECTED)
        {
            throw new AlreadyConnectedException();
        }

        LOG.info("Connecting to {}", endpoint);

        // Connecting goes out first, the engine may report results synchronously
        disconnecting = false;
        state = ConnectionState.CONNECTING;
        emit(new StompSocketEvent.Connecting());

        engine.setDelegate(this);
        engine.connect(connectionTimeout, true);
    }

    @Override
    public void disconnect()
    {
        disconnect(false);
    }

    @Override
    public void disconnect(boolean force)
    {
        if (closed)
        {
            LOG.debug("Disconnect ignored, socket for {} is closed", endpoint);
            return;
        }

        LOG.info("Disconnecting from {} (force={})", endpoint, force);

        // Must be set before the engine is told, it may report the shutdown synchronously
        disconnecting = !force;
        engine.setAutoReconnect(false);
        engine.disconnect(force);

        if (force)
        {
            engine.setDelegate(null);
            state = ConnectionState.DISCONNECTED;
            emit(new StompSocketEvent.Disconnected());
        }
    }

    @Override
    public void subscribe(String destination)
    {
        Objects.requireNonNull(destination, "destination");
        requireConnectedViaStomp();
        engine.subscribe(destination);
    }

    @Override
    public void unsubscribe(String destination)
    {
        Objects.requireNonNull(destination, "destination");
        requireConnectedViaStomp();
        engine.unsubscribe(destination);
    }

    @Override
    public void send(Object payload, String destination)
    {
        Objects.requireNonNull(payload, "payload");
        Objects.requireNonNull(destination, "destination");
        requireConnectedViaStomp();
        engine.send(payload, destination);
    }

    @Override
    public void onEvent(EventHandler handler)
    {
        this.eventHandler = Objects.requireNonNull(handler, "handler");
    }

    @Override
    public boolean isConnectedViaStomp()
    {
        return state == ConnectionState.FULLY_CONNECTED;
    }

    @Override
    public boolean isConnecting()
    {
        return state == ConnectionState.CONNECTING;
    }

    @Override
    public ConnectionState getConnectionState()
    {
        return state;
    }

    @Override
    public void close()
    {
        if (closed)
        {
            return;
        }
        disconnect(true);
        closed = true;
        engine.close();
    }

    // ========== StompEngineDelegate Interface ==========

    @Override
    public void onConnect(ConnectType type)
    {
        switch (type)
        {
            case TO_SOCKET_ENDPOINT ->
            {
                // Not usable until the STOMP handshake completes
                LOG.debug("Web-socket connected to {}", endpoint);
                if (state == ConnectionState.CONNECTING)
                {
                    state = ConnectionState.SOCKET_CONNECTED;
                }
            }
            case TO_STOMP ->
            {
                engine.enableAutoPing(autoPingInterval);
                state = ConnectionState.FULLY_CONNECTED;
                LOG.info("Connected via STOMP to {}", endpoint);
                emit(new StompSocketEvent.Connected());
            }
        }
    }

    @Override
    public void onDisconnect(DisconnectType type)
    {
        switch (type)
        {
            case FROM_SOCKET ->
            {
                LOG.info("Disconnected from {}", endpoint);
                state = ConnectionState.DISCONNECTED;
                disconnecting = false;
                emit(new StompSocketEvent.Disconnected());
                engine.setDelegate(null);
            }
            case FROM_STOMP ->
            {
                if (disconnecting)
                {
                    LOG.debug("STOMP closed during graceful disconnect from {}", endpoint);
                }
                else if (state == ConnectionState.FULLY_CONNECTED)
                {
                    LOG.warn("STOMP dropped on {}, web-socket still open", endpoint);
                    state = ConnectionState.SOCKET_CONNECTED;
                    emit(new StompSocketEvent.ProtocolDropped());
                }
                else
                {
                    LOG.debug("STOMP disconnect ignored in state {}", state);
                }
            }
        }
    }

    @Override
    public void onMessageReceived(Object message, String messageId, String destination, Map<String, String> headers)
    {
        payloadResolver.resolve(message)
                .ifPresent(payload -> emit(new StompSocketEvent.PayloadReceived(payload, destination)));
    }

    @Override
    public void onError(String briefDescription, String fullDescription, String receiptId, StompErrorType type)
    {
        LOG.warn("Error received ({}): {}", type, briefDescription);
        emit(new StompSocketEvent.ErrorReceived(briefDescription));
    }

    @Override
    public void onReceipt(String receiptId)
    {
        LOG.debug("Receipt received: {}", receiptId);
    }

    @Override
    public void onSocketEvent(String eventName, String description)
    {
        LOG.debug("Socket event {}: {}", eventName, description);
    }

    // ========== Helpers ==========

    private void requireConnectedViaStomp()
    {
        if (state != ConnectionState.FULLY_CONNECTED)
        {
            throw new NotConnectedException();
        }
    }

    private void emit(StompSocketEvent event)
    {
        EventHandler handler = eventHandler;
        try
        {
            handler.handle(this, event);
        }
        catch (Exception e)
        {
            LOG.error("Event handler failed on {}", event, e);
        }
    }
}
