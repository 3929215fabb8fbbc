package org.abstractica.stompsocket.impl.socket;

import org.abstractica.stompsocket.AlreadyConnectedException;
import org.abstractica.stompsocket.ConnectionState;
import org.abstractica.stompsocket.NotConnectedException;
import org.abstractica.stompsocket.StompSocket;
import org.abstractica.stompsocket.StompSocketEvent;
import org.abstractica.stompsocket.engine.StompErrorType;
import org.abstractica.stompsocket.impl.engine.SimulatedStompEngine;
import org.abstractica.stompsocket.impl.engine.SimulatedStompEngine.Command;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for {@link DefaultStompSocket}.
 */
class DefaultStompSocketTest
{
    // ========== Test Payload Types ==========

    record Ping(String kind)
    {
        Ping
        {
            if (!"ping".equals(kind))
            {
                throw new IllegalArgumentException("Not a ping: " + kind);
            }
        }
    }

    record Greeting(String text) {}

    record Score(int points) {}

    // ========== Test Setup ==========

    private static final URI ENDPOINT = URI.create("ws://localhost:8080/ws");
    private static final String TOPIC = "/topic/x";

    private SimulatedStompEngine engine;
    private List<StompSocketEvent> events;
    private StompSocket socket;

    @BeforeEach
    void setUp()
    {
        engine = new SimulatedStompEngine();
        events = new ArrayList<>();
        socket = createSocket(Greeting.class, Score.class);
    }

    private StompSocket createSocket(Class<?>... candidateTypes)
    {
        DefaultStompSocketFactory.DefaultBuilder builder = new DefaultStompSocketFactory.DefaultBuilder();
        builder.endpoint(ENDPOINT)
                .connectionTimeout(Duration.ofSeconds(3))
                .autoPingInterval(Duration.ofSeconds(7))
                .engineFactory((endpoint, headers) -> engine)
                .eventHandler((s, event) -> events.add(event));
        for (Class<?> type : candidateTypes)
        {
            builder.receive(type);
        }
        return builder.build();
    }

    private void connectFully()
    {
        socket.connect();
        engine.completeConnect();
        events.clear();
        engine.clearCommands();
    }

    // ========== Connect ==========

    @Test
    void connect_issuesCommandAndEmitsConnecting()
    {
        socket.connect();

        assertEquals(List.of(new StompSocketEvent.Connecting()), events);
        assertEquals(List.of(new Command.Connect(Duration.ofSeconds(3), true)), engine.getCommands());
        assertTrue(engine.hasDelegate());
        assertTrue(socket.isConnecting());
        assertFalse(socket.isConnectedViaStomp());
        assertEquals(ConnectionState.CONNECTING, socket.getConnectionState());
    }

    @Test
    void connect_whileConnecting_isNoOp()
    {
        socket.connect();
        socket.connect();

        assertEquals(1, events.size());
        assertEquals(1, engine.getCommands().size());
    }

    @Test
    void connect_whileFullyConnected_throwsAndIssuesNothing()
    {
        connectFully();

        assertThrows(AlreadyConnectedException.class, () -> socket.connect());

        assertTrue(engine.getCommands().isEmpty());
        assertTrue(events.isEmpty());
        assertTrue(socket.isConnectedViaStomp());
    }

    @Test
    void connect_engineFailingSynchronously_emitsConnectingFirst()
    {
        SimulatedStompEngine refusing = new SimulatedStompEngine()
        {
            @Override
            public void connect(Duration timeout, boolean autoReconnect)
            {
                super.connect(timeout, autoReconnect);
                raiseError("refused", null, null, StompErrorType.FROM_SOCKET);
                dropSocket();
            }
        };
        List<ConnectionState> statesSeen = new ArrayList<>();
        StompSocket refusedSocket = new DefaultStompSocketFactory().builder()
                .endpoint(ENDPOINT)
                .engineFactory((endpoint, headers) -> refusing)
                .eventHandler((s, event) ->
                {
                    events.add(event);
                    statesSeen.add(s.getConnectionState());
                })
                .build();

        refusedSocket.connect();

        assertEquals(List.of(
                new StompSocketEvent.Connecting(),
                new StompSocketEvent.ErrorReceived("refused"),
                new StompSocketEvent.Disconnected()
        ), events);
        assertEquals(List.of(ConnectionState.CONNECTING, ConnectionState.CONNECTING, ConnectionState.DISCONNECTED),
                statesSeen);
        assertEquals(ConnectionState.DISCONNECTED, refusedSocket.getConnectionState());
        assertFalse(refusing.hasDelegate());
    }

    @Test
    void connect_engineConnectingSynchronously_emitsConnectingThenConnected()
    {
        SimulatedStompEngine immediate = new SimulatedStompEngine()
        {
            @Override
            public void connect(Duration timeout, boolean autoReconnect)
            {
                super.connect(timeout, autoReconnect);
                completeConnect();
            }
        };
        StompSocket immediateSocket = new DefaultStompSocketFactory().builder()
                .endpoint(ENDPOINT)
                .engineFactory((endpoint, headers) -> immediate)
                .eventHandler((s, event) -> events.add(event))
                .build();

        immediateSocket.connect();

        assertEquals(List.of(new StompSocketEvent.Connecting(), new StompSocketEvent.Connected()), events);
        assertTrue(immediateSocket.isConnectedViaStomp());
    }

    @Test
    void socketConnect_movesToSocketConnectedWithoutEvent()
    {
        socket.connect();
        events.clear();

        engine.completeSocketConnect();

        assertTrue(events.isEmpty());
        assertEquals(ConnectionState.SOCKET_CONNECTED, socket.getConnectionState());
        assertFalse(socket.isConnecting());
        assertFalse(socket.isConnectedViaStomp());
    }

    @Test
    void stompConnect_enablesPingAndEmitsConnected()
    {
        socket.connect();
        events.clear();

        engine.completeConnect();

        assertEquals(List.of(new StompSocketEvent.Connected()), events);
        assertTrue(socket.isConnectedViaStomp());
        assertEquals(ConnectionState.FULLY_CONNECTED, socket.getConnectionState());
        assertEquals(Duration.ofSeconds(7), engine.getAutoPingInterval());
    }

    @Test
    void connected_precedesPayloadEvents()
    {
        socket.connect();
        engine.completeConnect();
        engine.deliver("{\"text\":\"hello\"}", TOPIC);

        assertEquals(List.of(
                new StompSocketEvent.Connecting(),
                new StompSocketEvent.Connected(),
                new StompSocketEvent.PayloadReceived(new Greeting("hello"), TOPIC)
        ), events);
    }

    // ========== Admission Control ==========

    @Test
    void operations_whenDisconnected_throwNotConnected()
    {
        assertThrows(NotConnectedException.class, () -> socket.subscribe(TOPIC));
        assertThrows(NotConnectedException.class, () -> socket.unsubscribe(TOPIC));
        assertThrows(NotConnectedException.class, () -> socket.send(new Score(1), TOPIC));

        assertTrue(engine.getCommands().isEmpty());
    }

    @Test
    void operations_whileConnecting_throwNotConnected()
    {
        socket.connect();
        engine.clearCommands();

        assertThrows(NotConnectedException.class, () -> socket.subscribe(TOPIC));
        assertThrows(NotConnectedException.class, () -> socket.send(new Score(1), TOPIC));

        engine.completeSocketConnect();

        assertThrows(NotConnectedException.class, () -> socket.unsubscribe(TOPIC));
        assertTrue(engine.getCommands().isEmpty());
    }

    @Test
    void operations_whenFullyConnected_forwardToEngine()
    {
        connectFully();

        socket.subscribe(TOPIC);
        socket.send(new Score(5), TOPIC);
        socket.unsubscribe(TOPIC);

        assertEquals(List.of(
                new Command.Subscribe(TOPIC),
                new Command.Send(new Score(5), TOPIC),
                new Command.Unsubscribe(TOPIC)
        ), engine.getCommands());
    }

    @Test
    void notConnectedException_isIllegalState()
    {
        IllegalStateException e = assertThrows(IllegalStateException.class, () -> socket.subscribe(TOPIC));
        assertInstanceOf(NotConnectedException.class, e);
    }

    // ========== Payload Decoding ==========

    @Test
    void message_decodesFirstMatchingCandidate()
    {
        connectFully();

        engine.deliver("{\"points\":42}", TOPIC);

        assertEquals(List.of(new StompSocketEvent.PayloadReceived(new Score(42), TOPIC)), events);
    }

    @Test
    void message_matchingNoCandidate_isDropped()
    {
        connectFully();

        engine.deliver("{\"unrelated\":true}", TOPIC);
        engine.deliver("not json at all", TOPIC);

        assertTrue(events.isEmpty());
        assertTrue(socket.isConnectedViaStomp());
    }

    @Test
    void message_binaryBody_isDecoded()
    {
        connectFully();

        engine.deliver("{\"text\":\"bytes\"}".getBytes(StandardCharsets.UTF_8), TOPIC);

        assertEquals(List.of(new StompSocketEvent.PayloadReceived(new Greeting("bytes"), TOPIC)), events);
    }

    @Test
    void message_unsupportedBody_isDropped()
    {
        connectFully();

        engine.deliver(42, TOPIC);
        engine.deliver(null, TOPIC);

        assertTrue(events.isEmpty());
    }

    @Test
    void message_decodableAsSeveralCandidates_emitsOnlyFirst()
    {
        socket = createSocket(Greeting.class, Greeting.class);
        connectFully();

        engine.deliver("{\"text\":\"once\"}", TOPIC);

        assertEquals(1, events.size());
    }

    @Test
    void message_withoutCandidates_isDropped()
    {
        socket = createSocket();
        connectFully();

        engine.deliver("{\"text\":\"hello\"}", TOPIC);

        assertTrue(events.isEmpty());
    }

    @Test
    void send_echoedBack_decodesToEqualValue()
    {
        connectFully();
        engine.setEchoSends(true);
        socket.subscribe(TOPIC);

        socket.send(new Score(7), TOPIC);

        assertEquals(List.of(new StompSocketEvent.PayloadReceived(new Score(7), TOPIC)), events);
    }

    // ========== Errors ==========

    @Test
    void error_emitsBriefDescriptionOnly()
    {
        connectFully();

        engine.raiseError("Broker unavailable", "The broker went away at 12:00", "receipt-1", StompErrorType.FROM_STOMP);

        assertEquals(List.of(new StompSocketEvent.ErrorReceived("Broker unavailable")), events);
        assertTrue(socket.isConnectedViaStomp());
    }

    @Test
    void receiptAndSocketEvents_emitNothing()
    {
        connectFully();

        engine.receipt("receipt-7");
        engine.socketEvent("pong", "keep-alive");

        assertTrue(events.isEmpty());
    }

    // ========== Disconnect ==========

    @Test
    void forcedDisconnect_emitsDisconnectedSynchronously()
    {
        connectFully();

        socket.disconnect(true);

        assertEquals(List.of(new StompSocketEvent.Disconnected()), events);
        assertEquals(List.of(new Command.SetAutoReconnect(false), new Command.Disconnect(true)), engine.getCommands());
        assertFalse(engine.hasDelegate());
        assertFalse(socket.isConnectedViaStomp());
        assertEquals(ConnectionState.DISCONNECTED, socket.getConnectionState());
    }

    @Test
    void forcedDisconnect_fromAnyState_emitsExactlyOneDisconnected()
    {
        socket.disconnect(true);
        assertEquals(List.of(new StompSocketEvent.Disconnected()), events);

        events.clear();
        socket.connect();
        events.clear();
        socket.disconnect(true);
        assertEquals(List.of(new StompSocketEvent.Disconnected()), events);
        assertFalse(socket.isConnecting());
    }

    @Test
    void gracefulDisconnect_defersDisconnectedUntilSocketCloses()
    {
        connectFully();

        socket.disconnect();

        assertEquals(List.of(new Command.SetAutoReconnect(false), new Command.Disconnect(false)), engine.getCommands());
        assertTrue(events.isEmpty());
        assertTrue(engine.hasDelegate());

        engine.completeDisconnect();

        assertEquals(List.of(new StompSocketEvent.Disconnected()), events);
        assertFalse(engine.hasDelegate());
        assertEquals(ConnectionState.DISCONNECTED, socket.getConnectionState());
    }

    @Test
    void socketDrop_emitsDisconnectedAndClearsDelegate()
    {
        connectFully();

        engine.dropSocket();

        assertEquals(List.of(new StompSocketEvent.Disconnected()), events);
        assertFalse(engine.hasDelegate());
        assertFalse(socket.isConnectedViaStomp());
    }

    @Test
    void reconnect_afterDisconnect_isAllowed()
    {
        connectFully();
        socket.disconnect(true);
        events.clear();

        socket.connect();
        engine.completeConnect();

        assertEquals(List.of(new StompSocketEvent.Connecting(), new StompSocketEvent.Connected()), events);
    }

    // ========== Protocol Drop ==========

    @Test
    void stompDrop_emitsProtocolDroppedAndRejectsOperations()
    {
        connectFully();

        engine.dropStomp();

        assertEquals(List.of(new StompSocketEvent.ProtocolDropped()), events);
        assertEquals(ConnectionState.SOCKET_CONNECTED, socket.getConnectionState());
        assertThrows(NotConnectedException.class, () -> socket.send(new Score(1), TOPIC));
    }

    @Test
    void stompDrop_thenReconnectByEngine_emitsConnected()
    {
        connectFully();
        engine.dropStomp();
        events.clear();

        engine.completeStompConnect();

        assertEquals(List.of(new StompSocketEvent.Connected()), events);
        assertTrue(socket.isConnectedViaStomp());
    }

    @Test
    void stompDrop_whenNotConnected_emitsNothing()
    {
        socket.connect();
        events.clear();

        engine.dropStomp();

        assertTrue(events.isEmpty());
        assertTrue(socket.isConnecting());
    }

    // ========== Event Handler ==========

    @Test
    void onEvent_replacesHandler()
    {
        List<StompSocketEvent> replacement = new ArrayList<>();
        socket.onEvent((s, event) -> replacement.add(event));

        socket.connect();

        assertTrue(events.isEmpty());
        assertEquals(List.of(new StompSocketEvent.Connecting()), replacement);
    }

    @Test
    void handlerException_doesNotReachCaller()
    {
        socket.onEvent((s, event) ->
        {
            throw new RuntimeException("Handler bug");
        });

        assertDoesNotThrow(() -> socket.connect());
        assertDoesNotThrow(() -> engine.completeConnect());
        assertTrue(socket.isConnectedViaStomp());
    }

    @Test
    void handler_receivesEmittingSocket()
    {
        List<StompSocket> sources = new ArrayList<>();
        socket.onEvent((s, event) -> sources.add(s));

        socket.connect();

        assertSame(socket, sources.get(0));
    }

    // ========== Close ==========

    @Test
    void close_forcesDisconnectAndClosesEngine()
    {
        connectFully();

        socket.close();

        assertEquals(List.of(new StompSocketEvent.Disconnected()), events);
        assertTrue(engine.isClosed());
    }

    @Test
    void close_isIdempotent()
    {
        connectFully();

        socket.close();
        socket.close();

        assertEquals(List.of(new StompSocketEvent.Disconnected()), events);
    }

    @Test
    void afterClose_connectThrowsAndDisconnectDoesNothing()
    {
        socket.close();
        events.clear();
        engine.clearCommands();

        IllegalStateException e = assertThrows(IllegalStateException.class, () -> socket.connect());
        socket.disconnect(true);
        socket.disconnect();

        assertEquals("StompSocket is closed", e.getMessage());
        assertTrue(events.isEmpty());
        assertTrue(engine.getCommands().isEmpty());
        assertFalse(engine.hasDelegate());
        assertEquals(ConnectionState.DISCONNECTED, socket.getConnectionState());
    }

    // ========== Scenario ==========

    @Test
    void pingScenario()
    {
        events.clear();
        socket = createSocket(Ping.class);

        socket.connect();
        assertEquals(List.of(new StompSocketEvent.Connecting()), events);

        engine.completeStompConnect();
        assertEquals(new StompSocketEvent.Connected(), events.get(1));
        assertTrue(socket.isConnectedViaStomp());

        engine.deliver("{\"kind\":\"ping\"}", TOPIC);
        assertEquals(new StompSocketEvent.PayloadReceived(new Ping("ping"), TOPIC), events.get(2));

        engine.deliver("{\"kind\":\"pong\"}", TOPIC);
        assertEquals(3, events.size());

        socket.disconnect(true);
        assertEquals(new StompSocketEvent.Disconnected(), events.get(3));
        assertFalse(socket.isConnectedViaStomp());
    }

    @Test
    void engineFactory_receivesEndpointAndHeaders()
    {
        List<Object> received = new ArrayList<>();
        new DefaultStompSocketFactory().builder()
                .endpoint(ENDPOINT)
                .connectionHeaders(Map.of("Authorization", "Bearer abc"))
                .engineFactory((endpoint, headers) ->
                {
                    received.add(endpoint);
                    received.add(headers);
                    return engine;
                })
                .build();

        assertEquals(List.of(ENDPOINT, Map.of("Authorization", "Bearer abc")), received);
    }
}
