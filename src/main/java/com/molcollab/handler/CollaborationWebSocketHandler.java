package com.molcollab.handler;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.molcollab.dto.ClientMessage;
import com.molcollab.dto.ClientMessageType;
import com.molcollab.dto.ErrorResponse.ErrorCode;
import com.molcollab.dto.ServerMessage;
import com.molcollab.exception.AuthException;
import com.molcollab.exception.MessageException;
import com.molcollab.exception.RoomException;
import com.molcollab.metrics.CollaborationMetrics;
import com.molcollab.handler.ClientMessageParser.ChatLine;
import com.molcollab.model.Room;
import com.molcollab.model.Session;
import com.molcollab.model.Vector3;
import com.molcollab.security.HandshakeAuthenticator;
import com.molcollab.service.RoomRegistry;
import com.molcollab.validation.InputValidator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.socket.CloseStatus;
import org.springframework.web.reactive.socket.WebSocketHandler;
import org.springframework.web.reactive.socket.WebSocketMessage;
import org.springframework.web.reactive.socket.WebSocketSession;
import reactor.core.publisher.Mono;
import reactor.core.publisher.Sinks;

import java.time.Duration;
import java.util.List;

/**
 * Reactive WebSocket handler for the collaboration protocol.
 * <p>
 * A connection starts unregistered and must complete a {@code handshake} (create, join or list
 * rooms) before anything else is accepted. After joining, each frame is parsed, validated and
 * handed to the room, which does all ordering and fan-out. Outbound frames go through a
 * per-connection sink, so rooms never touch the socket directly.
 */
@Component
public class CollaborationWebSocketHandler implements WebSocketHandler {

    private static final Logger logger = LoggerFactory.getLogger(CollaborationWebSocketHandler.class);
    private static final Duration EMIT_RETRY = Duration.ofMillis(100);

    private final RoomRegistry roomRegistry;
    private final HandshakeAuthenticator authenticator;
    private final ClientMessageParser parser;
    private final InputValidator validator;
    private final ObjectMapper objectMapper;
    private final CollaborationMetrics metrics;

    public CollaborationWebSocketHandler(RoomRegistry roomRegistry,
                                         HandshakeAuthenticator authenticator,
                                         ClientMessageParser parser,
                                         InputValidator validator,
                                         ObjectMapper objectMapper,
                                         CollaborationMetrics metrics) {
        this.roomRegistry = roomRegistry;
        this.authenticator = authenticator;
        this.parser = parser;
        this.validator = validator;
        this.objectMapper = objectMapper;
        this.metrics = metrics;
    }

    @Override
    public Mono<Void> handle(WebSocketSession webSocketSession) {
        Connection connection = new Connection(webSocketSession.getId(),
                Sinks.many().multicast().onBackpressureBuffer(1024));
        logger.info("New WebSocket connection: {}", connection.id);

        Mono<Void> input = webSocketSession.receive()
                .doOnNext(message -> handleMessage(connection, message))
                .doOnError(error -> logger.error("Error receiving on {}: {}", connection.id, error.getMessage()))
                .doFinally(signalType -> disconnect(connection))
                .then();

        // Once the outbound sink completes, close with the status the connection ended with
        Mono<Void> output = webSocketSession.send(connection.outbound.asFlux().map(webSocketSession::textMessage))
                .then(Mono.defer(() -> webSocketSession.close(connection.closeStatus)));

        return Mono.zip(input, output).then();
    }

    private void handleMessage(Connection connection, WebSocketMessage message) {
        if (message.getType() != WebSocketMessage.Type.TEXT) {
            logger.debug("Ignoring {} frame on {}", message.getType(), connection.id);
            if (message.getType() == WebSocketMessage.Type.BINARY) {
                connection.send(ServerMessage.error(ErrorCode.MSG_001, "binary frames are not supported"));
            }
            return;
        }
        handleText(connection, message.getPayloadAsText());
    }

    /**
     * Process one text frame. Failures are reported to this connection only.
     */
    void handleText(Connection connection, String text) {
        try {
            ClientMessage message = parser.parse(text);
            logger.debug("Received {} on {}", message.type().getWireName(), connection.id);

            if (message.type() == ClientMessageType.HANDSHAKE) {
                handleHandshake(connection, message);
                return;
            }
            Session session = connection.session;
            if (session == null) {
                throw new MessageException(ErrorCode.MSG_003, message.type().getWireName());
            }
            dispatch(session, message);
        } catch (MessageException | RoomException e) {
            logger.warn("Rejected message on {}: {}", connection.id, e.getMessage());
            metrics.messageRejected(errorCodeOf(e));
            connection.send(ServerMessage.error(errorCodeOf(e), detailsOf(e)));
        } catch (RuntimeException e) {
            logger.error("Unexpected error handling message on {}", connection.id, e);
            connection.send(ServerMessage.error(ErrorCode.SRV_001, null));
        }
    }

    private void handleHandshake(Connection connection, ClientMessage message) {
        if (connection.session != null) {
            throw new MessageException(ErrorCode.MSG_001, "already in room " + connection.session.getRoomId());
        }

        try {
            String userId = authenticator.authenticate(message.token(), message.userId())
                    .orElseThrow(() -> new AuthException(ErrorCode.AUTH_001));
            validator.validateUserId(userId);

            switch (message.action()) {
                case CREATE_ROOM -> {
                    validator.validateSubjectId(message.subjectId());
                    connection.session = roomRegistry.createAndJoin(userId, message.subjectId(), connection::send);
                    logger.info("Connection {} created room {} as {}",
                            connection.id, connection.session.getRoomId(), userId);
                }
                case JOIN_ROOM -> {
                    validator.validateRoomId(message.roomId());
                    connection.session = roomRegistry.joinRoom(message.roomId(), userId, connection::send);
                    logger.info("Connection {} joined room {} as {}", connection.id, message.roomId(), userId);
                }
                case LIST_ROOMS -> connection.send(ServerMessage.roomList(roomRegistry.listRooms()));
            }
        } catch (AuthException e) {
            logger.warn("Handshake authentication failed on {}", connection.id);
            metrics.messageRejected(e.getErrorCode());
            connection.send(ServerMessage.handshakeError(e.getMessage()));
            connection.close(CloseStatus.POLICY_VIOLATION);
        } catch (MessageException | RoomException e) {
            logger.warn("Handshake rejected on {}: {}", connection.id, e.getMessage());
            metrics.messageRejected(errorCodeOf(e));
            connection.send(ServerMessage.handshakeError(e.getMessage()));
        }
    }

    private void dispatch(Session session, ClientMessage message) {
        Room room = roomRegistry.getRoom(session.getRoomId());
        String sessionId = session.getSessionId();

        switch (message.type()) {
            case CURSOR_UPDATE -> {
                Vector3 cursor = parser.readCursor(message.payload());
                validator.validateCursor(cursor);
                room.updateCursor(sessionId, cursor);
            }
            case SELECTION_UPDATE -> {
                List<Integer> selection = parser.readSelection(message.payload());
                validator.validateSelection(selection);
                room.updateSelection(sessionId, selection);
            }
            case STATE_UPDATE -> room.applyUpdate(sessionId, parser.readUpdate(message.payload()));
            case CHAT_MESSAGE -> {
                ChatLine line = parser.readChat(message.payload());
                String text = validator.validateChatMessage(line.text());
                String username = validator.validateUsername(line.username(), session.getUserId());
                room.broadcastChat(sessionId, username, text);
            }
            case CAMERA_UPDATE -> room.updateCamera(sessionId, parser.readObject(message.payload(), "camera"));
            case ANNOTATION_ADDED -> room.addAnnotation(sessionId, parser.readObject(message.payload(), "annotation"));
            case HANDSHAKE -> throw new IllegalStateException("handshake is handled before dispatch");
        }
    }

    /**
     * A dropped connection is an implicit leave.
     */
    void disconnect(Connection connection) {
        Session session = connection.session;
        if (session != null) {
            roomRegistry.leave(session);
            connection.session = null;
        }
        connection.outbound.tryEmitComplete();
        logger.info("WebSocket connection closed: {}", connection.id);
    }

    private static ErrorCode errorCodeOf(RuntimeException e) {
        return e instanceof MessageException m ? m.getErrorCode() : ((RoomException) e).getErrorCode();
    }

    private static String detailsOf(RuntimeException e) {
        return e instanceof MessageException m ? m.getDetails() : ((RoomException) e).getDetails();
    }

    /**
     * Per-socket state. Frames of one socket are handled one at a time, so the fields need
     * no locking beyond visibility.
     */
    final class Connection {
        private final String id;
        private final Sinks.Many<String> outbound;
        private volatile Session session;
        private volatile CloseStatus closeStatus = CloseStatus.NORMAL;

        Connection(String id, Sinks.Many<String> outbound) {
            this.id = id;
            this.outbound = outbound;
        }

        void send(ServerMessage message) {
            String json;
            try {
                json = objectMapper.writeValueAsString(message);
            } catch (JsonProcessingException e) {
                throw new IllegalStateException("Failed to serialize " + message.getType(), e);
            }
            outbound.emitNext(json, Sinks.EmitFailureHandler.busyLooping(EMIT_RETRY));
        }

        void close(CloseStatus status) {
            this.closeStatus = status;
            outbound.tryEmitComplete();
        }

        Session getSession() {
            return session;
        }

        CloseStatus getCloseStatus() {
            return closeStatus;
        }
    }
}
