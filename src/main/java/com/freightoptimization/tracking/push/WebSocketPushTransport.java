package com.freightoptimization.tracking.push;

import com.freightoptimization.tracking.exception.TrackingConnectionException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;
import org.springframework.web.socket.client.WebSocketClient;
import org.springframework.web.socket.handler.TextWebSocketHandler;

import java.io.IOException;

/**
 * {@link PushTransport} over a plain text WebSocket.
 */
@Slf4j
public class WebSocketPushTransport implements PushTransport {

    private final WebSocketClient client;
    private final String url;
    private volatile WebSocketSession session;

    public WebSocketPushTransport(WebSocketClient client, String url) {
        this.client = client;
        this.url = url;
    }

    @Override
    public void connect(Listener listener) {
        log.debug("Opening push connection to {}", url);
        client.execute(new TextWebSocketHandler() {
            @Override
            public void afterConnectionEstablished(WebSocketSession newSession) {
                session = newSession;
                listener.onOpen();
            }

            @Override
            protected void handleTextMessage(WebSocketSession s, TextMessage message) {
                listener.onMessage(message.getPayload());
            }

            @Override
            public void handleTransportError(WebSocketSession s, Throwable exception) {
                listener.onError(exception);
            }

            @Override
            public void afterConnectionClosed(WebSocketSession s, CloseStatus status) {
                if (session == s) {
                    session = null;
                }
                listener.onClose(status.getCode(), status.getReason());
            }
        }, url).whenComplete((s, error) -> {
            if (error != null) {
                listener.onError(error);
            }
        });
    }

    @Override
    public void send(String text) {
        WebSocketSession current = session;
        if (current == null || !current.isOpen()) {
            throw new TrackingConnectionException("Push connection is not open");
        }
        try {
            current.sendMessage(new TextMessage(text));
        } catch (IOException e) {
            throw new TrackingConnectionException("Failed to send push frame: " + e.getMessage(), e);
        }
    }

    @Override
    public void close() {
        WebSocketSession current = session;
        session = null;
        if (current != null && current.isOpen()) {
            try {
                current.close(CloseStatus.NORMAL);
            } catch (IOException e) {
                log.warn("Error closing push connection: {}", e.getMessage());
            }
        }
    }
}
