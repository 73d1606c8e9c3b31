package com.signalbot.backend.service.signal;

import java.time.Instant;

/**
 * Raw alert as delivered by the chat-ingestion side.
 */
public record IncomingMessage(String messageId, String channel, String content, String imageUrl, Instant receivedAt) {

    public boolean hasImage() {
        return imageUrl != null && !imageUrl.isBlank();
    }

    public String text() {
        return content == null ? "" : content;
    }
}
