package com.signalbot.backend.dto;

import jakarta.validation.constraints.NotBlank;
import lombok.Data;

@Data
public class MessageRequest {

    @NotBlank
    private String messageId;

    private String channel;

    private String content;

    private String imageUrl;
}
