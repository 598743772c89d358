package com.marketdesk.marketdata.chat;

import jakarta.validation.constraints.NotBlank;

/** A chat command line as delivered by the chat front end. */
public record ChatMessageEnvelope(
    @NotBlank String channel,
    @NotBlank String chatId,
    String externalUserId,
    String text,
    String correlationId) {}
