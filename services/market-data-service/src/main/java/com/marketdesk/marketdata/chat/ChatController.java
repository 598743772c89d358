package com.marketdesk.marketdata.chat;

import jakarta.validation.Valid;
import lombok.extern.slf4j.Slf4j;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/** Entry point for chat front ends: one command line in, one or more reply messages out. */
@RestController
@RequestMapping("/internal/chat")
@Slf4j
public class ChatController {

  private final ChatCommandHandler commandHandler;

  public ChatController(ChatCommandHandler commandHandler) {
    this.commandHandler = commandHandler;
  }

  @PostMapping("/message")
  public ChatResponse onMessage(@Valid @RequestBody ChatMessageEnvelope message) {
    log.debug(
        "chat message channel={} chatId={} correlationId={}",
        message.channel(),
        message.chatId(),
        message.correlationId());
    return commandHandler.handle(message);
  }
}
