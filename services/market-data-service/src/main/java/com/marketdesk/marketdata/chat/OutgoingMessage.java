package com.marketdesk.marketdata.chat;

import jakarta.validation.constraints.NotBlank;

/** {@code preformatted} asks the front end to render in a monospace block. */
public record OutgoingMessage(@NotBlank String text, boolean preformatted) {

  public static OutgoingMessage plain(String text) {
    return new OutgoingMessage(text, false);
  }

  public static OutgoingMessage pre(String text) {
    return new OutgoingMessage(text, true);
  }
}
