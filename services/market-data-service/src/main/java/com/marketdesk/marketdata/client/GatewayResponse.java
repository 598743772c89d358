package com.marketdesk.marketdata.client;

import com.fasterxml.jackson.databind.JsonNode;

/** {@code json} is set only when the upstream declared a JSON content type. */
public record GatewayResponse(int statusCode, String contentType, JsonNode json, String rawBody) {

  public boolean isJson() {
    return json != null;
  }

  public JsonNode requireJson(String what) {
    if (json == null) {
      throw new DataException(
          what + " returned non-JSON response (" + contentType + "): " + abbreviate(rawBody));
    }
    return json;
  }

  private static String abbreviate(String text) {
    if (text == null) {
      return "";
    }
    return text.length() <= 200 ? text : text.substring(0, 200) + "...";
  }
}
