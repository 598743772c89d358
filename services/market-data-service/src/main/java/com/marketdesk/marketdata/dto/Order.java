package com.marketdesk.marketdata.dto;

/**
 * A crypto order as shown to the user. Fields are upstream text; an absent upstream field holds
 * {@link #PLACEHOLDER} instead of a made-up value.
 */
public record Order(
    String id, String timestamp, String side, String symbol, String quantity, String status) {

  public static final String PLACEHOLDER = "—";
}
