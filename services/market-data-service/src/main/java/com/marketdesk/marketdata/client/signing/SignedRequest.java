package com.marketdesk.marketdata.client.signing;

public record SignedRequest(String timestamp, String signature) {}
