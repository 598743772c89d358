package com.marketdesk.marketdata.render;

import com.marketdesk.marketdata.client.ValidationException;
import java.time.DateTimeException;
import java.time.LocalDate;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/** {@code MM/DD/YY} option expiries. Two-digit years below 70 are 20YY, the rest 19YY. */
public final class ExpiryParser {
  static final String MESSAGE = "Expiry must be MM/DD/YY";
  private static final Pattern SHAPE = Pattern.compile("^(\\d{1,2})/(\\d{1,2})/(\\d{2})$");
  private static final int PIVOT_YEAR = 70;

  private ExpiryParser() {}

  public static LocalDate parse(String expiry) {
    if (expiry == null) {
      throw new ValidationException(MESSAGE);
    }
    Matcher m = SHAPE.matcher(expiry.trim());
    if (!m.matches()) {
      throw new ValidationException(MESSAGE);
    }
    int month = Integer.parseInt(m.group(1));
    int day = Integer.parseInt(m.group(2));
    int yy = Integer.parseInt(m.group(3));
    int year = yy < PIVOT_YEAR ? 2000 + yy : 1900 + yy;
    try {
      return LocalDate.of(year, month, day);
    } catch (DateTimeException e) {
      throw new ValidationException(MESSAGE, e);
    }
  }

  /** {@code "01/15/25"} to {@code "2025-01-15"}. */
  public static String toIsoDate(String expiry) {
    return parse(expiry).toString();
  }
}
