package com.marketdesk.marketdata.render;

import com.marketdesk.marketdata.client.DataException;
import com.marketdesk.marketdata.dto.OptionChain;
import com.marketdesk.marketdata.dto.OptionContract;
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Set;
import org.springframework.stereotype.Component;

/**
 * Renders the strikes around the underlying price: the pivot is the first strike at or above the
 * underlying (the last strike when none is), and up to five strikes either side are shown.
 */
@Component
public class OptionsSliceFormatter {
  static final int HALF_WINDOW = 5;
  static final List<String> HEADERS = List.of("Strike", "Bid", "Ask", "Last", "IV", "OI", "Volume");
  private static final Set<Integer> NUMERIC_COLUMNS = Set.of(0, 1, 2, 3, 4, 5, 6);

  private final TextTable textTable = new TextTable();

  public String render(OptionChain chain) {
    List<OptionContract> window = select(chain.contracts(), chain.underlyingPrice());
    if (window.isEmpty()) {
      throw new DataException("No contracts found");
    }
    String header =
        chain.ticker()
            + " "
            + chain.type().name()
            + " "
            + chain.expiry()
            + " | Underlying: "
            + (chain.underlyingPrice() == null ? "—" : fixed(chain.underlyingPrice(), 2));

    List<List<String>> rows = new ArrayList<>();
    for (OptionContract c : window) {
      rows.add(
          List.of(
              fixed(c.strike(), 2),
              fixed(c.bid(), 2),
              fixed(c.ask(), 2),
              fixed(c.last(), 2),
              percent(c.impliedVolatility()),
              c.openInterest() == null ? "" : c.openInterest().toString(),
              c.volume() == null ? "" : c.volume().toString()));
    }
    return header + "\n" + textTable.render(HEADERS, rows, NUMERIC_COLUMNS);
  }

  /** Sorted ascending by strike, then clamped to {@code [pivot-5, pivot+5]}. */
  public List<OptionContract> select(List<OptionContract> contracts, BigDecimal underlying) {
    List<OptionContract> sorted = sortByStrike(contracts);
    if (sorted.isEmpty()) {
      return sorted;
    }
    int pivot = pivotIndex(sorted, underlying);
    int from = Math.max(0, pivot - HALF_WINDOW);
    int to = Math.min(sorted.size() - 1, pivot + HALF_WINDOW);
    return List.copyOf(sorted.subList(from, to + 1));
  }

  static List<OptionContract> sortByStrike(List<OptionContract> contracts) {
    List<OptionContract> sorted = new ArrayList<>();
    for (OptionContract c : contracts) {
      if (c.strike() != null) {
        sorted.add(c);
      }
    }
    sorted.sort(Comparator.comparing(OptionContract::strike));
    return sorted;
  }

  /** Expects {@code sorted} ascending by strike and non-empty. */
  static int pivotIndex(List<OptionContract> sorted, BigDecimal underlying) {
    if (underlying != null) {
      for (int i = 0; i < sorted.size(); i++) {
        if (sorted.get(i).strike().compareTo(underlying) >= 0) {
          return i;
        }
      }
    }
    return sorted.size() - 1;
  }

  static String fixed(BigDecimal value, int scale) {
    return value == null ? "" : value.setScale(scale, RoundingMode.HALF_UP).toPlainString();
  }

  static String percent(BigDecimal fraction) {
    if (fraction == null) {
      return "";
    }
    return fraction.movePointRight(2).setScale(1, RoundingMode.HALF_UP).toPlainString() + "%";
  }
}
