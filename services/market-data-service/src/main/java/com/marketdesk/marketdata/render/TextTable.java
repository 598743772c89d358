package com.marketdesk.marketdata.render;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/** Monospace table: {@code " | "} between cells, a {@code -+-} rule under the header. */
public class TextTable {

  public String render(List<String> headers, List<List<String>> rows) {
    return render(headers, rows, Set.of());
  }

  /**
   * @param rightAligned zero-based column indexes padded on the left, for numbers
   */
  public String render(List<String> headers, List<List<String>> rows, Set<Integer> rightAligned) {
    List<List<String>> body = rows == null ? List.of() : rows;
    List<List<String>> allRows = new ArrayList<>();
    if (headers != null && !headers.isEmpty()) {
      allRows.add(headers);
    }
    allRows.addAll(body);

    int cols = 0;
    for (List<String> row : allRows) {
      cols = Math.max(cols, row == null ? 0 : row.size());
    }
    int[] widths = new int[cols];
    for (List<String> row : allRows) {
      for (int i = 0; i < cols; i++) {
        widths[i] = Math.max(widths[i], cell(row, i).length());
      }
    }

    List<String> lines = new ArrayList<>();
    if (headers != null && !headers.isEmpty()) {
      lines.add(line(headers, widths, rightAligned));
      lines.add(separator(widths));
    }
    for (List<String> row : body) {
      lines.add(line(row, widths, rightAligned));
    }
    return String.join("\n", lines);
  }

  private static String line(List<String> row, int[] widths, Set<Integer> rightAligned) {
    StringBuilder sb = new StringBuilder();
    for (int i = 0; i < widths.length; i++) {
      if (i > 0) sb.append(" | ");
      String val = cell(row, i);
      sb.append(rightAligned.contains(i) ? padLeft(val, widths[i]) : padRight(val, widths[i]));
    }
    return sb.toString().stripTrailing();
  }

  private static String separator(int[] widths) {
    StringBuilder sb = new StringBuilder();
    for (int i = 0; i < widths.length; i++) {
      if (i > 0) sb.append("-+-");
      sb.append("-".repeat(widths[i]));
    }
    return sb.toString();
  }

  private static String cell(List<String> row, int i) {
    return row != null && i < row.size() && row.get(i) != null ? row.get(i) : "";
  }

  static String padRight(String s, int width) {
    if (s.length() >= width) return s;
    return s + " ".repeat(width - s.length());
  }

  static String padLeft(String s, int width) {
    if (s.length() >= width) return s;
    return " ".repeat(width - s.length()) + s;
  }
}
