package com.consullo.rewritetree.core;

import java.util.ArrayList;
import java.util.List;
import org.apache.commons.lang3.StringUtils;

/**
 * {@link LabelMetrics} for a fixed-width font, computed without a graphics
 * context.
 *
 * <p>
 * Labels are split on newlines and hard-wrapped at {@code maxLineLength}
 * columns. At most {@code maxLines} lines are kept; a trailing {@value #ELLIPSIS}
 * line marks truncation.
 * </p>
 */
public final class MonospaceLabelMetrics implements LabelMetrics {

  public static final String ELLIPSIS = "...";

  private static final double CHAR_WIDTH_FACTOR = 0.66;
  private static final double BOX_PADDING = 5.0;
  private static final int LINE_PADDING = 5;

  private final int fontSize;
  private final int maxLineLength;
  private final int maxLines;

  public MonospaceLabelMetrics(int fontSize, int maxLineLength, int maxLines) {
    if (fontSize <= 0 || maxLineLength <= 0 || maxLines <= 0) {
      throw new IllegalArgumentException("fontSize/maxLineLength/maxLines must be positive.");
    }
    this.fontSize = fontSize;
    this.maxLineLength = maxLineLength;
    this.maxLines = maxLines;
  }

  /**
   * Lucida Console 12pt, 50 columns, 9 lines.
   *
   * @return default metrics
   */
  public static MonospaceLabelMetrics defaults() {
    return new MonospaceLabelMetrics(12, 50, 9);
  }

  @Override
  public LabelBox measure(String label) {
    List<String> wrapped = wrap(label == null ? "" : label);

    List<String> lines = new ArrayList<>(Math.min(wrapped.size(), maxLines + 1));
    String longest = "";
    for (String line : wrapped) {
      if (lines.size() >= maxLines) {
        break;
      }
      if (line.length() > longest.length()) {
        longest = line;
      }
      lines.add(line);
    }
    if (wrapped.size() > lines.size()) {
      lines.add(ELLIPSIS);
    }

    double width = longest.length() * fontSize * CHAR_WIDTH_FACTOR + BOX_PADDING;
    double height = lineHeight() * lines.size();
    return new LabelBox(List.copyOf(lines), width, height);
  }

  @Override
  public double lineHeight() {
    return fontSize + LINE_PADDING;
  }

  private List<String> wrap(String label) {
    List<String> out = new ArrayList<>();
    for (String raw : StringUtils.splitPreserveAllTokens(label, '\n')) {
      String line = StringUtils.stripEnd(raw, "\r");
      if (line.isEmpty()) {
        out.add("");
        continue;
      }
      for (int start = 0; start < line.length(); start += maxLineLength) {
        out.add(line.substring(start, Math.min(line.length(), start + maxLineLength)));
      }
    }
    if (out.isEmpty()) {
      out.add("");
    }
    return out;
  }
}
