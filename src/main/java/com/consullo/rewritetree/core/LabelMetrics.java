package com.consullo.rewritetree.core;

/**
 * Font-metric seam between the layout engine and whatever renders the tree.
 *
 * <p>The layout engine never touches fonts directly. It asks this interface how
 * large a label box is and how tall one line of text is, which is all the
 * leaf-count and y-offset computations need.
 *
 * @since 1.0
 */
public interface LabelMetrics {

  /**
   * Measures the box a node label occupies once wrapped.
   *
   * @param label raw node label
   * @return measured box, never null
   */
  LabelBox measure(final String label);

  /**
   * Returns the height of a single-line label box. Multi-line boxes reserve extra
   * sibling slots in proportion to how far they exceed this height.
   *
   * @return line height in world units
   */
  double lineHeight();
}
