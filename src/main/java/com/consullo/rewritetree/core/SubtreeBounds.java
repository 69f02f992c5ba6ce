package com.consullo.rewritetree.core;

/**
 * Vertical world-space interval covered by a node and its expanded descendants.
 *
 * @param upperY smallest y covered
 * @param lowerY largest y covered
 * @since 1.0
 */
public record SubtreeBounds(
    double upperY,
    double lowerY) {

  public boolean contains(double y) {
    return y >= upperY && y <= lowerY;
  }
}
