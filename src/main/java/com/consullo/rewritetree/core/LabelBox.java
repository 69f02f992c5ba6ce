package com.consullo.rewritetree.core;

import java.util.List;

/**
 * Measured label box of a node.
 *
 * @param lines label lines as they will be drawn
 * @param width box width in world units
 * @param height box height in world units
 * @since 1.0
 */
public record LabelBox(
    List<String> lines,
    double width,
    double height) {
}
