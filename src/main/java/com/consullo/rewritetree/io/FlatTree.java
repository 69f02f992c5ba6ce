package com.consullo.rewritetree.io;

import java.util.List;
import java.util.Map;
import org.apache.commons.lang3.Validate;

/**
 * Flat form of a rewrite tree: de-duplicated label and properties dictionaries,
 * the nodes in pre-order and the parent to child edges in child order.
 *
 * <p>
 * Node 0 is the root. An edge refers to nodes by their position in
 * {@link #nodes()}.
 * </p>
 *
 * @param labels label text by key
 * @param properties properties text by key
 * @param nodes nodes in pre-order
 * @param edges parent to child edges, children of one parent in order
 * @since 1.0
 */
public record FlatTree(
    Map<Integer, String> labels,
    Map<Integer, String> properties,
    List<Entry> nodes,
    List<Edge> edges) {

  public FlatTree {
    Validate.notNull(labels, "labels must not be null.");
    Validate.notNull(properties, "properties must not be null.");
    Validate.notEmpty(nodes, "nodes must not be empty.");
    Validate.notNull(edges, "edges must not be null.");
    labels = Map.copyOf(labels);
    properties = Map.copyOf(properties);
    nodes = List.copyOf(nodes);
    edges = List.copyOf(edges);
  }

  public int nodeCount() {
    return nodes.size();
  }

  /**
   * One node of a flat tree.
   *
   * @param labelKey key into {@link FlatTree#labels()}
   * @param propertiesKey key into {@link FlatTree#properties()}
   * @param comment true for documentation-only nodes
   */
  public record Entry(int labelKey, int propertiesKey, boolean comment) {
  }

  /**
   * A parent to child link.
   *
   * @param parent index of the parent node
   * @param child index of the child node
   */
  public record Edge(int parent, int child) {
  }
}
