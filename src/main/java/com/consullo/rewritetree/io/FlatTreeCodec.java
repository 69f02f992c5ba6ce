package com.consullo.rewritetree.io;

import com.consullo.rewritetree.core.LabelMetrics;
import com.consullo.rewritetree.core.MonospaceLabelMetrics;
import com.consullo.rewritetree.core.RewriteTree;
import com.consullo.rewritetree.core.TreeNode;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import org.apache.commons.lang3.Validate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Converts between {@link RewriteTree} and {@link FlatTree}.
 *
 * <p>
 * Labels and properties are de-duplicated: equal strings share a key, and the
 * root's label and properties always get key 0. Only structure and text are
 * carried over; a decoded tree starts with fresh layout state.
 * </p>
 */
public final class FlatTreeCodec {

  private static final Logger LOGGER = LoggerFactory.getLogger(FlatTreeCodec.class);

  private FlatTreeCodec() {
  }

  /**
   * Flattens a tree.
   *
   * @param tree tree to flatten
   * @return flat form
   */
  public static FlatTree encode(RewriteTree tree) {
    Validate.notNull(tree, "tree must not be null.");

    Dictionary labels = new Dictionary();
    Dictionary properties = new Dictionary();
    List<FlatTree.Entry> nodes = new ArrayList<>();
    List<FlatTree.Edge> edges = new ArrayList<>();

    // pre-order walk; each stack frame is (node, index of its parent entry)
    Deque<TreeNode> pending = new ArrayDeque<>();
    Deque<Integer> parents = new ArrayDeque<>();
    pending.push(tree.getRoot());
    parents.push(-1);
    while (!pending.isEmpty()) {
      TreeNode node = pending.pop();
      int parent = parents.pop();
      int index = nodes.size();
      nodes.add(new FlatTree.Entry(labels.keyOf(node.getLabel()), properties.keyOf(node.getProperties()),
          node.isComment()));
      if (parent >= 0) {
        edges.add(new FlatTree.Edge(parent, index));
      }
      List<TreeNode> children = node.getChildren();
      for (int i = children.size() - 1; i >= 0; i--) {
        pending.push(children.get(i));
        parents.push(index);
      }
    }

    LOGGER.debug("encode: {} nodes, {} distinct labels, {} distinct properties",
        nodes.size(), labels.size(), properties.size());
    return new FlatTree(labels.byKey(), properties.byKey(), nodes, edges);
  }

  public static RewriteTree decode(FlatTree flat) {
    return decode(flat, MonospaceLabelMetrics.defaults());
  }

  /**
   * Rebuilds a tree from its flat form.
   *
   * @param flat flat form
   * @param metrics label metrics for the rebuilt tree
   * @return rebuilt tree, not yet laid out
   * @throws IllegalArgumentException if a key or edge does not resolve, or the
   * edges do not form a tree rooted at node 0
   */
  public static RewriteTree decode(FlatTree flat, LabelMetrics metrics) {
    Validate.notNull(flat, "flat must not be null.");

    List<FlatTree.Entry> entries = flat.nodes();
    TreeNode[] built = new TreeNode[entries.size()];

    FlatTree.Entry rootEntry = entries.get(0);
    built[0] = TreeNode.root(text(flat.labels(), rootEntry.labelKey(), "label"));
    built[0].setProperties(text(flat.properties(), rootEntry.propertiesKey(), "properties"));

    for (FlatTree.Edge edge : flat.edges()) {
      int parent = edge.parent();
      int child = edge.child();
      Validate.isTrue(parent >= 0 && parent < built.length && built[parent] != null,
          "edge %s: parent not yet decoded", edge);
      Validate.isTrue(child > 0 && child < built.length && built[child] == null,
          "edge %s: child out of range or already attached", edge);
      FlatTree.Entry entry = entries.get(child);
      built[child] = TreeNode.appendTo(built[parent],
          text(flat.labels(), entry.labelKey(), "label"),
          entry.comment(),
          text(flat.properties(), entry.propertiesKey(), "properties"));
    }

    for (int i = 1; i < built.length; i++) {
      Validate.isTrue(built[i] != null, "node %d is not reachable from the root", i);
    }
    return new RewriteTree(built[0], metrics);
  }

  private static String text(Map<Integer, String> dictionary, int key, String what) {
    String value = dictionary.get(key);
    Validate.isTrue(value != null, "unknown %s key %d", what, key);
    return value;
  }

  private static final class Dictionary {
    private final Map<String, Integer> keys = new HashMap<>();

    int keyOf(String text) {
      return keys.computeIfAbsent(text, t -> keys.size());
    }

    int size() {
      return keys.size();
    }

    Map<Integer, String> byKey() {
      Map<Integer, String> result = new HashMap<>();
      keys.forEach((text, key) -> result.put(key, text));
      return result;
    }
  }
}
