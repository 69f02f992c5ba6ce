package com.consullo.rewritetree.io;

import com.consullo.rewritetree.core.RewriteTree;
import com.consullo.rewritetree.core.TreeNode;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Tests for the flat dictionary and edge-list form of a tree.
 */
public class FlatTreeCodecTest {

  private static RewriteTree sampleTree() {
    final TreeNode root = TreeNode.root("add(x, 0)");
    final TreeNode comment = root.makeChild("Rewriting term:");
    final TreeNode term = TreeNode.appendTo(comment, "add(x, 0)", false, "Class: Apply");
    TreeNode.appendTo(term, "x", false, "Class: Variable");
    root.makeChild("Rewriting term:");
    return new RewriteTree(root);
  }

  @Test
  @DisplayName("Should share keys between equal labels and give the root key zero")
  void encode_DuplicateText_SharesKeys() {
    final FlatTree flat = FlatTreeCodec.encode(sampleTree());

    assertThat(flat.labels()).hasSize(3);
    assertThat(flat.labels().get(0)).isEqualTo("add(x, 0)");
    assertThat(flat.properties()).containsEntry(0, "");
    assertThat(flat.properties()).hasSize(3);

    final List<FlatTree.Entry> nodes = flat.nodes();
    assertThat(nodes).hasSize(5);
    // pre-order: root, comment, term, x, second comment
    assertThat(nodes.get(2).labelKey()).isEqualTo(nodes.get(0).labelKey());
    assertThat(nodes.get(4).labelKey()).isEqualTo(nodes.get(1).labelKey());
    assertThat(nodes.get(2).comment()).isFalse();
    assertThat(nodes.get(1).comment()).isTrue();
  }

  @Test
  @DisplayName("Should list parent to child edges in child order")
  void encode_Edges_InChildOrder() {
    final FlatTree flat = FlatTreeCodec.encode(sampleTree());

    assertThat(flat.edges()).containsExactly(
        new FlatTree.Edge(0, 1),
        new FlatTree.Edge(1, 2),
        new FlatTree.Edge(2, 3),
        new FlatTree.Edge(0, 4));
  }

  @Test
  @DisplayName("Should rebuild the same structure and text from the flat form")
  void decode_EncodedTree_SameStructure() {
    final RewriteTree original = sampleTree();

    final RewriteTree decoded = FlatTreeCodec.decode(FlatTreeCodec.encode(original));

    assertSameStructure(decoded.getRoot(), original.getRoot());
    assertThat(decoded.getRoot().getChild(1).isCompressed()).isTrue();
  }

  @Test
  @DisplayName("Should reject unknown keys, orphan edges and unreachable nodes")
  void decode_Inconsistent_Throws() {
    final Map<Integer, String> labels = Map.of(0, "root", 1, "child");
    final Map<Integer, String> props = Map.of(0, "");
    final List<FlatTree.Entry> nodes = List.of(
        new FlatTree.Entry(0, 0, true),
        new FlatTree.Entry(1, 0, true),
        new FlatTree.Entry(1, 0, true));

    assertThatThrownBy(() -> FlatTreeCodec.decode(new FlatTree(labels, props,
        List.of(new FlatTree.Entry(0, 0, true), new FlatTree.Entry(7, 0, true)),
        List.of(new FlatTree.Edge(0, 1)))))
        .isInstanceOf(IllegalArgumentException.class);
    assertThatThrownBy(() -> FlatTreeCodec.decode(new FlatTree(labels, props, nodes,
        List.of(new FlatTree.Edge(2, 1), new FlatTree.Edge(0, 2)))))
        .isInstanceOf(IllegalArgumentException.class);
    assertThatThrownBy(() -> FlatTreeCodec.decode(new FlatTree(labels, props, nodes,
        List.of(new FlatTree.Edge(0, 1)))))
        .isInstanceOf(IllegalArgumentException.class);
  }

  private static void assertSameStructure(TreeNode actual, TreeNode expected) {
    assertThat(actual.getLabel()).isEqualTo(expected.getLabel());
    assertThat(actual.getProperties()).isEqualTo(expected.getProperties());
    assertThat(actual.isComment()).isEqualTo(expected.isComment());
    assertThat(actual.childCount()).isEqualTo(expected.childCount());
    for (int i = 0; i < expected.childCount(); i++) {
      assertSameStructure(actual.getChild(i), expected.getChild(i));
    }
  }
}
