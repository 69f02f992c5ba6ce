package com.consullo.rewritetree.core;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

public class TreeNodeTest {

  @Test
  @DisplayName("Should start the root expanded and new children compressed")
  void newNodes_InitialDecompressionState() {
    final TreeNode root = TreeNode.root("root");
    final TreeNode child = TreeNode.appendTo(root, "f(x)", false, "Class: Apply");

    assertThat(root.isRoot()).isTrue();
    assertThat(root.isComment()).isTrue();
    assertThat(root.isCompressed()).isFalse();
    assertThat(root.getExpansion()).isEqualTo(1.0);

    assertThat(child.getParent()).isSameAs(root);
    assertThat(child.isComment()).isFalse();
    assertThat(child.getProperties()).isEqualTo("Class: Apply");
    assertThat(child.isCompressed()).isTrue();
    assertThat(child.getExpansion()).isEqualTo(0.0);
  }

  @Test
  @DisplayName("Should index children by position and drop only the last one")
  void removeLastChild_KeepsEarlierIndexes() {
    final TreeNode root = TreeNode.root("root");
    final TreeNode a = root.makeChild("a");
    root.makeChild("b");

    assertThat(a.getIndex()).isZero();
    assertThat(root.removeLastChild()).isTrue();
    final TreeNode c = root.makeChild("c");

    assertThat(root.getChildren()).containsExactly(a, c);
    assertThat(c.getIndex()).isEqualTo(1);
    assertThat(TreeNode.root("empty").removeLastChild()).isFalse();
  }

  @Test
  @DisplayName("Should expose children read-only and clamp expansion")
  void accessors_GuardState() {
    final TreeNode root = TreeNode.root("root");
    assertThatThrownBy(() -> root.getChildren().add(TreeNode.root("x")))
        .isInstanceOf(UnsupportedOperationException.class);

    root.setExpansion(1.5);
    assertThat(root.getExpansion()).isEqualTo(1.0);
    root.setExpansion(-0.5);
    assertThat(root.getExpansion()).isEqualTo(0.0);
  }
}
