package com.consullo.rewritetree.core;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

public class WelcomeTreesTest {

  @Test
  @DisplayName("Should build the greeting tree with the usage steps under the title")
  void build_GreetingStructure() {
    final RewriteTree tree = WelcomeTrees.build();
    final TreeNode root = tree.getRoot();

    assertThat(root.getLabel()).isEqualTo("root");
    assertThat(root.childCount()).isEqualTo(2);
    final TreeNode title = root.getChild(1);
    assertThat(title.getLabel()).isEqualTo("Rewrite Tree Visualizer!");
    assertThat(title.getChild(1).childCount()).isEqualTo(5);
    assertThat(title.getChild(1).getChild(2).getLabel()).isEqualTo("OR");
  }
}
