package com.consullo.rewritetree.core;

/**
 * Placeholder trees shown before any rewrite tree has been built.
 */
public final class WelcomeTrees {

  private WelcomeTrees() {
  }

  /**
   * Builds the greeting tree with short usage instructions.
   *
   * @param metrics label metrics for the new tree
   * @return placeholder tree, not yet laid out
   */
  public static RewriteTree build(LabelMetrics metrics) {
    TreeNode root = TreeNode.root("root");
    root.makeChild("Welcome to the ");
    TreeNode title = root.makeChild("Rewrite Tree Visualizer!");
    title.makeChild("To see how a term gets rewritten,");
    TreeNode steps = title.makeChild("do one of the following: ");
    steps.makeChild("Enter a term into the ");
    steps.makeChild("rewriting console.");
    steps.makeChild("OR");
    steps.makeChild("Load a file ");
    steps.makeChild("containing rewriter input.");
    return new RewriteTree(root, metrics);
  }

  public static RewriteTree build() {
    return build(MonospaceLabelMetrics.defaults());
  }
}
