package com.consullo.rewritetree.demo;

import com.consullo.rewritetree.builder.TermPayload;
import com.consullo.rewritetree.builder.TreeBuilder;
import com.consullo.rewritetree.builder.commands.TreeCommand;
import com.consullo.rewritetree.config.VisualizationConfig;
import com.consullo.rewritetree.config.VisualizationConfigLoader;
import com.consullo.rewritetree.core.RewriteTree;
import com.consullo.rewritetree.core.TreeNode;
import com.consullo.rewritetree.dispatch.TreeCommandDispatcher;
import com.consullo.rewritetree.view.RenderLoop;
import com.consullo.rewritetree.view.TreeVisualizer;
import java.awt.geom.Point2D;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;
import org.apache.commons.lang3.StringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Walkthrough that plays the rewriting engine's part: it streams the build
 * commands for one small rewrite through the dispatcher, waits for the tree to
 * reach the visualizer, then clicks around in it and prints the layout.
 *
 * @since 1.0
 */
public final class RewriteTreeDemo {

  private static final Logger LOGGER = LoggerFactory.getLogger(RewriteTreeDemo.class);

  private RewriteTreeDemo() {
  }

  /**
   * Demo entry point.
   *
   * @param args args
   * @throws Exception if demo fails
   */
  public static void main(final String[] args) throws Exception {
    final VisualizationConfig config = new VisualizationConfigLoader().load();
    final TreeVisualizer visualizer = new TreeVisualizer(config);

    try (final TreeCommandDispatcher dispatcher = new TreeCommandDispatcher(new TreeBuilder(config)).start();
        final RenderLoop renderLoop = new RenderLoop(visualizer,
            tree -> LOGGER.trace("frame: '{}' selected", labelOf(tree.getSelectedNode())), config).start()) {
      dispatcher.addTreeListener(visualizer);

      System.out.println("=== Welcome tree ===");
      print(visualizer.getCurrentTree());

      submitRewrite(dispatcher).get(5, TimeUnit.SECONDS);

      System.out.println("=== Rewrite tree ===");
      RewriteTree tree = visualizer.getCurrentTree();
      print(tree);

      // click on the term, which sits on the depth frontier, to open up its rule
      TreeNode term = tree.getRoot().getChild(0).getChild(0);
      Point2D where = visualizer.getWorldPosition(term);
      TreeNode hit = visualizer.selectAt(new Point2D.Double(where.getX() + 1, where.getY()));
      LOGGER.info("Clicked at {} and selected '{}'", where, labelOf(hit));

      System.out.println("=== After selecting '" + labelOf(hit) + "' ===");
      print(visualizer.getCurrentTree());
      LOGGER.info("Demo completed after {} frames", renderLoop.framesRendered());
    }
  }

  // add(x, 0) rewritten to x through one rule, with a speculative step rolled back
  private static CompletableFuture<Void> submitRewrite(TreeCommandDispatcher dispatcher) {
    dispatcher.submit(TreeCommand.newTree("add(x, 0)"));
    dispatcher.submit(TreeCommand.addCommentWithTerm(null, "term", "Rewriting term:",
        new TermPayload("add(x, 0)", "Class: Apply\nType: INTEGER")));
    dispatcher.submit(TreeCommand.pushScope());
    dispatcher.submit(TreeCommand.setSubroot("term"));
    dispatcher.submit(TreeCommand.addChild(null, "rule", "Trying rule add_zero", true));

    dispatcher.submit(TreeCommand.saveNodeCount());
    dispatcher.submit(TreeCommand.addChild("rule", "", "Trying rule add_comm", true));
    dispatcher.submit(TreeCommand.removeLastChild("rule"));
    dispatcher.submit(TreeCommand.restoreNodeCount(true));

    dispatcher.submit(TreeCommand.addTerm("rule", "result", new TermPayload("x", "Class: Variable")));
    dispatcher.submit(TreeCommand.popScope());
    dispatcher.submit("addToSubroot", new Object[] {"", "Rewrite complete."});
    return dispatcher.submit(TreeCommand.finishTree());
  }

  private static void print(RewriteTree tree) {
    print(tree, tree.getRoot(), 0);
  }

  private static void print(RewriteTree tree, TreeNode node, int depth) {
    Point2D pos = tree.getWorldPosition(node);
    System.out.printf("%s%s%s  (%.1f, %.1f)%n",
        StringUtils.repeat("  ", depth),
        node.isCompressed() ? "+ " : "- ",
        StringUtils.replace(node.getLabel(), "\n", " / "),
        pos.getX(), pos.getY());
    if (node.isCompressed()) {
      return;
    }
    for (TreeNode child : node.getChildren()) {
      print(tree, child, depth + 1);
    }
  }

  private static String labelOf(TreeNode node) {
    return node == null ? "<none>" : node.getLabel();
  }
}
