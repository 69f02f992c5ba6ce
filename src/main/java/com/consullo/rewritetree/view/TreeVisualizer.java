package com.consullo.rewritetree.view;

import com.consullo.rewritetree.config.VisualizationConfig;
import com.consullo.rewritetree.core.LabelMetrics;
import com.consullo.rewritetree.core.MonospaceLabelMetrics;
import com.consullo.rewritetree.core.RewriteTree;
import com.consullo.rewritetree.core.SubtreeBounds;
import com.consullo.rewritetree.core.TreeNode;
import com.consullo.rewritetree.core.WelcomeTrees;
import com.consullo.rewritetree.dispatch.TreeListener;
import java.awt.geom.Point2D;
import java.util.ArrayList;
import java.util.List;
import java.util.function.Function;
import org.apache.commons.lang3.Validate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Consumer-side owner of the tree currently on display.
 *
 * <p>
 * Finished trees arrive through {@link #onTreeFinished(RewriteTree)} on the
 * dispatcher thread; selections arrive from UI event handlers; the render loop
 * reads layout through {@link #withTree(Function)}. All three go through one
 * lock, so a selection never interleaves with a frame being drawn. Before the
 * first tree is finished the welcome tree is shown.
 * </p>
 *
 * <p>
 * Every change to the displayed tree or its layout is announced to the
 * registered change hooks (normally {@link RenderLoop#requestFrame()}), outside
 * the lock.
 * </p>
 */
public final class TreeVisualizer implements TreeListener {

  private static final Logger LOGGER = LoggerFactory.getLogger(TreeVisualizer.class);

  private final Object lock = new Object();
  private final List<Runnable> changeHooks = new ArrayList<>();
  private final int decompressionDepth;

  // guarded by lock
  private RewriteTree currentTree;

  public TreeVisualizer(VisualizationConfig config) {
    this(config, MonospaceLabelMetrics.defaults());
  }

  public TreeVisualizer(VisualizationConfig config, LabelMetrics metrics) {
    Validate.notNull(config, "config must not be null.");
    Validate.notNull(metrics, "metrics must not be null.");
    this.decompressionDepth = config.decompressionDepth();
    RewriteTree welcome = WelcomeTrees.build(metrics);
    welcome.selectNode(welcome.getRoot(), decompressionDepth);
    this.currentTree = welcome;
  }

  /**
   * Installs a freshly finished tree, selected at its root.
   *
   * @param tree finished tree
   */
  @Override
  public void onTreeFinished(RewriteTree tree) {
    Validate.notNull(tree, "tree must not be null.");
    synchronized (lock) {
      tree.selectNode(tree.getRoot(), decompressionDepth);
      currentTree = tree;
    }
    LOGGER.info("Displaying tree '{}'", tree.getRoot().getLabel());
    fireChanged();
  }

  /**
   * Latest finished tree, or the welcome tree if none has been finished yet.
   *
   * @return tree on display
   */
  public RewriteTree getCurrentTree() {
    synchronized (lock) {
      return currentTree;
    }
  }

  public int getDecompressionDepth() {
    return decompressionDepth;
  }

  public boolean selectNode(TreeNode node) {
    return selectNode(node, decompressionDepth);
  }

  /**
   * Selects a node of the displayed tree. A node from a tree that has since
   * been replaced (a click racing a tree hand-off) is ignored.
   *
   * @param node node to select
   * @param depth decompression depth
   * @return true if the selection was applied
   */
  public boolean selectNode(TreeNode node, int depth) {
    if (node == null) {
      return false;
    }
    synchronized (lock) {
      if (rootOf(node) != currentTree.getRoot()) {
        LOGGER.debug("selectNode: '{}' is not part of the displayed tree, ignored", node.getLabel());
        return false;
      }
      currentTree.selectNode(node, depth);
    }
    fireChanged();
    return true;
  }

  /**
   * Selects the node under a world-space point.
   *
   * @param worldPoint point in world coordinates
   * @return selected node, or null on a miss
   */
  public TreeNode selectAt(Point2D worldPoint) {
    TreeNode hit;
    synchronized (lock) {
      hit = currentTree.selectNodeAt(worldPoint, decompressionDepth);
    }
    if (hit != null) {
      fireChanged();
    }
    return hit;
  }

  public TreeNode detectMouseOver(Point2D worldPoint) {
    synchronized (lock) {
      return currentTree.detectMouseOver(worldPoint);
    }
  }

  public Point2D getWorldPosition(TreeNode node) {
    Validate.notNull(node, "node must not be null.");
    synchronized (lock) {
      return currentTree.getWorldPosition(node);
    }
  }

  public SubtreeBounds getSubtreeBounds(TreeNode node) {
    Validate.notNull(node, "node must not be null.");
    synchronized (lock) {
      return currentTree.getSubtreeBounds(node);
    }
  }

  /**
   * Runs {@code action} against the displayed tree while holding the lock.
   *
   * @param action work to do
   * @param <T> result type
   * @return the action's result
   */
  public <T> T withTree(Function<RewriteTree, T> action) {
    Validate.notNull(action, "action must not be null.");
    synchronized (lock) {
      return action.apply(currentTree);
    }
  }

  public void addChangeHook(Runnable hook) {
    Validate.notNull(hook, "hook must not be null.");
    synchronized (changeHooks) {
      changeHooks.add(hook);
    }
  }

  public void removeChangeHook(Runnable hook) {
    synchronized (changeHooks) {
      changeHooks.remove(hook);
    }
  }

  private void fireChanged() {
    List<Runnable> copy;
    synchronized (changeHooks) {
      copy = new ArrayList<>(changeHooks);
    }
    for (Runnable hook : copy) {
      try {
        hook.run();
      } catch (RuntimeException e) {
        LOGGER.warn("Change hook failed: {}", e.getMessage(), e);
      }
    }
  }

  private static TreeNode rootOf(TreeNode node) {
    TreeNode cur = node;
    while (cur.getParent() != null) {
      cur = cur.getParent();
    }
    return cur;
  }
}
