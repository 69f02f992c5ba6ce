package com.consullo.rewritetree.core;

import java.awt.geom.Point2D;
import java.awt.geom.Rectangle2D;
import java.util.ArrayDeque;
import java.util.Deque;
import org.apache.commons.lang3.Validate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * A finished rewrite tree plus its interactive layout state.
 *
 * <p>
 * The structure is fixed once a tree reaches this class. What changes is the
 * decompression state: {@link #selectNode(TreeNode, int)} expands the selected
 * node's ancestors and their neighbourhood out to a given depth, compresses
 * everything beyond that frontier, then recomputes leaf counts, y-offsets,
 * world positions and per-subtree vertical bounds.
 * </p>
 *
 * <p>
 * Layout uses a balanced placement: the expanded children of a node are spread
 * around the parent's y coordinate according to how many leaf slots each one
 * needs. Multi-line labels claim extra slots in proportion to their extra
 * height so that wrapped labels never overlap their siblings.
 * </p>
 *
 * <p>
 * Not thread-safe. Callers sharing a tree between threads must serialize access
 * (see {@code TreeVisualizer}).
 * </p>
 */
public final class RewriteTree {

  private static final Logger LOGGER = LoggerFactory.getLogger(RewriteTree.class);

  /** Base x-offset of a child from its parent. */
  public static final double CHILD_OFFSET_X = 50.0;

  /** Minimum y-distance between two sibling nodes. */
  public static final double SIBLING_SPACING_Y = 40.0;

  /** Extra horizontal room per leaf slot of the parent. */
  private static final double LEAF_SPREAD_X = 5.0;

  private static final double MIN_VISIBLE_EXPANSION = 0.01;
  private static final double EASING_RATE = 0.1;
  private static final double SETTLE_EPSILON = 0.001;

  private final TreeNode root;
  private final LabelMetrics metrics;
  private final double originX;
  private final double originY;

  private TreeNode selectedNode;

  public RewriteTree(TreeNode root) {
    this(root, MonospaceLabelMetrics.defaults());
  }

  public RewriteTree(TreeNode root, LabelMetrics metrics) {
    this(root, metrics, 0.0, 0.0);
  }

  public RewriteTree(TreeNode root, LabelMetrics metrics, double originX, double originY) {
    Validate.notNull(root, "root must not be null.");
    Validate.notNull(metrics, "metrics must not be null.");
    Validate.isTrue(root.isRoot(), "root must not have a parent.");
    this.root = root;
    this.metrics = metrics;
    this.originX = originX;
    this.originY = originY;
  }

  public TreeNode getRoot() {
    return root;
  }

  public TreeNode getSelectedNode() {
    return selectedNode;
  }

  public LabelMetrics getMetrics() {
    return metrics;
  }

  /**
   * Selects {@code node}, decompresses the tree around it to depth {@code n} and
   * recomputes the layout.
   *
   * <p>
   * Walking from the node up to the root, every ancestor is expanded together
   * with its subtree out to depth {@code n}, except the branch just ascended
   * from: that branch was already handled one step earlier in the walk with the
   * same remaining depth. Nodes past the depth frontier are compressed.
   * </p>
   *
   * @param node node to select; null is ignored
   * @param n decompression depth
   */
  public void selectNode(TreeNode node, int n) {
    if (node == null) {
      return;
    }
    Validate.isTrue(belongsToThisTree(node), "node is not part of this tree: %s", node);

    if (selectedNode != null) {
      selectedNode.setSelected(false);
    }
    node.setSelected(true);
    selectedNode = node;

    TreeNode ancestor = node;
    TreeNode skipped = null;
    while (ancestor != null) {
      decompress(ancestor, skipped, n);
      skipped = ancestor;
      ancestor = ancestor.getParent();
    }

    countLeaves(root);
    computeYOffsets(root);
    LOGGER.debug("selectNode: selected '{}' at depth {}, {} leaf slots", node.getLabel(), n, root.getNumLeaves());
  }

  /**
   * Selects whatever node lies under {@code worldPoint}. A miss changes nothing.
   *
   * @param worldPoint point in world coordinates
   * @param n decompression depth
   * @return the selected node, or null on a miss
   */
  public TreeNode selectNodeAt(Point2D worldPoint, int n) {
    TreeNode hit = detectMouseOver(worldPoint);
    selectNode(hit, n);
    return hit;
  }

  private void decompress(TreeNode node, TreeNode skipped, int n) {
    node.setCompressed(false);

    if (n <= 0) {
      compressChildrenOf(node, skipped);
      return;
    }

    if (node.getExpansion() < MIN_VISIBLE_EXPANSION) {
      node.setExpansion(MIN_VISIBLE_EXPANSION);
    }
    for (TreeNode child : node.getChildren()) {
      if (child != skipped) {
        decompress(child, skipped, n - 1);
      }
    }
  }

  /**
   * Compresses every descendant of {@code node} except the {@code skipped}
   * branch. The sweep does not descend below a node that is already compressed:
   * a compressed node never has expanded descendants.
   */
  private void compressChildrenOf(TreeNode node, TreeNode skipped) {
    Deque<TreeNode> stack = new ArrayDeque<>();
    for (TreeNode child : node.getChildren()) {
      if (!child.isCompressed() && child != skipped) {
        stack.push(child);
      }
    }

    while (!stack.isEmpty()) {
      TreeNode child = stack.pop();
      child.setCompressed(true);
      for (TreeNode grandChild : child.getChildren()) {
        if (!grandChild.isCompressed() && grandChild != skipped) {
          stack.push(grandChild);
        }
      }
    }
  }

  /**
   * Counts the leaf slots below {@code node} and stores the result in it.
   *
   * <p>
   * Each expanded child contributes {@code max(1, its own count)}. The total is
   * then raised to at least the number of extra text lines in the node's own
   * label, so a tall label reserves as much vertical room as that many stacked
   * leaves.
   * </p>
   *
   * @param node subtree root
   * @return leaf slots of the subtree
   */
  public int countLeaves(TreeNode node) {
    int leaves = 0;
    for (TreeNode child : node.getChildren()) {
      if (!child.isCompressed()) {
        leaves += Math.max(1, countLeaves(child));
      }
    }

    int lineSlots = (int) Math.round(excessHeight(node) / metrics.lineHeight());
    leaves = Math.max(leaves, lineSlots);
    node.setNumLeaves(leaves);
    return leaves;
  }

  /**
   * Assigns y-offsets and world positions to the expanded descendants of
   * {@code node} and records each subtree's vertical extent.
   *
   * <p>
   * Leaf counts must be current, see {@link #countLeaves(TreeNode)}.
   * </p>
   *
   * @param node subtree root
   * @return vertical bounds of the subtree
   */
  public SubtreeBounds computeYOffsets(TreeNode node) {
    if (node == root) {
      node.setWorldPosition(originX, originY);
    }
    measure(node);

    int nodeLeaves = Math.max(node.getNumLeaves() - 1, 0);
    int lastSiblingLeaves = 0;

    double upper = node.getWorldY() - node.getBoxHeight() / 2;
    double lower = upper + node.getBoxHeight();

    for (TreeNode child : node.getChildren()) {
      if (child.isCompressed()) {
        continue;
      }
      int childLeaves = Math.max(child.getNumLeaves() - 1, 0);
      child.setOffsetY((childLeaves + lastSiblingLeaves - nodeLeaves) * SIBLING_SPACING_Y / 2);
      lastSiblingLeaves += childLeaves * 2;

      Point2D childPos = getChildPosition(node, child.getIndex());
      child.setWorldPosition(
          node.getWorldX() + childPos.getX() + node.getBoxWidth(),
          node.getWorldY() + childPos.getY());

      SubtreeBounds sub = computeYOffsets(child);
      upper = Math.min(upper, sub.upperY());
      lower = Math.max(lower, sub.lowerY());
    }

    node.setSubtreeBounds(upper, lower);
    return new SubtreeBounds(upper, lower);
  }

  /**
   * Position of a child relative to the right edge of its parent's box.
   *
   * @param parent parent node
   * @param index child index
   * @return relative position
   */
  public Point2D getChildPosition(TreeNode parent, int index) {
    TreeNode child = parent.getChild(index);
    measure(parent);
    double childX = longestSiblingWidth(parent) - parent.getBoxWidth() + CHILD_OFFSET_X
        + LEAF_SPREAD_X * parent.getNumLeaves();
    double childY = SIBLING_SPACING_Y * index + child.getOffsetY();
    return new Point2D.Double(childX, childY);
  }

  /**
   * Finds the expanded node whose box contains {@code worldPoint}.
   *
   * <p>
   * A child subtree is only searched when the point's y lies inside that
   * child's recorded subtree bounds, so the search follows a single path in the
   * common case.
   * </p>
   *
   * @param worldPoint point in world coordinates
   * @return node under the point, or null
   */
  public TreeNode detectMouseOver(Point2D worldPoint) {
    if (worldPoint == null) {
      return null;
    }
    return detectMouseOver(worldPoint, root);
  }

  private TreeNode detectMouseOver(Point2D p, TreeNode node) {
    if (getCollisionBox(node).contains(p.getX(), p.getY())) {
      return node;
    }
    for (TreeNode child : node.getChildren()) {
      if (!child.isCompressed() && p.getY() >= child.getSubtreeUpperY() && p.getY() <= child.getSubtreeLowerY()) {
        TreeNode hit = detectMouseOver(p, child);
        if (hit != null) {
          return hit;
        }
      }
    }
    return null;
  }

  /**
   * Returns the node's box in world coordinates. The box is vertically centered
   * on the node's world position.
   *
   * @param node node
   * @return collision box
   */
  public Rectangle2D getCollisionBox(TreeNode node) {
    measure(node);
    return new Rectangle2D.Double(
        node.getWorldX(),
        node.getWorldY() - node.getBoxHeight() / 2,
        node.getBoxWidth(),
        node.getBoxHeight());
  }

  public Point2D getWorldPosition(TreeNode node) {
    return new Point2D.Double(node.getWorldX(), node.getWorldY());
  }

  public SubtreeBounds getSubtreeBounds(TreeNode node) {
    return new SubtreeBounds(node.getSubtreeUpperY(), node.getSubtreeLowerY());
  }

  /**
   * Advances the expand/collapse animation by one tick.
   *
   * <p>
   * Every child of a drawn node eases a tenth of the way toward 1 (expanded)
   * or 0 (compressed). A node counts as drawn while its expansion is above
   * {@value #MIN_VISIBLE_EXPANSION}; the root always is.
   * </p>
   *
   * @return true while some node is still moving
   */
  public boolean animate() {
    return animateChildren(root);
  }

  private boolean animateChildren(TreeNode node) {
    boolean moving = false;
    for (TreeNode child : node.getChildren()) {
      double target = child.isCompressed() ? 0.0 : 1.0;
      double next = child.getExpansion() + (target - child.getExpansion()) * EASING_RATE;
      if (Math.abs(target - next) < SETTLE_EPSILON) {
        next = target;
      } else {
        moving = true;
      }
      child.setExpansion(next);

      if (child.getExpansion() > MIN_VISIBLE_EXPANSION) {
        moving |= animateChildren(child);
      }
    }
    return moving;
  }

  private double excessHeight(TreeNode node) {
    measure(node);
    return node.getBoxHeight() - metrics.lineHeight();
  }

  private double longestSiblingWidth(TreeNode node) {
    TreeNode parent = node.getParent();
    if (parent == null) {
      return node.getBoxWidth();
    }
    double longest = 0.0;
    for (TreeNode sibling : parent.getChildren()) {
      measure(sibling);
      longest = Math.max(longest, sibling.getBoxWidth());
    }
    return longest;
  }

  private void measure(TreeNode node) {
    if (!node.isMeasured()) {
      LabelBox box = metrics.measure(node.getLabel());
      node.setBox(box.width(), box.height());
    }
  }

  private boolean belongsToThisTree(TreeNode node) {
    TreeNode cur = node;
    while (cur.getParent() != null) {
      cur = cur.getParent();
    }
    return cur == root;
  }
}
