package com.consullo.rewritetree.core;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import org.apache.commons.lang3.Validate;

/**
 * A single labeled vertex of a rewrite tree.
 *
 * <p>
 * A node exclusively owns its ordered children. The parent reference is a
 * non-owning back reference; the root has none. A node is either a comment (a
 * documentation-only label) or a payload node standing for a rewritten term.
 * </p>
 *
 * <p>
 * The layout fields ({@code numLeaves}, {@code offsetY}, world position,
 * subtree bounds) are only meaningful right after a layout pass of the owning
 * {@code RewriteTree} and go stale on any later structural change or
 * re-selection.
 * </p>
 *
 * @since 1.0
 */
public final class TreeNode {

  private final String label;
  private final TreeNode parent;
  private final boolean comment;
  private String properties;

  private final List<TreeNode> children = new ArrayList<>();
  private int index;

  // decompression + animation state
  private boolean compressed;
  private double expansion;
  private boolean selected;

  // layout state
  private int numLeaves;
  private double offsetY;
  private double worldX;
  private double worldY;
  private double subtreeUpperY;
  private double subtreeLowerY;

  // label box, filled in lazily by the layout engine
  private boolean measured;
  private double boxWidth;
  private double boxHeight;

  private TreeNode(String label, TreeNode parent, boolean comment, String properties) {
    this.label = label;
    this.parent = parent;
    this.comment = comment;
    this.properties = properties;
    // A root starts expanded. Everything else starts compressed so a compressed
    // node never has an expanded descendant.
    this.compressed = parent != null;
    this.expansion = parent == null ? 1.0 : 0.0;
  }

  /**
   * Creates a parentless root node. Roots are always comments.
   *
   * @param label root label
   * @return root node
   */
  public static TreeNode root(String label) {
    Validate.notNull(label, "label must not be null.");
    return new TreeNode(label, null, true, "");
  }

  /**
   * Creates a node and appends it as the last child of {@code parent}.
   *
   * @param parent owning parent
   * @param label node label
   * @param comment true for documentation-only nodes
   * @param properties descriptive text, may be empty
   * @return the new child
   */
  public static TreeNode appendTo(TreeNode parent, String label, boolean comment, String properties) {
    Validate.notNull(parent, "parent must not be null.");
    Validate.notNull(label, "label must not be null.");
    TreeNode node = new TreeNode(label, parent, comment, properties == null ? "" : properties);
    parent.addChild(node);
    return node;
  }

  /**
   * Convenience for building comment nodes by hand (placeholder trees, tests).
   *
   * @param label comment label
   * @return the new child
   */
  public TreeNode makeChild(String label) {
    return appendTo(this, label, true, "");
  }

  private void addChild(TreeNode node) {
    node.index = children.size();
    children.add(node);
  }

  /**
   * Removes this node's last child.
   *
   * @return true if a child was removed
   */
  public boolean removeLastChild() {
    if (children.isEmpty()) {
      return false;
    }
    children.remove(children.size() - 1);
    return true;
  }

  public String getLabel() {
    return label;
  }

  public TreeNode getParent() {
    return parent;
  }

  public boolean isRoot() {
    return parent == null;
  }

  public boolean isComment() {
    return comment;
  }

  public String getProperties() {
    return properties;
  }

  public void setProperties(String properties) {
    this.properties = properties == null ? "" : properties;
  }

  /**
   * Returns the children in insertion order.
   *
   * @return unmodifiable view of the children
   */
  public List<TreeNode> getChildren() {
    return Collections.unmodifiableList(children);
  }

  public TreeNode getChild(int i) {
    return children.get(i);
  }

  public int childCount() {
    return children.size();
  }

  public int getIndex() {
    return index;
  }

  public boolean isCompressed() {
    return compressed;
  }

  public void setCompressed(boolean compressed) {
    this.compressed = compressed;
  }

  public double getExpansion() {
    return expansion;
  }

  public void setExpansion(double expansion) {
    this.expansion = Math.max(0.0, Math.min(1.0, expansion));
  }

  public boolean isSelected() {
    return selected;
  }

  public void setSelected(boolean selected) {
    this.selected = selected;
  }

  public int getNumLeaves() {
    return numLeaves;
  }

  public void setNumLeaves(int numLeaves) {
    this.numLeaves = numLeaves;
  }

  public double getOffsetY() {
    return offsetY;
  }

  public void setOffsetY(double offsetY) {
    this.offsetY = offsetY;
  }

  public double getWorldX() {
    return worldX;
  }

  public double getWorldY() {
    return worldY;
  }

  public void setWorldPosition(double x, double y) {
    this.worldX = x;
    this.worldY = y;
  }

  public double getSubtreeUpperY() {
    return subtreeUpperY;
  }

  public double getSubtreeLowerY() {
    return subtreeLowerY;
  }

  public void setSubtreeBounds(double upperY, double lowerY) {
    this.subtreeUpperY = upperY;
    this.subtreeLowerY = lowerY;
  }

  public boolean isMeasured() {
    return measured;
  }

  public double getBoxWidth() {
    return boxWidth;
  }

  public double getBoxHeight() {
    return boxHeight;
  }

  /**
   * Records the rendered size of this node's label box.
   *
   * @param width box width
   * @param height box height
   */
  public void setBox(double width, double height) {
    this.boxWidth = width;
    this.boxHeight = height;
    this.measured = true;
  }

  @Override
  public String toString() {
    return "TreeNode[" + label + ", children=" + children.size() + "]";
  }
}
