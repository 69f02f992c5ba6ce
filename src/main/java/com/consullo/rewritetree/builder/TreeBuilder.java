package com.consullo.rewritetree.builder;

import com.consullo.rewritetree.config.RecoveryPolicy;
import com.consullo.rewritetree.config.VisualizationConfig;
import com.consullo.rewritetree.core.LabelMetrics;
import com.consullo.rewritetree.core.MonospaceLabelMetrics;
import com.consullo.rewritetree.core.RewriteTree;
import com.consullo.rewritetree.core.TreeNode;
import java.util.ArrayDeque;
import java.util.Deque;
import org.apache.commons.lang3.StringUtils;
import org.apache.commons.lang3.Validate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Incrementally builds one rewrite tree at a time from producer commands.
 *
 * <p>
 * The builder keeps:
 * <ul>
 * <li>the root of the tree under construction and the current subroot
 * (insertion cursor)</li>
 * <li>a {@link ScopeTableStack} resolving producer ids to nodes</li>
 * <li>a node counter with save/restore checkpoints, checked against the node
 * limit</li>
 * <li>a fatal flag and an ignore flag</li>
 * </ul>
 * </p>
 *
 * <p>
 * Producer mistakes never throw out of this class. A lookup miss or a node-limit
 * hit appends an explanatory comment node and sets the fatal flag, after which
 * every mutation is dropped until the next {@link #newTree(String)}. Commands
 * that arrive while ignoring, or with no tree in progress, are dropped.
 * </p>
 *
 * <p>
 * Not thread-safe. All calls must come from one thread, normally the
 * dispatcher's.
 * </p>
 */
public final class TreeBuilder {

  private static final Logger LOGGER = LoggerFactory.getLogger(TreeBuilder.class);

  static final String LOOKUP_FAILURE_MESSAGE =
      "Fatal error during tree construction: node id \"%s\" is not bound in the current scope. "
      + "Halting further tree construction.";
  static final String NODE_LIMIT_MESSAGE =
      "Tree node limit %d has been reached! Halting further tree construction.";

  private final ScopeTableStack scopes = new ScopeTableStack();
  private final Deque<Integer> savedNodeCounts = new ArrayDeque<>();

  private final LabelMetrics metrics;
  private final int nodeLimit;
  private final int maxScopeDepth;
  private final RecoveryPolicy recoveryPolicy;

  private TreeNode root;
  private TreeNode subroot;
  private int nodeCount;
  private boolean fatalError;
  private boolean ignoreCommands;

  public TreeBuilder(VisualizationConfig config) {
    this(config, MonospaceLabelMetrics.defaults());
  }

  public TreeBuilder(VisualizationConfig config, LabelMetrics metrics) {
    Validate.notNull(config, "config must not be null.");
    Validate.notNull(metrics, "metrics must not be null.");
    this.metrics = metrics;
    this.nodeLimit = config.nodeLimit();
    this.maxScopeDepth = config.maxScopeDepth();
    this.recoveryPolicy = config.recoveryPolicy();
  }

  /**
   * Discards any tree in progress and starts a new one whose root is a comment
   * node labeled {@code rootLabel}.
   *
   * @param rootLabel root label
   */
  public void newTree(String rootLabel) {
    clear();
    root = TreeNode.root(rootLabel == null ? "" : rootLabel);
    subroot = root;
    scopes.push(root, subroot);
    nodeCount = 1;
    LOGGER.debug("newTree: started '{}'", root.getLabel());
  }

  /**
   * Hands the tree under construction over as a layout-ready {@link RewriteTree}
   * and resets the builder.
   *
   * @return finished tree
   * @throws IllegalStateException if no tree is in progress
   */
  public RewriteTree finishTree() {
    Validate.validState(root != null, "finishTree called with no tree in progress.");
    RewriteTree tree = new RewriteTree(root, metrics);
    LOGGER.debug("finishTree: '{}' finished with {} nodes (fatal={})", root.getLabel(), nodeCount, fatalError);
    clear();
    return tree;
  }

  private void clear() {
    root = null;
    subroot = null;
    scopes.clear();
    savedNodeCounts.clear();
    nodeCount = 0;
    fatalError = false;
    ignoreCommands = false;
  }

  /**
   * Enters a nested computation context. The new scope table starts with the
   * current root and subroot bound.
   */
  public void pushScope() {
    if (isHalted("pushScope")) {
      return;
    }
    scopes.push(root, subroot);
  }

  /**
   * Leaves the current computation context, restoring the subroot that was
   * active when it was entered. The base scope is never popped.
   */
  public void popScope() {
    if (isHalted("popScope")) {
      return;
    }
    TreeNode restored = scopes.pop();
    if (restored != null) {
      subroot = restored;
    }
  }

  /**
   * Moves the insertion cursor to the node bound to {@code id}.
   *
   * @param id scope id
   */
  public void setSubroot(String id) {
    if (isHalted("setSubroot") || isMaxDepth()) {
      return;
    }
    TreeNode node = resolveOrRecover(id, "setSubroot");
    if (node != null) {
      subroot = node;
    }
  }

  /**
   * Appends a node under a parent.
   *
   * @param parentId scope id of the parent, or null for the current subroot
   * @param newId id to bind the new node to; null or empty binds nothing
   * @param label node label
   * @param comment true for a documentation-only node
   * @return the new node, or null if the command was dropped
   */
  public TreeNode addChild(String parentId, String newId, String label, boolean comment) {
    return add(parentId, newId, label, comment, "", null);
  }

  /**
   * Appends a payload node describing a rewritten term.
   *
   * @param parentId scope id of the parent, or null for the current subroot
   * @param newId id to bind the new node to; null or empty binds nothing
   * @param term term display data
   * @return the new node, or null if the command was dropped
   */
  public TreeNode addTerm(String parentId, String newId, TermPayload term) {
    Validate.notNull(term, "term must not be null.");
    return add(parentId, newId, term.label(), false, term.properties(), null);
  }

  /**
   * Appends a comment node with a single payload child. {@code newId} is bound
   * to the payload node.
   *
   * @param parentId scope id of the parent, or null for the current subroot
   * @param newId id to bind the payload node to; null or empty binds nothing
   * @param comment comment label
   * @param term term display data
   * @return the payload node, or null if the command was dropped
   */
  public TreeNode addCommentWithTerm(String parentId, String newId, String comment, TermPayload term) {
    Validate.notNull(term, "term must not be null.");
    return add(parentId, newId, comment, true, "", term);
  }

  private TreeNode add(String parentId, String newId, String label, boolean comment, String properties,
      TermPayload wrapped) {
    if (isHalted("addChild") || isMaxDepth()) {
      return null;
    }

    TreeNode parent = parentId == null ? subroot : resolveOrRecover(parentId, "addChild");
    if (parent == null) {
      return null;
    }

    TreeNode node = createNode(parent, label, comment, properties);
    if (wrapped != null) {
      if (fatalError) {
        return null;
      }
      node = createNode(node, wrapped.label(), false, wrapped.properties());
    }
    if (StringUtils.isNotEmpty(newId) && !fatalError) {
      scopes.bind(newId, node);
    }
    return node;
  }

  /**
   * Removes the last child of the node bound to {@code parentId}. The node
   * count is left alone; pair this with {@link #restoreNodeCount(boolean)}.
   *
   * @param parentId scope id of the parent
   * @return true if a child was removed
   */
  public boolean removeLastChild(String parentId) {
    if (isHalted("removeLastChild")) {
      return false;
    }
    TreeNode parent = resolveOrRecover(parentId, "removeLastChild");
    return parent != null && parent.removeLastChild();
  }

  /**
   * Pushes a checkpoint of the current node count.
   */
  public void saveNodeCount() {
    if (isHalted("saveNodeCount")) {
      return;
    }
    savedNodeCounts.push(nodeCount);
  }

  /**
   * Pops the latest node-count checkpoint.
   *
   * @param restore true to roll the count back to the checkpoint (subtree
   * discarded), false to just drop the checkpoint (subtree kept)
   */
  public void restoreNodeCount(boolean restore) {
    if (isHalted("restoreNodeCount")) {
      return;
    }
    if (savedNodeCounts.isEmpty()) {
      LOGGER.warn("restoreNodeCount: no saved node count to restore");
      return;
    }
    int saved = savedNodeCounts.pop();
    if (restore) {
      nodeCount = saved;
    }
  }

  /**
   * While set, all mutation commands except new/finish tree are dropped.
   *
   * @param flag new ignore state
   */
  public void toggleIgnore(boolean flag) {
    if (fatalError) {
      return;
    }
    ignoreCommands = flag;
  }

  public TreeNode getRoot() {
    return root;
  }

  public TreeNode getSubroot() {
    return subroot;
  }

  public int getNodeCount() {
    return nodeCount;
  }

  public boolean isFatalError() {
    return fatalError;
  }

  public boolean isIgnoringCommands() {
    return ignoreCommands;
  }

  public boolean isBuilding() {
    return root != null;
  }

  public int scopeDepth() {
    return scopes.depth();
  }

  /**
   * Resolves {@code id} in the active scope without any recovery side effects.
   *
   * @param id scope id
   * @return bound node or null
   */
  public TreeNode lookup(String id) {
    return scopes.resolve(id);
  }

  private TreeNode createNode(TreeNode parent, String label, boolean comment, String properties) {
    TreeNode node = TreeNode.appendTo(parent, label == null ? "" : label, comment, properties);
    nodeCount++;
    enforceNodeLimit();
    return node;
  }

  private void enforceNodeLimit() {
    if (nodeLimit <= 1 || nodeCount < nodeLimit) {
      return;
    }
    String message = String.format(NODE_LIMIT_MESSAGE, nodeLimit);
    LOGGER.error("Halting tree construction: node limit {} reached", nodeLimit);
    TreeNode.appendTo(root, message, true, "");
    TreeNode.appendTo(subroot, message, true, "");
    fatalError = true;
  }

  private TreeNode resolveOrRecover(String id, String operation) {
    TreeNode node = scopes.resolve(id);
    if (node != null) {
      return node;
    }
    LOGGER.warn("{}: id \"{}\" does not exist in the current scope table", operation, id);

    if (recoveryPolicy == RecoveryPolicy.POP_AND_RETRY && scopes.depth() > 1) {
      popScope();
      node = scopes.resolve(id);
      if (node != null) {
        LOGGER.info("{}: recovered id \"{}\" after popping one scope", operation, id);
        return node;
      }
      LOGGER.warn("{}: id \"{}\" still unbound after popping one scope", operation, id);
    }

    LOGGER.error("Halting tree construction: unresolvable id \"{}\" in {}", id, operation);
    TreeNode.appendTo(root, String.format(LOOKUP_FAILURE_MESSAGE, id), true, "");
    fatalError = true;
    return null;
  }

  private boolean isHalted(String operation) {
    if (root == null) {
      LOGGER.warn("{}: no tree in progress, command dropped", operation);
      return true;
    }
    if (fatalError || ignoreCommands) {
      LOGGER.debug("{}: dropped (fatal={}, ignoring={})", operation, fatalError, ignoreCommands);
      return true;
    }
    return false;
  }

  private boolean isMaxDepth() {
    return maxScopeDepth >= 0 && scopes.depth() >= maxScopeDepth;
  }
}
