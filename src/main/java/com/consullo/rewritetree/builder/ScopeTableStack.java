package com.consullo.rewritetree.builder;

import com.consullo.rewritetree.core.TreeNode;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.HashMap;
import java.util.Map;
import org.apache.commons.lang3.Validate;

/**
 * Stack of id-to-node tables used to resolve the short-lived identifiers a
 * producer hands out while it builds a subtree.
 *
 * <p>
 * Every table is seeded with {@value #ROOT} and {@value #SUBROOT} bindings when
 * pushed. The bottom table is never popped.
 * </p>
 *
 * <p>
 * This class does not check the builder's ignore/fatal flags; {@link TreeBuilder}
 * does that before delegating here.
 * </p>
 *
 * @since 1.0
 */
public final class ScopeTableStack {

  public static final String ROOT = "root";
  public static final String SUBROOT = "subroot";

  private final Deque<Map<String, TreeNode>> tables = new ArrayDeque<>();

  /**
   * Pushes a new table seeded with the given root and subroot.
   *
   * @param root current tree root
   * @param subroot current insertion cursor
   */
  public void push(TreeNode root, TreeNode subroot) {
    Map<String, TreeNode> table = new HashMap<>();
    table.put(ROOT, root);
    table.put(SUBROOT, subroot);
    tables.push(table);
  }

  /**
   * Pops the active table unless it is the base table.
   *
   * @return the popped table's subroot binding, or null when nothing was popped
   */
  public TreeNode pop() {
    if (tables.size() <= 1) {
      return null;
    }
    Map<String, TreeNode> popped = tables.pop();
    return popped.get(SUBROOT);
  }

  /**
   * Looks up an id in the active table.
   *
   * @param id identifier
   * @return bound node, or null on a miss
   */
  public TreeNode resolve(String id) {
    Map<String, TreeNode> active = tables.peek();
    if (active == null || id == null) {
      return null;
    }
    return active.get(id);
  }

  /**
   * Adds or overwrites a binding in the active table.
   *
   * @param id identifier
   * @param node node to bind
   */
  public void bind(String id, TreeNode node) {
    Validate.validState(!tables.isEmpty(), "no scope table is active.");
    Validate.notNull(id, "id must not be null.");
    tables.peek().put(id, node);
  }

  public int depth() {
    return tables.size();
  }

  public boolean isEmpty() {
    return tables.isEmpty();
  }

  public void clear() {
    tables.clear();
  }
}
