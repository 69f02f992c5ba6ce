package com.consullo.rewritetree.builder.commands;

import com.consullo.rewritetree.builder.TermPayload;
import org.apache.commons.lang3.Validate;

/**
 * One tree-construction command sent by the rewriting engine.
 *
 * <p>
 * Each {@link Type} has its own factory that checks the argument shape, so a
 * command that exists is well formed. For additions a null parent id means
 * "the current subroot".
 * </p>
 */
public final class TreeCommand {

  public enum Type {
    NEW_TREE,
    FINISH_TREE,
    PUSH_SCOPE,
    POP_SCOPE,
    SET_SUBROOT,
    ADD_CHILD,
    REMOVE_LAST_CHILD,
    SAVE_NODE_COUNT,
    RESTORE_NODE_COUNT,
    TOGGLE_IGNORE,
    IGNORE_NEXT_TREE
  }

  private static final TreeCommand FINISH = new TreeCommand(Type.FINISH_TREE, null, null, null, false, null, false);
  private static final TreeCommand PUSH = new TreeCommand(Type.PUSH_SCOPE, null, null, null, false, null, false);
  private static final TreeCommand POP = new TreeCommand(Type.POP_SCOPE, null, null, null, false, null, false);
  private static final TreeCommand SAVE = new TreeCommand(Type.SAVE_NODE_COUNT, null, null, null, false, null, false);
  private static final TreeCommand IGNORE_NEXT =
      new TreeCommand(Type.IGNORE_NEXT_TREE, null, null, null, false, null, false);

  private final Type type;
  private final String targetId;
  private final String newId;
  private final String label;
  private final boolean comment;
  private final TermPayload payload;
  private final boolean flag;

  private TreeCommand(Type type, String targetId, String newId, String label, boolean comment, TermPayload payload,
      boolean flag) {
    this.type = type;
    this.targetId = targetId;
    this.newId = newId;
    this.label = label;
    this.comment = comment;
    this.payload = payload;
    this.flag = flag;
  }

  public static TreeCommand newTree(String rootLabel) {
    Validate.notNull(rootLabel, "rootLabel must not be null.");
    return new TreeCommand(Type.NEW_TREE, null, null, rootLabel, true, null, false);
  }

  public static TreeCommand finishTree() {
    return FINISH;
  }

  public static TreeCommand pushScope() {
    return PUSH;
  }

  public static TreeCommand popScope() {
    return POP;
  }

  public static TreeCommand setSubroot(String id) {
    Validate.notNull(id, "id must not be null.");
    return new TreeCommand(Type.SET_SUBROOT, id, null, null, false, null, false);
  }

  /**
   * Adds a plain node.
   *
   * @param parentId parent scope id, or null for the current subroot
   * @param newId id for the new node, or empty
   * @param label node label
   * @param comment true for documentation-only nodes
   * @return command
   */
  public static TreeCommand addChild(String parentId, String newId, String label, boolean comment) {
    Validate.notNull(label, "label must not be null.");
    return new TreeCommand(Type.ADD_CHILD, parentId, newId, label, comment, null, false);
  }

  /**
   * Adds a payload node for a rewritten term.
   *
   * @param parentId parent scope id, or null for the current subroot
   * @param newId id for the new node, or empty
   * @param term term display data
   * @return command
   */
  public static TreeCommand addTerm(String parentId, String newId, TermPayload term) {
    Validate.notNull(term, "term must not be null.");
    return new TreeCommand(Type.ADD_CHILD, parentId, newId, null, false, term, false);
  }

  /**
   * Adds a comment node wrapping a payload node; {@code newId} names the payload.
   *
   * @param parentId parent scope id, or null for the current subroot
   * @param newId id for the payload node, or empty
   * @param comment comment label
   * @param term term display data
   * @return command
   */
  public static TreeCommand addCommentWithTerm(String parentId, String newId, String comment, TermPayload term) {
    Validate.notNull(comment, "comment must not be null.");
    Validate.notNull(term, "term must not be null.");
    return new TreeCommand(Type.ADD_CHILD, parentId, newId, comment, true, term, false);
  }

  public static TreeCommand removeLastChild(String parentId) {
    Validate.notNull(parentId, "parentId must not be null.");
    return new TreeCommand(Type.REMOVE_LAST_CHILD, parentId, null, null, false, null, false);
  }

  public static TreeCommand saveNodeCount() {
    return SAVE;
  }

  /**
   * Pops a node-count checkpoint.
   *
   * @param restore true rolls the count back, false only drops the checkpoint
   * @return command
   */
  public static TreeCommand restoreNodeCount(boolean restore) {
    return new TreeCommand(Type.RESTORE_NODE_COUNT, null, null, null, false, null, restore);
  }

  public static TreeCommand toggleIgnore(boolean ignore) {
    return new TreeCommand(Type.TOGGLE_IGNORE, null, null, null, false, null, ignore);
  }

  /**
   * Makes the dispatcher drop the next finished tree instead of publishing it.
   *
   * @return command
   */
  public static TreeCommand ignoreNextTree() {
    return IGNORE_NEXT;
  }

  public Type type() {
    return type;
  }

  /**
   * Scope id the command operates on: the new subroot, the parent of an
   * addition (null for the current subroot) or the parent losing its last child.
   *
   * @return target id
   */
  public String targetId() {
    return targetId;
  }

  public String newId() {
    return newId;
  }

  public String label() {
    return label;
  }

  public boolean comment() {
    return comment;
  }

  public TermPayload payload() {
    return payload;
  }

  public boolean flag() {
    return flag;
  }

  @Override
  public String toString() {
    StringBuilder sb = new StringBuilder(type.name());
    if (targetId != null) {
      sb.append(" target=").append(targetId);
    }
    if (newId != null && !newId.isEmpty()) {
      sb.append(" id=").append(newId);
    }
    if (label != null) {
      sb.append(" label=").append(label);
    }
    if (payload != null) {
      sb.append(" term=").append(payload.label());
    }
    if (type == Type.RESTORE_NODE_COUNT || type == Type.TOGGLE_IGNORE) {
      sb.append(" flag=").append(flag);
    }
    return sb.toString();
  }
}
