package com.consullo.rewritetree.config;

/**
 * What the tree builder does when a producer-supplied id is not bound in the
 * active scope table.
 *
 * @since 1.0
 */
public enum RecoveryPolicy {

  /**
   * Append an explanatory node under the root and stop building the current tree.
   */
  FAIL_FAST,

  /**
   * Pop one scope table (if more than the base table is present) and retry the
   * lookup once. A second miss falls back to {@link #FAIL_FAST}.
   */
  POP_AND_RETRY
}
