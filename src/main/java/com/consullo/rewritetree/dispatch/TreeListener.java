package com.consullo.rewritetree.dispatch;

import com.consullo.rewritetree.core.RewriteTree;

/**
 * Listener notified when the dispatcher finishes building a tree.
 *
 * @since 1.0
 */
public interface TreeListener {

  /**
   * Called on the dispatcher thread once a tree is complete. The tree's structure
   * is final from this point; only its layout state may change.
   *
   * @param tree finished tree
   */
  void onTreeFinished(RewriteTree tree);
}
