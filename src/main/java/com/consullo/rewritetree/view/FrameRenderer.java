package com.consullo.rewritetree.view;

import com.consullo.rewritetree.core.RewriteTree;

/**
 * Rendering back end driven by {@link RenderLoop}.
 *
 * <p>Implementations draw the tree's expanded nodes using the layout state the
 * tree already holds (world positions, expansion). Camera transforms, fonts and
 * rasterization are entirely the implementation's business.
 *
 * @since 1.0
 */
public interface FrameRenderer {

  /**
   * Draws one frame. Called on the render thread while the visualizer's lock is
   * held, so the tree's layout cannot change underneath the call.
   *
   * @param tree tree to draw
   */
  void renderFrame(final RewriteTree tree);
}
