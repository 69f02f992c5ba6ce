package com.consullo.rewritetree.view;

import com.consullo.rewritetree.config.RecoveryPolicy;
import com.consullo.rewritetree.config.VisualizationConfig;
import com.consullo.rewritetree.core.RewriteTree;
import com.consullo.rewritetree.core.TreeNode;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.*;

/**
 * Tests for the render thread driven by frame requests.
 */
public class RenderLoopTest {

  private static final VisualizationConfig CONFIG =
      new VisualizationConfig(2, 10_000, -1, RecoveryPolicy.FAIL_FAST, 5L);

  @Test
  @DisplayName("Should draw a first frame on start")
  void start_DrawsInitialFrame() {
    final TreeVisualizer visualizer = new TreeVisualizer(CONFIG);
    final FrameRenderer renderer = mock(FrameRenderer.class);

    try (RenderLoop loop = new RenderLoop(visualizer, renderer, CONFIG).start()) {
      verify(renderer, timeout(2_000).atLeastOnce()).renderFrame(same(visualizer.getCurrentTree()));
      assertThat(loop.framesRendered()).isPositive();
    }
  }

  @Test
  @DisplayName("Should draw a newly finished tree and keep ticking until its animation settles")
  void onTreeFinished_AnimatesNewTree() throws Exception {
    final TreeVisualizer visualizer = new TreeVisualizer(CONFIG);
    final FrameRenderer renderer = mock(FrameRenderer.class);
    final TreeNode root = TreeNode.root("rewrite");
    final TreeNode child = root.makeChild("child");
    final RewriteTree tree = new RewriteTree(root);

    try (RenderLoop loop = new RenderLoop(visualizer, renderer, CONFIG).start()) {
      visualizer.onTreeFinished(tree);

      // easing by a tenth per tick takes dozens of frames to settle
      verify(renderer, timeout(5_000).atLeast(20)).renderFrame(same(tree));
      final long deadline = System.currentTimeMillis() + 5_000;
      while (visualizer.withTree(t -> child.getExpansion()) < 1.0 && System.currentTimeMillis() < deadline) {
        Thread.sleep(10);
      }
      final double expansion = visualizer.withTree(t -> child.getExpansion());
      assertThat(expansion).isEqualTo(1.0);
    }
  }

  @Test
  @DisplayName("Should survive a renderer failure and draw the next requested frame")
  void renderFrame_Throws_LoopContinues() {
    final TreeVisualizer visualizer = new TreeVisualizer(CONFIG);
    final FrameRenderer renderer = mock(FrameRenderer.class);
    doThrow(new IllegalStateException("boom")).doNothing().when(renderer).renderFrame(any());

    try (RenderLoop loop = new RenderLoop(visualizer, renderer, CONFIG).start()) {
      verify(renderer, timeout(2_000).atLeastOnce()).renderFrame(any());
      loop.requestFrame();
      verify(renderer, timeout(2_000).atLeast(2)).renderFrame(any());
    }
  }

  @Test
  @DisplayName("Should stop drawing once closed")
  void close_StopsRendering() throws Exception {
    final TreeVisualizer visualizer = new TreeVisualizer(CONFIG);
    final FrameRenderer renderer = mock(FrameRenderer.class);
    final RenderLoop loop = new RenderLoop(visualizer, renderer, CONFIG).start();
    verify(renderer, timeout(2_000).atLeastOnce()).renderFrame(any());

    loop.close();
    final long frames = loop.framesRendered();
    visualizer.onTreeFinished(new RewriteTree(TreeNode.root("after close")));
    loop.requestFrame();
    Thread.sleep(50);

    assertThat(loop.framesRendered()).isEqualTo(frames);
  }
}
