package com.consullo.rewritetree.view;

import com.consullo.rewritetree.config.VisualizationConfig;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;
import org.apache.commons.lang3.Validate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Dedicated render thread for a {@link TreeVisualizer}.
 *
 * <p>
 * The thread sleeps on a monitor until {@link #requestFrame()} is called. Each
 * frame advances the tree's animation one tick and hands the tree to the
 * {@link FrameRenderer}, both under the visualizer's lock. While the animation
 * is still moving the loop wakes again after one frame interval; once it has
 * settled the loop blocks until the next request.
 * </p>
 */
public final class RenderLoop implements AutoCloseable {

  private static final Logger LOGGER = LoggerFactory.getLogger(RenderLoop.class);

  private static final long CLOSE_TIMEOUT_MILLIS = 2_000L;

  private final TreeVisualizer visualizer;
  private final FrameRenderer renderer;
  private final long frameIntervalMillis;
  private final Object signal = new Object();
  private final AtomicBoolean started = new AtomicBoolean(false);
  private final AtomicBoolean closed = new AtomicBoolean(false);
  private final AtomicLong framesRendered = new AtomicLong();
  private final Runnable hook = this::requestFrame;
  private final Thread thread;

  // guarded by signal
  private boolean frameRequested;

  public RenderLoop(TreeVisualizer visualizer, FrameRenderer renderer, VisualizationConfig config) {
    Validate.notNull(visualizer, "visualizer must not be null.");
    Validate.notNull(renderer, "renderer must not be null.");
    Validate.notNull(config, "config must not be null.");
    this.visualizer = visualizer;
    this.renderer = renderer;
    this.frameIntervalMillis = config.frameIntervalMillis();
    this.thread = new Thread(this::renderLoop, "TreeRenderLoop");
    this.thread.setDaemon(true);
  }

  /**
   * Subscribes to visualizer changes, starts the thread and draws a first frame.
   *
   * @return this loop
   */
  public RenderLoop start() {
    if (started.compareAndSet(false, true)) {
      visualizer.addChangeHook(hook);
      thread.start();
      requestFrame();
      LOGGER.info("Render loop started ({} ms frame interval)", frameIntervalMillis);
    }
    return this;
  }

  /**
   * Wakes the render thread. Requests made while a frame is being drawn
   * collapse into one further frame.
   */
  public void requestFrame() {
    synchronized (signal) {
      frameRequested = true;
      signal.notifyAll();
    }
  }

  public long framesRendered() {
    return framesRendered.get();
  }

  private void renderLoop() {
    boolean animating = false;
    try {
      while (!closed.get()) {
        awaitFrame(animating);
        if (closed.get()) {
          break;
        }
        animating = renderFrame();
      }
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
    } finally {
      LOGGER.debug("Render loop exited after {} frames", framesRendered.get());
    }
  }

  private void awaitFrame(boolean animating) throws InterruptedException {
    synchronized (signal) {
      if (animating) {
        if (!frameRequested) {
          signal.wait(frameIntervalMillis);
        }
      } else {
        while (!frameRequested && !closed.get()) {
          signal.wait();
        }
      }
      frameRequested = false;
    }
  }

  private boolean renderFrame() {
    long start = System.nanoTime();
    boolean moving = visualizer.withTree(tree -> {
      boolean stillMoving = tree.animate();
      try {
        renderer.renderFrame(tree);
      } catch (RuntimeException e) {
        LOGGER.warn("Frame renderer failed: {}", e.getMessage(), e);
      }
      return stillMoving;
    });
    long frame = framesRendered.incrementAndGet();
    if (LOGGER.isTraceEnabled()) {
      LOGGER.trace("Frame {} drawn in {} us (animating={})",
          frame, TimeUnit.NANOSECONDS.toMicros(System.nanoTime() - start), moving);
    }
    return moving;
  }

  /**
   * Stops the render thread and unsubscribes from the visualizer.
   */
  @Override
  public void close() {
    if (!closed.compareAndSet(false, true)) {
      return;
    }
    visualizer.removeChangeHook(hook);
    synchronized (signal) {
      signal.notifyAll();
    }
    if (started.get()) {
      thread.interrupt();
      try {
        thread.join(CLOSE_TIMEOUT_MILLIS);
      } catch (InterruptedException e) {
        Thread.currentThread().interrupt();
      }
    }
  }
}
