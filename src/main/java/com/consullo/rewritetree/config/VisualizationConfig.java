package com.consullo.rewritetree.config;

import org.apache.commons.lang3.Validate;

/**
 * Rewrite tree visualization settings.
 *
 * @param decompressionDepth tree levels kept expanded around a selected node (must be positive)
 * @param nodeLimit maximum nodes per tree; values of 1 or less mean unlimited
 * @param maxScopeDepth maximum scope-stack depth that still registers nodes; negative means unlimited
 * @param recoveryPolicy reaction to identifier lookup misses
 * @param frameIntervalMillis render tick interval while an animation is running
 * @since 1.0
 */
public record VisualizationConfig(
    int decompressionDepth,
    int nodeLimit,
    int maxScopeDepth,
    RecoveryPolicy recoveryPolicy,
    long frameIntervalMillis) {

  public static final int DEFAULT_DECOMPRESSION_DEPTH = 2;
  public static final int DEFAULT_NODE_LIMIT = 10_000;
  public static final int DEFAULT_MAX_SCOPE_DEPTH = -1;
  public static final long DEFAULT_FRAME_INTERVAL_MILLIS = 16L;

  public VisualizationConfig {
    Validate.isTrue(decompressionDepth > 0, "decompressionDepth must be positive: %d", decompressionDepth);
    Validate.notNull(recoveryPolicy, "recoveryPolicy must not be null.");
    Validate.isTrue(frameIntervalMillis > 0, "frameIntervalMillis must be positive: %d", frameIntervalMillis);
  }

  /**
   * Returns the stock settings.
   *
   * @return default configuration
   */
  public static VisualizationConfig defaults() {
    return new VisualizationConfig(
        DEFAULT_DECOMPRESSION_DEPTH,
        DEFAULT_NODE_LIMIT,
        DEFAULT_MAX_SCOPE_DEPTH,
        RecoveryPolicy.FAIL_FAST,
        DEFAULT_FRAME_INTERVAL_MILLIS);
  }

  public boolean isNodeLimitEnabled() {
    return nodeLimit > 1;
  }

  public boolean isScopeDepthLimited() {
    return maxScopeDepth >= 0;
  }

  public VisualizationConfig withNodeLimit(int limit) {
    return new VisualizationConfig(decompressionDepth, limit, maxScopeDepth, recoveryPolicy, frameIntervalMillis);
  }

  public VisualizationConfig withMaxScopeDepth(int depth) {
    return new VisualizationConfig(decompressionDepth, nodeLimit, depth, recoveryPolicy, frameIntervalMillis);
  }

  public VisualizationConfig withRecoveryPolicy(RecoveryPolicy policy) {
    return new VisualizationConfig(decompressionDepth, nodeLimit, maxScopeDepth, policy, frameIntervalMillis);
  }

  public VisualizationConfig withDecompressionDepth(int depth) {
    return new VisualizationConfig(depth, nodeLimit, maxScopeDepth, recoveryPolicy, frameIntervalMillis);
  }
}
