package com.consullo.rewritetree.config;

import java.io.IOException;
import java.io.InputStream;
import java.util.Properties;
import org.apache.commons.lang3.StringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Loads {@link VisualizationConfig} from a classpath properties file and JVM
 * system properties.
 *
 * <p>
 * Resolution order: built-in defaults, then {@value #RESOURCE_NAME} on the
 * classpath, then system properties prefixed with {@value #SYSTEM_PREFIX}.
 * Unknown keys and unparsable values are logged and skipped.
 * </p>
 */
public final class VisualizationConfigLoader {

  private static final Logger LOGGER = LoggerFactory.getLogger(VisualizationConfigLoader.class);

  public static final String RESOURCE_NAME = "rewrite-tree.properties";
  public static final String SYSTEM_PREFIX = "rewritetree.";

  private final String resourceName;

  public VisualizationConfigLoader() {
    this(RESOURCE_NAME);
  }

  public VisualizationConfigLoader(String resourceName) {
    if (StringUtils.isBlank(resourceName)) {
      throw new IllegalArgumentException("resourceName must not be blank.");
    }
    this.resourceName = resourceName;
  }

  /**
   * Loads the effective configuration.
   *
   * @return configuration, never null
   */
  public VisualizationConfig load() {
    Properties merged = new Properties();
    merged.putAll(readResource());

    Properties sys = System.getProperties();
    for (String name : sys.stringPropertyNames()) {
      if (name.startsWith(SYSTEM_PREFIX)) {
        merged.setProperty(name.substring(SYSTEM_PREFIX.length()), sys.getProperty(name));
      }
    }
    return fromProperties(merged);
  }

  /**
   * Applies recognised keys from {@code props} on top of the defaults.
   *
   * @param props settings keyed without prefix
   * @return configuration, never null
   */
  public static VisualizationConfig fromProperties(Properties props) {
    VisualizationConfig defaults = VisualizationConfig.defaults();
    int depth = defaults.decompressionDepth();
    int nodeLimit = defaults.nodeLimit();
    int maxScopeDepth = defaults.maxScopeDepth();
    RecoveryPolicy policy = defaults.recoveryPolicy();
    long frameInterval = defaults.frameIntervalMillis();

    if (props == null) {
      return defaults;
    }

    for (String key : props.stringPropertyNames()) {
      String value = StringUtils.trim(props.getProperty(key));
      try {
        switch (key) {
          case "decompressionDepth":
            int parsedDepth = Integer.parseInt(value);
            if (parsedDepth > 0) {
              depth = parsedDepth;
            } else {
              LOGGER.warn("Ignoring non-positive decompressionDepth: {}", value);
            }
            break;
          case "nodeLimit":
            nodeLimit = Integer.parseInt(value);
            break;
          case "maxScopeDepth":
            maxScopeDepth = Integer.parseInt(value);
            break;
          case "recoveryPolicy":
            policy = RecoveryPolicy.valueOf(StringUtils.upperCase(value));
            break;
          case "frameIntervalMillis":
            long parsedInterval = Long.parseLong(value);
            if (parsedInterval > 0) {
              frameInterval = parsedInterval;
            } else {
              LOGGER.warn("Ignoring non-positive frameIntervalMillis: {}", value);
            }
            break;
          default:
            LOGGER.warn("Unknown configuration key: {}", key);
        }
      } catch (IllegalArgumentException e) {
        LOGGER.warn("Ignoring bad value for configuration key {}: {}", key, value);
      }
    }

    return new VisualizationConfig(depth, nodeLimit, maxScopeDepth, policy, frameInterval);
  }

  private Properties readResource() {
    Properties props = new Properties();
    try (InputStream in = getClass().getClassLoader().getResourceAsStream(resourceName)) {
      if (in == null) {
        LOGGER.debug("No {} on the classpath, using defaults", resourceName);
        return props;
      }
      props.load(in);
    } catch (IOException e) {
      LOGGER.warn("Failed to read {}, using defaults: {}", resourceName, e.getMessage());
    }
    return props;
  }
}
