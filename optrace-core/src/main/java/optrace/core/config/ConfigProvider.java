package optrace.core.config;

import java.util.Map;
import java.util.Properties;
import javax.annotation.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Resolves configuration keys, such as {@code profiler.state}, from the system property {@code
 * optrace.profiler.state}, then the environment variable {@code OPTRACE_PROFILER_STATE}, then the
 * given default.
 */
public final class ConfigProvider {
  private static final Logger log = LoggerFactory.getLogger(ConfigProvider.class);

  private static final String PREFIX = "optrace.";

  private static final ConfigProvider INSTANCE = new ConfigProvider(null, null);

  @Nullable private final Properties systemProperties;
  @Nullable private final Map<String, String> environment;

  private ConfigProvider(
      @Nullable Properties systemProperties, @Nullable Map<String, String> environment) {
    this.systemProperties = systemProperties;
    this.environment = environment;
  }

  /** Returns the provider reading the JVM system properties and the process environment. */
  public static ConfigProvider get() {
    return INSTANCE;
  }

  /** Creates a provider reading the given sources instead of the process ones. */
  public static ConfigProvider withSources(
      Properties systemProperties, Map<String, String> environment) {
    return new ConfigProvider(systemProperties, environment);
  }

  public static String toSystemProperty(String key) {
    return PREFIX + key;
  }

  public static String toEnvVar(String key) {
    return toSystemProperty(key).replace('.', '_').replace('-', '_').toUpperCase();
  }

  @Nullable
  public String getString(String key) {
    String value = systemProperty(toSystemProperty(key));
    if (value == null) {
      value = environmentVariable(toEnvVar(key));
    }
    return value == null ? null : value.trim();
  }

  public String getString(String key, String defaultValue) {
    String value = getString(key);
    return value == null || value.isEmpty() ? defaultValue : value;
  }

  public boolean getBoolean(String key, boolean defaultValue) {
    String value = getString(key);
    if (value == null || value.isEmpty()) {
      return defaultValue;
    }
    return "true".equalsIgnoreCase(value) || "1".equals(value);
  }

  public int getInteger(String key, int defaultValue) {
    String value = getString(key);
    if (value == null || value.isEmpty()) {
      return defaultValue;
    }
    try {
      return Integer.parseInt(value);
    } catch (NumberFormatException e) {
      log.warn(
          "Invalid configuration for {}: '{}' is not an integer, using {}",
          key,
          value,
          defaultValue);
      return defaultValue;
    }
  }

  @Nullable
  private String systemProperty(String name) {
    try {
      return this.systemProperties == null
          ? System.getProperty(name)
          : this.systemProperties.getProperty(name);
    } catch (SecurityException e) {
      log.debug("Cannot read system property {}", name, e);
      return null;
    }
  }

  @Nullable
  private String environmentVariable(String name) {
    try {
      return this.environment == null ? System.getenv(name) : this.environment.get(name);
    } catch (SecurityException e) {
      log.debug("Cannot read environment variable {}", name, e);
      return null;
    }
  }
}
