package io.fullerstack.perf.core.config;

import java.util.Locale;
import java.util.MissingResourceException;
import java.util.Objects;
import java.util.ResourceBundle;
import java.util.Set;
import java.util.function.Function;
import java.util.regex.Pattern;

/**
 * Layered configuration backed by {@link ResourceBundle} property files.
 *
 * <p>Lookup order, first match wins:
 * <ol>
 *   <li>JVM system properties ({@code -Dperf.target-fps=120})</li>
 *   <li>{@code config_{profile}.properties} (deployment profile, when one is selected)</li>
 *   <li>{@code config.properties} (global defaults)</li>
 * </ol>
 *
 * <p>Profiles map onto the bundle's locale language tag, so a profile name must
 * be 2 to 8 lowercase letters ({@code linux}, {@code headless}, {@code lowlat}).
 * The JVM default locale never takes part in the fallback chain.
 *
 * <p><strong>Example Property Files:</strong>
 * <pre>
 * # config.properties
 * perf.update-interval-ms=500
 * perf.target-fps=60
 *
 * # config_lowlat.properties
 * perf.update-interval-ms=100
 * </pre>
 *
 * <p><strong>Usage:</strong>
 * <pre>
 * HierarchicalConfig config = HierarchicalConfig.forProfile("lowlat");
 * long interval = config.getLong("perf.update-interval-ms");
 * // → 100 (from config_lowlat.properties)
 * int target = config.getInt("perf.target-fps");
 * // → 60 (inherited from config.properties)
 * </pre>
 */
public class HierarchicalConfig {

  private static final String BASE_NAME = "config";
  private static final Pattern PROFILE_PATTERN = Pattern.compile("[a-z]{2,8}");
  private static final ResourceBundle.Control NO_LOCALE_FALLBACK =
    ResourceBundle.Control.getNoFallbackControl(ResourceBundle.Control.FORMAT_PROPERTIES);

  private final ResourceBundle bundle;
  private final String context;

  private HierarchicalConfig(ResourceBundle bundle, String context) {
    this.bundle = bundle;
    this.context = context;
  }

  /**
   * Configuration from {@code config.properties} plus system property overrides.
   *
   * @throws ConfigurationException if config.properties is not on the classpath
   */
  public static HierarchicalConfig global() {
    return new HierarchicalConfig(load(Locale.ROOT), "global");
  }

  /**
   * Get profile-specific configuration, falling back to config.properties for
   * keys the profile file does not define. A profile without its own file
   * behaves like {@link #global()}.
   *
   * @param profile Profile name (e.g., "linux", "headless")
   * @return Profile configuration
   */
  public static HierarchicalConfig forProfile(String profile) {
    Objects.requireNonNull(profile, "profile cannot be null");
    if (!PROFILE_PATTERN.matcher(profile).matches()) {
      throw new IllegalArgumentException(
        "profile must be 2-8 lowercase letters, got: '" + profile + "'"
      );
    }
    return new HierarchicalConfig(load(new Locale(profile)), "profile:" + profile);
  }

  private static ResourceBundle load(Locale locale) {
    try {
      return ResourceBundle.getBundle(BASE_NAME, locale, NO_LOCALE_FALLBACK);
    } catch (MissingResourceException e) {
      throw new ConfigurationException("No " + BASE_NAME + ".properties on the classpath", e);
    }
  }

  // =========================================================================
  // Lookups: system property, then profile file, then config.properties
  // =========================================================================

  /**
   * @throws ConfigurationException if no layer defines {@code key}
   */
  public String getString(String key) {
    String value = getString(key, null);
    if (value == null) {
      throw new ConfigurationException("Missing config key '" + key + "' in context: " + context);
    }
    return value;
  }

  /**
   * @return trimmed value from the first layer defining {@code key}, else {@code defaultValue}
   */
  public String getString(String key, String defaultValue) {
    String override = System.getProperty(key);
    if (override != null) {
      return override.trim();
    }
    return bundle.containsKey(key) ? bundle.getString(key).trim() : defaultValue;
  }

  /**
   * @throws ConfigurationException if {@code key} is missing or not an int
   */
  public int getInt(String key) {
    return this.<Integer>parseRequired(key, "int", Integer::valueOf);
  }

  /**
   * An unparsable value also yields the default.
   */
  public int getInt(String key, int defaultValue) {
    return parseOrDefault(key, defaultValue, Integer::valueOf);
  }

  /**
   * @throws ConfigurationException if {@code key} is missing or not a long
   */
  public long getLong(String key) {
    return this.<Long>parseRequired(key, "long", Long::valueOf);
  }

  public long getLong(String key, long defaultValue) {
    return parseOrDefault(key, defaultValue, Long::valueOf);
  }

  public double getDouble(String key, double defaultValue) {
    return parseOrDefault(key, defaultValue, Double::valueOf);
  }

  private <T> T parseRequired(String key, String type, Function<String, T> parser) {
    String raw = getString(key);
    try {
      return parser.apply(raw);
    } catch (NumberFormatException e) {
      throw new ConfigurationException("Invalid " + type + " value for key '" + key + "': " + raw, e);
    }
  }

  private <T> T parseOrDefault(String key, T defaultValue, Function<String, T> parser) {
    String raw = getString(key, null);
    if (raw == null) {
      return defaultValue;
    }
    try {
      return parser.apply(raw);
    } catch (NumberFormatException e) {
      return defaultValue;
    }
  }

  /**
   * @return true if a system property or any property file layer defines {@code key}
   */
  public boolean contains(String key) {
    return System.getProperty(key) != null || bundle.containsKey(key);
  }

  /**
   * @return all keys visible in this configuration, including inherited ones
   */
  public Set<String> keys() {
    return bundle.keySet();
  }

  /**
   * @return Context description (e.g., "global", "profile:linux")
   */
  public String context() {
    return context;
  }

  @Override
  public String toString() {
    return "HierarchicalConfig{" + context + ", keys=" + bundle.keySet().size() + "}";
  }
}
