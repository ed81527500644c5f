package org.folio.layoutxml.util;

import io.vertx.core.json.JsonObject;

/**
 * Configuration lookup: Java system property first, then JSON configuration
 * (verticle config), then default.
 */
public final class Config {

  private Config() {
    throw new UnsupportedOperationException("Config");
  }

  /**
   * Get configuration value.
   * @param key property name
   * @param def default value
   * @param conf JSON configuration; may be null
   * @return value
   */
  public static String getSysConf(String key, String def, JsonObject conf) {
    String v = System.getProperty(key);
    if (v != null) {
      return v;
    }
    if (conf != null) {
      Object o = conf.getValue(key);
      if (o != null) {
        return o.toString();
      }
    }
    return def;
  }

  /**
   * Get integer configuration value.
   * @param key property name
   * @param def default value
   * @param conf JSON configuration; may be null
   * @return value
   * @throws IllegalArgumentException if value is not an integer
   */
  public static int getSysConfInteger(String key, int def, JsonObject conf) {
    String v = getSysConf(key, null, conf);
    if (v == null) {
      return def;
    }
    try {
      return Integer.parseInt(v.trim());
    } catch (NumberFormatException e) {
      throw new IllegalArgumentException("Bad value for " + key + ": " + v, e);
    }
  }
}
