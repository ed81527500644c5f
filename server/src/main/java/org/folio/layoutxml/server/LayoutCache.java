package org.folio.layoutxml.server;

import io.vertx.core.json.JsonObject;
import java.util.LinkedHashMap;
import java.util.Map;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.folio.layoutxml.util.Digest;

/**
 * Converted layouts keyed by the digest of their XML source.
 *
 * <p>Least recently used entries are evicted once the cache holds more than
 * {@code maxSize} entries.
 */
public class LayoutCache {
  private static final Logger log = LogManager.getLogger(LayoutCache.class);

  private final int maxSize;

  private final Map<Digest, JsonObject> entries;

  /**
   * Create cache.
   * @param maxSize maximum number of layouts kept
   */
  public LayoutCache(int maxSize) {
    if (maxSize <= 0) {
      throw new IllegalArgumentException("cache size must be positive: " + maxSize);
    }
    this.maxSize = maxSize;
    entries = new LinkedHashMap<>(16, 0.75f, true) {
      @Override
      protected boolean removeEldestEntry(Map.Entry<Digest, JsonObject> eldest) {
        boolean evict = size() > LayoutCache.this.maxSize;
        if (evict) {
          log.debug("Evicting layout {}", eldest.getKey());
        }
        return evict;
      }
    };
  }

  /**
   * Lookup layout.
   * @param digest digest of XML source
   * @return layout tree; null if not cached
   */
  public synchronized JsonObject get(Digest digest) {
    return entries.get(digest);
  }

  public synchronized void put(Digest digest, JsonObject layout) {
    entries.put(digest, layout);
  }

  /**
   * Remove layout.
   * @param digest digest of XML source
   * @return true if the layout was cached
   */
  public synchronized boolean invalidate(Digest digest) {
    return entries.remove(digest) != null;
  }

  public synchronized int size() {
    return entries.size();
  }

  public synchronized void clear() {
    entries.clear();
  }

  public int getMaxSize() {
    return maxSize;
  }
}
