package org.folio.layoutxml.server;

import io.vertx.core.json.JsonObject;
import org.folio.layoutxml.util.Digest;
import org.junit.Assert;
import org.junit.Test;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.is;
import static org.hamcrest.Matchers.nullValue;

public class LayoutCacheTest {

  static Digest digest(int n) {
    byte[] bytes = new byte[Digest.LENGTH];
    bytes[0] = (byte) n;
    return Digest.of(bytes);
  }

  static JsonObject layout(String type) {
    return new JsonObject().put("type", type);
  }

  @Test
  public void putGet() {
    LayoutCache cache = new LayoutCache(10);
    assertThat(cache.getMaxSize(), is(10));
    assertThat(cache.get(digest(1)), is(nullValue()));
    cache.put(digest(1), layout("a"));
    assertThat(cache.get(digest(1)), is(layout("a")));
    cache.put(digest(1), layout("b"));
    assertThat(cache.get(digest(1)), is(layout("b")));
    assertThat(cache.size(), is(1));
  }

  @Test
  public void leastRecentlyUsedEvicted() {
    LayoutCache cache = new LayoutCache(2);
    cache.put(digest(1), layout("a"));
    cache.put(digest(2), layout("b"));
    cache.get(digest(1));
    cache.put(digest(3), layout("c"));
    assertThat(cache.size(), is(2));
    assertThat(cache.get(digest(2)), is(nullValue()));
    assertThat(cache.get(digest(1)), is(layout("a")));
    assertThat(cache.get(digest(3)), is(layout("c")));
  }

  @Test
  public void invalidate() {
    LayoutCache cache = new LayoutCache(2);
    cache.put(digest(1), layout("a"));
    assertThat(cache.invalidate(digest(1)), is(true));
    assertThat(cache.invalidate(digest(1)), is(false));
    cache.put(digest(2), layout("b"));
    cache.clear();
    assertThat(cache.size(), is(0));
  }

  @Test
  public void badSize() {
    Assert.assertThrows(IllegalArgumentException.class, () -> new LayoutCache(0));
  }
}
