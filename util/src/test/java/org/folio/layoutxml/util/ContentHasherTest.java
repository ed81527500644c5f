package org.folio.layoutxml.util;

import java.nio.charset.StandardCharsets;
import org.junit.Assert;
import org.junit.Test;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.is;

public class ContentHasherTest {
  static final String ABC_SHA256 = "ba7816bf8f01cfea414140de5dae2223b00361a396177a9cb410ff61f20015ad";
  static final String EMPTY_SHA256 = "e3b0c44298fc1c149afbf4c8996fb92427ae41e4649b934ca495991b7852b855";

  @Test
  public void abc() {
    ContentHasher hasher = new ContentHasher();
    hasher.update("abc".getBytes(StandardCharsets.UTF_8));
    assertThat(hasher.digest().toHex(), is(ABC_SHA256));
  }

  @Test
  public void empty() {
    ContentHasher hasher = new ContentHasher();
    hasher.update(new byte[0]);
    assertThat(hasher.digest().toHex(), is(EMPTY_SHA256));
  }

  @Test
  public void chunkBoundaries() {
    byte[] data = "<LinearLayout><TextView/></LinearLayout>".getBytes(StandardCharsets.UTF_8);
    ContentHasher whole = new ContentHasher();
    whole.update(data);
    Digest expected = whole.digest();
    for (int chunk = 1; chunk <= data.length; chunk++) {
      ContentHasher hasher = new ContentHasher();
      for (int off = 0; off < data.length; off += chunk) {
        hasher.update(data, off, Math.min(chunk, data.length - off));
      }
      assertThat("chunk " + chunk, hasher.digest(), is(expected));
    }
  }

  @Test
  public void finalizedOnce() {
    ContentHasher hasher = new ContentHasher();
    assertThat(hasher.isFinalized(), is(false));
    hasher.digest();
    assertThat(hasher.isFinalized(), is(true));
    Assert.assertThrows(IllegalStateException.class, hasher::digest);
    Assert.assertThrows(IllegalStateException.class, () -> hasher.update(new byte[1]));
  }
}
