package org.folio.layoutxml.util;

import io.vertx.core.json.JsonObject;
import java.util.Objects;

/**
 * Layout tree with the digest of the bytes it was parsed from.
 */
public class ParseResult {

  public static final String DIGEST_LABEL = "digest";

  public static final String LAYOUT_LABEL = "layout";

  private final JsonObject tree;

  private final Digest digest;

  public ParseResult(JsonObject tree, Digest digest) {
    this.tree = Objects.requireNonNull(tree);
    this.digest = Objects.requireNonNull(digest);
  }

  public JsonObject getTree() {
    return tree;
  }

  public Digest getDigest() {
    return digest;
  }

  public JsonObject toJson() {
    return new JsonObject()
        .put(DIGEST_LABEL, digest.toHex())
        .put(LAYOUT_LABEL, tree);
  }

  @Override
  public boolean equals(Object o) {
    if (!(o instanceof ParseResult)) {
      return false;
    }
    ParseResult other = (ParseResult) o;
    return tree.equals(other.tree) && digest.equals(other.digest);
  }

  @Override
  public int hashCode() {
    return 31 * tree.hashCode() + digest.hashCode();
  }
}
