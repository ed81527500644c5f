package org.folio.layoutxml.util.token;

import io.vertx.core.json.JsonObject;
import java.util.Collections;
import java.util.Map;
import java.util.Objects;

/**
 * Structural token of a layout document: start of element, end of element or text.
 */
public abstract class Token {

  public enum Kind {
    START, END, TEXT
  }

  public static final String KIND_LABEL = "kind";

  private Token() {
  }

  public abstract Kind getKind();

  /**
   * JSON representation.
   * @return object with "kind" and the token's fields
   */
  public abstract JsonObject toJson();

  public static StartElement start(String type, Map<String, String> attributes) {
    return new StartElement(type, attributes);
  }

  public static EndElement end(String type) {
    return new EndElement(type);
  }

  public static Text text(String content) {
    return new Text(content);
  }

  public static final class StartElement extends Token {
    private final String type;
    private final Map<String, String> attributes;

    StartElement(String type, Map<String, String> attributes) {
      this.type = Objects.requireNonNull(type);
      this.attributes = attributes == null ? Collections.emptyMap() : attributes;
    }

    public String getType() {
      return type;
    }

    /**
     * Normalized attributes in document order.
     * @return map; empty if element has no attributes
     */
    public Map<String, String> getAttributes() {
      return attributes;
    }

    @Override
    public Kind getKind() {
      return Kind.START;
    }

    @Override
    public JsonObject toJson() {
      JsonObject o = new JsonObject().put(KIND_LABEL, "start").put("type", type);
      if (!attributes.isEmpty()) {
        JsonObject attrs = new JsonObject();
        attributes.forEach(attrs::put);
        o.put("attributes", attrs);
      }
      return o;
    }

    @Override
    public boolean equals(Object o) {
      if (!(o instanceof StartElement)) {
        return false;
      }
      StartElement other = (StartElement) o;
      return type.equals(other.type) && attributes.equals(other.attributes);
    }

    @Override
    public int hashCode() {
      return Objects.hash(type, attributes);
    }

    @Override
    public String toString() {
      return "Start(" + type + (attributes.isEmpty() ? "" : " " + attributes) + ")";
    }
  }

  public static final class EndElement extends Token {
    private final String type;

    EndElement(String type) {
      this.type = Objects.requireNonNull(type);
    }

    public String getType() {
      return type;
    }

    @Override
    public Kind getKind() {
      return Kind.END;
    }

    @Override
    public JsonObject toJson() {
      return new JsonObject().put(KIND_LABEL, "end").put("type", type);
    }

    @Override
    public boolean equals(Object o) {
      return o instanceof EndElement && type.equals(((EndElement) o).type);
    }

    @Override
    public int hashCode() {
      return type.hashCode();
    }

    @Override
    public String toString() {
      return "End(" + type + ")";
    }
  }

  public static final class Text extends Token {
    private final String content;

    Text(String content) {
      this.content = Objects.requireNonNull(content);
    }

    public String getContent() {
      return content;
    }

    @Override
    public Kind getKind() {
      return Kind.TEXT;
    }

    @Override
    public JsonObject toJson() {
      return new JsonObject().put(KIND_LABEL, "text").put("content", content);
    }

    @Override
    public boolean equals(Object o) {
      return o instanceof Text && content.equals(((Text) o).content);
    }

    @Override
    public int hashCode() {
      return content.hashCode();
    }

    @Override
    public String toString() {
      return "Text(" + content + ")";
    }
  }
}
