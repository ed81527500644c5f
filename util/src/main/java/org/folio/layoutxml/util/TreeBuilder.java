package org.folio.layoutxml.util;

import io.vertx.core.json.JsonArray;
import io.vertx.core.json.JsonObject;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import org.folio.layoutxml.util.LayoutXmlException.ErrorType;

/**
 * Builds a single JSON tree from element events.
 *
 * <p>Each node has "type", "attributes" if the element has any, and "children" if
 * the element has at least one child element. Character data is not part of the tree.
 */
public class TreeBuilder implements LayoutEventHandler {

  public static final String TYPE_LABEL = "type";

  public static final String ATTRIBUTES_LABEL = "attributes";

  public static final String CHILDREN_LABEL = "children";

  // per open element: whether its children array has been opened
  private final List<Boolean> childrenStarted = new ArrayList<>();

  private final List<JsonObject> nodes = new ArrayList<>();

  private int depth;

  private JsonObject root;

  private boolean complete;

  static JsonObject newNode(String name, Map<String, String> attributes) {
    JsonObject node = new JsonObject().put(TYPE_LABEL, name);
    if (!attributes.isEmpty()) {
      JsonObject attrs = new JsonObject();
      attributes.forEach(attrs::put);
      node.put(ATTRIBUTES_LABEL, attrs);
    }
    return node;
  }

  @Override
  public void startElement(String name, Map<String, String> attributes) {
    JsonObject node = newNode(name, attributes);
    if (depth > 0) {
      JsonObject parent = nodes.get(depth - 1);
      if (Boolean.FALSE.equals(childrenStarted.get(depth - 1))) {
        childrenStarted.set(depth - 1, Boolean.TRUE);
        parent.put(CHILDREN_LABEL, new JsonArray());
      }
      parent.getJsonArray(CHILDREN_LABEL).add(node);
    } else {
      // a well-formed document has one root; token sources are not checked by a tokenizer
      if (root != null) {
        throw new LayoutXmlException(ErrorType.SYNTAX_ERROR,
            "Second root element <" + name + ">");
      }
      root = node;
    }
    nodes.add(node);
    childrenStarted.add(Boolean.FALSE);
    depth++;
  }

  @Override
  public void endElement(String name) {
    if (depth == 0) {
      throw new LayoutXmlException(ErrorType.SYNTAX_ERROR, "Unbalanced end tag </" + name + ">");
    }
    depth--;
    nodes.remove(depth);
    childrenStarted.remove(depth);
  }

  @Override
  public void characters(String text) {
    // layouts carry no text in the tree
  }

  @Override
  public void endDocument() {
    if (depth != 0) {
      throw new LayoutXmlException(ErrorType.FINALIZE_ERROR,
          "Document ended with " + depth + " open element(s)");
    }
    if (root == null) {
      throw new LayoutXmlException(ErrorType.FINALIZE_ERROR, "No root element");
    }
    complete = true;
  }

  public int getDepth() {
    return depth;
  }

  /**
   * Resulting tree.
   * @return root node
   * @throws IllegalStateException if the document has not ended successfully
   */
  public JsonObject result() {
    if (!complete) {
      throw new IllegalStateException("Document not complete");
    }
    return root;
  }
}
