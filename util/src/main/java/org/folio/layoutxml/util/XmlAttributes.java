package org.folio.layoutxml.util;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import javax.xml.stream.XMLStreamReader;

/**
 * Element names and attribute maps from a parser positioned at START_ELEMENT.
 */
public final class XmlAttributes {

  private XmlAttributes() {
    throw new UnsupportedOperationException("XmlAttributes");
  }

  /**
   * Strip namespace prefix from attribute key.
   * @param key raw key, such as "android:layout_width"
   * @return part after first colon; key itself if there is no colon
   */
  public static String normalizeKey(String key) {
    int idx = key.indexOf(':');
    return idx == -1 ? key : key.substring(idx + 1);
  }

  static String qualify(String prefix, String localName) {
    if (prefix == null || prefix.isEmpty()) {
      return localName;
    }
    return prefix + ":" + localName;
  }

  /**
   * Raw qualified name of current element.
   * @param reader parser at START_ELEMENT or END_ELEMENT
   * @return "prefix:local" or "local"
   */
  public static String elementName(XMLStreamReader reader) {
    return qualify(reader.getPrefix(), reader.getLocalName());
  }

  /**
   * Attributes of current element with normalized keys.
   *
   * <p>Attributes are in document order; namespace declarations are ordinary
   * attributes, so {@code xmlns:android} gives key {@code android}. When two keys normalize to the same key the last value wins; the key keeps the
   * position of its first occurrence.
   * @param reader parser at START_ELEMENT
   * @return ordered unmodifiable map; empty if element has no attributes
   */
  public static Map<String, String> collect(XMLStreamReader reader) {
    int attributeCount = reader.getAttributeCount();
    if (attributeCount == 0) {
      return Collections.emptyMap();
    }
    Map<String, String> attributes = new LinkedHashMap<>();
    for (int i = 0; i < attributeCount; i++) {
      String rawKey = qualify(reader.getAttributePrefix(i), reader.getAttributeLocalName(i));
      String value = reader.getAttributeValue(i);
      attributes.put(normalizeKey(rawKey), value == null ? "" : value);
    }
    return Collections.unmodifiableMap(attributes);
  }
}
