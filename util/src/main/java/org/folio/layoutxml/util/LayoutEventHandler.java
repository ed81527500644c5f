package org.folio.layoutxml.util;

import java.util.Map;

/**
 * Receives element and character events from {@link LayoutXmlFeeder} in document order.
 */
public interface LayoutEventHandler {

  /**
   * Start tag.
   * @param name raw element name
   * @param attributes normalized attributes; empty if none
   */
  void startElement(String name, Map<String, String> attributes);

  void endElement(String name);

  /**
   * Character data; may be split over several calls.
   * @param text characters
   */
  void characters(String text);

  /**
   * End of input; called once after the last event and before the digest is computed.
   * @throws LayoutXmlException if the events did not form a complete document
   */
  void endDocument();
}
