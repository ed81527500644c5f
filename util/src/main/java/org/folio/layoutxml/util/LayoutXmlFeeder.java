package org.folio.layoutxml.util;

import com.fasterxml.aalto.AsyncByteArrayFeeder;
import com.fasterxml.aalto.AsyncXMLInputFactory;
import com.fasterxml.aalto.AsyncXMLStreamReader;
import com.fasterxml.aalto.stax.InputFactoryImpl;
import javax.xml.stream.XMLInputFactory;
import javax.xml.stream.XMLStreamConstants;
import javax.xml.stream.XMLStreamException;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.folio.layoutxml.util.LayoutXmlException.ErrorType;

/**
 * Per-parse context: hashes each chunk, feeds it to
 * <a href="https://github.com/FasterXML/aalto-xml">Aalto XML</a> and dispatches the
 * resulting events to a {@link LayoutEventHandler}.
 *
 * <p>Instances are confined to one parse and must not be shared.
 */
public class LayoutXmlFeeder implements AutoCloseable {
  private static final Logger log = LogManager.getLogger(LayoutXmlFeeder.class);

  private final AsyncXMLStreamReader<AsyncByteArrayFeeder> parser;

  private final ContentHasher hasher = new ContentHasher();

  private final LayoutEventHandler handler;

  private boolean ended;

  private boolean closed;

  private long bytesFed;

  /**
   * Create feeder with a fresh parser.
   * @param handler receives the events
   * @throws LayoutXmlException PARSER_INIT_FAILURE if parser could not be created
   */
  public LayoutXmlFeeder(LayoutEventHandler handler) {
    this.handler = handler;
    try {
      AsyncXMLInputFactory factory = new InputFactoryImpl();
      // prefixes are kept verbatim in names; no namespace binding or checks
      factory.setProperty(XMLInputFactory.IS_NAMESPACE_AWARE, Boolean.FALSE);
      parser = factory.createAsyncForByteArray();
    } catch (RuntimeException | Error e) {
      throw new LayoutXmlException(ErrorType.PARSER_INIT_FAILURE,
          "Cannot create XML parser: " + e.getMessage(), e);
    }
  }

  /**
   * Hash and parse chunk. Events are delivered before this returns.
   * @param buf buffer
   * @param offset offset in buffer
   * @param length number of bytes
   * @throws LayoutXmlException SYNTAX_ERROR if the chunk is not well-formed
   * @throws IllegalStateException if called after {@link #end()} or {@link #close()}
   */
  public void feed(byte[] buf, int offset, int length) {
    if (ended || closed) {
      throw new IllegalStateException("Input already ended");
    }
    hasher.update(buf, offset, length);
    if (length == 0) {
      return;
    }
    bytesFed += length;
    try {
      parser.getInputFeeder().feedInput(buf, offset, length);
      drain();
    } catch (XMLStreamException e) {
      throw new LayoutXmlException(ErrorType.SYNTAX_ERROR, e);
    }
  }

  public void feed(byte[] buf) {
    feed(buf, 0, buf.length);
  }

  /**
   * Signal end-of-input; flushes remaining events and finalizes the digest.
   * @return digest of all bytes fed
   * @throws LayoutXmlException SYNTAX_ERROR if the input is not a complete document;
   *     FINALIZE_ERROR if the event handler rejects the end of document
   */
  public Digest end() {
    if (ended || closed) {
      throw new IllegalStateException("Input already ended");
    }
    ended = true;
    parser.getInputFeeder().endOfInput();
    try {
      drain();
      // endOfInput does not make the parser throw on truncated input
      if (parser.getEventType() != XMLStreamConstants.END_DOCUMENT) {
        throw new XMLStreamException("Incomplete input after " + bytesFed + " bytes",
            parser.getLocation());
      }
    } catch (XMLStreamException e) {
      throw new LayoutXmlException(ErrorType.SYNTAX_ERROR, e);
    }
    handler.endDocument();
    Digest digest = hasher.digest();
    log.debug("Parsed {} bytes, digest {}", bytesFed, digest);
    return digest;
  }

  private void drain() throws XMLStreamException {
    while (parser.hasNext()) {
      int event = parser.next();
      switch (event) {
        case AsyncXMLStreamReader.EVENT_INCOMPLETE:
          return;
        case XMLStreamConstants.START_ELEMENT:
          handler.startElement(XmlAttributes.elementName(parser), XmlAttributes.collect(parser));
          break;
        case XMLStreamConstants.END_ELEMENT:
          handler.endElement(XmlAttributes.elementName(parser));
          break;
        case XMLStreamConstants.CHARACTERS:
        case XMLStreamConstants.CDATA:
        case XMLStreamConstants.SPACE:
          handler.characters(parser.getText());
          break;
        default:
          break;
      }
    }
  }

  public long getBytesFed() {
    return bytesFed;
  }

  @Override
  public void close() {
    if (closed) {
      return;
    }
    closed = true;
    try {
      parser.closeCompletely();
    } catch (XMLStreamException e) {
      log.warn("Closing XML parser failed: {}", e.getMessage(), e);
    }
  }
}
