package org.folio.layoutxml.util;

import java.util.Map;
import java.util.function.Consumer;
import org.folio.layoutxml.util.LayoutXmlException.ErrorType;
import org.folio.layoutxml.util.token.Token;

/**
 * Turns element events into tokens without materializing a tree.
 *
 * <p>Character data between two markup boundaries becomes one text token, emitted just
 * before the next start or end token. Empty text produces no token.
 */
public class TokenEmitter implements LayoutEventHandler {

  private final Consumer<Token> consumer;

  private final StringBuilder pending = new StringBuilder();

  private int openElements;

  public TokenEmitter(Consumer<Token> consumer) {
    this.consumer = consumer;
  }

  private void flushText() {
    if (pending.length() > 0) {
      String content = pending.toString();
      pending.setLength(0);
      consumer.accept(Token.text(content));
    }
  }

  @Override
  public void startElement(String name, Map<String, String> attributes) {
    flushText();
    openElements++;
    consumer.accept(Token.start(name, attributes));
  }

  @Override
  public void endElement(String name) {
    flushText();
    openElements--;
    consumer.accept(Token.end(name));
  }

  @Override
  public void characters(String text) {
    // character data outside the root element is not reported
    if (openElements > 0) {
      pending.append(text);
    }
  }

  @Override
  public void endDocument() {
    if (openElements != 0) {
      throw new LayoutXmlException(ErrorType.FINALIZE_ERROR,
          "Document ended with " + openElements + " open element(s)");
    }
    flushText();
  }
}
