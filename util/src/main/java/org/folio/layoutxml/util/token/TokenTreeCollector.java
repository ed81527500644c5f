package org.folio.layoutxml.util.token;

import org.folio.layoutxml.util.Digest;
import org.folio.layoutxml.util.ParseResult;
import org.folio.layoutxml.util.TreeBuilder;

/**
 * Token sink that rebuilds the layout tree from a token sequence.
 */
public class TokenTreeCollector implements TokenSink {

  private final TreeBuilder treeBuilder = new TreeBuilder();

  private ParseResult result;

  @Override
  public void onToken(Token token) {
    switch (token.getKind()) {
      case START:
        Token.StartElement start = (Token.StartElement) token;
        treeBuilder.startElement(start.getType(), start.getAttributes());
        break;
      case END:
        treeBuilder.endElement(((Token.EndElement) token).getType());
        break;
      default:
        break;
    }
  }

  @Override
  public void onComplete(Digest digest) {
    treeBuilder.endDocument();
    result = new ParseResult(treeBuilder.result(), digest);
  }

  /**
   * Collected tree.
   * @return tree and digest; null if the token stream has not completed
   */
  public ParseResult getResult() {
    return result;
  }
}
