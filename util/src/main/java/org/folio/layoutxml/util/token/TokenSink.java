package org.folio.layoutxml.util.token;

import org.folio.layoutxml.util.Digest;

/**
 * Receiver of streamed tokens.
 */
public interface TokenSink {

  void onToken(Token token);

  /**
   * Called once after the last token when the whole document parsed successfully.
   * Never called if parsing fails.
   * @param digest SHA-256 of the raw input
   */
  void onComplete(Digest digest);
}
