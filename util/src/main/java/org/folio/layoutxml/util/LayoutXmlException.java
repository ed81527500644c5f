package org.folio.layoutxml.util;

import javax.xml.stream.Location;
import javax.xml.stream.XMLStreamException;

public class LayoutXmlException extends RuntimeException {

  public enum ErrorType {
    SOURCE_UNAVAILABLE,
    ALLOCATION_FAILURE,
    PARSER_INIT_FAILURE,
    READ_FAILURE,
    SYNTAX_ERROR,
    FINALIZE_ERROR
  }

  private final ErrorType errorType;

  private final int line;

  private final int column;

  private final int offset;

  public LayoutXmlException(ErrorType errorType, String msg) {
    this(errorType, msg, null);
  }

  public LayoutXmlException(ErrorType errorType, String msg, Throwable cause) {
    super(msg, cause);
    this.errorType = errorType;
    this.line = -1;
    this.column = -1;
    this.offset = -1;
  }

  /**
   * Wrap parser exception, keeping its location.
   * @param errorType classification
   * @param e parser exception
   */
  public LayoutXmlException(ErrorType errorType, XMLStreamException e) {
    super(e.getMessage(), e);
    this.errorType = errorType;
    Location location = e.getLocation();
    if (location == null) {
      line = -1;
      column = -1;
      offset = -1;
    } else {
      line = location.getLineNumber();
      column = location.getColumnNumber();
      offset = location.getCharacterOffset();
    }
  }

  public ErrorType getErrorType() {
    return errorType;
  }

  /**
   * Line of error.
   * @return line number (1-based); -1 if unknown
   */
  public int getLine() {
    return line;
  }

  /**
   * Column of error.
   * @return column number; -1 if unknown
   */
  public int getColumn() {
    return column;
  }

  /**
   * Byte offset of error.
   * @return offset from start of input; -1 if unknown
   */
  public int getOffset() {
    return offset;
  }
}
