package org.folio.layoutxml.util;

import javax.xml.stream.XMLStreamException;
import org.folio.layoutxml.util.LayoutXmlException.ErrorType;
import org.junit.Test;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.greaterThan;
import static org.hamcrest.Matchers.is;
import static org.hamcrest.Matchers.sameInstance;

public class LayoutXmlExceptionTest {

  @Test
  public void withoutLocation() {
    LayoutXmlException e = new LayoutXmlException(ErrorType.READ_FAILURE, "gone");
    assertThat(e.getErrorType(), is(ErrorType.READ_FAILURE));
    assertThat(e.getMessage(), is("gone"));
    assertThat(e.getLine(), is(-1));
    assertThat(e.getColumn(), is(-1));
    assertThat(e.getOffset(), is(-1));
  }

  @Test
  public void fromStreamException() {
    XMLStreamException cause = new XMLStreamException("bad");
    LayoutXmlException e = new LayoutXmlException(ErrorType.SYNTAX_ERROR, cause);
    assertThat(e.getCause(), is(sameInstance(cause)));
    assertThat(e.getMessage(), is("bad"));
    assertThat(e.getLine(), is(-1));
  }

  @Test
  public void fromParser() {
    try {
      new LayoutXmlParser().parseTree(LayoutXmlFeederTest.bytes("<a>\n<b></c></a>"));
    } catch (LayoutXmlException e) {
      assertThat(e.getErrorType(), is(ErrorType.SYNTAX_ERROR));
      assertThat(e.getLine(), greaterThan(0));
      return;
    }
    throw new AssertionError("no exception");
  }
}
