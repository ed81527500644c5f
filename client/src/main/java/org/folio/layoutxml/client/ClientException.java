package org.folio.layoutxml.client;

public class ClientException extends RuntimeException {

  public ClientException(String msg) {
    super(msg);
  }
}
