package com.farmbot.celeryscript.core.spi;

/** Una forma reconoció el valor pero no pudo leer sus campos. */
public class NodeReadException extends RuntimeException {
  public NodeReadException(String message) { super(message); }
  public NodeReadException(String message, Throwable cause) { super(message, cause); }
}
