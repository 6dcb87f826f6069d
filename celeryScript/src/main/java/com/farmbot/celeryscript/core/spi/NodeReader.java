// core/spi/NodeReader.java
package com.farmbot.celeryscript.core.spi;

/**
 * Vista uniforme de un nodo crudo, sin importar cómo nombre sus campos.
 * Cada método devuelve {@code null} si el campo no está presente.
 */
public interface NodeReader {
  Object kind();
  Object args();
  /** Las formas sin campo body (p.ej. records de dos componentes) devuelven null. */
  Object body();

  static NodeReader of(Object kind, Object args, Object body) {
    return new Snapshot(kind, args, body);
  }

  record Snapshot(Object kind, Object args, Object body) implements NodeReader {}
}
