// core/spi/NodeShape.java
package com.farmbot.celeryscript.core.spi;

public interface NodeShape {
  /** ¿Esta forma reconoce el valor crudo? (p.ej. un Map con claves de texto) */
  boolean supports(Object raw);
  /**
   * Lector uniforme sobre el valor; sólo se llama si {@link #supports} dio true.
   * @throws NodeReadException si los campos no se pueden leer
   */
  NodeReader reader(Object raw);
}
