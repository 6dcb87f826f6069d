// core/runtime/ShapeRegistry.java
package com.farmbot.celeryscript.core.runtime;
import com.farmbot.celeryscript.core.spi.NodeReader;
import com.farmbot.celeryscript.core.spi.NodeShape;
import com.farmbot.celeryscript.plugins.map.AtomKeyedMapShape;
import com.farmbot.celeryscript.plugins.map.StringKeyedMapShape;
import com.farmbot.celeryscript.plugins.record.RecordShape;
import java.util.List;

/** Despacho de formas crudas: la primera que soporta el valor gana. */
public class ShapeRegistry {
  private final List<NodeShape> shapes;
  public ShapeRegistry(List<NodeShape> ns){ this.shapes = List.copyOf(ns); }

  public static ShapeRegistry builtIn() {
    return new ShapeRegistry(List.of(
        new CanonicalShape(),
        new StringKeyedMapShape(),
        new AtomKeyedMapShape(),
        new RecordShape()));
  }

  /** @return lector para el valor, o null si ninguna forma lo reconoce */
  public NodeReader readerFor(Object raw){
    for (var s : shapes)
      if (s.supports(raw)) return s.reader(raw);
    return null;
  }

  /**
   * ¿El valor es un nodo? Hace falta que alguna forma lo reconozca y que traiga
   * tanto kind como args. Se usa para decidir si un valor de args se normaliza.
   */
  public boolean isNode(Object value){
    NodeReader r = readerFor(value);
    return r != null && r.kind() != null && r.args() != null;
  }

  public List<NodeShape> shapes(){ return shapes; }
}
