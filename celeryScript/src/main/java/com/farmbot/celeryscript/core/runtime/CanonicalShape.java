package com.farmbot.celeryscript.core.runtime;

import com.farmbot.celeryscript.core.model.AstNode;
import com.farmbot.celeryscript.core.spi.NodeReader;
import com.farmbot.celeryscript.core.spi.NodeShape;

/** Un AstNode ya normalizado se vuelve a leer como cualquier otra forma. */
public class CanonicalShape implements NodeShape {
  @Override public boolean supports(Object raw) { return raw instanceof AstNode; }

  @Override public NodeReader reader(Object raw) {
    AstNode n = (AstNode) raw;
    return NodeReader.of(n.kind(), n.args(), n.body());
  }
}
