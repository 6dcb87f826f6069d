package com.farmbot.celeryscript.plugins.map;

import com.farmbot.celeryscript.core.model.Atom;

import java.util.List;

/** {@code {"kind": ..., "args": {...}, "body": [...]}}, p.ej. lo que sale de un JSON. */
public class StringKeyedMapShape extends KeyedMapShape {
    public StringKeyedMapShape() {
        super(List.of("kind", "args", "body"), List.of(Atom.KIND, Atom.ARGS, Atom.BODY));
    }
}
