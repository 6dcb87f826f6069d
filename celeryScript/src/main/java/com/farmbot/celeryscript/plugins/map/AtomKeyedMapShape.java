package com.farmbot.celeryscript.plugins.map;

import com.farmbot.celeryscript.core.model.Atom;

import java.util.List;

/** Igual que {@link StringKeyedMapShape} pero con claves {@link Atom}. */
public class AtomKeyedMapShape extends KeyedMapShape {
    public AtomKeyedMapShape() {
        super(List.of(Atom.KIND, Atom.ARGS, Atom.BODY), List.of("kind", "args", "body"));
    }
}
