package com.farmbot.celeryscript.plugins.map;

import com.farmbot.celeryscript.core.spi.NodeReadException;
import com.farmbot.celeryscript.core.spi.NodeReader;
import com.farmbot.celeryscript.core.spi.NodeShape;

import java.util.List;
import java.util.Map;

/**
 * Base de las formas Map: misma lógica, distinta representación de las claves.
 * Las claves se comparan por equals recorriendo el keySet, así un TreeMap con
 * claves de otro tipo no lanza ClassCastException en containsKey.
 */
abstract class KeyedMapShape implements NodeShape {
    private final List<Object> own;       // kind, args, body
    private final List<Object> foreign;   // los mismos campos en la otra convención

    KeyedMapShape(List<Object> own, List<Object> foreign) {
        this.own = List.copyOf(own);
        this.foreign = List.copyOf(foreign);
    }

    /** El kind decide la convención; sin kind en ninguna, alcanza con args. */
    @Override public boolean supports(Object raw) {
        if (!(raw instanceof Map<?, ?> m)) return false;
        if (hasKey(m, own.get(0))) return true;
        return !hasKey(m, foreign.get(0)) && hasKey(m, own.get(1));
    }

    @Override public NodeReader reader(Object raw) {
        Map<?, ?> m = (Map<?, ?>) raw;
        for (Object k : foreign) {
            if (hasKey(m, k))
                throw new NodeReadException("map mixes string and atom keys (found " + k + " next to " + own.get(0) + ")");
        }
        return NodeReader.of(get(m, own.get(0)), get(m, own.get(1)), get(m, own.get(2)));
    }

    private static Object get(Map<?, ?> m, Object key) {
        return hasKey(m, key) ? m.get(key) : null;
    }

    private static boolean hasKey(Map<?, ?> m, Object key) {
        for (Object k : m.keySet()) {
            if (key.equals(k)) return true;
        }
        return false;
    }
}
