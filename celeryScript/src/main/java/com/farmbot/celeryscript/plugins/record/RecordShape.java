package com.farmbot.celeryscript.plugins.record;

import com.farmbot.celeryscript.core.spi.NodeReadException;
import com.farmbot.celeryscript.core.spi.NodeReader;
import com.farmbot.celeryscript.core.spi.NodeShape;

import java.lang.reflect.InvocationTargetException;
import java.lang.reflect.RecordComponent;

/**
 * Cualquier {@code record} con componentes {@code kind} y {@code args}.
 * El match es por nombre de componente, no por tipo: no hace falta implementar nada.
 * {@code body} es opcional; si el record no lo declara se toma como ausente.
 */
public class RecordShape implements NodeShape {

    @Override public boolean supports(Object raw) {
        if (raw == null || !raw.getClass().isRecord()) return false;
        return component(raw, "kind") != null || component(raw, "args") != null;
    }

    @Override public NodeReader reader(Object raw) {
        return NodeReader.of(read(raw, "kind"), read(raw, "args"), read(raw, "body"));
    }

    private static Object read(Object raw, String name) {
        RecordComponent rc = component(raw, name);
        if (rc == null) return null;
        try {
            var accessor = rc.getAccessor();
            accessor.setAccessible(true);   // records anidados/no públicos
            return accessor.invoke(raw);
        } catch (IllegalAccessException | InvocationTargetException | RuntimeException e) {
            throw new NodeReadException("cannot read record component '" + name + "' of "
                    + raw.getClass().getName(), e);
        }
    }

    private static RecordComponent component(Object raw, String name) {
        for (RecordComponent rc : raw.getClass().getRecordComponents()) {
            if (rc.getName().equals(name)) return rc;
        }
        return null;
    }
}
