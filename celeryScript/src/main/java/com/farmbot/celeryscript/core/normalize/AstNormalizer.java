package com.farmbot.celeryscript.core.normalize;

import com.farmbot.celeryscript.config.NormalizerConfig;
import com.farmbot.celeryscript.core.model.AstNode;
import com.farmbot.celeryscript.core.model.Atom;
import com.farmbot.celeryscript.core.runtime.ShapeRegistry;
import com.farmbot.celeryscript.core.spi.NodeReadException;
import com.farmbot.celeryscript.core.spi.NodeReader;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.*;

/**
 * Convierte nodos crudos (Map con claves de texto, Map con claves {@link Atom},
 * records con kind/args, o un {@link AstNode}) en un árbol {@link AstNode} uniforme.
 *
 * <p>Sin estado mutable: una instancia se puede compartir entre hilos.
 * Cada llamada devuelve un árbol nuevo. Los errores se propagan como
 * {@link AstException}; nunca se devuelve un árbol parcial.
 */
public class AstNormalizer {
    private static final Logger log = LoggerFactory.getLogger(AstNormalizer.class);

    private final ShapeRegistry shapes;
    private final int maxDepth;

    public AstNormalizer() {
        this(ShapeRegistry.builtIn(), NormalizerConfig.defaults());
    }

    public AstNormalizer(NormalizerConfig cfg) {
        this(ShapeRegistry.builtIn(), cfg);
    }

    public AstNormalizer(ShapeRegistry shapes, NormalizerConfig cfg) {
        this.shapes = Objects.requireNonNull(shapes, "shapes");
        this.maxDepth = Objects.requireNonNull(cfg, "cfg").maxDepth();
        log.debug("normalizer ready: shapes={} maxDepth={}", shapes.shapes().size(), maxDepth);
    }

    public AstNode normalize(Object raw) {
        return normalize(raw, "$", 1);
    }

    /**
     * Mismo criterio que usa la normalización para decidir si un valor de args es un nodo:
     * tiene que traer kind y args. Un valor de args como {@code {"kind": "k"}} (sin args)
     * queda opaco, tal cual vino; en la raíz o en body ese mismo map sí se normaliza.
     */
    public boolean isNode(Object value) {
        return isNode(value, "$");
    }

    private AstNode normalize(Object raw, String path, int depth) {
        if (depth > maxDepth) throw reject(new NodeDepthExceededException(path, maxDepth));

        NodeReader r = readerFor(raw, path);
        if (r == null)
            throw reject(new UnrecognizedNodeShapeException(path, "unrecognized node shape: " + describe(raw)));

        String kind = kind(r.kind(), path);
        Map<Atom, Object> args = args(r.args(), path, depth);
        List<AstNode> body = body(r.body(), path, depth);

        AstNode.Builder b = AstNode.builder(kind);
        args.forEach(b::arg);
        body.forEach(b::child);
        return b.build();
    }

    private String kind(Object kind, String path) {
        if (kind instanceof String s) return s;
        if (kind instanceof Atom a) return a.name();
        if (kind == null) throw reject(new UnrecognizedNodeShapeException(path, "node has no kind"));
        throw reject(new UnrecognizedNodeShapeException(path, "kind must be text or atom, got " + describe(kind)));
    }

    private Map<Atom, Object> args(Object args, String path, int depth) {
        if (args == null) return Map.of();
        if (!(args instanceof Map<?, ?> in))
            throw reject(new MalformedNodeException(path + ".args", "args must be a map, got " + describe(args)));

        Map<Atom, Object> out = new LinkedHashMap<>(Math.max(4, in.size() * 2));
        for (var en : in.entrySet()) {
            Atom key = Atom.canonical(en.getKey());
            if (key == null)
                throw reject(new MalformedNodeException(path + ".args",
                        "arg key must be text or atom, got " + describe(en.getKey())));
            if (out.containsKey(key))
                throw reject(new MalformedNodeException(path + ".args", "duplicate arg key " + key));

            String valuePath = path + ".args." + key.name();
            Object v = en.getValue();
            out.put(key, isNode(v, valuePath) ? normalize(v, valuePath, depth + 1) : v);
        }
        return out;
    }

    private List<AstNode> body(Object body, String path, int depth) {
        if (body == null) return List.of();
        if (!(body instanceof List<?> in))
            throw reject(new MalformedNodeException(path + ".body", "body must be a list, got " + describe(body)));

        List<AstNode> out = new ArrayList<>(in.size());
        int i = 0;
        for (Object child : in) {
            out.add(normalize(child, path + ".body[" + i + "]", depth + 1));
            i++;
        }
        return out;
    }

    private NodeReader readerFor(Object raw, String path) {
        try {
            return shapes.readerFor(raw);
        } catch (NodeReadException e) {
            throw reject(new MalformedNodeException(path, e.getMessage(), e));
        }
    }

    private boolean isNode(Object value, String path) {
        try {
            return shapes.isNode(value);
        } catch (NodeReadException e) {
            throw reject(new MalformedNodeException(path, e.getMessage(), e));
        }
    }

    private static <E extends AstException> E reject(E e) {
        log.debug("rejected node at {}: {}", e.path(), e.getMessage());
        return e;
    }

    private static String describe(Object o) {
        return o == null ? "null" : o.getClass().getName();
    }
}
