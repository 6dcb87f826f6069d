package com.farmbot.celeryscript.core.model;

import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.*;

/**
 * Nodo canónico de CeleryScript: {@code kind}, {@code args} y {@code body}.
 * Inmutable; sólo lo construye el normalizador (o su builder).
 */
@JsonPropertyOrder({"kind", "args", "body"})
public final class AstNode {
    private final String kind;              // nombre del comando, tal cual vino
    private final Map<Atom, Object> args;   // claves canónicas; valores escalares o AstNode
    private final List<AstNode> body;       // hijos en orden, nunca null

    private AstNode(String kind, Map<Atom, Object> args, List<AstNode> body) {
        this.kind = Objects.requireNonNull(kind, "kind");
        // LinkedHashMap y no Map.copyOf: los args admiten valores null
        this.args = (args == null) ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(args));
        this.body = (body == null) ? List.of() : List.copyOf(body);
    }

    public String kind() { return kind; }
    public Map<Atom, Object> args() { return args; }
    public List<AstNode> body() { return body; }

    /** Atajo para {@code args().get(Atom.of(name))}. */
    public Object arg(String name) { return args.get(Atom.of(name)); }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof AstNode n)) return false;
        return kind.equals(n.kind) && args.equals(n.args) && body.equals(n.body);
    }

    @Override
    public int hashCode() { return Objects.hash(kind, args, body); }

    @Override
    public String toString() {
        return "AstNode{kind=" + kind + ", args=" + args + ", body=" + body + "}";
    }

    // --- builder ---
    public static Builder builder(String kind) { return new Builder().kind(kind); }
    public static final class Builder {
        private String kind;
        private final Map<Atom, Object> args = new LinkedHashMap<>();
        private final List<AstNode> body = new ArrayList<>();

        public Builder kind(String k){ this.kind = k; return this; }
        public Builder arg(Atom k, Object v){ this.args.put(k, v); return this; }
        public Builder arg(String k, Object v){ return arg(Atom.of(k), v); }
        public Builder child(AstNode n){ this.body.add(Objects.requireNonNull(n, "child")); return this; }

        public AstNode build() {
            return new AstNode(kind, args, body);
        }
    }
}
