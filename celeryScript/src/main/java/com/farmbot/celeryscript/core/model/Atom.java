package com.farmbot.celeryscript.core.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Objects;

/**
 * Clave simbólica de los args de un nodo (equivalente a un átomo/símbolo).
 * Dos átomos con el mismo nombre son iguales; el orden es el del nombre.
 */
public final class Atom implements Comparable<Atom> {
    public static final Atom KIND = new Atom("kind");
    public static final Atom ARGS = new Atom("args");
    public static final Atom BODY = new Atom("body");

    private final String name;

    private Atom(String name) {
        this.name = name;
    }

    @JsonCreator
    public static Atom of(String name) {
        return new Atom(Objects.requireNonNull(name, "name"));
    }

    /**
     * Convierte una clave cruda a su forma canónica.
     * Idempotente: un {@code Atom} se devuelve tal cual.
     *
     * @return el átomo, o {@code null} si la clave no es textual ni un átomo
     */
    public static Atom canonical(Object key) {
        if (key instanceof Atom a) return a;
        if (key instanceof String s) return of(s);
        return null;
    }

    @JsonValue
    public String name() { return name; }

    @Override
    public int compareTo(Atom o) {
        return name.compareTo(o.name);
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof Atom a && name.equals(a.name);
    }

    @Override
    public int hashCode() { return name.hashCode(); }

    @Override
    public String toString() { return ":" + name; }
}
