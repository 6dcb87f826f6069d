package com.farmbot.celeryscript.core.normalize;

/**
 * Falla estructural de un nodo durante la normalización.
 * {@link #path()} indica dónde se detectó, p.ej. {@code $.body[1].args.node}.
 */
public abstract class AstException extends RuntimeException {
    private final String path;

    protected AstException(String path, String message) {
        super(message + " (at " + path + ")");
        this.path = path;
    }

    protected AstException(String path, String message, Throwable cause) {
        super(message + " (at " + path + ")", cause);
        this.path = path;
    }

    public String path() { return path; }
}
