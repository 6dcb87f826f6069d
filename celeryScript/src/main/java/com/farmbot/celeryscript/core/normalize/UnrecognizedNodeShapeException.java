package com.farmbot.celeryscript.core.normalize;

/** Ninguna forma conocida acepta el valor, o la forma aceptada no trae un kind utilizable. */
public class UnrecognizedNodeShapeException extends AstException {
    public UnrecognizedNodeShapeException(String path, String message) {
        super(path, message);
    }
}
