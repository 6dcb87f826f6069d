package com.farmbot.celeryscript.core.normalize;

/** La forma se reconoció pero sus campos no tienen el tipo esperado. */
public class MalformedNodeException extends AstException {
    public MalformedNodeException(String path, String message) {
        super(path, message);
    }

    public MalformedNodeException(String path, String message, Throwable cause) {
        super(path, message, cause);
    }
}
