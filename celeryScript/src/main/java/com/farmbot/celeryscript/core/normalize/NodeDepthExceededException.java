package com.farmbot.celeryscript.core.normalize;

/** Anidamiento mayor que {@code maxDepth}. También corta la entrada cíclica. */
public class NodeDepthExceededException extends MalformedNodeException {
    private final int maxDepth;

    public NodeDepthExceededException(String path, int maxDepth) {
        super(path, "node nesting exceeds maxDepth=" + maxDepth);
        this.maxDepth = maxDepth;
    }

    public int maxDepth() { return maxDepth; }
}
