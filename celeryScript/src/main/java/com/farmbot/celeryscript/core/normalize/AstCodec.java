package com.farmbot.celeryscript.core.normalize;

import com.farmbot.celeryscript.core.model.AstNode;
import com.farmbot.celeryscript.core.model.JsonSupport;

import java.nio.charset.StandardCharsets;
import java.util.Objects;

/**
 * Forma JSON del árbol canónico: {@code {"kind":..,"args":{..},"body":[..]}}.
 * Al leer, el documento pasa por el normalizador, así que el resultado
 * cumple las mismas garantías que {@link AstNormalizer#normalize}.
 * Los valores {@code Atom} se escriben como texto y vuelven como String.
 */
public final class AstCodec {
    private final AstNormalizer normalizer;

    public AstCodec() { this(new AstNormalizer()); }

    public AstCodec(AstNormalizer normalizer) {
        this.normalizer = Objects.requireNonNull(normalizer, "normalizer");
    }

    public byte[] toJson(AstNode node) {
        return JsonSupport.toBytes(Objects.requireNonNull(node, "node"));
    }

    public String toJsonString(AstNode node) {
        return new String(toJson(node), StandardCharsets.UTF_8);
    }

    public AstNode fromJson(byte[] json) {
        return normalizer.normalize(JsonSupport.readRawMap(json));
    }

    public AstNode fromJson(String json) {
        return fromJson(json.getBytes(StandardCharsets.UTF_8));
    }
}
