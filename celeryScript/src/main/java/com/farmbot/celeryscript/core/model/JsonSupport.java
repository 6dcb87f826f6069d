package com.farmbot.celeryscript.core.model;

import com.fasterxml.jackson.annotation.JsonAutoDetect;
import com.fasterxml.jackson.annotation.PropertyAccessor;
import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.*;
import com.fasterxml.jackson.databind.module.SimpleModule;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.Map;

public final class JsonSupport {
    private JsonSupport(){}

    private static final TypeReference<Map<String, Object>> RAW_MAP = new TypeReference<>() {};

    public static final ObjectMapper MAPPER = new ObjectMapper()
            .registerModule(atomModule())
            .setVisibility(PropertyAccessor.FIELD, JsonAutoDetect.Visibility.ANY);

    public static byte[] toBytes(Object o){
        try { return MAPPER.writeValueAsBytes(o); }
        catch (JsonProcessingException e){ throw new UncheckedIOException(e); }
    }

    /** Documento JSON → mapa con claves de texto (forma cruda 1). */
    public static Map<String, Object> readRawMap(byte[] b){
        try { return MAPPER.readValue(b, RAW_MAP); }
        catch (IOException e){ throw new UncheckedIOException(e); }
    }

    // claves Atom como su nombre, sin el ":" de toString()
    private static SimpleModule atomModule() {
        SimpleModule m = new SimpleModule("celeryscript-atom");
        m.addKeySerializer(Atom.class, new JsonSerializer<Atom>() {
            @Override
            public void serialize(Atom value, JsonGenerator gen, SerializerProvider sp) throws IOException {
                gen.writeFieldName(value.name());
            }
        });
        m.addKeyDeserializer(Atom.class, new KeyDeserializer() {
            @Override
            public Object deserializeKey(String key, DeserializationContext ctxt) {
                return Atom.of(key);
            }
        });
        return m;
    }
}
