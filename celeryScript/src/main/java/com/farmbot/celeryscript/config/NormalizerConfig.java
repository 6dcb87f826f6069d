package com.farmbot.celeryscript.config;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;

@JsonIgnoreProperties(ignoreUnknown = true)
public class NormalizerConfig {
    private static final Logger log = LoggerFactory.getLogger(NormalizerConfig.class);

    public static final String CLASSPATH_RESOURCE = "/celeryscript.yaml";
    public static final int DEFAULT_MAX_DEPTH = 256;

    public NormalizerSettings normalizer = new NormalizerSettings();

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class NormalizerSettings {
        /** Profundidad máxima de anidamiento (raíz = 1). Corta también la entrada cíclica. */
        public int maxDepth = DEFAULT_MAX_DEPTH;
    }

    public int maxDepth() { return normalizer.maxDepth; }

    public static NormalizerConfig defaults() {
        return new NormalizerConfig();
    }

    public static NormalizerConfig load(InputStream yaml) {
        NormalizerConfig cfg;
        try {
            ObjectMapper om = new ObjectMapper(new YAMLFactory());
            cfg = om.readValue(yaml, NormalizerConfig.class);
        } catch (IOException e) {
            throw new IllegalStateException("Error loading normalizer config", e);
        }
        if (cfg == null) cfg = defaults();
        if (cfg.normalizer == null) cfg.normalizer = new NormalizerSettings();
        if (cfg.normalizer.maxDepth < 1)
            throw new IllegalArgumentException("normalizer.maxDepth must be >= 1, got " + cfg.normalizer.maxDepth);
        return cfg;
    }

    /** Lee {@value #CLASSPATH_RESOURCE} si existe; si no, valores por defecto. */
    public static NormalizerConfig fromClasspath() {
        try (InputStream in = NormalizerConfig.class.getResourceAsStream(CLASSPATH_RESOURCE)) {
            if (in == null) {
                log.info("{} not found on classpath, using defaults (maxDepth={})", CLASSPATH_RESOURCE, DEFAULT_MAX_DEPTH);
                return defaults();
            }
            NormalizerConfig cfg = load(in);
            log.info("loaded {} (maxDepth={})", CLASSPATH_RESOURCE, cfg.maxDepth());
            return cfg;
        } catch (IOException e) {
            throw new IllegalStateException("Error reading " + CLASSPATH_RESOURCE, e);
        }
    }
}
