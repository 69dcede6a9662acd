package com.dexarena.tournament.json;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import com.fasterxml.jackson.datatype.guava.GuavaModule;
import com.fasterxml.jackson.datatype.jdk8.Jdk8Module;

/**
 * Shared ObjectMapper factory for consistent JSON serialization
 * across storage, configuration and the web layer.
 */
public final class ObjectMapperFactory {

    private ObjectMapperFactory() {
        // Utility class
    }

    /**
     * Creates a pre-configured ObjectMapper with Guava and JDK8 module support.
     *
     * @return a new ObjectMapper instance
     */
    public static ObjectMapper create() {
        return configure(new ObjectMapper());
    }

    /**
     * Same as {@link #create()} but with indented output, for files meant to be read by people.
     */
    public static ObjectMapper createPretty() {
        ObjectMapper mapper = create();
        mapper.enable(SerializationFeature.INDENT_OUTPUT);
        return mapper;
    }

    /**
     * Creates a YAML-reading mapper with the same module support.
     */
    public static ObjectMapper createYaml() {
        return configure(new ObjectMapper(new YAMLFactory()));
    }

    private static ObjectMapper configure(ObjectMapper mapper) {
        mapper.registerModule(new GuavaModule());
        mapper.registerModule(new Jdk8Module());
        return mapper;
    }
}
