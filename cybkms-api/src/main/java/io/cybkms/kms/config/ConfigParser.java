/*
 * Copyright CybKMS Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.cybkms.kms.config;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;

import com.fasterxml.jackson.annotation.JsonAutoDetect.Visibility;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.PropertyAccessor;
import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.cfg.ConstructorDetector;
import com.fasterxml.jackson.databind.exc.ValueInstantiationException;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import com.fasterxml.jackson.datatype.jdk8.Jdk8Module;
import com.fasterxml.jackson.module.paramnames.ParameterNamesModule;

import edu.umd.cs.findbugs.annotations.NonNull;

/**
 * Parses YAML configuration documents into configuration records.
 * @param <T> the configuration type
 */
public class ConfigParser<T> {

    private static final ObjectMapper MAPPER = createObjectMapper();

    private final Class<T> configType;

    public ConfigParser(@NonNull Class<T> configType) {
        this.configType = configType;
    }

    public T parseConfiguration(String configuration) {
        try {
            return MAPPER.readValue(configuration, configType);
        }
        catch (ValueInstantiationException e) {
            throw illegalConfiguration(e);
        }
        catch (IOException e) {
            throw new IllegalArgumentException("Couldn't parse configuration", e);
        }
    }

    public T parseConfiguration(InputStream configuration) {
        try {
            return MAPPER.readValue(configuration, configType);
        }
        catch (ValueInstantiationException e) {
            throw illegalConfiguration(e);
        }
        catch (IOException e) {
            throw new IllegalArgumentException("Couldn't parse configuration", e);
        }
    }

    public T parseConfiguration(Path configFile) {
        try (InputStream stream = Files.newInputStream(configFile)) {
            return parseConfiguration(stream);
        }
        catch (IOException e) {
            throw new IllegalArgumentException("Couldn't read configuration file " + configFile, e);
        }
    }

    public String toYaml(T configuration) {
        try {
            return MAPPER.writeValueAsString(configuration);
        }
        catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Failed to encode configuration as YAML", e);
        }
    }

    private static RuntimeException illegalConfiguration(ValueInstantiationException e) {
        if (e.getCause() instanceof IllegalConfigurationException ice) {
            return ice;
        }
        return new IllegalArgumentException("Couldn't parse configuration", e);
    }

    /**
     * A strict object mapper for configuration: unknown properties and duplicate keys are errors.
     * @return object mapper
     */
    public static ObjectMapper createObjectMapper() {
        return new ObjectMapper(new YAMLFactory())
                .registerModule(new ParameterNamesModule())
                .registerModule(new Jdk8Module())
                .setVisibility(PropertyAccessor.ALL, Visibility.NONE)
                .setVisibility(PropertyAccessor.FIELD, Visibility.ANY)
                .setVisibility(PropertyAccessor.CREATOR, Visibility.ANY)
                .setConstructorDetector(ConstructorDetector.USE_PROPERTIES_BASED)
                .enable(SerializationFeature.FAIL_ON_EMPTY_BEANS)
                .enable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
                .enable(JsonParser.Feature.STRICT_DUPLICATE_DETECTION)
                .setSerializationInclusion(JsonInclude.Include.NON_NULL);
    }
}
