/*
 * Copyright CybKMS Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.cybkms.kms.service;

import java.util.Objects;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import edu.umd.cs.findbugs.annotations.NonNull;

/**
 * Encodes KMS failures as {@code {"type": <discriminator>, "message": <text>}} and decodes them back.
 * <p>Decoding never throws: an unknown discriminator or a malformed payload becomes an
 * {@link InternalException} describing what was wrong.</p>
 */
public final class KmsErrorCodec {

    private static final Logger LOGGER = LoggerFactory.getLogger(KmsErrorCodec.class);

    private final ObjectMapper mapper;

    /**
     * The wire shape of an error.
     * @param type the discriminator
     * @param message the human readable message
     */
    public record KmsError(@JsonProperty("type") String type,
                           @JsonProperty("message") String message) {}

    public KmsErrorCodec() {
        this(new ObjectMapper());
    }

    public KmsErrorCodec(@NonNull ObjectMapper mapper) {
        this.mapper = Objects.requireNonNull(mapper);
    }

    /**
     * @param exception the failure
     * @return the wire form of the failure
     */
    @NonNull
    public KmsError toError(@NonNull KmsException exception) {
        var type = exception.errorType();
        var message = type == KmsErrorType.THROTTLING ? ThrottlingException.MESSAGE : exception.getMessage();
        return new KmsError(type.discriminator(), message == null ? "" : message);
    }

    /**
     * @param exception the failure
     * @return the JSON encoding of the failure
     */
    @NonNull
    public String encode(@NonNull KmsException exception) {
        try {
            return mapper.writeValueAsString(toError(exception));
        }
        catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to encode " + exception.errorType(), e);
        }
    }

    /**
     * Maps a wire error to the matching exception.
     * @param error the wire error
     * @return the exception, {@link InternalException} when the type is not recognised.
     */
    @NonNull
    public KmsException fromError(@NonNull KmsError error) {
        return KmsErrorType.fromDiscriminator(error.type())
                .map(type -> type.newException(error.message()))
                .orElseGet(() -> new InternalException("Unknown error type: " + error.type()));
    }

    /**
     * Decodes the JSON encoding of an error.
     * @param json the encoded error
     * @return the decoded exception, never null
     */
    @NonNull
    public KmsException decode(String json) {
        if (json == null) {
            return new InternalException("Malformed error payload: null");
        }
        try {
            JsonNode node = mapper.readTree(json);
            if (node == null || !node.isObject() || !node.path("type").isTextual()) {
                return new InternalException("Malformed error payload: missing type");
            }
            var message = node.path("message");
            return fromError(new KmsError(node.get("type").asText(), message.isTextual() ? message.asText() : ""));
        }
        catch (JsonProcessingException e) {
            LOGGER.debug("Failed to parse error payload", e);
            return new InternalException("Malformed error payload: " + e.getOriginalMessage());
        }
    }
}
