/*
 * Copyright CybKMS Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.cybkms.kms.service;

import java.nio.BufferOverflowException;
import java.nio.BufferUnderflowException;
import java.nio.ByteBuffer;
import java.nio.ReadOnlyBufferException;

import edu.umd.cs.findbugs.annotations.NonNull;

/**
 * ByteBuffer-sympathetic serialization and deserialization of objects.
 * @param <T> The type of the object that can be (de)serialized.
 */
public interface Serde<T> {

    /**
     * Returns the number of bytes required to serialize the given object.
     * @param object The object to be serialized.
     * @return the number of bytes required to serialize the given object.
     */
    int sizeOf(T object);

    /**
     * Serializes the given object to the given buffer.
     * @param object The object to be serialized.
     * @param buffer the buffer to serialize the object to.
     * @throws BufferOverflowException If the buffer has fewer than {@link #sizeOf(Object) sizeOf(object)} bytes remaining.
     * @throws ReadOnlyBufferException If this buffer is read-only.
     */
    void serialize(T object,
                   @NonNull ByteBuffer buffer);

    /**
     * Deserialize an instance of {@code T} from the given buffer.
     * @param buffer The buffer.
     * @return The instance.
     * @throws BufferUnderflowException If the buffer holds too few bytes.
     */
    T deserialize(@NonNull ByteBuffer buffer);

    /**
     * Serializes the given object to a new array of exactly the required size.
     * @param object The object to be serialized.
     * @return the serialized bytes.
     */
    default byte[] toBytes(T object) {
        var buffer = ByteBuffer.allocate(sizeOf(object));
        serialize(object, buffer);
        return buffer.array();
    }
}
