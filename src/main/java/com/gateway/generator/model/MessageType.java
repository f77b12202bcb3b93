package com.gateway.generator.model;

import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

/**
 * Reference to a message type and the file that declares it.
 */
@Value
@Builder(toBuilder = true)
public class MessageType {

    /**
     * Fully-qualified name with a leading dot, e.g. {@code .example.foo.GetRequest}.
     */
    @NonNull
    String fullName;

    @NonNull
    String fileName;

    /**
     * Go package of the declaring file.
     */
    @NonNull
    GoPackage goPackage;

    /**
     * Simple name, the last segment of the fully-qualified name.
     */
    public String getSimpleName() {
        return fullName.substring(fullName.lastIndexOf('.') + 1);
    }
}
