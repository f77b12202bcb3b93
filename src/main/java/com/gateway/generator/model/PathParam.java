package com.gateway.generator.model;

import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

/**
 * A variable captured from a binding's path template.
 */
@Value
@Builder(toBuilder = true)
public class PathParam {

    /**
     * Dotted field path inside the request message, e.g. {@code shelf.name}.
     */
    @NonNull
    String fieldPath;

    /**
     * Fully-qualified type name of the target field; empty for scalar fields.
     */
    @NonNull
    @Builder.Default
    String targetTypeName = "";
}
