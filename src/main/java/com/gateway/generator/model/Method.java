package com.gateway.generator.model;

import java.util.List;

import lombok.Builder;
import lombok.NonNull;
import lombok.Singular;
import lombok.Value;

/**
 * An RPC method together with its HTTP route bindings.
 */
@Value
@Builder(toBuilder = true)
public class Method {

    @NonNull
    String name;

    /**
     * Request message; may be declared in a different file than the service.
     */
    @NonNull
    MessageType requestType;

    /**
     * HTTP bindings in declaration order; empty when the method is not exposed.
     */
    @Singular
    List<Binding> bindings;

    public boolean hasBindings() {
        return !bindings.isEmpty();
    }
}
