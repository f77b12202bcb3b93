package com.gateway.generator.model;

import java.util.List;

import lombok.Builder;
import lombok.NonNull;
import lombok.Singular;
import lombok.Value;

/**
 * One HTTP route bound to an RPC method.
 */
@Value
@Builder(toBuilder = true)
public class Binding {

    /**
     * Position among the method's bindings, 0 for the primary rule.
     */
    int index;

    /**
     * HTTP verb in upper case, e.g. {@code GET} or a custom verb.
     */
    @NonNull
    String httpMethod;

    @NonNull
    String pathTemplate;

    /**
     * Body selector: empty for no body, {@code *} for the whole request, or a field name.
     */
    @NonNull
    @Builder.Default
    String body = "";

    @Singular
    List<PathParam> pathParams;

    public boolean hasBody() {
        return !body.isEmpty();
    }
}
