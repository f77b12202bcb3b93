package com.gateway.generator.model;

import java.util.List;

import lombok.Builder;
import lombok.NonNull;
import lombok.Singular;
import lombok.Value;

@Value
@Builder(toBuilder = true)
public class Service {

    @NonNull
    String name;

    @Singular
    List<Method> methods;

    /**
     * Whether at least one method carries an HTTP binding.
     */
    public boolean hasBindings() {
        return methods.stream().anyMatch(Method::hasBindings);
    }
}
