package com.gateway.generator.model;

import java.util.List;

import lombok.Builder;
import lombok.NonNull;
import lombok.Singular;
import lombok.Value;

/**
 * One parsed .proto source unit.
 */
@Value
@Builder(toBuilder = true)
public class ProtoFile {

    /**
     * Path of the file as given to the compiler, e.g. {@code foo/bar/svc.proto}.
     */
    @NonNull
    String name;

    @NonNull
    GoPackage goPackage;

    @Singular
    List<Service> services;
}
