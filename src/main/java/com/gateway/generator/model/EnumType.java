package com.gateway.generator.model;

import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

@Value
@Builder(toBuilder = true)
public class EnumType {

    @NonNull
    String fullName;

    @NonNull
    String fileName;

    @NonNull
    GoPackage goPackage;
}
