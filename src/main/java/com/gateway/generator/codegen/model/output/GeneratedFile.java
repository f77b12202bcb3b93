package com.gateway.generator.codegen.model.output;

import com.gateway.generator.model.GoPackage;

import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

/**
 * A generated gateway file (package + name + contents).
 *
 * Pure structure only.
 */
@Value
@Builder(toBuilder = true)
public class GeneratedFile {

    /**
     * Package of the source file the gateway was generated for.
     */
    @NonNull
    GoPackage goPackage;

    /**
     * Slash-separated output path, e.g. {@code example.com/foo/svc.pb.gw.go}.
     */
    @NonNull
    String name;

    @NonNull
    String content;
}
