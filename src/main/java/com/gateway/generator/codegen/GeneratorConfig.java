package com.gateway.generator.codegen;

import java.util.List;

import com.gateway.generator.codegen.path.PathConfig;
import com.gateway.generator.model.GoPackage;

import lombok.Builder;
import lombok.NonNull;
import lombok.Singular;
import lombok.Value;

/**
 * Configuration for the gateway generator. Fixed for the whole run.
 */
@Value
@Builder(toBuilder = true)
public class GeneratorConfig {

    /**
     * Packages every generated gateway file imports.
     */
    public static final List<GoPackage> DEFAULT_BASE_IMPORTS = List.of(
            GoPackage.of("context"),
            GoPackage.of("errors"),
            GoPackage.of("io"),
            GoPackage.of("net/http"),
            GoPackage.of("github.com/grpc-ecosystem/grpc-gateway/v2/runtime"),
            GoPackage.of("github.com/grpc-ecosystem/grpc-gateway/v2/utilities"),
            GoPackage.of("google.golang.org/protobuf/proto"),
            GoPackage.of("google.golang.org/grpc"),
            GoPackage.of("google.golang.org/grpc/codes"),
            GoPackage.of("google.golang.org/grpc/grpclog"),
            GoPackage.of("google.golang.org/grpc/metadata"),
            GoPackage.of("google.golang.org/grpc/status"));

    @Singular
    List<GoPackage> baseImports;

    /**
     * Use the incoming HTTP request's context instead of the registration context.
     */
    boolean useRequestContext;

    /**
     * Appended to service names in Register* function names.
     */
    @NonNull
    @Builder.Default
    String registerFuncSuffix = "Handler";

    @NonNull
    @Builder.Default
    PathConfig pathConfig = PathConfig.DEFAULT;

    /**
     * Enable field-mask handling for PATCH bindings.
     */
    boolean allowPatchFeature;

    /**
     * Generate into a separate package that imports the file's own package.
     */
    boolean standalone;

    /**
     * Defaults matching protoc-gen-grpc-gateway's own flag defaults.
     */
    public static GeneratorConfigBuilder defaults() {
        return GeneratorConfig.builder()
                .baseImports(DEFAULT_BASE_IMPORTS)
                .useRequestContext(true)
                .allowPatchFeature(true);
    }
}
