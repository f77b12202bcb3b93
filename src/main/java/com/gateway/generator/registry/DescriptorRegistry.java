package com.gateway.generator.registry;

import java.util.List;
import java.util.Optional;

import com.gateway.generator.model.EnumType;
import com.gateway.generator.model.ProtoFile;

/**
 * Read-only view over the parsed descriptor graph.
 */
public interface DescriptorRegistry {

    /**
     * Resolves an enum type name as seen from {@code location}, a protobuf
     * package scope. An empty location means the name is fully qualified.
     *
     * @return the enum, or empty when no enum is reachable under that name
     */
    Optional<EnumType> lookupEnum(String location, String name);

    Optional<ProtoFile> lookupFile(String name);

    /**
     * All files known to the registry, in load order.
     */
    List<ProtoFile> getFiles();

    /**
     * Whether generated files should omit the package documentation comment.
     */
    boolean isOmitPackageDoc();
}
