package com.gateway.generator.codegen.path;

import com.gateway.generator.codegen.exception.GenerationException;
import com.gateway.generator.codegen.util.GoPathUtil;
import com.gateway.generator.model.ProtoFile;

/**
 * Computes where a file's generated companion is written.
 */
public class PathResolver {

    /**
     * Suffix replacing the .proto extension of generated gateway files.
     */
    public static final String GATEWAY_SUFFIX = ".pb.gw.go";

    private final PathConfig config;

    public PathResolver(PathConfig config) {
        this.config = config;
    }

    /**
     * Resolves the output path of {@code file}, still carrying the source extension.
     *
     * @throws GenerationException if the module prefix does not match the file's import path
     */
    public String resolve(ProtoFile file) {
        config.requireCompatible();

        String name = file.getName();
        String pkgPath = file.getGoPackage().getPath();

        if (config.hasModulePrefix()) {
            String trimPath = config.getModulePrefix() + "/";
            String fullPath = pkgPath + "/";
            if (!fullPath.startsWith(trimPath)) {
                throw new GenerationException(GenerationException.Reason.PREFIX_MISMATCH,
                        pkgPath + ": file go path does not match module prefix: " + trimPath);
            }
            return GoPathUtil.join(fullPath.substring(trimPath.length()), GoPathUtil.baseName(name));
        }
        if (config.getAddressingMode() == AddressingMode.IMPORT && !pkgPath.isEmpty()) {
            return pkgPath + "/" + GoPathUtil.baseName(name);
        }
        return name;
    }

    /**
     * Resolves the output path and replaces its extension with {@link #GATEWAY_SUFFIX}.
     */
    public String resolveOutputName(ProtoFile file) {
        return GoPathUtil.stripExtension(resolve(file)) + GATEWAY_SUFFIX;
    }
}
