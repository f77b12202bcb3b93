package com.gateway.generator.codegen.path;

import com.gateway.generator.codegen.exception.GenerationException;

import lombok.NonNull;
import lombok.Value;

/**
 * Output addressing settings. A module prefix is only valid together with
 * {@link AddressingMode#IMPORT}; instances that violate this cannot be created.
 */
@Value
public class PathConfig {

    public static final PathConfig DEFAULT = new PathConfig(AddressingMode.IMPORT, "");

    @NonNull
    AddressingMode addressingMode;

    /**
     * Module path stripped from import paths; empty when unset.
     */
    @NonNull
    String modulePrefix;

    private PathConfig(AddressingMode addressingMode, String modulePrefix) {
        this.addressingMode = addressingMode;
        this.modulePrefix = modulePrefix;
        requireCompatible();
    }

    public static PathConfig of(AddressingMode addressingMode, String modulePrefix) {
        return new PathConfig(addressingMode, modulePrefix == null ? "" : modulePrefix);
    }

    /**
     * Builds a configuration from the raw {@code paths} and {@code module} flag values.
     */
    public static PathConfig fromFlags(String paths, String module) {
        return of(AddressingMode.fromFlag(paths), module);
    }

    public boolean hasModulePrefix() {
        return !modulePrefix.isEmpty();
    }

    void requireCompatible() {
        if (hasModulePrefix() && addressingMode != AddressingMode.IMPORT) {
            throw new GenerationException(GenerationException.Reason.CONFIGURATION_CONFLICT,
                    "cannot use module=" + modulePrefix + " with paths=" + addressingMode.getFlag());
        }
    }
}
