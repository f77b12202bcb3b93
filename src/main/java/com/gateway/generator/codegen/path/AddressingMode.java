package com.gateway.generator.codegen.path;

import com.gateway.generator.codegen.exception.GenerationException;

/**
 * How output file paths are derived from input files.
 */
public enum AddressingMode {

    /**
     * Output goes under the Go import path of the file's package.
     */
    IMPORT("import"),

    /**
     * Output goes next to the input .proto file.
     */
    SOURCE_RELATIVE("source_relative");

    private final String flag;

    AddressingMode(String flag) {
        this.flag = flag;
    }

    public String getFlag() {
        return flag;
    }

    /**
     * Parses the {@code paths} flag. An empty value selects {@link #IMPORT}.
     *
     * @throws GenerationException for any other unrecognized value
     */
    public static AddressingMode fromFlag(String value) {
        if (value == null || value.isEmpty()) {
            return IMPORT;
        }
        for (AddressingMode mode : values()) {
            if (mode.flag.equals(value)) {
                return mode;
            }
        }
        throw new GenerationException(GenerationException.Reason.UNKNOWN_ADDRESSING_MODE,
                String.format("Unknown path type \"%s\": want \"import\" or \"source_relative\".", value));
    }
}
