package com.gateway.generator.codegen.format;

/**
 * Validates and normalizes generated source text.
 */
@FunctionalInterface
public interface SourceFormatter {

    /**
     * @return the normalized source
     * @throws com.gateway.generator.codegen.exception.GenerationException with reason
     *         {@code INVALID_SYNTAX}; the message contains {@code raw} verbatim
     */
    String format(String raw);
}
