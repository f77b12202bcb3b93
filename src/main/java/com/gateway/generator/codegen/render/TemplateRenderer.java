package com.gateway.generator.codegen.render;

/**
 * Turns a render request into raw Go source.
 */
@FunctionalInterface
public interface TemplateRenderer {

    /**
     * @throws com.gateway.generator.codegen.exception.GenerationException with reason
     *         {@code RENDERING_FAILED} when the template cannot be applied
     */
    String render(RenderRequest request);
}
