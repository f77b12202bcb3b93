package com.gateway.generator.codegen;

import java.util.ArrayList;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.gateway.generator.codegen.exception.GenerationException;
import com.gateway.generator.codegen.format.SourceFormatter;
import com.gateway.generator.codegen.imports.ImportCollector;
import com.gateway.generator.codegen.model.output.GeneratedFile;
import com.gateway.generator.codegen.path.PathResolver;
import com.gateway.generator.codegen.render.RenderRequest;
import com.gateway.generator.codegen.render.TemplateRenderer;
import com.gateway.generator.model.ProtoFile;
import com.gateway.generator.model.Service;
import com.gateway.generator.registry.DescriptorRegistry;

import lombok.NonNull;

/**
 * Generates {@code .pb.gw.go} gateway files for a batch of proto files.
 *
 * Files are processed strictly in order. A file without any HTTP-bound method
 * is skipped; any other failure aborts the whole batch and nothing is returned.
 */
public class GatewayGenerator {
    private static final Logger log = LoggerFactory.getLogger(GatewayGenerator.class);

    private final DescriptorRegistry registry;
    private final GeneratorConfig config;
    private final TemplateRenderer renderer;
    private final SourceFormatter formatter;
    private final ImportCollector importCollector;
    private final PathResolver pathResolver;

    public GatewayGenerator(@NonNull DescriptorRegistry registry, @NonNull GeneratorConfig config,
                            @NonNull TemplateRenderer renderer, @NonNull SourceFormatter formatter) {
        this.registry = registry;
        this.config = config;
        this.renderer = renderer;
        this.formatter = formatter;
        this.importCollector = new ImportCollector(registry, config.getBaseImports(), config.isStandalone());
        this.pathResolver = new PathResolver(config.getPathConfig());
    }

    /**
     * Generates gateway files for {@code targets}.
     *
     * @return one file per target that declares at least one HTTP binding, in input order
     * @throws GenerationException on the first rendering, syntax or path failure
     */
    public List<GeneratedFile> generate(List<ProtoFile> targets) {
        List<GeneratedFile> files = new ArrayList<>();
        for (ProtoFile file : targets) {
            log.debug("Processing {}", file.getName());

            if (!hasTargetService(file)) {
                log.info("{}: no target service defined in the file", file.getName());
                continue;
            }

            String code = renderer.render(renderRequest(file));

            String formatted;
            try {
                formatted = formatter.format(code);
            } catch (GenerationException e) {
                log.error("{}: {}", file.getName(), e.getMessage());
                throw new GenerationException(GenerationException.Reason.INVALID_SYNTAX, file.getName(),
                        e.getMessage(), e);
            }

            String name;
            try {
                name = pathResolver.resolveOutputName(file);
            } catch (GenerationException e) {
                log.error("{}: {}", e.getMessage(), code);
                throw new GenerationException(e.getReason(), file.getName(),
                        e.getMessage() + System.lineSeparator() + code, e);
            }

            files.add(GeneratedFile.builder()
                    .goPackage(file.getGoPackage())
                    .name(name)
                    .content(formatted)
                    .build());
        }
        return files;
    }

    private RenderRequest renderRequest(ProtoFile file) {
        return RenderRequest.builder()
                .file(file)
                .imports(importCollector.collect(file))
                .useRequestContext(config.isUseRequestContext())
                .registerFuncSuffix(config.getRegisterFuncSuffix())
                .allowPatchFeature(config.isAllowPatchFeature())
                .omitPackageDoc(registry.isOmitPackageDoc())
                .standalone(config.isStandalone())
                .build();
    }

    static boolean hasTargetService(ProtoFile file) {
        return file.getServices().stream().anyMatch(Service::hasBindings);
    }
}
