package com.gateway.generator.cli;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.gateway.generator.cli.exception.OptionsValidationException;
import com.gateway.generator.cli.model.GenerateOptions;
import com.gateway.generator.cli.model.ValidatedGenerateOptions;
import com.gateway.generator.cli.output.GenerateResultsPrinter;
import com.gateway.generator.cli.validation.GenerateOptionsValidator;
import com.gateway.generator.codegen.GatewayGenerator;
import com.gateway.generator.codegen.GeneratorConfig;
import com.gateway.generator.codegen.exception.GenerationException;
import com.gateway.generator.codegen.format.GoSourceFormatter;
import com.gateway.generator.codegen.model.output.GeneratedFile;
import com.gateway.generator.codegen.render.FreemarkerTemplateRenderer;
import com.gateway.generator.codegen.util.FileWriteUtil;
import com.gateway.generator.model.ProtoFile;
import com.gateway.generator.registry.DescriptorRegistry;
import com.gateway.generator.registry.DescriptorSetLoader;

import picocli.CommandLine.Command;
import picocli.CommandLine.Mixin;

/**
 * CLI command for generating gRPC gateway reverse-proxy sources.
 */
@Command(
        name = "generate",
        mixinStandardHelpOptions = true,
        version = "grpc-gateway-gen 1.0.0",
        description = "Generates .pb.gw.go HTTP gateway files for the HTTP-annotated services of a protobuf descriptor set."
)
public class GenerateCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(GenerateCommand.class);

    @Mixin
    private GenerateOptions options = new GenerateOptions();

    private final GenerateOptionsValidator validator = new GenerateOptionsValidator();
    private final GenerateResultsPrinter printer = new GenerateResultsPrinter();

    @Override
    public Integer call() {
        ValidatedGenerateOptions validated;
        try {
            validated = validator.validate(options);
        } catch (OptionsValidationException e) {
            printer.printErrors(e.getErrors());
            return 1;
        }
        printer.printBanner(options, validated);

        try {
            DescriptorRegistry registry = new DescriptorSetLoader(validated.getGoPackageOverrides(),
                    options.isOmitPackageDoc()).load(options.getDescriptorSet());
            List<ProtoFile> targets = selectTargets(registry);

            GeneratorConfig config = GeneratorConfig.defaults()
                    .useRequestContext(options.isRequestContext())
                    .registerFuncSuffix(options.getRegisterFuncSuffix())
                    .pathConfig(validated.getPathConfig())
                    .allowPatchFeature(options.isAllowPatchFeature())
                    .standalone(options.isStandalone())
                    .build();

            GatewayGenerator generator = new GatewayGenerator(registry, config,
                    new FreemarkerTemplateRenderer(), new GoSourceFormatter());
            List<GeneratedFile> files = generator.generate(targets);

            List<Path> written = FileWriteUtil.writeAll(validated.getNormalizedOutputDir(), files);
            printer.printSuccess(validated, targets.size(), written);
            return 0;

        } catch (GenerationException e) {
            log.error("Generation failed ({}): {}", e.getReason(), e.getMessage());
            return 1;
        } catch (IOException e) {
            log.error("Generation failed with I/O error", e);
            return 1;
        }
    }

    private List<ProtoFile> selectTargets(DescriptorRegistry registry) {
        if (options.getFiles().isEmpty()) {
            List<ProtoFile> targets = new ArrayList<>();
            for (ProtoFile file : registry.getFiles()) {
                if (!file.getServices().isEmpty()) {
                    targets.add(file);
                }
            }
            return targets;
        }
        List<ProtoFile> targets = new ArrayList<>();
        for (String name : options.getFiles()) {
            ProtoFile file = registry.lookupFile(name.trim())
                    .orElseThrow(() -> new GenerationException(GenerationException.Reason.INVALID_DESCRIPTOR, name,
                            "file is not part of the descriptor set"));
            targets.add(file);
        }
        return targets;
    }
}
