package com.gateway.generator.registry;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.gateway.generator.codegen.exception.GenerationException;
import com.gateway.generator.model.Binding;
import com.gateway.generator.model.EnumType;
import com.gateway.generator.model.GoPackage;
import com.gateway.generator.model.MessageType;
import com.gateway.generator.model.Method;
import com.gateway.generator.model.PathParam;
import com.gateway.generator.model.ProtoFile;
import com.gateway.generator.model.Service;
import com.google.api.AnnotationsProto;
import com.google.api.HttpRule;
import com.google.protobuf.DescriptorProtos.DescriptorProto;
import com.google.protobuf.DescriptorProtos.EnumDescriptorProto;
import com.google.protobuf.DescriptorProtos.FieldDescriptorProto;
import com.google.protobuf.DescriptorProtos.FileDescriptorProto;
import com.google.protobuf.DescriptorProtos.FileDescriptorSet;
import com.google.protobuf.DescriptorProtos.MethodDescriptorProto;
import com.google.protobuf.DescriptorProtos.ServiceDescriptorProto;
import com.google.protobuf.ExtensionRegistry;

import lombok.Value;

/**
 * Builds a {@link DescriptorRegistry} from a serialized FileDescriptorSet, as
 * written by {@code protoc --include_imports --descriptor_set_out=<file>}.
 */
public class DescriptorSetLoader {

    private static final Logger log = LoggerFactory.getLogger(DescriptorSetLoader.class);

    private final Map<String, String> goPackageOverrides;
    private final boolean omitPackageDoc;

    private final Map<String, DeclaredMessage> messages = new HashMap<>();
    private final Map<String, EnumType> enums = new HashMap<>();

    /**
     * @param goPackageOverrides proto file name to Go import path, taking
     *                           precedence over the file's go_package option
     * @param omitPackageDoc     value reported by the registry for generated files
     */
    public DescriptorSetLoader(Map<String, String> goPackageOverrides, boolean omitPackageDoc) {
        this.goPackageOverrides = Map.copyOf(goPackageOverrides);
        this.omitPackageDoc = omitPackageDoc;
    }

    public DescriptorRegistry load(Path descriptorSet) throws IOException {
        log.debug("Reading descriptor set {}", descriptorSet);
        try (InputStream in = Files.newInputStream(descriptorSet)) {
            ExtensionRegistry extensions = ExtensionRegistry.newInstance();
            AnnotationsProto.registerAllExtensions(extensions);
            return load(FileDescriptorSet.parseFrom(in, extensions));
        }
    }

    public DescriptorRegistry load(FileDescriptorSet set) {
        messages.clear();
        enums.clear();

        Map<String, GoPackage> packages = new HashMap<>();
        for (FileDescriptorProto file : set.getFileList()) {
            GoPackage goPackage = goPackageOf(file);
            packages.put(file.getName(), goPackage);
            String scope = file.getPackage().isEmpty() ? "" : "." + file.getPackage();
            for (DescriptorProto message : file.getMessageTypeList()) {
                indexMessage(scope, message, file.getName(), goPackage);
            }
            for (EnumDescriptorProto enumType : file.getEnumTypeList()) {
                indexEnum(scope, enumType, file.getName(), goPackage);
            }
        }

        InMemoryDescriptorRegistry.InMemoryDescriptorRegistryBuilder registry = InMemoryDescriptorRegistry.builder()
                .omitPackageDoc(omitPackageDoc)
                .enumTypes(enums.values());
        for (FileDescriptorProto file : set.getFileList()) {
            ProtoFile.ProtoFileBuilder builder = ProtoFile.builder()
                    .name(file.getName())
                    .goPackage(packages.get(file.getName()));
            for (ServiceDescriptorProto service : file.getServiceList()) {
                builder.service(toService(file, service));
            }
            registry.file(builder.build());
        }
        log.debug("Loaded {} files, {} messages, {} enums", set.getFileCount(), messages.size(), enums.size());
        return registry.build();
    }

    private GoPackage goPackageOf(FileDescriptorProto file) {
        String override = goPackageOverrides.get(file.getName());
        if (override != null) {
            return GoPackage.parse(override);
        }
        if (file.getOptions().hasGoPackage()) {
            return GoPackage.parse(file.getOptions().getGoPackage());
        }
        String name = file.getPackage().isEmpty()
                ? baseNameWithoutExtension(file.getName())
                : file.getPackage().replace('.', '_');
        return GoPackage.of("", name);
    }

    private void indexMessage(String scope, DescriptorProto message, String fileName, GoPackage goPackage) {
        String fullName = scope + "." + message.getName();
        messages.put(fullName, new DeclaredMessage(message, MessageType.builder()
                .fullName(fullName)
                .fileName(fileName)
                .goPackage(goPackage)
                .build()));
        for (DescriptorProto nested : message.getNestedTypeList()) {
            indexMessage(fullName, nested, fileName, goPackage);
        }
        for (EnumDescriptorProto nested : message.getEnumTypeList()) {
            indexEnum(fullName, nested, fileName, goPackage);
        }
    }

    private void indexEnum(String scope, EnumDescriptorProto enumType, String fileName, GoPackage goPackage) {
        String fullName = scope + "." + enumType.getName();
        enums.put(fullName, EnumType.builder()
                .fullName(fullName)
                .fileName(fileName)
                .goPackage(goPackage)
                .build());
    }

    private Service toService(FileDescriptorProto file, ServiceDescriptorProto service) {
        Service.ServiceBuilder builder = Service.builder().name(service.getName());
        for (MethodDescriptorProto method : service.getMethodList()) {
            DeclaredMessage request = message(file, method.getInputType());
            // resolved only to report a response type missing from the set
            message(file, method.getOutputType());
            Method.MethodBuilder methodBuilder = Method.builder()
                    .name(method.getName())
                    .requestType(request.getType());
            if (method.getOptions().hasExtension(AnnotationsProto.http)) {
                HttpRule rule = method.getOptions().getExtension(AnnotationsProto.http);
                methodBuilder.binding(toBinding(file, method, request, rule, 0));
                List<HttpRule> additional = rule.getAdditionalBindingsList();
                for (int i = 0; i < additional.size(); i++) {
                    methodBuilder.binding(toBinding(file, method, request, additional.get(i), i + 1));
                }
            }
            builder.method(methodBuilder.build());
        }
        return builder.build();
    }

    private Binding toBinding(FileDescriptorProto file, MethodDescriptorProto method, DeclaredMessage request,
                              HttpRule rule, int index) {
        String verb;
        String template;
        switch (rule.getPatternCase()) {
            case GET -> { verb = "GET"; template = rule.getGet(); }
            case PUT -> { verb = "PUT"; template = rule.getPut(); }
            case POST -> { verb = "POST"; template = rule.getPost(); }
            case DELETE -> { verb = "DELETE"; template = rule.getDelete(); }
            case PATCH -> { verb = "PATCH"; template = rule.getPatch(); }
            case CUSTOM -> { verb = rule.getCustom().getKind(); template = rule.getCustom().getPath(); }
            default -> throw new GenerationException(GenerationException.Reason.INVALID_DESCRIPTOR, file.getName(),
                    "no HTTP pattern specified for method " + method.getName());
        }
        Binding.BindingBuilder builder = Binding.builder()
                .index(index)
                .httpMethod(verb)
                .pathTemplate(template)
                .body(rule.getBody());
        for (String fieldPath : PathTemplateParser.variables(template)) {
            builder.pathParam(PathParam.builder()
                    .fieldPath(fieldPath)
                    .targetTypeName(resolveLeafType(file, request, fieldPath))
                    .build());
        }
        return builder.build();
    }

    /**
     * Walks {@code a.b.c} through nested message fields and returns the
     * type name of the final field, or an empty string for scalars.
     */
    private String resolveLeafType(FileDescriptorProto file, DeclaredMessage request, String fieldPath) {
        DeclaredMessage current = request;
        String[] segments = fieldPath.split("\\.");
        for (int i = 0; i < segments.length; i++) {
            FieldDescriptorProto field = findField(current.getDescriptor(), segments[i]);
            if (field == null) {
                throw new GenerationException(GenerationException.Reason.INVALID_DESCRIPTOR, file.getName(),
                        "no field " + segments[i] + " in message " + current.getType().getFullName());
            }
            if (i == segments.length - 1) {
                return field.getTypeName();
            }
            if (field.getType() != FieldDescriptorProto.Type.TYPE_MESSAGE) {
                throw new GenerationException(GenerationException.Reason.INVALID_DESCRIPTOR, file.getName(),
                        "field " + segments[i] + " of " + current.getType().getFullName() + " is not a message");
            }
            current = message(file, field.getTypeName());
        }
        return "";
    }

    private DeclaredMessage message(FileDescriptorProto file, String typeName) {
        DeclaredMessage message = messages.get(typeName);
        if (message == null) {
            throw new GenerationException(GenerationException.Reason.INVALID_DESCRIPTOR, file.getName(),
                    "unknown message type " + typeName + " (was the set written with --include_imports?)");
        }
        return message;
    }

    private static FieldDescriptorProto findField(DescriptorProto message, String name) {
        for (FieldDescriptorProto field : message.getFieldList()) {
            if (field.getName().equals(name)) {
                return field;
            }
        }
        return null;
    }

    private static String baseNameWithoutExtension(String fileName) {
        String base = fileName.substring(fileName.lastIndexOf('/') + 1);
        int dot = base.lastIndexOf('.');
        return (dot < 0 ? base : base.substring(0, dot)).replace('.', '_').replace('-', '_');
    }

    @Value
    private static class DeclaredMessage {
        DescriptorProto descriptor;
        MessageType type;
    }
}
