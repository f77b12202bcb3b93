package com.gateway.generator.registry;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import com.gateway.generator.codegen.exception.GenerationException;
import com.gateway.generator.model.Binding;
import com.gateway.generator.model.GoPackage;
import com.gateway.generator.model.Method;
import com.gateway.generator.model.PathParam;
import com.gateway.generator.model.ProtoFile;
import com.google.api.AnnotationsProto;
import com.google.api.HttpRule;
import com.google.protobuf.DescriptorProtos.FileDescriptorProto;
import com.google.protobuf.DescriptorProtos.FileDescriptorSet;
import com.google.protobuf.DescriptorProtos.MethodDescriptorProto;
import com.google.protobuf.DescriptorProtos.MethodOptions;

import static com.gateway.generator.registry.DescriptorSetFixtures.*;
import static org.assertj.core.api.Assertions.*;

/**
 * Unit tests for DescriptorSetLoader.
 */
class DescriptorSetLoaderTest {

    @TempDir
    Path tempDir;

    private final DescriptorSetLoader loader = new DescriptorSetLoader(Map.of(), false);

    @Test
    void testLoadsFilesWithGoPackages() {
        DescriptorRegistry registry = loader.load(bookstoreSet());

        assertThat(registry.getFiles()).extracting(ProtoFile::getName)
                .containsExactly(TYPES_PROTO, SVC_PROTO, GRPC_ONLY_PROTO);
        ProtoFile types = registry.lookupFile(TYPES_PROTO).orElseThrow();
        assertThat(types.getGoPackage().getPath()).isEqualTo("example.com/types");
        assertThat(types.getGoPackage().getName()).isEqualTo("types");
        ProtoFile grpcOnly = registry.lookupFile(GRPC_ONLY_PROTO).orElseThrow();
        assertThat(grpcOnly.getGoPackage().getPath()).isEmpty();
        assertThat(grpcOnly.getGoPackage().getName()).isEqualTo("example_grpc");
    }

    @Test
    void testBindingsAndPathParams() {
        ProtoFile svc = loader.load(bookstoreSet()).lookupFile(SVC_PROTO).orElseThrow();

        Method get = svc.getServices().get(0).getMethods().get(0);
        assertThat(get.getRequestType().getFullName()).isEqualTo(".example.foo.GetRequest");
        assertThat(get.getRequestType().getGoPackage()).isEqualTo(GoPackage.of("example.com/foo/bar"));
        assertThat(get.getBindings()).extracting(Binding::getHttpMethod).containsExactly("GET", "POST");
        assertThat(get.getBindings()).extracting(Binding::getIndex).containsExactly(0, 1);

        Binding primary = get.getBindings().get(0);
        assertThat(primary.getPathTemplate()).isEqualTo("/v1/{name}/{ref.kind}");
        assertThat(primary.getPathParams()).extracting(PathParam::getFieldPath).containsExactly("name", "ref.kind");
        assertThat(primary.getPathParams()).extracting(PathParam::getTargetTypeName)
                .containsExactly("", ".example.types.Kind");
        assertThat(get.getBindings().get(1).getBody()).isEqualTo("*");

        Method ping = svc.getServices().get(0).getMethods().get(1);
        assertThat(ping.hasBindings()).isFalse();
    }

    @Test
    void testEnumsAreRegistered() {
        DescriptorRegistry registry = loader.load(bookstoreSet());

        assertThat(registry.lookupEnum("", ".example.types.Kind"))
                .hasValueSatisfying(e -> assertThat(e.getGoPackage().getPath()).isEqualTo("example.com/types"));
    }

    @Test
    void testGoPackageOverrideWins() {
        DescriptorSetLoader overriding = new DescriptorSetLoader(
                Map.of(SVC_PROTO, "example.com/override;ovr"), true);

        DescriptorRegistry registry = overriding.load(bookstoreSet());

        ProtoFile svc = registry.lookupFile(SVC_PROTO).orElseThrow();
        assertThat(svc.getGoPackage().getPath()).isEqualTo("example.com/override");
        assertThat(svc.getGoPackage().getName()).isEqualTo("ovr");
        assertThat(registry.isOmitPackageDoc()).isTrue();
    }

    @Test
    void testLoadsFromSerializedFile() throws Exception {
        Path file = tempDir.resolve("set.pb");
        Files.write(file, bookstoreSet().toByteArray());

        DescriptorRegistry registry = loader.load(file);

        Method get = registry.lookupFile(SVC_PROTO).orElseThrow().getServices().get(0).getMethods().get(0);
        assertThat(get.getBindings()).hasSize(2);
    }

    @Test
    void testUnknownPathFieldIsInvalidDescriptor() {
        FileDescriptorProto broken = serviceFile().toBuilder()
                .setService(0, serviceFile().getService(0).toBuilder()
                        .setMethod(0, MethodDescriptorProto.newBuilder()
                                .setName("Get")
                                .setInputType(".example.foo.GetRequest")
                                .setOutputType(".example.foo.GetResponse")
                                .setOptions(MethodOptions.newBuilder().setExtension(AnnotationsProto.http,
                                        HttpRule.newBuilder().setGet("/v1/{missing}").build()))))
                .build();
        FileDescriptorSet set = FileDescriptorSet.newBuilder().addFile(typesFile()).addFile(broken).build();

        assertThatThrownBy(() -> loader.load(set))
                .isInstanceOf(GenerationException.class)
                .hasMessageContaining("no field missing in message .example.foo.GetRequest")
                .extracting(e -> ((GenerationException) e).getReason())
                .isEqualTo(GenerationException.Reason.INVALID_DESCRIPTOR);
    }

    @Test
    void testMissingImportedMessageIsReported() {
        FileDescriptorSet set = FileDescriptorSet.newBuilder().addFile(serviceFile()).build();

        assertThatThrownBy(() -> loader.load(set))
                .isInstanceOf(GenerationException.class)
                .hasMessageContaining(".example.types.Ref");
    }
}
