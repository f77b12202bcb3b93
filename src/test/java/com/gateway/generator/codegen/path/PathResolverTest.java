package com.gateway.generator.codegen.path;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import com.gateway.generator.codegen.exception.GenerationException;
import com.gateway.generator.model.GoPackage;
import com.gateway.generator.model.ProtoFile;

import static com.gateway.generator.model.Descriptors.simpleFile;
import static org.assertj.core.api.Assertions.*;

/**
 * Unit tests for PathResolver.
 */
class PathResolverTest {

    private static ProtoFile fileIn(String pkgPath, String name) {
        return simpleFile(name, GoPackage.of(pkgPath));
    }

    @Test
    void testImportModeJoinsPackagePathAndBaseName() {
        PathResolver resolver = new PathResolver(PathConfig.DEFAULT);

        assertThat(resolver.resolve(fileIn("example.com/foo/bar", "svc.proto")))
                .isEqualTo("example.com/foo/bar/svc.proto");
        assertThat(resolver.resolve(fileIn("example.com/foo/bar", "protos/deep/svc.proto")))
                .isEqualTo("example.com/foo/bar/svc.proto");
    }

    @Test
    void testImportModeWithEmptyPackagePathKeepsFileName() {
        PathResolver resolver = new PathResolver(PathConfig.DEFAULT);

        assertThat(resolver.resolve(fileIn("", "protos/svc.proto"))).isEqualTo("protos/svc.proto");
    }

    @Test
    void testSourceRelativeKeepsFileName() {
        PathResolver resolver = new PathResolver(PathConfig.of(AddressingMode.SOURCE_RELATIVE, ""));

        assertThat(resolver.resolve(fileIn("example.com/foo/bar", "svc.proto"))).isEqualTo("svc.proto");
        assertThat(resolver.resolveOutputName(fileIn("example.com/foo/bar", "a/b/svc.proto")))
                .isEqualTo("a/b/svc.pb.gw.go");
    }

    @Test
    void testModulePrefixIsStripped() {
        PathResolver resolver = new PathResolver(PathConfig.of(AddressingMode.IMPORT, "example.com/foo"));
        ProtoFile file = fileIn("example.com/foo/bar", "bar/svc.proto");

        assertThat(resolver.resolve(file)).isEqualTo("bar/svc.proto");
        assertThat(resolver.resolveOutputName(file)).isEqualTo("bar/svc.pb.gw.go");
    }

    @Test
    void testModulePrefixEqualToPackagePathYieldsBaseName() {
        PathResolver resolver = new PathResolver(PathConfig.of(AddressingMode.IMPORT, "example.com/foo"));

        assertThat(resolver.resolve(fileIn("example.com/foo", "protos/svc.proto"))).isEqualTo("svc.proto");
    }

    @Test
    void testModulePrefixMustMatchWholePathElements() {
        PathResolver resolver = new PathResolver(PathConfig.of(AddressingMode.IMPORT, "example.com/foo"));

        assertThatThrownBy(() -> resolver.resolve(fileIn("example.com/foobar/baz", "svc.proto")))
                .isInstanceOf(GenerationException.class)
                .hasMessageContaining("example.com/foobar/baz")
                .hasMessageContaining("example.com/foo/")
                .extracting(e -> ((GenerationException) e).getReason())
                .isEqualTo(GenerationException.Reason.PREFIX_MISMATCH);
    }

    @Test
    void testModulePrefixWithEmptyPackagePathFails() {
        PathResolver resolver = new PathResolver(PathConfig.of(AddressingMode.IMPORT, "example.com/foo"));

        assertThatThrownBy(() -> resolver.resolve(fileIn("", "svc.proto")))
                .isInstanceOf(GenerationException.class)
                .hasMessageContaining("does not match module prefix");
    }

    @ParameterizedTest
    @CsvSource({
        "example.com/foo/bar, svc.proto,          import,          example.com/foo/bar/svc.pb.gw.go",
        "example.com/foo/bar, svc.proto,          source_relative, svc.pb.gw.go",
        "example.com/foo/bar, v1/svc.v1.proto,    import,          example.com/foo/bar/svc.v1.pb.gw.go",
        "'',                  v1/svc,             import,          v1/svc.pb.gw.go",
        "example.com/x,       dir.d/svc,          source_relative, dir.d/svc.pb.gw.go"
    })
    void testOutputName(String pkgPath, String fileName, String paths, String expected) {
        PathResolver resolver = new PathResolver(PathConfig.fromFlags(paths, ""));

        assertThat(resolver.resolveOutputName(fileIn(pkgPath, fileName))).isEqualTo(expected);
    }

    @Test
    void testResolveIsDeterministic() {
        PathResolver resolver = new PathResolver(PathConfig.of(AddressingMode.IMPORT, "example.com/foo"));
        ProtoFile file = fileIn("example.com/foo/bar", "bar/svc.proto");

        assertThat(resolver.resolveOutputName(file)).isEqualTo(resolver.resolveOutputName(file));
    }
}
