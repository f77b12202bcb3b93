package com.gateway.generator.integration;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import com.gateway.generator.cli.GenerateCommand;
import com.gateway.generator.registry.DescriptorSetFixtures;

import picocli.CommandLine;

import static org.assertj.core.api.Assertions.*;

/**
 * Integration tests for the complete generation process, from descriptor set
 * to files on disk.
 */
class GeneratorIntegrationTest {

    @TempDir
    Path tempDir;

    private Path writeDescriptorSet() throws IOException {
        Path set = tempDir.resolve("bookstore.pb");
        Files.write(set, DescriptorSetFixtures.bookstoreSet().toByteArray());
        return set;
    }

    private int run(String... args) {
        return new CommandLine(new GenerateCommand()).execute(args);
    }

    @Test
    void testGeneratesGatewayForHttpAnnotatedFilesOnly() throws IOException {
        Path set = writeDescriptorSet();
        Path out = tempDir.resolve("out");

        int exitCode = run("-d", set.toString(), "-o", out.toString());

        assertThat(exitCode).isEqualTo(0);
        Path generated = out.resolve("example.com/foo/bar/svc.pb.gw.go");
        assertThat(generated).exists();
        assertThat(out.resolve("grpc/only.pb.gw.go")).doesNotExist();
        assertThat(out.resolve("example.com/types/types.pb.gw.go")).doesNotExist();

        String code = Files.readString(generated);
        assertThat(code).startsWith("// Code generated by protoc-gen-grpc-gateway. DO NOT EDIT.\n");
        assertThat(code).contains("package bar\n");
        assertThat(code).contains("\t\"example.com/types\"\n");
        assertThat(code).contains("func RegisterSvcHandlerServer(");
        assertThat(code).contains("pattern_Svc_Get_1 = \"/v1/get\"");
        assertThat(code).endsWith(")\n");
        assertThat(code).doesNotContain("\n\n\n");
    }

    @Test
    void testSourceRelativePaths() throws IOException {
        Path set = writeDescriptorSet();
        Path out = tempDir.resolve("out");

        int exitCode = run("-d", set.toString(), "-o", out.toString(), "--paths=source_relative",
                "-f", DescriptorSetFixtures.SVC_PROTO);

        assertThat(exitCode).isEqualTo(0);
        assertThat(out.resolve("foo/bar/svc.pb.gw.go")).exists();
    }

    @Test
    void testModulePrefix() throws IOException {
        Path set = writeDescriptorSet();
        Path out = tempDir.resolve("out");

        int exitCode = run("-d", set.toString(), "-o", out.toString(), "--module=example.com/foo");

        assertThat(exitCode).isEqualTo(0);
        assertThat(out.resolve("bar/svc.pb.gw.go")).exists();
    }

    @Test
    void testPrefixMismatchWritesNothing() throws IOException {
        Path set = writeDescriptorSet();
        Path out = tempDir.resolve("out");

        int exitCode = run("-d", set.toString(), "-o", out.toString(), "--module=example.com/other");

        assertThat(exitCode).isEqualTo(1);
        assertThat(out).doesNotExist();
    }

    @Test
    void testConflictingPathOptionsFailBeforeLoading() {
        int exitCode = run("-d", tempDir.resolve("missing.pb").toString(),
                "--paths=source_relative", "--module=example.com/foo");

        assertThat(exitCode).isEqualTo(1);
    }

    @Test
    void testUnknownTargetFileFails() throws IOException {
        Path set = writeDescriptorSet();

        int exitCode = run("-d", set.toString(), "-o", tempDir.resolve("out").toString(), "-f", "nope.proto");

        assertThat(exitCode).isEqualTo(1);
    }

    @Test
    void testStandaloneAndOverrides() throws IOException {
        Path set = writeDescriptorSet();
        Path out = tempDir.resolve("out");

        int exitCode = run("-d", set.toString(), "-o", out.toString(), "--standalone", "--omit-package-doc",
                "-M" + DescriptorSetFixtures.SVC_PROTO + "=example.com/gw/bar;bar");

        assertThat(exitCode).isEqualTo(0);
        String code = Files.readString(out.resolve("example.com/gw/bar/svc.pb.gw.go"));
        assertThat(code).contains("extBar \"example.com/gw/bar\"");
        assertThat(code).contains("var protoReq extBar.GetRequest");
        assertThat(code).contains("\npackage bargw\n");
        assertThat(code).doesNotContain("\npackage bar\n");
        assertThat(code).contains("server extBar.SvcServer) error {");
        assertThat(code).contains("extBar.NewSvcClient(conn)");
        assertThat(code).doesNotContain("is a reverse proxy");
    }
}
