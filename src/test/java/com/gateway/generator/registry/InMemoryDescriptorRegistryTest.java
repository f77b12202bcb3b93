package com.gateway.generator.registry;

import org.junit.jupiter.api.Test;

import com.gateway.generator.model.EnumType;

import static com.gateway.generator.model.Descriptors.*;
import static org.assertj.core.api.Assertions.*;

class InMemoryDescriptorRegistryTest {

    private final InMemoryDescriptorRegistry registry = InMemoryDescriptorRegistry.builder()
            .file(simpleFile("a.proto", FOO))
            .file(simpleFile("b.proto", TYPES))
            .enumType(enumType(".example.enums.Kind", ENUMS))
            .enumType(enumType(".example.foo.v1.Kind", FOO))
            .build();

    @Test
    void testLookupFullyQualifiedEnum() {
        assertThat(registry.lookupEnum("", ".example.enums.Kind")).map(EnumType::getGoPackage).contains(ENUMS);
        assertThat(registry.lookupEnum("", "example.enums.Kind")).map(EnumType::getGoPackage).contains(ENUMS);
        assertThat(registry.lookupEnum("anything", ".example.enums.Kind")).map(EnumType::getGoPackage).contains(ENUMS);
    }

    @Test
    void testLookupMissIsEmpty() {
        assertThat(registry.lookupEnum("", ".example.enums.Missing")).isEmpty();
        assertThat(registry.lookupEnum("", "")).isEmpty();
        assertThat(registry.lookupEnum("", null)).isEmpty();
    }

    @Test
    void testRelativeLookupSearchesInnermostScopeFirst() {
        assertThat(registry.lookupEnum("example.foo.v1", "Kind")).map(EnumType::getGoPackage).contains(FOO);
        assertThat(registry.lookupEnum("example.foo.v1.inner", "Kind")).map(EnumType::getGoPackage).contains(FOO);
        assertThat(registry.lookupEnum("example.other", "enums.Kind")).map(EnumType::getGoPackage).contains(ENUMS);
        assertThat(registry.lookupEnum("other", "enums.Kind")).isEmpty();
        assertThat(registry.lookupEnum("example.other", "example.enums.Kind")).map(EnumType::getGoPackage)
                .contains(ENUMS);
    }

    @Test
    void testFilesKeepInsertionOrder() {
        assertThat(registry.getFiles()).extracting("name").containsExactly("a.proto", "b.proto");
        assertThat(registry.lookupFile("b.proto")).isPresent();
        assertThat(registry.lookupFile("c.proto")).isEmpty();
        assertThat(registry.isOmitPackageDoc()).isFalse();
    }
}
