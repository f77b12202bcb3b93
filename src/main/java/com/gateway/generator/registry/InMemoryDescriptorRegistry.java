package com.gateway.generator.registry;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import com.gateway.generator.model.EnumType;
import com.gateway.generator.model.ProtoFile;

import lombok.Builder;
import lombok.Singular;

/**
 * Map-backed registry. Enum names are stored without the leading dot.
 */
public class InMemoryDescriptorRegistry implements DescriptorRegistry {

    private final Map<String, ProtoFile> files = new LinkedHashMap<>();
    private final Map<String, EnumType> enums = new LinkedHashMap<>();
    private final boolean omitPackageDoc;

    @Builder
    private InMemoryDescriptorRegistry(@Singular List<ProtoFile> files,
                                       @Singular List<EnumType> enumTypes,
                                       boolean omitPackageDoc) {
        for (ProtoFile file : files) {
            this.files.put(file.getName(), file);
        }
        for (EnumType enumType : enumTypes) {
            this.enums.put(stripLeadingDot(enumType.getFullName()), enumType);
        }
        this.omitPackageDoc = omitPackageDoc;
    }

    @Override
    public Optional<EnumType> lookupEnum(String location, String name) {
        if (name == null || name.isEmpty()) {
            return Optional.empty();
        }
        if (name.startsWith(".") || location == null || location.isEmpty()) {
            return Optional.ofNullable(enums.get(stripLeadingDot(name)));
        }
        // innermost scope first: a.b.c, a.b, a, then the root
        String scope = location;
        while (!scope.isEmpty()) {
            EnumType found = enums.get(scope + "." + name);
            if (found != null) {
                return Optional.of(found);
            }
            int dot = scope.lastIndexOf('.');
            scope = dot < 0 ? "" : scope.substring(0, dot);
        }
        return Optional.ofNullable(enums.get(name));
    }

    @Override
    public Optional<ProtoFile> lookupFile(String name) {
        return Optional.ofNullable(files.get(name));
    }

    @Override
    public List<ProtoFile> getFiles() {
        return new ArrayList<>(files.values());
    }

    @Override
    public boolean isOmitPackageDoc() {
        return omitPackageDoc;
    }

    private static String stripLeadingDot(String name) {
        return name.startsWith(".") ? name.substring(1) : name;
    }
}
