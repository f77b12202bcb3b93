package com.gateway.generator.codegen.render;

import java.util.ArrayList;
import java.util.List;

import com.gateway.generator.model.GoPackage;
import com.gateway.generator.model.MessageType;
import com.gateway.generator.model.ProtoFile;

import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

/**
 * Everything the template needs to render one gateway file.
 */
@Value
@Builder(toBuilder = true)
public class RenderRequest {

    @NonNull
    ProtoFile file;

    /**
     * Ordered, duplicate-free imports.
     */
    @NonNull
    List<GoPackage> imports;

    boolean useRequestContext;

    @NonNull
    @Builder.Default
    String registerFuncSuffix = "";

    boolean allowPatchFeature;

    boolean omitPackageDoc;

    /**
     * The gateway lives in its own package and refers to the file's package by alias.
     */
    boolean standalone;

    /**
     * Package clause of the generated file. In standalone mode the gateway
     * gets its own package, named after the file's package with a {@code gw} suffix.
     */
    public String getPackageName() {
        String name = file.getGoPackage().getName();
        return standalone ? name + "gw" : name;
    }

    /**
     * Import specs in Go syntax, e.g. {@code "net/http"} or {@code extFoo "example.com/foo"}.
     */
    public List<String> getImportLines() {
        List<String> lines = new ArrayList<>();
        for (GoPackage pkg : imports) {
            String alias = referenced(pkg).getAlias();
            lines.add(alias.isEmpty() ? quote(pkg.getPath()) : alias + " " + quote(pkg.getPath()));
        }
        return lines;
    }

    /**
     * Go expression naming {@code type} from inside the generated file.
     */
    public String typeName(MessageType type) {
        return qualified(type.getGoPackage(), type.getSimpleName());
    }

    /**
     * Go expression naming an identifier generated by protoc-gen-go-grpc for the
     * file's services, such as {@code EchoServer} or {@code NewEchoClient}.
     */
    public String serviceTypeName(String identifier) {
        return qualified(file.getGoPackage(), identifier);
    }

    private String qualified(GoPackage pkg, String identifier) {
        if (pkg.equals(file.getGoPackage()) && !standalone) {
            return identifier;
        }
        return referenced(pkg).getReferenceName() + "." + identifier;
    }

    // the file's own package is imported as ext<Name> in standalone mode unless it already has an alias
    private GoPackage referenced(GoPackage pkg) {
        if (!standalone || !pkg.getAlias().isEmpty() || !pkg.equals(file.getGoPackage())) {
            return pkg;
        }
        String name = pkg.getName();
        String alias = name.isEmpty() ? "ext" : "ext" + Character.toUpperCase(name.charAt(0)) + name.substring(1);
        return pkg.toBuilder().alias(alias).build();
    }

    private static String quote(String path) {
        return "\"" + path + "\"";
    }
}
