package com.gateway.generator.codegen.imports;

import java.util.List;
import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.gateway.generator.model.Binding;
import com.gateway.generator.model.EnumType;
import com.gateway.generator.model.GoPackage;
import com.gateway.generator.model.Method;
import com.gateway.generator.model.PathParam;
import com.gateway.generator.model.ProtoFile;
import com.gateway.generator.model.Service;
import com.gateway.generator.registry.DescriptorRegistry;

/**
 * Computes the packages a generated gateway file must import.
 *
 * The result starts with the base imports, then (in standalone mode) the
 * file's own package, then per method in declaration order: packages of enum
 * path parameters, followed by the request message package for methods that
 * have at least one binding. The file's own package is never added otherwise.
 */
public class ImportCollector {

    private static final Logger log = LoggerFactory.getLogger(ImportCollector.class);

    private final DescriptorRegistry registry;
    private final List<GoPackage> baseImports;
    private final boolean standalone;

    public ImportCollector(DescriptorRegistry registry, List<GoPackage> baseImports, boolean standalone) {
        this.registry = registry;
        this.baseImports = List.copyOf(baseImports);
        this.standalone = standalone;
    }

    public List<GoPackage> collect(ProtoFile file) {
        ImportSet imports = new ImportSet();
        for (GoPackage pkg : baseImports) {
            imports.add(pkg);
        }
        if (standalone) {
            imports.add(file.getGoPackage());
        }

        for (Service service : file.getServices()) {
            for (Method method : service.getMethods()) {
                addEnumPathParamImports(file, method, imports);
                if (!method.hasBindings()) {
                    continue;
                }
                addUnlessOwnPackage(file, method.getRequestType().getGoPackage(), imports);
            }
        }
        return imports.toList();
    }

    private void addEnumPathParamImports(ProtoFile file, Method method, ImportSet imports) {
        for (Binding binding : method.getBindings()) {
            for (PathParam param : binding.getPathParams()) {
                Optional<EnumType> enumType = registry.lookupEnum("", param.getTargetTypeName());
                if (enumType.isEmpty()) {
                    continue;
                }
                if (addUnlessOwnPackage(file, enumType.get().getGoPackage(), imports)) {
                    log.debug("{}: importing {} for enum path parameter {}",
                            file.getName(), enumType.get().getGoPackage().getPath(), param.getFieldPath());
                }
            }
        }
    }

    private static boolean addUnlessOwnPackage(ProtoFile file, GoPackage pkg, ImportSet imports) {
        if (pkg.equals(file.getGoPackage())) {
            return false;
        }
        return imports.add(pkg);
    }
}
