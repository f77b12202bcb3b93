package com.gateway.generator.codegen.imports;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

import com.gateway.generator.model.GoPackage;

/**
 * Insertion-ordered set of Go packages keyed by import path. The first
 * package added for a path wins.
 */
public class ImportSet {

    private final List<GoPackage> packages = new ArrayList<>();
    private final Set<String> seen = new HashSet<>();

    /**
     * @return true if the package was appended, false if its path was already present
     */
    public boolean add(GoPackage pkg) {
        if (!seen.add(pkg.getPath())) {
            return false;
        }
        packages.add(pkg);
        return true;
    }

    public List<GoPackage> toList() {
        return Collections.unmodifiableList(new ArrayList<>(packages));
    }
}
