package com.gateway.generator.registry;

import java.util.ArrayList;
import java.util.List;

import com.gateway.generator.codegen.exception.GenerationException;

/**
 * Extracts the variables of an HTTP rule path template such as
 * {@code /v1/{parent=shelves/*}/books/{book.id}:publish}.
 */
public class PathTemplateParser {

    private PathTemplateParser() {
        // Utility class
    }

    /**
     * Returns the field path of every variable in the template, in order.
     *
     * @throws GenerationException if the template is malformed
     */
    public static List<String> variables(String template) {
        if (template == null || !template.startsWith("/")) {
            throw invalid(template, "path template must start with '/'");
        }
        List<String> fieldPaths = new ArrayList<>();
        int i = 0;
        while (i < template.length()) {
            char c = template.charAt(i);
            if (c == '}') {
                throw invalid(template, "unexpected '}' at " + i);
            }
            if (c != '{') {
                i++;
                continue;
            }
            int close = template.indexOf('}', i + 1);
            if (close < 0) {
                throw invalid(template, "unterminated variable at " + i);
            }
            String variable = template.substring(i + 1, close);
            if (variable.indexOf('{') >= 0) {
                throw invalid(template, "nested variable at " + i);
            }
            int eq = variable.indexOf('=');
            String fieldPath = (eq < 0 ? variable : variable.substring(0, eq)).trim();
            if (!isFieldPath(fieldPath)) {
                throw invalid(template, "invalid field path '" + fieldPath + "'");
            }
            fieldPaths.add(fieldPath);
            i = close + 1;
        }
        return fieldPaths;
    }

    private static boolean isFieldPath(String fieldPath) {
        if (fieldPath.isEmpty()) {
            return false;
        }
        for (String ident : fieldPath.split("\\.", -1)) {
            if (ident.isEmpty() || !Character.isJavaIdentifierStart(ident.charAt(0))) {
                return false;
            }
            for (int k = 1; k < ident.length(); k++) {
                if (!Character.isJavaIdentifierPart(ident.charAt(k))) {
                    return false;
                }
            }
        }
        return true;
    }

    private static GenerationException invalid(String template, String detail) {
        return new GenerationException(GenerationException.Reason.INVALID_DESCRIPTOR,
                "invalid path template " + template + ": " + detail);
    }
}
