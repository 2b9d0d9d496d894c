package com.lexis.activation.compiler;

import com.lexis.activation.api.model.ModuleCatalog;
import com.lexis.activation.api.model.VariableDependency;

import java.util.List;

/**
 * Result of loading one catalog file.
 *
 * @param catalog            modules ready for planning
 * @param dependencies       conditional variable declarations for the preprocessor
 * @param invalidRuleModules ids of modules whose rules failed validation
 */
public record CompiledCatalog(
        ModuleCatalog catalog,
        List<VariableDependency> dependencies,
        List<String> invalidRuleModules
) {

    public CompiledCatalog {
        dependencies = dependencies == null ? List.of() : List.copyOf(dependencies);
        invalidRuleModules = invalidRuleModules == null ? List.of() : List.copyOf(invalidRuleModules);
    }
}
