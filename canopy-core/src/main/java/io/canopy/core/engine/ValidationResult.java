package io.canopy.core.engine;

import java.util.List;

/// Outcome of validating a tree.
///
/// @param errors problems that make the tree unusable, never null
/// @param warnings suspicious but legal shapes, never null
public record ValidationResult(List<String> errors, List<String> warnings) {

    public ValidationResult {
        errors = List.copyOf(errors);
        warnings = List.copyOf(warnings);
    }

    public boolean isValid() {
        return errors.isEmpty();
    }
}
