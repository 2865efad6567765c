package io.canopy.core.exception;

import java.io.Serial;

/// Raised when a node is wired into a shape that violates the tree model.
///
/// Leaves with children, a child that already belongs to another parent, or an
/// ancestor added below one of its own descendants all end up here. These are
/// configuration mistakes and are reported at the point of misuse, never during a tick.
public class TreeStructureException extends RuntimeException {
    @Serial private static final long serialVersionUID = 7261540998215330417L;

    public TreeStructureException(String message) {
        super(message);
    }
}
