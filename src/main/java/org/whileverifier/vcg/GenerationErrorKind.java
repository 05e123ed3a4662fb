package org.whileverifier.vcg;

public enum GenerationErrorKind {
    MISSING_INVARIANT,
    DIVISION_BY_ZERO,
    MALFORMED_EXPRESSION
}
