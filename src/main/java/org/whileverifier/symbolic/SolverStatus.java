package org.whileverifier.symbolic;

public enum SolverStatus {
    SATISFIABLE,
    UNSATISFIABLE,
    UNKNOWN
}
