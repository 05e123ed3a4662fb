package org.whileverifier.statements;

import lombok.Getter;
import org.whileverifier.core.SourcePosition;

@Getter
public final class Skip implements Statement {

    private final SourcePosition position;

    private Skip(SourcePosition position) {
        this.position = position;
    }

    public static Skip of() {
        return new Skip(null);
    }

    public static Skip of(SourcePosition position) {
        return new Skip(position);
    }

    @Override
    public String toString() {
        return "skip";
    }
}
