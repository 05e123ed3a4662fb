package org.whileverifier.vcg;

import lombok.Getter;
import org.whileverifier.core.SourcePosition;

/**
 * 验证条件无法生成或无法编码。发生在任何求解器调用之前，对本次验证是致命的。
 */
@Getter
public class GenerationException extends RuntimeException {

    private final GenerationErrorKind kind;
    private final SourcePosition position;

    public GenerationException(GenerationErrorKind kind, String message, SourcePosition position) {
        super(message);
        this.kind = kind;
        this.position = position;
    }
}
