package org.whileverifier.statements;

import org.whileverifier.core.SourcePosition;

/**
 * While 语言的语句。语句树在解析后不可变，验证过程只读取它。
 */
public sealed interface Statement permits Skip, Assignment, Sequence, IfStatement, WhileStatement {

    /**
     * @return 源位置；由程序直接构造的语句可能没有位置，此时返回 null。
     */
    SourcePosition getPosition();
}
