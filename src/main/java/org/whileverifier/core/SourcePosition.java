package org.whileverifier.core;

import lombok.Getter;

import java.util.Comparator;
import java.util.Objects;

/**
 * 源程序中的位置信息，由外部解析器填充，仅用于诊断与结果排序。
 * 此类是不可变的。
 */
@Getter
public final class SourcePosition implements Comparable<SourcePosition> {

    private static final Comparator<SourcePosition> ORDER = Comparator
            .comparingInt(SourcePosition::getLine)
            .thenComparingInt(SourcePosition::getColumn)
            .thenComparingInt(SourcePosition::getStartIndex)
            .thenComparingInt(SourcePosition::getLength);

    private final int line;
    private final int column;
    private final int startIndex;
    private final int length;

    private final int hashCode;

    private SourcePosition(int line, int column, int startIndex, int length) {
        if (line < 1 || column < 1) {
            throw new IllegalArgumentException("SourcePosition-构造函数: 行号和列号从 1 开始，收到 " + line + ":" + column);
        }
        if (startIndex < 0 || length < 0) {
            throw new IllegalArgumentException("SourcePosition-构造函数: startIndex 和 length 不能为负数");
        }
        this.line = line;
        this.column = column;
        this.startIndex = startIndex;
        this.length = length;
        this.hashCode = Objects.hash(line, column, startIndex, length);
    }

    public static SourcePosition of(int line, int column, int startIndex, int length) {
        return new SourcePosition(line, column, startIndex, length);
    }

    /**
     * 只知道行列号时使用，startIndex 与 length 记为 0。
     */
    public static SourcePosition of(int line, int column) {
        return new SourcePosition(line, column, 0, 0);
    }

    @Override
    public int compareTo(SourcePosition other) {
        return ORDER.compare(this, other);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        SourcePosition that = (SourcePosition) o;
        return line == that.line && column == that.column
                && startIndex == that.startIndex && length == that.length;
    }

    @Override
    public int hashCode() {
        return hashCode;
    }

    @Override
    public String toString() {
        return "line " + line + ", column " + column;
    }
}
