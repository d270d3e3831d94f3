package org.exprengine.exceptions;

import lombok.Getter;

/**
 * 变量下标不在状态向量或符号表的有效范围内。
 */
@Getter
public class OutOfRangeException extends IndexOutOfBoundsException {

    private final int index;
    private final int size;

    public OutOfRangeException(String where, int index, int size) {
        super(where + ": 下标 " + index + " 超出范围 [0, " + size + ")");
        this.index = index;
        this.size = size;
    }
}
