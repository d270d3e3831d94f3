package org.exprengine.exceptions;

import lombok.Getter;

/**
 * 二元除法的除数求值为 0。
 * 复合赋值 /= 不会抛出此异常。
 */
@Getter
public class DivisionByZeroException extends ArithmeticException {

    private final double dividend;

    public DivisionByZeroException(double dividend) {
        super("division by zero");
        this.dividend = dividend;
    }
}
