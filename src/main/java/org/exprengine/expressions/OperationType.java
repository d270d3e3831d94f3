package org.exprengine.expressions;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.function.DoubleBinaryOperator;

public enum OperationType {

    /**
     * 运算符枚举。ASSIGN 只出现在赋值节点中。
     */
    ASSIGN(null, "<<=", (stored, value) -> value),
    PLUS("+", "+=", (l, r) -> l + r),
    MINUS("-", "-=", (l, r) -> l - r),
    MUL("*", "*=", (l, r) -> l * r),
    DIV("/", "/=", (l, r) -> l / r);

    private static final Logger logger = LoggerFactory.getLogger(OperationType.class);

    private final String symbol;
    private final String assignSymbol;
    private final DoubleBinaryOperator operator;

    OperationType(String symbol, String assignSymbol, DoubleBinaryOperator operator) {
        this.symbol = symbol;
        this.assignSymbol = assignSymbol;
        this.operator = operator;
    }

    /**
     * 二元运算中使用的符号。
     * @throws IllegalStateException 对 ASSIGN 调用。
     */
    public String getSymbol() {
        if (symbol == null) {
            logger.error("{} 没有二元运算符号", this);
            throw new IllegalStateException(this + " 不是二元运算");
        }
        return symbol;
    }

    /**
     * 赋值节点中使用的符号。普通赋值写作 "<<="，避免与相等比较混淆。
     */
    public String getAssignSymbol() {
        return assignSymbol;
    }

    /**
     * 一元运算中使用的前缀。正号不输出任何符号。
     */
    public String getUnarySymbol() {
        return switch (this) {
            case PLUS -> "";
            case MINUS -> "-";
            default -> {
                logger.error("{} 不是一元运算", this);
                throw new IllegalStateException(this + " 不是一元运算");
            }
        };
    }

    public boolean isUnary() {
        return this == PLUS || this == MINUS;
    }

    public boolean isBinary() {
        return this != ASSIGN;
    }

    /**
     * 按原始浮点语义计算 left op right，不做除零检查。
     * 对 ASSIGN 直接返回 right。
     */
    public double apply(double left, double right) {
        return operator.applyAsDouble(left, right);
    }
}
