package org.exprengine.expressions;

import lombok.Getter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;

/**
 * 二元运算节点：left op right，op 为 PLUS、MINUS、MUL 或 DIV。
 */
@Getter
public final class Binary implements Expression {

    private static final Logger logger = LoggerFactory.getLogger(Binary.class);

    private final OperationType operation;
    private final Expression left;
    private final Expression right;

    private final int hashCode;

    public Binary(OperationType operation, Expression left, Expression right) {
        Objects.requireNonNull(operation, "Binary-构造函数: operation 不能为 null");
        Objects.requireNonNull(left, "Binary-构造函数: left 不能为 null");
        Objects.requireNonNull(right, "Binary-构造函数: right 不能为 null");
        if (!operation.isBinary()) {
            logger.error("Binary-构造函数: {} 不是二元运算", operation);
            throw new IllegalArgumentException("二元运算不支持 " + operation + "，赋值请使用 Assign");
        }
        this.operation = operation;
        this.left = left;
        this.right = right;
        this.hashCode = Objects.hash(operation, left, right);
        logger.debug("创建 Binary: {} ({}, {})", operation, left.getClass().getSimpleName(), right.getClass().getSimpleName());
    }

    @Override
    public <R> R accept(ExpressionVisitor<R> visitor) {
        return visitor.visitBinary(this);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        Binary binary = (Binary) o;
        return operation == binary.operation
                && left.equals(binary.left)
                && right.equals(binary.right);
    }

    @Override
    public int hashCode() {
        return hashCode;
    }

    @Override
    public String toString() {
        return "Binary(" + operation + ", " + left + ", " + right + ")";
    }
}
