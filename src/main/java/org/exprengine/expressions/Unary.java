package org.exprengine.expressions;

import lombok.Getter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;

/**
 * 一元运算节点，运算只能是 PLUS 或 MINUS。
 */
@Getter
public final class Unary implements Expression {

    private static final Logger logger = LoggerFactory.getLogger(Unary.class);

    private final OperationType operation;
    private final Expression operand;

    private final int hashCode;

    public Unary(OperationType operation, Expression operand) {
        Objects.requireNonNull(operation, "Unary-构造函数: operation 不能为 null");
        Objects.requireNonNull(operand, "Unary-构造函数: operand 不能为 null");
        if (!operation.isUnary()) {
            logger.error("Unary-构造函数: {} 不是一元运算", operation);
            throw new IllegalArgumentException("一元运算只支持 PLUS 和 MINUS，收到: " + operation);
        }
        this.operation = operation;
        this.operand = operand;
        this.hashCode = Objects.hash(operation, operand);
        logger.debug("创建 Unary: {} ({})", operation, operand.getClass().getSimpleName());
    }

    @Override
    public <R> R accept(ExpressionVisitor<R> visitor) {
        return visitor.visitUnary(this);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        Unary unary = (Unary) o;
        return operation == unary.operation && operand.equals(unary.operand);
    }

    @Override
    public int hashCode() {
        return hashCode;
    }

    @Override
    public String toString() {
        return "Unary(" + operation + ", " + operand + ")";
    }
}
