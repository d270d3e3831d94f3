package org.exprengine.expressions;

import lombok.Getter;
import org.exprengine.core.Variable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;

/**
 * 赋值节点：target op= value。
 * 目标的类型是 {@link Variable} 而不是任意表达式，所以 "(a - b) += c" 这样的树无法构造出来。
 * ASSIGN 表示普通赋值，其余运算表示复合赋值。
 */
@Getter
public final class Assign implements Expression {

    private static final Logger logger = LoggerFactory.getLogger(Assign.class);

    private final OperationType operation;
    private final Variable target;
    private final Expression value;

    private final int hashCode;

    public Assign(OperationType operation, Variable target, Expression value) {
        this.operation = Objects.requireNonNull(operation, "Assign-构造函数: operation 不能为 null");
        this.target = Objects.requireNonNull(target, "Assign-构造函数: target 不能为 null");
        this.value = Objects.requireNonNull(value, "Assign-构造函数: value 不能为 null");
        this.hashCode = Objects.hash(operation, target, value);
        logger.debug("创建 Assign: {} ({}, {})", operation, target, value.getClass().getSimpleName());
    }

    @Override
    public <R> R accept(ExpressionVisitor<R> visitor) {
        return visitor.visitAssign(this);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        Assign assign = (Assign) o;
        return operation == assign.operation
                && target.equals(assign.target)
                && value.equals(assign.value);
    }

    @Override
    public int hashCode() {
        return hashCode;
    }

    @Override
    public String toString() {
        return "Assign(" + operation + ", " + target + ", " + value + ")";
    }
}
