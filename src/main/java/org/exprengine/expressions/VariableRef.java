package org.exprengine.expressions;

import lombok.Getter;
import org.exprengine.core.Variable;

import java.util.Objects;

/**
 * 变量引用节点，求值时读取状态向量中对应的槽位。
 */
@Getter
public final class VariableRef implements Expression {

    private final Variable variable;

    public VariableRef(Variable variable) {
        this.variable = Objects.requireNonNull(variable, "VariableRef: variable 不能为 null");
    }

    @Override
    public <R> R accept(ExpressionVisitor<R> visitor) {
        return visitor.visitVariable(this);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        VariableRef that = (VariableRef) o;
        return variable.equals(that.variable);
    }

    @Override
    public int hashCode() {
        return variable.hashCode();
    }

    @Override
    public String toString() {
        return "VariableRef(" + variable + ")";
    }
}
