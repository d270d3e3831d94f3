package org.exprengine.expressions;

import lombok.Getter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * 常数节点。
 */
@Getter
public final class Constant implements Expression {

    private static final Logger logger = LoggerFactory.getLogger(Constant.class);

    private final double value;

    public Constant(double value) {
        this.value = value;
        logger.debug("创建 Constant: {}", value);
    }

    @Override
    public <R> R accept(ExpressionVisitor<R> visitor) {
        return visitor.visitConstant(this);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        Constant constant = (Constant) o;
        return Double.compare(value, constant.value) == 0;
    }

    @Override
    public int hashCode() {
        return Double.hashCode(value);
    }

    @Override
    public String toString() {
        return "Constant(" + value + ")";
    }
}
