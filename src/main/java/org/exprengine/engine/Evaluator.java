package org.exprengine.engine;

import lombok.Getter;
import org.exprengine.core.State;
import org.exprengine.exceptions.DivisionByZeroException;
import org.exprengine.expressions.Assign;
import org.exprengine.expressions.Binary;
import org.exprengine.expressions.Constant;
import org.exprengine.expressions.Expression;
import org.exprengine.expressions.ExpressionVisitor;
import org.exprengine.expressions.OperationType;
import org.exprengine.expressions.Unary;
import org.exprengine.expressions.VariableRef;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;

/**
 * 表达式求值器。
 * 递归遍历表达式树，在给定的状态向量上计算其值；只有赋值节点会写回状态向量。
 * 不做缓存：同一棵树每次求值都会读取状态向量的当前值。
 * 求值中途抛出的异常会直接传给调用方，已经执行过的赋值不会回滚。
 */
@Getter
public final class Evaluator implements ExpressionVisitor<Double> {

    private static final Logger logger = LoggerFactory.getLogger(Evaluator.class);

    private final State state;

    public Evaluator(State state) {
        this.state = Objects.requireNonNull(state, "Evaluator: state 不能为 null");
    }

    /**
     * 在 state 上对 expression 求值。
     * @param expression 表达式树。
     * @param state 状态向量，赋值节点会修改它。
     * @return 表达式的值。
     * @throws DivisionByZeroException 二元除法的除数为 0。
     * @throws org.exprengine.exceptions.OutOfRangeException 变量下标超出状态向量长度。
     */
    public static double evaluate(Expression expression, State state) {
        return new Evaluator(state).evaluate(expression);
    }

    public double evaluate(Expression expression) {
        Objects.requireNonNull(expression, "Evaluator: expression 不能为 null");
        double result = expression.accept(this);
        logger.debug("在 {} 上求值 {}，结果为 {}", state, expression, result);
        return result;
    }

    @Override
    public Double visitConstant(Constant node) {
        return node.getValue();
    }

    @Override
    public Double visitVariable(VariableRef node) {
        return state.get(node.getVariable());
    }

    @Override
    public Double visitUnary(Unary node) {
        double operand = node.getOperand().accept(this);
        return switch (node.getOperation()) {
            case PLUS -> operand;
            case MINUS -> -operand;
            default -> throw unsupported(node.getOperation(), "一元");
        };
    }

    @Override
    public Double visitBinary(Binary node) {
        double left = node.getLeft().accept(this);
        double right = node.getRight().accept(this);
        return switch (node.getOperation()) {
            case PLUS -> left + right;
            case MINUS -> left - right;
            case MUL -> left * right;
            case DIV -> {
                if (right == 0) {
                    logger.error("二元除法的除数为 0: {} / {}", left, right);
                    throw new DivisionByZeroException(left);
                }
                yield left / right;
            }
            default -> throw unsupported(node.getOperation(), "二元");
        };
    }

    @Override
    public Double visitAssign(Assign node) {
        double value = node.getValue().accept(this);
        double stored = state.get(node.getTarget());
        if (node.getOperation() == OperationType.DIV && value == 0) {
            // /= 不检查除数，结果为 inf 或 nan
            logger.warn("复合赋值 /= 的除数为 0，{} 的新值将是 {}", node.getTarget(), stored / value);
        }
        double updated = node.getOperation().apply(stored, value);
        state.set(node.getTarget(), updated);
        return updated;
    }

    private static IllegalStateException unsupported(OperationType operation, String kind) {
        logger.error("遇到不支持的{}运算: {}", kind, operation);
        return new IllegalStateException("不支持的" + kind + "运算: " + operation);
    }
}
