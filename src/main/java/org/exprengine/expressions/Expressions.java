package org.exprengine.expressions;

import org.exprengine.core.Variable;

/**
 * 构造表达式树的工厂方法，对应中缀写法中的各个运算符。
 * 这些方法只分配新节点，不求值；double 参数会被提升为 {@link Constant}。
 * 赋值类方法的目标参数只接受 {@link Variable}。
 */
public final class Expressions {

    private Expressions() {
    }

    public static Constant constant(double value) {
        return new Constant(value);
    }

    public static VariableRef ref(Variable variable) {
        return new VariableRef(variable);
    }

    // ========== 二元运算 ==========

    /**
     * left + right
     */
    public static Binary add(Expression left, Expression right) {
        return new Binary(OperationType.PLUS, left, right);
    }

    public static Binary add(Expression left, double right) {
        return add(left, constant(right));
    }

    public static Binary add(double left, Expression right) {
        return add(constant(left), right);
    }

    /**
     * left - right
     */
    public static Binary sub(Expression left, Expression right) {
        return new Binary(OperationType.MINUS, left, right);
    }

    public static Binary sub(Expression left, double right) {
        return sub(left, constant(right));
    }

    public static Binary sub(double left, Expression right) {
        return sub(constant(left), right);
    }

    /**
     * left * right
     */
    public static Binary mul(Expression left, Expression right) {
        return new Binary(OperationType.MUL, left, right);
    }

    public static Binary mul(Expression left, double right) {
        return mul(left, constant(right));
    }

    public static Binary mul(double left, Expression right) {
        return mul(constant(left), right);
    }

    /**
     * left / right，求值时除数为 0 会抛出 DivisionByZeroException。
     */
    public static Binary div(Expression left, Expression right) {
        return new Binary(OperationType.DIV, left, right);
    }

    public static Binary div(Expression left, double right) {
        return div(left, constant(right));
    }

    public static Binary div(double left, Expression right) {
        return div(constant(left), right);
    }

    // ========== 一元运算 ==========

    /**
     * +operand
     */
    public static Unary plus(Expression operand) {
        return new Unary(OperationType.PLUS, operand);
    }

    public static Unary plus(double operand) {
        return plus(constant(operand));
    }

    /**
     * -operand
     */
    public static Unary negate(Expression operand) {
        return new Unary(OperationType.MINUS, operand);
    }

    public static Unary negate(double operand) {
        return negate(constant(operand));
    }

    // ========== 赋值 ==========

    /**
     * target <<= value
     */
    public static Assign assign(Variable target, Expression value) {
        return new Assign(OperationType.ASSIGN, target, value);
    }

    public static Assign assign(Variable target, double value) {
        return assign(target, constant(value));
    }

    /**
     * target += value
     */
    public static Assign addAssign(Variable target, Expression value) {
        return new Assign(OperationType.PLUS, target, value);
    }

    public static Assign addAssign(Variable target, double value) {
        return addAssign(target, constant(value));
    }

    /**
     * target -= value
     */
    public static Assign subAssign(Variable target, Expression value) {
        return new Assign(OperationType.MINUS, target, value);
    }

    public static Assign subAssign(Variable target, double value) {
        return subAssign(target, constant(value));
    }

    /**
     * target *= value
     */
    public static Assign mulAssign(Variable target, Expression value) {
        return new Assign(OperationType.MUL, target, value);
    }

    public static Assign mulAssign(Variable target, double value) {
        return mulAssign(target, constant(value));
    }

    /**
     * target /= value，除数为 0 时不做检查。
     */
    public static Assign divAssign(Variable target, Expression value) {
        return new Assign(OperationType.DIV, target, value);
    }

    public static Assign divAssign(Variable target, double value) {
        return divAssign(target, constant(value));
    }
}
