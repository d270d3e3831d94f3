package org.exprengine.expressions;

/**
 * 表达式树的遍历接口，每种节点对应一个方法。
 * @param <R> 遍历结果类型。
 */
public interface ExpressionVisitor<R> {

    R visitConstant(Constant node);

    R visitVariable(VariableRef node);

    R visitUnary(Unary node);

    R visitBinary(Binary node);

    R visitAssign(Assign node);
}
