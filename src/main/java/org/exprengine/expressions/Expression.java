package org.exprengine.expressions;

import org.exprengine.core.State;
import org.exprengine.core.SymbolTable;
import org.exprengine.engine.Evaluator;
import org.exprengine.engine.Renderer;

/**
 * 算术表达式树的节点。
 * 所有节点构造后不可变，按值持有子节点，因此不会出现环，也可以在线程间只读共享。
 * 两棵树相等当且仅当结构和内容相同。
 */
public sealed interface Expression permits Constant, VariableRef, Unary, Binary, Assign {

    <R> R accept(ExpressionVisitor<R> visitor);

    /**
     * 在给定状态向量上求值。赋值节点会修改 state。
     * @param state 状态向量。
     * @return 表达式的值。
     */
    default double evaluate(State state) {
        return Evaluator.evaluate(this, state);
    }

    /**
     * 渲染为中缀文本，变量名从符号表中查找。
     * @param symbolTable 声明了树中所有变量的符号表。
     * @return 中缀文本，不含括号。
     */
    default String render(SymbolTable symbolTable) {
        return Renderer.render(this, symbolTable);
    }
}
