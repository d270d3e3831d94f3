package org.exprengine.engine;

import lombok.Getter;
import org.exprengine.core.SymbolTable;
import org.exprengine.expressions.Assign;
import org.exprengine.expressions.Binary;
import org.exprengine.expressions.Constant;
import org.exprengine.expressions.Expression;
import org.exprengine.expressions.ExpressionVisitor;
import org.exprengine.expressions.Unary;
import org.exprengine.expressions.VariableRef;
import org.exprengine.utils.NumberFormats;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;

/**
 * 把表达式树渲染成中缀文本。
 * 输出是树结构的直接展开：先左子树，再运算符，再右子树，从不插入括号，
 * 所以 (a+b)*c 会输出为 "a+b*c"。
 * 变量名从符号表中查找，查找失败时 OutOfRangeException 原样抛出。
 * Renderer 本身不保存渲染过程中的状态，同一个实例可以在多个线程中同时使用，
 * 前提是没有线程在同时向符号表声明变量。
 */
public final class Renderer {

    private static final Logger logger = LoggerFactory.getLogger(Renderer.class);

    /**
     * 常数的默认有效数字位数，与 printf 的 %g 默认精度相同。
     */
    public static final int DEFAULT_PRECISION = 6;

    @Getter
    private final SymbolTable symbolTable;
    @Getter
    private final int precision;

    public Renderer(SymbolTable symbolTable) {
        this(symbolTable, DEFAULT_PRECISION);
    }

    public Renderer(SymbolTable symbolTable, int precision) {
        this.symbolTable = Objects.requireNonNull(symbolTable, "Renderer: symbolTable 不能为 null");
        if (precision < 1) {
            logger.error("Renderer 的精度必须至少为 1，收到 {}", precision);
            throw new IllegalArgumentException("precision 必须至少为 1: " + precision);
        }
        this.precision = precision;
    }

    /**
     * 使用默认精度渲染 expression。
     * @param expression 表达式树。
     * @param symbolTable 声明了树中所有变量的符号表。
     * @return 中缀文本。
     */
    public static String render(Expression expression, SymbolTable symbolTable) {
        return new Renderer(symbolTable).render(expression);
    }

    /**
     * 渲染 expression。
     */
    public String render(Expression expression) {
        Objects.requireNonNull(expression, "Renderer: expression 不能为 null");
        InfixWriter writer = new InfixWriter();
        expression.accept(writer);
        String text = writer.out.toString();
        logger.debug("渲染 {} 得到 {}", expression, text);
        return text;
    }

    /**
     * 单次渲染使用的遍历器，持有本次输出的缓冲区。
     */
    private final class InfixWriter implements ExpressionVisitor<Void> {

        private final StringBuilder out = new StringBuilder();

        @Override
        public Void visitConstant(Constant node) {
            out.append(NumberFormats.format(node.getValue(), precision));
            return null;
        }

        @Override
        public Void visitVariable(VariableRef node) {
            out.append(symbolTable.nameOf(node.getVariable()));
            return null;
        }

        @Override
        public Void visitUnary(Unary node) {
            out.append(node.getOperation().getUnarySymbol());
            node.getOperand().accept(this);
            return null;
        }

        @Override
        public Void visitBinary(Binary node) {
            node.getLeft().accept(this);
            out.append(node.getOperation().getSymbol());
            node.getRight().accept(this);
            return null;
        }

        @Override
        public Void visitAssign(Assign node) {
            out.append(symbolTable.nameOf(node.getTarget()));
            out.append(node.getOperation().getAssignSymbol());
            node.getValue().accept(this);
            return null;
        }
    }
}
