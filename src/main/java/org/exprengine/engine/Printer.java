package org.exprengine.engine;

import lombok.Getter;
import org.exprengine.core.SymbolTable;
import org.exprengine.expressions.Expression;

import java.io.IOException;
import java.util.Objects;

/**
 * 把一棵表达式树和它的符号表绑定在一起，便于直接拼接进日志或输出流。
 * 不缓存渲染结果，每次 toString 都会重新查找变量名。
 */
@Getter
public final class Printer {

    private final SymbolTable symbolTable;
    private final Expression expression;

    public Printer(SymbolTable symbolTable, Expression expression) {
        this.symbolTable = Objects.requireNonNull(symbolTable, "Printer: symbolTable 不能为 null");
        this.expression = Objects.requireNonNull(expression, "Printer: expression 不能为 null");
    }

    public static Printer of(SymbolTable symbolTable, Expression expression) {
        return new Printer(symbolTable, expression);
    }

    /**
     * 把渲染结果写入 out。
     * @param out 目标。
     * @return out 本身，便于链式调用。
     * @throws IOException 写入 out 失败。
     */
    public <A extends Appendable> A printTo(A out) throws IOException {
        out.append(toString());
        return out;
    }

    @Override
    public String toString() {
        return Renderer.render(expression, symbolTable);
    }
}
