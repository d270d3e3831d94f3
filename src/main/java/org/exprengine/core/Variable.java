package org.exprengine.core;

import lombok.Getter;
import org.exprengine.expressions.VariableRef;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;

/**
 * 指向状态向量中某个槽位的变量句柄。
 * 变量本身不保存值，读写都经过外部传入的 {@link State}。
 * 两个句柄相等当且仅当下标相等。
 */
@Getter
public final class Variable implements Comparable<Variable> {

    private static final Logger logger = LoggerFactory.getLogger(Variable.class);

    private final int index;

    private final int hashCode;

    /**
     * 包内构造，外部应通过 {@link SymbolTable#declare(String, double)} 获取变量。
     * @param index 状态向量中的下标。
     */
    Variable(int index) {
        if (index < 0) {
            logger.error("尝试创建下标为负数的变量: {}", index);
            throw new IllegalArgumentException("变量下标不能为负数: " + index);
        }
        this.index = index;
        this.hashCode = Objects.hash(index);
        logger.debug("创建了一个Variable，下标为 {}", index);
    }

    /**
     * 工厂方法：直接按下标创建变量句柄，不经过符号表。
     * 主要用于与已有状态向量对接；渲染这样的变量需要一个声明过该下标的符号表。
     * @param index 状态向量中的下标。
     * @return 变量句柄。
     */
    public static Variable ofIndex(int index) {
        return new Variable(index);
    }

    /**
     * 获取引用此变量的表达式节点。
     * @return {@link VariableRef} 节点。
     */
    public VariableRef ref() {
        return new VariableRef(this);
    }

    @Override
    public int compareTo(Variable other) {
        return Integer.compare(this.index, other.index);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        Variable variable = (Variable) o;
        return index == variable.index;
    }

    @Override
    public int hashCode() {
        return hashCode;
    }

    @Override
    public String toString() {
        return "$" + index;
    }
}
