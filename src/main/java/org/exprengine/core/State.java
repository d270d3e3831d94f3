package org.exprengine.core;

import org.exprengine.exceptions.OutOfRangeException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Arrays;
import java.util.stream.Collectors;

/**
 * 状态向量：长度固定、按下标访问的 double 序列。
 * 由调用方持有，求值时按引用传入，只有赋值表达式会修改它。
 * 此类不是线程安全的。
 */
public final class State {

    private static final Logger logger = LoggerFactory.getLogger(State.class);

    private final double[] values;

    private State(double[] values) {
        this.values = values;
        logger.debug("创建 State: {}", this);
    }

    /**
     * 工厂方法：以给定值的拷贝创建状态向量。
     * @param values 初始值。
     * @return 新的 State。
     */
    public static State of(double... values) {
        return new State(values.clone());
    }

    /**
     * 工厂方法：创建全零的状态向量。
     * @param size 长度。
     * @return 全零的 State。
     */
    public static State ofSize(int size) {
        if (size < 0) {
            logger.error("尝试创建长度为 {} 的 State", size);
            throw new IllegalArgumentException("State 的长度不能为负数: " + size);
        }
        return new State(new double[size]);
    }

    public double get(Variable variable) {
        return get(variable.getIndex());
    }

    /**
     * 读取指定下标的值。
     * @param index 下标。
     * @return 当前值。
     * @throws OutOfRangeException 下标越界。
     */
    public double get(int index) {
        checkIndex(index);
        return values[index];
    }

    public void set(Variable variable, double value) {
        set(variable.getIndex(), value);
    }

    /**
     * 写入指定下标的值。
     * @param index 下标。
     * @param value 新值。
     * @throws OutOfRangeException 下标越界。
     */
    public void set(int index, double value) {
        checkIndex(index);
        logger.debug("State[{}]: {} -> {}", index, values[index], value);
        values[index] = value;
    }

    public int size() {
        return values.length;
    }

    /**
     * 获取一个独立的快照，之后对任一方的修改互不影响。
     * @return 新的 State。
     */
    public State copy() {
        return new State(values.clone());
    }

    public double[] toArray() {
        return values.clone();
    }

    private void checkIndex(int index) {
        if (index < 0 || index >= values.length) {
            logger.error("访问 State 时下标越界: {}，长度为 {}", index, values.length);
            throw new OutOfRangeException("State", index, values.length);
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        State state = (State) o;
        return Arrays.equals(values, state.values);
    }

    @Override
    public int hashCode() {
        return Arrays.hashCode(values);
    }

    @Override
    public String toString() {
        return Arrays.stream(values)
                .mapToObj(String::valueOf)
                .collect(Collectors.joining(", ", "[", "]"));
    }
}
