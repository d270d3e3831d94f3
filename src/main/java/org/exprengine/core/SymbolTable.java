package org.exprengine.core;

import org.apache.commons.lang3.StringUtils;
import org.apache.commons.lang3.tuple.Pair;
import org.exprengine.exceptions.OutOfRangeException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;
import java.util.stream.IntStream;

/**
 * 符号表：按声明顺序为变量分配下标，并记录每个下标的显示名称和初始值。
 * 只追加，不删除也不重新编号：第 N 个名称总是对应状态向量中的下标 N。
 * 符号表不持有求值用的状态向量，只负责用初始值生成新的向量。
 * 此类不是线程安全的。
 */
public final class SymbolTable {

    private static final Logger logger = LoggerFactory.getLogger(SymbolTable.class);

    private final List<String> names = new ArrayList<>();
    private final List<Double> initialValues = new ArrayList<>();
    private final Set<String> declaredNames = new HashSet<>();

    /**
     * 声明一个新变量。
     * 下标从 0 开始严格递增；名称只用于显示，允许重名。
     * @param name 显示名称，不能为空白。
     * @param initial 初始值。
     * @return 新变量的句柄。
     */
    public Variable declare(String name, double initial) {
        if (StringUtils.isBlank(name)) {
            logger.error("声明变量失败：名称 '{}' 为空白", name);
            throw new IllegalArgumentException("变量名称不能为空白");
        }
        if (!declaredNames.add(name)) {
            logger.warn("变量名称 '{}' 已被声明过，新变量将使用相同的显示名称", name);
        }
        int index = names.size();
        names.add(name);
        initialValues.add(initial);
        logger.info("声明变量 {}，下标为 {}，初始值为 {}", name, index, initial);
        return new Variable(index);
    }

    public String nameOf(Variable variable) {
        return nameOf(variable.getIndex());
    }

    /**
     * 获取指定下标的显示名称。
     * @param index 变量下标。
     * @return 声明时的名称。
     * @throws OutOfRangeException 该下标不是由此符号表分配的。
     */
    public String nameOf(int index) {
        checkIndex(index);
        return names.get(index);
    }

    public double initialValueOf(Variable variable) {
        checkIndex(variable.getIndex());
        return initialValues.get(variable.getIndex());
    }

    /**
     * 用已声明变量的初始值生成一个新的状态向量，长度等于已声明变量的个数。
     * 每次调用都返回独立的向量，由调用方持有。
     * @return 新的 State。
     */
    public State createState() {
        double[] values = initialValues.stream().mapToDouble(Double::doubleValue).toArray();
        logger.debug("由符号表生成 State，包含 {} 个变量", values.length);
        return State.of(values);
    }

    public int size() {
        return names.size();
    }

    /**
     * @return 按声明顺序排列的名称，不可修改。
     */
    public List<String> getNames() {
        return Collections.unmodifiableList(names);
    }

    /**
     * @return 按声明顺序排列的变量句柄。
     */
    public List<Variable> getVariables() {
        return IntStream.range(0, names.size())
                .mapToObj(Variable::new)
                .collect(Collectors.toUnmodifiableList());
    }

    /**
     * @return 按声明顺序排列的 (变量, 名称) 对。
     */
    public List<Pair<Variable, String>> entries() {
        return IntStream.range(0, names.size())
                .mapToObj(i -> Pair.of(new Variable(i), names.get(i)))
                .collect(Collectors.toUnmodifiableList());
    }

    private void checkIndex(int index) {
        if (index < 0 || index >= names.size()) {
            logger.error("符号表中不存在下标 {}，当前共有 {} 个变量", index, names.size());
            throw new OutOfRangeException("SymbolTable", index, names.size());
        }
    }

    @Override
    public String toString() {
        return "SymbolTable{" +
                IntStream.range(0, names.size())
                        .mapToObj(i -> names.get(i) + "=" + initialValues.get(i))
                        .collect(Collectors.joining(", ")) +
                "}";
    }
}
