package com.chih.JSugar.core.pipeline;

/**
 * 遍历状态的类型化键，按引用比较
 *
 * @param <T> 值类型
 */
public final class StateKey<T> {

    private final String name;

    private StateKey(String name) {
        this.name = name;
    }

    public static <T> StateKey<T> named(String name) {
        return new StateKey<>(name);
    }

    public String getName() {
        return name;
    }

    @Override
    public String toString() {
        return "StateKey{" + name + '}';
    }
}
