package com.chih.JSugar.core.pipeline;

import java.util.HashMap;
import java.util.Map;
import java.util.function.Supplier;

/**
 * 单次 execute 内的遍历状态，每次执行新建，不跨线程共享
 */
public final class TraversalState {

    private final Map<StateKey<?>, Object> values = new HashMap<>();

    @SuppressWarnings("unchecked")
    public <T> T get(StateKey<T> key) {
        return (T) values.get(key);
    }

    public <T> T getOrDefault(StateKey<T> key, T defaultValue) {
        T value = get(key);
        return value != null ? value : defaultValue;
    }

    public <T> void put(StateKey<T> key, T value) {
        values.put(key, value);
    }

    @SuppressWarnings("unchecked")
    public <T> T computeIfAbsent(StateKey<T> key, Supplier<T> supplier) {
        return (T) values.computeIfAbsent(key, k -> supplier.get());
    }
}
