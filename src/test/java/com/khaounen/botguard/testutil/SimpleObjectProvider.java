package com.khaounen.botguard.testutil;

import org.springframework.beans.factory.ObjectProvider;

import java.util.function.Supplier;
import java.util.stream.Stream;

public final class SimpleObjectProvider<T> implements ObjectProvider<T> {
    private final T instance;

    public SimpleObjectProvider(T instance) {
        this.instance = instance;
    }

    @Override
    public T getObject(Object... args) {
        if (instance == null) {
            throw new IllegalStateException("No object available");
        }
        return instance;
    }

    @Override
    public T getObject() {
        return getObject(new Object[0]);
    }

    @Override
    public T getIfAvailable() {
        return instance;
    }

    @Override
    public T getIfAvailable(Supplier<T> supplier) {
        return instance != null ? instance : supplier.get();
    }

    @Override
    public T getIfUnique() {
        return instance;
    }

    @Override
    public T getIfUnique(Supplier<T> supplier) {
        return instance != null ? instance : supplier.get();
    }

    @Override
    public Stream<T> stream() {
        return instance == null ? Stream.empty() : Stream.of(instance);
    }

    @Override
    public Stream<T> orderedStream() {
        return stream();
    }
}
