package com.givehub.backend.support;

import java.util.ArrayList;
import java.util.List;
import java.util.function.Supplier;

import com.givehub.backend.global.transaction.UnitOfWork;

/**
 * Runs work inline without a transaction and records the unit names, for service unit tests.
 */
public class DirectUnitOfWork implements UnitOfWork {

    private final List<String> executedUnits = new ArrayList<>();

    @Override
    public <T> T execute(String name, Supplier<T> work) {
        executedUnits.add(name);
        return work.get();
    }

    public List<String> executedUnits() {
        return executedUnits;
    }
}
