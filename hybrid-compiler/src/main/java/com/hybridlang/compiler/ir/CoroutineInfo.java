package com.hybridlang.compiler.ir;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * 协程信息，所有标志都由 {@link #addOperation} 推导
 */
public class CoroutineInfo {
    private final List<AsyncOperation> operations = new ArrayList<AsyncOperation>();
    private boolean usesSuspend;
    private boolean usesReturn;
    private boolean usesYield;

    public void addOperation(AsyncOperation op) {
        operations.add(op);
        switch (op.getKind()) {
            case SUSPEND: usesSuspend = true; break;
            case RETURN:  usesReturn = true; break;
            case YIELD:   usesYield = true; break;
        }
    }

    public List<AsyncOperation> getOperations() {
        return Collections.unmodifiableList(operations);
    }

    public boolean isCoroutine() {
        return usesSuspend || usesReturn || usesYield;
    }

    public boolean usesSuspend() {
        return usesSuspend;
    }

    public boolean usesReturn() {
        return usesReturn;
    }

    public boolean usesYield() {
        return usesYield;
    }

    /** 含 co_yield 即为生成器 */
    public boolean isGenerator() {
        return usesYield;
    }

    public void clear() {
        operations.clear();
        usesSuspend = false;
        usesReturn = false;
        usesYield = false;
    }
}
