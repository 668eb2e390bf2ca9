package com.hybridlang.compiler.ir;

import java.util.ArrayList;
import java.util.List;

/**
 * 原子变量及其上观察到的操作（load / store / fetch_add / ...）
 */
public class AtomicInfo {
    private final String variable;
    private final Type valueType;
    private final List<String> operations = new ArrayList<String>();

    public AtomicInfo(String variable, Type valueType) {
        this.variable = variable;
        this.valueType = valueType;
    }

    public String getVariable() {
        return variable;
    }

    public Type getValueType() {
        return valueType;
    }

    /** 按出现顺序去重后的操作名 */
    public List<String> getOperations() {
        return operations;
    }

    public void addOperation(String operation) {
        if (!operations.contains(operation)) {
            operations.add(operation);
        }
    }
}
