package com.hybridlang.compiler.ir;

/**
 * future 声明及与之配对的 promise
 */
public class FutureInfo {
    private final String futureVar;
    private final Type valueType;
    private String promiseVar = "";
    private boolean shared;

    public FutureInfo(String futureVar, Type valueType) {
        this.futureVar = futureVar;
        this.valueType = valueType;
    }

    public String getFutureVar() {
        return futureVar;
    }

    public Type getValueType() {
        return valueType;
    }

    public String getPromiseVar() {
        return promiseVar;
    }

    public boolean hasPromise() {
        return !promiseVar.isEmpty();
    }

    public void setPromiseVar(String promiseVar) {
        this.promiseVar = promiseVar != null ? promiseVar : "";
    }

    public boolean isShared() {
        return shared;
    }

    public void setShared(boolean shared) {
        this.shared = shared;
    }
}
