package com.hybridlang.compiler.ir;

import java.util.ArrayList;
import java.util.List;

/**
 * 条件变量及其等待条件
 */
public class ConditionVariableInfo {
    private final String variable;
    private String associatedMutex = "";
    private final List<String> waitConditions = new ArrayList<String>();
    private boolean notifiesAll;

    public ConditionVariableInfo(String variable) {
        this.variable = variable;
    }

    public String getVariable() {
        return variable;
    }

    public String getAssociatedMutex() {
        return associatedMutex;
    }

    public void setAssociatedMutex(String associatedMutex) {
        this.associatedMutex = associatedMutex != null ? associatedMutex : "";
    }

    public List<String> getWaitConditions() {
        return waitConditions;
    }

    public boolean isNotifiesAll() {
        return notifiesAll;
    }

    public void setNotifiesAll(boolean notifiesAll) {
        this.notifiesAll = notifiesAll;
    }
}
