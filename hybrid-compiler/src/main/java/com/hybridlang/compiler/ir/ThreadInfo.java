package com.hybridlang.compiler.ir;

import java.util.ArrayList;
import java.util.List;

/**
 * 源程序中的线程创建：{@code std::thread t(worker, a, b);}
 */
public class ThreadInfo {
    private final String threadVar;      // 匿名临时线程为空串
    private final String targetFunction;
    private final List<String> arguments = new ArrayList<String>();
    private boolean detached;

    public ThreadInfo(String threadVar, String targetFunction, List<String> arguments) {
        this.threadVar = threadVar != null ? threadVar : "";
        this.targetFunction = targetFunction;
        if (arguments != null) {
            this.arguments.addAll(arguments);
        }
    }

    public String getThreadVar() {
        return threadVar;
    }

    public String getTargetFunction() {
        return targetFunction;
    }

    public List<String> getArguments() {
        return arguments;
    }

    public boolean isDetached() {
        return detached;
    }

    public boolean isJoinable() {
        return !detached;
    }

    public void setDetached(boolean detached) {
        this.detached = detached;
    }
}
