package com.hybridlang.compiler.ir;

import java.util.ArrayList;
import java.util.List;

/**
 * std::async 启动的任务
 */
public class AsyncTaskInfo {
    private final String taskVar;        // 未绑定变量时为空串
    private final String functionName;
    private final List<String> arguments = new ArrayList<String>();
    private Type resultType;
    private final boolean detached;

    public AsyncTaskInfo(String taskVar, String functionName, List<String> arguments, boolean detached) {
        this.taskVar = taskVar != null ? taskVar : "";
        this.functionName = functionName;
        if (arguments != null) {
            this.arguments.addAll(arguments);
        }
        this.detached = detached;
    }

    public String getTaskVar() {
        return taskVar;
    }

    public boolean hasTaskVar() {
        return !taskVar.isEmpty();
    }

    public String getFunctionName() {
        return functionName;
    }

    public List<String> getArguments() {
        return arguments;
    }

    /** 结果类型，未知时为 null */
    public Type getResultType() {
        return resultType;
    }

    public void setResultType(Type resultType) {
        this.resultType = resultType;
    }

    public boolean isDetached() {
        return detached;
    }
}
