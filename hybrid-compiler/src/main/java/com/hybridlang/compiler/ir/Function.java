package com.hybridlang.compiler.ir;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 函数 / 方法声明。
 *
 * <p>returnType 为 null 当且仅当是构造器。body 为 null 表示只有声明（以 {@code ;} 结尾）。
 * 分析 pass 在原地补充异常、模板、并发、异步、所有权信息。</p>
 */
public class Function {
    private final String name;
    private final Type returnType;
    private final List<Parameter> parameters = new ArrayList<Parameter>();
    private String body;
    private final Map<String, String> memberInitializers = new LinkedHashMap<String, String>();

    private boolean isConst;
    private boolean isStatic;
    private boolean isVirtual;
    private boolean isPureVirtual;
    private boolean isOverride;
    private boolean isConstructor;
    private boolean isDestructor;

    // 异常
    private final ExceptionSpec exceptionSpec = new ExceptionSpec();
    private final List<TryCatchBlock> tryCatchBlocks = new ArrayList<TryCatchBlock>();
    private boolean mayThrow;

    // 模板
    private String templateDeclaration;
    private boolean isTemplate;
    private final List<TemplateParameter> templateParameters = new ArrayList<TemplateParameter>();
    private final TemplateSpecialization specialization = new TemplateSpecialization();

    // 并发
    private final List<ThreadInfo> threads = new ArrayList<ThreadInfo>();
    private final List<MutexInfo> mutexes = new ArrayList<MutexInfo>();
    private final List<LockInfo> locks = new ArrayList<LockInfo>();
    private final List<AtomicInfo> atomics = new ArrayList<AtomicInfo>();
    private final List<ConditionVariableInfo> conditionVariables = new ArrayList<ConditionVariableInfo>();

    // 异步
    private final CoroutineInfo coroutineInfo = new CoroutineInfo();
    private final List<FutureInfo> futures = new ArrayList<FutureInfo>();
    private final List<AsyncTaskInfo> asyncTasks = new ArrayList<AsyncTaskInfo>();

    // 所有权
    private final List<String> movedParams = new ArrayList<String>();
    private final List<String> borrowedParams = new ArrayList<String>();

    public Function(String name, Type returnType) {
        this.name = name;
        this.returnType = returnType;
        this.isConstructor = returnType == null;
    }

    public String getName() {
        return name;
    }

    public Type getReturnType() {
        return returnType;
    }

    public boolean returnsVoid() {
        return returnType == null || returnType.getKind() == TypeKind.VOID;
    }

    public List<Parameter> getParameters() {
        return parameters;
    }

    public void addParameter(Parameter parameter) {
        parameters.add(parameter);
    }

    public Parameter findParameter(String paramName) {
        for (Parameter p : parameters) {
            if (p.getName().equals(paramName)) return p;
        }
        return null;
    }

    public String getBody() {
        return body;
    }

    public void setBody(String body) {
        this.body = body;
    }

    public boolean hasBody() {
        return body != null;
    }

    /** 构造器成员初始化列表：成员名 → 初始化表达式文本（按书写顺序） */
    public Map<String, String> getMemberInitializers() {
        return memberInitializers;
    }

    // ============ 标志 ============

    public boolean isConst() { return isConst; }
    public void setConst(boolean isConst) { this.isConst = isConst; }

    public boolean isStatic() { return isStatic; }
    public void setStatic(boolean isStatic) { this.isStatic = isStatic; }

    public boolean isVirtual() { return isVirtual; }
    public void setVirtual(boolean isVirtual) { this.isVirtual = isVirtual; }

    public boolean isPureVirtual() { return isPureVirtual; }
    public void setPureVirtual(boolean isPureVirtual) { this.isPureVirtual = isPureVirtual; }

    public boolean isOverride() { return isOverride; }
    public void setOverride(boolean isOverride) { this.isOverride = isOverride; }

    public boolean isConstructor() { return isConstructor; }
    public void setConstructor(boolean isConstructor) { this.isConstructor = isConstructor; }

    public boolean isDestructor() { return isDestructor; }
    public void setDestructor(boolean isDestructor) { this.isDestructor = isDestructor; }

    /** virtual 或 override 都参与动态分派 */
    public boolean isPolymorphic() {
        return isVirtual || isPureVirtual || isOverride;
    }

    // ============ 异常 ============

    public ExceptionSpec getExceptionSpec() {
        return exceptionSpec;
    }

    public List<TryCatchBlock> getTryCatchBlocks() {
        return tryCatchBlocks;
    }

    public boolean mayThrow() {
        return mayThrow;
    }

    public void setMayThrow(boolean mayThrow) {
        this.mayThrow = mayThrow;
    }

    /** 抛出异常或含 catch 子句的函数都需要以错误值形式返回 */
    public boolean isFallible() {
        return mayThrow || !tryCatchBlocks.isEmpty();
    }

    // ============ 模板 ============

    public String getTemplateDeclaration() {
        return templateDeclaration;
    }

    public void setTemplateDeclaration(String templateDeclaration) {
        this.templateDeclaration = templateDeclaration;
    }

    public boolean isTemplate() {
        return isTemplate;
    }

    public void setTemplate(boolean isTemplate) {
        this.isTemplate = isTemplate;
    }

    public List<TemplateParameter> getTemplateParameters() {
        return templateParameters;
    }

    public TemplateSpecialization getSpecialization() {
        return specialization;
    }

    // ============ 并发 ============

    public List<ThreadInfo> getThreads() { return threads; }
    public List<MutexInfo> getMutexes() { return mutexes; }
    public List<LockInfo> getLocks() { return locks; }
    public List<AtomicInfo> getAtomics() { return atomics; }
    public List<ConditionVariableInfo> getConditionVariables() { return conditionVariables; }

    public boolean usesConcurrency() {
        return !threads.isEmpty() || !mutexes.isEmpty() || !locks.isEmpty()
                || !atomics.isEmpty() || !conditionVariables.isEmpty();
    }

    // ============ 异步 ============

    public CoroutineInfo getCoroutineInfo() {
        return coroutineInfo;
    }

    public List<FutureInfo> getFutures() {
        return futures;
    }

    public List<AsyncTaskInfo> getAsyncTasks() {
        return asyncTasks;
    }

    /**
     * 派生属性：协程、future 或 async 任务任一存在即为异步函数
     */
    public boolean isAsync() {
        return coroutineInfo.isCoroutine() || !futures.isEmpty() || !asyncTasks.isEmpty();
    }

    // ============ 所有权 ============

    public List<String> getMovedParams() {
        return movedParams;
    }

    public List<String> getBorrowedParams() {
        return borrowedParams;
    }

    public boolean isMoved(String paramName) {
        return movedParams.contains(paramName);
    }

    public boolean isBorrowed(String paramName) {
        return borrowedParams.contains(paramName);
    }

    @Override
    public String toString() {
        return "Function(" + name + ", params=" + parameters.size() + ")";
    }
}
