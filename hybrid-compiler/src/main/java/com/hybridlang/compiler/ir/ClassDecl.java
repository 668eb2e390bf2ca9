package com.hybridlang.compiler.ir;

import java.util.ArrayList;
import java.util.List;

/**
 * 类 / 结构体声明
 */
public class ClassDecl {
    private final String name;
    private final boolean isStruct;

    private final List<Variable> fields = new ArrayList<Variable>();
    private final List<Function> methods = new ArrayList<Function>();
    private final List<String> baseClasses = new ArrayList<String>();
    private final List<AccessSection> accessSections = new ArrayList<AccessSection>();

    // 模板
    private String templateDeclaration;
    private boolean isTemplate;
    private final List<TemplateParameter> templateParameters = new ArrayList<TemplateParameter>();
    private final TemplateSpecialization specialization = new TemplateSpecialization();

    // 并发
    private final List<MutexInfo> mutexes = new ArrayList<MutexInfo>();
    private final List<AtomicInfo> atomics = new ArrayList<AtomicInfo>();
    private final List<ConditionVariableInfo> conditionVariables = new ArrayList<ConditionVariableInfo>();
    private boolean threadSafe;  // 预留给后续 pass，核心管线不设置

    public ClassDecl(String name, boolean isStruct) {
        this.name = name;
        this.isStruct = isStruct;
    }

    public String getName() {
        return name;
    }

    public boolean isStruct() {
        return isStruct;
    }

    public List<Variable> getFields() {
        return fields;
    }

    public void addField(Variable field) {
        fields.add(field);
    }

    public Variable findField(String fieldName) {
        for (Variable f : fields) {
            if (f.getName().equals(fieldName)) return f;
        }
        return null;
    }

    public List<Function> getMethods() {
        return methods;
    }

    public void addMethod(Function method) {
        methods.add(method);
    }

    public List<Function> getVirtualMethods() {
        List<Function> result = new ArrayList<Function>();
        for (Function m : methods) {
            if (m.isPolymorphic() && !m.isConstructor() && !m.isDestructor()) {
                result.add(m);
            }
        }
        return result;
    }

    public boolean isPolymorphic() {
        return !getVirtualMethods().isEmpty();
    }

    /** 含纯虚函数且没有字段：只需生成 trait / interface */
    public boolean isInterfaceLike() {
        if (!fields.isEmpty()) return false;
        boolean hasPure = false;
        for (Function m : methods) {
            if (m.isConstructor() || m.isDestructor()) continue;
            if (!m.isPolymorphic()) return false;
            if (m.isPureVirtual()) hasPure = true;
        }
        return hasPure;
    }

    public List<String> getBaseClasses() {
        return baseClasses;
    }

    public List<AccessSection> getAccessSections() {
        return accessSections;
    }

    /**
     * 查询成员的访问级别。未出现在任何访问段中时按 class / struct 的默认可见性返回。
     */
    public AccessLevel getAccessOf(String memberName) {
        for (AccessSection section : accessSections) {
            if (section.getMembers().contains(memberName)) {
                return section.getLevel();
            }
        }
        return isStruct ? AccessLevel.PUBLIC : AccessLevel.PRIVATE;
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

    public List<MutexInfo> getMutexes() { return mutexes; }
    public List<AtomicInfo> getAtomics() { return atomics; }
    public List<ConditionVariableInfo> getConditionVariables() { return conditionVariables; }

    public boolean isThreadSafe() {
        return threadSafe;
    }

    public void setThreadSafe(boolean threadSafe) {
        this.threadSafe = threadSafe;
    }

    @Override
    public String toString() {
        return (isStruct ? "struct " : "class ") + name;
    }
}
