package com.hybridlang.compiler.ir;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 中间表示根节点：一次转译调用对应一个实例，由编排器独占。
 */
public class IrModule {
    private final List<ClassDecl> classes = new ArrayList<ClassDecl>();
    private final List<Function> functions = new ArrayList<Function>();
    private final List<Variable> globalVariables = new ArrayList<Variable>();
    private final List<EnumDecl> enums = new ArrayList<EnumDecl>();
    private final Map<String, Type> typeRegistry = new LinkedHashMap<String, Type>();

    public void addClass(ClassDecl classDecl) {
        classes.add(classDecl);
    }

    public void addFunction(Function function) {
        functions.add(function);
    }

    public void addGlobalVariable(Variable variable) {
        globalVariables.add(variable);
    }

    public void addEnum(EnumDecl enumDecl) {
        enums.add(enumDecl);
    }

    public List<ClassDecl> getClasses() {
        return Collections.unmodifiableList(classes);
    }

    public List<Function> getFunctions() {
        return Collections.unmodifiableList(functions);
    }

    public List<Variable> getGlobalVariables() {
        return Collections.unmodifiableList(globalVariables);
    }

    public List<EnumDecl> getEnums() {
        return Collections.unmodifiableList(enums);
    }

    public ClassDecl findClass(String name) {
        for (ClassDecl c : classes) {
            if (c.getName().equals(name)) return c;
        }
        return null;
    }

    // ============ 类型注册表 ============

    /**
     * 注册类型，同名后注册者覆盖先注册者
     */
    public void registerType(String name, Type type) {
        typeRegistry.put(name, type);
    }

    public Type findType(String name) {
        return typeRegistry.get(name);
    }

    public Map<String, Type> getTypeRegistry() {
        return Collections.unmodifiableMap(typeRegistry);
    }

    /**
     * 所有函数：类方法在前（按类声明顺序），自由函数在后
     */
    public List<Function> getAllFunctions() {
        List<Function> all = new ArrayList<Function>();
        for (ClassDecl c : classes) {
            all.addAll(c.getMethods());
        }
        all.addAll(functions);
        return all;
    }
}
