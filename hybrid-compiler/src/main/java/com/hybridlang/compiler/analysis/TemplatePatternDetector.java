package com.hybridlang.compiler.analysis;

import com.hybridlang.compiler.ir.ClassDecl;
import com.hybridlang.compiler.ir.Function;
import com.hybridlang.compiler.ir.Parameter;

import java.util.Arrays;
import java.util.HashSet;
import java.util.Set;

/**
 * 模板形态启发式：只用于选择生成策略，不作语义保证
 */
public final class TemplatePatternDetector {

    private static final Set<String> CONTAINER_METHODS = new HashSet<String>(Arrays.asList(
            "push_back", "insert", "size", "begin", "end"));

    private TemplatePatternDetector() {}

    /** 模板类且含容器风格方法 */
    public static boolean isContainerTemplate(ClassDecl cls) {
        if (!cls.isTemplate()) return false;
        for (Function m : cls.getMethods()) {
            if (CONTAINER_METHODS.contains(m.getName())) return true;
        }
        return false;
    }

    /** 模板函数且有迭代器形参 */
    public static boolean isAlgorithmTemplate(Function fn) {
        if (!fn.isTemplate()) return false;
        for (Parameter p : fn.getParameters()) {
            String typeName = p.getType().getName();
            if (typeName.contains("Iterator") || typeName.contains("iterator")) return true;
        }
        return false;
    }

    /** 返回类型或形参类型里出现 enable_if。没有返回类型（构造器）不算 */
    public static boolean hasSfinaePattern(Function fn) {
        if (fn.getReturnType() != null && fn.getReturnType().getName().contains("enable_if")) {
            return true;
        }
        for (Parameter p : fn.getParameters()) {
            if (p.getType().getName().contains("enable_if")) return true;
        }
        return false;
    }
}
