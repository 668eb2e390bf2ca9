package com.hybridlang.backend.codegen;

import com.hybridlang.backend.TranspilerOptions;
import com.hybridlang.compiler.ir.ClassDecl;
import com.hybridlang.compiler.ir.Function;
import com.hybridlang.compiler.ir.IrModule;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;

/**
 * 单次生成调用的上下文：输出缓冲、导入集合、当前类 / 函数。
 *
 * <p>每次 generate 新建，生成器本身不保存任何调用间状态。</p>
 */
public class GenerationContext {
    private final IrModule module;
    private final TranspilerOptions options;
    private final CodeWriter out;
    private final Set<String> imports = new TreeSet<String>();
    private final Map<String, String> errorTypes = new LinkedHashMap<String, String>();
    private ClassDecl currentClass;
    private Function currentFunction;

    public GenerationContext(IrModule module, TranspilerOptions options, CodeWriter out) {
        this.module = module;
        this.options = options;
        this.out = out;
    }

    public IrModule getModule() {
        return module;
    }

    public TranspilerOptions getOptions() {
        return options;
    }

    public CodeWriter getOut() {
        return out;
    }

    public void addImport(String path) {
        imports.add(path);
    }

    /**
     * 按字典序排列的导入
     */
    public Set<String> getImports() {
        return Collections.unmodifiableSet(imports);
    }

    /**
     * 源异常类型 → 目标错误类型名
     */
    public Map<String, String> getErrorTypes() {
        return errorTypes;
    }

    public ClassDecl getCurrentClass() {
        return currentClass;
    }

    public void setCurrentClass(ClassDecl currentClass) {
        this.currentClass = currentClass;
    }

    public Function getCurrentFunction() {
        return currentFunction;
    }

    public void setCurrentFunction(Function currentFunction) {
        this.currentFunction = currentFunction;
    }

    public boolean isInClass() {
        return currentClass != null;
    }
}
