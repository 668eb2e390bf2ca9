package com.hybridlang.backend.codegen.rust;

import com.hybridlang.backend.TargetProfile;
import com.hybridlang.backend.TranspilerOptions;
import com.hybridlang.backend.codegen.AbstractCodeGenerator;
import com.hybridlang.backend.codegen.CodeWriter;
import com.hybridlang.backend.codegen.CountedLoop;
import com.hybridlang.backend.codegen.ExprToken;
import com.hybridlang.backend.codegen.GenerationContext;
import com.hybridlang.backend.codegen.NameSanitizer;
import com.hybridlang.backend.codegen.SimpleBody;
import com.hybridlang.compiler.analysis.TemplateConversion;
import com.hybridlang.compiler.ir.AccessLevel;
import com.hybridlang.compiler.ir.AsyncOperation;
import com.hybridlang.compiler.ir.AsyncTaskInfo;
import com.hybridlang.compiler.ir.AtomicInfo;
import com.hybridlang.compiler.ir.ClassDecl;
import com.hybridlang.compiler.ir.ConditionVariableInfo;
import com.hybridlang.compiler.ir.EnumDecl;
import com.hybridlang.compiler.ir.Function;
import com.hybridlang.compiler.ir.FutureInfo;
import com.hybridlang.compiler.ir.IrModule;
import com.hybridlang.compiler.ir.LockInfo;
import com.hybridlang.compiler.ir.MutexInfo;
import com.hybridlang.compiler.ir.NonTypeParam;
import com.hybridlang.compiler.ir.Parameter;
import com.hybridlang.compiler.ir.PointerOwnership;
import com.hybridlang.compiler.ir.TemplateParameter;
import com.hybridlang.compiler.ir.ThreadInfo;
import com.hybridlang.compiler.ir.TryCatchBlock;
import com.hybridlang.compiler.ir.Type;
import com.hybridlang.compiler.ir.TypeKind;
import com.hybridlang.compiler.ir.Variable;
import com.hybridlang.compiler.parser.CppText;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Target-Alpha 生成器：输出 Rust（edition 2021）。
 *
 * <ul>
 *   <li>类 → struct + 固有 impl；多态类与基类 → trait，派生类逐个实现</li>
 *   <li>可能抛出 / 含 catch 的函数 → {@code Result<T, HybridError>}，catch 子句 → match 分支</li>
 *   <li>线程 → {@code thread::spawn} + join；锁 → guard；原子量 → {@code std::sync::atomic}</li>
 *   <li>协程 → {@code async fn} / {@code .await}；生成器 → 同步通道驱动的迭代器</li>
 * </ul>
 */
public class RustCodeGenerator extends AbstractCodeGenerator<RustCodeGenerator.RustContext> {

    private static final String ERROR_TYPE = "HybridError";
    private static final Pattern INTEGER_LITERAL = Pattern.compile("-?\\d+");

    /**
     * 单次调用的上下文：在通用上下文之上增加类型映射与 trait 规划
     */
    static final class RustContext extends GenerationContext {
        final RustTypeMapper types;
        /** 类 / 外部基类的简单名 → trait 名 */
        final Map<String, String> traits = new LinkedHashMap<String, String>();
        final Set<String> externalTraits = new LinkedHashSet<String>();

        RustContext(IrModule module, TranspilerOptions options) {
            super(module, options, new CodeWriter("    "));
            this.types = new RustTypeMapper(this);
        }
    }

    public RustCodeGenerator(TranspilerOptions options) {
        super(options);
    }

    @Override
    public TargetProfile getProfile() {
        return TargetProfile.RUST;
    }

    @Override
    protected RustContext createContext(IrModule module) {
        return new RustContext(module, options);
    }

    @Override
    protected String assemble(RustContext ctx) {
        CodeWriter file = new CodeWriter("    ");
        file.line("// Generated by hybrid-transpiler from C++ source.");
        file.line("// Target: Rust (edition 2021)");
        file.line("#![allow(dead_code, unused_variables, unused_mut, unused_imports, non_snake_case)]");
        if (!ctx.getImports().isEmpty()) {
            file.blankLine();
            for (String path : ctx.getImports()) {
                file.line("use " + path + ";");
            }
        }
        file.blankLine();
        file.append(ctx.getOut().getOutput());
        return file.getOutput();
    }

    // ============ 模块 ============

    @Override
    protected void generateModule(RustContext ctx) {
        IrModule module = ctx.getModule();
        planTraits(ctx);

        if (needsErrorType(module, ctx)) {
            generateErrorType(ctx);
        }
        for (EnumDecl e : module.getEnums()) {
            generateEnum(e, ctx);
        }
        for (Variable global : module.getGlobalVariables()) {
            generateGlobal(global, ctx);
        }
        for (String external : ctx.externalTraits) {
            ctx.getOut().blankLine();
            ctx.getOut().line("pub trait " + typeName(external) + " {}");
        }
        for (ClassDecl cls : module.getClasses()) {
            generateClass(cls, ctx);
        }
        for (Function fn : module.getFunctions()) {
            ctx.getOut().blankLine();
            generateFunction(fn, ctx, Role.FREE, fnName(fn.getName()));
        }
    }

    private static boolean needsErrorType(IrModule module, RustContext ctx) {
        if (!ctx.getErrorTypes().isEmpty()) return true;
        for (Function fn : module.getAllFunctions()) {
            if (fn.isFallible()) return true;
        }
        return false;
    }

    /**
     * 每种 C++ 异常类型一个变体，外加兜底的 Other
     */
    private void generateErrorType(RustContext ctx) {
        CodeWriter out = ctx.getOut();
        out.blankLine();
        out.line("/// Errors raised by translated code, one variant per C++ exception type.");
        out.line("#[derive(Debug, Clone, PartialEq)]");
        out.open("pub enum " + ERROR_TYPE + " {");
        for (String variant : ctx.getErrorTypes().values()) {
            out.line(variant + "(String),");
        }
        out.line("Other(String),");
        out.close("}");
        out.blankLine();
        out.open("impl std::fmt::Display for " + ERROR_TYPE + " {");
        out.open("fn fmt(&self, f: &mut std::fmt::Formatter<'_>) -> std::fmt::Result {");
        out.open("match self {");
        for (Map.Entry<String, String> e : ctx.getErrorTypes().entrySet()) {
            out.line(ERROR_TYPE + "::" + e.getValue() + "(msg) => write!(f, \"" + e.getKey() + ": {}\", msg),");
        }
        out.line(ERROR_TYPE + "::Other(msg) => write!(f, \"{}\", msg),");
        out.close("}");
        out.close("}");
        out.close("}");
        out.blankLine();
        out.line("impl std::error::Error for " + ERROR_TYPE + " {}");
    }

    private void generateEnum(EnumDecl e, RustContext ctx) {
        CodeWriter out = ctx.getOut();
        out.blankLine();
        out.line("#[derive(Debug, Clone, Copy, PartialEq, Eq)]");
        out.open("pub enum " + typeName(e.getName()) + " {");
        for (String item : e.getEnumerators()) {
            String value = e.getValue(item);
            String variant = NameSanitizer.sanitize(variantName(item), TargetProfile.RUST);
            if (value != null && INTEGER_LITERAL.matcher(value).matches()) {
                out.line(variant + " = " + value + ",");
            } else {
                out.line(variant + ",");
            }
        }
        out.close("}");
    }

    /** {@code RED} / {@code red} 得到 {@code Red} */
    private static String variantName(String enumerator) {
        if (enumerator.equals(enumerator.toUpperCase())) {
            StringBuilder sb = new StringBuilder();
            for (String part : enumerator.toLowerCase().split("_")) {
                if (!part.isEmpty()) sb.append(NameSanitizer.capitalize(part));
            }
            return sb.toString();
        }
        return NameSanitizer.capitalize(enumerator);
    }

    private void generateGlobal(Variable global, RustContext ctx) {
        CodeWriter out = ctx.getOut();
        Type type = global.getType();
        String name = constName(global.getName());
        String mapped = ctx.types.map(type);
        String init = global.hasInitializer()
                ? renderExpression(global.getInitializer(), new RustResolver(ctx, null, false), type) : null;
        out.blankLine();
        if (type.getKind() == TypeKind.ATOMIC) {
            out.line("pub static " + name + ": " + mapped + " = " + ctx.types.defaultValue(type) + ";");
        } else if (global.isConst() || type.isConst()) {
            out.line("pub const " + name + ": " + mapped + " = "
                    + (init != null ? init : ctx.types.defaultValue(type)) + ";");
        } else if (init != null || type.getKind().isPrimitive()) {
            ctx.addImport("std::sync::Mutex");
            out.line("pub static " + name + ": Mutex<" + mapped + "> = Mutex::new("
                    + (init != null ? init : ctx.types.defaultValue(type)) + ");");
        } else {
            out.line("// global " + global.getName() + ": " + type.getName() + " has no constant initializer");
        }
    }

    // ============ trait 规划 ============

    private void planTraits(RustContext ctx) {
        IrModule module = ctx.getModule();
        Set<String> usedAsBase = new HashSet<String>();
        for (ClassDecl cls : module.getClasses()) {
            for (String base : cls.getBaseClasses()) {
                usedAsBase.add(simpleName(base));
            }
        }
        for (ClassDecl cls : module.getClasses()) {
            if (cls.getSpecialization().isSpecialization()) continue;
            String simple = simpleName(cls.getName());
            // 只重写祖先虚函数的叶子类直接实现祖先 trait，不生成空 trait
            boolean introducesVirtuals = cls.isPolymorphic() && !ownTraitMethods(cls, module).isEmpty();
            if (cls.isInterfaceLike() || usedAsBase.contains(simple) || introducesVirtuals) {
                ctx.traits.put(simple, cls.isInterfaceLike() ? simple : simple + "Trait");
            }
        }
        for (ClassDecl cls : module.getClasses()) {
            for (String base : cls.getBaseClasses()) {
                String simple = simpleName(base);
                if (!ctx.traits.containsKey(simple)) {
                    ctx.traits.put(simple, simple);
                    ctx.externalTraits.add(simple);
                }
            }
        }
    }

    /** 该类新引入的虚函数：不与任何祖先的虚函数同名 */
    private static List<Function> ownTraitMethods(ClassDecl cls, IrModule module) {
        Set<String> inherited = new HashSet<String>();
        collectAncestorVirtuals(cls, module, inherited, new HashSet<String>());
        List<Function> result = new ArrayList<Function>();
        for (Function m : cls.getVirtualMethods()) {
            if (!inherited.contains(m.getName())) result.add(m);
        }
        return result;
    }

    private static void collectAncestorVirtuals(ClassDecl cls, IrModule module, Set<String> names, Set<String> visited) {
        for (String base : cls.getBaseClasses()) {
            ClassDecl b = module.findClass(simpleName(base));
            if (b == null || !visited.add(b.getName())) continue;
            for (Function m : b.getVirtualMethods()) {
                names.add(m.getName());
            }
            collectAncestorVirtuals(b, module, names, visited);
        }
    }

    /** 自身（若有 trait）与所有祖先，按从近到远的顺序 */
    private static List<String> traitLineage(ClassDecl cls, RustContext ctx) {
        List<String> lineage = new ArrayList<String>();
        if (ctx.traits.containsKey(simpleName(cls.getName())) && !cls.getSpecialization().isSpecialization()) {
            lineage.add(simpleName(cls.getName()));
        }
        collectLineage(cls, ctx, lineage);
        return lineage;
    }

    private static void collectLineage(ClassDecl cls, RustContext ctx, List<String> lineage) {
        for (String base : cls.getBaseClasses()) {
            String simple = simpleName(base);
            if (lineage.contains(simple)) continue;
            lineage.add(simple);
            ClassDecl b = ctx.getModule().findClass(simple);
            if (b != null) collectLineage(b, ctx, lineage);
        }
    }

    // ============ 类 ============

    private void generateClass(ClassDecl cls, RustContext ctx) {
        ctx.setCurrentClass(cls);
        try {
            if (cls.isInterfaceLike()) {
                generateTrait(cls, ctx);
                return;
            }
            generateStruct(cls, ctx);
            generateImpl(cls, ctx);
            String simple = simpleName(cls.getName());
            if (ctx.traits.containsKey(simple) && !cls.getSpecialization().isSpecialization()) {
                generateTrait(cls, ctx);
            }
            generateTraitImplementations(cls, ctx);
            Function dtor = destructor(cls);
            if (dtor != null) {
                generateDrop(cls, dtor, ctx);
            }
        } finally {
            ctx.setCurrentClass(null);
        }
    }

    private void generateStruct(ClassDecl cls, RustContext ctx) {
        CodeWriter out = ctx.getOut();
        out.blankLine();
        writeContainerNote(out, cls, "len()");
        if (isDerivable(cls)) {
            out.line("#[derive(Debug, Clone, Default)]");
        }
        out.open("pub struct " + typeName(className(cls)) + genericParams(cls) + " {");
        for (Map.Entry<String, ClassDecl> base : compositionBases(cls, ctx).entrySet()) {
            out.line(base.getKey() + ": " + typeName(base.getValue().getName()) + ",");
        }
        List<String> mappedFields = new ArrayList<String>();
        for (Variable field : cls.getFields()) {
            if (field.isStatic()) continue;
            String mapped = ctx.types.map(field.getType());
            mappedFields.add(mapped);
            String vis = cls.getAccessOf(field.getName()) == AccessLevel.PUBLIC ? "pub " : "";
            out.line(vis + varName(field.getName()) + ": " + mapped + ",");
        }
        List<String> unused = unusedTypeParams(cls, mappedFields);
        if (!unused.isEmpty()) {
            out.line("_marker: std::marker::PhantomData<(" + join(unused, ", ") + ",)>,");
        }
        out.close("}");
    }

    /** 未出现在任何字段类型里的类型形参需要 PhantomData 占位 */
    private static List<String> unusedTypeParams(ClassDecl cls, List<String> mappedFields) {
        List<String> unused = new ArrayList<String>();
        for (String name : templateParamNames(cls.getTemplateParameters(), false)) {
            Pattern p = Pattern.compile("\\b" + Pattern.quote(name) + "\\b");
            boolean used = false;
            for (String field : mappedFields) {
                if (p.matcher(field).find()) {
                    used = true;
                    break;
                }
            }
            if (!used) unused.add(name);
        }
        return unused;
    }

    /** 字段只含基本类型、字符串、容器和模板形参时可以派生常用 trait */
    private static boolean isDerivable(ClassDecl cls) {
        for (Variable field : cls.getFields()) {
            if (!isPlain(field.getType())) return false;
        }
        return true;
    }

    private static boolean isPlain(Type type) {
        if (type == null) return true;
        TypeKind kind = type.getKind();
        if (kind.isPrimitive() || kind == TypeKind.STD_STRING || kind == TypeKind.TEMPLATE_PARAM
                || kind == TypeKind.ENUM) {
            return true;
        }
        if (kind.isContainer()) {
            for (Type arg : type.getTemplateArgs()) {
                if (!isPlain(arg)) return false;
            }
            return true;
        }
        return false;
    }

    /**
     * 具体（非接口、非模板）基类以组合字段嵌入：单基类字段名为 base，多基类为 base_xxx
     */
    private static Map<String, ClassDecl> compositionBases(ClassDecl cls, GenerationContext ctx) {
        List<ClassDecl> concrete = new ArrayList<ClassDecl>();
        for (String base : cls.getBaseClasses()) {
            if (base.indexOf('<') >= 0) continue;
            ClassDecl b = ctx.getModule().findClass(simpleName(base));
            if (b != null && !b.isInterfaceLike() && !b.isTemplate()) concrete.add(b);
        }
        Map<String, ClassDecl> result = new LinkedHashMap<String, ClassDecl>();
        for (ClassDecl b : concrete) {
            result.put(concrete.size() == 1 ? "base" : "base_" + varName(b.getName()), b);
        }
        return result;
    }

    private void generateImpl(ClassDecl cls, RustContext ctx) {
        CodeWriter out = ctx.getOut();
        out.blankLine();
        out.open("impl" + genericParams(cls) + " " + typeName(className(cls)) + genericArgs(cls) + " {");
        boolean first = true;

        for (Variable field : cls.getFields()) {
            if (!field.isStatic()) continue;
            if (field.isConst() || field.getType().isConst()) {
                String init = field.hasInitializer()
                        ? renderExpression(field.getInitializer(), new RustResolver(ctx, null, false), field.getType())
                        : null;
                out.line("pub const " + constName(field.getName()) + ": " + ctx.types.map(field.getType()) + " = "
                        + (init != null ? init : ctx.types.defaultValue(field.getType())) + ";");
            } else {
                out.line("// static " + field.getName() + ": " + field.getType().getName()
                        + " is shared by all instances; see module-level state");
            }
            first = false;
        }

        List<Function> ctors = constructors(cls);
        if (ctors.isEmpty()) {
            if (!first) out.blankLine();
            generateDefaultConstructor(cls, ctx);
            first = false;
        }
        Map<Function, String> ctorNames = constructorNames(ctors);
        for (Function ctor : ctors) {
            if (!first) out.blankLine();
            generateConstructor(cls, ctor, ctorNames.get(ctor), ctx);
            first = false;
        }

        Set<String> used = new HashSet<String>(ctorNames.values());
        for (Function m : ordinaryMethods(cls)) {
            if (m.isPolymorphic()) continue;  // 进入 trait impl
            if (!first) out.blankLine();
            generateFunction(m, ctx, Role.INHERENT, uniqueName(used, fnName(m.getName()), m));
            first = false;
        }
        out.close("}");
    }

    private static Map<Function, String> constructorNames(List<Function> ctors) {
        Map<Function, String> names = new LinkedHashMap<Function, String>();
        Set<String> used = new HashSet<String>();
        boolean hasDefault = false;
        for (Function c : ctors) {
            if (c.getParameters().isEmpty()) hasDefault = true;
        }
        for (Function c : ctors) {
            String candidate;
            if (ctors.size() == 1 || c.getParameters().isEmpty() || (!hasDefault && names.isEmpty())) {
                candidate = "new";
            } else {
                List<String> params = new ArrayList<String>();
                for (Parameter p : c.getParameters()) {
                    params.add(varName(p.getName()));
                }
                candidate = "with_" + join(params, "_");
            }
            String name = candidate;
            int n = 2;
            while (used.contains(name)) {
                name = candidate + "_" + n++;
            }
            used.add(name);
            names.put(c, name);
        }
        return names;
    }

    private void generateDefaultConstructor(ClassDecl cls, RustContext ctx) {
        CodeWriter out = ctx.getOut();
        out.open("pub fn new() -> Self {");
        writeStructLiteral(cls, fieldDefaults(cls, ctx), ctx, false);
        out.close("}");
    }

    private void generateConstructor(ClassDecl cls, Function ctor, String name, RustContext ctx) {
        CodeWriter out = ctx.getOut();
        ctx.setCurrentFunction(ctor);
        try {
            String ret = ctor.isFallible() ? "Result<Self, " + ERROR_TYPE + ">" : "Self";
            out.open("pub fn " + name + "(" + parameterList(ctor, ctx, false) + ") -> " + ret + " {");
            writeSafetyChecks(ctor, ctx);

            Map<String, String> values = fieldDefaults(cls, ctx);
            RustResolver resolver = new RustResolver(ctx, ctor, false);
            Map<String, ClassDecl> bases = compositionBases(cls, ctx);
            for (Map.Entry<String, String> init : ctor.getMemberInitializers().entrySet()) {
                String member = init.getKey();
                Variable field = cls.findField(member);
                String rendered = null;
                String key = null;
                if (field != null) {
                    key = varName(member);
                    rendered = renderExpression(init.getValue(), resolver, field.getType());
                } else {
                    for (Map.Entry<String, ClassDecl> base : bases.entrySet()) {
                        if (simpleName(base.getValue().getName()).equals(simpleName(member))) {
                            key = base.getKey();
                            rendered = renderBaseConstruction(base.getValue(), init.getValue(), resolver);
                        }
                    }
                }
                if (key != null && rendered != null) {
                    values.put(key, rendered);
                } else if (options.isPreserveComments()) {
                    out.line("// " + member + "(" + init.getValue() + ")");
                }
            }

            SimpleBody body = SimpleBody.parse(ctor.getBody());
            if (body != null && !body.hasReturn()) {
                for (SimpleBody.Assignment a : body.getAssignments()) {
                    Variable field = cls.findField(a.getTarget());
                    String rendered = field == null || !"=".equals(a.getOperator()) ? null
                            : SimpleBody.render(a.getValue(), resolver, isFloat(field.getType()));
                    if (rendered != null) {
                        values.put(varName(field.getName()), rendered);
                    } else if (options.isPreserveComments()) {
                        out.line("// " + a.getTarget() + " " + a.getOperator() + " ...;");
                    }
                }
            } else {
                writeOriginalBody(out, ctor);
            }
            writeStructLiteral(cls, values, ctx, ctor.isFallible());
            out.close("}");
        } finally {
            ctx.setCurrentFunction(null);
        }
    }

    private String renderBaseConstruction(ClassDecl base, String args, RustResolver resolver) {
        List<String> rendered = new ArrayList<String>();
        for (String arg : CppText.splitArguments(args)) {
            String r = renderExpression(arg, resolver, null);
            if (r == null) return null;
            rendered.add(r);
        }
        return typeName(base.getName()) + "::new(" + join(rendered, ", ") + ")";
    }

    /** 字段默认值：类内初始化器优先，否则类型零值 */
    private Map<String, String> fieldDefaults(ClassDecl cls, RustContext ctx) {
        Map<String, String> values = new LinkedHashMap<String, String>();
        for (Map.Entry<String, ClassDecl> base : compositionBases(cls, ctx).entrySet()) {
            values.put(base.getKey(), typeName(base.getValue().getName()) + "::new()");
        }
        RustResolver resolver = new RustResolver(ctx, null, false);
        for (Variable field : cls.getFields()) {
            if (field.isStatic()) continue;
            String init = field.hasInitializer()
                    ? renderExpression(field.getInitializer(), resolver, field.getType()) : null;
            values.put(varName(field.getName()), init != null ? init : ctx.types.defaultValue(field.getType()));
        }
        return values;
    }

    private void writeStructLiteral(ClassDecl cls, Map<String, String> values, RustContext ctx, boolean wrapOk) {
        CodeWriter out = ctx.getOut();
        List<String> mapped = new ArrayList<String>();
        for (Variable field : cls.getFields()) {
            if (!field.isStatic()) mapped.add(ctx.types.map(field.getType()));
        }
        boolean marker = !unusedTypeParams(cls, mapped).isEmpty();
        if (values.isEmpty() && !marker) {
            out.line(wrapOk ? "Ok(Self {})" : "Self {}");
            return;
        }
        out.open(wrapOk ? "Ok(Self {" : "Self {");
        for (Map.Entry<String, String> e : values.entrySet()) {
            out.line(e.getKey().equals(e.getValue()) ? e.getKey() + "," : e.getKey() + ": " + e.getValue() + ",");
        }
        if (marker) {
            out.line("_marker: std::marker::PhantomData,");
        }
        out.close(wrapOk ? "})" : "}");
    }

    private void generateDrop(ClassDecl cls, Function dtor, RustContext ctx) {
        CodeWriter out = ctx.getOut();
        ctx.setCurrentFunction(dtor);
        try {
            out.blankLine();
            out.open("impl" + genericParams(cls) + " Drop for " + typeName(className(cls)) + genericArgs(cls) + " {");
            out.open("fn drop(&mut self) {");
            if (!writeSimpleBody(dtor, ctx, new RustResolver(ctx, dtor, false))) {
                writeOriginalBody(out, dtor);
                generateThreadingCode(dtor, ctx);
            }
            out.close("}");
            out.close("}");
        } finally {
            ctx.setCurrentFunction(null);
        }
    }

    // ============ trait ============

    private void generateTrait(ClassDecl cls, RustContext ctx) {
        CodeWriter out = ctx.getOut();
        String simple = simpleName(cls.getName());
        List<String> supertraits = new ArrayList<String>();
        for (String base : cls.getBaseClasses()) {
            String t = ctx.traits.get(simpleName(base));
            if (t != null) supertraits.add(typeName(t));
        }
        List<Function> methods = ownTraitMethods(cls, ctx.getModule());
        out.blankLine();
        String header = "pub trait " + typeName(ctx.traits.get(simple))
                + (supertraits.isEmpty() ? "" : ": " + join(supertraits, " + "));
        if (methods.isEmpty()) {
            out.line(header + " {}");
            return;
        }
        out.open(header + " {");
        Set<String> used = new HashSet<String>();
        boolean first = true;
        for (Function m : methods) {
            if (!first) out.blankLine();
            Role role = cls.isInterfaceLike() && !m.isPureVirtual() ? Role.TRAIT_DEFAULT : Role.TRAIT_DECL;
            generateFunction(m, ctx, role, uniqueName(used, fnName(m.getName()), m));
            first = false;
        }
        out.close("}");
    }

    /**
     * 为自身及每个祖先的 trait 生成 impl；未重写的方法委托给组合字段或使用默认实现
     */
    private void generateTraitImplementations(ClassDecl cls, RustContext ctx) {
        CodeWriter out = ctx.getOut();
        String self = typeName(className(cls)) + genericArgs(cls);
        Map<String, ClassDecl> bases = compositionBases(cls, ctx);

        for (String traitOwner : traitLineage(cls, ctx)) {
            String traitName = typeName(ctx.traits.get(traitOwner));
            ClassDecl owner = ctx.getModule().findClass(traitOwner);
            List<Function> methods = owner == null || ctx.externalTraits.contains(traitOwner)
                    ? Collections.<Function>emptyList() : ownTraitMethods(owner, ctx.getModule());
            out.blankLine();
            String header = "impl" + genericParams(cls) + " " + traitName + " for " + self;
            if (methods.isEmpty()) {
                out.line(header + " {}");
                continue;
            }
            out.open(header + " {");
            Set<String> used = new HashSet<String>();
            boolean first = true;
            for (Function declared : methods) {
                String name = uniqueName(used, fnName(declared.getName()), declared);
                Function impl = owner == cls ? declared : findMethod(cls, declared.getName());
                if (impl != null) {
                    if (!first) out.blankLine();
                    generateFunction(impl, ctx, Role.TRAIT_IMPL, name);
                    first = false;
                    continue;
                }
                if (owner.isInterfaceLike() && !declared.isPureVirtual()) {
                    continue;  // trait 默认实现
                }
                if (!first) out.blankLine();
                String delegate = delegateField(bases, owner, ctx);
                generateDelegation(declared, name, delegate, ctx);
                first = false;
            }
            out.close("}");
        }
    }

    /** 能提供 owner trait 实现的组合字段 */
    private static String delegateField(Map<String, ClassDecl> bases, ClassDecl owner, RustContext ctx) {
        for (Map.Entry<String, ClassDecl> base : bases.entrySet()) {
            if (base.getValue() == owner || traitLineage(base.getValue(), ctx).contains(simpleName(owner.getName()))) {
                return base.getKey();
            }
        }
        return null;
    }

    private void generateDelegation(Function declared, String name, String field, RustContext ctx) {
        CodeWriter out = ctx.getOut();
        out.open("fn " + name + "(" + parameterList(declared, ctx, true) + ")" + returnClause(declared, ctx) + " {");
        if (field != null) {
            List<String> args = new ArrayList<String>();
            for (Parameter p : declared.getParameters()) {
                args.add(varName(p.getName()));
            }
            out.line("self." + field + "." + name + "(" + join(args, ", ") + ")");
        } else {
            out.line("todo!(\"" + declared.getName() + " is not implemented\")");
        }
        out.close("}");
    }

    // ============ 函数 ============

    private enum Role {
        FREE, INHERENT, TRAIT_DECL, TRAIT_DEFAULT, TRAIT_IMPL
    }

    private void generateFunction(Function fn, RustContext ctx, Role role, String name) {
        CodeWriter out = ctx.getOut();
        ctx.setCurrentFunction(fn);
        try {
            boolean isMain = role == Role.FREE && "main".equals(fn.getName());
            StringBuilder sig = new StringBuilder();
            if (role == Role.FREE && !isMain) {
                sig.append("pub ");
            } else if (role == Role.INHERENT && isPublic(fn, ctx)) {
                sig.append("pub ");
            }
            if (isAsyncCoroutine(fn)) sig.append("async ");
            sig.append("fn ").append(name);
            sig.append(TemplateConversion.toAlphaGenericBounds(fn.getTemplateParameters()));
            sig.append('(').append(parameterList(fn, ctx, ctx.isInClass())).append(')');
            if (!isMain) {
                sig.append(returnClause(fn, ctx));
            } else if (fn.isFallible()) {
                sig.append(" -> Result<(), ").append(ERROR_TYPE).append('>');
            }

            writeTemplateNotes(out, fn);
            if (role == Role.TRAIT_DECL) {
                out.line(sig + ";");
                return;
            }
            if (isEmptyUnitBody(fn)) {
                out.line(sig + " {}");
                return;
            }
            out.open(sig + " {");
            writeSafetyChecks(fn, ctx);
            RustResolver resolver = new RustResolver(ctx, fn, role != Role.TRAIT_DEFAULT);
            if (isMain) {
                generateMainBody(fn, ctx);
            } else if (fn.getCoroutineInfo().isCoroutine()) {
                generateCoroutineBody(fn, ctx);
            } else if (!writeSimpleBody(fn, ctx, resolver)) {
                generateFallbackBody(fn, ctx);
            }
            out.close("}");
        } finally {
            ctx.setCurrentFunction(null);
        }
    }

    private static boolean isEmptyUnitBody(Function fn) {
        return fn.hasBody() && fn.getBody().trim().isEmpty() && fn.returnsVoid() && !fn.isFallible()
                && !hasRawPointerParam(fn);
    }

    private static boolean isPublic(Function fn, RustContext ctx) {
        ClassDecl cls = ctx.getCurrentClass();
        return cls == null || cls.getAccessOf(fn.getName()) == AccessLevel.PUBLIC;
    }

    private static boolean isAsyncCoroutine(Function fn) {
        return fn.getCoroutineInfo().isCoroutine() && !fn.getCoroutineInfo().isGenerator();
    }

    private String parameterList(Function fn, RustContext ctx, boolean withReceiver) {
        List<String> params = new ArrayList<String>();
        if (withReceiver && !fn.isStatic() && !fn.isConstructor()) {
            params.add(fn.isConst() ? "&self" : "&mut self");
        }
        for (Parameter p : fn.getParameters()) {
            String pname = p.getName().isEmpty() ? "_arg" + params.size() : varName(p.getName());
            params.add(pname + ": " + ctx.types.mapParameter(p.getType(), fn.isBorrowed(p.getName())
                    && p.getType().getKind() != TypeKind.TEMPLATE_PARAM));
        }
        return join(params, ", ");
    }

    private String returnClause(Function fn, RustContext ctx) {
        String value = returnValueType(fn, ctx);
        if (fn.isFallible()) {
            return " -> Result<" + (value == null ? "()" : value) + ", " + ERROR_TYPE + ">";
        }
        return value == null ? "" : " -> " + value;
    }

    /** 返回值类型（不含 Result 包装），unit 时为 null */
    private String returnValueType(Function fn, RustContext ctx) {
        if (fn.isConstructor()) return "Self";
        if (fn.getCoroutineInfo().isCoroutine()) {
            Type value = fn.getReturnType() == null ? null : fn.getReturnType().getTemplateArg(0);
            if (fn.getCoroutineInfo().isGenerator()) {
                return "impl Iterator<Item = " + (value == null ? "()" : ctx.types.map(value)) + ">";
            }
            return value == null || value.getKind() == TypeKind.VOID ? null : ctx.types.map(value);
        }
        if (fn.returnsVoid()) return null;
        return ctx.types.mapReturn(fn.getReturnType());
    }

    private static boolean hasRawPointerParam(Function fn) {
        for (Parameter p : fn.getParameters()) {
            if (isRawPointer(p.getType())) return true;
        }
        return false;
    }

    private static boolean isRawPointer(Type type) {
        return type.getKind() == TypeKind.POINTER && type.getOwnership() == PointerOwnership.RAW;
    }

    private void writeSafetyChecks(Function fn, RustContext ctx) {
        if (!options.isEnableSafetyChecks()) return;
        for (Parameter p : fn.getParameters()) {
            if (isRawPointer(p.getType()) && !p.getName().isEmpty()) {
                String name = varName(p.getName());
                ctx.getOut().line("assert!(!" + name + ".is_null(), \"" + name + " must not be null\");");
            }
        }
    }

    /**
     * 直接转换简单函数体；不可转换时不写任何内容并返回 false
     */
    private boolean writeSimpleBody(Function fn, RustContext ctx, RustResolver resolver) {
        SimpleBody body = SimpleBody.parse(fn.getBody());
        if (body == null) return false;
        boolean unit = returnValueType(fn, ctx) == null;
        if (!unit && !body.hasReturn()) return false;
        if (unit && body.hasReturn() && !body.getReturnValue().isEmpty()) return false;

        List<String> lines = new ArrayList<String>();
        for (SimpleBody.Assignment a : body.getAssignments()) {
            String target = resolver.resolve(a.getTarget(), false, false);
            Variable field = findField(ctx.getCurrentClass(), a.getTarget());
            if (target == null || !target.startsWith("self.") || field == null) return false;
            String value = SimpleBody.render(a.getValue(), resolver, isFloat(field.getType()));
            if (value == null) return false;
            lines.add(target + " " + a.getOperator() + " " + value + ";");
        }
        if (!unit) {
            String value = renderReturn(fn, body.getReturnValue(), resolver, ctx);
            if (value == null) return false;
            lines.add(fn.isFallible() ? "Ok(" + value + ")" : value);
        } else if (fn.isFallible()) {
            lines.add("Ok(())");
        }
        for (String line : lines) {
            ctx.getOut().line(line);
        }
        return true;
    }

    /** 单独返回字段时按返回类型借用或克隆 */
    private String renderReturn(Function fn, List<ExprToken> tokens, RustResolver resolver, RustContext ctx) {
        Type ret = fn.getReturnType();
        String value = SimpleBody.render(tokens, resolver, isFloat(ret));
        if (value == null) return null;
        if (tokens.size() == 1 && value.startsWith("self.")) {
            if (ret.getKind() == TypeKind.REFERENCE) {
                boolean mutable = !ret.isConst() && !fn.isConst();
                return (mutable ? "&mut " : "&") + value;
            }
            Variable field = findField(ctx.getCurrentClass(), tokens.get(0).getText());
            if (field != null && !RustTypeMapper.isCopy(field.getType())) {
                return value + ".clone()";
            }
        }
        return value;
    }

    private static boolean isFloat(Type type) {
        if (type == null) return false;
        if (type.getKind() == TypeKind.REFERENCE && type.getElementType() != null) {
            return type.getElementType().getKind() == TypeKind.FLOAT;
        }
        return type.getKind() == TypeKind.FLOAT;
    }

    /**
     * 不可直接转换的函数体：原文注释 + 各描述符的转换 + 占位实现
     */
    private void generateFallbackBody(Function fn, RustContext ctx) {
        CodeWriter out = ctx.getOut();
        writeOriginalBody(out, fn);
        generateThreadingCode(fn, ctx);
        generateFutures(fn, ctx);
        generateAsyncTasks(fn, ctx);
        if (fn.isFallible()) {
            generateTryCatchAsResult(fn, ctx);
        }
        if (returnValueType(fn, ctx) != null) {
            out.line("todo!()");
        } else if (fn.isFallible()) {
            out.line("Ok(())");
        }
    }

    /** main 没有返回值；可能出错时返回 {@code Result<(), HybridError>} */
    private void generateMainBody(Function fn, RustContext ctx) {
        writeOriginalBody(ctx.getOut(), fn);
        generateThreadingCode(fn, ctx);
        generateFutures(fn, ctx);
        generateAsyncTasks(fn, ctx);
        if (fn.isFallible()) {
            generateTryCatchAsResult(fn, ctx);
            ctx.getOut().line("Ok(())");
        }
    }

    // ============ 异常 ============

    private void generateTryCatchAsResult(Function fn, RustContext ctx) {
        CodeWriter out = ctx.getOut();
        int index = 0;
        for (TryCatchBlock block : fn.getTryCatchBlocks()) {
            String var = index == 0 ? "outcome" : "outcome_" + (index + 1);
            index++;
            out.open("let " + var + ": Result<(), " + ERROR_TYPE + "> = (|| {");
            if (options.isPreserveComments()) {
                writeSourceComment(out, block.getTryBody());
            }
            out.line("Ok(())");
            out.close("})();");
            out.open("match " + var + " {");
            out.line("Ok(()) => {}");
            boolean catchAll = false;
            for (TryCatchBlock.CatchClause clause : block.getCatchClauses()) {
                String binding = clause.getExceptionVar().isEmpty() ? "_" : varName(clause.getExceptionVar());
                String pattern;
                if (isCatchAllType(clause.getExceptionType())) {
                    pattern = "Err(" + binding + ")";
                    catchAll = true;
                } else {
                    pattern = "Err(" + ERROR_TYPE + "::" + ctx.getErrorTypes().get(clause.getExceptionType())
                            + "(" + binding + "))";
                }
                if (options.isPreserveComments() && !clause.getHandlerBody().trim().isEmpty()) {
                    out.open(pattern + " => {");
                    writeSourceComment(out, clause.getHandlerBody());
                    out.close("}");
                } else {
                    out.line(pattern + " => {}");
                }
                if (catchAll) break;
            }
            if (!catchAll) {
                out.line("Err(e) => return Err(e),");
            }
            out.close("}");
        }
    }

    // ============ 并发 ============

    private void generateThreadingCode(Function fn, RustContext ctx) {
        CodeWriter out = ctx.getOut();
        RustResolver lenient = new RustResolver(ctx, fn, true).lenient();

        for (MutexInfo m : fn.getMutexes()) {
            String type = ctx.types.map(new Type(TypeKind.MUTEX, "std::" + mutexSpelling(m)));
            out.line("let " + varName(m.getMutexVar()) + " = " + type.substring(0, type.indexOf('<')) + "::new(());");
        }
        for (AtomicInfo a : fn.getAtomics()) {
            if (findField(ctx.getCurrentClass(), a.getVariable()) != null) continue;
            Type atomic = new Type(TypeKind.ATOMIC, "std::atomic", a.getValueType(),
                    Collections.singletonList(a.getValueType()), PointerOwnership.RAW);
            out.line("let " + varName(a.getVariable()) + " = " + ctx.types.defaultValue(atomic) + ";");
        }
        for (ConditionVariableInfo cv : fn.getConditionVariables()) {
            if (findField(ctx.getCurrentClass(), cv.getVariable()) != null) continue;
            ctx.addImport("std::sync::Condvar");
            out.line("let " + varName(cv.getVariable()) + " = Condvar::new();");
        }

        for (LockInfo lock : fn.getLocks()) {
            generateLockScope(lock, fn, ctx, lenient);
        }
        for (AtomicInfo a : fn.getAtomics()) {
            generateAtomicOperations(a, ctx, lenient);
        }
        for (ConditionVariableInfo cv : fn.getConditionVariables()) {
            generateConditionVariable(cv, fn, ctx, lenient);
        }

        Set<String> declaredPools = new HashSet<String>();
        List<String> joins = new ArrayList<String>();
        for (ThreadInfo thread : fn.getThreads()) {
            generateThreadCreation(thread, fn, ctx, lenient, declaredPools, joins);
        }
        for (String join : joins) {
            out.line(join);
        }
    }

    private static String mutexSpelling(MutexInfo m) {
        return m.getKind() == MutexInfo.Kind.SHARED ? "shared_mutex" : "mutex";
    }

    private void generateThreadCreation(ThreadInfo thread, Function fn, RustContext ctx, RustResolver resolver,
                                        Set<String> declaredPools, List<String> joins) {
        CodeWriter out = ctx.getOut();
        ctx.addImport("std::thread");
        String var = thread.getThreadVar();
        if (isThreadPool(fn, ctx.getCurrentClass(), var)) {
            boolean field = findField(ctx.getCurrentClass(), var) != null;
            String pool = field ? "self." + varName(var) : varName(var);
            if (!field && declaredPools.add(var)) {
                ctx.addImport("std::thread::JoinHandle");
                out.line("let mut " + pool + ": Vec<JoinHandle<()>> = Vec::new();");
            }
            writeSpawn(out, pool + ".push(", thread, ctx, resolver, ");");
            if (!joins.contains(joinPool(pool, field))) joins.add(joinPool(pool, field));
        } else if (var.isEmpty()) {
            writeSpawn(out, "", thread, ctx, resolver, ";");
            if (thread.isJoinable()) {
                out.line("// spawned without a handle; the thread runs detached");
            }
        } else {
            String handle = varName(var);
            writeSpawn(out, "let " + handle + " = ", thread, ctx, resolver, ";");
            if (thread.isDetached()) {
                out.line("drop(" + handle + "); // detached");
            } else {
                joins.add(handle + ".join().unwrap();");
            }
        }
    }

    private static String joinPool(String pool, boolean field) {
        return "for handle in " + pool + (field ? ".drain(..)" : "") + " { handle.join().unwrap(); }";
    }

    private void writeSpawn(CodeWriter out, String prefix, ThreadInfo thread, RustContext ctx,
                            RustResolver resolver, String suffix) {
        if (isLambda(thread.getTargetFunction())) {
            out.open(prefix + "thread::spawn(move || {");
            writeSourceComment(out, thread.getTargetFunction());
            out.close("})" + suffix);
        } else {
            out.line(prefix + "thread::spawn(move || " + renderCall(thread.getTargetFunction(),
                    thread.getArguments(), resolver) + ")" + suffix);
        }
    }

    private void generateLockScope(LockInfo lock, Function fn, RustContext ctx, RustResolver resolver) {
        String mutex = resolver.resolve(lock.getMutexVar(), false, false);
        if (mutex == null || lock.getMutexVar().isEmpty()) {
            ctx.getOut().line("// " + lock.getKind().name().toLowerCase() + " lock on unknown mutex");
            return;
        }
        String call;
        if (isSharedMutex(lock.getMutexVar(), fn, ctx)) {
            call = lock.getKind() == LockInfo.Kind.SHARED ? ".read().unwrap()" : ".write().unwrap()";
        } else {
            call = ".lock().unwrap()";
        }
        ctx.getOut().line("let " + guardName(lock) + " = " + mutex + call + ";");
    }

    private static String guardName(LockInfo lock) {
        return lock.getLockVar().isEmpty() ? "_guard" : varName(lock.getLockVar());
    }

    private static boolean isSharedMutex(String var, Function fn, RustContext ctx) {
        List<MutexInfo> all = new ArrayList<MutexInfo>(fn.getMutexes());
        if (ctx.getCurrentClass() != null) all.addAll(ctx.getCurrentClass().getMutexes());
        for (MutexInfo m : all) {
            if (m.getMutexVar().equals(var)) return m.getKind() == MutexInfo.Kind.SHARED;
        }
        return false;
    }

    private void generateAtomicOperations(AtomicInfo atomic, RustContext ctx, RustResolver resolver) {
        CodeWriter out = ctx.getOut();
        String target = resolver.resolve(atomic.getVariable(), false, false);
        String type = ctx.types.atomic(atomic.getValueType());
        for (String op : atomic.getOperations()) {
            if (type.startsWith("Mutex")) {
                out.line("// " + atomic.getVariable() + "." + op + "(...) on a non-integral atomic");
                continue;
            }
            if ("fetch_add".equals(op) || "fetch_sub".equals(op)) {
                out.line(target + "." + op + "(1, Ordering::SeqCst);");
            } else if ("load".equals(op)) {
                out.line("let _ = " + target + ".load(Ordering::SeqCst);");
            } else {
                out.line("// " + target + "." + op + "(..., Ordering::SeqCst);");
            }
        }
    }

    private void generateConditionVariable(ConditionVariableInfo cv, Function fn, RustContext ctx,
                                           RustResolver resolver) {
        CodeWriter out = ctx.getOut();
        String target = resolver.resolve(cv.getVariable(), false, false);
        String mutex = cv.getAssociatedMutex();
        if (!mutex.isEmpty()) {
            String guard = null;
            for (LockInfo lock : fn.getLocks()) {
                if (lock.getMutexVar().equals(mutex)) guard = guardName(lock);
            }
            String source = guard != null ? guard : resolver.resolve(mutex, false, false) + ".lock().unwrap()";
            String bound = guard != null ? guard : "_guard";
            if (cv.getWaitConditions().isEmpty()) {
                out.line("let " + bound + " = " + target + ".wait(" + source + ").unwrap();");
            }
            for (String condition : cv.getWaitConditions()) {
                String rendered = renderExpression(condition, resolver, null);
                if (rendered != null) {
                    out.line("let " + bound + " = " + target + ".wait_while(" + source + ", |_| !(" + rendered
                            + ")).unwrap();");
                } else {
                    out.line("// wait until: " + condition);
                    out.line("let " + bound + " = " + target + ".wait(" + source + ").unwrap();");
                }
                source = bound;
            }
        }
        if (cv.isNotifiesAll()) {
            out.line(target + ".notify_all();");
        } else if (mutex.isEmpty()) {
            out.line(target + ".notify_one();");
        }
    }

    // ============ future / async ============

    private void generateFutures(Function fn, RustContext ctx) {
        CodeWriter out = ctx.getOut();
        for (FutureInfo future : fn.getFutures()) {
            if (!future.hasPromise()) continue;
            ctx.addImport("std::sync::mpsc");
            out.line("let (" + varName(future.getPromiseVar()) + ", " + varName(future.getFutureVar())
                    + ") = mpsc::channel::<" + ctx.types.map(future.getValueType()) + ">();");
        }
    }

    private void generateAsyncTasks(Function fn, RustContext ctx) {
        CodeWriter out = ctx.getOut();
        RustResolver resolver = new RustResolver(ctx, fn, true).lenient();
        for (AsyncTaskInfo task : fn.getAsyncTasks()) {
            ctx.addImport("std::thread");
            String prefix = "";
            if (!task.isDetached()) {
                String annotation = "";
                if (task.getResultType() != null) {
                    ctx.addImport("std::thread::JoinHandle");
                    annotation = ": JoinHandle<" + ctx.types.map(task.getResultType()) + ">";
                }
                prefix = "let " + varName(task.getTaskVar()) + annotation + " = ";
            }
            if (isLambda(task.getFunctionName())) {
                out.open(prefix + "thread::spawn(move || {");
                writeSourceComment(out, task.getFunctionName());
                if (!task.getArguments().isEmpty()) {
                    out.line("// arguments: " + join(task.getArguments(), ", "));
                }
                if (task.getResultType() != null && task.getResultType().getKind() != TypeKind.VOID) {
                    out.line("todo!()");
                }
                out.close("});");
            } else {
                out.line(prefix + "thread::spawn(move || "
                        + renderCall(task.getFunctionName(), task.getArguments(), resolver) + ");");
            }
        }
    }

    // ============ 协程 ============

    private void generateCoroutineBody(Function fn, RustContext ctx) {
        if (fn.getCoroutineInfo().isGenerator()) {
            generateGenerator(fn, ctx);
        } else {
            generateAsyncFunction(fn, ctx);
        }
    }

    /**
     * async fn：挂起点 → .await，最后一个 co_return → 尾表达式
     */
    private void generateAsyncFunction(Function fn, RustContext ctx) {
        CodeWriter out = ctx.getOut();
        writeOriginalBody(out, fn);
        RustResolver resolver = new RustResolver(ctx, fn, true);
        List<AsyncOperation> ops = fn.getCoroutineInfo().getOperations();
        boolean unit = returnValueType(fn, ctx) == null;
        for (int i = 0; i < ops.size(); i++) {
            AsyncOperation op = ops.get(i);
            boolean last = i == ops.size() - 1;
            switch (op.getKind()) {
                case SUSPEND:
                    generateAwaitExpression(op, resolver, ctx);
                    break;
                case RETURN: {
                    if (op.getExpression().isEmpty() || unit) {
                        if (!last) out.line("return;");
                        break;
                    }
                    String value = renderExpression(op.getExpression(), resolver, null);
                    if (value == null) value = "todo!()";
                    out.line(last ? value : "return " + value + ";");
                    break;
                }
                case YIELD:
                default:
                    break;
            }
        }
        if (!unit && (ops.isEmpty() || ops.get(ops.size() - 1).getKind() != AsyncOperation.Kind.RETURN)) {
            out.line("todo!()");
        }
    }

    private void generateAwaitExpression(AsyncOperation op, RustResolver resolver, RustContext ctx) {
        CodeWriter out = ctx.getOut();
        String value = renderExpression(op.getExpression(), resolver, null);
        if (value == null) value = renderExpression(op.getExpression(), resolver.lenientCopy(), null);
        if (op.hasBinding()) {
            String binding = varName(op.getBinding());
            out.line("let " + binding + " = " + (value != null ? value + ".await" : "todo!()") + ";");
            resolver.declareLocal(op.getBinding());
        } else if (value != null) {
            out.line(value + ".await;");
        } else {
            out.line("// co_await " + op.getExpression());
        }
    }

    /**
     * 生成器：容量为 0 的同步通道，每个 co_yield 发送一个值，消费者逐个取
     */
    private void generateGenerator(Function fn, RustContext ctx) {
        CodeWriter out = ctx.getOut();
        ctx.addImport("std::sync::mpsc");
        ctx.addImport("std::thread");
        Type value = fn.getReturnType() == null ? null : fn.getReturnType().getTemplateArg(0);
        String item = value == null ? "()" : ctx.types.map(value);
        writeOriginalBody(out, fn);
        out.line("let (tx, rx) = mpsc::sync_channel::<" + item + ">(0);");
        out.open("thread::spawn(move || {");
        RustResolver resolver = new RustResolver(ctx, fn, true);
        CountedLoop loop = CountedLoop.match(fn.getBody());
        if (loop != null) {
            String from = renderExpression(loop.getFrom(), resolver, null);
            String to = renderExpression(loop.getTo(), resolver, null);
            resolver.declareLocal(loop.getVariable());
            if (from != null && to != null) {
                out.open("for " + varName(loop.getVariable()) + " in " + from
                        + (loop.isInclusive() ? "..=" : "..") + to + " {");
                writeYields(fn, resolver, out);
                out.close("}");
            } else {
                writeYields(fn, resolver, out);
            }
        } else {
            writeYields(fn, resolver, out);
        }
        out.close("});");
        out.line("rx.into_iter()");
    }

    private void writeYields(Function fn, RustResolver resolver, CodeWriter out) {
        for (AsyncOperation op : fn.getCoroutineInfo().getOperations()) {
            if (op.getKind() != AsyncOperation.Kind.YIELD) continue;
            String value = renderExpression(op.getExpression(), resolver, null);
            out.line("if tx.send(" + (value != null ? value : "todo!()") + ").is_err() { return; }");
        }
    }

    // ============ 表达式 ============

    private static String renderExpression(String text, RustResolver resolver, Type target) {
        List<ExprToken> tokens = SimpleBody.parseExpression(text);
        return tokens == null ? null : SimpleBody.render(tokens, resolver, isFloat(target));
    }

    /**
     * 线程 / 任务入口的调用：{@code worker} 或 {@code &Class::method, this}
     */
    private String renderCall(String target, List<String> args, RustResolver resolver) {
        String callee = target.trim();
        if (callee.startsWith("&")) callee = callee.substring(1).trim();
        List<String> rest = args;
        String calleeExpr;
        int colon = callee.lastIndexOf("::");
        if (colon >= 0 && !callee.startsWith("std::")) {
            String method = fnName(callee.substring(colon + 2));
            if (!args.isEmpty()) {
                String receiver = "this".equals(args.get(0).trim()) ? "self" : renderArgument(args.get(0), resolver);
                calleeExpr = receiver + "." + method;
                rest = args.subList(1, args.size());
            } else {
                calleeExpr = typeName(callee.substring(0, colon)) + "::" + method;
            }
        } else {
            calleeExpr = resolver.resolve(callee, false, true);
            if (calleeExpr == null) calleeExpr = fnName(callee);
        }
        List<String> rendered = new ArrayList<String>();
        for (String arg : rest) {
            rendered.add(renderArgument(arg, resolver));
        }
        return calleeExpr + "(" + join(rendered, ", ") + ")";
    }

    private static String renderArgument(String arg, RustResolver resolver) {
        String text = arg.trim();
        if (text.startsWith("std::ref(") && text.endsWith(")")) {
            String inner = renderExpression(text.substring(9, text.length() - 1), resolver, null);
            return inner != null ? "&" + inner : "todo!()";
        }
        String rendered = renderExpression(text, resolver, null);
        return rendered != null ? rendered : "todo!()";
    }

    /**
     * 函数体内标识符的解析：形参、局部绑定、字段、方法、自由函数、常量泛型与枚举项
     */
    private final class RustResolver implements SimpleBody.NameResolver {
        private final RustContext ctx;
        private final Function fn;
        private final boolean allowSelf;
        private final Set<String> locals = new HashSet<String>();
        private boolean lenient;

        RustResolver(RustContext ctx, Function fn, boolean allowSelf) {
            this.ctx = ctx;
            this.fn = fn;
            this.allowSelf = allowSelf;
        }

        /** 未知名字按局部变量处理 */
        RustResolver lenient() {
            this.lenient = true;
            return this;
        }

        /** 共享已声明局部变量的宽松副本，未知被调函数按自由函数处理 */
        RustResolver lenientCopy() {
            RustResolver copy = new RustResolver(ctx, fn, allowSelf);
            copy.locals.addAll(locals);
            copy.lenient = true;
            return copy;
        }

        void declareLocal(String name) {
            locals.add(name);
        }

        @Override
        public String resolve(String name, boolean viaThis, boolean isCall) {
            ClassDecl cls = ctx.getCurrentClass();
            boolean hasSelf = allowSelf && cls != null && fn != null && !fn.isStatic() && !fn.isConstructor();
            if (!viaThis) {
                if (fn != null && fn.findParameter(name) != null) return varName(name);
                if (locals.contains(name)) return varName(name);
                if (isConstGeneric(name)) return name;
            }
            if (cls != null) {
                if (isCall) {
                    Function m = findMethod(cls, name);
                    if (m != null && m.isStatic()) return "Self::" + fnName(name);
                    if (m != null && hasSelf) return "self." + fnName(name);
                } else {
                    Variable f = cls.findField(name);
                    if (f != null && f.isStatic()) {
                        return f.isConst() || f.getType().isConst() ? "Self::" + constName(name) : null;
                    }
                    if (f != null && hasSelf) return "self." + varName(name);
                }
            }
            if (viaThis) return null;
            IrModule module = ctx.getModule();
            if (isCall) {
                if (findFreeFunction(module, name) != null) return fnName(name);
                if (module.findClass(name) != null) return typeName(name) + "::new";
            } else {
                for (Variable g : module.getGlobalVariables()) {
                    if (g.getName().equals(name)) return constName(name);
                }
                for (EnumDecl e : module.getEnums()) {
                    if (!e.isScoped() && e.getEnumerators().contains(name)) {
                        return typeName(e.getName()) + "::" + NameSanitizer.sanitize(variantName(name), TargetProfile.RUST);
                    }
                }
            }
            if (lenient) return isCall ? fnName(name) : varName(name);
            return null;
        }

        private boolean isConstGeneric(String name) {
            List<TemplateParameter> params = new ArrayList<TemplateParameter>();
            if (fn != null) params.addAll(fn.getTemplateParameters());
            if (ctx.getCurrentClass() != null) params.addAll(ctx.getCurrentClass().getTemplateParameters());
            for (TemplateParameter p : params) {
                if (p instanceof NonTypeParam && p.getName().equals(name)) return true;
            }
            return false;
        }
    }

    // ============ 测试骨架 ============

    @Override
    protected void generateTestModule(RustContext ctx) {
        CodeWriter out = ctx.getOut();
        out.line("// Test scaffold generated by hybrid-transpiler.");
        out.line("#[cfg(test)]");
        out.open("mod tests {");
        out.line("use super::*;");
        Set<String> used = new HashSet<String>();
        for (ClassDecl cls : ctx.getModule().getClasses()) {
            for (Function m : ordinaryMethods(cls)) {
                String name = uniqueName(used, varName(className(cls)) + "_" + fnName(m.getName()), m);
                writeTestStub(out, name, className(cls) + "::" + m.getName());
            }
        }
        for (Function fn : ctx.getModule().getFunctions()) {
            if ("main".equals(fn.getName())) continue;
            writeTestStub(out, uniqueName(used, fnName(fn.getName()), fn), fn.getName());
        }
        out.close("}");
    }

    private static void writeTestStub(CodeWriter out, String name, String subject) {
        out.blankLine();
        out.line("#[test]");
        out.open("fn " + name + "() {");
        out.line("// exercise " + subject);
        out.close("}");
    }

    // ============ 命名 ============

    private static String genericParams(ClassDecl cls) {
        if (cls.getSpecialization().isSpecialization() && !cls.getSpecialization().isPartial()) return "";
        return TemplateConversion.toAlphaGenericBounds(cls.getTemplateParameters());
    }

    private static String genericArgs(ClassDecl cls) {
        if (cls.getSpecialization().isSpecialization() && !cls.getSpecialization().isPartial()) return "";
        List<String> names = templateParamNames(cls.getTemplateParameters(), true);
        return names.isEmpty() ? "" : "<" + join(names, ", ") + ">";
    }

    static String fnName(String name) {
        return NameSanitizer.sanitize(NameSanitizer.toSnakeCase(operatorName(name)), TargetProfile.RUST);
    }

    static String varName(String name) {
        return NameSanitizer.sanitize(NameSanitizer.toSnakeCase(name), TargetProfile.RUST);
    }

    static String typeName(String name) {
        return NameSanitizer.sanitize(name, TargetProfile.RUST);
    }

    static String constName(String name) {
        return NameSanitizer.toSnakeCase(name).toUpperCase();
    }

    private static String join(List<String> parts, String separator) {
        StringBuilder sb = new StringBuilder();
        for (int i = 0; i < parts.size(); i++) {
            if (i > 0) sb.append(separator);
            sb.append(parts.get(i));
        }
        return sb.toString();
    }
}
