package com.hybridlang.backend.codegen.go;

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
import com.hybridlang.compiler.ir.Parameter;
import com.hybridlang.compiler.ir.PointerOwnership;
import com.hybridlang.compiler.ir.ThreadInfo;
import com.hybridlang.compiler.ir.TryCatchBlock;
import com.hybridlang.compiler.ir.Type;
import com.hybridlang.compiler.ir.TypeKind;
import com.hybridlang.compiler.ir.Variable;
import com.hybridlang.compiler.parser.CppText;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Target-Beta 生成器：输出 Go（1.19+）。
 *
 * <p>类 → struct + 指针接收者方法，多态类 → interface，基类 → 嵌入；
 * 可能抛出的函数多返回一个 error；线程 → goroutine，锁 → {@code Lock()/defer Unlock()}；
 * 协程与生成器 → 返回只读 channel。</p>
 */
public class GoCodeGenerator extends AbstractCodeGenerator<GoCodeGenerator.GoContext> {

    private static final Pattern INTEGER_LITERAL = Pattern.compile("-?\\d+");

    static final class GoContext extends GenerationContext {
        final GoTypeMapper types;
        /** 类的简单名 → interface 名 */
        final Map<String, String> interfaces = new LinkedHashMap<String, String>();

        GoContext(IrModule module, TranspilerOptions options) {
            super(module, options, new CodeWriter("\t"));
            this.types = new GoTypeMapper(this);
        }
    }

    public GoCodeGenerator(TranspilerOptions options) {
        super(options);
    }

    @Override
    public TargetProfile getProfile() {
        return TargetProfile.GO;
    }

    @Override
    protected GoContext createContext(IrModule module) {
        return new GoContext(module, options);
    }

    @Override
    protected String assemble(GoContext ctx) {
        CodeWriter file = new CodeWriter("\t");
        file.line("// Code generated by hybrid-transpiler from C++ source. DO NOT EDIT.");
        file.blankLine();
        file.line("package " + options.getGoPackage());
        writeImports(file, ctx.getImports());
        file.blankLine();
        file.append(ctx.getOut().getOutput());
        return file.getOutput();
    }

    private static void writeImports(CodeWriter file, Set<String> imports) {
        if (imports.isEmpty()) return;
        file.blankLine();
        if (imports.size() == 1) {
            file.line("import \"" + imports.iterator().next() + "\"");
            return;
        }
        file.open("import (");
        for (String path : imports) {
            file.line("\"" + path + "\"");
        }
        file.close(")");
    }

    // ============ 模块 ============

    @Override
    protected void generateModule(GoContext ctx) {
        IrModule module = ctx.getModule();
        planInterfaces(ctx);

        for (Map.Entry<String, String> e : ctx.getErrorTypes().entrySet()) {
            generateErrorType(e.getKey(), e.getValue(), ctx);
        }
        for (EnumDecl e : module.getEnums()) {
            generateEnum(e, ctx);
        }
        for (Variable global : module.getGlobalVariables()) {
            generateGlobal(global, ctx);
        }
        for (ClassDecl cls : module.getClasses()) {
            generateClass(cls, ctx);
        }
        for (Function fn : module.getFunctions()) {
            ctx.getOut().blankLine();
            generateFunction(fn, ctx, funcName(fn.getName()));
        }
    }

    /**
     * 每种 C++ 异常类型一个实现 error 的结构体，catch 子句用 errors.As 匹配
     */
    private void generateErrorType(String cppType, String name, GoContext ctx) {
        CodeWriter out = ctx.getOut();
        out.blankLine();
        out.line("// " + name + " corresponds to the C++ exception " + cppType + ".");
        out.open("type " + name + " struct {");
        out.line("Msg string");
        out.close("}");
        out.blankLine();
        out.open("func (e *" + name + ") Error() string {");
        out.line("return \"" + cppType + ": \" + e.Msg");
        out.close("}");
    }

    private void generateEnum(EnumDecl e, GoContext ctx) {
        CodeWriter out = ctx.getOut();
        String type = typeName(e.getName());
        boolean explicit = false;
        for (String item : e.getEnumerators()) {
            if (e.getValue(item) != null) explicit = true;
        }
        out.blankLine();
        out.line("type " + type + " int");
        if (e.getEnumerators().isEmpty()) return;
        out.blankLine();
        out.open("const (");
        long next = 0;
        boolean first = true;
        for (String item : e.getEnumerators()) {
            String name = enumeratorName(e, item);
            String value = e.getValue(item);
            if (!explicit) {
                out.line(first ? name + " " + type + " = iota" : name);
            } else if (value != null && INTEGER_LITERAL.matcher(value).matches()) {
                next = Long.parseLong(value);
                out.line(name + " " + type + " = " + next);
                next++;
            } else {
                if (value != null) out.line("// " + item + " = " + value);
                out.line(name + " " + type + " = " + next);
                next++;
            }
            first = false;
        }
        out.close(")");
    }

    private static String enumeratorName(EnumDecl e, String item) {
        String variant = item.equals(item.toUpperCase()) ? camel(item.toLowerCase()) : NameSanitizer.capitalize(item);
        return typeName(e.getName()) + variant;
    }

    private static String camel(String snake) {
        StringBuilder sb = new StringBuilder();
        for (String part : snake.split("_")) {
            if (!part.isEmpty()) sb.append(NameSanitizer.capitalize(part));
        }
        return sb.toString();
    }

    private void generateGlobal(Variable global, GoContext ctx) {
        CodeWriter out = ctx.getOut();
        Type type = global.getType();
        String name = varName(global.getName());
        String mapped = ctx.types.map(type);
        String init = global.hasInitializer()
                ? renderExpression(global.getInitializer(), new GoResolver(ctx, null, null)) : null;
        out.blankLine();
        if ((global.isConst() || type.isConst()) && init != null && isConstantKind(type)) {
            out.line("const " + name + " " + mapped + " = " + init);
        } else if (init != null && type.getKind() != TypeKind.ATOMIC) {
            out.line("var " + name + " " + mapped + " = " + init);
        } else {
            out.line("var " + name + " " + mapped);
        }
    }

    private static boolean isConstantKind(Type type) {
        TypeKind kind = type.getKind();
        return kind == TypeKind.BOOL || kind == TypeKind.INTEGER || kind == TypeKind.FLOAT
                || kind == TypeKind.STD_STRING || kind == TypeKind.ENUM;
    }

    // ============ interface 规划 ============

    private void planInterfaces(GoContext ctx) {
        Set<String> usedAsBase = new HashSet<String>();
        for (ClassDecl cls : ctx.getModule().getClasses()) {
            for (String base : cls.getBaseClasses()) {
                usedAsBase.add(simpleName(base));
            }
        }
        for (ClassDecl cls : ctx.getModule().getClasses()) {
            if (cls.getSpecialization().isSpecialization()) continue;
            String simple = simpleName(cls.getName());
            if (cls.isInterfaceLike()) {
                ctx.interfaces.put(simple, simple);
            } else if (cls.isPolymorphic() && usedAsBase.contains(simple)) {
                ctx.interfaces.put(simple, simple + "Interface");
            }
        }
    }

    /** 不与祖先同名的虚函数 */
    private static List<Function> ownVirtualMethods(ClassDecl cls, IrModule module) {
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

    private static boolean hasDefaults(ClassDecl cls) {
        if (!cls.isInterfaceLike()) return false;
        for (Function m : cls.getVirtualMethods()) {
            if (!m.isPureVirtual() && m.hasBody()) return true;
        }
        return false;
    }

    // ============ 类 ============

    private void generateClass(ClassDecl cls, GoContext ctx) {
        ctx.setCurrentClass(cls);
        try {
            String simple = simpleName(cls.getName());
            if (ctx.interfaces.containsKey(simple)) {
                generateInterface(cls, ctx);
            }
            if (cls.isInterfaceLike()) {
                if (hasDefaults(cls)) generateDefaults(cls, ctx);
                return;
            }
            generateStruct(cls, ctx);
            generateStatics(cls, ctx);
            generateConstructors(cls, ctx);
            generateMethods(cls, ctx);
            Function dtor = destructor(cls);
            if (dtor != null) {
                ctx.getOut().blankLine();
                generateMethod(dtor, ctx, "Close");
            }
            generateInterfaceAssertions(cls, ctx);
        } finally {
            ctx.setCurrentClass(null);
        }
    }

    private void generateInterface(ClassDecl cls, GoContext ctx) {
        CodeWriter out = ctx.getOut();
        String name = typeName(ctx.interfaces.get(simpleName(cls.getName())));
        out.blankLine();
        out.open("type " + name + " interface {");
        for (String base : cls.getBaseClasses()) {
            String embedded = ctx.interfaces.get(simpleName(base));
            if (embedded != null) out.line(typeName(embedded));
        }
        Set<String> used = new HashSet<String>();
        for (Function m : ownVirtualMethods(cls, ctx.getModule())) {
            ctx.setCurrentFunction(m);
            out.line(uniqueName(used, exportedName(m.getName()), m) + signatureTail(m, ctx));
            ctx.setCurrentFunction(null);
        }
        out.close("}");
    }

    /** 接口的默认实现放进可嵌入的 XxxDefaults 结构体 */
    private void generateDefaults(ClassDecl cls, GoContext ctx) {
        CodeWriter out = ctx.getOut();
        String name = typeName(simpleName(cls.getName())) + "Defaults";
        out.blankLine();
        out.line("type " + name + " struct{}");
        for (Function m : cls.getVirtualMethods()) {
            if (m.isPureVirtual() || !m.hasBody()) continue;
            out.blankLine();
            ctx.setCurrentFunction(m);
            try {
                out.open("func (" + name + ") " + exportedName(m.getName()) + signatureTail(m, ctx) + " {");
                writeBody(m, ctx, new GoResolver(ctx, m, null));
                out.close("}");
            } finally {
                ctx.setCurrentFunction(null);
            }
        }
    }

    private void generateStruct(ClassDecl cls, GoContext ctx) {
        CodeWriter out = ctx.getOut();
        out.blankLine();
        writeContainerNote(out, cls, "Len()");
        List<String> lines = new ArrayList<String>();
        for (String embedded : embeddedTypes(cls, ctx)) {
            lines.add(embedded);
        }
        for (Variable field : cls.getFields()) {
            if (field.isStatic()) continue;
            lines.add(fieldName(cls, field.getName()) + " " + ctx.types.map(field.getType()));
        }
        String header = "type " + typeName(className(cls)) + typeParams(cls) + " struct";
        if (lines.isEmpty()) {
            out.line(header + "{}");
            return;
        }
        out.open(header + " {");
        for (String line : lines) {
            out.line(line);
        }
        out.close("}");
    }

    /** 嵌入的具体基类与接口默认实现 */
    private static List<String> embeddedTypes(ClassDecl cls, GoContext ctx) {
        List<String> result = new ArrayList<String>();
        for (String base : cls.getBaseClasses()) {
            ClassDecl b = ctx.getModule().findClass(simpleName(base));
            if (b == null) continue;
            if (!b.isInterfaceLike() && !b.isTemplate()) {
                result.add(typeName(b.getName()));
            } else if (hasDefaults(b)) {
                result.add(typeName(b.getName()) + "Defaults");
            }
        }
        return result;
    }

    /** 静态字段提升为包级变量 / 常量 */
    private void generateStatics(ClassDecl cls, GoContext ctx) {
        CodeWriter out = ctx.getOut();
        GoResolver resolver = new GoResolver(ctx, null, null);
        for (Variable field : cls.getFields()) {
            if (!field.isStatic()) continue;
            String name = staticName(cls, field.getName());
            String init = field.hasInitializer() ? renderExpression(field.getInitializer(), resolver) : null;
            out.blankLine();
            if ((field.isConst() || field.getType().isConst()) && init != null && isConstantKind(field.getType())) {
                out.line("const " + name + " " + ctx.types.map(field.getType()) + " = " + init);
            } else {
                out.line("var " + name + " " + ctx.types.map(field.getType()) + (init != null ? " = " + init : ""));
            }
        }
    }

    // ============ 构造函数 ============

    private void generateConstructors(ClassDecl cls, GoContext ctx) {
        List<Function> ctors = constructors(cls);
        if (ctors.isEmpty()) {
            ctx.getOut().blankLine();
            generateConstructor(cls, null, "New" + typeName(className(cls)), ctx);
            return;
        }
        for (Map.Entry<Function, String> e : constructorNames(cls, ctors).entrySet()) {
            ctx.getOut().blankLine();
            generateConstructor(cls, e.getKey(), e.getValue(), ctx);
        }
    }

    private static Map<Function, String> constructorNames(ClassDecl cls, List<Function> ctors) {
        String base = "New" + typeName(className(cls));
        Map<Function, String> names = new LinkedHashMap<Function, String>();
        Set<String> used = new HashSet<String>();
        boolean hasDefault = false;
        for (Function c : ctors) {
            if (c.getParameters().isEmpty()) hasDefault = true;
        }
        for (Function c : ctors) {
            String candidate;
            if (ctors.size() == 1 || c.getParameters().isEmpty() || (!hasDefault && names.isEmpty())) {
                candidate = base;
            } else {
                StringBuilder sb = new StringBuilder(base).append("With");
                for (Parameter p : c.getParameters()) {
                    sb.append(NameSanitizer.capitalize(p.getName()));
                }
                candidate = sb.toString();
            }
            String name = candidate;
            int n = 2;
            while (used.contains(name)) {
                name = candidate + n++;
            }
            used.add(name);
            names.put(c, name);
        }
        return names;
    }

    /** 与实参个数匹配的构造函数名 */
    private static String constructorFor(ClassDecl cls, int arity) {
        List<Function> ctors = constructors(cls);
        if (ctors.isEmpty()) return "New" + typeName(className(cls));
        Map<Function, String> names = constructorNames(cls, ctors);
        for (Map.Entry<Function, String> e : names.entrySet()) {
            if (e.getKey().getParameters().size() == arity) return e.getValue();
        }
        return names.values().iterator().next();
    }

    private void generateConstructor(ClassDecl cls, Function ctor, String name, GoContext ctx) {
        CodeWriter out = ctx.getOut();
        ctx.setCurrentFunction(ctor);
        try {
            String self = typeName(className(cls)) + typeArgs(cls);
            boolean fallible = ctor != null && ctor.isFallible();
            String params = ctor == null ? "" : parameterList(ctor, ctx);
            out.open("func " + name + typeParams(cls) + "(" + params + ") "
                    + (fallible ? "(*" + self + ", error)" : "*" + self) + " {");
            if (ctor != null) writeSafetyChecks(ctor, ctx);

            Map<String, String> values = new LinkedHashMap<String, String>();
            GoResolver resolver = new GoResolver(ctx, ctor, null);
            for (Variable field : cls.getFields()) {
                if (field.isStatic()) continue;
                String init = field.hasInitializer() ? renderExpression(field.getInitializer(), resolver) : null;
                if (init == null) init = ctx.types.constructorValue(field.getType());
                if (init != null) values.put(fieldName(cls, field.getName()), init);
            }
            if (ctor != null) {
                lowerConstructorBody(cls, ctor, values, resolver, ctx);
            }

            List<Variable> condvars = new ArrayList<Variable>();
            for (Variable field : cls.getFields()) {
                if (!field.isStatic() && field.getType().getKind() == TypeKind.CONDITION_VARIABLE) condvars.add(field);
            }
            String ok = fallible ? ", nil" : "";
            if (condvars.isEmpty()) {
                writeCompositeLiteral(out, "return &" + self, values, ok);
            } else {
                String recv = receiverName(cls, ctor);
                writeCompositeLiteral(out, recv + " := &" + self, values, "");
                for (Variable cv : condvars) {
                    ctx.addImport("sync");
                    out.line(recv + "." + fieldName(cls, cv.getName()) + " = sync.NewCond(" + condvarLocker(cls, cv, recv, ctx) + ")");
                }
                out.line("return " + recv + ok);
            }
            out.close("}");
        } finally {
            ctx.setCurrentFunction(null);
        }
    }

    private void lowerConstructorBody(ClassDecl cls, Function ctor, Map<String, String> values,
                                      GoResolver resolver, GoContext ctx) {
        CodeWriter out = ctx.getOut();
        for (Map.Entry<String, String> init : ctor.getMemberInitializers().entrySet()) {
            String member = init.getKey();
            Variable field = cls.findField(member);
            String rendered = null;
            String key = null;
            if (field != null) {
                key = fieldName(cls, member);
                rendered = renderExpression(init.getValue(), resolver);
            } else {
                ClassDecl base = ctx.getModule().findClass(simpleName(member));
                if (base != null && cls.getBaseClasses().contains(member) && !base.isInterfaceLike()) {
                    key = typeName(base.getName());
                    rendered = renderBaseConstruction(base, init.getValue(), resolver);
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
                        : SimpleBody.render(a.getValue(), resolver, false);
                if (rendered != null) {
                    values.put(fieldName(cls, field.getName()), rendered);
                } else if (options.isPreserveComments()) {
                    out.line("// " + a.getTarget() + " " + a.getOperator() + " ...");
                }
            }
        } else {
            writeOriginalBody(out, ctor);
        }
    }

    private String renderBaseConstruction(ClassDecl base, String args, GoResolver resolver) {
        List<String> parts = CppText.splitArguments(args);
        List<String> rendered = new ArrayList<String>();
        for (String arg : parts) {
            String r = renderExpression(arg, resolver);
            if (r == null) return null;
            rendered.add(r);
        }
        return "*" + constructorFor(base, parts.size()) + "(" + join(rendered, ", ") + ")";
    }

    private static void writeCompositeLiteral(CodeWriter out, String head, Map<String, String> values, String tail) {
        if (values.isEmpty()) {
            out.line(head + "{}" + tail);
            return;
        }
        out.open(head + "{");
        for (Map.Entry<String, String> e : values.entrySet()) {
            out.line(e.getKey() + ": " + e.getValue() + ",");
        }
        out.close("}" + tail);
    }

    /** 条件变量关联的互斥量：方法里观察到的配对优先，否则取类里第一个 mutex */
    private static String condvarLocker(ClassDecl cls, Variable cv, String recv, GoContext ctx) {
        String mutex = null;
        for (Function m : cls.getMethods()) {
            for (ConditionVariableInfo info : m.getConditionVariables()) {
                if (info.getVariable().equals(cv.getName()) && !info.getAssociatedMutex().isEmpty()) {
                    mutex = info.getAssociatedMutex();
                }
            }
        }
        if (mutex == null) {
            for (Variable f : cls.getFields()) {
                if (f.getType().getKind() == TypeKind.MUTEX) {
                    mutex = f.getName();
                    break;
                }
            }
        }
        Variable field = mutex == null ? null : cls.findField(mutex);
        if (field == null) return "&sync.Mutex{}";
        return "&" + recv + "." + fieldName(cls, field.getName());
    }

    // ============ 方法 ============

    private void generateMethods(ClassDecl cls, GoContext ctx) {
        Set<String> used = new HashSet<String>();
        for (Function m : ordinaryMethods(cls)) {
            ctx.getOut().blankLine();
            generateMethod(m, ctx, uniqueName(used, methodName(cls, m), m));
        }
    }

    private void generateMethod(Function m, GoContext ctx, String name) {
        if (m.isStatic()) {
            generateFunction(m, ctx, name);
            return;
        }
        CodeWriter out = ctx.getOut();
        ClassDecl cls = ctx.getCurrentClass();
        ctx.setCurrentFunction(m);
        try {
            String recv = receiverName(cls, m);
            String erased = TemplateConversion.toBetaTypeParameters(m.getTemplateParameters());
            if (!erased.isEmpty()) {
                out.line("// type parameters " + erased + " erased to any");
            }
            out.open("func (" + recv + " *" + typeName(className(cls)) + typeArgs(cls) + ") " + name
                    + signatureTail(m, ctx) + " {");
            writeBody(m, ctx, new GoResolver(ctx, m, recv));
            out.close("}");
        } finally {
            ctx.setCurrentFunction(null);
        }
    }

    /** 接收者名取类名首字母小写，与形参冲突时改用 self */
    private static String receiverName(ClassDecl cls, Function fn) {
        String candidate = className(cls).substring(0, 1).toLowerCase();
        if (NameSanitizer.isReserved(candidate, TargetProfile.GO)
                || (fn != null && fn.findParameter(candidate) != null)) {
            return "self";
        }
        return candidate;
    }

    private void generateInterfaceAssertions(ClassDecl cls, GoContext ctx) {
        if (cls.isTemplate() || cls.getSpecialization().isSpecialization()) return;
        List<String> implemented = new ArrayList<String>();
        collectInterfaces(cls, ctx, implemented, true);
        for (String iface : implemented) {
            ctx.getOut().blankLine();
            ctx.getOut().line("var _ " + typeName(iface) + " = (*" + typeName(className(cls)) + ")(nil)");
        }
    }

    private static void collectInterfaces(ClassDecl cls, GoContext ctx, List<String> result, boolean self) {
        String own = ctx.interfaces.get(simpleName(cls.getName()));
        if (self && own != null && !result.contains(own)) result.add(own);
        for (String base : cls.getBaseClasses()) {
            String iface = ctx.interfaces.get(simpleName(base));
            if (iface != null && !result.contains(iface)) result.add(iface);
            ClassDecl b = ctx.getModule().findClass(simpleName(base));
            if (b != null) collectInterfaces(b, ctx, result, false);
        }
    }

    // ============ 函数 ============

    private void generateFunction(Function fn, GoContext ctx, String name) {
        CodeWriter out = ctx.getOut();
        Function previous = ctx.getCurrentFunction();
        ctx.setCurrentFunction(fn);
        try {
            if ("main".equals(fn.getName()) && !ctx.isInClass()) {
                out.open("func main() {");
                writeOriginalBody(out, fn);
                writeConcurrency(fn, ctx, new GoResolver(ctx, fn, null).lenient());
                if (fn.isFallible()) {
                    writeTryCatchAsError(fn, ctx, "panic(err)");
                }
                out.close("}");
                return;
            }
            writeTemplateNotes(out, fn);
            String generics = TemplateConversion.toBetaTypeParameters(fn.getTemplateParameters());
            out.open("func " + name + generics + signatureTail(fn, ctx) + " {");
            writeBody(fn, ctx, new GoResolver(ctx, fn, null));
            out.close("}");
        } finally {
            ctx.setCurrentFunction(previous);
        }
    }

    /** 形参列表与返回类型 */
    private String signatureTail(Function fn, GoContext ctx) {
        String result = resultList(fn, ctx);
        return "(" + parameterList(fn, ctx) + ")" + (result.isEmpty() ? "" : " " + result);
    }

    private String parameterList(Function fn, GoContext ctx) {
        List<String> params = new ArrayList<String>();
        for (Parameter p : fn.getParameters()) {
            String pname = p.getName().isEmpty() ? "arg" + params.size() : varName(p.getName());
            params.add(pname + " " + ctx.types.map(p.getType()));
        }
        return join(params, ", ");
    }

    private String resultList(Function fn, GoContext ctx) {
        if (fn.getCoroutineInfo().isCoroutine()) {
            return "<-chan " + coroutineValueType(fn, ctx);
        }
        String value = fn.returnsVoid() ? null : ctx.types.map(fn.getReturnType());
        if (fn.isFallible()) {
            return value == null ? "error" : "(" + value + ", error)";
        }
        return value == null ? "" : value;
    }

    private static String coroutineValueType(Function fn, GoContext ctx) {
        Type value = fn.getReturnType() == null ? null : fn.getReturnType().getTemplateArg(0);
        return value == null || value.getKind() == TypeKind.VOID ? "struct{}" : ctx.types.map(value);
    }

    private void writeBody(Function fn, GoContext ctx, GoResolver resolver) {
        writeSafetyChecks(fn, ctx);
        if (fn.getCoroutineInfo().isCoroutine()) {
            if (fn.getCoroutineInfo().isGenerator()) {
                generateGenerator(fn, ctx, resolver);
            } else {
                generateAsyncFunction(fn, ctx, resolver);
            }
        } else if (!writeSimpleBody(fn, ctx, resolver)) {
            generateFallbackBody(fn, ctx, resolver);
        }
    }

    private void writeSafetyChecks(Function fn, GoContext ctx) {
        if (!options.isEnableSafetyChecks()) return;
        for (Parameter p : fn.getParameters()) {
            Type type = p.getType();
            if (type.getKind() == TypeKind.POINTER && type.getOwnership() == PointerOwnership.RAW
                    && !p.getName().isEmpty()) {
                String name = varName(p.getName());
                CodeWriter out = ctx.getOut();
                out.open("if " + name + " == nil {");
                out.line("panic(\"" + name + " must not be nil\")");
                out.close("}");
            }
        }
    }

    private boolean writeSimpleBody(Function fn, GoContext ctx, GoResolver resolver) {
        SimpleBody body = SimpleBody.parse(fn.getBody());
        if (body == null) return false;
        boolean unit = fn.returnsVoid();
        if (!unit && !body.hasReturn()) return false;
        if (unit && body.hasReturn() && !body.getReturnValue().isEmpty()) return false;

        List<String> lines = new ArrayList<String>();
        for (SimpleBody.Assignment a : body.getAssignments()) {
            String target = resolver.resolve(a.getTarget(), false, false);
            if (target == null || resolver.recv == null || !target.startsWith(resolver.recv + ".")) return false;
            String value = SimpleBody.render(a.getValue(), resolver, false);
            if (value == null) return false;
            lines.add(target + " " + a.getOperator() + " " + value);
        }
        if (!unit) {
            String value = renderReturn(fn, body.getReturnValue(), resolver);
            if (value == null) return false;
            lines.add("return " + value + (fn.isFallible() ? ", nil" : ""));
        } else if (fn.isFallible()) {
            lines.add("return nil");
        }
        for (String line : lines) {
            ctx.getOut().line(line);
        }
        return true;
    }

    private static String renderReturn(Function fn, List<ExprToken> tokens, GoResolver resolver) {
        String value = SimpleBody.render(tokens, resolver, false);
        if (value == null) return null;
        Type ret = fn.getReturnType();
        if (tokens.size() == 1 && resolver.recv != null && value.startsWith(resolver.recv + ".")
                && ret.getKind() == TypeKind.REFERENCE && !ret.isConst()
                && (ret.getElementType() == null || !ret.getElementType().isConst())) {
            return "&" + value;
        }
        return value;
    }

    private void generateFallbackBody(Function fn, GoContext ctx, GoResolver resolver) {
        CodeWriter out = ctx.getOut();
        writeOriginalBody(out, fn);
        writeConcurrency(fn, ctx, resolver.lenient());
        String zeros = zeroResults(fn, ctx);
        if (fn.isFallible()) {
            writeTryCatchAsError(fn, ctx, "return " + (zeros.isEmpty() ? "" : zeros + ", ") + "err");
        }
        if (!fn.returnsVoid()) {
            out.line("panic(\"TODO: translate body of " + fn.getName() + "\")");
        } else if (fn.isFallible()) {
            out.line("return nil");
        }
    }

    /** 出错返回时的零值部分（不含 error） */
    private static String zeroResults(Function fn, GoContext ctx) {
        return fn.returnsVoid() ? "" : ctx.types.zeroValue(fn.getReturnType());
    }

    private void writeConcurrency(Function fn, GoContext ctx, GoResolver resolver) {
        generateThreadingCode(fn, ctx, resolver);
        generateFutures(fn, ctx);
        generateAsyncTasks(fn, ctx, resolver);
    }

    // ============ 异常 ============

    /**
     * try 块 → 返回 error 的闭包；catch 子句按 errors.As 依次匹配，未匹配的执行 propagate
     */
    private void writeTryCatchAsError(Function fn, GoContext ctx, String propagate) {
        CodeWriter out = ctx.getOut();
        for (TryCatchBlock block : fn.getTryCatchBlocks()) {
            out.open("if err := func() error {");
            if (options.isPreserveComments()) {
                writeSourceComment(out, block.getTryBody());
            }
            out.line("return nil");
            out.dedent();
            out.open("}(); err != nil {");

            List<TryCatchBlock.CatchClause> typed = new ArrayList<TryCatchBlock.CatchClause>();
            TryCatchBlock.CatchClause catchAll = null;
            for (TryCatchBlock.CatchClause clause : block.getCatchClauses()) {
                if (isCatchAllType(clause.getExceptionType())) {
                    catchAll = clause;
                    break;
                }
                typed.add(clause);
            }
            List<String> targets = new ArrayList<String>();
            for (TryCatchBlock.CatchClause clause : typed) {
                ctx.addImport("errors");
                String base = clause.getExceptionVar().isEmpty() ? "target" : varName(clause.getExceptionVar());
                String var = base;
                int n = 2;
                while (targets.contains(var)) {
                    var = base + n++;
                }
                targets.add(var);
                out.line("var " + var + " *" + ctx.getErrorTypes().get(clause.getExceptionType()));
            }
            for (int i = 0; i < typed.size(); i++) {
                if (i == 0) {
                    out.open("if errors.As(err, &" + targets.get(i) + ") {");
                } else {
                    out.dedent();
                    out.open("} else if errors.As(err, &" + targets.get(i) + ") {");
                }
                writeHandler(out, typed.get(i));
            }
            if (!typed.isEmpty()) {
                out.dedent();
                out.open("} else {");
            }
            if (catchAll != null) {
                writeHandler(out, catchAll);
            } else {
                out.line(propagate);
            }
            if (!typed.isEmpty()) {
                out.close("}");
            }
            out.close("}");
        }
    }

    private void writeHandler(CodeWriter out, TryCatchBlock.CatchClause clause) {
        if (options.isPreserveComments() && !clause.getHandlerBody().trim().isEmpty()) {
            writeSourceComment(out, clause.getHandlerBody());
        }
    }

    // ============ 并发 ============

    private void generateThreadingCode(Function fn, GoContext ctx, GoResolver resolver) {
        CodeWriter out = ctx.getOut();
        ClassDecl cls = ctx.getCurrentClass();
        List<String> unused = new ArrayList<String>();

        for (MutexInfo m : fn.getMutexes()) {
            if (findField(cls, m.getMutexVar()) != null) continue;
            ctx.addImport("sync");
            String var = varName(m.getMutexVar());
            out.line("var " + var + " " + (m.getKind() == MutexInfo.Kind.SHARED ? "sync.RWMutex" : "sync.Mutex"));
            if (!isLocked(fn, m.getMutexVar())) unused.add(var);
        }
        for (AtomicInfo a : fn.getAtomics()) {
            if (findField(cls, a.getVariable()) != null) continue;
            String var = varName(a.getVariable());
            out.line("var " + var + " " + ctx.types.atomic(a.getValueType()));
            if (a.getOperations().isEmpty()) unused.add(var);
        }
        for (ConditionVariableInfo cv : fn.getConditionVariables()) {
            if (findField(cls, cv.getVariable()) != null) continue;
            ctx.addImport("sync");
            String locker = cv.getAssociatedMutex().isEmpty() ? "&sync.Mutex{}"
                    : "&" + resolver.resolve(cv.getAssociatedMutex(), false, false);
            out.line(varName(cv.getVariable()) + " := sync.NewCond(" + locker + ")");
        }

        for (LockInfo lock : fn.getLocks()) {
            generateLockScope(lock, fn, ctx, resolver);
        }
        for (AtomicInfo a : fn.getAtomics()) {
            generateAtomicOperations(a, ctx, resolver);
        }
        for (ConditionVariableInfo cv : fn.getConditionVariables()) {
            generateConditionVariable(cv, ctx, resolver);
        }

        Set<String> declaredPools = new HashSet<String>();
        List<String> joins = new ArrayList<String>();
        for (ThreadInfo thread : fn.getThreads()) {
            generateThreadCreation(thread, fn, ctx, resolver, declaredPools, joins);
        }
        for (String join : joins) {
            out.line(join);
        }
        for (String var : unused) {
            out.line("_ = &" + var);
        }
    }

    private static boolean isLocked(Function fn, String mutex) {
        for (LockInfo lock : fn.getLocks()) {
            if (lock.getMutexVar().equals(mutex)) return true;
        }
        for (ConditionVariableInfo cv : fn.getConditionVariables()) {
            if (cv.getAssociatedMutex().equals(mutex)) return true;
        }
        return false;
    }

    private void generateThreadCreation(ThreadInfo thread, Function fn, GoContext ctx, GoResolver resolver,
                                        Set<String> declaredPools, List<String> joins) {
        CodeWriter out = ctx.getOut();
        String var = thread.getThreadVar();
        if (isThreadPool(fn, ctx.getCurrentClass(), var)) {
            boolean field = findField(ctx.getCurrentClass(), var) != null;
            String pool = field ? resolver.resolve(var, false, false) : varName(var);
            if (!field && declaredPools.add(var)) {
                ctx.addImport("sync");
                out.line("var " + pool + " sync.WaitGroup");
            }
            out.line(pool + ".Add(1)");
            out.open("go func() {");
            out.line("defer " + pool + ".Done()");
            writeThreadTarget(out, thread.getTargetFunction(), thread.getArguments(), resolver);
            out.close("}()");
            if (!joins.contains(pool + ".Wait()")) joins.add(pool + ".Wait()");
        } else if (var.isEmpty() || thread.isDetached()) {
            writeGoStatement(out, thread.getTargetFunction(), thread.getArguments(), resolver);
        } else {
            String done = varName(var) + "Done";
            out.line(done + " := make(chan struct{})");
            out.open("go func() {");
            out.line("defer close(" + done + ")");
            writeThreadTarget(out, thread.getTargetFunction(), thread.getArguments(), resolver);
            out.close("}()");
            joins.add("<-" + done);
        }
    }

    private void writeGoStatement(CodeWriter out, String target, List<String> args, GoResolver resolver) {
        if (isLambda(target)) {
            out.open("go func() {");
            writeSourceComment(out, target);
            out.close("}()");
        } else {
            out.line("go " + renderCall(target, args, resolver));
        }
    }

    private void writeThreadTarget(CodeWriter out, String target, List<String> args, GoResolver resolver) {
        if (isLambda(target)) {
            writeSourceComment(out, target);
        } else {
            out.line(renderCall(target, args, resolver));
        }
    }

    private void generateLockScope(LockInfo lock, Function fn, GoContext ctx, GoResolver resolver) {
        CodeWriter out = ctx.getOut();
        if (lock.getMutexVar().isEmpty()) {
            out.line("// " + lock.getKind().name().toLowerCase() + " lock on unknown mutex");
            return;
        }
        String mutex = resolver.resolve(lock.getMutexVar(), false, false);
        boolean shared = lock.getKind() == LockInfo.Kind.SHARED && isSharedMutex(lock.getMutexVar(), fn, ctx);
        out.line(mutex + (shared ? ".RLock()" : ".Lock()"));
        out.line("defer " + mutex + (shared ? ".RUnlock()" : ".Unlock()"));
    }

    private static boolean isSharedMutex(String var, Function fn, GoContext ctx) {
        List<MutexInfo> all = new ArrayList<MutexInfo>(fn.getMutexes());
        if (ctx.getCurrentClass() != null) all.addAll(ctx.getCurrentClass().getMutexes());
        for (MutexInfo m : all) {
            if (m.getMutexVar().equals(var)) return m.getKind() == MutexInfo.Kind.SHARED;
        }
        return false;
    }

    private void generateAtomicOperations(AtomicInfo atomic, GoContext ctx, GoResolver resolver) {
        CodeWriter out = ctx.getOut();
        String target = resolver.resolve(atomic.getVariable(), false, false);
        String type = ctx.types.atomic(atomic.getValueType());
        if (!ctx.types.isNativeAtomic(atomic.getValueType())) {
            for (String op : atomic.getOperations()) {
                out.line("// " + atomic.getVariable() + "." + op + "(...) on a non-integral atomic");
            }
            return;
        }
        boolean unsigned = type.startsWith("atomic.Uint");
        for (String op : atomic.getOperations()) {
            if ("fetch_add".equals(op)) {
                out.line(target + ".Add(1)");
            } else if ("fetch_sub".equals(op)) {
                out.line(target + ".Add(" + (unsigned ? "^" + type.substring(7).toLowerCase() + "(0)" : "-1") + ")");
            } else if ("load".equals(op)) {
                out.line("_ = " + target + ".Load()");
            } else {
                out.line("// " + target + "." + NameSanitizer.capitalize(op) + "(...)");
            }
        }
    }

    private void generateConditionVariable(ConditionVariableInfo cv, GoContext ctx, GoResolver resolver) {
        CodeWriter out = ctx.getOut();
        String target = resolver.resolve(cv.getVariable(), false, false);
        boolean waits = !cv.getAssociatedMutex().isEmpty();
        if (waits && cv.getWaitConditions().isEmpty()) {
            out.line(target + ".Wait()");
        }
        if (waits) {
            for (String condition : cv.getWaitConditions()) {
                String rendered = renderExpression(condition, resolver);
                if (rendered != null) {
                    out.open("for !(" + rendered + ") {");
                } else {
                    out.open("for /* " + condition.replace("*/", "* /") + " */ false {");
                }
                out.line(target + ".Wait()");
                out.close("}");
            }
        }
        if (cv.isNotifiesAll()) {
            out.line(target + ".Broadcast()");
        } else if (!waits) {
            out.line(target + ".Signal()");
        }
    }

    // ============ future / async ============

    private void generateFutures(Function fn, GoContext ctx) {
        CodeWriter out = ctx.getOut();
        for (FutureInfo future : fn.getFutures()) {
            if (!future.hasPromise()) continue;
            String f = varName(future.getFutureVar());
            String p = varName(future.getPromiseVar());
            out.line(f + " := make(chan " + ctx.types.map(future.getValueType()) + ", 1)");
            out.line(p + " := " + f);
            out.line("_, _ = " + p + ", " + f);
        }
    }

    private void generateAsyncTasks(Function fn, GoContext ctx, GoResolver resolver) {
        CodeWriter out = ctx.getOut();
        for (AsyncTaskInfo task : fn.getAsyncTasks()) {
            if (task.isDetached()) {
                writeGoStatement(out, task.getFunctionName(), task.getArguments(), resolver);
                continue;
            }
            String var = varName(task.getTaskVar());
            String result = taskResultType(task, ctx);
            if ("struct{}".equals(result)) {
                out.line(var + " := make(chan struct{})");
                out.open("go func() {");
                out.line("defer close(" + var + ")");
                writeThreadTarget(out, task.getFunctionName(), task.getArguments(), resolver);
            } else {
                out.line(var + " := make(chan " + result + ", 1)");
                out.open("go func() {");
                if (isLambda(task.getFunctionName())) {
                    writeSourceComment(out, task.getFunctionName());
                } else {
                    out.line(var + " <- " + renderCall(task.getFunctionName(), task.getArguments(), resolver));
                }
            }
            out.close("}()");
            out.line("_ = " + var);
        }
    }

    private static String taskResultType(AsyncTaskInfo task, GoContext ctx) {
        if (task.getResultType() != null) {
            return task.getResultType().getKind() == TypeKind.VOID ? "struct{}" : ctx.types.map(task.getResultType());
        }
        Function callee = findFreeFunction(ctx.getModule(), task.getFunctionName().trim());
        if (callee != null) {
            return callee.returnsVoid() ? "struct{}" : ctx.types.map(callee.getReturnType());
        }
        return "any";
    }

    // ============ 协程 ============

    /**
     * 协程：返回缓冲为 1 的只读 channel，函数体在 goroutine 中执行；co_await x → {@code <-x}
     */
    private void generateAsyncFunction(Function fn, GoContext ctx, GoResolver resolver) {
        CodeWriter out = ctx.getOut();
        String value = coroutineValueType(fn, ctx);
        boolean unit = "struct{}".equals(value);
        writeOriginalBody(out, fn);
        out.line("result := make(chan " + value + (unit ? ")" : ", 1)"));
        out.open("go func() {");
        out.line("defer close(result)");
        List<AsyncOperation> ops = fn.getCoroutineInfo().getOperations();
        for (int i = 0; i < ops.size(); i++) {
            AsyncOperation op = ops.get(i);
            boolean last = i == ops.size() - 1;
            if (op.getKind() == AsyncOperation.Kind.SUSPEND) {
                generateAwaitExpression(op, resolver, ctx);
            } else if (op.getKind() == AsyncOperation.Kind.RETURN) {
                if (!unit && !op.getExpression().isEmpty()) {
                    String rendered = renderExpression(op.getExpression(), resolver);
                    out.line(rendered != null ? "result <- " + rendered : "// co_return " + op.getExpression());
                }
                if (!last) out.line("return");
            }
        }
        out.close("}()");
        out.line("return result");
    }

    private void generateAwaitExpression(AsyncOperation op, GoResolver resolver, GoContext ctx) {
        CodeWriter out = ctx.getOut();
        String value = renderExpression(op.getExpression(), resolver);
        if (value == null) value = renderExpression(op.getExpression(), resolver.lenientCopy());
        if (value == null) {
            out.line("// co_await " + op.getExpression());
        } else if (op.hasBinding()) {
            out.line(varName(op.getBinding()) + " := <-" + value);
            resolver.declareLocal(op.getBinding());
        } else {
            out.line("<-" + value);
        }
    }

    /**
     * 生成器：无缓冲 channel，每个 co_yield 发送一个值，结束时关闭
     */
    private void generateGenerator(Function fn, GoContext ctx, GoResolver resolver) {
        CodeWriter out = ctx.getOut();
        writeOriginalBody(out, fn);
        out.line("ch := make(chan " + coroutineValueType(fn, ctx) + ")");
        out.open("go func() {");
        out.line("defer close(ch)");
        CountedLoop loop = CountedLoop.match(fn.getBody());
        String from = loop == null ? null : renderExpression(loop.getFrom(), resolver);
        String to = loop == null ? null : renderExpression(loop.getTo(), resolver);
        if (from != null && to != null) {
            String var = varName(loop.getVariable());
            resolver.declareLocal(loop.getVariable());
            out.open("for " + var + " := " + from + "; " + var + (loop.isInclusive() ? " <= " : " < ") + to
                    + "; " + var + "++ {");
            writeYields(fn, resolver, out);
            out.close("}");
        } else {
            writeYields(fn, resolver, out);
        }
        out.close("}()");
        out.line("return ch");
    }

    private void writeYields(Function fn, GoResolver resolver, CodeWriter out) {
        for (AsyncOperation op : fn.getCoroutineInfo().getOperations()) {
            if (op.getKind() != AsyncOperation.Kind.YIELD) continue;
            String value = renderExpression(op.getExpression(), resolver);
            out.line(value != null ? "ch <- " + value : "// co_yield " + op.getExpression());
        }
    }

    // ============ 表达式 ============

    private static String renderExpression(String text, GoResolver resolver) {
        List<ExprToken> tokens = SimpleBody.parseExpression(text);
        return tokens == null ? null : SimpleBody.render(tokens, resolver, false);
    }

    private String renderCall(String target, List<String> args, GoResolver resolver) {
        String callee = target.trim();
        if (callee.startsWith("&")) callee = callee.substring(1).trim();
        List<String> rest = args;
        String calleeExpr;
        int colon = callee.lastIndexOf("::");
        if (colon >= 0 && !callee.startsWith("std::")) {
            String owner = callee.substring(0, colon);
            String method = callee.substring(colon + 2);
            ClassDecl cls = resolver.ctx.getModule().findClass(simpleName(owner));
            Function m = cls == null ? null : findMethod(cls, method);
            String goMethod = m != null ? methodName(cls, m) : exportedName(method);
            if (!args.isEmpty()) {
                String receiver = "this".equals(args.get(0).trim()) && resolver.recv != null
                        ? resolver.recv : renderArgument(args.get(0), resolver);
                calleeExpr = receiver + "." + goMethod;
                rest = args.subList(1, args.size());
            } else {
                calleeExpr = cls != null ? staticName(cls, method) : funcName(method);
            }
        } else {
            calleeExpr = resolver.resolve(callee, false, true);
            if (calleeExpr == null) calleeExpr = funcName(callee);
        }
        List<String> rendered = new ArrayList<String>();
        for (String arg : rest) {
            rendered.add(renderArgument(arg, resolver));
        }
        return calleeExpr + "(" + join(rendered, ", ") + ")";
    }

    private static String renderArgument(String arg, GoResolver resolver) {
        String text = arg.trim();
        if (text.startsWith("std::ref(") && text.endsWith(")")) {
            String inner = renderExpression(text.substring(9, text.length() - 1), resolver);
            return inner != null ? "&" + inner : "nil";
        }
        String rendered = renderExpression(text, resolver);
        return rendered != null ? rendered : "nil /* " + text.replace("*/", "* /") + " */";
    }

    /**
     * Go 侧的名字解析，与 Rust 侧规则一致，差别在接收者与导出名
     */
    private final class GoResolver implements SimpleBody.NameResolver {
        private final GoContext ctx;
        private final Function fn;
        private final String recv;
        private final Set<String> locals = new HashSet<String>();
        private boolean lenient;

        GoResolver(GoContext ctx, Function fn, String recv) {
            this.ctx = ctx;
            this.fn = fn;
            this.recv = recv;
        }

        GoResolver lenient() {
            this.lenient = true;
            return this;
        }

        /** 共享已声明局部变量的宽松副本，未知被调函数按自由函数处理 */
        GoResolver lenientCopy() {
            GoResolver copy = new GoResolver(ctx, fn, recv);
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
            if (!viaThis) {
                if (fn != null && fn.findParameter(name) != null) return varName(name);
                if (locals.contains(name)) return varName(name);
            }
            if (cls != null) {
                if (isCall) {
                    Function m = findMethod(cls, name);
                    if (m != null && m.isStatic()) return staticName(cls, name);
                    if (m != null && recv != null) return recv + "." + methodName(cls, m);
                } else {
                    Variable f = cls.findField(name);
                    if (f != null && f.isStatic()) return staticName(cls, name);
                    if (f != null && recv != null) return recv + "." + fieldName(cls, name);
                }
            }
            if (viaThis) return null;
            IrModule module = ctx.getModule();
            if (isCall) {
                if (findFreeFunction(module, name) != null) return funcName(name);
                ClassDecl target = module.findClass(name);
                if (target != null) return "*" + constructorFor(target, -1);
            } else {
                for (Variable g : module.getGlobalVariables()) {
                    if (g.getName().equals(name)) return varName(name);
                }
                for (EnumDecl e : module.getEnums()) {
                    if (!e.isScoped() && e.getEnumerators().contains(name)) return enumeratorName(e, name);
                }
            }
            if (lenient) return isCall ? funcName(name) : varName(name);
            return null;
        }
    }

    // ============ 测试骨架 ============

    @Override
    protected void generateTestModule(GoContext ctx) {
        CodeWriter out = ctx.getOut();
        out.line("// Test scaffold generated by hybrid-transpiler.");
        out.blankLine();
        out.line("package " + options.getGoPackage());
        out.blankLine();
        out.line("import \"testing\"");
        Set<String> used = new HashSet<String>();
        for (ClassDecl cls : ctx.getModule().getClasses()) {
            for (Function m : ordinaryMethods(cls)) {
                String name = uniqueName(used, "Test" + typeName(className(cls)) + exportedName(m.getName()), m);
                writeTestStub(out, name, className(cls) + "::" + m.getName());
            }
        }
        for (Function fn : ctx.getModule().getFunctions()) {
            if ("main".equals(fn.getName())) continue;
            writeTestStub(out, uniqueName(used, "Test" + exportedName(fn.getName()), fn), fn.getName());
        }
    }

    private static void writeTestStub(CodeWriter out, String name, String subject) {
        out.blankLine();
        out.open("func " + name + "(t *testing.T) {");
        out.line("// exercise " + subject);
        out.line("t.Skip(\"not yet written\")");
        out.close("}");
    }

    // ============ 命名 ============

    private static String typeParams(ClassDecl cls) {
        if (cls.getSpecialization().isSpecialization() && !cls.getSpecialization().isPartial()) return "";
        return TemplateConversion.toBetaTypeParameters(cls.getTemplateParameters());
    }

    private static String typeArgs(ClassDecl cls) {
        if (cls.getSpecialization().isSpecialization() && !cls.getSpecialization().isPartial()) return "";
        List<String> names = templateParamNames(cls.getTemplateParameters(), false);
        return names.isEmpty() ? "" : "[" + join(names, ", ") + "]";
    }

    /** 公有成员导出（首字母大写），其余首字母小写 */
    static String memberName(ClassDecl cls, String name) {
        return cls.getAccessOf(name) == AccessLevel.PUBLIC ? exportedName(name) : unexportedName(name);
    }

    /** 虚函数总是导出，以便满足对应的 interface */
    static String methodName(ClassDecl cls, Function m) {
        if (m.isStatic()) return staticName(cls, m.getName());
        return m.isPolymorphic() ? exportedName(m.getName()) : memberName(cls, m.getName());
    }

    /** 公有字段导出，除非与同名导出方法冲突 */
    static String fieldName(ClassDecl cls, String name) {
        if (cls.getAccessOf(name) != AccessLevel.PUBLIC) return unexportedName(name);
        String exported = exportedName(name);
        for (Function m : cls.getMethods()) {
            if (!m.isConstructor() && !m.isDestructor() && exported.equals(methodName(cls, m))) {
                return unexportedName(name);
            }
        }
        return exported;
    }

    /** 静态成员提升为包级名字：{@code Counter::count} 得到 {@code CounterCount} */
    static String staticName(ClassDecl cls, String member) {
        String name = typeName(className(cls)) + NameSanitizer.capitalize(operatorName(member));
        return cls.getAccessOf(member) == AccessLevel.PUBLIC ? name : NameSanitizer.decapitalize(name);
    }

    static String exportedName(String name) {
        return NameSanitizer.sanitize(NameSanitizer.capitalize(operatorName(name)), TargetProfile.GO);
    }

    static String unexportedName(String name) {
        return NameSanitizer.sanitize(NameSanitizer.decapitalize(operatorName(name)), TargetProfile.GO);
    }

    static String funcName(String name) {
        return NameSanitizer.sanitize(operatorName(name), TargetProfile.GO);
    }

    static String varName(String name) {
        return NameSanitizer.sanitize(name, TargetProfile.GO);
    }

    static String typeName(String name) {
        return NameSanitizer.sanitize(name, TargetProfile.GO);
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
