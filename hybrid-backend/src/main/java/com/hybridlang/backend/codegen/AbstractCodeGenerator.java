package com.hybridlang.backend.codegen;

import com.hybridlang.backend.TranspilerOptions;
import com.hybridlang.compiler.analysis.TemplatePatternDetector;
import com.hybridlang.compiler.ir.ClassDecl;
import com.hybridlang.compiler.ir.Function;
import com.hybridlang.compiler.ir.IrModule;
import com.hybridlang.compiler.ir.NestedTemplateParam;
import com.hybridlang.compiler.ir.TemplateParameter;
import com.hybridlang.compiler.ir.TryCatchBlock;
import com.hybridlang.compiler.ir.Type;
import com.hybridlang.compiler.ir.TypeKind;
import com.hybridlang.compiler.ir.TypeParam;
import com.hybridlang.compiler.ir.Variable;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * 两个目标生成器共用的骨架与工具方法。
 *
 * <p>{@link #generate} 为每次调用新建上下文：先生成正文，收集导入，再拼出文件头。</p>
 */
public abstract class AbstractCodeGenerator<C extends GenerationContext> implements CodeGenerator {

    private static final Map<String, String> OPERATOR_NAMES = new HashMap<String, String>();

    static {
        OPERATOR_NAMES.put("[]", "index");
        OPERATOR_NAMES.put("()", "call");
        OPERATOR_NAMES.put("+", "add");
        OPERATOR_NAMES.put("-", "sub");
        OPERATOR_NAMES.put("*", "mul");
        OPERATOR_NAMES.put("/", "div");
        OPERATOR_NAMES.put("%", "rem");
        OPERATOR_NAMES.put("==", "eq");
        OPERATOR_NAMES.put("!=", "ne");
        OPERATOR_NAMES.put("<", "lt");
        OPERATOR_NAMES.put(">", "gt");
        OPERATOR_NAMES.put("<=", "le");
        OPERATOR_NAMES.put(">=", "ge");
        OPERATOR_NAMES.put("=", "assign");
        OPERATOR_NAMES.put("+=", "add_assign");
        OPERATOR_NAMES.put("-=", "sub_assign");
        OPERATOR_NAMES.put("<<", "shl");
        OPERATOR_NAMES.put(">>", "shr");
        OPERATOR_NAMES.put("!", "not");
        OPERATOR_NAMES.put("++", "increment");
        OPERATOR_NAMES.put("--", "decrement");
    }

    protected final TranspilerOptions options;

    protected AbstractCodeGenerator(TranspilerOptions options) {
        this.options = new TranspilerOptions(options);
    }

    @Override
    public String generate(IrModule module) {
        if (module == null) {
            throw new GenerationException("No IR module to generate from", getProfile());
        }
        C ctx = createContext(module);
        collectErrorTypes(ctx);
        generateModule(ctx);
        return assemble(ctx);
    }

    @Override
    public String generateTests(IrModule module) {
        if (module == null) {
            throw new GenerationException("No IR module to generate tests from", getProfile());
        }
        C ctx = createContext(module);
        generateTestModule(ctx);
        return ctx.getOut().getOutput();
    }

    protected abstract C createContext(IrModule module);

    /** 把模块正文写入 ctx 的输出缓冲 */
    protected abstract void generateModule(C ctx);

    /** 拼接文件头、导入与正文 */
    protected abstract String assemble(C ctx);

    protected abstract void generateTestModule(C ctx);

    // ============ 异常类型 ============

    private void collectErrorTypes(C ctx) {
        for (Function fn : ctx.getModule().getAllFunctions()) {
            for (String type : fn.getExceptionSpec().getThrowTypes()) {
                registerErrorType(ctx, type);
            }
            for (TryCatchBlock block : fn.getTryCatchBlocks()) {
                for (TryCatchBlock.CatchClause clause : block.getCatchClauses()) {
                    registerErrorType(ctx, clause.getExceptionType());
                }
            }
        }
    }

    private static void registerErrorType(GenerationContext ctx, String cppType) {
        if (isCatchAllType(cppType) || ctx.getErrorTypes().containsKey(cppType)) return;
        ctx.getErrorTypes().put(cppType, errorTypeName(cppType));
    }

    /** catch(...) 与 std::exception 接住所有错误 */
    protected static boolean isCatchAllType(String cppType) {
        return "...".equals(cppType) || "std::exception".equals(cppType) || "exception".equals(cppType);
    }

    /**
     * {@code std::runtime_error} 得到 {@code RuntimeError}
     */
    protected static String errorTypeName(String cppType) {
        String simple = simpleName(cppType);
        StringBuilder sb = new StringBuilder();
        for (String part : simple.split("_")) {
            if (part.isEmpty()) continue;
            sb.append(Character.toUpperCase(part.charAt(0))).append(part.substring(1));
        }
        return sb.length() == 0 ? "Error" : sb.toString();
    }

    // ============ 类与成员 ============

    /**
     * 去掉命名空间与模板实参：{@code ns::Base<T>} 得到 {@code Base}
     */
    protected static String simpleName(String name) {
        String result = name;
        int lt = result.indexOf('<');
        if (lt >= 0) result = result.substring(0, lt);
        int colon = result.lastIndexOf("::");
        if (colon >= 0) result = result.substring(colon + 2);
        return result.trim();
    }

    protected static List<Function> constructors(ClassDecl cls) {
        List<Function> result = new ArrayList<Function>();
        for (Function m : cls.getMethods()) {
            if (m.isConstructor()) result.add(m);
        }
        return result;
    }

    protected static Function destructor(ClassDecl cls) {
        for (Function m : cls.getMethods()) {
            if (m.isDestructor()) return m;
        }
        return null;
    }

    /** 除构造 / 析构以外的方法 */
    protected static List<Function> ordinaryMethods(ClassDecl cls) {
        List<Function> result = new ArrayList<Function>();
        for (Function m : cls.getMethods()) {
            if (!m.isConstructor() && !m.isDestructor()) result.add(m);
        }
        return result;
    }

    /** 特化类型的名字：{@code Serializer<int>} 得到 {@code SerializerInt} */
    protected static String className(ClassDecl cls) {
        if (!cls.getSpecialization().isSpecialization()) {
            return cls.getName();
        }
        StringBuilder sb = new StringBuilder(cls.getName());
        for (String arg : cls.getSpecialization().getSpecializedArgs()) {
            for (String part : arg.split("[^A-Za-z0-9]+")) {
                if (!part.isEmpty()) sb.append(NameSanitizer.capitalize(part));
            }
        }
        return sb.toString();
    }

    /**
     * 运算符重载的方法名：{@code operator[]} 得到 {@code index}
     */
    protected static String operatorName(String name) {
        if (!name.startsWith("operator")) return name;
        String symbol = name.substring("operator".length()).trim();
        String mapped = OPERATOR_NAMES.get(symbol);
        return mapped != null ? mapped : "op_" + NameSanitizer.sanitize(symbol, null).replace("_", "x");
    }

    /**
     * 同一作用域里重名的方法（重载、const / 非 const 版本）追加后缀
     */
    protected static String uniqueName(Set<String> used, String name, Function fn) {
        String candidate = name;
        if (used.contains(candidate) && !fn.isConst()) {
            candidate = name + "_mut";
        }
        int n = 2;
        while (used.contains(candidate)) {
            candidate = name + "_" + n++;
        }
        used.add(candidate);
        return candidate;
    }

    /** 类型与非类型形参名（嵌套模板形参也算类型） */
    protected static List<String> templateParamNames(List<TemplateParameter> params, boolean includeNonType) {
        List<String> names = new ArrayList<String>();
        for (TemplateParameter p : params) {
            if (p instanceof TypeParam || p instanceof NestedTemplateParam || includeNonType) {
                names.add(p.getName());
            }
        }
        return names;
    }

    protected static Variable findField(ClassDecl cls, String name) {
        return cls == null ? null : cls.findField(name);
    }

    protected static Function findMethod(ClassDecl cls, String name) {
        if (cls == null) return null;
        for (Function m : cls.getMethods()) {
            if (m.getName().equals(name) && !m.isConstructor()) return m;
        }
        return null;
    }

    protected static Function findFreeFunction(IrModule module, String name) {
        for (Function f : module.getFunctions()) {
            if (f.getName().equals(name)) return f;
        }
        return null;
    }

    /** 类里声明过的 vector&lt;thread&gt; 字段或函数体里的局部线程池 */
    protected static boolean isThreadPool(Function fn, ClassDecl owner, String var) {
        if (var == null || var.isEmpty()) return false;
        Variable field = findField(owner, var);
        if (field != null) {
            return isThreadVector(field.getType());
        }
        return fn.hasBody() && Pattern.compile("std::vector\\s*<\\s*std::j?thread\\s*>\\s+" + Pattern.quote(var) + "\\b")
                .matcher(fn.getBody()).find();
    }

    protected static boolean isThreadVector(Type type) {
        return type.getKind() == TypeKind.STD_VECTOR && type.getElementType() != null
                && type.getElementType().getKind() == TypeKind.THREAD;
    }

    protected static boolean isLambda(String text) {
        return text != null && text.trim().startsWith("[");
    }

    // ============ 模板形态 ============

    /** 容器风格的模板类：提示 size() 对应的长度方法 */
    protected static void writeContainerNote(CodeWriter out, ClassDecl cls, String lenName) {
        if (TemplatePatternDetector.isContainerTemplate(cls)) {
            out.line("// container template: " + lenName + " mirrors size()");
        }
    }

    /** enable_if 约束与迭代器算法模板的说明 */
    protected static void writeTemplateNotes(CodeWriter out, Function fn) {
        if (TemplatePatternDetector.hasSfinaePattern(fn)) {
            out.line("// enable_if constraint erased; restate it as a bound on the type parameters");
        }
        if (TemplatePatternDetector.isAlgorithmTemplate(fn)) {
            out.line("// iterator-based algorithm template");
        }
    }

    // ============ 注释 ============

    /**
     * 以行注释形式写出原始代码，去掉共同缩进
     */
    protected static void writeSourceComment(CodeWriter out, String text) {
        if (text == null) return;
        String[] lines = text.split("\n");
        int common = Integer.MAX_VALUE;
        for (String line : lines) {
            if (line.trim().isEmpty()) continue;
            int indent = 0;
            while (indent < line.length() && Character.isWhitespace(line.charAt(indent))) indent++;
            common = Math.min(common, indent);
        }
        for (String line : lines) {
            if (line.trim().isEmpty()) continue;
            String stripped = line.substring(Math.min(common, line.length())).replaceAll("\\s+$", "");
            out.line("// " + stripped.replace("\t", "    "));
        }
    }

    /** 函数体原文（开启注释保留时） */
    protected void writeOriginalBody(CodeWriter out, Function fn) {
        if (options.isPreserveComments() && fn.hasBody()) {
            writeSourceComment(out, fn.getBody());
        }
    }
}
