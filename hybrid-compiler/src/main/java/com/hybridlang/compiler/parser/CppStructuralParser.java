package com.hybridlang.compiler.parser;

import com.hybridlang.compiler.ir.AccessLevel;
import com.hybridlang.compiler.ir.AccessSection;
import com.hybridlang.compiler.ir.ClassDecl;
import com.hybridlang.compiler.ir.EnumDecl;
import com.hybridlang.compiler.ir.Function;
import com.hybridlang.compiler.ir.IrModule;
import com.hybridlang.compiler.ir.Parameter;
import com.hybridlang.compiler.ir.Type;
import com.hybridlang.compiler.ir.TypeKind;
import com.hybridlang.compiler.ir.Variable;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.TreeMap;
import java.util.logging.Logger;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * C++ 结构识别器。
 *
 * <p>不是完整的 C++ 前端：只识别类 / 结构体、访问段、方法、字段、自由函数、全局变量与枚举名，
 * 函数体保留为原始文本交给分析 pass。花括号按平衡扫描匹配，方法体内的嵌套块不会截断类体。</p>
 *
 * <p>已知限制：函数指针字段与带嵌套括号的默认实参识别不了；宏不展开。</p>
 */
final class CppStructuralParser {

    private static final Logger LOG = Logger.getLogger(CppStructuralParser.class.getName());

    private static final Pattern ENUM_HEAD = Pattern.compile(
            "(?<![\\w:])enum\\s+(class\\s+|struct\\s+)?(\\w+)\\s*(?::\\s*[\\w:\\s]+?)?\\s*\\{");

    private static final Pattern CLASS_HEAD = Pattern.compile(
            "(?<![\\w:])(?:(template\\s*<[^;{}]*?>)\\s*)?"
            + "\\b(class|struct)\\s+(\\w+)\\s*(<[^;{}]*?>)?\\s*(?:final\\s*)?"
            + "(?::\\s*([^;{}]*))?\\{");

    private static final Pattern ACCESS_LABEL = Pattern.compile(
            "(?<![\\w:])(public|protected|private)\\s*:(?!:)");

    private static final String QUALIFIED_PREFIX = "(?:\\w+(?:<[^<>;{}()]*>)?::)*";

    private static final Pattern FUNCTION_HEAD = Pattern.compile(
            "(?<![\\w:~])"
            + "(?:(template\\s*<[^;{}]*?>)\\s*)?"
            + "((?:(?:virtual|static|inline|explicit|constexpr|friend)\\s+)*)"
            + "(?:([a-zA-Z_][\\w:<>,\\s*&]*?)(?:\\s+|(?<=[*&])))?"
            + "(" + QUALIFIED_PREFIX + "(?:~?[a-zA-Z_]\\w*|operator\\s*(?:\\(\\)|\\[\\]|[^\\s\\w(]{1,3})))"
            + "\\s*\\(((?:[^()]|\\([^()]*\\))*)\\)"
            + "((?:\\s*(?:const|noexcept(?:\\s*\\([^)]*\\))?|override|final|volatile))*)"
            + "\\s*(=\\s*(?:0|default|delete))?"
            + "\\s*(\\{|;|:(?!:))");

    private static final Pattern FIELD = Pattern.compile(
            "(?<![\\w:])((?:(?:const|static|mutable|constexpr|inline|extern|thread_local|volatile)\\s+)*)"
            + "([a-zA-Z_][\\w:<>,\\s*&]*?)(?:\\s+|(?<=[*&]))"
            + "([a-zA-Z_]\\w*(?:\\s*\\[[^\\]]*\\])?(?:\\s*,\\s*[*&]?\\s*[a-zA-Z_]\\w*(?:\\s*\\[[^\\]]*\\])?)*)"
            + "\\s*(?:=\\s*([^;]*)|(\\{[^;]*\\}))?\\s*;");

    private static final Pattern PARAMETER = Pattern.compile(
            "^(.*?)(?:\\s+|(?<=[*&]))([a-zA-Z_]\\w*)\\s*(\\[[^\\]]*\\])?(?:\\s*=\\s*(.+))?$", Pattern.DOTALL);

    private static final Pattern CONST_WORD = Pattern.compile("\\bconst\\b");

    /** 不可能是函数名的关键字：控制流、运算符与协程关键字 */
    private static final Set<String> NON_FUNCTION_NAMES = new HashSet<String>(Arrays.asList(
            "if", "for", "while", "switch", "return", "sizeof", "catch", "alignof", "decltype",
            "typeid", "static_assert", "new", "delete", "throw", "co_return", "co_await", "co_yield",
            "noexcept", "alignas", "requires"));

    /** 以这些词开头的“类型”说明匹配落在了语句或别名声明上 */
    private static final Set<String> NON_TYPE_WORDS = new HashSet<String>(Arrays.asList(
            "return", "else", "new", "delete", "throw", "case", "goto", "using", "typedef",
            "namespace", "friend", "template", "class", "struct", "enum", "co_return", "co_await",
            "co_yield", "public", "private", "protected", "operator", "static_assert"));

    /** 单独出现时只是类型的一部分，不能作为参数名 */
    private static final Set<String> TYPE_ONLY_WORDS = new HashSet<String>(Arrays.asList(
            "int", "char", "long", "short", "double", "float", "bool", "unsigned", "signed",
            "const", "volatile", "void", "auto", "struct", "typename"));

    private final TypeParser typeParser = new TypeParser();

    IrModule parse(String source) {
        String cleaned = CppText.stripPreprocessor(CppText.stripComments(source));
        IrModule ir = new IrModule();

        StringBuilder top = new StringBuilder(cleaned);
        blankEnums(top, ir);
        extractClasses(top, ir);
        extractFreeFunctions(top, ir);
        extractGlobals(top.toString(), ir);

        LOG.fine("识别完成: " + ir.getClasses().size() + " classes, "
                + ir.getFunctions().size() + " functions, "
                + ir.getGlobalVariables().size() + " globals");
        return ir;
    }

    // ============ 枚举 ============

    private void blankEnums(StringBuilder buf, IrModule ir) {
        String text = buf.toString();
        Matcher m = ENUM_HEAD.matcher(text);
        int from = 0;
        while (from < text.length() && m.find(from)) {
            int open = m.end() - 1;
            int close = CppText.findMatchingBrace(text, open);
            if (close < 0) {
                from = m.end();
                continue;
            }
            String name = m.group(2);
            ir.registerType(name, new Type(TypeKind.ENUM, name));
            ir.addEnum(readEnum(name, m.group(1) != null, text.substring(open + 1, close)));
            int end = skipTrailingSemicolon(text, close + 1);
            CppText.blank(buf, m.start(), end);
            from = end;
        }
    }

    private static EnumDecl readEnum(String name, boolean scoped, String body) {
        EnumDecl decl = new EnumDecl(name, scoped);
        // 枚举值里可能有 << 运算符，不能按尖括号配对切分
        for (String raw : body.split(",")) {
            String item = raw.trim();
            if (item.isEmpty()) continue;
            int eq = item.indexOf('=');
            if (eq < 0) {
                decl.addEnumerator(item, null);
            } else {
                decl.addEnumerator(item.substring(0, eq).trim(), CppText.normalizeSpace(item.substring(eq + 1)));
            }
        }
        return decl;
    }

    // ============ 类 ============

    private void extractClasses(StringBuilder buf, IrModule ir) {
        String text = buf.toString();
        Matcher m = CLASS_HEAD.matcher(text);
        List<int[]> ranges = new ArrayList<int[]>();
        int from = 0;
        while (from < text.length() && m.find(from)) {
            int open = m.end() - 1;
            int close = CppText.findMatchingBrace(text, open);
            if (close < 0) {
                LOG.fine("类体未闭合，跳过: " + m.group(3));
                from = m.end();
                continue;
            }
            parseClass(m, text.substring(open + 1, close), ir);
            int end = skipTrailingSemicolon(text, close + 1);
            ranges.add(new int[] {m.start(), end});
            from = end;
        }
        for (int[] r : ranges) {
            CppText.blank(buf, r[0], r[1]);
        }
    }

    private void parseClass(Matcher head, String body, IrModule ir) {
        String name = head.group(3);
        boolean isStruct = "struct".equals(head.group(2));
        ClassDecl cls = new ClassDecl(name, isStruct);

        if (head.group(1) != null) {
            cls.setTemplateDeclaration(CppText.normalizeSpace(head.group(1)));
        }
        if (head.group(4) != null) {
            String args = head.group(4);
            for (String arg : CppText.splitTemplateArgs(args.substring(1, args.length() - 1))) {
                cls.getSpecialization().getSpecializedArgs().add(CppText.normalizeSpace(arg));
            }
        }
        if (head.group(5) != null) {
            for (String base : CppText.splitTemplateArgs(head.group(5))) {
                String baseName = stripBaseSpecifiers(CppText.normalizeSpace(base));
                if (!baseName.isEmpty()) {
                    cls.getBaseClasses().add(baseName);
                }
            }
        }

        ir.registerType(name, new Type(isStruct ? TypeKind.STRUCT : TypeKind.CLASS, name));
        ir.addClass(cls);

        // 嵌套类型单独成为顶层 IR 类，再从外层类体中抹掉
        StringBuilder bodyBuf = new StringBuilder(body);
        blankEnums(bodyBuf, ir);
        extractClasses(bodyBuf, ir);
        parseMembers(bodyBuf.toString(), cls);
    }

    private static String stripBaseSpecifiers(String base) {
        String result = base;
        boolean changed = true;
        while (changed) {
            changed = false;
            for (String kw : new String[] {"public ", "protected ", "private ", "virtual "}) {
                if (result.startsWith(kw)) {
                    result = result.substring(kw.length()).trim();
                    changed = true;
                }
            }
        }
        return result;
    }

    private void parseMembers(String body, ClassDecl cls) {
        Matcher m = ACCESS_LABEL.matcher(body);
        AccessLevel level = cls.isStruct() ? AccessLevel.PUBLIC : AccessLevel.PRIVATE;
        boolean explicitLabel = false;
        int start = 0;
        while (m.find()) {
            parseSection(body.substring(start, m.start()), level, explicitLabel, cls);
            level = AccessLevel.fromLabel(m.group(1));
            explicitLabel = true;
            start = m.end();
        }
        parseSection(body.substring(start), level, explicitLabel, cls);
    }

    private void parseSection(String text, AccessLevel level, boolean explicitLabel, ClassDecl cls) {
        TreeMap<Integer, List<String>> order = new TreeMap<Integer, List<String>>();
        StringBuilder rest = new StringBuilder(text);

        Matcher m = FUNCTION_HEAD.matcher(text);
        int from = 0;
        while (from < text.length() && m.find(from)) {
            FunctionMatch fm = readFunction(text, m, cls.getName());
            if (fm == null) {
                from = m.start() + 1;
                continue;
            }
            CppText.blank(rest, m.start(), fm.end);
            from = fm.end;
            if (fm.deleted) continue;
            cls.addMethod(fm.function);
            remember(order, m.start(), fm.function.getName());
        }

        for (Variable field : readVariables(rest.toString(), order)) {
            cls.addField(field);
        }

        if (!explicitLabel && order.isEmpty()) return;
        AccessSection section = new AccessSection(level);
        for (List<String> names : order.values()) {
            for (String n : names) {
                if (!section.getMembers().contains(n)) {
                    section.addMember(n);
                }
            }
        }
        cls.getAccessSections().add(section);
    }

    private static void remember(TreeMap<Integer, List<String>> order, int position, String name) {
        List<String> names = order.get(position);
        if (names == null) {
            names = new ArrayList<String>();
            order.put(position, names);
        }
        names.add(name);
    }

    // ============ 函数 ============

    /** 一次函数头匹配的结果 */
    private static final class FunctionMatch {
        Function function;
        String owner;
        int end;
        boolean deleted;
    }

    /**
     * 解析 FUNCTION_HEAD 的一次命中，返回 null 表示这不是函数声明 / 定义。
     *
     * @param className 所在类名；顶层调用传 null
     */
    private FunctionMatch readFunction(String text, Matcher m, String className) {
        String templateDecl = m.group(1);
        String prefix = m.group(2);
        String typeText = m.group(3) == null ? "" : CppText.normalizeSpace(m.group(3));
        String rawName = CppText.normalizeSpace(m.group(4));
        String qualifiers = m.group(6);
        String special = m.group(7);
        String terminator = m.group(8);

        if (!atStatementBoundary(text, m.start())) return null;
        if (prefix.contains("friend")) return null;
        if (!typeText.isEmpty() && NON_TYPE_WORDS.contains(firstWord(typeText))) return null;

        String owner = null;
        String name = rawName;
        int sep = rawName.lastIndexOf("::");
        if (sep >= 0) {
            String qualifier = stripTemplateArgs(rawName.substring(0, sep));
            int outer = qualifier.lastIndexOf("::");
            owner = outer >= 0 ? qualifier.substring(outer + 2) : qualifier;
            name = rawName.substring(sep + 2);
        }
        if (NON_FUNCTION_NAMES.contains(name)) return null;

        boolean destructor = name.startsWith("~");
        String enclosing = className != null ? className : owner;
        boolean constructor = !destructor && typeText.isEmpty();
        if (constructor && (enclosing == null || !name.equals(enclosing))) return null;
        if (":".equals(terminator) && !constructor) return null;

        Function fn = new Function(name, constructor || destructor ? null : typeParser.parse(typeText));
        if (destructor) {
            fn.setConstructor(false);
            fn.setDestructor(true);
        }
        if (templateDecl != null) {
            fn.setTemplateDeclaration(CppText.normalizeSpace(templateDecl));
        }
        fn.setVirtual(prefix.contains("virtual"));
        fn.setStatic(prefix.contains("static"));
        fn.setConst(CONST_WORD.matcher(qualifiers).find());
        fn.setOverride(qualifiers.contains("override") || qualifiers.contains("final"));
        if (qualifiers.contains("noexcept") && !qualifiers.replace(" ", "").contains("noexcept(false)")) {
            fn.getExceptionSpec().setNoexcept(true);
        }
        for (Parameter p : parseParameters(m.group(5))) {
            fn.addParameter(p);
        }

        FunctionMatch result = new FunctionMatch();
        result.function = fn;
        result.owner = className == null ? owner : null;
        if (special != null) {
            String s = special.replace(" ", "");
            if ("=0".equals(s)) {
                fn.setPureVirtual(true);
                fn.setVirtual(true);
            }
            result.deleted = "=delete".equals(s);
        }

        int open = -1;
        if ("{".equals(terminator)) {
            open = m.end(8) - 1;
        } else if (":".equals(terminator)) {
            open = findConstructorBody(text, m.end());
            if (open < 0) return null;
            readMemberInitializers(text.substring(m.end(), open), fn);
        }

        if (open < 0) {
            result.end = m.end();
            return result;
        }
        int close = CppText.findMatchingBrace(text, open);
        if (close < 0) {
            LOG.fine("函数体未闭合: " + rawName);
            fn.setBody(text.substring(open + 1));
            result.end = text.length();
            return result;
        }
        fn.setBody(text.substring(open + 1, close));
        result.end = close + 1;
        return result;
    }

    /**
     * 从初始化列表起点找到构造器函数体的 {@code '{'}：
     * 跳过 {@code a(x)} 与 {@code b{y}} 形式的成员初始化。
     */
    private static int findConstructorBody(String text, int from) {
        for (int i = from; i < text.length(); i++) {
            char c = text.charAt(i);
            if (c == ';') return -1;
            if (c == '(') {
                int close = CppText.findMatchingParen(text, i);
                if (close < 0) return -1;
                i = close;
            } else if (c == '{') {
                char prev = previousNonSpace(text, i);
                if (Character.isJavaIdentifierPart(prev) || prev == '>') {
                    int close = CppText.findMatchingBrace(text, i);
                    if (close < 0) return -1;
                    i = close;
                } else {
                    return i;
                }
            }
        }
        return -1;
    }

    private static void readMemberInitializers(String list, Function fn) {
        for (String item : CppText.splitArguments(list)) {
            int paren = item.indexOf('(');
            int brace = item.indexOf('{');
            int open = paren < 0 ? brace : (brace < 0 ? paren : Math.min(paren, brace));
            if (open <= 0) continue;
            String member = item.substring(0, open).trim();
            String expr = item.substring(open + 1, item.length() - 1).trim();
            fn.getMemberInitializers().put(member, expr);
        }
    }

    private List<Parameter> parseParameters(String params) {
        List<Parameter> result = new ArrayList<Parameter>();
        String trimmed = params.trim();
        if (trimmed.isEmpty() || "void".equals(trimmed)) return result;

        for (String raw : CppText.splitParameters(trimmed)) {
            String text = CppText.normalizeSpace(raw);
            if (text.isEmpty() || "...".equals(text)) continue;

            String defaultValue = "";
            Matcher m = PARAMETER.matcher(text);
            if (m.matches() && !m.group(1).trim().isEmpty()
                    && !TYPE_ONLY_WORDS.contains(m.group(2))
                    && !isOnlyQualifiers(m.group(1))) {
                String typeText = m.group(1).trim() + (m.group(3) != null ? m.group(3) : "");
                if (m.group(4) != null) defaultValue = m.group(4).trim();
                result.add(new Parameter(m.group(2), typeParser.parse(typeText), defaultValue));
            } else {
                // 未命名参数：整段都是类型
                int eq = text.indexOf('=');
                String typeText = eq >= 0 ? text.substring(0, eq).trim() : text;
                if (eq >= 0) defaultValue = text.substring(eq + 1).trim();
                result.add(new Parameter("", typeParser.parse(typeText), defaultValue));
            }
        }
        return result;
    }

    private static boolean isOnlyQualifiers(String typeText) {
        for (String word : typeText.trim().split("\\s+")) {
            if (!TYPE_ONLY_WORDS.contains(word) || "int".equals(word) || "char".equals(word)
                    || "double".equals(word) || "float".equals(word) || "bool".equals(word)
                    || "void".equals(word) || "auto".equals(word)) {
                return false;
            }
        }
        return true;
    }

    // ============ 自由函数与全局变量 ============

    private void extractFreeFunctions(StringBuilder buf, IrModule ir) {
        String text = buf.toString();
        Matcher m = FUNCTION_HEAD.matcher(text);
        List<FunctionMatch> prototypes = new ArrayList<FunctionMatch>();
        List<FunctionMatch> definitions = new ArrayList<FunctionMatch>();
        int from = 0;
        while (from < text.length() && m.find(from)) {
            FunctionMatch fm = readFunction(text, m, null);
            if (fm == null) {
                from = m.start() + 1;
                continue;
            }
            CppText.blank(buf, m.start(), fm.end);
            from = fm.end;
            if (fm.deleted) continue;
            if (fm.function.hasBody()) {
                definitions.add(fm);
            } else {
                prototypes.add(fm);
            }
        }

        List<Function> free = new ArrayList<Function>();
        for (FunctionMatch fm : prototypes) {
            if (fm.owner != null && ir.findClass(fm.owner) != null) continue;
            if (findDefinition(definitions, fm.function) == null) {
                free.add(fm.function);
            }
        }
        for (FunctionMatch fm : definitions) {
            ClassDecl owner = fm.owner == null ? null : ir.findClass(fm.owner);
            if (owner != null) {
                attachOutOfLine(owner, fm.function);
            } else {
                free.add(fm.function);
            }
        }
        for (Function f : free) {
            ir.addFunction(f);
        }
    }

    private static FunctionMatch findDefinition(List<FunctionMatch> definitions, Function prototype) {
        for (FunctionMatch d : definitions) {
            if (d.owner == null && d.function.getName().equals(prototype.getName())
                    && d.function.getParameters().size() == prototype.getParameters().size()) {
                return d;
            }
        }
        return null;
    }

    /**
     * 类外定义 {@code R Owner::name(...) { ... }}：并入类内声明；没有对应声明时作为新方法加入
     */
    private static void attachOutOfLine(ClassDecl owner, Function definition) {
        for (Function declared : owner.getMethods()) {
            if (!declared.hasBody()
                    && declared.getName().equals(definition.getName())
                    && declared.getParameters().size() == definition.getParameters().size()) {
                declared.setBody(definition.getBody());
                declared.getParameters().clear();
                declared.getParameters().addAll(definition.getParameters());
                declared.getMemberInitializers().putAll(definition.getMemberInitializers());
                return;
            }
        }
        owner.addMethod(definition);
    }

    private void extractGlobals(String text, IrModule ir) {
        for (Variable v : readVariables(text, null)) {
            ir.addGlobalVariable(v);
        }
    }

    private List<Variable> readVariables(String text, TreeMap<Integer, List<String>> order) {
        List<Variable> result = new ArrayList<Variable>();
        Matcher m = FIELD.matcher(text);
        while (m.find()) {
            String prefix = m.group(1);
            String typeText = CppText.normalizeSpace(m.group(2));
            if (NON_TYPE_WORDS.contains(firstWord(typeText))) continue;
            if (!atStatementBoundary(text, m.start())) continue;

            boolean isStatic = prefix.contains("static");
            boolean isConst = prefix.contains("const ") || prefix.contains("constexpr");
            String initializer = m.group(4) != null ? m.group(4).trim()
                    : (m.group(5) != null ? m.group(5).trim() : "");

            for (String declarator : m.group(3).split(",")) {
                String d = declarator.trim().replaceFirst("^[*&]\\s*", "");
                String arraySuffix = "";
                int bracket = d.indexOf('[');
                if (bracket >= 0) {
                    arraySuffix = d.substring(bracket).replace(" ", "");
                    d = d.substring(0, bracket).trim();
                }
                Type type = typeParser.parse((isConst ? "const " : "") + typeText + arraySuffix);
                Variable v = new Variable(d, type);
                v.setStatic(isStatic);
                v.setConst(isConst || type.isConst());
                v.setInitializer(initializer);
                result.add(v);
                if (order != null) {
                    remember(order, m.start(), d);
                }
            }
        }
        return result;
    }

    // ============ 工具 ============

    /** 匹配起点之前必须是语句边界，否则命中的是表达式的一部分 */
    private static boolean atStatementBoundary(String text, int start) {
        char prev = previousNonSpace(text, start);
        return prev == 0 || prev == ';' || prev == '{' || prev == '}' || prev == ':' || prev == ']';
    }

    private static char previousNonSpace(String text, int index) {
        for (int i = index - 1; i >= 0; i--) {
            char c = text.charAt(i);
            if (!Character.isWhitespace(c)) return c;
        }
        return 0;
    }

    private static int skipTrailingSemicolon(String text, int from) {
        int i = from;
        while (i < text.length() && Character.isWhitespace(text.charAt(i))) i++;
        return i < text.length() && text.charAt(i) == ';' ? i + 1 : from;
    }

    private static String firstWord(String text) {
        int i = 0;
        while (i < text.length() && (Character.isJavaIdentifierPart(text.charAt(i)))) i++;
        return text.substring(0, i);
    }

    private static String stripTemplateArgs(String name) {
        StringBuilder sb = new StringBuilder();
        int depth = 0;
        for (int i = 0; i < name.length(); i++) {
            char c = name.charAt(i);
            if (c == '<') depth++;
            else if (c == '>') depth--;
            else if (depth == 0) sb.append(c);
        }
        return sb.toString();
    }
}
