package com.hybridlang.compiler.analysis;

import com.hybridlang.compiler.ir.ClassDecl;
import com.hybridlang.compiler.ir.Function;
import com.hybridlang.compiler.ir.IrModule;
import com.hybridlang.compiler.ir.NestedTemplateParam;
import com.hybridlang.compiler.ir.NonTypeParam;
import com.hybridlang.compiler.ir.Parameter;
import com.hybridlang.compiler.ir.TemplateParameter;
import com.hybridlang.compiler.ir.Type;
import com.hybridlang.compiler.ir.TypeKind;
import com.hybridlang.compiler.ir.TypeParam;
import com.hybridlang.compiler.ir.Variable;
import com.hybridlang.compiler.parser.CppText;
import com.hybridlang.compiler.parser.TypeParser;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * 模板分析：解析 {@code template<...>} 形参列表，并把引用模板形参的类型标记为 TEMPLATE_PARAM。
 */
public class TemplateAnalyzer implements IrPass {

    private final TypeParser typeParser = new TypeParser();

    @Override
    public String getName() {
        return "TemplateAnalyzer";
    }

    @Override
    public IrModule run(IrModule module) {
        for (ClassDecl cls : module.getClasses()) {
            analyzeClass(cls);
        }
        for (Function fn : module.getFunctions()) {
            analyzeFunction(fn, new HashSet<String>());
        }
        return module;
    }

    private void analyzeClass(ClassDecl cls) {
        Set<String> classParams = new HashSet<String>();
        if (cls.getTemplateDeclaration() != null) {
            cls.setTemplate(true);
            cls.getTemplateParameters().clear();
            analyzeTemplateParams(cls.getTemplateDeclaration(), cls.getTemplateParameters());
            classParams.addAll(typeParamNames(cls.getTemplateParameters()));
            // template<typename T> class Foo<T*> 是偏特化；template<> class Foo<int> 是全特化
            cls.getSpecialization().setPartial(cls.getSpecialization().isSpecialization()
                    && !cls.getTemplateParameters().isEmpty());
        }
        for (Variable field : cls.getFields()) {
            retag(field.getType(), classParams);
        }
        for (Function method : cls.getMethods()) {
            analyzeFunction(method, classParams);
        }
    }

    private void analyzeFunction(Function fn, Set<String> enclosingParams) {
        Set<String> names = new HashSet<String>(enclosingParams);
        if (fn.getTemplateDeclaration() != null) {
            fn.setTemplate(true);
            fn.getTemplateParameters().clear();
            analyzeTemplateParams(fn.getTemplateDeclaration(), fn.getTemplateParameters());
            names.addAll(typeParamNames(fn.getTemplateParameters()));
        }
        if (names.isEmpty()) return;
        retag(fn.getReturnType(), names);
        for (Parameter p : fn.getParameters()) {
            retag(p.getType(), names);
        }
    }

    /**
     * 解析模板声明文本，返回形参列表。空文本或没有尖括号时返回空列表。
     */
    public List<TemplateParameter> analyzeTemplateParams(String declaration) {
        List<TemplateParameter> params = new ArrayList<TemplateParameter>();
        analyzeTemplateParams(declaration, params);
        return params;
    }

    /**
     * 解析模板声明文本，把形参追加到 target
     */
    public void analyzeTemplateParams(String declaration, List<TemplateParameter> target) {
        if (declaration == null) return;
        int start = declaration.indexOf('<');
        int end = declaration.lastIndexOf('>');
        if (start < 0 || end <= start) return;

        for (String raw : CppText.splitTemplateArgs(declaration.substring(start + 1, end))) {
            String text = CppText.normalizeSpace(raw);
            if (text.isEmpty()) continue;
            TemplateParameter param = parseParameter(text);
            if (param != null) {
                target.add(param);
            }
        }
    }

    private TemplateParameter parseParameter(String text) {
        if (startsWithWord(text, "typename") || startsWithWord(text, "class")) {
            String rest = text.substring(text.indexOf(' ') < 0 ? text.length() : text.indexOf(' ')).trim();
            String defaultValue = null;
            int eq = rest.indexOf('=');
            if (eq >= 0) {
                defaultValue = rest.substring(eq + 1).trim();
                rest = rest.substring(0, eq).trim();
            }
            if (rest.startsWith("...")) {
                rest = rest.substring(3).trim();  // 变参包
            }
            return new TypeParam(rest, defaultValue);
        }

        if (startsWithWord(text, "template")) {
            int close = text.lastIndexOf('>');
            String tail = close >= 0 ? text.substring(close + 1).trim() : text;
            int eq = tail.indexOf('=');
            if (eq >= 0) tail = tail.substring(0, eq).trim();
            int cls = tail.lastIndexOf("class");
            String name = cls >= 0 ? tail.substring(cls + 5).trim() : lastToken(tail);
            return new NestedTemplateParam(name);
        }

        String declarator = text;
        String defaultValue = null;
        int eq = declarator.indexOf('=');
        if (eq >= 0) {
            defaultValue = declarator.substring(eq + 1).trim();
            declarator = declarator.substring(0, eq).trim();
        }
        String name = lastToken(declarator);
        String typeText = declarator.substring(0, declarator.length() - name.length()).trim();
        return new NonTypeParam(name, typeParser.parse(typeText), defaultValue);
    }

    private static List<String> typeParamNames(List<TemplateParameter> params) {
        List<String> names = new ArrayList<String>();
        for (TemplateParameter p : params) {
            if (p instanceof TypeParam || p instanceof NestedTemplateParam) {
                names.add(p.getName());
            }
        }
        return names;
    }

    /** 递归把名字等于模板形参的 CLASS 类型改标为 TEMPLATE_PARAM */
    private static void retag(Type type, Set<String> names) {
        if (type == null) return;
        if (type.getKind() == TypeKind.CLASS && names.contains(type.getName())) {
            type.setKind(TypeKind.TEMPLATE_PARAM);
        }
        if (type.getElementType() != null) {
            retag(type.getElementType(), names);
        }
        for (Type arg : type.getTemplateArgs()) {
            if (arg != type.getElementType()) {
                retag(arg, names);
            }
        }
    }

    private static boolean startsWithWord(String text, String word) {
        return text.startsWith(word)
                && (text.length() == word.length() || !Character.isJavaIdentifierPart(text.charAt(word.length())));
    }

    private static String lastToken(String text) {
        String[] tokens = text.trim().split("\\s+");
        return tokens[tokens.length - 1];
    }
}
