package com.hybridlang.compiler.analysis;

import com.hybridlang.compiler.ir.Function;
import com.hybridlang.compiler.ir.IrModule;
import com.hybridlang.compiler.ir.TryCatchBlock;
import com.hybridlang.compiler.parser.CppText;

import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * 异常分析：throw 表达式、try/catch 块、noexcept。
 *
 * <p>调用了可能抛异常的函数、且调用点不在 try 块内的函数也视为可能抛出，迭代到不动点。</p>
 */
public class ExceptionAnalyzer implements IrPass {

    private static final Pattern THROW = Pattern.compile("\\bthrow\\b\\s*([\\w:]+)?\\s*([({;])?");
    private static final Pattern TRY = Pattern.compile("\\btry\\s*\\{");
    private static final Pattern CATCH = Pattern.compile("\\G\\s*catch\\s*\\(([^)]*)\\)\\s*\\{");
    private static final Pattern CATCH_DECL = Pattern.compile("^(.*?[\\s&*])\\s*(\\w+)$");

    @Override
    public String getName() {
        return "ExceptionAnalyzer";
    }

    @Override
    public IrModule run(IrModule module) {
        List<Function> all = module.getAllFunctions();
        for (Function fn : all) {
            analyze(fn);
        }
        propagate(all);
        return module;
    }

    public void analyze(Function fn) {
        fn.getTryCatchBlocks().clear();
        if (!fn.hasBody()) {
            fn.setMayThrow(false);
            fn.getExceptionSpec().setCanThrow(false);
            return;
        }
        String body = fn.getBody();

        boolean throwsSomething = false;
        Matcher t = THROW.matcher(body);
        while (t.find()) {
            throwsSomething = true;
            String type = t.group(1);
            // throw; 与 throw e; 是重新抛出，不引入新类型
            if (type != null && ("(".equals(t.group(2)) || "{".equals(t.group(2)))) {
                fn.getExceptionSpec().addThrowType(type);
            }
        }

        readTryCatchBlocks(body, fn);

        boolean noexcept = fn.getExceptionSpec().isNoexcept();
        fn.setMayThrow(throwsSomething && !noexcept && !allThrowsCaught(body));
        fn.getExceptionSpec().setCanThrow(fn.mayThrow());
    }

    private static void readTryCatchBlocks(String body, Function fn) {
        Matcher m = TRY.matcher(body);
        int from = 0;
        while (from < body.length() && m.find(from)) {
            int open = m.end() - 1;
            int close = CppText.findMatchingBrace(body, open);
            if (close < 0) break;
            TryCatchBlock block = new TryCatchBlock(body.substring(open + 1, close));

            int pos = close + 1;
            Matcher c = CATCH.matcher(body);
            while (pos < body.length() && c.find(pos)) {
                int hOpen = c.end() - 1;
                int hClose = CppText.findMatchingBrace(body, hOpen);
                if (hClose < 0) break;
                String[] decl = splitCatchDeclaration(c.group(1));
                block.addCatchClause(new TryCatchBlock.CatchClause(
                        decl[0], decl[1], body.substring(hOpen + 1, hClose)));
                pos = hClose + 1;
            }
            fn.getTryCatchBlocks().add(block);
            // 嵌套 try 单独记录
            from = open + 1;
        }
    }

    /**
     * {@code const std::exception& e} 得到 {@code ["std::exception", "e"]}；{@code ...} 得到 {@code ["...", ""]}
     */
    static String[] splitCatchDeclaration(String declaration) {
        String text = CppText.normalizeSpace(declaration);
        if ("...".equals(text)) return new String[] {"...", ""};
        if (text.startsWith("const ")) text = text.substring(6).trim();

        String var = "";
        Matcher m = CATCH_DECL.matcher(text);
        String type = text;
        if (m.matches() && !m.group(1).trim().isEmpty()) {
            type = m.group(1);
            var = m.group(2);
        }
        type = type.replace("&", "").replace("*", "").trim();
        if (type.endsWith(" const")) type = type.substring(0, type.length() - 6).trim();
        return new String[] {type, var};
    }

    /** 所有 throw 都落在能接住它的 try 块里时，异常不会逃出函数 */
    private static boolean allThrowsCaught(String body) {
        String outside = blankHandledTryBodies(body);
        return !THROW.matcher(outside).find();
    }

    /**
     * 抹掉“异常必然被接住”的 try 块：有 catch(...)、catch std::exception，
     * 或块内每个 throw 的类型都有对应的 catch 子句。
     */
    private static String blankHandledTryBodies(String body) {
        StringBuilder sb = new StringBuilder(body);
        Matcher m = TRY.matcher(body);
        int from = 0;
        while (from < body.length() && m.find(from)) {
            int open = m.end() - 1;
            int close = CppText.findMatchingBrace(body, open);
            if (close < 0) break;
            Set<String> caught = new HashSet<String>();
            Matcher c = CATCH.matcher(body);
            int pos = close + 1;
            while (pos < body.length() && c.find(pos)) {
                int hClose = CppText.findMatchingBrace(body, c.end() - 1);
                if (hClose < 0) break;
                caught.add(splitCatchDeclaration(c.group(1))[0]);
                pos = hClose + 1;
            }
            if (handlesAll(body.substring(open + 1, close), caught)) {
                CppText.blank(sb, open, close + 1);
            }
            from = open + 1;
        }
        return sb.toString();
    }

    private static boolean handlesAll(String tryBody, Set<String> caught) {
        if (caught.contains("...") || caught.contains("std::exception")) return true;
        if (caught.isEmpty()) return false;
        Matcher t = THROW.matcher(tryBody);
        while (t.find()) {
            if (t.group(1) == null || !caught.contains(t.group(1))) return false;
        }
        return true;
    }

    private static void propagate(List<Function> functions) {
        boolean changed = true;
        while (changed) {
            changed = false;
            Set<String> throwing = new HashSet<String>();
            for (Function f : functions) {
                if (f.mayThrow()) throwing.add(f.getName());
            }
            for (Function f : functions) {
                if (f.mayThrow() || !f.hasBody() || f.getExceptionSpec().isNoexcept()) continue;
                String outside = blankHandledTryBodies(f.getBody());
                for (String callee : throwing) {
                    if (callee.equals(f.getName())) continue;
                    if (Pattern.compile("(?<![\\w~])" + Pattern.quote(callee) + "\\s*\\(").matcher(outside).find()) {
                        f.setMayThrow(true);
                        f.getExceptionSpec().setCanThrow(true);
                        changed = true;
                        break;
                    }
                }
            }
        }
    }
}
