package com.hybridlang.compiler.analysis;

import com.hybridlang.compiler.ir.AtomicInfo;
import com.hybridlang.compiler.ir.ClassDecl;
import com.hybridlang.compiler.ir.ConditionVariableInfo;
import com.hybridlang.compiler.ir.Function;
import com.hybridlang.compiler.ir.IrModule;
import com.hybridlang.compiler.ir.LockInfo;
import com.hybridlang.compiler.ir.MutexInfo;
import com.hybridlang.compiler.ir.ThreadInfo;
import com.hybridlang.compiler.ir.Type;
import com.hybridlang.compiler.ir.TypeKind;
import com.hybridlang.compiler.ir.Variable;
import com.hybridlang.compiler.parser.CppText;
import com.hybridlang.compiler.parser.TypeParser;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * 并发分析：线程创建、互斥量、锁作用域、原子变量、条件变量。
 *
 * <p>函数级描述记录函数体内声明或使用的原语；类级描述记录并发原语字段，
 * 并汇总各方法对这些字段的操作。</p>
 */
public class ConcurrencyAnalyzer implements IrPass {

    private static final String TYPE_ARG = "((?:[^<>;]|<(?:[^<>;]|<[^<>;]*>)*>)+)";

    private static final Pattern NAMED_THREAD = Pattern.compile(
            "\\bstd::j?thread\\s+(\\w+)\\s*([({])");
    private static final Pattern TEMP_THREAD = Pattern.compile(
            "(?<![\\w:])std::j?thread\\s*\\(");
    private static final Pattern THREAD_POOL = Pattern.compile(
            "std::vector\\s*<\\s*std::j?thread\\s*>\\s+(\\w+)");
    private static final Pattern POOL_ADD = Pattern.compile(
            "(\\w+)\\s*\\.\\s*(?:push_back|emplace_back)\\s*\\(\\s*$");

    private static final Pattern MUTEX_DECL = Pattern.compile(
            "\\bstd::((?:recursive_|shared_)?(?:timed_)?mutex)\\s+(\\w+)\\s*;");
    private static final Pattern LOCK_DECL = Pattern.compile(
            "\\bstd::(lock_guard|unique_lock|shared_lock|scoped_lock)\\s*(?:<" + TYPE_ARG + ">)?\\s+(\\w+)\\s*([({])");
    private static final Pattern ATOMIC_DECL = Pattern.compile(
            "\\bstd::atomic\\s*<" + TYPE_ARG + ">\\s+(\\w+)");
    private static final Pattern CV_DECL = Pattern.compile(
            "\\bstd::condition_variable(?:_any)?\\s+(\\w+)\\s*;");
    private static final Pattern LAMBDA_RETURN = Pattern.compile("\\breturn\\s+([^;]*);");

    private static final Set<String> ATOMIC_METHODS = new HashSet<String>(Arrays.asList(
            "load", "store", "exchange", "fetch_add", "fetch_sub", "fetch_and", "fetch_or",
            "fetch_xor", "compare_exchange_weak", "compare_exchange_strong"));

    private final TypeParser typeParser = new TypeParser();

    @Override
    public String getName() {
        return "ConcurrencyAnalyzer";
    }

    @Override
    public IrModule run(IrModule module) {
        for (ClassDecl cls : module.getClasses()) {
            analyzeClass(cls);
        }
        for (Function fn : module.getFunctions()) {
            analyze(fn, null);
        }
        return module;
    }

    private void analyzeClass(ClassDecl cls) {
        cls.getMutexes().clear();
        cls.getAtomics().clear();
        cls.getConditionVariables().clear();
        for (Variable field : cls.getFields()) {
            Type type = field.getType();
            if (type.getKind() == TypeKind.MUTEX) {
                String spelling = type.getBaseName().replace("std::", "");
                cls.getMutexes().add(new MutexInfo(field.getName(), MutexInfo.kindOf(spelling)));
            } else if (type.getKind() == TypeKind.ATOMIC) {
                cls.getAtomics().add(new AtomicInfo(field.getName(), type.getTemplateArg(0)));
            } else if (type.getKind() == TypeKind.CONDITION_VARIABLE) {
                cls.getConditionVariables().add(new ConditionVariableInfo(field.getName()));
            }
        }

        for (Function method : cls.getMethods()) {
            analyze(method, cls);
        }

        // 类级汇总：各方法对字段原语的操作
        for (Function method : cls.getMethods()) {
            for (AtomicInfo used : method.getAtomics()) {
                AtomicInfo field = findAtomic(cls.getAtomics(), used.getVariable());
                if (field == null) continue;
                for (String op : used.getOperations()) {
                    field.addOperation(op);
                }
            }
            for (ConditionVariableInfo used : method.getConditionVariables()) {
                ConditionVariableInfo field = findConditionVariable(cls.getConditionVariables(), used.getVariable());
                if (field == null) continue;
                if (field.getAssociatedMutex().isEmpty()) {
                    field.setAssociatedMutex(used.getAssociatedMutex());
                }
                for (String cond : used.getWaitConditions()) {
                    if (!field.getWaitConditions().contains(cond)) {
                        field.getWaitConditions().add(cond);
                    }
                }
                if (used.isNotifiesAll()) field.setNotifiesAll(true);
            }
        }
        for (MutexInfo mutex : cls.getMutexes()) {
            mutex.setProtectedType(protectedTypeOf(cls, mutex.getMutexVar()));
        }
    }

    /**
     * 分析单个函数
     *
     * @param owner 所属类，自由函数为 null
     */
    public void analyze(Function fn, ClassDecl owner) {
        fn.getThreads().clear();
        fn.getMutexes().clear();
        fn.getLocks().clear();
        fn.getAtomics().clear();
        fn.getConditionVariables().clear();
        if (!fn.hasBody()) return;
        String body = fn.getBody();

        detectThreads(fn, body, owner);
        detectMutexes(fn, body);
        detectLocks(fn, body);
        detectAtomics(fn, body, owner);
        detectConditionVariables(fn, body, owner);
    }

    // ============ 线程 ============

    private void detectThreads(Function fn, String body, ClassDecl owner) {
        Matcher m = NAMED_THREAD.matcher(body);
        while (m.find()) {
            int open = m.end() - 1;
            int close = "(".equals(m.group(2))
                    ? CppText.findMatchingParen(body, open) : CppText.findMatchingBrace(body, open);
            if (close < 0) continue;
            List<String> args = CppText.splitArguments(body.substring(open + 1, close));
            if (args.isEmpty()) continue;  // 默认构造的空线程对象
            ThreadInfo info = new ThreadInfo(m.group(1), args.get(0), args.subList(1, args.size()));
            info.setDetached(Pattern.compile("\\b" + Pattern.quote(m.group(1)) + "\\s*\\.\\s*detach\\s*\\(")
                    .matcher(body).find());
            fn.getThreads().add(info);
        }

        // std::thread(f, x) 临时对象：放入容器或直接 detach
        Matcher t = TEMP_THREAD.matcher(body);
        while (t.find()) {
            int open = t.end() - 1;
            int close = CppText.findMatchingParen(body, open);
            if (close < 0) continue;
            List<String> args = CppText.splitArguments(body.substring(open + 1, close));
            if (args.isEmpty()) continue;
            Matcher pool = POOL_ADD.matcher(body.substring(0, t.start()));
            String var = pool.find() ? pool.group(1) : "";
            ThreadInfo info = new ThreadInfo(var, args.get(0), args.subList(1, args.size()));
            info.setDetached(body.substring(close + 1).matches("(?s)\\s*\\.\\s*detach\\s*\\(.*"));
            fn.getThreads().add(info);
        }

        // std::vector<std::thread> pool; pool.emplace_back(f, x);
        Set<String> pools = new LinkedHashSet<String>();
        Matcher p = THREAD_POOL.matcher(body);
        while (p.find()) pools.add(p.group(1));
        if (owner != null) {
            for (Variable field : owner.getFields()) {
                Type type = field.getType();
                if (type.getKind() == TypeKind.STD_VECTOR && type.getElementType() != null
                        && type.getElementType().getKind() == TypeKind.THREAD) {
                    pools.add(field.getName());
                }
            }
        }
        for (String pool : pools) {
            Matcher e = Pattern.compile("\\b" + Pattern.quote(pool) + "\\s*\\.\\s*emplace_back\\s*\\(").matcher(body);
            while (e.find()) {
                int open = e.end() - 1;
                int close = CppText.findMatchingParen(body, open);
                if (close < 0) continue;
                List<String> args = CppText.splitArguments(body.substring(open + 1, close));
                if (args.isEmpty() || args.get(0).startsWith("std::thread")
                        || args.get(0).startsWith("std::jthread")) continue;
                fn.getThreads().add(new ThreadInfo(pool, args.get(0), args.subList(1, args.size())));
            }
        }
    }

    // ============ 互斥量与锁 ============

    private static void detectMutexes(Function fn, String body) {
        Matcher m = MUTEX_DECL.matcher(body);
        while (m.find()) {
            fn.getMutexes().add(new MutexInfo(m.group(2), MutexInfo.kindOf(m.group(1))));
        }
    }

    private static void detectLocks(Function fn, String body) {
        Matcher m = LOCK_DECL.matcher(body);
        while (m.find()) {
            int open = m.end() - 1;
            int close = "(".equals(m.group(4))
                    ? CppText.findMatchingParen(body, open) : CppText.findMatchingBrace(body, open);
            if (close < 0) continue;
            List<String> args = CppText.splitArguments(body.substring(open + 1, close));
            String mutexVar = args.isEmpty() ? "" : args.get(0).replace("this->", "").replace("*", "").replace("&", "").trim();
            int statementEnd = body.indexOf(';', close);
            int scopeStart = statementEnd < 0 ? close + 1 : statementEnd + 1;
            int scopeEnd = enclosingBlockEnd(body, scopeStart);
            fn.getLocks().add(new LockInfo(LockInfo.kindOf(m.group(1)), m.group(3), mutexVar,
                    body.substring(scopeStart, scopeEnd).trim()));
        }
    }

    private static int enclosingBlockEnd(String body, int from) {
        int depth = 0;
        for (int i = from; i < body.length(); i++) {
            char c = body.charAt(i);
            if (c == '{') {
                depth++;
            } else if (c == '}') {
                if (depth == 0) return i;
                depth--;
            }
        }
        return body.length();
    }

    // ============ 原子变量 ============

    private void detectAtomics(Function fn, String body, ClassDecl owner) {
        Map<String, Type> atomics = new LinkedHashMap<String, Type>();
        Matcher m = ATOMIC_DECL.matcher(body);
        while (m.find()) {
            atomics.put(m.group(2), typeParser.parse(m.group(1)));
        }
        if (owner != null) {
            for (AtomicInfo field : owner.getAtomics()) {
                if (!atomics.containsKey(field.getVariable()) && mentions(body, field.getVariable())) {
                    atomics.put(field.getVariable(), field.getValueType());
                }
            }
        }

        for (Map.Entry<String, Type> e : atomics.entrySet()) {
            AtomicInfo info = new AtomicInfo(e.getKey(), e.getValue());
            for (String op : atomicOperations(body, e.getKey())) {
                info.addOperation(op);
            }
            fn.getAtomics().add(info);
        }
    }

    /** 按出现顺序列出作用在 name 上的原子操作；++ / -- / += / -= 归一为 fetch_add / fetch_sub */
    static List<String> atomicOperations(String body, String name) {
        String n = Pattern.quote(name);
        Pattern ops = Pattern.compile(
                "\\b" + n + "\\s*\\.\\s*(\\w+)\\s*\\("
                + "|\\b" + n + "\\s*(\\+\\+|--|\\+=|-=)"
                + "|(\\+\\+|--)\\s*" + n + "\\b"
                + "|\\b" + n + "\\s*=(?!=)");
        List<String> result = new ArrayList<String>();
        Matcher m = ops.matcher(body);
        while (m.find()) {
            String op;
            if (m.group(1) != null) {
                if (!ATOMIC_METHODS.contains(m.group(1))) continue;
                op = m.group(1);
            } else {
                String symbol = m.group(2) != null ? m.group(2) : m.group(3);
                if (symbol == null) {
                    op = "store";
                } else {
                    op = symbol.startsWith("+") ? "fetch_add" : "fetch_sub";
                }
            }
            if (!result.contains(op)) result.add(op);
        }
        return result;
    }

    // ============ 条件变量 ============

    private static void detectConditionVariables(Function fn, String body, ClassDecl owner) {
        Set<String> names = new LinkedHashSet<String>();
        Matcher d = CV_DECL.matcher(body);
        while (d.find()) names.add(d.group(1));
        if (owner != null) {
            for (ConditionVariableInfo field : owner.getConditionVariables()) {
                if (mentions(body, field.getVariable())) names.add(field.getVariable());
            }
        }

        for (String name : names) {
            ConditionVariableInfo info = new ConditionVariableInfo(name);
            Matcher w = Pattern.compile("\\b" + Pattern.quote(name) + "\\s*\\.\\s*wait(?:_for|_until)?\\s*\\(")
                    .matcher(body);
            while (w.find()) {
                int open = w.end() - 1;
                int close = CppText.findMatchingParen(body, open);
                if (close < 0) continue;
                List<String> args = CppText.splitArguments(body.substring(open + 1, close));
                if (args.isEmpty()) continue;
                if (info.getAssociatedMutex().isEmpty()) {
                    info.setAssociatedMutex(mutexOfLock(fn, args.get(0)));
                }
                String last = args.get(args.size() - 1);
                if (args.size() > 1 && last.startsWith("[")) {
                    Matcher r = LAMBDA_RETURN.matcher(last);
                    info.getWaitConditions().add(r.find() ? CppText.normalizeSpace(r.group(1)) : last);
                }
            }
            info.setNotifiesAll(Pattern.compile("\\b" + Pattern.quote(name) + "\\s*\\.\\s*notify_all\\s*\\(")
                    .matcher(body).find());
            fn.getConditionVariables().add(info);
        }
    }

    private static String mutexOfLock(Function fn, String lockVar) {
        for (LockInfo lock : fn.getLocks()) {
            if (lock.getLockVar().equals(lockVar)) return lock.getMutexVar();
        }
        return lockVar;
    }

    // ============ 工具 ============

    /** 在该互斥量的锁作用域里只访问到一个普通字段时，认为它保护的是这个字段的类型 */
    private static String protectedTypeOf(ClassDecl cls, String mutexVar) {
        Set<Variable> touched = new HashSet<Variable>();
        for (Function method : cls.getMethods()) {
            for (LockInfo lock : method.getLocks()) {
                if (!lock.getMutexVar().equals(mutexVar)) continue;
                for (Variable field : cls.getFields()) {
                    Type t = field.getType();
                    if (t.getKind().isConcurrencyPrimitive()) continue;
                    if (mentions(lock.getScopeBody(), field.getName())) touched.add(field);
                }
            }
        }
        return touched.size() == 1 ? touched.iterator().next().getType().getName() : "";
    }

    private static boolean mentions(String text, String name) {
        return Pattern.compile("(?<![\\w.])" + Pattern.quote(name) + "\\b").matcher(text).find()
                || text.contains("this->" + name);
    }

    private static AtomicInfo findAtomic(List<AtomicInfo> atomics, String name) {
        for (AtomicInfo a : atomics) {
            if (a.getVariable().equals(name)) return a;
        }
        return null;
    }

    private static ConditionVariableInfo findConditionVariable(List<ConditionVariableInfo> cvs, String name) {
        for (ConditionVariableInfo cv : cvs) {
            if (cv.getVariable().equals(name)) return cv;
        }
        return null;
    }
}
