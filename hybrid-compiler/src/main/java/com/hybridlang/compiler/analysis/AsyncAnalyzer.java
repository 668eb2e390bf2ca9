package com.hybridlang.compiler.analysis;

import com.hybridlang.compiler.ir.AsyncOperation;
import com.hybridlang.compiler.ir.AsyncTaskInfo;
import com.hybridlang.compiler.ir.Function;
import com.hybridlang.compiler.ir.FutureInfo;
import com.hybridlang.compiler.ir.IrModule;
import com.hybridlang.compiler.ir.Type;
import com.hybridlang.compiler.parser.CppText;
import com.hybridlang.compiler.parser.TypeParser;

import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * 协程 / 异步分析：扫描函数体原文，记录挂起关键字、future/promise 声明与 std::async 调用。
 *
 * <p>三个扫描互不依赖；识别不出的写法只是不产生描述，不报错。</p>
 */
public class AsyncAnalyzer implements IrPass {

    private static final Pattern SUSPENSION = Pattern.compile("\\bco_(await|return|yield)\\b");

    private static final Pattern BINDING = Pattern.compile(
            "^\\s*(?:[\\w:<>,*&]+\\s+)*(\\w+)\\s*=\\s*$");

    private static final String TYPE_ARG = "((?:[^<>;]|<(?:[^<>;]|<[^<>;]*>)*>)+)";

    private static final Pattern FUTURE_DECL = Pattern.compile(
            "std::(shared_)?future\\s*<" + TYPE_ARG + ">\\s+(\\w+)\\s*[=;{(]");

    private static final Pattern PROMISE_DECL = Pattern.compile(
            "std::promise\\s*<" + TYPE_ARG + ">\\s+(\\w+)");

    private static final Pattern ASYNC_CALL = Pattern.compile("\\bstd::async\\s*\\(");

    private static final Pattern ASSIGNED_TASK = Pattern.compile(
            "(?:(?:auto|std::(?:shared_)?future\\s*<" + TYPE_ARG + ">)\\s+)?(\\w+)\\s*=\\s*$");

    private final TypeParser typeParser = new TypeParser();

    @Override
    public String getName() {
        return "AsyncAnalyzer";
    }

    @Override
    public IrModule run(IrModule module) {
        for (Function fn : module.getAllFunctions()) {
            analyze(fn);
        }
        return module;
    }

    /**
     * 分析单个函数，覆盖之前的异步描述
     */
    public void analyze(Function fn) {
        fn.getCoroutineInfo().clear();
        fn.getFutures().clear();
        fn.getAsyncTasks().clear();
        if (!fn.hasBody()) return;

        String body = fn.getBody();
        detectSuspensionPoints(fn, body);
        detectFuturesAndPromises(fn, body);
        detectAsyncLaunches(fn, body);
    }

    // ============ co_await / co_return / co_yield ============

    private void detectSuspensionPoints(Function fn, String body) {
        Matcher m = SUSPENSION.matcher(body);
        while (m.find()) {
            AsyncOperation.Kind kind = kindOf(m.group(1));
            String expression = expressionAfter(body, m.end());
            String binding = null;
            if (kind == AsyncOperation.Kind.SUSPEND) {
                Matcher b = BINDING.matcher(statementPrefix(body, m.start()));
                if (b.matches()) binding = b.group(1);
            }
            fn.getCoroutineInfo().addOperation(
                    new AsyncOperation(kind, expression, CppText.lineOf(body, m.start()), binding));
        }
    }

    private static AsyncOperation.Kind kindOf(String keyword) {
        if ("await".equals(keyword)) return AsyncOperation.Kind.SUSPEND;
        if ("return".equals(keyword)) return AsyncOperation.Kind.RETURN;
        return AsyncOperation.Kind.YIELD;
    }

    /** 关键字之后到语句结束（或外层括号闭合）为止的表达式 */
    private static String expressionAfter(String body, int from) {
        int depth = 0;
        int i = from;
        for (; i < body.length(); i++) {
            char c = body.charAt(i);
            if (c == '(' || c == '[' || c == '{') {
                depth++;
            } else if (c == ')' || c == ']' || c == '}') {
                if (depth == 0) break;
                depth--;
            } else if (c == ';' && depth == 0) {
                break;
            }
        }
        return CppText.normalizeSpace(body.substring(from, i));
    }

    /** 当前语句中位于 index 之前的部分 */
    private static String statementPrefix(String body, int index) {
        int i = index - 1;
        while (i >= 0) {
            char c = body.charAt(i);
            if (c == ';' || c == '{' || c == '}') break;
            i--;
        }
        return body.substring(i + 1, index);
    }

    // ============ future / promise ============

    private void detectFuturesAndPromises(Function fn, String body) {
        Matcher f = FUTURE_DECL.matcher(body);
        while (f.find()) {
            FutureInfo info = new FutureInfo(f.group(3), typeParser.parse(f.group(2)));
            info.setShared(f.group(1) != null);
            fn.getFutures().add(info);
        }

        // 先声明的 future 先配对，不做数据流分析
        Matcher p = PROMISE_DECL.matcher(body);
        while (p.find()) {
            for (FutureInfo future : fn.getFutures()) {
                if (!future.hasPromise()) {
                    future.setPromiseVar(p.group(2));
                    break;
                }
            }
        }
    }

    // ============ std::async ============

    private void detectAsyncLaunches(Function fn, String body) {
        Matcher m = ASYNC_CALL.matcher(body);
        while (m.find()) {
            int open = m.end() - 1;
            int close = CppText.findMatchingParen(body, open);
            if (close < 0) continue;

            List<String> args = CppText.splitArguments(body.substring(open + 1, close));
            boolean hasPolicy = !args.isEmpty() && args.get(0).startsWith("std::launch::");
            if (hasPolicy) args = args.subList(1, args.size());
            if (args.isEmpty()) continue;

            String taskVar = null;
            Type resultType = null;
            Matcher a = ASSIGNED_TASK.matcher(statementPrefix(body, m.start()));
            if (a.find()) {
                taskVar = a.group(2);
                if (a.group(1) != null) resultType = typeParser.parse(a.group(1));
            }
            // 两种形态：var = std::async(f, ...) 与 std::async(policy, f, ...)
            if (taskVar == null && !hasPolicy) continue;

            AsyncTaskInfo task = new AsyncTaskInfo(taskVar, args.get(0),
                    args.subList(1, args.size()), taskVar == null);
            if (resultType == null && taskVar != null) {
                resultType = futureValueType(fn, taskVar);
            }
            task.setResultType(resultType);
            fn.getAsyncTasks().add(task);
        }
    }

    private static Type futureValueType(Function fn, String var) {
        for (FutureInfo f : fn.getFutures()) {
            if (f.getFutureVar().equals(var)) return f.getValueType();
        }
        return null;
    }
}
