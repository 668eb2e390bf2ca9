package com.hybridlang.backend.codegen;

import com.hybridlang.compiler.parser.CppText;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * 形如 {@code for (int i = a; i < b; ++i) { ... }} 的计数循环，且循环就是整个函数体
 */
public final class CountedLoop {

    private static final Pattern HEAD = Pattern.compile(
            "^for\\s*\\(\\s*(?:(?:const\\s+)?(?:int|long|short|unsigned|size_t|std::size_t|auto|unsigned\\s+int)\\s+)?"
                    + "(\\w+)\\s*=\\s*([^;]+);\\s*(\\w+)\\s*(<=|<)\\s*([^;]+);\\s*(?:\\+\\+\\s*(\\w+)|(\\w+)\\s*\\+\\+)\\s*\\)\\s*\\{");

    private final String variable;
    private final String from;
    private final String to;
    private final boolean inclusive;
    private final String body;

    private CountedLoop(String variable, String from, String to, boolean inclusive, String body) {
        this.variable = variable;
        this.from = from;
        this.to = to;
        this.inclusive = inclusive;
        this.body = body;
    }

    /**
     * 整个函数体恰好是一个计数循环时返回它，否则返回 null
     */
    public static CountedLoop match(String functionBody) {
        if (functionBody == null) return null;
        String text = functionBody.trim();
        Matcher m = HEAD.matcher(text);
        if (!m.find()) return null;
        String var = m.group(1);
        String step = m.group(6) != null ? m.group(6) : m.group(7);
        if (!var.equals(m.group(3)) || !var.equals(step)) return null;

        int open = m.end() - 1;
        int close = CppText.findMatchingBrace(text, open);
        if (close != text.length() - 1) return null;
        return new CountedLoop(var, m.group(2).trim(), m.group(5).trim(), "<=".equals(m.group(4)),
                text.substring(open + 1, close));
    }

    public String getVariable() {
        return variable;
    }

    public String getFrom() {
        return from;
    }

    public String getTo() {
        return to;
    }

    public boolean isInclusive() {
        return inclusive;
    }

    public String getBody() {
        return body;
    }
}
