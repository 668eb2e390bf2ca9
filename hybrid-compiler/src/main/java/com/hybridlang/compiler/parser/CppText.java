package com.hybridlang.compiler.parser;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * C++ 源码文本工具：注释剥离、括号匹配、顶层逗号切分
 */
public final class CppText {

    private static final Pattern COMMENT = Pattern.compile("//[^\n]*|/\\*.*?\\*/", Pattern.DOTALL);
    private static final Pattern PREPROCESSOR = Pattern.compile("(?m)^[ \t]*#[^\n]*");

    private CppText() {}

    /**
     * 剥离 {@code //} 与 {@code /* *}{@code /} 注释（不嵌套）。块注释中的换行保留，
     * 以免后续行号偏移。字符串字面量中的注释标记不做区分。
     */
    public static String stripComments(String code) {
        Matcher m = COMMENT.matcher(code);
        StringBuffer sb = new StringBuffer();
        while (m.find()) {
            m.appendReplacement(sb, Matcher.quoteReplacement(newlinesOf(m.group())));
        }
        m.appendTail(sb);
        return sb.toString();
    }

    /**
     * 删除预处理指令行（只删除，不展开）
     */
    public static String stripPreprocessor(String code) {
        return PREPROCESSOR.matcher(code).replaceAll("");
    }

    private static String newlinesOf(String text) {
        StringBuilder sb = new StringBuilder();
        for (int i = 0; i < text.length(); i++) {
            if (text.charAt(i) == '\n') sb.append('\n');
        }
        return sb.toString();
    }

    /**
     * 从 openIndex 处的 {@code '{'} 开始查找与之匹配的 {@code '}'}，
     * 跳过字符串与字符字面量。未闭合时返回 -1。
     */
    public static int findMatchingBrace(String text, int openIndex) {
        int depth = 0;
        for (int i = openIndex; i < text.length(); i++) {
            char c = text.charAt(i);
            if (c == '"' || c == '\'') {
                i = skipLiteral(text, i, c);
                continue;
            }
            if (c == '{') {
                depth++;
            } else if (c == '}') {
                depth--;
                if (depth == 0) return i;
            }
        }
        return -1;
    }

    private static int skipLiteral(String text, int start, char quote) {
        for (int i = start + 1; i < text.length(); i++) {
            char c = text.charAt(i);
            if (c == '\\') {
                i++;
            } else if (c == quote || c == '\n') {
                return i;
            }
        }
        return text.length();
    }

    /**
     * 切分参数列表：只跟踪尖括号深度。
     * 默认值中带逗号的括号表达式会被错误切开（已知限制）。
     */
    public static List<String> splitParameters(String params) {
        List<String> result = new ArrayList<String>();
        int angleDepth = 0;
        int start = 0;
        for (int i = 0; i < params.length(); i++) {
            char c = params.charAt(i);
            if (c == '<') angleDepth++;
            else if (c == '>') angleDepth--;
            else if (c == ',' && angleDepth == 0) {
                result.add(params.substring(start, i));
                start = i + 1;
            }
        }
        result.add(params.substring(start));
        return result;
    }

    /**
     * 切分模板实参 / 模板形参：跟踪尖括号与圆括号深度
     */
    public static List<String> splitTemplateArgs(String args) {
        List<String> result = new ArrayList<String>();
        StringBuilder current = new StringBuilder();
        int depth = 0;
        for (int i = 0; i < args.length(); i++) {
            char c = args.charAt(i);
            if (c == '<' || c == '(') {
                depth++;
            } else if (c == '>' || c == ')') {
                depth--;
            } else if (c == ',' && depth == 0) {
                result.add(current.toString());
                current.setLength(0);
                continue;
            }
            current.append(c);
        }
        if (current.length() > 0) {
            result.add(current.toString());
        }
        return result;
    }

    /**
     * 切分调用实参：跟踪 () [] {} 与尖括号深度，结果已去除首尾空白，空串被忽略
     */
    public static List<String> splitArguments(String args) {
        List<String> result = new ArrayList<String>();
        if (args == null || args.trim().isEmpty()) return result;
        StringBuilder current = new StringBuilder();
        int parenDepth = 0;
        int angleDepth = 0;
        for (int i = 0; i < args.length(); i++) {
            char c = args.charAt(i);
            if (c == '(' || c == '[' || c == '{') {
                parenDepth++;
            } else if (c == ')' || c == ']' || c == '}') {
                parenDepth--;
            } else if (c == '<') {
                angleDepth++;
            } else if (c == '>' && angleDepth > 0) {
                angleDepth--;
            }
            if (c == ',' && parenDepth == 0 && angleDepth == 0) {
                addTrimmed(result, current);
                current.setLength(0);
            } else {
                current.append(c);
            }
        }
        addTrimmed(result, current);
        return result;
    }

    private static void addTrimmed(List<String> out, CharSequence text) {
        String s = text.toString().trim();
        if (!s.isEmpty()) out.add(s);
    }

    /**
     * 从 openIndex 处的 {@code '('} 查找匹配的 {@code ')'}，未闭合返回 -1
     */
    public static int findMatchingParen(String text, int openIndex) {
        int depth = 0;
        for (int i = openIndex; i < text.length(); i++) {
            char c = text.charAt(i);
            if (c == '"' || c == '\'') {
                i = skipLiteral(text, i, c);
                continue;
            }
            if (c == '(') {
                depth++;
            } else if (c == ')') {
                depth--;
                if (depth == 0) return i;
            }
        }
        return -1;
    }

    /**
     * 用空格覆盖 [from, to) 区间，保留换行
     */
    public static void blank(StringBuilder text, int from, int to) {
        for (int i = from; i < to && i < text.length(); i++) {
            if (text.charAt(i) != '\n') {
                text.setCharAt(i, ' ');
            }
        }
    }

    /**
     * 用空格覆盖所有顶层花括号块（含花括号本身）
     */
    public static String blankBlocks(String text) {
        StringBuilder sb = new StringBuilder(text);
        int i = 0;
        while (i < sb.length()) {
            if (sb.charAt(i) == '{') {
                int close = findMatchingBrace(sb.toString(), i);
                int end = close < 0 ? sb.length() : close + 1;
                blank(sb, i, end);
                i = end;
            } else {
                i++;
            }
        }
        return sb.toString();
    }

    /**
     * index 处所在的行号（从 1 开始）
     */
    public static int lineOf(String text, int index) {
        int line = 1;
        for (int i = 0; i < index && i < text.length(); i++) {
            if (text.charAt(i) == '\n') line++;
        }
        return line;
    }

    /**
     * 去掉首尾空白并把内部连续空白压缩为一个空格
     */
    public static String normalizeSpace(String text) {
        return text.trim().replaceAll("\\s+", " ");
    }
}
