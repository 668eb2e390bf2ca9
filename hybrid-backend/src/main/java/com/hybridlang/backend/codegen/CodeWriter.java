package com.hybridlang.backend.codegen;

/**
 * 生成代码的输出缓冲区，跟踪缩进层级。每次 generate 调用新建一个实例。
 */
public class CodeWriter {
    private final StringBuilder output = new StringBuilder();
    private final String indentUnit;
    private int indentLevel = 0;
    private boolean atLineStart = true;

    public CodeWriter(String indentUnit) {
        this.indentUnit = indentUnit;
    }

    public void indent() {
        indentLevel++;
    }

    public void dedent() {
        if (indentLevel > 0) {
            indentLevel--;
        }
    }

    /**
     * 追加文本（行首自动缩进）
     */
    public CodeWriter append(String text) {
        if (text == null || text.isEmpty()) return this;
        if (atLineStart) {
            output.append(indentString());
            atLineStart = false;
        }
        output.append(text);
        return this;
    }

    /**
     * 追加一整行
     */
    public CodeWriter line(String text) {
        append(text);
        newLine();
        return this;
    }

    public CodeWriter newLine() {
        output.append("\n");
        atLineStart = true;
        return this;
    }

    /**
     * 打开一个块：写出头部并增加缩进
     */
    public CodeWriter open(String header) {
        line(header);
        indent();
        return this;
    }

    /**
     * 关闭当前块
     */
    public CodeWriter close(String footer) {
        dedent();
        line(footer);
        return this;
    }

    public void blankLine() {
        // 避免连续多个空行，也不在文件开头留空行
        if (output.length() == 0 || endsWith("\n\n")) {
            return;
        }
        if (!endsWith("\n")) {
            output.append("\n");
        }
        output.append("\n");
        atLineStart = true;
    }

    public String getOutput() {
        return output.toString();
    }

    private boolean endsWith(String suffix) {
        int len = output.length();
        return len >= suffix.length() && output.substring(len - suffix.length()).equals(suffix);
    }

    private String indentString() {
        StringBuilder sb = new StringBuilder();
        for (int i = 0; i < indentLevel; i++) {
            sb.append(indentUnit);
        }
        return sb.toString();
    }
}
