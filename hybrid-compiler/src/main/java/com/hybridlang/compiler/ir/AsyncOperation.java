package com.hybridlang.compiler.ir;

/**
 * 协程挂起点：co_await / co_return / co_yield
 */
public final class AsyncOperation {

    public enum Kind {
        SUSPEND("co_await"),
        RETURN("co_return"),
        YIELD("co_yield");

        private final String keyword;

        Kind(String keyword) {
            this.keyword = keyword;
        }

        public String getKeyword() {
            return keyword;
        }
    }

    private final Kind kind;
    private final String expression;
    private final int line;
    private final String binding;  // auto r = co_await f(); 中的 r，没有则为空串

    public AsyncOperation(Kind kind, String expression, int line, String binding) {
        this.kind = kind;
        this.expression = expression != null ? expression : "";
        this.line = line;
        this.binding = binding != null ? binding : "";
    }

    public AsyncOperation(Kind kind, String expression, int line) {
        this(kind, expression, line, null);
    }

    public Kind getKind() {
        return kind;
    }

    public String getExpression() {
        return expression;
    }

    /** 函数体内的行号，从 1 开始 */
    public int getLine() {
        return line;
    }

    public String getBinding() {
        return binding;
    }

    public boolean hasBinding() {
        return !binding.isEmpty();
    }

    @Override
    public String toString() {
        return kind.getKeyword() + " " + expression + " @" + line;
    }
}
