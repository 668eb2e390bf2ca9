package com.hybridlang.backend.codegen;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * 可以直接转换的函数体：若干成员赋值语句，加上可选的最后一条 return。
 *
 * <p>表达式只允许标识符、{@code this->成员}、数字、true/false、算术 / 比较 / 逻辑运算符、
 * 括号和以标识符开头的调用。其余写法（局部变量声明、字符串、成员访问、控制流等）
 * 一律视为不可转换，由生成器输出注释和占位实现。</p>
 */
public final class SimpleBody {

    private static final Pattern TOKEN = Pattern.compile(
            "\\s*(?:(this\\s*->\\s*[A-Za-z_]\\w*)"
                    + "|([A-Za-z_]\\w*)"
                    + "|(\\d+\\.\\d*(?:[eE][-+]?\\d+)?[fFlL]?|\\.\\d+(?:[eE][-+]?\\d+)?[fFlL]?|\\d+[eE][-+]?\\d+[fFlL]?|\\d+[uUlL]*)"
                    + "|(==|!=|<=|>=|&&|\\|\\||\\+\\+|--|[-+*/%]=|[-+*/%<>!=;(),]))");

    private static final List<String> ASSIGNMENTS = Arrays.asList("=", "+=", "-=", "*=", "/=", "%=");

    /**
     * 成员赋值：{@code target op value}
     */
    public static final class Assignment {
        private final String target;
        private final String operator;
        private final List<ExprToken> value;

        Assignment(String target, String operator, List<ExprToken> value) {
            this.target = target;
            this.operator = operator;
            this.value = value;
        }

        public String getTarget() {
            return target;
        }

        public String getOperator() {
            return operator;
        }

        public List<ExprToken> getValue() {
            return value;
        }
    }

    /**
     * 标识符解析回调：返回目标语言中的写法，无法解析时返回 null
     */
    public interface NameResolver {
        String resolve(String name, boolean viaThis, boolean isCall);
    }

    private final List<Assignment> assignments;
    private final List<ExprToken> returnValue;

    private SimpleBody(List<Assignment> assignments, List<ExprToken> returnValue) {
        this.assignments = assignments;
        this.returnValue = returnValue;
    }

    public List<Assignment> getAssignments() {
        return Collections.unmodifiableList(assignments);
    }

    /**
     * return 语句的表达式；没有 return 时为 null，{@code return;} 为空列表
     */
    public List<ExprToken> getReturnValue() {
        return returnValue;
    }

    public boolean hasReturn() {
        return returnValue != null;
    }

    /**
     * 识别函数体，不可转换时返回 null
     */
    public static SimpleBody parse(String body) {
        if (body == null) return null;
        List<ExprToken> tokens = tokenize(body);
        if (tokens == null) return null;

        List<Assignment> assignments = new ArrayList<Assignment>();
        List<ExprToken> returnValue = null;
        List<ExprToken> statement = new ArrayList<ExprToken>();
        for (ExprToken token : tokens) {
            if (!token.is(ExprToken.Kind.OPERATOR, ";")) {
                statement.add(token);
                continue;
            }
            if (statement.isEmpty()) continue;
            if (returnValue != null) return null;  // return 之后还有语句

            if (statement.get(0).is(ExprToken.Kind.IDENTIFIER, "return")) {
                returnValue = new ArrayList<ExprToken>(statement.subList(1, statement.size()));
                if (!isExpression(returnValue, true)) return null;
            } else {
                Assignment assignment = toAssignment(statement);
                if (assignment == null) return null;
                assignments.add(assignment);
            }
            statement = new ArrayList<ExprToken>();
        }
        if (!statement.isEmpty()) return null;
        return new SimpleBody(assignments, returnValue);
    }

    /**
     * 识别单个表达式（描述符里的实参、条件等），不可转换时返回 null
     */
    public static List<ExprToken> parseExpression(String text) {
        if (text == null) return null;
        List<ExprToken> tokens = tokenize(text);
        if (tokens == null || !isExpression(tokens, false)) return null;
        return tokens;
    }

    private static List<ExprToken> tokenize(String body) {
        List<ExprToken> tokens = new ArrayList<ExprToken>();
        Matcher m = TOKEN.matcher(body);
        int pos = 0;
        while (pos < body.length()) {
            if (body.substring(pos).trim().isEmpty()) break;
            if (!m.find(pos) || m.start() != pos) return null;
            if (m.group(1) != null) {
                String member = m.group(1);
                tokens.add(new ExprToken(ExprToken.Kind.MEMBER,
                        member.substring(member.indexOf('>') + 1).trim()));
            } else if (m.group(2) != null) {
                String word = m.group(2);
                if ("true".equals(word) || "false".equals(word)) {
                    tokens.add(new ExprToken(ExprToken.Kind.BOOLEAN, word));
                } else {
                    tokens.add(new ExprToken(ExprToken.Kind.IDENTIFIER, word));
                }
            } else if (m.group(3) != null) {
                tokens.add(new ExprToken(ExprToken.Kind.NUMBER, m.group(3)));
            } else {
                String op = m.group(4);
                if ("-".equals(op) && m.end() < body.length() && body.charAt(m.end()) == '>') {
                    return null;  // p->x 只允许 this
                }
                if ("(".equals(op)) {
                    tokens.add(new ExprToken(ExprToken.Kind.OPEN, op));
                } else if (")".equals(op)) {
                    tokens.add(new ExprToken(ExprToken.Kind.CLOSE, op));
                } else if (",".equals(op)) {
                    tokens.add(new ExprToken(ExprToken.Kind.COMMA, op));
                } else {
                    tokens.add(new ExprToken(ExprToken.Kind.OPERATOR, op));
                }
            }
            pos = m.end();
        }
        return tokens;
    }

    private static Assignment toAssignment(List<ExprToken> statement) {
        ExprToken first = statement.get(0);
        ExprToken.Kind kind = first.getKind();
        // x++ / ++x / x-- / --x
        if (statement.size() == 2) {
            ExprToken a = statement.get(0);
            ExprToken b = statement.get(1);
            ExprToken target = isTarget(a) ? a : isTarget(b) ? b : null;
            ExprToken op = target == a ? b : a;
            if (target != null && op.getKind() == ExprToken.Kind.OPERATOR
                    && ("++".equals(op.getText()) || "--".equals(op.getText()))) {
                List<ExprToken> one = Collections.singletonList(new ExprToken(ExprToken.Kind.NUMBER, "1"));
                return new Assignment(target.getText(), "++".equals(op.getText()) ? "+=" : "-=", one);
            }
            return null;
        }
        if (statement.size() < 3 || (kind != ExprToken.Kind.IDENTIFIER && kind != ExprToken.Kind.MEMBER)) {
            return null;
        }
        ExprToken op = statement.get(1);
        if (op.getKind() != ExprToken.Kind.OPERATOR || !ASSIGNMENTS.contains(op.getText())) return null;
        List<ExprToken> value = new ArrayList<ExprToken>(statement.subList(2, statement.size()));
        if (!isExpression(value, false)) return null;
        return new Assignment(first.getText(), op.getText(), value);
    }

    private static boolean isTarget(ExprToken token) {
        return token.getKind() == ExprToken.Kind.MEMBER
                || (token.getKind() == ExprToken.Kind.IDENTIFIER && !"return".equals(token.getText()));
    }

    private static boolean isExpression(List<ExprToken> tokens, boolean allowEmpty) {
        if (tokens.isEmpty()) return allowEmpty;
        int depth = 0;
        for (int i = 0; i < tokens.size(); i++) {
            ExprToken t = tokens.get(i);
            switch (t.getKind()) {
                case OPEN:
                    depth++;
                    break;
                case CLOSE:
                    if (--depth < 0) return false;
                    break;
                case COMMA:
                    if (depth == 0) return false;
                    break;
                case OPERATOR:
                    if (ASSIGNMENTS.contains(t.getText()) || "++".equals(t.getText())
                            || "--".equals(t.getText()) || ";".equals(t.getText())) {
                        return false;
                    }
                    break;
                case IDENTIFIER:
                    if ("return".equals(t.getText())) return false;
                    // 两个标识符相邻说明是声明或强制转换
                    if (i + 1 < tokens.size() && tokens.get(i + 1).getKind() == ExprToken.Kind.IDENTIFIER) {
                        return false;
                    }
                    break;
                default:
                    break;
            }
        }
        return depth == 0;
    }

    /**
     * 按目标语言输出表达式；任何标识符无法解析时返回 null。
     *
     * @param floatContext 整数字面量是否需要写成浮点形式
     */
    public static String render(List<ExprToken> tokens, NameResolver resolver, boolean floatContext) {
        StringBuilder sb = new StringBuilder();
        ExprToken prev = null;
        for (int i = 0; i < tokens.size(); i++) {
            ExprToken t = tokens.get(i);
            boolean isCall = i + 1 < tokens.size() && tokens.get(i + 1).getKind() == ExprToken.Kind.OPEN;
            switch (t.getKind()) {
                case IDENTIFIER:
                case MEMBER: {
                    String resolved = resolver.resolve(t.getText(), t.getKind() == ExprToken.Kind.MEMBER, isCall);
                    if (resolved == null) return null;
                    sb.append(resolved);
                    break;
                }
                case NUMBER:
                    sb.append(number(t.getText(), floatContext));
                    break;
                case BOOLEAN:
                    sb.append(t.getText());
                    break;
                case OPEN:
                case CLOSE:
                    sb.append(t.getText());
                    break;
                case COMMA:
                    sb.append(", ");
                    break;
                case OPERATOR:
                    if (isUnary(prev)) {
                        sb.append(t.getText());
                    } else {
                        sb.append(' ').append(t.getText()).append(' ');
                    }
                    break;
                default:
                    return null;
            }
            prev = t;
        }
        return sb.toString();
    }

    private static boolean isUnary(ExprToken prev) {
        return prev == null || prev.getKind() == ExprToken.Kind.OPERATOR
                || prev.getKind() == ExprToken.Kind.OPEN || prev.getKind() == ExprToken.Kind.COMMA;
    }

    private static String number(String literal, boolean floatContext) {
        String digits = literal;
        while (!digits.isEmpty() && "fFuUlL".indexOf(digits.charAt(digits.length() - 1)) >= 0) {
            digits = digits.substring(0, digits.length() - 1);
        }
        if (digits.endsWith(".")) {
            digits = digits + "0";
        }
        if (digits.startsWith(".")) {
            digits = "0" + digits;
        }
        boolean isFloat = digits.indexOf('.') >= 0 || digits.indexOf('e') >= 0 || digits.indexOf('E') >= 0;
        if (floatContext && !isFloat) {
            digits = digits + ".0";
        }
        return digits;
    }
}
