package com.hybridlang.backend.codegen;

import com.hybridlang.backend.TargetProfile;

import java.util.Arrays;
import java.util.Collections;
import java.util.HashSet;
import java.util.Set;

/**
 * 标识符清洗：避开目标语言保留字，并做命名风格转换
 */
public final class NameSanitizer {

    private static final Set<String> RUST_KEYWORDS = Collections.unmodifiableSet(new HashSet<String>(Arrays.asList(
            "as", "async", "await", "break", "const", "continue", "crate", "dyn", "else", "enum",
            "extern", "false", "fn", "for", "if", "impl", "in", "let", "loop", "match", "mod",
            "move", "mut", "pub", "ref", "return", "self", "Self", "static", "struct", "super",
            "trait", "true", "type", "unsafe", "use", "where", "while", "abstract", "become",
            "box", "do", "final", "macro", "override", "priv", "try", "typeof", "unsized",
            "virtual", "yield")));

    private static final Set<String> GO_KEYWORDS = Collections.unmodifiableSet(new HashSet<String>(Arrays.asList(
            "break", "case", "chan", "const", "continue", "default", "defer", "else",
            "fallthrough", "for", "func", "go", "goto", "if", "import", "interface", "map",
            "package", "range", "return", "select", "struct", "switch", "type", "var",
            // 预声明标识符，遮蔽后生成代码会难以阅读
            "any", "append", "bool", "byte", "cap", "close", "complex", "copy", "delete",
            "error", "false", "float32", "float64", "int", "int8", "int16", "int32", "int64",
            "iota", "len", "make", "new", "nil", "panic", "print", "println", "real",
            "recover", "rune", "string", "true", "uint", "uint8", "uint16", "uint32",
            "uint64", "uintptr")));

    private NameSanitizer() {
    }

    public static boolean isReserved(String name, TargetProfile profile) {
        return keywords(profile).contains(name);
    }

    /**
     * 与保留字冲突时追加下划线；非法字符替换为下划线
     */
    public static String sanitize(String name, TargetProfile profile) {
        if (name == null || name.isEmpty()) {
            return "_";
        }
        StringBuilder sb = new StringBuilder(name.length());
        for (int i = 0; i < name.length(); i++) {
            char c = name.charAt(i);
            sb.append(Character.isLetterOrDigit(c) || c == '_' ? c : '_');
        }
        if (Character.isDigit(sb.charAt(0))) {
            sb.insert(0, '_');
        }
        String result = sb.toString();
        return keywords(profile).contains(result) ? result + "_" : result;
    }

    /**
     * camelCase / PascalCase 转 snake_case，例如 {@code getArea} 得到 {@code get_area}
     */
    public static String toSnakeCase(String name) {
        StringBuilder sb = new StringBuilder(name.length() + 4);
        for (int i = 0; i < name.length(); i++) {
            char c = name.charAt(i);
            if (Character.isUpperCase(c)) {
                boolean prevLower = i > 0 && (Character.isLowerCase(name.charAt(i - 1))
                        || Character.isDigit(name.charAt(i - 1)));
                boolean nextLower = i > 0 && i + 1 < name.length() && Character.isLowerCase(name.charAt(i + 1))
                        && Character.isUpperCase(name.charAt(i - 1));
                if ((prevLower || nextLower) && sb.length() > 0 && sb.charAt(sb.length() - 1) != '_') {
                    sb.append('_');
                }
                sb.append(Character.toLowerCase(c));
            } else {
                sb.append(c);
            }
        }
        return sb.toString();
    }

    /**
     * 首字母大写（Go 导出）
     */
    public static String capitalize(String name) {
        if (name == null || name.isEmpty()) return name;
        return Character.toUpperCase(name.charAt(0)) + name.substring(1);
    }

    /**
     * 首字母小写（Go 包内可见）
     */
    public static String decapitalize(String name) {
        if (name == null || name.isEmpty()) return name;
        return Character.toLowerCase(name.charAt(0)) + name.substring(1);
    }

    private static Set<String> keywords(TargetProfile profile) {
        return profile == TargetProfile.GO ? GO_KEYWORDS : RUST_KEYWORDS;
    }
}
