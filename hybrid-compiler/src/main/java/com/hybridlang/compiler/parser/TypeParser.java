package com.hybridlang.compiler.parser;

import com.hybridlang.compiler.ir.PointerOwnership;
import com.hybridlang.compiler.ir.Type;
import com.hybridlang.compiler.ir.TypeKind;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * 类型文本解析：把 {@code const std::vector<int>&} 这样的文本递归解析为 {@link Type} 树
 */
public final class TypeParser {

    private static final Map<String, TypeKind> BUILTINS = new HashMap<String, TypeKind>();
    private static final Map<String, TypeKind> STD_TYPES = new HashMap<String, TypeKind>();

    static {
        BUILTINS.put("void", TypeKind.VOID);
        BUILTINS.put("bool", TypeKind.BOOL);
        for (String s : new String[] {
                "char", "signed char", "unsigned char", "wchar_t", "char8_t", "char16_t", "char32_t",
                "short", "short int", "unsigned short", "int", "signed", "signed int",
                "unsigned", "unsigned int", "long", "long int", "unsigned long", "long long",
                "unsigned long long", "size_t", "std::size_t", "ptrdiff_t",
                "int8_t", "int16_t", "int32_t", "int64_t",
                "uint8_t", "uint16_t", "uint32_t", "uint64_t",
                "std::int32_t", "std::int64_t", "std::uint32_t", "std::uint64_t"}) {
            BUILTINS.put(s, TypeKind.INTEGER);
        }
        BUILTINS.put("float", TypeKind.FLOAT);
        BUILTINS.put("double", TypeKind.FLOAT);
        BUILTINS.put("long double", TypeKind.FLOAT);

        STD_TYPES.put("std::vector", TypeKind.STD_VECTOR);
        STD_TYPES.put("std::list", TypeKind.STD_LIST);
        STD_TYPES.put("std::deque", TypeKind.STD_DEQUE);
        STD_TYPES.put("std::map", TypeKind.STD_MAP);
        STD_TYPES.put("std::unordered_map", TypeKind.STD_UNORDERED_MAP);
        STD_TYPES.put("std::set", TypeKind.STD_SET);
        STD_TYPES.put("std::unordered_set", TypeKind.STD_UNORDERED_SET);
        STD_TYPES.put("std::string", TypeKind.STD_STRING);
        STD_TYPES.put("std::pair", TypeKind.STD_PAIR);
        STD_TYPES.put("std::optional", TypeKind.STD_OPTIONAL);
        STD_TYPES.put("std::thread", TypeKind.THREAD);
        STD_TYPES.put("std::jthread", TypeKind.THREAD);
        STD_TYPES.put("std::mutex", TypeKind.MUTEX);
        STD_TYPES.put("std::recursive_mutex", TypeKind.MUTEX);
        STD_TYPES.put("std::shared_mutex", TypeKind.MUTEX);
        STD_TYPES.put("std::timed_mutex", TypeKind.MUTEX);
        STD_TYPES.put("std::atomic", TypeKind.ATOMIC);
        STD_TYPES.put("std::condition_variable", TypeKind.CONDITION_VARIABLE);
        STD_TYPES.put("std::condition_variable_any", TypeKind.CONDITION_VARIABLE);
        STD_TYPES.put("std::lock_guard", TypeKind.LOCK_GUARD);
        STD_TYPES.put("std::unique_lock", TypeKind.LOCK_GUARD);
        STD_TYPES.put("std::shared_lock", TypeKind.LOCK_GUARD);
        STD_TYPES.put("std::scoped_lock", TypeKind.LOCK_GUARD);
        STD_TYPES.put("std::future", TypeKind.FUTURE);
        STD_TYPES.put("std::shared_future", TypeKind.FUTURE);
        STD_TYPES.put("std::promise", TypeKind.PROMISE);
        STD_TYPES.put("std::coroutine_handle", TypeKind.COROUTINE);
        STD_TYPES.put("Task", TypeKind.TASK);
        STD_TYPES.put("std::task", TypeKind.TASK);

        // using namespace std 之后的常见写法
        for (String name : new String[] {"vector", "list", "deque", "map", "unordered_map",
                "set", "unordered_set", "string", "pair", "optional"}) {
            STD_TYPES.put(name, STD_TYPES.get("std::" + name));
        }
    }

    /**
     * 解析类型文本。空文本得到 VOID。
     */
    public Type parse(String typeText) {
        String trimmed = CppText.normalizeSpace(typeText);
        if (trimmed.isEmpty()) {
            return new Type(TypeKind.VOID, "void");
        }

        boolean isConst = false;
        if (trimmed.startsWith("const ")) {
            isConst = true;
            trimmed = trimmed.substring(6).trim();
        }
        trimmed = stripQualifiers(trimmed);

        // 指针 / 引用：从末尾剥离
        if (trimmed.endsWith("*")) {
            String inner = trimmed.substring(0, trimmed.length() - 1).trim();
            Type ptr = Type.pointer(parse(inner), inner + "*", PointerOwnership.RAW);
            ptr.setConst(isConst);
            return ptr;
        }
        if (trimmed.endsWith("&")) {
            String inner = trimmed.substring(0, trimmed.length() - 1).trim();
            if (inner.endsWith("&")) {
                inner = inner.substring(0, inner.length() - 1).trim();  // 右值引用
            }
            Type ref = new Type(TypeKind.REFERENCE, inner + "&", parse(inner));
            ref.setConst(isConst);
            return ref;
        }

        // 智能指针
        if (trimmed.startsWith("std::unique_ptr<") || trimmed.startsWith("std::shared_ptr<")) {
            String inner = templateBody(trimmed);
            PointerOwnership ownership = trimmed.startsWith("std::unique_ptr<")
                    ? PointerOwnership.UNIQUE : PointerOwnership.SHARED;
            Type ptr = Type.pointer(parse(inner), trimmed, ownership);
            ptr.setConst(isConst);
            return ptr;
        }

        // 数组
        int bracket = trimmed.indexOf('[');
        if (bracket > 0 && trimmed.indexOf('<') < 0) {
            String base = trimmed.substring(0, bracket);
            Type array = new Type(TypeKind.ARRAY, trimmed, parse(base));
            array.setConst(isConst);
            return array;
        }

        TypeKind builtin = BUILTINS.get(trimmed);
        if (builtin != null) {
            Type type = new Type(builtin, trimmed);
            type.setConst(isConst);
            return type;
        }

        Type type = parseNamed(trimmed);
        type.setConst(isConst);
        return type;
    }

    private Type parseNamed(String text) {
        if (text.startsWith("struct ")) {
            return new Type(TypeKind.STRUCT, text.substring(7).trim());
        }
        if (text.startsWith("enum ")) {
            return new Type(TypeKind.ENUM, text.substring(5).trim());
        }

        int lt = text.indexOf('<');
        String baseName = lt >= 0 ? text.substring(0, lt).trim() : text;
        List<Type> args = Collections.emptyList();
        if (lt >= 0 && text.endsWith(">")) {
            args = new ArrayList<Type>();
            for (String arg : CppText.splitTemplateArgs(templateBody(text))) {
                if (!arg.trim().isEmpty()) {
                    args.add(parse(arg));
                }
            }
        }

        TypeKind kind = STD_TYPES.get(baseName);
        if (kind == null) {
            kind = TypeKind.CLASS;
        }
        Type element = args.size() == 1 ? args.get(0) : null;
        if (element != null) {
            // 单参数容器的元素同时作为 elementType
            return new Type(kind, text, element, args, PointerOwnership.RAW);
        }
        return new Type(kind, text, null, args, PointerOwnership.RAW);
    }

    private static String stripQualifiers(String text) {
        String result = text;
        boolean changed = true;
        while (changed) {
            changed = false;
            for (String q : new String[] {"volatile ", "mutable ", "typename ", "constexpr ", "inline "}) {
                if (result.startsWith(q)) {
                    result = result.substring(q.length()).trim();
                    changed = true;
                }
            }
        }
        if (result.endsWith(" const")) {
            result = result.substring(0, result.length() - 6).trim();
        }
        return result;
    }

    private static String templateBody(String text) {
        int start = text.indexOf('<') + 1;
        int end = text.lastIndexOf('>');
        return end > start ? text.substring(start, end) : "";
    }
}
