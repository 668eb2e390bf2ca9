package com.hybridlang.backend.codegen.go;

import com.hybridlang.backend.codegen.GenerationContext;
import com.hybridlang.compiler.ir.ClassDecl;
import com.hybridlang.compiler.ir.Function;
import com.hybridlang.compiler.ir.TemplateParameter;
import com.hybridlang.compiler.ir.Type;
import com.hybridlang.compiler.ir.TypeKind;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * C++ 类型到 Go 类型的映射
 */
final class GoTypeMapper {

    private static final Map<String, String> INTEGERS = new HashMap<String, String>();

    static {
        INTEGERS.put("char", "byte");
        INTEGERS.put("signed char", "int8");
        INTEGERS.put("unsigned char", "uint8");
        INTEGERS.put("char8_t", "uint8");
        INTEGERS.put("wchar_t", "rune");
        INTEGERS.put("char16_t", "uint16");
        INTEGERS.put("char32_t", "rune");
        INTEGERS.put("short", "int16");
        INTEGERS.put("short int", "int16");
        INTEGERS.put("unsigned short", "uint16");
        INTEGERS.put("int", "int");
        INTEGERS.put("signed", "int");
        INTEGERS.put("signed int", "int");
        INTEGERS.put("unsigned", "uint");
        INTEGERS.put("unsigned int", "uint");
        INTEGERS.put("long", "int64");
        INTEGERS.put("long int", "int64");
        INTEGERS.put("unsigned long", "uint64");
        INTEGERS.put("long long", "int64");
        INTEGERS.put("unsigned long long", "uint64");
        INTEGERS.put("size_t", "uint");
        INTEGERS.put("std::size_t", "uint");
        INTEGERS.put("ptrdiff_t", "int");
        INTEGERS.put("int8_t", "int8");
        INTEGERS.put("int16_t", "int16");
        INTEGERS.put("int32_t", "int32");
        INTEGERS.put("int64_t", "int64");
        INTEGERS.put("uint8_t", "uint8");
        INTEGERS.put("uint16_t", "uint16");
        INTEGERS.put("uint32_t", "uint32");
        INTEGERS.put("uint64_t", "uint64");
        INTEGERS.put("std::int32_t", "int32");
        INTEGERS.put("std::int64_t", "int64");
        INTEGERS.put("std::uint32_t", "uint32");
        INTEGERS.put("std::uint64_t", "uint64");
    }

    private final GenerationContext ctx;

    GoTypeMapper(GenerationContext ctx) {
        this.ctx = ctx;
    }

    String map(Type type) {
        if (type == null) return "struct{}";
        switch (type.getKind()) {
            case VOID:
                return "struct{}";
            case BOOL:
                return "bool";
            case INTEGER:
                return integer(type.getName());
            case FLOAT:
                return "float".equals(type.getName()) ? "float32" : "float64";
            case POINTER:
            case STD_OPTIONAL:
                return pointer(type.getKind() == TypeKind.POINTER ? type.getElementType() : element(type));
            case REFERENCE:
                return reference(type);
            case ARRAY:
                return array(type);
            case STRUCT:
            case CLASS:
            case ENUM:
                return named(type);
            case FUNCTION:
                return "func()";
            case TEMPLATE_PARAM:
                return isMethodTypeParam(type) ? "any" : type.getBaseName();
            case STD_VECTOR:
                if (isThreadVector(type)) {
                    ctx.addImport("sync");
                    return "sync.WaitGroup";
                }
                return "[]" + map(element(type));
            case STD_LIST:
            case STD_DEQUE:
                return "[]" + map(element(type));
            case STD_MAP:
            case STD_UNORDERED_MAP:
                return "map[" + map(type.getTemplateArg(0)) + "]" + map(type.getTemplateArg(1));
            case STD_SET:
            case STD_UNORDERED_SET:
                return "map[" + map(element(type)) + "]struct{}";
            case STD_STRING:
                return "string";
            case STD_PAIR:
                return "struct{ First " + map(type.getTemplateArg(0)) + "; Second " + map(type.getTemplateArg(1)) + " }";
            case THREAD:
                return "chan struct{}";
            case MUTEX:
                ctx.addImport("sync");
                return type.getBaseName().contains("shared") ? "sync.RWMutex" : "sync.Mutex";
            case ATOMIC:
                return atomic(type.getTemplateArg(0));
            case CONDITION_VARIABLE:
                ctx.addImport("sync");
                return "*sync.Cond";
            case LOCK_GUARD:
                return "func()";
            case FUTURE:
            case PROMISE:
                return "chan " + map(element(type));
            case COROUTINE:
                return "<-chan struct{}";
            case TASK:
            default:
                return "struct{}";
        }
    }

    /**
     * 原子类型（Go 1.19 的 atomic.Int32 等），其余值类型退化为带锁的包装
     */
    String atomic(Type valueType) {
        String inner = map(valueType);
        String atomic = atomicName(valueType, inner);
        if (atomic == null) {
            ctx.addImport("sync");
            return "struct{ sync.Mutex; v " + inner + " }";
        }
        ctx.addImport("sync/atomic");
        return atomic;
    }

    boolean isNativeAtomic(Type valueType) {
        return atomicName(valueType, map(valueType)) != null;
    }

    /** C++ 的 int / unsigned 是 32 位，不跟随 Go 平台相关的 int 宽度 */
    private static String atomicName(Type valueType, String inner) {
        if (valueType != null && valueType.getKind() == TypeKind.INTEGER) {
            String name = valueType.getName().trim();
            if ("int".equals(name) || "signed".equals(name) || "signed int".equals(name)) return "atomic.Int32";
            if ("unsigned".equals(name) || "unsigned int".equals(name)) return "atomic.Uint32";
        }
        if ("bool".equals(inner)) return "atomic.Bool";
        if ("int32".equals(inner)) return "atomic.Int32";
        if ("int".equals(inner) || "int64".equals(inner)) return "atomic.Int64";
        if ("uint32".equals(inner)) return "atomic.Uint32";
        if ("uint".equals(inner) || "uint64".equals(inner)) return "atomic.Uint64";
        return null;
    }

    /**
     * Go 的零值表达式
     */
    String zeroValue(Type type) {
        if (type == null) return "struct{}{}";
        switch (type.getKind()) {
            case BOOL:
                return "false";
            case INTEGER:
            case FLOAT:
                return "0";
            case STD_STRING:
                return "\"\"";
            case POINTER:
            case STD_OPTIONAL:
            case STD_VECTOR:
            case STD_LIST:
            case STD_DEQUE:
            case STD_MAP:
            case STD_UNORDERED_MAP:
            case STD_SET:
            case STD_UNORDERED_SET:
            case FUTURE:
            case PROMISE:
            case THREAD:
            case FUNCTION:
            case CONDITION_VARIABLE:
            case COROUTINE:
            case LOCK_GUARD:
                return isThreadVector(type) ? map(type) + "{}" : "nil";
            case REFERENCE:
                return type.isConst() ? zeroValue(type.getElementType()) : "nil";
            case TEMPLATE_PARAM:
                return isMethodTypeParam(type) ? "nil" : "*new(" + type.getBaseName() + ")";
            case ENUM:
                return "0";
            case CLASS:
            case STRUCT:
                return isInterfaceClass(type.getBaseName()) ? "nil" : map(type) + "{}";
            default:
                return map(type) + "{}";
        }
    }

    /** 构造函数里需要 make 的类型 */
    String constructorValue(Type type) {
        switch (type.getKind()) {
            case STD_MAP:
            case STD_UNORDERED_MAP:
            case STD_SET:
            case STD_UNORDERED_SET:
                return "make(" + map(type) + ")";
            default:
                return null;
        }
    }

    boolean isInterfaceClass(String name) {
        ClassDecl cls = ctx.getModule().findClass(name);
        return cls != null && cls.isInterfaceLike();
    }

    private static boolean isThreadVector(Type type) {
        return type.getKind() == TypeKind.STD_VECTOR && type.getElementType() != null
                && type.getElementType().getKind() == TypeKind.THREAD;
    }

    private String integer(String name) {
        String mapped = INTEGERS.get(name);
        return mapped != null ? mapped : "int";
    }

    private static Type element(Type type) {
        Type arg = type.getTemplateArg(0);
        return arg != null ? arg : type.getElementType();
    }

    /** 指向接口的指针就是接口值本身 */
    private String pointer(Type pointee) {
        if (pointee == null) return "*struct{}";
        if ((pointee.getKind() == TypeKind.CLASS || pointee.getKind() == TypeKind.STRUCT)
                && isInterfaceClass(pointee.getBaseName())) {
            return named(pointee);
        }
        return "*" + map(pointee);
    }

    /** const 引用按值传递，非 const 引用取指针（map 本身即引用语义） */
    private String reference(Type type) {
        Type target = type.getElementType();
        boolean mutable = !type.isConst() && (target == null || !target.isConst());
        if (target == null) return "*struct{}";
        if (!mutable || isInterfaceClass(target.getBaseName())) {
            return map(target);
        }
        switch (target.getKind()) {
            case STD_MAP:
            case STD_UNORDERED_MAP:
            case STD_SET:
            case STD_UNORDERED_SET:
            case CONDITION_VARIABLE:
                return map(target);
            default:
                return "*" + map(target);
        }
    }

    /** 长度为字面量时为定长数组，否则为切片 */
    private String array(Type type) {
        String name = type.getName();
        List<String> dims = new ArrayList<String>();
        int i = name.indexOf('[');
        while (i >= 0) {
            int close = name.indexOf(']', i);
            if (close < 0) break;
            dims.add(name.substring(i + 1, close).trim());
            i = name.indexOf('[', close);
        }
        StringBuilder sb = new StringBuilder();
        for (String dim : dims) {
            sb.append(dim.matches("\\d+") ? "[" + dim + "]" : "[]");
        }
        return sb.append(type.getElementType() == null ? "struct{}" : map(type.getElementType())).toString();
    }

    private String named(Type type) {
        String base = type.getBaseName();
        int colon = base.lastIndexOf("::");
        if (colon >= 0) base = base.substring(colon + 2);
        if (type.getTemplateArgs().isEmpty()) return base;
        StringBuilder sb = new StringBuilder(base).append('[');
        for (int i = 0; i < type.getTemplateArgs().size(); i++) {
            if (i > 0) sb.append(", ");
            sb.append(map(type.getTemplateArgs().get(i)));
        }
        return sb.append(']').toString();
    }

    /** Go 方法不能声明自己的类型形参，方法模板的形参退化为 any */
    private boolean isMethodTypeParam(Type type) {
        Function fn = ctx.getCurrentFunction();
        if (fn == null || fn.isStatic() || ctx.getCurrentClass() == null) return false;
        for (TemplateParameter p : fn.getTemplateParameters()) {
            if (p.getName().equals(type.getBaseName())) return true;
        }
        return false;
    }
}
