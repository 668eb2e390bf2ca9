package com.hybridlang.backend.codegen.rust;

import com.hybridlang.backend.codegen.GenerationContext;
import com.hybridlang.compiler.ir.ClassDecl;
import com.hybridlang.compiler.ir.PointerOwnership;
import com.hybridlang.compiler.ir.Type;
import com.hybridlang.compiler.ir.TypeKind;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * C++ 类型到 Rust 类型的映射，用到的标准库路径登记到上下文的导入集合
 */
final class RustTypeMapper {

    private static final Map<String, String> INTEGERS = new HashMap<String, String>();
    private static final Map<String, String> ATOMICS = new HashMap<String, String>();

    static {
        INTEGERS.put("char", "char");
        INTEGERS.put("signed char", "i8");
        INTEGERS.put("unsigned char", "u8");
        INTEGERS.put("char8_t", "u8");
        INTEGERS.put("wchar_t", "char");
        INTEGERS.put("char16_t", "u16");
        INTEGERS.put("char32_t", "char");
        INTEGERS.put("short", "i16");
        INTEGERS.put("short int", "i16");
        INTEGERS.put("unsigned short", "u16");
        INTEGERS.put("int", "i32");
        INTEGERS.put("signed", "i32");
        INTEGERS.put("signed int", "i32");
        INTEGERS.put("unsigned", "u32");
        INTEGERS.put("unsigned int", "u32");
        INTEGERS.put("long", "i64");
        INTEGERS.put("long int", "i64");
        INTEGERS.put("unsigned long", "u64");
        INTEGERS.put("long long", "i64");
        INTEGERS.put("unsigned long long", "u64");
        INTEGERS.put("size_t", "usize");
        INTEGERS.put("std::size_t", "usize");
        INTEGERS.put("ptrdiff_t", "isize");
        INTEGERS.put("int8_t", "i8");
        INTEGERS.put("int16_t", "i16");
        INTEGERS.put("int32_t", "i32");
        INTEGERS.put("int64_t", "i64");
        INTEGERS.put("uint8_t", "u8");
        INTEGERS.put("uint16_t", "u16");
        INTEGERS.put("uint32_t", "u32");
        INTEGERS.put("uint64_t", "u64");
        INTEGERS.put("std::int32_t", "i32");
        INTEGERS.put("std::int64_t", "i64");
        INTEGERS.put("std::uint32_t", "u32");
        INTEGERS.put("std::uint64_t", "u64");

        ATOMICS.put("bool", "AtomicBool");
        ATOMICS.put("i8", "AtomicI8");
        ATOMICS.put("i16", "AtomicI16");
        ATOMICS.put("i32", "AtomicI32");
        ATOMICS.put("i64", "AtomicI64");
        ATOMICS.put("isize", "AtomicIsize");
        ATOMICS.put("u8", "AtomicU8");
        ATOMICS.put("u16", "AtomicU16");
        ATOMICS.put("u32", "AtomicU32");
        ATOMICS.put("u64", "AtomicU64");
        ATOMICS.put("usize", "AtomicUsize");
    }

    private final GenerationContext ctx;

    RustTypeMapper(GenerationContext ctx) {
        this.ctx = ctx;
    }

    /**
     * 值位置（字段、返回值、按值形参）的类型
     */
    String map(Type type) {
        if (type == null) return "()";
        switch (type.getKind()) {
            case VOID:
                return "()";
            case BOOL:
                return "bool";
            case INTEGER:
                return integer(type.getName());
            case FLOAT:
                return "float".equals(type.getName()) ? "f32" : "f64";
            case POINTER:
                return pointer(type);
            case REFERENCE:
                return reference(type, false);
            case ARRAY:
                return array(type);
            case STRUCT:
            case CLASS:
            case ENUM:
                return named(type);
            case FUNCTION:
                return "Box<dyn Fn()>";
            case TEMPLATE_PARAM:
                return type.getBaseName();
            case STD_VECTOR:
                if (type.getElementType() != null && type.getElementType().getKind() == TypeKind.THREAD) {
                    ctx.addImport("std::thread::JoinHandle");
                    return "Vec<JoinHandle<()>>";
                }
                return "Vec<" + element(type, 0) + ">";
            case STD_LIST:
            case STD_DEQUE:
                ctx.addImport("std::collections::VecDeque");
                return "VecDeque<" + element(type, 0) + ">";
            case STD_MAP:
                ctx.addImport("std::collections::BTreeMap");
                return "BTreeMap<" + element(type, 0) + ", " + element(type, 1) + ">";
            case STD_UNORDERED_MAP:
                ctx.addImport("std::collections::HashMap");
                return "HashMap<" + element(type, 0) + ", " + element(type, 1) + ">";
            case STD_SET:
                ctx.addImport("std::collections::BTreeSet");
                return "BTreeSet<" + element(type, 0) + ">";
            case STD_UNORDERED_SET:
                ctx.addImport("std::collections::HashSet");
                return "HashSet<" + element(type, 0) + ">";
            case STD_STRING:
                return "String";
            case STD_PAIR:
                return "(" + element(type, 0) + ", " + element(type, 1) + ")";
            case STD_OPTIONAL:
                return "Option<" + element(type, 0) + ">";
            case THREAD:
                ctx.addImport("std::thread::JoinHandle");
                return "Option<JoinHandle<()>>";
            case MUTEX:
                if (type.getBaseName().contains("shared")) {
                    ctx.addImport("std::sync::RwLock");
                    return "RwLock<()>";
                }
                ctx.addImport("std::sync::Mutex");
                return "Mutex<()>";
            case ATOMIC:
                return atomic(type.getTemplateArg(0));
            case CONDITION_VARIABLE:
                ctx.addImport("std::sync::Condvar");
                return "Condvar";
            case LOCK_GUARD:
                ctx.addImport("std::sync::MutexGuard");
                return "MutexGuard<'_, ()>";
            case FUTURE:
                ctx.addImport("std::sync::mpsc::Receiver");
                return "Receiver<" + element(type, 0) + ">";
            case PROMISE:
                ctx.addImport("std::sync::mpsc::Sender");
                return "Sender<" + element(type, 0) + ">";
            case COROUTINE:
                ctx.addImport("std::future::Future");
                ctx.addImport("std::pin::Pin");
                return "Pin<Box<dyn Future<Output = ()>>>";
            case TASK:
                return "()";
            default:
                return "()";
        }
    }

    /**
     * 形参类型。按值传入但未被移动的聚合类型改为借用。
     */
    String mapParameter(Type type, boolean borrowed) {
        if (type.getKind() == TypeKind.REFERENCE) {
            return reference(type, true);
        }
        if (borrowed && isBorrowableAggregate(type)) {
            return borrowedView(type, false);
        }
        return map(type);
    }

    /** 返回值位置：引用返回借用 self 的数据 */
    String mapReturn(Type type) {
        if (type != null && type.getKind() == TypeKind.REFERENCE) {
            return reference(type, false);
        }
        return map(type);
    }

    /**
     * 带标准库路径的原子类型名（{@code AtomicI32} 等），非整数值类型退化为 {@code Mutex<T>}
     */
    String atomic(Type valueType) {
        String inner = map(valueType);
        String atomic = ATOMICS.get(inner);
        if (atomic == null) {
            ctx.addImport("std::sync::Mutex");
            return "Mutex<" + inner + ">";
        }
        ctx.addImport("std::sync::atomic::" + atomic);
        ctx.addImport("std::sync::atomic::Ordering");
        return atomic;
    }

    /** 复制语义的类型，返回字段时不需要 clone */
    static boolean isCopy(Type type) {
        if (type == null) return true;
        switch (type.getKind()) {
            case VOID:
            case BOOL:
            case INTEGER:
            case FLOAT:
            case ENUM:
                return true;
            case POINTER:
                return type.getOwnership() == PointerOwnership.RAW;
            default:
                return false;
        }
    }

    /**
     * Rust 中的零值 / 默认值
     */
    String defaultValue(Type type) {
        if (type == null) return "()";
        switch (type.getKind()) {
            case BOOL:
                return "false";
            case INTEGER:
                return "char".equals(integer(type.getName())) ? "'\\0'" : "0";
            case FLOAT:
                return "0.0";
            case STD_STRING:
                return "String::new()";
            case STD_VECTOR:
                return "Vec::new()";
            case STD_OPTIONAL:
            case THREAD:
                return "None";
            case POINTER:
                if (type.getOwnership() == PointerOwnership.RAW) {
                    return isConstPointer(type) ? "std::ptr::null()" : "std::ptr::null_mut()";
                }
                return "Default::default()";
            case MUTEX:
                return map(type).startsWith("RwLock") ? "RwLock::new(())" : "Mutex::new(())";
            case CONDITION_VARIABLE:
                return "Condvar::new()";
            case ATOMIC: {
                String atomic = atomic(type.getTemplateArg(0));
                String init = defaultValue(type.getTemplateArg(0));
                return (atomic.startsWith("Mutex") ? "Mutex" : atomic) + "::new(" + init + ")";
            }
            default:
                return "Default::default()";
        }
    }

    boolean isInterfaceClass(String name) {
        ClassDecl cls = ctx.getModule().findClass(name);
        return cls != null && cls.isInterfaceLike();
    }

    private String integer(String name) {
        String mapped = INTEGERS.get(name);
        return mapped != null ? mapped : "i32";
    }

    private String element(Type type, int index) {
        Type arg = type.getTemplateArg(index);
        if (arg == null && index == 0) arg = type.getElementType();
        return arg == null ? "()" : map(arg);
    }

    private String pointer(Type type) {
        Type pointee = type.getElementType();
        String inner = pointee == null ? "()" : pointeeType(pointee);
        switch (type.getOwnership()) {
            case UNIQUE:
                return "Box<" + inner + ">";
            case SHARED:
                ctx.addImport("std::rc::Rc");
                return "Rc<" + inner + ">";
            default:
                return (isConstPointer(type) ? "*const " : "*mut ") + map(pointee);
        }
    }

    static boolean isConstPointer(Type type) {
        return type.isConst() || (type.getElementType() != null && type.getElementType().isConst());
    }

    /** 指向多态接口类的智能指针装箱为 trait 对象 */
    private String pointeeType(Type pointee) {
        if ((pointee.getKind() == TypeKind.CLASS || pointee.getKind() == TypeKind.STRUCT)
                && isInterfaceClass(pointee.getBaseName())) {
            return "dyn " + pointee.getBaseName();
        }
        return map(pointee);
    }

    private String reference(Type type, boolean parameterPosition) {
        Type target = type.getElementType();
        boolean mutable = !type.isConst() && (target == null || !target.isConst());
        if (target == null) return mutable ? "&mut ()" : "&()";
        if (!mutable && parameterPosition && isBorrowableAggregate(target)) {
            return borrowedView(target, false);
        }
        if (isInterfaceClass(target.getBaseName())) {
            return (mutable ? "&mut dyn " : "&dyn ") + target.getBaseName();
        }
        return (mutable ? "&mut " : "&") + map(target);
    }

    /** 只读借用：String 借为 &str，Vec 借为切片 */
    private String borrowedView(Type type, boolean mutable) {
        if (type.getKind() == TypeKind.STD_STRING && !mutable) return "&str";
        if (type.getKind() == TypeKind.STD_VECTOR && !mutable) return "&[" + element(type, 0) + "]";
        if (isInterfaceClass(type.getBaseName())) return "&dyn " + type.getBaseName();
        return (mutable ? "&mut " : "&") + map(type);
    }

    private static boolean isBorrowableAggregate(Type type) {
        TypeKind kind = type.getKind();
        return kind == TypeKind.CLASS || kind == TypeKind.STRUCT || kind.isContainer();
    }

    /** {@code T data[N][M]} 得到 {@code [[T; M]; N]} */
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
        String result = type.getElementType() == null ? "()" : map(type.getElementType());
        for (int d = dims.size() - 1; d >= 0; d--) {
            String size = dims.get(d).isEmpty() ? null : dims.get(d);
            result = size == null ? "Vec<" + result + ">" : "[" + result + "; " + size + "]";
        }
        return result;
    }

    private String named(Type type) {
        String base = type.getBaseName();
        int colon = base.lastIndexOf("::");
        if (colon >= 0) base = base.substring(colon + 2);
        if (type.getTemplateArgs().isEmpty()) return base;
        StringBuilder sb = new StringBuilder(base).append('<');
        for (int i = 0; i < type.getTemplateArgs().size(); i++) {
            if (i > 0) sb.append(", ");
            sb.append(map(type.getTemplateArgs().get(i)));
        }
        return sb.append('>').toString();
    }
}
