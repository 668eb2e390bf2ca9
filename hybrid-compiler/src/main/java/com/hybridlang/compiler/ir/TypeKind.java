package com.hybridlang.compiler.ir;

/**
 * IR 类型类别
 */
public enum TypeKind {
    // === 基础类型 ===
    VOID,
    BOOL,
    INTEGER,
    FLOAT,

    // === 复合类型 ===
    POINTER,
    REFERENCE,
    ARRAY,
    STRUCT,
    CLASS,
    ENUM,
    FUNCTION,
    TEMPLATE_PARAM,

    // === 标准容器 ===
    STD_VECTOR,
    STD_LIST,
    STD_DEQUE,
    STD_MAP,
    STD_UNORDERED_MAP,
    STD_SET,
    STD_UNORDERED_SET,
    STD_STRING,
    STD_PAIR,
    STD_OPTIONAL,

    // === 并发原语 ===
    THREAD,
    MUTEX,
    ATOMIC,
    CONDITION_VARIABLE,
    LOCK_GUARD,

    // === 异步原语 ===
    FUTURE,
    PROMISE,
    COROUTINE,
    TASK;

    public boolean isPrimitive() {
        return this == VOID || this == BOOL || this == INTEGER || this == FLOAT;
    }

    public boolean isContainer() {
        switch (this) {
            case STD_VECTOR:
            case STD_LIST:
            case STD_DEQUE:
            case STD_MAP:
            case STD_UNORDERED_MAP:
            case STD_SET:
            case STD_UNORDERED_SET:
            case STD_STRING:
            case STD_PAIR:
            case STD_OPTIONAL:
                return true;
            default:
                return false;
        }
    }

    public boolean isConcurrencyPrimitive() {
        return this == THREAD || this == MUTEX || this == ATOMIC
                || this == CONDITION_VARIABLE || this == LOCK_GUARD;
    }

    public boolean isAsyncPrimitive() {
        return this == FUTURE || this == PROMISE || this == COROUTINE || this == TASK;
    }
}
