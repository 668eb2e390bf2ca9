package com.hybridlang.compiler.ir;

/**
 * 互斥量声明
 */
public class MutexInfo {

    public enum Kind {
        PLAIN, RECURSIVE, SHARED, TIMED
    }

    private final String mutexVar;
    private final Kind kind;
    private String protectedType = "";

    public MutexInfo(String mutexVar, Kind kind) {
        this.mutexVar = mutexVar;
        this.kind = kind;
    }

    public String getMutexVar() {
        return mutexVar;
    }

    public Kind getKind() {
        return kind;
    }

    /** 被保护的数据类型名，未知时为空串 */
    public String getProtectedType() {
        return protectedType;
    }

    public void setProtectedType(String protectedType) {
        this.protectedType = protectedType != null ? protectedType : "";
    }

    /**
     * 由 {@code std::xxx_mutex} 的 xxx 部分推断种类
     */
    public static Kind kindOf(String spelling) {
        if (spelling.contains("recursive")) return Kind.RECURSIVE;
        if (spelling.contains("shared")) return Kind.SHARED;
        if (spelling.contains("timed")) return Kind.TIMED;
        return Kind.PLAIN;
    }
}
