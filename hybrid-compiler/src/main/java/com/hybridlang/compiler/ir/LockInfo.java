package com.hybridlang.compiler.ir;

/**
 * 锁作用域：{@code std::lock_guard<std::mutex> lock(mtx);} 到所在块结束
 */
public class LockInfo {

    public enum Kind {
        GUARD, UNIQUE, SHARED, SCOPED
    }

    private final Kind kind;
    private final String lockVar;
    private final String mutexVar;
    private final String scopeBody;

    public LockInfo(Kind kind, String lockVar, String mutexVar, String scopeBody) {
        this.kind = kind;
        this.lockVar = lockVar;
        this.mutexVar = mutexVar;
        this.scopeBody = scopeBody != null ? scopeBody : "";
    }

    public Kind getKind() {
        return kind;
    }

    public String getLockVar() {
        return lockVar;
    }

    public String getMutexVar() {
        return mutexVar;
    }

    /** 从加锁语句之后到所在块结束的原始文本 */
    public String getScopeBody() {
        return scopeBody;
    }

    public static Kind kindOf(String spelling) {
        switch (spelling) {
            case "unique_lock": return Kind.UNIQUE;
            case "shared_lock": return Kind.SHARED;
            case "scoped_lock": return Kind.SCOPED;
            default:            return Kind.GUARD;
        }
    }
}
