package com.hybridlang.compiler.ir;

/**
 * 成员访问级别
 */
public enum AccessLevel {
    PUBLIC, PROTECTED, PRIVATE;

    public static AccessLevel fromLabel(String label) {
        switch (label) {
            case "public":    return PUBLIC;
            case "protected": return PROTECTED;
            default:          return PRIVATE;
        }
    }
}
