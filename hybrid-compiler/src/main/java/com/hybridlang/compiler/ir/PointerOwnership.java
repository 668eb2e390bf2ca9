package com.hybridlang.compiler.ir;

/**
 * 指针所有权：裸指针、独占智能指针、共享智能指针
 */
public enum PointerOwnership {
    RAW,
    UNIQUE,
    SHARED
}
