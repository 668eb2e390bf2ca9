package com.hybridlang.backend;

/**
 * 输出目标
 */
public enum TargetProfile {
    /** Target-Alpha：所有权 / trait / Result 风格 */
    RUST(".rs"),
    /** Target-Beta：interface / goroutine / error 元组风格 */
    GO(".go");

    private final String extension;

    TargetProfile(String extension) {
        this.extension = extension;
    }

    public String getExtension() {
        return extension;
    }
}
