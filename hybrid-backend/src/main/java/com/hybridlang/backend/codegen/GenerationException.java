package com.hybridlang.backend.codegen;

import com.hybridlang.backend.TargetProfile;

/**
 * 代码生成阶段的致命错误：未选择目标、输出不可写等
 */
public class GenerationException extends RuntimeException {

    private final TargetProfile profile;

    public GenerationException(String message) {
        this(message, null, null);
    }

    public GenerationException(String message, TargetProfile profile) {
        this(message, profile, null);
    }

    public GenerationException(String message, TargetProfile profile, Throwable cause) {
        super(message, cause);
        this.profile = profile;
    }

    /**
     * 出错时的目标，未选择目标时为 null
     */
    public TargetProfile getProfile() {
        return profile;
    }

    @Override
    public String getMessage() {
        if (profile == null) {
            return super.getMessage();
        }
        return "[" + profile.name().toLowerCase() + "] " + super.getMessage();
    }
}
