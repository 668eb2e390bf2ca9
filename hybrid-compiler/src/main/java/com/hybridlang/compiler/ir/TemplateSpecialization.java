package com.hybridlang.compiler.ir;

import java.util.ArrayList;
import java.util.List;

/**
 * 模板特化信息
 */
public class TemplateSpecialization {
    private boolean partial;
    private final List<String> specializedArgs = new ArrayList<String>();

    public boolean isPartial() {
        return partial;
    }

    public void setPartial(boolean partial) {
        this.partial = partial;
    }

    public List<String> getSpecializedArgs() {
        return specializedArgs;
    }

    public boolean isSpecialization() {
        return !specializedArgs.isEmpty();
    }
}
