package com.hybridlang.compiler.ir;

import java.util.ArrayList;
import java.util.List;

/**
 * 异常规格：是否可能抛出，以及抛出的类型名（空列表表示任意类型）
 */
public class ExceptionSpec {
    private boolean canThrow;
    private boolean noexcept;
    private final List<String> throwTypes = new ArrayList<String>();

    public boolean canThrow() {
        return canThrow;
    }

    public void setCanThrow(boolean canThrow) {
        this.canThrow = canThrow;
    }

    public boolean isNoexcept() {
        return noexcept;
    }

    public void setNoexcept(boolean noexcept) {
        this.noexcept = noexcept;
    }

    public List<String> getThrowTypes() {
        return throwTypes;
    }

    public void addThrowType(String type) {
        if (!throwTypes.contains(type)) {
            throwTypes.add(type);
        }
    }
}
