package com.hybridlang.compiler.ir;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 枚举声明。枚举项按书写顺序保存，显式赋值的项记录其值的原文。
 */
public class EnumDecl {
    private final String name;
    private final boolean scoped;
    private final Map<String, String> enumerators = new LinkedHashMap<String, String>();

    public EnumDecl(String name, boolean scoped) {
        this.name = name;
        this.scoped = scoped;
    }

    public String getName() {
        return name;
    }

    /** enum class / enum struct */
    public boolean isScoped() {
        return scoped;
    }

    /**
     * @param value 显式值的原文，没有时为 null
     */
    public void addEnumerator(String enumerator, String value) {
        enumerators.put(enumerator, value);
    }

    public List<String> getEnumerators() {
        return new ArrayList<String>(enumerators.keySet());
    }

    public String getValue(String enumerator) {
        return enumerators.get(enumerator);
    }
}
