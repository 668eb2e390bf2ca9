package com.hybridlang.compiler.ir;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * IR 类型。
 *
 * <p>复合类型（指针、引用、数组、单参数容器）独占一个元素类型；
 * 多参数容器（map、pair）的成员放在 templateArgs 中。每次解析都重新构建，
 * 因此类型总是一棵树，不会在解析之间共享节点。</p>
 */
public class Type {

    private TypeKind kind;
    private final String name;
    private boolean isConst;
    private boolean isMutable = true;
    private final Type elementType;
    private final List<Type> templateArgs;
    private final PointerOwnership ownership;
    private long sizeBytes;
    private long alignment;

    public Type(TypeKind kind, String name) {
        this(kind, name, null, Collections.<Type>emptyList(), PointerOwnership.RAW);
    }

    public Type(TypeKind kind, String name, Type elementType) {
        this(kind, name, elementType, Collections.<Type>emptyList(), PointerOwnership.RAW);
    }

    public Type(TypeKind kind, String name, Type elementType, List<Type> templateArgs,
                PointerOwnership ownership) {
        this.kind = kind;
        this.name = name;
        this.elementType = elementType;
        this.templateArgs = templateArgs != null ? new ArrayList<Type>(templateArgs) : new ArrayList<Type>();
        this.ownership = ownership != null ? ownership : PointerOwnership.RAW;
    }

    public static Type pointer(Type element, String name, PointerOwnership ownership) {
        return new Type(TypeKind.POINTER, name, element, Collections.<Type>emptyList(), ownership);
    }

    public TypeKind getKind() {
        return kind;
    }

    /**
     * 仅用于模板分析：把引用模板类型参数的类类型改标为 TEMPLATE_PARAM。
     */
    public void setKind(TypeKind kind) {
        this.kind = kind;
    }

    public String getName() {
        return name;
    }

    public boolean isConst() {
        return isConst;
    }

    public void setConst(boolean isConst) {
        this.isConst = isConst;
        this.isMutable = !isConst;
    }

    public boolean isMutable() {
        return isMutable;
    }

    public void setMutable(boolean isMutable) {
        this.isMutable = isMutable;
    }

    public Type getElementType() {
        return elementType;
    }

    public List<Type> getTemplateArgs() {
        return templateArgs;
    }

    public Type getTemplateArg(int index) {
        return index < templateArgs.size() ? templateArgs.get(index) : null;
    }

    public PointerOwnership getOwnership() {
        return ownership;
    }

    public boolean isSmartPointer() {
        return kind == TypeKind.POINTER && ownership != PointerOwnership.RAW;
    }

    public long getSizeBytes() {
        return sizeBytes;
    }

    public void setSizeBytes(long sizeBytes) {
        this.sizeBytes = sizeBytes;
    }

    public long getAlignment() {
        return alignment;
    }

    public void setAlignment(long alignment) {
        this.alignment = alignment;
    }

    /**
     * 名称中去掉模板实参部分，例如 {@code Generator<int>} 得到 {@code Generator}
     */
    public String getBaseName() {
        int lt = name.indexOf('<');
        return lt >= 0 ? name.substring(0, lt).trim() : name;
    }

    @Override
    public String toString() {
        return (isConst ? "const " : "") + name + ":" + kind;
    }
}
