package com.hybridlang.compiler.analysis;

import com.hybridlang.compiler.ir.Function;
import com.hybridlang.compiler.ir.IrModule;
import com.hybridlang.compiler.ir.Parameter;
import com.hybridlang.compiler.ir.PointerOwnership;
import com.hybridlang.compiler.ir.Type;
import com.hybridlang.compiler.ir.TypeKind;

import java.util.Map;
import java.util.regex.Pattern;

/**
 * 所有权分析：把形参分为“被移动”（所有权转入函数）与“被借用”（只读或经引用访问）。
 *
 * <ul>
 *   <li>moved：按值传入的 unique_ptr；函数体里出现 {@code std::move(p)}；
 *       按值传入的非基本类型被存入成员、放进容器或直接返回</li>
 *   <li>borrowed：引用 / 裸指针形参，以及没有逃逸的按值非基本类型形参</li>
 *   <li>基本类型按值传递两者都不是</li>
 * </ul>
 */
public class OwnershipAnalyzer implements IrPass {

    @Override
    public String getName() {
        return "OwnershipAnalyzer";
    }

    @Override
    public IrModule run(IrModule module) {
        for (Function fn : module.getAllFunctions()) {
            analyze(fn);
        }
        return module;
    }

    public void analyze(Function fn) {
        fn.getMovedParams().clear();
        fn.getBorrowedParams().clear();
        String body = fn.hasBody() ? fn.getBody() : "";

        for (Parameter p : fn.getParameters()) {
            if (p.getName().isEmpty()) continue;
            Type type = p.getType();
            if (isMoved(p, body, fn.getMemberInitializers())) {
                fn.getMovedParams().add(p.getName());
            } else if (isBorrowable(type)) {
                fn.getBorrowedParams().add(p.getName());
            }
        }
    }

    private static boolean isMoved(Parameter p, String body, Map<String, String> initializers) {
        Type type = p.getType();
        String name = Pattern.quote(p.getName());
        if (Pattern.compile("\\bstd::move\\s*\\(\\s*" + name + "\\s*\\)").matcher(body).find()) {
            return true;
        }
        if (type.getKind() == TypeKind.POINTER && type.getOwnership() == PointerOwnership.UNIQUE) {
            return true;
        }
        if (!isByValueAggregate(type)) return false;

        // 按值传入后逃逸：存入成员、放进容器、原样返回
        for (String expr : initializers.values()) {
            if (expr.trim().equals(p.getName())) return true;
        }
        return Pattern.compile("(?<![=!<>])=\\s*" + name + "\\s*;").matcher(body).find()
                || Pattern.compile("\\.(?:push_back|emplace_back|insert|push)\\s*\\(\\s*" + name + "\\s*\\)").matcher(body).find()
                || Pattern.compile("\\breturn\\s+" + name + "\\s*;").matcher(body).find();
    }

    private static boolean isBorrowable(Type type) {
        if (type.getKind() == TypeKind.REFERENCE) return true;
        if (type.getKind() == TypeKind.POINTER && type.getOwnership() == PointerOwnership.RAW) return true;
        return isByValueAggregate(type);
    }

    private static boolean isByValueAggregate(Type type) {
        TypeKind kind = type.getKind();
        return kind == TypeKind.CLASS || kind == TypeKind.STRUCT || kind == TypeKind.TEMPLATE_PARAM
                || kind == TypeKind.STD_STRING || kind.isContainer()
                || (kind == TypeKind.POINTER && type.getOwnership() == PointerOwnership.SHARED);
    }
}
