package com.hybridlang.compiler.analysis;

import com.hybridlang.compiler.ir.NestedTemplateParam;
import com.hybridlang.compiler.ir.NonTypeParam;
import com.hybridlang.compiler.ir.TemplateParameter;
import com.hybridlang.compiler.ir.TemplateParameterVisitor;
import com.hybridlang.compiler.ir.TypeParam;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * 模板形参列表到两种目标泛型语法的渲染。
 *
 * <ul>
 *   <li>Rust：{@code <T: A + B, const N: usize>}</li>
 *   <li>Go：{@code [T any]}；Go 没有非类型形参与模板模板形参，直接丢弃</li>
 * </ul>
 */
public final class TemplateConversion {

    private static final Map<String, String> RUST_CONST_TYPES = new HashMap<String, String>();

    static {
        RUST_CONST_TYPES.put("size_t", "usize");
        RUST_CONST_TYPES.put("std::size_t", "usize");
        RUST_CONST_TYPES.put("int8_t", "i8");
        RUST_CONST_TYPES.put("int16_t", "i16");
        RUST_CONST_TYPES.put("int32_t", "i32");
        RUST_CONST_TYPES.put("int64_t", "i64");
        RUST_CONST_TYPES.put("uint8_t", "u8");
        RUST_CONST_TYPES.put("uint16_t", "u16");
        RUST_CONST_TYPES.put("unsigned", "u32");
        RUST_CONST_TYPES.put("unsigned int", "u32");
        RUST_CONST_TYPES.put("uint32_t", "u32");
        RUST_CONST_TYPES.put("uint64_t", "u64");
        RUST_CONST_TYPES.put("bool", "bool");
        RUST_CONST_TYPES.put("char", "char");
    }

    private TemplateConversion() {}

    /**
     * 渲染为 Rust 泛型参数列表，空列表得到空串
     */
    public static String toAlphaGenericBounds(List<TemplateParameter> params) {
        if (params.isEmpty()) return "";
        StringBuilder sb = new StringBuilder("<");
        boolean first = true;
        for (TemplateParameter p : params) {
            String rendered = p.accept(ALPHA);
            if (rendered == null) continue;
            if (!first) sb.append(", ");
            first = false;
            sb.append(rendered);
        }
        if (first) return "";
        return sb.append(">").toString();
    }

    /**
     * 渲染为 Go 类型参数列表，全部形参被丢弃时同样得到空串
     */
    public static String toBetaTypeParameters(List<TemplateParameter> params) {
        if (params.isEmpty()) return "";
        StringBuilder sb = new StringBuilder("[");
        boolean first = true;
        for (TemplateParameter p : params) {
            String rendered = p.accept(BETA);
            if (rendered == null) continue;
            if (!first) sb.append(", ");
            first = false;
            sb.append(rendered);
        }
        if (first) return "";
        return sb.append("]").toString();
    }

    /**
     * 非类型形参的 Rust const 泛型类型，表外类型一律 usize
     */
    public static String alphaConstType(String cppType) {
        String lowered = RUST_CONST_TYPES.get(cppType == null ? "" : cppType.trim());
        return lowered != null ? lowered : "usize";
    }

    private static final TemplateParameterVisitor<String> ALPHA = new TemplateParameterVisitor<String>() {
        @Override
        public String visitTypeParam(TypeParam param) {
            if (param.getConstraints().isEmpty()) return param.getName();
            return param.getName() + ": " + join(param.getConstraints(), " + ");
        }

        @Override
        public String visitNonTypeParam(NonTypeParam param) {
            return "const " + param.getName() + ": " + alphaConstType(param.getParamType().getName());
        }

        @Override
        public String visitNestedTemplateParam(NestedTemplateParam param) {
            // Rust 没有高阶类型参数，退化为普通类型参数
            return param.getName();
        }
    };

    private static final TemplateParameterVisitor<String> BETA = new TemplateParameterVisitor<String>() {
        @Override
        public String visitTypeParam(TypeParam param) {
            if (param.getConstraints().isEmpty()) return param.getName() + " any";
            return param.getName() + " " + join(param.getConstraints(), " | ");
        }

        @Override
        public String visitNonTypeParam(NonTypeParam param) {
            return null;
        }

        @Override
        public String visitNestedTemplateParam(NestedTemplateParam param) {
            return null;
        }
    };

    private static String join(List<String> parts, String separator) {
        StringBuilder sb = new StringBuilder();
        for (int i = 0; i < parts.size(); i++) {
            if (i > 0) sb.append(separator);
            sb.append(parts.get(i));
        }
        return sb.toString();
    }
}
