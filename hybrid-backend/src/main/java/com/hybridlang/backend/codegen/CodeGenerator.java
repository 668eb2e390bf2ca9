package com.hybridlang.backend.codegen;

import com.hybridlang.backend.TargetProfile;
import com.hybridlang.compiler.ir.IrModule;

/**
 * 目标代码生成器。
 *
 * <p>实现只持有不可变的选项；输出缓冲、导入集合等状态都在单次调用内创建，
 * 同一个 IR 重复生成得到逐字节相同的文本。</p>
 */
public interface CodeGenerator {

    TargetProfile getProfile();

    /**
     * 生成完整的翻译单元
     */
    String generate(IrModule module);

    /**
     * 生成配套的测试骨架文件
     */
    String generateTests(IrModule module);
}
