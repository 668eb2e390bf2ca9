package com.hybridlang.compiler.analysis;

import com.hybridlang.compiler.ir.IrModule;

/**
 * IR 分析 pass 接口。
 *
 * <p>pass 在原地补充语义信息；识别不出的模式退化为空信息，不抛异常。</p>
 */
public interface IrPass {

    /**
     * Pass 名称（用于日志/调试）。
     */
    String getName();

    /**
     * 对 IR 模块执行分析，返回同一个模块。
     */
    IrModule run(IrModule module);
}
