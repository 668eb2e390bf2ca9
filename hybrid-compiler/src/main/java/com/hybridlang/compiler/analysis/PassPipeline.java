package com.hybridlang.compiler.analysis;

import com.hybridlang.compiler.ir.IrModule;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.logging.Logger;

/**
 * 分析 pass 管线：按顺序对同一个 IR 执行各 pass。
 */
public class PassPipeline {

    private static final Logger LOG = Logger.getLogger(PassPipeline.class.getName());

    private final List<IrPass> passes = new ArrayList<IrPass>();

    /**
     * 创建默认管线。
     * 模板在最前（后续 pass 依赖 TEMPLATE_PARAM 标记），所有权在最后（需要完整的参数类型）。
     */
    public static PassPipeline createDefault() {
        PassPipeline pipeline = new PassPipeline();
        pipeline.addPass(new TemplateAnalyzer());
        pipeline.addPass(new ExceptionAnalyzer());
        pipeline.addPass(new ConcurrencyAnalyzer());
        pipeline.addPass(new AsyncAnalyzer());
        pipeline.addPass(new OwnershipAnalyzer());
        return pipeline;
    }

    public void addPass(IrPass pass) {
        passes.add(pass);
    }

    public List<IrPass> getPasses() {
        return Collections.unmodifiableList(passes);
    }

    public IrModule execute(IrModule module) {
        IrModule current = module;
        for (IrPass pass : passes) {
            LOG.fine("执行 pass: " + pass.getName());
            current = pass.run(current);
        }
        return current;
    }
}
