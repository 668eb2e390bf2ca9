package com.hybridlang.compiler.analysis;

import com.hybridlang.compiler.ir.Function;
import com.hybridlang.compiler.ir.IrModule;
import com.hybridlang.compiler.ir.TypeKind;
import com.hybridlang.compiler.parser.SourceParser;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class PassPipelineTest {

    @Test
    void defaultPipelineRunsPassesInOrder() {
        List<String> names = new ArrayList<String>();
        for (IrPass pass : PassPipeline.createDefault().getPasses()) {
            names.add(pass.getName());
        }
        assertThat(names).containsExactly("TemplateAnalyzer", "ExceptionAnalyzer",
                "ConcurrencyAnalyzer", "AsyncAnalyzer", "OwnershipAnalyzer");
    }

    @Test
    void defaultPipelineAnnotatesWholeModule() {
        IrModule ir = SourceParser.parseString("template<typename T>\n"
                + "T pick(T a, T b) { if (!ok()) throw Err(); return a; }\n"
                + "Task<int> fetch() { int v = co_await load(); co_return v; }\n");
        IrModule result = PassPipeline.createDefault().execute(ir);

        assertThat(result).isSameAs(ir);
        Function pick = result.getFunctions().get(0);
        assertThat(pick.isTemplate()).isTrue();
        assertThat(pick.getParameters().get(0).getType().getKind()).isEqualTo(TypeKind.TEMPLATE_PARAM);
        assertThat(pick.mayThrow()).isTrue();
        assertThat(pick.getMovedParams()).containsExactly("a");

        Function fetch = result.getFunctions().get(1);
        assertThat(fetch.isAsync()).isTrue();
        assertThat(fetch.getCoroutineInfo().getOperations()).hasSize(2);
    }

    @Test
    void customPipelineRunsAddedPasses() {
        final List<String> seen = new ArrayList<String>();
        PassPipeline pipeline = new PassPipeline();
        pipeline.addPass(new IrPass() {
            @Override
            public String getName() {
                return "Recorder";
            }

            @Override
            public IrModule run(IrModule module) {
                seen.add("run");
                return module;
            }
        });
        pipeline.execute(new IrModule());
        assertThat(seen).containsExactly("run");
    }
}
