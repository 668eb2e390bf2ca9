package com.hybridlang.backend.codegen;

import com.hybridlang.backend.TargetProfile;
import com.hybridlang.backend.TranspilerOptions;
import com.hybridlang.backend.codegen.go.GoCodeGenerator;
import com.hybridlang.backend.codegen.rust.RustCodeGenerator;

/**
 * 按目标选择生成器
 */
public final class CodeGenerators {

    private CodeGenerators() {
    }

    public static CodeGenerator create(TargetProfile profile, TranspilerOptions options) {
        if (profile == null) {
            throw new GenerationException("Code generator not initialized: no target profile selected");
        }
        TranspilerOptions copy = new TranspilerOptions(options != null ? options : new TranspilerOptions());
        copy.setTarget(profile);
        switch (profile) {
            case RUST:
                return new RustCodeGenerator(copy);
            case GO:
                return new GoCodeGenerator(copy);
            default:
                throw new GenerationException("Unsupported target profile", profile);
        }
    }
}
