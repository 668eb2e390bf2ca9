package com.hybridlang.backend.codegen;

import com.hybridlang.backend.TargetProfile;
import com.hybridlang.backend.TranspilerOptions;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class CodeGeneratorsTest {

    @Test
    void nullProfileIsRejected() {
        GenerationException e = assertThrows(GenerationException.class,
                () -> CodeGenerators.create(null, new TranspilerOptions()));
        assertTrue(e.getMessage().startsWith("Code generator not initialized"));
        assertNull(e.getProfile());
    }

    @Test
    void profileSelectsGenerator() {
        assertEquals(TargetProfile.RUST, CodeGenerators.create(TargetProfile.RUST, new TranspilerOptions()).getProfile());
        assertEquals(TargetProfile.GO, CodeGenerators.create(TargetProfile.GO, null).getProfile());
    }

    @Test
    void explicitProfileWinsOverOptions() {
        TranspilerOptions options = new TranspilerOptions();
        options.setTarget(TargetProfile.RUST);

        CodeGenerator generator = CodeGenerators.create(TargetProfile.GO, options);

        assertEquals(TargetProfile.GO, generator.getProfile());
        // 调用方的选项不被修改
        assertEquals(TargetProfile.RUST, options.getTarget());
    }

    @Test
    void messageCarriesProfile() {
        assertEquals("[go] boom", new GenerationException("boom", TargetProfile.GO).getMessage());
        assertEquals("boom", new GenerationException("boom").getMessage());
    }

    @Test
    void generateRejectsMissingModule() {
        CodeGenerator generator = CodeGenerators.create(TargetProfile.RUST, new TranspilerOptions());
        GenerationException e = assertThrows(GenerationException.class, () -> generator.generate(null));
        assertEquals(TargetProfile.RUST, e.getProfile());
    }
}
