package com.hybridlang.backend;

import java.nio.file.Path;

/**
 * 转译选项
 */
public class TranspilerOptions {

    private TargetProfile target = TargetProfile.RUST;
    private Path outputPath;
    private boolean enableSafetyChecks = true;
    private boolean preserveComments = true;
    private boolean generateTests = false;
    private boolean emitIrJson = false;
    private String goPackage = "main";

    public TranspilerOptions() {
    }

    public TranspilerOptions(TranspilerOptions other) {
        this.target = other.target;
        this.outputPath = other.outputPath;
        this.enableSafetyChecks = other.enableSafetyChecks;
        this.preserveComments = other.preserveComments;
        this.generateTests = other.generateTests;
        this.emitIrJson = other.emitIrJson;
        this.goPackage = other.goPackage;
    }

    public TargetProfile getTarget() {
        return target;
    }

    public void setTarget(TargetProfile target) {
        this.target = target;
    }

    /**
     * 显式输出路径；为 null 时由输入路径替换扩展名得到
     */
    public Path getOutputPath() {
        return outputPath;
    }

    public void setOutputPath(Path outputPath) {
        this.outputPath = outputPath;
    }

    /**
     * 是否在生成代码中插入运行时空指针检查
     */
    public boolean isEnableSafetyChecks() {
        return enableSafetyChecks;
    }

    public void setEnableSafetyChecks(boolean enableSafetyChecks) {
        this.enableSafetyChecks = enableSafetyChecks;
    }

    /**
     * 是否把无法直接转换的函数体以注释形式保留
     */
    public boolean isPreserveComments() {
        return preserveComments;
    }

    public void setPreserveComments(boolean preserveComments) {
        this.preserveComments = preserveComments;
    }

    public boolean isGenerateTests() {
        return generateTests;
    }

    public void setGenerateTests(boolean generateTests) {
        this.generateTests = generateTests;
    }

    /**
     * 是否额外输出分析后的 IR（JSON）
     */
    public boolean isEmitIrJson() {
        return emitIrJson;
    }

    public void setEmitIrJson(boolean emitIrJson) {
        this.emitIrJson = emitIrJson;
    }

    public String getGoPackage() {
        return goPackage;
    }

    public void setGoPackage(String goPackage) {
        this.goPackage = goPackage;
    }
}
