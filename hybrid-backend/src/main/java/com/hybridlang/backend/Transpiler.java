package com.hybridlang.backend;

import com.hybridlang.backend.codegen.CodeGenerator;
import com.hybridlang.backend.codegen.CodeGenerators;
import com.hybridlang.backend.codegen.GenerationException;
import com.hybridlang.compiler.analysis.PassPipeline;
import com.hybridlang.compiler.ir.IrJsonWriter;
import com.hybridlang.compiler.ir.IrModule;
import com.hybridlang.compiler.parser.SourceParser;
import com.hybridlang.compiler.parser.SourceReadException;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * 转译器门面。
 * 管线：C++ 源码 → 结构化解析 → IR → 分析 Pass → 目标代码（Rust / Go）。
 *
 * <p>每个输入单元使用新的 IR；输出先在内存中全部生成，再经临时文件整体落盘，
 * 失败的单元不会创建或覆盖任何输出文件。</p>
 */
public class Transpiler {

    private static final Logger LOG = Logger.getLogger(Transpiler.class.getName());

    private final TranspilerOptions options;
    private final PassPipeline pipeline;
    private final CodeGenerator generator;
    private String lastError;

    public Transpiler() {
        this(new TranspilerOptions());
    }

    public Transpiler(TranspilerOptions options) {
        this(options, PassPipeline.createDefault());
    }

    public Transpiler(TranspilerOptions options, PassPipeline pipeline) {
        this.options = new TranspilerOptions(options);
        this.pipeline = pipeline;
        CodeGenerator created = null;
        try {
            created = CodeGenerators.create(this.options.getTarget(), this.options);
        } catch (GenerationException e) {
            lastError = e.getMessage();
            LOG.warning("无法创建代码生成器: " + e.getMessage());
        }
        this.generator = created;
    }

    public TranspilerOptions getOptions() {
        return new TranspilerOptions(options);
    }

    public PassPipeline getPipeline() {
        return pipeline;
    }

    /**
     * 最近一次失败的原因；成功的调用会清空
     */
    public String getLastError() {
        return lastError;
    }

    /**
     * 转译单个文件，输出路径取 {@link TranspilerOptions#getOutputPath()}，未设置时由输入路径推导。
     *
     * @return 是否成功；失败原因见 {@link #getLastError()}
     */
    public boolean transpile(Path input) {
        return transpile(input, options.getOutputPath());
    }

    /**
     * 依次转译多个文件，遇到第一个失败即停止。批量模式忽略显式输出路径。
     */
    public boolean transpileBatch(List<Path> inputs) {
        int done = 0;
        for (Path input : inputs) {
            if (!transpile(input, null)) {
                LOG.warning("批量转译在第 " + (done + 1) + "/" + inputs.size() + " 个文件处停止");
                return false;
            }
            done++;
        }
        LOG.info("批量转译完成: " + done + " 个文件");
        return true;
    }

    private boolean transpile(Path input, Path explicitOutput) {
        lastError = null;
        if (generator == null) {
            return fail("Code generator not initialized", null);
        }
        LOG.info("开始转译: " + input + " -> " + options.getTarget());

        IrModule module;
        try {
            module = SourceParser.parseFile(input);
        } catch (SourceReadException e) {
            return fail("Failed to parse input file: " + e.getMessage(), e);
        }
        Path output = explicitOutput != null ? explicitOutput : deriveOutputPath(input, options.getTarget());
        Map<Path, String> files = new LinkedHashMap<Path, String>();
        try {
            pipeline.execute(module);
            files.put(output, generator.generate(module));
            if (options.isGenerateTests()) {
                files.put(deriveTestPath(output), generator.generateTests(module));
            }
            if (options.isEmitIrJson()) {
                files.put(deriveIrPath(output), IrJsonWriter.write(module));
            }
        } catch (GenerationException e) {
            return fail(e.getMessage(), e);
        } catch (RuntimeException e) {
            return fail("Internal error while transpiling " + input + ": " + e, e);
        }

        if (!writeAll(files)) {
            return false;
        }
        LOG.info("转译完成: " + output + "（" + module.getClasses().size() + " 个类, "
                + module.getFunctions().size() + " 个函数）");
        return true;
    }

    /**
     * 先把全部内容写到同目录的临时文件，再逐个移动到位；任何一步失败都清理本次产生的文件
     */
    private boolean writeAll(Map<Path, String> files) {
        Map<Path, Path> staged = new LinkedHashMap<Path, Path>();
        for (Map.Entry<Path, String> file : files.entrySet()) {
            Path target = file.getKey();
            try {
                if (Files.isDirectory(target)) {
                    throw new IOException("Is a directory: " + target);
                }
                Path parent = target.toAbsolutePath().getParent();
                Path temp = Files.createTempFile(parent, "." + target.getFileName(), ".tmp");
                staged.put(target, temp);
                Files.write(temp, file.getValue().getBytes(StandardCharsets.UTF_8));
            } catch (IOException e) {
                discard(staged.values());
                return fail("Failed to open output file: " + target, e);
            }
        }
        List<Path> moved = new ArrayList<Path>();
        for (Map.Entry<Path, Path> entry : staged.entrySet()) {
            try {
                Files.move(entry.getValue(), entry.getKey(), StandardCopyOption.REPLACE_EXISTING);
                moved.add(entry.getKey());
            } catch (IOException e) {
                discard(staged.values());
                discard(moved);
                return fail("Failed to open output file: " + entry.getKey(), e);
            }
        }
        return true;
    }

    private static void discard(Collection<Path> paths) {
        for (Path path : paths) {
            try {
                Files.deleteIfExists(path);
            } catch (IOException e) {
                LOG.log(Level.FINE, "无法清理输出文件: " + path, e);
            }
        }
    }

    private boolean fail(String message, Exception cause) {
        lastError = message;
        if (cause != null) {
            LOG.log(Level.WARNING, message, cause);
        } else {
            LOG.warning(message);
        }
        return false;
    }

    /**
     * 转译源码字符串，返回目标代码
     *
     * @throws GenerationException 生成器未初始化
     */
    public String transpileSource(String source) {
        if (generator == null) {
            throw new GenerationException("Code generator not initialized");
        }
        IrModule module = pipeline.execute(SourceParser.parseString(source));
        return generator.generate(module);
    }

    /**
     * 解析并分析源码，以 JSON 形式返回 IR
     */
    public String dumpIr(String source) {
        return IrJsonWriter.write(pipeline.execute(SourceParser.parseString(source)));
    }

    // ============ 输出路径 ============

    /**
     * {@code src/shapes.cpp} 得到 {@code src/shapes.rs}
     */
    public static Path deriveOutputPath(Path input, TargetProfile profile) {
        return input.resolveSibling(stem(input) + profile.getExtension());
    }

    static Path deriveTestPath(Path output) {
        String name = output.getFileName().toString();
        int dot = name.lastIndexOf('.');
        String ext = dot > 0 ? name.substring(dot) : "";
        return output.resolveSibling(stem(output) + "_test" + ext);
    }

    static Path deriveIrPath(Path output) {
        return output.resolveSibling(stem(output) + ".ir.json");
    }

    private static String stem(Path path) {
        String name = path.getFileName().toString();
        int dot = name.lastIndexOf('.');
        return dot > 0 ? name.substring(0, dot) : name;
    }
}
