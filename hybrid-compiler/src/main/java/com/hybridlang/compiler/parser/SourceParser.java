package com.hybridlang.compiler.parser;

import com.hybridlang.compiler.ir.IrModule;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.logging.Logger;

/**
 * C++ 源码入口：读取文件或字符串，产出未经分析的 {@link IrModule}。
 *
 * <p>每次调用得到一个新的 IR，调用方独占。</p>
 */
public final class SourceParser {

    private static final Logger LOG = Logger.getLogger(SourceParser.class.getName());

    private SourceParser() {}

    /**
     * 解析文件
     *
     * @throws SourceReadException 文件不存在或读取失败
     */
    public static IrModule parseFile(Path path) throws SourceReadException {
        if (!Files.isRegularFile(path)) {
            throw new SourceReadException(path, "file does not exist");
        }
        String source;
        try {
            source = new String(Files.readAllBytes(path), StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new SourceReadException(path, e);
        }
        LOG.fine("解析文件: " + path);
        return parseString(source);
    }

    /**
     * 解析源码字符串。不合法的 C++ 不会报错，只会少识别一些结构。
     */
    public static IrModule parseString(String source) {
        return new CppStructuralParser().parse(source);
    }
}
