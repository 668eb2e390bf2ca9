package com.hybridlang.compiler.parser;

import java.io.IOException;
import java.nio.file.Path;

/**
 * 输入源文件不存在或无法读取
 */
public class SourceReadException extends IOException {
    private final Path path;

    public SourceReadException(Path path, String reason) {
        super(reason);
        this.path = path;
    }

    public SourceReadException(Path path, Throwable cause) {
        super(cause.getMessage(), cause);
        this.path = path;
    }

    public Path getPath() {
        return path;
    }

    @Override
    public String getMessage() {
        return "Cannot read source file " + path + ": " + super.getMessage();
    }
}
