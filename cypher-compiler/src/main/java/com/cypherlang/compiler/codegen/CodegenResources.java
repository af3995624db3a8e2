package com.cypherlang.compiler.codegen;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;

/**
 * 加载 classpath 中打包的固定输出片段
 */
public final class CodegenResources {

    private CodegenResources() {}

    /**
     * 读取相对于 {@code anchor} 所在包的资源。
     *
     * @throws IllegalStateException jar 中缺少该资源时
     */
    public static String load(Class<?> anchor, String name) {
        try (InputStream in = anchor.getResourceAsStream(name)) {
            if (in == null) {
                throw new IllegalStateException("Missing codegen resource: " + name
                        + " (relative to " + anchor.getPackage().getName() + ")");
            }
            return new String(in.readAllBytes(), StandardCharsets.UTF_8).replace("\r\n", "\n");
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read codegen resource " + name, e);
        }
    }
}
