package com.cypherlang.compiler.codegen;

/**
 * 代码生成配置
 */
public class CodegenConfig {
    private int indentSize = 4;
    private boolean strictTypes = false;
    private String solidityVersion = "^0.8.19";

    public CodegenConfig() {
    }

    /** Solidity 输出的缩进宽度。JavaScript 输出始终使用两个空格。 */
    public int getIndentSize() {
        return indentSize;
    }

    public void setIndentSize(int indentSize) {
        if (indentSize < 1) {
            throw new IllegalArgumentException("indentSize must be positive: " + indentSize);
        }
        this.indentSize = indentSize;
    }

    /**
     * 开启时，后端无法映射的基本类型名会抛出
     * {@link CodegenException}。关闭时回退为后端的
     * 默认标量类型（{@code uint256} / {@code bigint}）并记录告警。
     */
    public boolean isStrictTypes() {
        return strictTypes;
    }

    public void setStrictTypes(boolean strictTypes) {
        this.strictTypes = strictTypes;
    }

    /** 写入 Solidity pragma 的版本约束 */
    public String getSolidityVersion() {
        return solidityVersion;
    }

    public void setSolidityVersion(String solidityVersion) {
        this.solidityVersion = solidityVersion;
    }

    /**
     * Solidity 输出的单个缩进单位
     */
    public String getIndentString() {
        StringBuilder sb = new StringBuilder();
        for (int i = 0; i < indentSize; i++) {
            sb.append(' ');
        }
        return sb.toString();
    }
}
