package com.cypherlang.compiler.codegen;

import com.cypherlang.compiler.ast.SourceLocation;

import java.util.HashMap;
import java.util.Map;
import java.util.function.Predicate;

/**
 * 输出代码中的一个命名作用域
 *
 * <p>记录作用域内已出现的名字（包括生成器自己引入的名字），
 * 重名或使用目标语言保留字时抛出 {@link CodegenException}。</p>
 */
public class NameScope {
    private final String language;
    private final String description;
    private final Predicate<String> reserved;
    private final Map<String, String> names = new HashMap<>();

    /**
     * @param language    目标语言，用于错误信息
     * @param description 作用域描述，如 {@code contract 'Vault'}
     * @param reserved    目标语言保留字判定
     */
    public NameScope(String language, String description, Predicate<String> reserved) {
        this.language = language;
        this.description = description;
        this.reserved = reserved;
    }

    /**
     * 登记用户声明的名字：不能是保留字，也不能与已登记的名字重复
     */
    public void declare(String name, String kind, SourceLocation location) {
        if (reserved.test(name)) {
            throw new CodegenException("'" + name + "' is a reserved word in " + language
                    + " and cannot name a " + kind, location);
        }
        claim(name, kind, location);
    }

    /**
     * 登记名字，只检查重复。用于生成器引入的名字，以及目标语言允许使用保留字的位置（如 JS 方法名）
     */
    public void claim(String name, String kind, SourceLocation location) {
        String previous = names.putIfAbsent(name, kind);
        if (previous != null) {
            throw new CodegenException("Name '" + name + "' of " + kind + " clashes with "
                    + previous + " in " + description, location);
        }
    }

    public boolean contains(String name) {
        return names.containsKey(name);
    }
}
