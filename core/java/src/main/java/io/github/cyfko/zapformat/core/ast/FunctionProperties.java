package io.github.cyfko.zapformat.core.ast;

/**
 * Properties of a {@code funct} block. Absent keys are {@code null}.
 *
 * @param call {@code Async} or {@code Sync}
 * @param args the argument type
 * @param rets the return type
 * @author Frank KOSSI
 * @since 1.0.0
 */
public record FunctionProperties(String call, TypeNode args, TypeNode rets) {

    public static FunctionProperties empty() {
        return new FunctionProperties(null, null, null);
    }
}
