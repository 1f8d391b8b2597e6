package io.rowfilter.codegen;

/**
 * A participant in code generation.
 * <p>
 * Nodes register with a {@link CodegenSession} when they are built and are asked to emit
 * their loops once the session generates code.
 */
@FunctionalInterface
public interface CodegenNode {
    void generateCode(CodegenSession session);
}
