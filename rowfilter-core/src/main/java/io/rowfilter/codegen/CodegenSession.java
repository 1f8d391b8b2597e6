package io.rowfilter.codegen;

import io.rowfilter.kernel.FilterFunction;
import io.rowfilter.kernel.Frame;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Collects generated functions for one evaluation over a frame and compiles them together.
 * <p>
 * Nodes reserve function names and register themselves while the evaluation is being
 * planned; {@link #generate()} then asks every node to emit its loop, compiles the result
 * and makes each function retrievable by name.
 */
public final class CodegenSession {
    private static final Logger log = LoggerFactory.getLogger(CodegenSession.class);

    private final Frame frame;
    private final FilterFunctionCompiler compiler;
    private final List<CodegenNode> nodes = new ArrayList<>();
    private final Map<String, LoopBuilder> functions = new LinkedHashMap<>();
    private final Map<String, FilterFunction> results = new HashMap<>();
    private int nameCounter;
    private boolean generated;

    public CodegenSession(Frame frame, FilterFunctionCompiler compiler) {
        if (frame == null) {
            throw new IllegalArgumentException("frame required");
        }
        if (compiler == null) {
            throw new IllegalArgumentException("compiler required");
        }
        this.frame = frame;
        this.compiler = compiler;
    }

    /**
     * Reserves a function name unique within this session.
     */
    public String makeFunctionName(String prefix) {
        return prefix + "_" + (++nameCounter);
    }

    public void addNode(CodegenNode node) {
        if (generated) {
            throw new IllegalStateException("Cannot register nodes after code generation");
        }
        nodes.add(node);
    }

    /**
     * Starts a loop over the visible rows of this session's frame.
     */
    public LoopBuilder newLoop(String name) {
        if (functions.containsKey(name)) {
            throw new IllegalArgumentException("Function " + name + " already exists");
        }
        return new LoopBuilder(name, frame, this);
    }

    void addFunction(LoopBuilder loop) {
        if (functions.putIfAbsent(loop.name(), loop) != null) {
            throw new IllegalArgumentException("Function " + loop.name() + " already exists");
        }
    }

    public boolean isGenerated() {
        return generated;
    }

    /**
     * Emits and compiles the code of all registered nodes. Calling it again has no effect.
     */
    public void generate() {
        if (generated) {
            return;
        }
        generated = true;
        for (var node : nodes) {
            node.generateCode(this);
        }
        if (functions.isEmpty()) {
            return;
        }
        var sources = new ArrayList<String>(functions.size());
        for (var loop : functions.values()) {
            sources.add(loop.toJavaSource());
        }
        var compiled = compiler.compile(sources);
        for (var loop : functions.values()) {
            results.put(loop.name(), compiler.bind(compiled, loop.name(), loop.data()));
        }
        log.debug("Generated {} function(s) {} in {}", functions.size(), functions.keySet(), compiled.getName());
    }

    /**
     * Returns the compiled function generated under {@code name}.
     *
     * @throws IllegalStateException if {@link #generate()} has not run
     * @throws IllegalArgumentException if no function with that name was generated
     */
    public FilterFunction getResult(String name) {
        if (!generated) {
            throw new IllegalStateException("Code has not been generated yet");
        }
        var result = results.get(name);
        if (result == null) {
            throw new IllegalArgumentException("No generated function named " + name);
        }
        return result;
    }
}
