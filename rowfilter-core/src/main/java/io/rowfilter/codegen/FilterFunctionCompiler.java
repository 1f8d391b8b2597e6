package io.rowfilter.codegen;

import io.rowfilter.core.RowFilterException;
import io.rowfilter.kernel.FilterFunction;
import net.bytebuddy.dynamic.loading.ByteArrayClassLoader;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.tools.Diagnostic;
import javax.tools.DiagnosticCollector;
import javax.tools.FileObject;
import javax.tools.ForwardingJavaFileManager;
import javax.tools.JavaCompiler;
import javax.tools.JavaFileObject;
import javax.tools.SimpleJavaFileObject;
import javax.tools.StandardJavaFileManager;
import javax.tools.ToolProvider;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.OutputStream;
import java.lang.invoke.MethodHandle;
import java.lang.invoke.MethodHandles;
import java.lang.invoke.MethodType;
import java.net.URI;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Compiles generated filter loops into classes and binds them as {@link FilterFunction}s.
 * <p>
 * Generated sources only reference JDK types, so compilation does not depend on the
 * application class path. Compiled classes are defined through ByteBuddy's
 * {@link ByteArrayClassLoader} and cached by source text for reuse across sessions.
 */
public final class FilterFunctionCompiler {
    private static final Logger log = LoggerFactory.getLogger(FilterFunctionCompiler.class);

    private static final String PACKAGE = "io.rowfilter.generated";
    private static final MethodType FILTER_TYPE = MethodType.methodType(void.class,
            Object[].class, int.class, int.class, int[].class, int[].class);
    private static final FilterFunctionCompiler SHARED = new FilterFunctionCompiler();

    private final ConcurrentHashMap<String, Class<?>> cache = new ConcurrentHashMap<>();
    private final AtomicLong classCounter = new AtomicLong(0);
    private final JavaCompiler javac;

    public FilterFunctionCompiler() {
        this(ToolProvider.getSystemJavaCompiler());
    }

    FilterFunctionCompiler(JavaCompiler javac) {
        this.javac = javac;
    }

    /**
     * Compiler instance shared by evaluation contexts.
     */
    public static FilterFunctionCompiler shared() {
        return SHARED;
    }

    /**
     * Check if a system Java compiler is present (it is absent on a bare JRE).
     */
    public boolean isAvailable() {
        return javac != null;
    }

    /**
     * Compiles the given static methods into one class.
     *
     * @param methodSources Java source of each {@code public static} method
     * @return the loaded class
     * @throws RowFilterException if compilation fails
     */
    public Class<?> compile(List<String> methodSources) {
        if (!isAvailable()) {
            throw new IllegalStateException("No system Java compiler is available");
        }
        var body = String.join("\n", methodSources);
        return cache.computeIfAbsent(body, this::doCompile);
    }

    /**
     * Binds method {@code name} of a compiled class to its {@code data} argument.
     */
    public FilterFunction bind(Class<?> compiled, String name, Object[] data) {
        MethodHandle handle;
        try {
            handle = MethodHandles.publicLookup().findStatic(compiled, name, FILTER_TYPE);
        } catch (NoSuchMethodException | IllegalAccessException e) {
            throw new RowFilterException("Generated class " + compiled.getName()
                    + " has no filter function " + name, e);
        }
        var bound = MethodHandles.insertArguments(handle, 0, (Object) data);
        return (row0, row1, out, nOuts) -> {
            try {
                bound.invokeExact(row0, row1, out, nOuts);
            } catch (RuntimeException | Error e) {
                throw e;
            } catch (Throwable t) {
                throw new RowFilterException("Filter function " + name + " failed", t);
            }
        };
    }

    public int cacheSize() {
        return cache.size();
    }

    public void clearCache() {
        cache.clear();
    }

    private Class<?> doCompile(String body) {
        var simpleName = "FilterGen" + classCounter.incrementAndGet();
        var className = PACKAGE + "." + simpleName;
        var source = "package " + PACKAGE + ";\n\n"
                + "public final class " + simpleName + " {\n"
                + "    private " + simpleName + "() {\n    }\n\n"
                + body
                + "}\n";
        log.debug("Compiling {}:\n{}", className, source);

        var diagnostics = new DiagnosticCollector<JavaFileObject>();
        Map<String, byte[]> classes;
        try (var fileManager = new MemoryFileManager(javac.getStandardFileManager(diagnostics, null, null))) {
            var task = javac.getTask(null, fileManager, diagnostics,
                    List.of("-proc:none", "-g:none", "-Xlint:none"), null,
                    List.of(new SourceFile(className, source)));
            if (!Boolean.TRUE.equals(task.call())) {
                throw new RowFilterException("Failed to compile " + className + ": " + describe(diagnostics)
                        + "\n" + source);
            }
            classes = fileManager.classes();
        } catch (IOException e) {
            throw new RowFilterException("Failed to compile " + className, e);
        }

        var loader = new ByteArrayClassLoader(FilterFunctionCompiler.class.getClassLoader(), classes);
        try {
            return Class.forName(className, true, loader);
        } catch (ClassNotFoundException e) {
            throw new RowFilterException("Compiled class " + className + " could not be loaded", e);
        }
    }

    private static String describe(DiagnosticCollector<JavaFileObject> diagnostics) {
        var sb = new StringBuilder();
        for (Diagnostic<? extends JavaFileObject> d : diagnostics.getDiagnostics()) {
            if (d.getKind() == Diagnostic.Kind.ERROR) {
                sb.append("line ").append(d.getLineNumber()).append(": ").append(d.getMessage(null)).append("; ");
            }
        }
        return sb.toString();
    }

    private static final class SourceFile extends SimpleJavaFileObject {
        private final String source;

        SourceFile(String className, String source) {
            super(URI.create("string:///" + className.replace('.', '/') + Kind.SOURCE.extension), Kind.SOURCE);
            this.source = source;
        }

        @Override
        public CharSequence getCharContent(boolean ignoreEncodingErrors) {
            return source;
        }
    }

    private static final class ClassFile extends SimpleJavaFileObject {
        private final ByteArrayOutputStream bytes = new ByteArrayOutputStream();

        ClassFile(String className) {
            super(URI.create("bytes:///" + className.replace('.', '/') + Kind.CLASS.extension), Kind.CLASS);
        }

        @Override
        public OutputStream openOutputStream() {
            return bytes;
        }
    }

    private static final class MemoryFileManager extends ForwardingJavaFileManager<StandardJavaFileManager> {
        private final Map<String, ClassFile> outputs = new HashMap<>();

        MemoryFileManager(StandardJavaFileManager delegate) {
            super(delegate);
        }

        @Override
        public JavaFileObject getJavaFileForOutput(Location location, String className,
                JavaFileObject.Kind kind, FileObject sibling) {
            var file = new ClassFile(className);
            outputs.put(className, file);
            return file;
        }

        Map<String, byte[]> classes() {
            var result = new HashMap<String, byte[]>();
            outputs.forEach((name, file) -> result.put(name, file.bytes.toByteArray()));
            return result;
        }
    }
}
