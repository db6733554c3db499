package com.questrail.protowire.codegen.processor;

import com.questrail.protowire.codegen.WireType;
import io.netty.buffer.ByteBuf;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import javax.tools.Diagnostic;
import javax.tools.DiagnosticCollector;
import javax.tools.JavaCompiler;
import javax.tools.JavaFileObject;
import javax.tools.SimpleJavaFileObject;
import javax.tools.StandardJavaFileManager;
import javax.tools.ToolProvider;
import java.io.File;
import java.io.IOException;
import java.net.URI;
import java.net.URISyntaxException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

import static org.junit.jupiter.api.Assertions.*;

/**
 * WireCodecProcessorTest
 * -----------------------------------------------------------------------------
 * Runs the processor inside an in-process {@code javac} over small sources and
 * checks the generated code and the compile errors it reports.
 */
final class WireCodecProcessorTest
{
    @TempDir
    Path work;

    @Test
    void generatesCodecNextToTheRecord() throws Exception
    {
        Result result = compile("demo.Point",
                "package demo;\n"
                + "import com.questrail.protowire.codegen.WireType;\n"
                + "@WireType public record Point(int x, int y) {}\n");

        assertTrue(result.success, result.errors.toString());
        Path generated = work.resolve("generated/demo/PointWireCodec.java");
        assertTrue(Files.exists(generated));
        String source = Files.readString(generated, StandardCharsets.UTF_8);
        assertTrue(source.contains("public final class PointWireCodec implements WireCodec<demo.Point>"), source);
        assertTrue(source.contains("public static final PointWireCodec INSTANCE"), source);
        assertTrue(Files.exists(work.resolve("classes/demo/PointWireCodec.class")));
    }

    @Test
    void nestedTypesGetFlattenedCodecNames() throws Exception
    {
        Result result = compile("demo.Outer",
                "package demo;\n"
                + "import com.questrail.protowire.codegen.WireType;\n"
                + "public class Outer { @WireType public enum Mode { A, B } }\n");

        assertTrue(result.success, result.errors.toString());
        assertTrue(Files.exists(work.resolve("generated/demo/Outer_ModeWireCodec.java")));
    }

    @Test
    void genericUnionCompiles() throws Exception
    {
        Result result = compile("demo.Maybe",
                "package demo;\n"
                + "import com.questrail.protowire.codegen.WireType;\n"
                + "import java.util.List;\n"
                + "@WireType public sealed interface Maybe<T> permits Maybe.Some, Maybe.None {\n"
                + "  record Some<V>(V value, List<V> more) implements Maybe<V> {}\n"
                + "  record None<V>() implements Maybe<V> {}\n"
                + "}\n");

        assertTrue(result.success, result.errors.toString());
    }

    @Test
    void rejectsPlainClasses()
    {
        assertError("must be records",
                "package demo;\n"
                + "import com.questrail.protowire.codegen.WireType;\n"
                + "@WireType public class Plain { int x; }\n",
                "applies to records, sealed interfaces and enums");
    }

    @Test
    void rejectsNonRecordUnionArms()
    {
        assertError("arm",
                "package demo;\n"
                + "import com.questrail.protowire.codegen.WireType;\n"
                + "@WireType public sealed interface Animal permits Animal.Cat {\n"
                + "  final class Cat implements Animal {}\n"
                + "}\n",
                "must be a record to be a wire variant");
    }

    @Test
    void rejectsDuplicateDiscriminants()
    {
        assertError("duplicate",
                "package demo;\n"
                + "import com.questrail.protowire.codegen.WireType;\n"
                + "import com.questrail.protowire.codegen.WireVariant;\n"
                + "@WireType public enum Clash { @WireVariant(1) A, B }\n",
                "discriminant 1 of B is already used by A");
    }

    @Test
    void rejectsNegativeDiscriminants()
    {
        assertError("negative",
                "package demo;\n"
                + "import com.questrail.protowire.codegen.WireType;\n"
                + "import com.questrail.protowire.codegen.WireVariant;\n"
                + "@WireType public enum Below { @WireVariant(-1) A }\n",
                "between 0 and 4294967295");
    }

    @Test
    void rejectsComponentsWithoutCodec()
    {
        assertError("unsupported",
                "package demo;\n"
                + "import com.questrail.protowire.codegen.WireType;\n"
                + "@WireType public record Holder(Thread worker) {}\n",
                "worker: no wire codec for java.lang.Thread");
    }

    @Test
    void rejectsRawTypes()
    {
        assertError("raw",
                "package demo;\n"
                + "import com.questrail.protowire.codegen.WireType;\n"
                + "@SuppressWarnings(\"rawtypes\")\n"
                + "@WireType public record Loose(java.util.List items) {}\n",
                "raw type");
    }

    @Test
    void rejectsMaxLengthOnFixedWidthComponents()
    {
        assertError("max length",
                "package demo;\n"
                + "import com.questrail.protowire.codegen.WireType;\n"
                + "import com.questrail.protowire.codegen.WireMaxLength;\n"
                + "@WireType public record Capped(@WireMaxLength(4) int count) {}\n",
                "@WireMaxLength applies to");
    }

    @Test
    void rejectsPrivateTypes()
    {
        assertError("private",
                "package demo;\n"
                + "import com.questrail.protowire.codegen.WireType;\n"
                + "public class Host { @WireType private record Hidden(int x) {} }\n",
                "must not be private");
    }

    @Test
    void rejectsMissingSkipFactory()
    {
        assertError("skip factory",
                "package demo;\n"
                + "import com.questrail.protowire.codegen.WireType;\n"
                + "import com.questrail.protowire.codegen.WireSkip;\n"
                + "@WireType public record Cached(int id, @WireSkip(defaultFactory = \"nothing\") String note) {}\n",
                "@WireSkip default factory nothing()");
    }

    @Test
    void rejectsArmTypeParametersUnknownToTheUnion()
    {
        assertError("arm type parameter",
                "package demo;\n"
                + "import com.questrail.protowire.codegen.WireType;\n"
                + "@WireType public sealed interface Box<T> permits Box.Full {\n"
                + "  record Full<T, U>(T item, U extra) implements Box<T> {}\n"
                + "}\n",
                "type parameter U of Full is not passed on to Box");
    }

    @Test
    void proxyTypeDelegatesToAConvertingCodec() throws Exception
    {
        Result result = compile("demo.Stamp",
                "package demo;\n"
                + "import com.questrail.protowire.codegen.WireType;\n"
                + "@WireType(via = long.class) public class Stamp {\n"
                + "  final long millis;\n"
                + "  Stamp(long millis) { this.millis = millis; }\n"
                + "  long toWire() { return millis; }\n"
                + "  static Stamp fromWire(long millis) { return new Stamp(millis); }\n"
                + "}\n");

        assertTrue(result.success, result.errors.toString());
        String source = Files.readString(work.resolve("generated/demo/StampWireCodec.java"), StandardCharsets.UTF_8);
        assertTrue(source.contains("Codecs.<demo.Stamp, java.lang.Long>via(TYPE_NAME"), source);
        assertFalse(source.contains("DISCRIMINANT"), source);
    }

    @Test
    void rejectsViaCombinedWithAsString()
    {
        assertError("via and asString",
                "package demo;\n"
                + "import com.questrail.protowire.codegen.WireType;\n"
                + "@WireType(via = String.class, asString = true) public class Both {}\n",
                "via and asString cannot be combined");
    }

    @Test
    void rejectsViaWithoutFromWire()
    {
        assertError("fromWire",
                "package demo;\n"
                + "import com.questrail.protowire.codegen.WireType;\n"
                + "@WireType(via = long.class) public class OneWay {\n"
                + "  long toWire() { return 0L; }\n"
                + "}\n",
                "needs a non-private static method OneWay fromWire(long)");
    }

    @Test
    void rejectsAsStringWithoutParser()
    {
        assertError("parser",
                "package demo;\n"
                + "import com.questrail.protowire.codegen.WireType;\n"
                + "@WireType(asString = true) public class Opaque {}\n",
                "needs a non-private static fromString, parse or valueOf");
    }

    @Test
    void rejectsGenericProxyTypes()
    {
        assertError("generic proxy",
                "package demo;\n"
                + "import com.questrail.protowire.codegen.WireType;\n"
                + "@WireType(asString = true) public class Tagged<T> {\n"
                + "  public static Tagged<String> parse(String text) { return new Tagged<>(); }\n"
                + "}\n",
                "non-generic types only");
    }

    // ---------------------------------------------------------------------
    // Helpers
    // ---------------------------------------------------------------------

    private void assertError(String label, String source, String expectedMessage)
    {
        String className = "demo." + source.replaceAll("(?s).*public (?:sealed )?(?:class|record|interface|enum) (\\w+).*", "$1");
        Result result;
        try {
            result = compile(className, source);
        }
        catch (IOException e) {
            throw new AssertionError(label + ": cannot run compiler", e);
        }
        assertFalse(result.success, label + ": compilation should fail");
        assertTrue(result.errors.stream().anyMatch(m -> m.contains(expectedMessage)),
                label + ": expected '" + expectedMessage + "' in " + result.errors);
    }

    private Result compile(String className, String source) throws IOException
    {
        JavaCompiler compiler = ToolProvider.getSystemJavaCompiler();
        assertNotNull(compiler, "tests need a JDK, not a JRE");

        Path classes = Files.createDirectories(work.resolve("classes"));
        Path generated = Files.createDirectories(work.resolve("generated"));
        List<String> options = List.of(
                "-classpath", location(WireType.class) + File.pathSeparator + location(ByteBuf.class),
                "-d", classes.toString(),
                "-s", generated.toString());

        DiagnosticCollector<JavaFileObject> diagnostics = new DiagnosticCollector<>();
        try (StandardJavaFileManager files = compiler.getStandardFileManager(diagnostics, Locale.ROOT, StandardCharsets.UTF_8)) {
            JavaCompiler.CompilationTask task = compiler.getTask(null, files, diagnostics, options, null,
                    List.of(new StringSource(className, source)));
            task.setProcessors(List.of(new WireCodecProcessor()));
            boolean success = task.call();

            List<String> errors = new ArrayList<>();
            for (Diagnostic<? extends JavaFileObject> d : diagnostics.getDiagnostics()) {
                if (d.getKind() == Diagnostic.Kind.ERROR) {
                    errors.add(d.getMessage(Locale.ROOT));
                }
            }
            return new Result(success, errors);
        }
    }

    private static String location(Class<?> type)
    {
        try {
            return Path.of(type.getProtectionDomain().getCodeSource().getLocation().toURI()).toString();
        }
        catch (URISyntaxException e) {
            throw new IllegalStateException(e);
        }
    }

    private static final class Result
    {
        final boolean success;
        final List<String> errors;

        Result(boolean success, List<String> errors)
        {
            this.success = success;
            this.errors = errors;
        }
    }

    private static final class StringSource extends SimpleJavaFileObject
    {
        private final String code;

        StringSource(String className, String code)
        {
            super(URI.create("string:///" + className.replace('.', '/') + Kind.SOURCE.extension), Kind.SOURCE);
            this.code = code;
        }

        @Override
        public CharSequence getCharContent(boolean ignoreEncodingErrors)
        {
            return code;
        }
    }
}
