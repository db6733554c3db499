package com.questrail.protowire.codegen.processor;

import java.util.ArrayList;
import java.util.List;

/**
 * CodecSourceWriter
 * -----------------------------------------------------------------------------
 * Renders the Java source of the codec for a {@link TypeLayout}.
 *
 * <h2>Shape of the output</h2>
 * <ul>
 *   <li>One {@code final} codec field per encoded component, typed with the
 *       component's boxed type and built in the constructor.</li>
 *   <li>{@code write}: discriminant (unions, enums), then each component's
 *       codec in declaration order.</li>
 *   <li>{@code read}: one nesting level on the budget, discriminant, then the
 *       components in the same order into slots, then the canonical
 *       constructor.</li>
 *   <li>Proxy encodings delegate both directions to a converting codec.</li>
 * </ul>
 *
 * <p>Field references are always qualified with {@code this.} so component
 * names cannot clash with method parameters.</p>
 */
final class CodecSourceWriter
{
    private static final String PROCESSOR = WireCodecProcessor.class.getName();

    private final TypeLayout layout;
    private final StringBuilder out = new StringBuilder();
    private int indent;

    CodecSourceWriter(TypeLayout layout)
    {
        this.layout = layout;
    }

    String render()
    {
        if (!layout.packageName().isEmpty()) {
            line("package " + layout.packageName() + ";");
            line("");
        }
        line("import com.questrail.protowire.api.WireCodec;");
        line("import com.questrail.protowire.api.WireDecodeException;");
        line("import com.questrail.protowire.api.WireErrorKind;");
        line("import com.questrail.protowire.budget.DecodeBudget;");
        line("import com.questrail.protowire.codec.Codecs;");
        line("import com.questrail.protowire.codec.impl.Sizes;");
        line("import com.questrail.protowire.codegen.support.CodecCasts;");
        line("import com.questrail.protowire.codegen.support.Discriminant;");
        line("import com.questrail.protowire.codegen.support.FieldSequence;");
        line("import com.questrail.protowire.codegen.support.MinEncodedSize;");
        line("import com.questrail.protowire.internal.async.Futures;");
        line("import com.questrail.protowire.transport.WireReader;");
        line("import com.questrail.protowire.transport.WireWriter;");
        line("");
        line("import java.util.concurrent.CompletableFuture;");
        line("");
        line("@javax.annotation.processing.Generated(\"" + PROCESSOR + "\")");
        line("@SuppressWarnings(\"all\")");
        String parameters = layout.generic() ? "<" + String.join(", ", layout.typeParameters()) + ">" : "";
        open("public final class " + layout.codecName() + parameters + " implements WireCodec<" + layout.typeText() + ">");

        if (!layout.generic()) {
            line("public static final " + layout.codecName() + " INSTANCE = new " + layout.codecName() + "();");
            line("");
        }
        line("private static final String TYPE_NAME = \"" + layout.typeName() + "\";");
        if (layout.kind() == TypeLayout.Kind.UNION || layout.kind() == TypeLayout.Kind.ENUM) {
            line("private static final Discriminant DISCRIMINANT = new Discriminant(" + layout.discriminantWidth() + ");");
        }
        line("");
        for (TypeLayout.Field field : encodedFields()) {
            line("private final WireCodec<" + field.valueType() + "> " + field.codecField() + ";");
        }
        if (layout.kind() == TypeLayout.Kind.PROXY) {
            line("private final WireCodec<" + layout.typeText() + "> conversion;");
        }
        line("private final MinEncodedSize minEncodedSize;");
        line("");

        constructor();
        switch (layout.kind()) {
            case RECORD:
                recordWrite();
                recordRead();
                break;
            case UNION:
                unionWrite();
                unionRead();
                break;
            case ENUM:
                enumWrite();
                enumRead();
                break;
            case PROXY:
                proxyWrite();
                proxyRead();
                break;
        }
        line("@Override");
        open("public int minEncodedSize()");
        line("return this.minEncodedSize.get();");
        close("");
        line("@Override");
        open("public String typeName()");
        line("return TYPE_NAME;");
        close("");
        close("");
        return out.toString();
    }

    private void constructor()
    {
        List<String> parameters = new ArrayList<>();
        for (String variable : layout.typeVariables()) {
            parameters.add("WireCodec<" + variable + "> " + CodecNames.typeVariableCodec(variable));
        }
        open("public " + layout.codecName() + "(" + String.join(", ", parameters) + ")");
        for (String variable : layout.typeVariables()) {
            String codec = CodecNames.typeVariableCodec(variable);
            line("java.util.Objects.requireNonNull(" + codec + ", \"" + codec + "\");");
        }
        for (TypeLayout.Field field : encodedFields()) {
            line("this." + field.codecField() + " = CodecCasts.adapt(" + field.codecExpr() + ");");
        }
        if (layout.kind() == TypeLayout.Kind.PROXY) {
            line("this.conversion = " + layout.conversion() + ";");
        }
        line("this.minEncodedSize = new MinEncodedSize(() -> " + minSizeExpression() + ");");
        close("");
    }

    private String minSizeExpression()
    {
        switch (layout.kind()) {
            case RECORD:
                return sizeSum(layout.fields());
            case UNION:
                List<String> arms = new ArrayList<>();
                for (TypeLayout.Variant variant : layout.variants()) {
                    arms.add(sizeSum(variant.fields()));
                }
                return "Sizes.sum(DISCRIMINANT.width(), Sizes.min(" + String.join(", ", arms) + "))";
            case PROXY:
                return "this.conversion.minEncodedSize()";
            default:
                return layout.variants().isEmpty() ? "0" : "DISCRIMINANT.width()";
        }
    }

    private static String sizeSum(List<TypeLayout.Field> fields)
    {
        List<String> sizes = new ArrayList<>();
        for (TypeLayout.Field field : fields) {
            if (!field.skipped()) {
                sizes.add("this." + field.codecField() + ".minEncodedSize()");
            }
        }
        return "Sizes.sum(" + String.join(", ", sizes) + ")";
    }

    private void recordWrite()
    {
        line("@Override");
        open("public CompletableFuture<Void> write(" + layout.typeText() + " value, WireWriter out)");
        line("return Futures.call(() -> FieldSequence.writer(out)");
        indent += 2;
        writeFields(layout.fields(), "value");
        line(".end());");
        indent -= 2;
        close("");
    }

    private void recordRead()
    {
        line("@Override");
        open("public CompletableFuture<" + layout.typeText() + "> read(WireReader in, DecodeBudget budget)");
        line("return FieldSequence.nested(budget, TYPE_NAME, () -> FieldSequence.reader(in, budget, "
                + layout.fields().size() + ")");
        indent += 2;
        readFields(layout.fields());
        line(".<" + layout.typeText() + ">build(slots -> " + construct(layout.typeText(), layout.fields(), false) + "));");
        indent -= 2;
        close("");
    }

    private void unionWrite()
    {
        line("@Override");
        open("public CompletableFuture<Void> write(" + layout.typeText() + " value, WireWriter out)");
        for (TypeLayout.Variant variant : layout.variants()) {
            String erased = erasure(variant.reference());
            open("if (value instanceof " + erased + ")");
            line(variant.reference() + " arm = (" + variant.reference() + ") (Object) value;");
            line("return FieldSequence.variant(\"" + variant.name() + "\", Futures.call(() -> FieldSequence.writer(out)");
            indent += 2;
            line(".raw(DISCRIMINANT.encode(" + variant.discriminant() + "L))");
            writeFields(variant.fields(), "arm");
            line(".end()));");
            indent -= 2;
            close("");
        }
        line("return Futures.failed(new IllegalArgumentException(\"not a \" + TYPE_NAME + \" variant: \" + value));");
        close("");
    }

    private void unionRead()
    {
        line("@Override");
        open("public CompletableFuture<" + layout.typeText() + "> read(WireReader in, DecodeBudget budget)");
        line("return FieldSequence.nested(budget, TYPE_NAME, () -> DISCRIMINANT.read(in).thenCompose(d -> {");
        indent++;
        for (TypeLayout.Variant variant : layout.variants()) {
            open("if (d == " + variant.discriminant() + "L)");
            line("return FieldSequence.<" + layout.typeText() + ">variant(\"" + variant.name()
                    + "\", FieldSequence.reader(in, budget, " + variant.fields().size() + ")");
            indent += 2;
            readFields(variant.fields());
            line(".<" + layout.typeText() + ">build(slots -> "
                    + construct(variant.reference(), variant.fields(), variant.upcast()) + "));");
            indent -= 2;
            close(null);
        }
        line("throw WireDecodeException.unknownVariant(d, TYPE_NAME);");
        indent--;
        line("}));");
        close("");
    }

    private void enumWrite()
    {
        line("@Override");
        open("public CompletableFuture<Void> write(" + layout.typeText() + " value, WireWriter out)");
        for (TypeLayout.Variant variant : layout.variants()) {
            open("if (value == " + variant.reference() + ")");
            line("return out.writeAll(DISCRIMINANT.encode(" + variant.discriminant() + "L));");
            close(null);
        }
        line("return Futures.failed(new IllegalArgumentException(\"not a \" + TYPE_NAME + \" constant: \" + value));");
        close("");
    }

    private void enumRead()
    {
        line("@Override");
        open("public CompletableFuture<" + layout.typeText() + "> read(WireReader in, DecodeBudget budget)");
        if (layout.variants().isEmpty()) {
            line("return Futures.failed(new WireDecodeException(WireErrorKind.EMPTY_TYPE, TYPE_NAME + \" has no values to decode\"));");
            close("");
            return;
        }
        line("return FieldSequence.nested(budget, TYPE_NAME, () -> DISCRIMINANT.read(in).thenApply(d -> {");
        indent++;
        for (TypeLayout.Variant variant : layout.variants()) {
            open("if (d == " + variant.discriminant() + "L)");
            line("return " + variant.reference() + ";");
            close(null);
        }
        line("throw WireDecodeException.unknownVariant(d, TYPE_NAME);");
        indent--;
        line("}));");
        close("");
    }

    private void proxyWrite()
    {
        line("@Override");
        open("public CompletableFuture<Void> write(" + layout.typeText() + " value, WireWriter out)");
        line("return this.conversion.write(value, out);");
        close("");
    }

    private void proxyRead()
    {
        line("@Override");
        open("public CompletableFuture<" + layout.typeText() + "> read(WireReader in, DecodeBudget budget)");
        line("return this.conversion.read(in, budget);");
        close("");
    }

    private void writeFields(List<TypeLayout.Field> fields, String owner)
    {
        for (TypeLayout.Field field : fields) {
            if (!field.skipped()) {
                line(".field(\"" + field.name() + "\", this." + field.codecField() + ", " + owner + "." + field.name() + "())");
            }
        }
    }

    private void readFields(List<TypeLayout.Field> fields)
    {
        for (int slot = 0; slot < fields.size(); slot++) {
            TypeLayout.Field field = fields.get(slot);
            if (!field.skipped()) {
                line(".field(" + slot + ", \"" + field.name() + "\", this." + field.codecField() + ")");
            }
        }
    }

    private String construct(String type, List<TypeLayout.Field> fields, boolean upcast)
    {
        List<String> arguments = new ArrayList<>();
        for (int slot = 0; slot < fields.size(); slot++) {
            TypeLayout.Field field = fields.get(slot);
            arguments.add(field.skipped() ? field.defaultExpr() : "(" + field.valueType() + ") slots[" + slot + "]");
        }
        String construction = "new " + type + "(" + String.join(", ", arguments) + ")";
        return upcast ? "(" + layout.typeText() + ") (Object) " + construction : construction;
    }

    private static String erasure(String type)
    {
        int generic = type.indexOf('<');
        return generic < 0 ? type : type.substring(0, generic);
    }

    private List<TypeLayout.Field> encodedFields()
    {
        List<TypeLayout.Field> encoded = new ArrayList<>();
        for (TypeLayout.Field field : layout.fields()) {
            if (!field.skipped()) {
                encoded.add(field);
            }
        }
        for (TypeLayout.Variant variant : layout.variants()) {
            for (TypeLayout.Field field : variant.fields()) {
                if (!field.skipped()) {
                    encoded.add(field);
                }
            }
        }
        return encoded;
    }

    private void open(String header)
    {
        line(header);
        line("{");
        indent++;
    }

    // A null trailer closes without a blank line.
    private void close(String trailer)
    {
        indent--;
        line("}");
        if (trailer != null) {
            line(trailer);
        }
    }

    private void line(String text)
    {
        if (!text.isEmpty()) {
            out.append("    ".repeat(indent)).append(text);
        }
        out.append('\n');
    }
}
