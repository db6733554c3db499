package com.questrail.protowire.codegen.processor;

import com.questrail.protowire.codegen.WireType;

import javax.annotation.processing.AbstractProcessor;
import javax.annotation.processing.RoundEnvironment;
import javax.annotation.processing.SupportedAnnotationTypes;
import javax.lang.model.SourceVersion;
import javax.lang.model.element.Element;
import javax.lang.model.element.TypeElement;
import javax.tools.Diagnostic;
import javax.tools.JavaFileObject;
import java.io.IOException;
import java.io.Writer;
import java.util.Set;

/**
 * WireCodecProcessor
 * =============================================================================
 * Compile-time code generation engine for {@link WireType} types.
 *
 * <h2>Architectural Role</h2>
 * For every annotated record, sealed interface or enum the processor emits one
 * codec class next to it. The generated code calls the built-in codecs and the
 * codecs of other annotated types directly; nothing is resolved by reflection
 * at run time.
 *
 * <h2>Errors</h2>
 * Types that cannot be encoded (unsupported component types, conflicting
 * discriminants, private types, ...) are reported as compile errors on the
 * offending element, and no codec is written for them.
 */
@SupportedAnnotationTypes("com.questrail.protowire.codegen.WireType")
public final class WireCodecProcessor extends AbstractProcessor
{
    @Override
    public SourceVersion getSupportedSourceVersion()
    {
        return SourceVersion.latestSupported();
    }

    @Override
    public boolean process(Set<? extends TypeElement> annotations, RoundEnvironment round)
    {
        LayoutAnalyzer analyzer = new LayoutAnalyzer(processingEnv);
        for (Element element : round.getElementsAnnotatedWith(WireType.class)) {
            if (!(element instanceof TypeElement)) {
                continue;
            }
            TypeElement type = (TypeElement) element;
            try {
                write(analyzer.analyze(type));
            }
            catch (LayoutException e) {
                processingEnv.getMessager().printMessage(Diagnostic.Kind.ERROR, e.getMessage(), e.element());
            }
        }
        return true;
    }

    private void write(TypeLayout layout)
    {
        String source = new CodecSourceWriter(layout).render();
        try {
            JavaFileObject file = processingEnv.getFiler().createSourceFile(layout.qualifiedCodecName(), layout.element());
            try (Writer writer = file.openWriter()) {
                writer.write(source);
            }
        }
        catch (IOException e) {
            processingEnv.getMessager().printMessage(Diagnostic.Kind.ERROR,
                    "cannot write " + layout.qualifiedCodecName() + ": " + e.getMessage(), layout.element());
        }
    }
}
