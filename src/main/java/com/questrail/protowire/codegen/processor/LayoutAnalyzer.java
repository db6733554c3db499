package com.questrail.protowire.codegen.processor;

import com.questrail.protowire.codegen.WireFixedLength;
import com.questrail.protowire.codegen.WireMaxLength;
import com.questrail.protowire.codegen.WireSkip;
import com.questrail.protowire.codegen.WireType;
import com.questrail.protowire.codegen.WireVariant;
import com.questrail.protowire.codegen.support.Discriminant;

import javax.annotation.processing.ProcessingEnvironment;
import javax.lang.model.element.AnnotationMirror;
import javax.lang.model.element.AnnotationValue;
import javax.lang.model.element.Element;
import javax.lang.model.element.ElementKind;
import javax.lang.model.element.ExecutableElement;
import javax.lang.model.element.Modifier;
import javax.lang.model.element.RecordComponentElement;
import javax.lang.model.element.TypeElement;
import javax.lang.model.element.TypeParameterElement;
import javax.lang.model.element.VariableElement;
import javax.lang.model.type.DeclaredType;
import javax.lang.model.type.ExecutableType;
import javax.lang.model.type.TypeKind;
import javax.lang.model.type.TypeMirror;
import javax.lang.model.util.ElementFilter;
import javax.lang.model.util.Elements;
import javax.lang.model.util.Types;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * LayoutAnalyzer
 * -----------------------------------------------------------------------------
 * Derives the {@link TypeLayout} of a {@code @WireType} and rejects types that
 * cannot be encoded, with a compile error on the offending element.
 *
 * <h2>Rules</h2>
 * <ul>
 *   <li>Records: components in declaration order.</li>
 *   <li>Sealed interfaces: every permitted subtype must be a record that
 *       implements the interface directly. Its type parameters must map one to
 *       one onto the interface's, so its components can be typed in the
 *       interface's type variables.</li>
 *   <li>Enums: constants in declaration order.</li>
 *   <li>Discriminants default to the declaration index; {@link WireVariant}
 *       overrides must be in {@code [0, 2^32)} and unique.</li>
 *   <li>Proxy encodings ({@code via}, {@code asString}): one or the other, on a
 *       non-generic type declaring the conversion methods.</li>
 * </ul>
 */
final class LayoutAnalyzer
{
    private final Elements elements;
    private final Types types;
    private final FieldCodecResolver resolver;

    LayoutAnalyzer(ProcessingEnvironment env)
    {
        this.elements = env.getElementUtils();
        this.types = env.getTypeUtils();
        this.resolver = new FieldCodecResolver(env);
    }

    TypeLayout analyze(TypeElement type)
    {
        checkAccessible(type);
        AnnotationMirror wireType = wireType(type);
        TypeMirror via = (TypeMirror) value(wireType, "via");
        boolean asString = (Boolean) value(wireType, "asString");
        if (via.getKind() != TypeKind.VOID || asString) {
            return proxy(type, via.getKind() == TypeKind.VOID ? null : via, asString);
        }
        switch (type.getKind()) {
            case RECORD:
                return record(type);
            case ENUM:
                return enumeration(type);
            case INTERFACE:
                if (type.getModifiers().contains(Modifier.SEALED)) {
                    return union(type);
                }
                break;
            default:
                break;
        }
        throw new LayoutException(type, "@WireType applies to records, sealed interfaces and enums");
    }

    private TypeLayout proxy(TypeElement type, TypeMirror via, boolean asString)
    {
        if (via != null && asString) {
            throw new LayoutException(type, "@WireType via and asString cannot be combined");
        }
        if (!type.getTypeParameters().isEmpty()) {
            throw new LayoutException(type, "@WireType via and asString apply to non-generic types only");
        }
        String self = type.getQualifiedName().toString();
        String conversion;
        if (asString) {
            ExecutableElement parse = parser(type);
            conversion = "Codecs.<" + self + ">asString(TYPE_NAME, " + self + "::" + parse.getSimpleName() + ")";
        }
        else {
            if (types.isSameType(via, type.asType())) {
                throw new LayoutException(type, type.getSimpleName() + " cannot be its own proxy");
            }
            checkToWire(type, via);
            checkFromWire(type, via);
            String proxyCodec = resolver.resolve(via, type, scope(type), null, null);
            String proxyType = resolver.boxed(via);
            conversion = "Codecs.<" + self + ", " + proxyType + ">via(TYPE_NAME, CodecCasts.<" + proxyType + ">adapt("
                    + proxyCodec + "), value -> value.toWire(), " + self + "::fromWire)";
        }
        return layout(TypeLayout.Kind.PROXY, type, List.of(), List.of(), 0, conversion);
    }

    private ExecutableElement parser(TypeElement type)
    {
        for (String name : List.of("fromString", "parse", "valueOf")) {
            for (ExecutableElement method : ElementFilter.methodsIn(type.getEnclosedElements())) {
                if (method.getSimpleName().contentEquals(name)
                        && isStaticVisible(method)
                        && method.getParameters().size() == 1
                        && isString(method.getParameters().get(0).asType())
                        && types.isAssignable(method.getReturnType(), type.asType())) {
                    return method;
                }
            }
        }
        throw new LayoutException(type, "@WireType(asString = true) needs a non-private static fromString, parse or valueOf"
                + " method taking a String and returning " + type.getSimpleName());
    }

    private void checkToWire(TypeElement type, TypeMirror via)
    {
        for (ExecutableElement method : ElementFilter.methodsIn(elements.getAllMembers(type))) {
            if (method.getSimpleName().contentEquals("toWire")
                    && method.getParameters().isEmpty()
                    && !method.getModifiers().contains(Modifier.STATIC)
                    && !method.getModifiers().contains(Modifier.PRIVATE)
                    && types.isAssignable(method.getReturnType(), via)) {
                return;
            }
        }
        throw new LayoutException(type, "@WireType(via = " + via + ") needs a non-private instance method "
                + via + " toWire()");
    }

    private void checkFromWire(TypeElement type, TypeMirror via)
    {
        for (ExecutableElement method : ElementFilter.methodsIn(type.getEnclosedElements())) {
            if (method.getSimpleName().contentEquals("fromWire")
                    && isStaticVisible(method)
                    && method.getParameters().size() == 1
                    && types.isAssignable(via, method.getParameters().get(0).asType())
                    && types.isAssignable(method.getReturnType(), type.asType())) {
                return;
            }
        }
        throw new LayoutException(type, "@WireType(via = " + via + ") needs a non-private static method "
                + type.getSimpleName() + " fromWire(" + via + ")");
    }

    private static boolean isStaticVisible(ExecutableElement method)
    {
        return method.getModifiers().contains(Modifier.STATIC) && !method.getModifiers().contains(Modifier.PRIVATE);
    }

    private static boolean isString(TypeMirror type)
    {
        return type.getKind() == TypeKind.DECLARED
                && ((TypeElement) ((DeclaredType) type).asElement()).getQualifiedName().contentEquals("java.lang.String");
    }

    private static AnnotationMirror wireType(TypeElement type)
    {
        for (AnnotationMirror mirror : type.getAnnotationMirrors()) {
            TypeElement annotation = (TypeElement) mirror.getAnnotationType().asElement();
            if (annotation.getQualifiedName().contentEquals(WireType.class.getName())) {
                return mirror;
            }
        }
        throw new IllegalStateException(type + " is not annotated with @WireType");
    }

    // Class-valued members cannot be read through getAnnotation() at compile time.
    private Object value(AnnotationMirror mirror, String member)
    {
        for (Map.Entry<? extends ExecutableElement, ? extends AnnotationValue> entry
                : elements.getElementValuesWithDefaults(mirror).entrySet()) {
            if (entry.getKey().getSimpleName().contentEquals(member)) {
                return entry.getValue().getValue();
            }
        }
        throw new IllegalStateException("@WireType has no member " + member);
    }

    private TypeLayout record(TypeElement type)
    {
        FieldCodecResolver.Scope scope = scope(type);
        List<TypeLayout.Field> fields = fields(type, (DeclaredType) type.asType(), null, scope);
        return layout(TypeLayout.Kind.RECORD, type, fields, List.of(), 0, null);
    }

    private TypeLayout enumeration(TypeElement type)
    {
        List<TypeLayout.Variant> variants = new ArrayList<>();
        Map<Long, String> taken = new HashMap<>();
        long index = 0;
        for (VariableElement constant : ElementFilter.fieldsIn(type.getEnclosedElements())) {
            if (constant.getKind() != ElementKind.ENUM_CONSTANT) {
                continue;
            }
            String name = constant.getSimpleName().toString();
            long discriminant = discriminant(constant, index++, name, taken);
            variants.add(new TypeLayout.Variant(name, discriminant,
                    type.getQualifiedName() + "." + name, false, List.of()));
        }
        return layout(TypeLayout.Kind.ENUM, type, List.of(), variants, width(variants), null);
    }

    private TypeLayout union(TypeElement type)
    {
        FieldCodecResolver.Scope scope = scope(type);
        List<TypeLayout.Variant> variants = new ArrayList<>();
        Map<Long, String> taken = new HashMap<>();
        long index = 0;
        for (TypeMirror permitted : type.getPermittedSubclasses()) {
            TypeElement arm = (TypeElement) types.asElement(permitted);
            if (arm.getKind() != ElementKind.RECORD) {
                throw new LayoutException(arm, "permitted subtype " + arm.getSimpleName() + " of "
                        + type.getSimpleName() + " must be a record to be a wire variant");
            }
            checkAccessible(arm);
            String name = arm.getSimpleName().toString();
            long discriminant = discriminant(arm, index++, name, taken);

            DeclaredType armType = armTypeIn(type, arm);
            boolean upcast = !types.isSubtype(armType, type.asType());
            List<TypeLayout.Field> fields = fields(arm, armType, name, scope);
            variants.add(new TypeLayout.Variant(name, discriminant, armType.toString(), upcast, fields));
        }
        return layout(TypeLayout.Kind.UNION, type, List.of(), variants, width(variants), null);
    }

    /**
     * The arm's type with its type variables replaced by the union's, e.g.
     * {@code Left<L, R>} for {@code record Left<A, B>(A value) implements Either<A, B>}.
     */
    private DeclaredType armTypeIn(TypeElement union, TypeElement arm)
    {
        if (arm.getTypeParameters().isEmpty()) {
            return (DeclaredType) arm.asType();
        }
        DeclaredType supertype = null;
        for (TypeMirror candidate : arm.getInterfaces()) {
            if (types.isSameType(types.erasure(candidate), types.erasure(union.asType()))) {
                supertype = (DeclaredType) candidate;
            }
        }
        if (supertype == null) {
            throw new LayoutException(arm, arm.getSimpleName() + " must implement " + union.getSimpleName()
                    + " directly to be a generic wire variant");
        }

        Map<TypeParameterElement, TypeMirror> mapping = new LinkedHashMap<>();
        List<? extends TypeMirror> arguments = supertype.getTypeArguments();
        for (int i = 0; i < arguments.size(); i++) {
            TypeMirror argument = arguments.get(i);
            if (argument.getKind() == TypeKind.TYPEVAR) {
                Element variable = types.asElement(argument);
                if (variable instanceof TypeParameterElement parameter && parameter.getGenericElement().equals(arm)) {
                    mapping.putIfAbsent(parameter, union.getTypeParameters().get(i).asType());
                }
            }
        }
        TypeMirror[] armArguments = new TypeMirror[arm.getTypeParameters().size()];
        for (int i = 0; i < armArguments.length; i++) {
            TypeParameterElement parameter = arm.getTypeParameters().get(i);
            armArguments[i] = mapping.get(parameter);
            if (armArguments[i] == null) {
                throw new LayoutException(parameter, "type parameter " + parameter.getSimpleName() + " of "
                        + arm.getSimpleName() + " is not passed on to " + union.getSimpleName());
            }
        }
        return types.getDeclaredType(arm, armArguments);
    }

    private List<TypeLayout.Field> fields(TypeElement record, DeclaredType recordType, String arm,
                                          FieldCodecResolver.Scope scope)
    {
        List<TypeLayout.Field> fields = new ArrayList<>();
        for (RecordComponentElement component : record.getRecordComponents()) {
            String name = component.getSimpleName().toString();
            ExecutableType accessor = (ExecutableType) types.asMemberOf(recordType, component.getAccessor());
            TypeMirror type = accessor.getReturnType();
            String valueType = resolver.boxed(type);

            WireSkip skip = component.getAnnotation(WireSkip.class);
            if (skip != null) {
                fields.add(new TypeLayout.Field(name, null, null, valueType, skipDefault(record, component, type, skip)));
                continue;
            }
            WireMaxLength maxLength = component.getAnnotation(WireMaxLength.class);
            WireFixedLength fixedLength = component.getAnnotation(WireFixedLength.class);
            String codec = resolver.resolve(type, component, scope,
                    maxLength == null ? null : maxLength.value(),
                    fixedLength == null ? null : fixedLength.value());
            fields.add(new TypeLayout.Field(name, CodecNames.codecField(arm, name), codec, valueType, null));
        }
        return fields;
    }

    private String skipDefault(TypeElement record, RecordComponentElement component, TypeMirror type, WireSkip skip)
    {
        String factory = skip.defaultFactory();
        if (factory.isEmpty()) {
            return resolver.defaultValue(type);
        }
        for (ExecutableElement method : ElementFilter.methodsIn(record.getEnclosedElements())) {
            if (method.getSimpleName().contentEquals(factory)
                    && method.getParameters().isEmpty()
                    && method.getModifiers().contains(Modifier.STATIC)
                    && !method.getModifiers().contains(Modifier.PRIVATE)) {
                return record.getQualifiedName() + "." + factory + "()";
            }
        }
        throw new LayoutException(component, "@WireSkip default factory " + factory
                + "() must be a non-private static no-argument method of " + record.getSimpleName());
    }

    private long discriminant(Element variant, long index, String name, Map<Long, String> taken)
    {
        WireVariant override = variant.getAnnotation(WireVariant.class);
        long discriminant = override == null ? index : override.value();
        if (discriminant < 0 || discriminant > 0xFFFF_FFFFL) {
            throw new LayoutException(variant, "@WireVariant must be between 0 and 4294967295");
        }
        String previous = taken.putIfAbsent(discriminant, name);
        if (previous != null) {
            throw new LayoutException(variant, "discriminant " + discriminant + " of " + name
                    + " is already used by " + previous);
        }
        return discriminant;
    }

    private static int width(List<TypeLayout.Variant> variants)
    {
        long max = 0;
        for (TypeLayout.Variant variant : variants) {
            max = Math.max(max, variant.discriminant());
        }
        return Discriminant.forMax(max).width();
    }

    private FieldCodecResolver.Scope scope(TypeElement type)
    {
        Map<String, String> codecs = new LinkedHashMap<>();
        for (TypeParameterElement parameter : type.getTypeParameters()) {
            String name = parameter.getSimpleName().toString();
            codecs.put(name, CodecNames.typeVariableCodec(name));
        }
        return new FieldCodecResolver.Scope(type, codecs);
    }

    private TypeLayout layout(TypeLayout.Kind kind, TypeElement type, List<TypeLayout.Field> fields,
                              List<TypeLayout.Variant> variants, int discriminantWidth, String conversion)
    {
        List<String> declarations = new ArrayList<>();
        List<String> variables = new ArrayList<>();
        for (TypeParameterElement parameter : type.getTypeParameters()) {
            String name = parameter.getSimpleName().toString();
            variables.add(name);
            List<String> bounds = new ArrayList<>();
            for (TypeMirror bound : parameter.getBounds()) {
                if (!bound.toString().equals("java.lang.Object")) {
                    bounds.add(bound.toString());
                }
            }
            declarations.add(bounds.isEmpty() ? name : name + " extends " + String.join(" & ", bounds));
        }
        return new TypeLayout(kind, type,
                CodecNames.packageName(type, elements),
                CodecNames.simpleName(type),
                type.asType().toString(),
                type.getSimpleName().toString(),
                declarations, variables, fields, variants, discriminantWidth, conversion);
    }

    private static void checkAccessible(TypeElement type)
    {
        Element current = type;
        while (current instanceof TypeElement) {
            if (current.getModifiers().contains(Modifier.PRIVATE)) {
                throw new LayoutException(type, type.getSimpleName()
                        + " must not be private or nested in a private type to get a wire codec");
            }
            current = current.getEnclosingElement();
        }
    }
}
