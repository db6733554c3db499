package com.questrail.protowire.codegen.processor;

import com.questrail.protowire.codegen.WireType;

import javax.annotation.processing.ProcessingEnvironment;
import javax.lang.model.element.Element;
import javax.lang.model.element.ExecutableElement;
import javax.lang.model.element.Modifier;
import javax.lang.model.element.TypeElement;
import javax.lang.model.type.ArrayType;
import javax.lang.model.type.DeclaredType;
import javax.lang.model.type.TypeKind;
import javax.lang.model.type.TypeMirror;
import javax.lang.model.type.TypeVariable;
import javax.lang.model.type.WildcardType;
import javax.lang.model.util.ElementFilter;
import javax.lang.model.util.Elements;
import javax.lang.model.util.Types;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * FieldCodecResolver
 * -----------------------------------------------------------------------------
 * Turns the static type of a record component into a Java expression that
 * builds its codec.
 *
 * <h2>Resolution order</h2>
 * <ol>
 *   <li>Primitives, their boxes, {@code String}, {@code BigInteger},
 *       {@code Duration}, {@code byte[]}</li>
 *   <li>{@code Optional}, {@code WireResult}, tuples, lists, sets and maps,
 *       resolving their type arguments recursively</li>
 *   <li>Type variables of the generated codec: the constructor's codec argument</li>
 *   <li>Other {@code @WireType} types: their generated codec, behind a deferred
 *       reference. An exact self-reference is {@code this}</li>
 *   <li>Types with a {@code public static wireCodec()} method: that method</li>
 * </ol>
 *
 * <p>Anything else is a compile error naming the component.</p>
 */
final class FieldCodecResolver
{
    private static final Set<String> LENGTH_PREFIXED = Set.of(
            "java.lang.String",
            "java.util.List",
            "java.util.Set",
            "java.util.SortedSet",
            "java.util.NavigableSet",
            "java.util.Map",
            "java.util.SortedMap",
            "java.util.NavigableMap");

    /**
     * Codec scope of one generated class.
     *
     * @param self                the annotated type being generated
     * @param typeVariableCodecs  type variable name → codec expression
     */
    record Scope(TypeElement self, Map<String, String> typeVariableCodecs) {}

    private final Elements elements;
    private final Types types;

    FieldCodecResolver(ProcessingEnvironment env)
    {
        this.elements = env.getElementUtils();
        this.types = env.getTypeUtils();
    }

    /**
     * @param maxLength   {@code @WireMaxLength} value, or {@code null}
     * @param fixedLength {@code @WireFixedLength} value, or {@code null}
     */
    String resolve(TypeMirror type, Element component, Scope scope, Long maxLength, Integer fixedLength)
    {
        if (maxLength != null && fixedLength != null) {
            throw new LayoutException(component, "@WireMaxLength and @WireFixedLength cannot be combined");
        }
        if (fixedLength != null) {
            return fixed(type, component, scope, fixedLength);
        }
        String codec = resolve(type, component, scope);
        if (maxLength != null) {
            if (maxLength < 0) {
                throw new LayoutException(component, "@WireMaxLength must not be negative");
            }
            if (!isLengthPrefixed(type)) {
                throw new LayoutException(component,
                        "@WireMaxLength applies to String, byte[], List, Set and Map components, not " + type);
            }
            return codec + ".withMaxLength(" + maxLength + "L)";
        }
        return codec;
    }

    /**
     * Source text of {@code type} usable as a type argument: primitives are boxed.
     */
    String boxed(TypeMirror type)
    {
        if (type.getKind().isPrimitive()) {
            return types.boxedClass(types.getPrimitiveType(type.getKind())).getQualifiedName().toString();
        }
        return type.toString();
    }

    /**
     * Value a skipped component of {@code type} receives on decode.
     */
    String defaultValue(TypeMirror type)
    {
        switch (type.getKind()) {
            case BOOLEAN: return "false";
            case BYTE:    return "(byte) 0";
            case SHORT:   return "(short) 0";
            case INT:     return "0";
            case LONG:    return "0L";
            case CHAR:    return "'\\u0000'";
            case FLOAT:   return "0.0f";
            case DOUBLE:  return "0.0d";
            default:      break;
        }
        if (type.getKind() != TypeKind.DECLARED) {
            return "null";
        }
        switch (qualifiedName((DeclaredType) type)) {
            case "java.util.Optional":     return "java.util.Optional.empty()";
            case "java.util.List":
            case "java.util.Collection":   return "new java.util.ArrayList<>()";
            case "java.util.Set":          return "new java.util.HashSet<>()";
            case "java.util.SortedSet":
            case "java.util.NavigableSet": return "new java.util.TreeSet<>()";
            case "java.util.Map":          return "new java.util.HashMap<>()";
            case "java.util.SortedMap":
            case "java.util.NavigableMap": return "new java.util.TreeMap<>()";
            default:                       return "null";
        }
    }

    private String fixed(TypeMirror type, Element component, Scope scope, int length)
    {
        if (length < 0) {
            throw new LayoutException(component, "@WireFixedLength must not be negative");
        }
        if (isByteArray(type)) {
            return "Codecs.fixedBytes(" + length + ")";
        }
        if (type.getKind() == TypeKind.DECLARED && qualifiedName((DeclaredType) type).equals("java.util.List")) {
            return "Codecs.fixedArray(" + argument((DeclaredType) type, 0, component, scope) + ", " + length + ")";
        }
        throw new LayoutException(component, "@WireFixedLength applies to List and byte[] components, not " + type);
    }

    private String resolve(TypeMirror type, Element component, Scope scope)
    {
        switch (type.getKind()) {
            case BOOLEAN: return "Codecs.bool()";
            case BYTE:    return "Codecs.int8()";
            case SHORT:   return "Codecs.int16()";
            case INT:     return "Codecs.int32()";
            case LONG:    return "Codecs.int64()";
            case CHAR:    return "Codecs.char16()";
            case FLOAT:   return "Codecs.float32()";
            case DOUBLE:  return "Codecs.float64()";
            case ARRAY:
                if (isByteArray(type)) {
                    return "Codecs.bytes()";
                }
                throw new LayoutException(component, "arrays other than byte[] have no wire codec; use List for " + type);
            case TYPEVAR:
                return typeVariable((TypeVariable) type, component, scope);
            case WILDCARD:
                TypeMirror bound = ((WildcardType) type).getExtendsBound();
                if (bound == null) {
                    throw new LayoutException(component, "wildcard " + type + " needs an upper bound to be decoded");
                }
                return resolve(bound, component, scope);
            case DECLARED:
                return declared((DeclaredType) type, component, scope);
            default:
                throw unsupported(type, component);
        }
    }

    private String declared(DeclaredType type, Element component, Scope scope)
    {
        TypeElement element = (TypeElement) type.asElement();
        if (!element.getTypeParameters().isEmpty() && type.getTypeArguments().isEmpty()) {
            throw new LayoutException(component, "raw type " + type + " has no wire codec; add type arguments");
        }
        switch (element.getQualifiedName().toString()) {
            case "java.lang.Boolean":   return "Codecs.bool()";
            case "java.lang.Byte":      return "Codecs.int8()";
            case "java.lang.Short":     return "Codecs.int16()";
            case "java.lang.Integer":   return "Codecs.int32()";
            case "java.lang.Long":      return "Codecs.int64()";
            case "java.lang.Character": return "Codecs.char16()";
            case "java.lang.Float":     return "Codecs.float32()";
            case "java.lang.Double":    return "Codecs.float64()";
            case "java.lang.String":    return "Codecs.string()";
            case "java.math.BigInteger": return "Codecs.int128()";
            case "java.time.Duration":  return "Codecs.duration()";
            case "java.util.Optional":
                return "Codecs.optional(" + argument(type, 0, component, scope) + ")";
            case "com.questrail.protowire.api.WireResult":
                return "Codecs.result(" + arguments(type, component, scope) + ")";
            case "com.questrail.protowire.api.Tuple2":
                return "Codecs.tuple2(" + arguments(type, component, scope) + ")";
            case "com.questrail.protowire.api.Tuple3":
                return "Codecs.tuple3(" + arguments(type, component, scope) + ")";
            case "java.util.List":
                return "Codecs.list(" + argument(type, 0, component, scope) + ")";
            case "java.util.Set":
                return "Codecs.hashSet(" + argument(type, 0, component, scope) + ")";
            case "java.util.SortedSet":
            case "java.util.NavigableSet":
                return "Codecs.sortedSet(" + argument(type, 0, component, scope) + ")";
            case "java.util.Map":
                return "Codecs.hashMap(" + arguments(type, component, scope) + ")";
            case "java.util.SortedMap":
            case "java.util.NavigableMap":
                return "Codecs.sortedMap(" + arguments(type, component, scope) + ")";
            default:
                break;
        }
        if (element.getAnnotation(WireType.class) != null) {
            return generated(type, element, component, scope);
        }
        if (hasManualCodec(element)) {
            return element.getQualifiedName() + ".wireCodec()";
        }
        throw unsupported(type, component);
    }

    private String generated(DeclaredType type, TypeElement element, Element component, Scope scope)
    {
        if (element.equals(scope.self()) && isOwnTypeVariables(type, element)) {
            return "this";
        }
        String codecClass = CodecNames.qualifiedName(element, elements);
        if (element.getTypeParameters().isEmpty()) {
            return "FieldSequence.<" + type + ">deferred(() -> " + codecClass + ".INSTANCE)";
        }
        List<String> typeArguments = new ArrayList<>();
        List<String> codecArguments = new ArrayList<>();
        for (TypeMirror argument : type.getTypeArguments()) {
            if (argument.getKind() == TypeKind.WILDCARD) {
                throw new LayoutException(component,
                        "type arguments of " + element.getSimpleName() + " must not be wildcards: " + type);
            }
            typeArguments.add(argument.toString());
            codecArguments.add("CodecCasts.<" + argument + ">adapt(" + resolve(argument, component, scope) + ")");
        }
        return "FieldSequence.<" + type + ">deferred(() -> new " + codecClass
                + "<" + String.join(", ", typeArguments) + ">(" + String.join(", ", codecArguments) + "))";
    }

    private String typeVariable(TypeVariable type, Element component, Scope scope)
    {
        String name = type.asElement().getSimpleName().toString();
        String codec = scope.typeVariableCodecs().get(name);
        if (codec == null) {
            throw new LayoutException(component, "type variable " + name + " is not a type parameter of "
                    + scope.self().getSimpleName());
        }
        return codec;
    }

    private String argument(DeclaredType type, int index, Element component, Scope scope)
    {
        return resolve(type.getTypeArguments().get(index), component, scope);
    }

    private String arguments(DeclaredType type, Element component, Scope scope)
    {
        List<String> codecs = new ArrayList<>();
        for (TypeMirror argument : type.getTypeArguments()) {
            codecs.add(resolve(argument, component, scope));
        }
        return String.join(", ", codecs);
    }

    private boolean isOwnTypeVariables(DeclaredType type, TypeElement element)
    {
        List<? extends TypeMirror> arguments = type.getTypeArguments();
        for (int i = 0; i < arguments.size(); i++) {
            if (!types.isSameType(arguments.get(i), element.getTypeParameters().get(i).asType())) {
                return false;
            }
        }
        return true;
    }

    private boolean hasManualCodec(TypeElement element)
    {
        for (ExecutableElement method : ElementFilter.methodsIn(element.getEnclosedElements())) {
            if (method.getSimpleName().contentEquals("wireCodec")
                    && method.getParameters().isEmpty()
                    && method.getModifiers().contains(Modifier.STATIC)
                    && method.getModifiers().contains(Modifier.PUBLIC)) {
                return true;
            }
        }
        return false;
    }

    private boolean isLengthPrefixed(TypeMirror type)
    {
        if (isByteArray(type)) {
            return true;
        }
        return type.getKind() == TypeKind.DECLARED && LENGTH_PREFIXED.contains(qualifiedName((DeclaredType) type));
    }

    private static boolean isByteArray(TypeMirror type)
    {
        return type.getKind() == TypeKind.ARRAY
                && ((ArrayType) type).getComponentType().getKind() == TypeKind.BYTE;
    }

    private static String qualifiedName(DeclaredType type)
    {
        return ((TypeElement) type.asElement()).getQualifiedName().toString();
    }

    private static LayoutException unsupported(TypeMirror type, Element component)
    {
        return new LayoutException(component, component.getSimpleName() + ": no wire codec for " + type
                + "; annotate it with @WireType or give it a public static wireCodec() method");
    }
}
