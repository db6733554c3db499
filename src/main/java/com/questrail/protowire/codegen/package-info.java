/**
 * Code Generation Engine
 * =============================================================================
 *
 * <p>Annotations that drive {@code WireCodecProcessor}, the JSR-269 processor
 * that writes codecs for user-defined records, sealed interfaces and enums at
 * compile time.</p>
 *
 * <h2>Layout rules</h2>
 * <ul>
 *   <li>Field order on the wire is component declaration order. Reordering
 *       components changes the format.</li>
 *   <li>Union discriminants are the 0-based declaration index unless pinned
 *       with {@link com.questrail.protowire.codegen.WireVariant}. Unknown
 *       discriminants fail decoding; there is no fallback variant.</li>
 *   <li>Generic types require a codec for each type argument, so a
 *       {@code Pair<A>} codec exists only where one for {@code A} does. javac
 *       checks this where the generated constructor is called.</li>
 *   <li>Recursive types are allowed; their depth at run time is limited by the
 *       decode budget.</li>
 *   <li>{@code @WireType(via = ...)} and {@code @WireType(asString = true)}
 *       borrow the wire format of a proxy type or of {@code String}.</li>
 * </ul>
 *
 * <h2>Build setup</h2>
 * <p>The processor is registered through
 * {@code META-INF/services/javax.annotation.processing.Processor} and runs
 * wherever this artifact is on the annotation processor path.</p>
 */
package com.questrail.protowire.codegen;
