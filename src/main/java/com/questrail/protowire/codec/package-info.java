/**
 * Wire Codec Core
 * =============================================================================
 *
 * <p>The built-in {@link com.questrail.protowire.api.WireCodec} implementations
 * for primitive and container values, reached through
 * {@link com.questrail.protowire.codec.Codecs}. Generated codecs for records,
 * sealed interfaces and enums are built from these.</p>
 *
 * <h2>Format version 1</h2>
 * <ul>
 *   <li>All integers are big-endian.</li>
 *   <li>Length Fields are unsigned 64-bit unless a maximum length narrows them.</li>
 *   <li>Option and result discriminants are one byte.</li>
 *   <li>There are no type tags, field names or padding.</li>
 * </ul>
 *
 * <p>Cross-version wire compatibility is not guaranteed. Iteration order of
 * hash-based containers is not canonical, so the same set may encode to
 * different bytes; it always decodes to an equal set.</p>
 *
 * <h2>Decoding discipline</h2>
 * <p>Every Length Field is charged against the
 * {@link com.questrail.protowire.budget.DecodeBudget} before anything sized by
 * it is allocated, and allocations go through
 * {@link com.questrail.protowire.budget.FallibleAllocation}.</p>
 */
package com.questrail.protowire.codec;
