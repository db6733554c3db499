/**
 * Runtime helpers called by codecs that {@code WireCodecProcessor} generates.
 * Not intended for hand-written code.
 */
package com.questrail.protowire.codegen.support;
