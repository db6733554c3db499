package com.questrail.protowire.fixtures;

import com.questrail.protowire.codegen.WireType;
import com.questrail.protowire.codegen.WireVariant;

/** Pinned discriminants; the largest needs two bytes. */
@WireType
public enum Priority
{
    @WireVariant(300) HIGH,
    @WireVariant(10) LOW,
    NORMAL
}
