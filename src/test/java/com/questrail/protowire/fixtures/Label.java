package com.questrail.protowire.fixtures;

import com.questrail.protowire.codegen.WireFixedLength;
import com.questrail.protowire.codegen.WireMaxLength;
import com.questrail.protowire.codegen.WireType;

import java.util.List;

@WireType
public record Label(
    @WireMaxLength(255) String text,
    @WireFixedLength(4) byte[] tag,
    @WireMaxLength(3) List<Integer> codes,
    @WireFixedLength(2) List<Short> pair
) {}
