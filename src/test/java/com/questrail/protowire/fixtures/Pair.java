package com.questrail.protowire.fixtures;

import com.questrail.protowire.codegen.WireType;

@WireType
public record Pair<A, B>(A first, B second) {}
