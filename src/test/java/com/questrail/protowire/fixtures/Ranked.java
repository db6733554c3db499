package com.questrail.protowire.fixtures;

import com.questrail.protowire.codegen.WireType;

import java.util.NavigableSet;

/** Generic record with a bounded type parameter. */
@WireType
public record Ranked<T extends Comparable<T>>(T best, NavigableSet<T> all) {}
