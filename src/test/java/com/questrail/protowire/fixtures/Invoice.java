package com.questrail.protowire.fixtures;

import com.questrail.protowire.api.Tuple2;
import com.questrail.protowire.api.WireResult;
import com.questrail.protowire.codegen.WireType;

import java.math.BigInteger;
import java.time.Duration;
import java.util.Map;
import java.util.Set;
import java.util.SortedMap;

/** Exercises most component kinds the generator resolves. */
@WireType
public record Invoice(
    Money total,
    Person owner,
    Pair<String, Integer> line,
    Either<String, Long> reference,
    Map<String, Shape> shapes,
    SortedMap<Integer, Priority> priorities,
    Set<Toggle> toggles,
    Tuple2<Character, Float> mark,
    WireResult<BigInteger, String> audit,
    Duration term,
    byte[] signature,
    short revision,
    byte flags
) {}
