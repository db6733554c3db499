package com.questrail.protowire.fixtures;

import com.questrail.protowire.codegen.WireSkip;
import com.questrail.protowire.codegen.WireType;

import java.util.HashMap;
import java.util.Map;

@WireType
public record Session(
    long id,
    @WireSkip(defaultFactory = "freshCache") Map<String, Integer> cache,
    @WireSkip int hits,
    boolean active
) {
    static Map<String, Integer> freshCache()
    {
        Map<String, Integer> cache = new HashMap<>();
        cache.put("fresh", 1);
        return cache;
    }
}
