package com.questrail.protowire.budget;

import com.questrail.protowire.api.WireDecodeException;
import com.questrail.protowire.api.WireErrorKind;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;

/**
 * FallibleAllocation
 * -----------------------------------------------------------------------------
 * Capacity allocation for the decode path that reports allocator refusal as a
 * recoverable {@link WireErrorKind#OVERSIZED_REQUEST} instead of letting an
 * {@link OutOfMemoryError} take down the process.
 *
 * <p>Sizes passed here have already been checked by
 * {@link DecodeBudget#reserve}. This is the second line: the budget may be
 * larger than the heap actually has to spare.</p>
 */
public final class FallibleAllocation
{
    /**
     * Largest capacity allocated up front for a container. Containers start no
     * larger than this and grow as elements actually arrive, so a Length Field
     * on a stream of unknown size costs nothing until its bytes are read.
     */
    public static final int MAX_INITIAL_CAPACITY = 1024;

    private FallibleAllocation() {}

    public static byte[] bytes(int length, String typeName)
    {
        try {
            return new byte[length];
        }
        catch (OutOfMemoryError e) {
            throw refused(typeName, length, e);
        }
    }

    public static <T> ArrayList<T> arrayList(int capacity, String typeName)
    {
        try {
            return new ArrayList<>(Math.min(capacity, MAX_INITIAL_CAPACITY));
        }
        catch (OutOfMemoryError e) {
            throw refused(typeName, capacity, e);
        }
    }

    public static <T> HashSet<T> hashSet(int expected, String typeName)
    {
        try {
            return new HashSet<>(hashCapacity(expected));
        }
        catch (OutOfMemoryError e) {
            throw refused(typeName, expected, e);
        }
    }

    public static <K, V> HashMap<K, V> hashMap(int expected, String typeName)
    {
        try {
            return new HashMap<>(hashCapacity(expected));
        }
        catch (OutOfMemoryError e) {
            throw refused(typeName, expected, e);
        }
    }

    // Table capacity that holds up to MAX_INITIAL_CAPACITY of the `expected` entries at the default load factor without rehashing.
    private static int hashCapacity(int expected)
    {
        return (int) Math.ceil(Math.min(expected, MAX_INITIAL_CAPACITY) / 0.75d);
    }

    private static WireDecodeException refused(String typeName, int size, OutOfMemoryError e)
    {
        return new WireDecodeException(WireErrorKind.OVERSIZED_REQUEST,
                "allocator refused capacity " + size + " for " + typeName, e);
    }
}
