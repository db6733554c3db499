package com.questrail.protowire.codec.impl;

/**
 * Saturating arithmetic for {@code minEncodedSize()} lower bounds.
 */
public final class Sizes
{
    private Sizes() {}

    public static int sum(int... sizes)
    {
        long total = 0;
        for (int size : sizes) {
            total += size;
        }
        return (int) Math.min(total, Integer.MAX_VALUE);
    }

    public static int times(int count, int size)
    {
        return (int) Math.min((long) count * size, Integer.MAX_VALUE);
    }

    /**
     * Smallest of {@code sizes}, the lower bound of a choice between encodings.
     */
    public static int min(int... sizes)
    {
        int least = Integer.MAX_VALUE;
        for (int size : sizes) {
            least = Math.min(least, size);
        }
        return sizes.length == 0 ? 0 : least;
    }
}
