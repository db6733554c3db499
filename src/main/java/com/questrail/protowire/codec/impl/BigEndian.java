package com.questrail.protowire.codec.impl;

/**
 * Big-endian (network order) integer packing, the byte order of format
 * version 1.
 */
public final class BigEndian
{
    private BigEndian() {}

    /**
     * @return the low {@code width} bytes of {@code value}, most significant first
     */
    public static byte[] encode(long value, int width)
    {
        byte[] out = new byte[width];
        for (int i = width - 1; i >= 0; i--) {
            out[i] = (byte) (value & 0xFF);
            value >>>= 8;
        }
        return out;
    }

    /**
     * Zero-extending decode. For eight bytes the result is the raw bit pattern,
     * so unsigned values above {@link Long#MAX_VALUE} come back negative.
     */
    public static long decodeUnsigned(byte[] bytes)
    {
        long value = 0;
        for (byte b : bytes) {
            value = (value << 8) | (b & 0xFF);
        }
        return value;
    }

    /**
     * Sign-extending decode of up to eight bytes.
     */
    public static long decodeSigned(byte[] bytes)
    {
        int shift = 64 - 8 * bytes.length;
        return (decodeUnsigned(bytes) << shift) >> shift;
    }
}
