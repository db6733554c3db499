package com.questrail.protowire.codec.impl;

import com.questrail.protowire.api.WireCodec;
import com.questrail.protowire.api.WireDecodeException;
import com.questrail.protowire.api.WireErrorKind;
import com.questrail.protowire.budget.DecodeBudget;
import com.questrail.protowire.internal.async.Futures;
import com.questrail.protowire.transport.WireReader;
import com.questrail.protowire.transport.WireWriter;

import java.math.BigInteger;
import java.util.Arrays;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.function.Function;

/**
 * FixedWidthCodec
 * -----------------------------------------------------------------------------
 * Codec for values whose encoding always has the same number of bytes:
 * booleans, integers, floats and UTF-16 code units.
 *
 * <p>A value is read with a single {@code readExact(width)}, so a stream that
 * ends part way through a value fails with end of stream and never yields a
 * partially assembled number.</p>
 */
public final class FixedWidthCodec<T> implements WireCodec<T>
{
    public static final FixedWidthCodec<Boolean> BOOL = new FixedWidthCodec<>("bool", 1,
            v -> new byte[] { (byte) (v ? 1 : 0) },
            FixedWidthCodec::decodeBoolean);

    public static final FixedWidthCodec<Byte> INT8 = new FixedWidthCodec<>("int8", 1,
            v -> new byte[] { v },
            b -> b[0]);

    public static final FixedWidthCodec<Short> INT16 = new FixedWidthCodec<>("int16", 2,
            v -> BigEndian.encode(v, 2),
            b -> (short) BigEndian.decodeSigned(b));

    public static final FixedWidthCodec<Integer> INT32 = new FixedWidthCodec<>("int32", 4,
            v -> BigEndian.encode(v, 4),
            b -> (int) BigEndian.decodeSigned(b));

    public static final FixedWidthCodec<Long> INT64 = new FixedWidthCodec<>("int64", 8,
            v -> BigEndian.encode(v, 8),
            BigEndian::decodeSigned);

    public static final FixedWidthCodec<Integer> UINT8 = new FixedWidthCodec<>("uint8", 1,
            v -> BigEndian.encode(checkUnsigned(v, 0xFFL, "uint8"), 1),
            b -> (int) BigEndian.decodeUnsigned(b));

    public static final FixedWidthCodec<Integer> UINT16 = new FixedWidthCodec<>("uint16", 2,
            v -> BigEndian.encode(checkUnsigned(v, 0xFFFFL, "uint16"), 2),
            b -> (int) BigEndian.decodeUnsigned(b));

    public static final FixedWidthCodec<Long> UINT32 = new FixedWidthCodec<>("uint32", 4,
            v -> BigEndian.encode(checkUnsigned(v, 0xFFFF_FFFFL, "uint32"), 4),
            BigEndian::decodeUnsigned);

    public static final FixedWidthCodec<Float> FLOAT32 = new FixedWidthCodec<>("float32", 4,
            v -> BigEndian.encode(Float.floatToRawIntBits(v), 4),
            b -> Float.intBitsToFloat((int) BigEndian.decodeUnsigned(b)));

    public static final FixedWidthCodec<Double> FLOAT64 = new FixedWidthCodec<>("float64", 8,
            v -> BigEndian.encode(Double.doubleToRawLongBits(v), 8),
            b -> Double.longBitsToDouble(BigEndian.decodeUnsigned(b)));

    public static final FixedWidthCodec<Character> CHAR16 = new FixedWidthCodec<>("char16", 2,
            v -> BigEndian.encode(v, 2),
            b -> (char) BigEndian.decodeUnsigned(b));

    // 16 bytes, two's complement
    public static final FixedWidthCodec<BigInteger> INT128 = new FixedWidthCodec<>("int128", 16,
            FixedWidthCodec::encodeInt128,
            BigInteger::new);

    private final String typeName;
    private final int width;
    private final Function<T, byte[]> encoder;
    private final Function<byte[], T> decoder;

    private FixedWidthCodec(String typeName, int width, Function<T, byte[]> encoder, Function<byte[], T> decoder)
    {
        this.typeName = typeName;
        this.width = width;
        this.encoder = encoder;
        this.decoder = decoder;
    }

    @Override
    public CompletableFuture<Void> write(T value, WireWriter out)
    {
        return Futures.call(() -> out.writeAll(encoder.apply(Objects.requireNonNull(value, typeName))));
    }

    @Override
    public CompletableFuture<T> read(WireReader in, DecodeBudget budget)
    {
        return Futures.call(() -> in.readExact(width).thenApply(decoder));
    }

    @Override
    public int minEncodedSize()
    {
        return width;
    }

    @Override
    public String typeName()
    {
        return typeName;
    }

    private static Boolean decodeBoolean(byte[] b)
    {
        switch (b[0]) {
            case 0: return Boolean.FALSE;
            case 1: return Boolean.TRUE;
            default:
                throw new WireDecodeException(WireErrorKind.INVALID_BOOLEAN,
                        "invalid boolean byte 0x" + Integer.toHexString(b[0] & 0xFF));
        }
    }

    private static long checkUnsigned(long value, long max, String typeName)
    {
        if (value < 0 || value > max) {
            throw new IllegalArgumentException(value + " is out of range for " + typeName);
        }
        return value;
    }

    private static byte[] encodeInt128(BigInteger value)
    {
        if (value.bitLength() > 127) {
            throw new IllegalArgumentException(value + " is out of range for int128");
        }
        byte[] minimal = value.toByteArray();
        byte[] out = new byte[16];
        Arrays.fill(out, 0, 16 - minimal.length, (byte) (value.signum() < 0 ? 0xFF : 0x00));
        System.arraycopy(minimal, 0, out, 16 - minimal.length, minimal.length);
        return out;
    }
}
