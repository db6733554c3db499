package com.questrail.protowire.codec;

import com.questrail.protowire.api.Tuple2;
import com.questrail.protowire.api.Tuple3;
import com.questrail.protowire.api.WireCodec;
import com.questrail.protowire.api.WireResult;
import com.questrail.protowire.codec.impl.BytesCodec;
import com.questrail.protowire.codec.impl.CollectionCodec;
import com.questrail.protowire.codec.impl.ConvertingCodec;
import com.questrail.protowire.codec.impl.DurationCodec;
import com.questrail.protowire.codec.impl.FixedArrayCodec;
import com.questrail.protowire.codec.impl.FixedBytesCodec;
import com.questrail.protowire.codec.impl.FixedWidthCodec;
import com.questrail.protowire.codec.impl.LazyCodec;
import com.questrail.protowire.codec.impl.MapCodec;
import com.questrail.protowire.codec.impl.OptionalCodec;
import com.questrail.protowire.codec.impl.ResultCodec;
import com.questrail.protowire.codec.impl.TextCodec;
import com.questrail.protowire.codec.impl.TupleCodecs;

import java.math.BigInteger;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.SortedMap;
import java.util.SortedSet;
import java.util.function.Function;
import java.util.function.Supplier;

/**
 * Codecs
 * =============================================================================
 * Entry point to the built-in codecs of wire format version 1.
 *
 * <table>
 *   <caption>Encodings</caption>
 *   <tr><th>Codec</th><th>Bytes</th></tr>
 *   <tr><td>{@link #bool()}</td><td>1: {@code 0} or {@code 1}</td></tr>
 *   <tr><td>int8 / int16 / int32 / int64</td><td>1 / 2 / 4 / 8, big-endian two's complement</td></tr>
 *   <tr><td>uint8 / uint16 / uint32</td><td>1 / 2 / 4, big-endian unsigned</td></tr>
 *   <tr><td>{@link #int128()}</td><td>16, big-endian two's complement</td></tr>
 *   <tr><td>float32 / float64</td><td>IEEE-754 bit pattern, big-endian</td></tr>
 *   <tr><td>{@link #char16()}</td><td>2: one UTF-16 code unit</td></tr>
 *   <tr><td>{@link #string()}, {@link #bytes()}</td><td>Length Field (u64) + payload bytes</td></tr>
 *   <tr><td>{@link #optional}, {@link #result}</td><td>discriminant byte + payload</td></tr>
 *   <tr><td>tuples, fixed arrays, fixed bytes</td><td>elements back to back</td></tr>
 *   <tr><td>list, sets, maps</td><td>Length Field (u64) + elements (key, value per map entry)</td></tr>
 *   <tr><td>{@link #duration()}</td><td>u64 seconds + u32 nanoseconds</td></tr>
 * </table>
 *
 * <p>Codecs are immutable and may be shared between threads and decodes.</p>
 */
public final class Codecs
{
    private Codecs() {}

    public static WireCodec<Boolean> bool()        { return FixedWidthCodec.BOOL; }
    public static WireCodec<Byte> int8()           { return FixedWidthCodec.INT8; }
    public static WireCodec<Short> int16()         { return FixedWidthCodec.INT16; }
    public static WireCodec<Integer> int32()       { return FixedWidthCodec.INT32; }
    public static WireCodec<Long> int64()          { return FixedWidthCodec.INT64; }
    public static WireCodec<Integer> uint8()       { return FixedWidthCodec.UINT8; }
    public static WireCodec<Integer> uint16()      { return FixedWidthCodec.UINT16; }
    public static WireCodec<Long> uint32()         { return FixedWidthCodec.UINT32; }
    public static WireCodec<BigInteger> int128()   { return FixedWidthCodec.INT128; }
    public static WireCodec<Float> float32()       { return FixedWidthCodec.FLOAT32; }
    public static WireCodec<Double> float64()      { return FixedWidthCodec.FLOAT64; }
    public static WireCodec<Character> char16()    { return FixedWidthCodec.CHAR16; }
    public static WireCodec<Duration> duration()   { return DurationCodec.INSTANCE; }

    public static LengthPrefixedCodec<String> string()
    {
        return TextCodec.UNBOUNDED;
    }

    public static LengthPrefixedCodec<byte[]> bytes()
    {
        return BytesCodec.UNBOUNDED;
    }

    public static WireCodec<byte[]> fixedBytes(int length)
    {
        return new FixedBytesCodec(length);
    }

    public static <T> WireCodec<Optional<T>> optional(WireCodec<T> payload)
    {
        return new OptionalCodec<>(payload);
    }

    public static <T, E> WireCodec<WireResult<T, E>> result(WireCodec<T> ok, WireCodec<E> err)
    {
        return new ResultCodec<>(ok, err);
    }

    public static <A, B> WireCodec<Tuple2<A, B>> tuple2(WireCodec<A> first, WireCodec<B> second)
    {
        return new TupleCodecs.Pair<>(first, second);
    }

    public static <A, B, C> WireCodec<Tuple3<A, B, C>> tuple3(WireCodec<A> first, WireCodec<B> second, WireCodec<C> third)
    {
        return new TupleCodecs.Triple<>(first, second, third);
    }

    /**
     * A list of exactly {@code length} elements, written without a Length Field.
     */
    public static <E> WireCodec<List<E>> fixedArray(WireCodec<E> element, int length)
    {
        return new FixedArrayCodec<>(element, length);
    }

    public static <E> LengthPrefixedCodec<List<E>> list(WireCodec<E> element)
    {
        return CollectionCodec.list(element);
    }

    public static <E> LengthPrefixedCodec<Set<E>> hashSet(WireCodec<E> element)
    {
        return CollectionCodec.hashSet(element);
    }

    /**
     * Decodes into a {@code TreeSet} ordered by the elements' natural ordering.
     */
    public static <E> LengthPrefixedCodec<SortedSet<E>> sortedSet(WireCodec<E> element)
    {
        return CollectionCodec.sortedSet(element);
    }

    public static <K, V> LengthPrefixedCodec<Map<K, V>> hashMap(WireCodec<K> key, WireCodec<V> value)
    {
        return MapCodec.hashMap(key, value);
    }

    /**
     * Decodes into a {@code TreeMap} ordered by the keys' natural ordering.
     */
    public static <K, V> LengthPrefixedCodec<SortedMap<K, V>> sortedMap(WireCodec<K> key, WireCodec<V> value)
    {
        return MapCodec.sortedMap(key, value);
    }

    /**
     * Defers codec lookup to first use, for recursive and mutually recursive types.
     * Every read through the returned codec counts one level toward the
     * configured nesting depth.
     */
    public static <T> WireCodec<T> lazy(Supplier<? extends WireCodec<T>> supplier)
    {
        return new LazyCodec<>(supplier);
    }

    /**
     * Encodes values of a named type as a proxy value.
     *
     * @see ConvertingCodec
     */
    public static <T, P> WireCodec<T> via(String typeName, WireCodec<P> proxy,
                                          Function<? super T, ? extends P> toProxy,
                                          ConvertingCodec.Conversion<? super P, ? extends T> fromProxy)
    {
        return new ConvertingCodec<>(typeName, proxy, toProxy, fromProxy);
    }

    /**
     * Encodes values as the text of their {@code toString()}, decoded with
     * {@code parse}.
     */
    public static <T> WireCodec<T> asString(String typeName, ConvertingCodec.Conversion<? super String, ? extends T> parse)
    {
        return new ConvertingCodec<T, String>(typeName, string(), Object::toString, parse);
    }
}
