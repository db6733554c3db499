package com.questrail.protowire.codec;

import com.questrail.protowire.WireProtocol;
import com.questrail.protowire.api.Tuple2;
import com.questrail.protowire.api.Tuple3;
import com.questrail.protowire.api.WireCodec;
import com.questrail.protowire.api.WireDecodeException;
import com.questrail.protowire.api.WireEncodeException;
import com.questrail.protowire.api.WireErrorKind;
import com.questrail.protowire.api.WireResult;
import com.questrail.protowire.budget.DecodeBudget;
import com.questrail.protowire.config.WireConfig;
import com.questrail.protowire.observability.NullObservabilitySink;
import com.questrail.protowire.transport.FakeWireStream;
import org.junit.jupiter.api.Test;

import java.nio.ByteBuffer;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.SortedMap;
import java.util.SortedSet;
import java.util.TreeMap;
import java.util.TreeSet;
import java.util.concurrent.CompletableFuture;

import static org.junit.jupiter.api.Assertions.*;

final class ContainerCodecsTest
{
    private final WireProtocol wire = new WireProtocol();

    @Test
    void absentOptionalIsSingleZeroByte()
    {
        WireCodec<Optional<Integer>> codec = Codecs.optional(Codecs.int32());
        assertArrayEquals(new byte[] { 0x00 }, wire.encode(codec, Optional.empty()));
        assertArrayEquals(new byte[] { 0x01, 0, 0, 0, 7 }, wire.encode(codec, Optional.of(7)));
        assertEquals(Optional.of(7), wire.decode(codec, new byte[] { 0x01, 0, 0, 0, 7 }));
    }

    @Test
    void optionalDiscriminantOtherThanZeroOrOneIsUnknownVariant()
    {
        WireDecodeException e = assertThrows(WireDecodeException.class,
                () -> wire.decode(Codecs.optional(Codecs.int8()), new byte[] { 0x02, 0x00 }));
        assertEquals(WireErrorKind.UNKNOWN_VARIANT, e.kind());
        assertEquals(2, e.variant().getAsLong());
    }

    @Test
    void resultIsTaggedOkThenErr()
    {
        WireCodec<WireResult<Integer, String>> codec = Codecs.result(Codecs.int32(), Codecs.string().withMaxLength(255));

        assertArrayEquals(new byte[] { 0, 0, 0, 0, 5 }, wire.encode(codec, WireResult.ok(5)));
        assertArrayEquals(new byte[] { 1, 2, 'n', 'o' }, wire.encode(codec, WireResult.err("no")));
        assertEquals(WireResult.err("no"), wire.decode(codec, new byte[] { 1, 2, 'n', 'o' }));

        WireDecodeException e = assertThrows(WireDecodeException.class,
                () -> wire.decode(codec, new byte[] { 7 }));
        assertEquals(WireErrorKind.UNKNOWN_VARIANT, e.kind());
    }

    @Test
    void tuplesArePositional()
    {
        WireCodec<Tuple2<Byte, Boolean>> pair = Codecs.tuple2(Codecs.int8(), Codecs.bool());
        assertArrayEquals(new byte[] { 3, 1 }, wire.encode(pair, Tuple2.of((byte) 3, true)));

        WireCodec<Tuple3<Byte, Byte, Boolean>> triple = Codecs.tuple3(Codecs.int8(), Codecs.int8(), Codecs.bool());
        assertEquals(Tuple3.of((byte) 1, (byte) 2, false), wire.decode(triple, new byte[] { 1, 2, 0 }));

        WireDecodeException e = assertThrows(WireDecodeException.class,
                () -> wire.decode(triple, new byte[] { 1, 2, 9 }));
        assertTrue(e.path().endsWith(".2"), e.path());
    }

    @Test
    void emptyListIsEightZeroBytes()
    {
        assertArrayEquals(new byte[8], wire.encode(Codecs.list(Codecs.int32()), List.of()));
        assertEquals(List.of(), wire.decode(Codecs.list(Codecs.int32()), new byte[8]));
    }

    @Test
    void listKeepsOrder()
    {
        WireCodec<List<Short>> codec = Codecs.list(Codecs.int16());
        byte[] bytes = wire.encode(codec, List.of((short) 2, (short) 1));
        assertArrayEquals(new byte[] { 0, 0, 0, 0, 0, 0, 0, 2, 0, 2, 0, 1 }, bytes);
        assertEquals(List.of((short) 2, (short) 1), wire.decode(codec, bytes));
    }

    @Test
    void elementFailureNamesItsIndex()
    {
        byte[] bytes = { 0, 0, 0, 0, 0, 0, 0, 3, 1, 0, 5 };
        WireDecodeException e = assertThrows(WireDecodeException.class,
                () -> wire.decode(Codecs.list(Codecs.bool()), bytes));
        assertEquals(WireErrorKind.INVALID_BOOLEAN, e.kind());
        assertTrue(e.path().endsWith("[2]"), e.path());
    }

    @Test
    void hashSetDecodesEqualRegardlessOfIterationOrder()
    {
        Set<String> forward = new LinkedHashSet<>(List.of("a", "b", "c"));
        Set<String> backward = new LinkedHashSet<>(List.of("c", "b", "a"));
        WireCodec<Set<String>> codec = Codecs.hashSet(Codecs.string());

        assertEquals(wire.decode(codec, wire.encode(codec, forward)), wire.decode(codec, wire.encode(codec, backward)));
        assertEquals(forward, wire.decode(codec, wire.encode(codec, backward)));
    }

    @Test
    void sortedContainersDecodeSorted()
    {
        SortedSet<Integer> set = new TreeSet<>(List.of(3, 1, 2));
        SortedSet<Integer> decoded = wire.decode(Codecs.sortedSet(Codecs.int32()),
                wire.encode(Codecs.sortedSet(Codecs.int32()), set));
        assertEquals(List.of(1, 2, 3), new ArrayList<>(decoded));

        SortedMap<String, Integer> map = new TreeMap<>(Map.of("b", 2, "a", 1));
        WireCodec<SortedMap<String, Integer>> codec = Codecs.sortedMap(Codecs.string(), Codecs.int32());
        assertEquals("a", wire.decode(codec, wire.encode(codec, map)).firstKey());
    }

    @Test
    void mapEntriesAreKeyThenValue()
    {
        Map<Byte, Boolean> map = new HashMap<>();
        map.put((byte) 4, true);
        WireCodec<Map<Byte, Boolean>> codec = Codecs.hashMap(Codecs.int8(), Codecs.bool());

        byte[] bytes = wire.encode(codec, map);
        assertArrayEquals(new byte[] { 0, 0, 0, 0, 0, 0, 0, 1, 4, 1 }, bytes);
        assertEquals(map, wire.decode(codec, bytes));
    }

    @Test
    void listMaxLengthIsEnforced()
    {
        LengthPrefixedCodec<List<Byte>> codec = Codecs.list(Codecs.int8()).withMaxLength(2);
        assertArrayEquals(new byte[] { 2, 1, 2 }, wire.encode(codec, List.of((byte) 1, (byte) 2)));

        WireEncodeException e = assertThrows(WireEncodeException.class,
                () -> wire.encode(codec, List.of((byte) 1, (byte) 2, (byte) 3)));
        assertEquals(WireErrorKind.OVERSIZED_REQUEST, e.kind());
    }

    @Test
    void fixedArrayHasNoLengthField()
    {
        WireCodec<List<Short>> codec = Codecs.fixedArray(Codecs.int16(), 2);
        assertArrayEquals(new byte[] { 0, 1, 0, 2 }, wire.encode(codec, List.of((short) 1, (short) 2)));

        List<Short> decoded = wire.decode(codec, new byte[] { 0, 1, 0, 2 });
        assertEquals(List.of((short) 1, (short) 2), decoded);
        assertThrows(UnsupportedOperationException.class, () -> decoded.add((short) 3));

        assertThrows(IllegalArgumentException.class, () -> wire.encode(codec, List.of((short) 1)));
        assertEquals(4, codec.minEncodedSize());
    }

    @Test
    void largeListDecodesFromSuspendedStream()
    {
        WireCodec<List<Integer>> codec = Codecs.list(Codecs.int32());
        List<Integer> values = new ArrayList<>();
        for (int i = 0; i < 500; i++) {
            values.add(i);
        }
        byte[] bytes = wire.encode(codec, values);

        FakeWireStream stream = new FakeWireStream();
        CompletableFuture<List<Integer>> read = codec.read(stream, new DecodeBudget(bytes.length, 8));
        stream.trickle(bytes);

        assertEquals(values, read.join());
        assertFalse(stream.hasPendingRead());
    }

    /** A list whose elements are lists of the same kind, built by hand through {@link Codecs#lazy}. */
    private static final class NestedLists
    {
        private WireCodec<List<Object>> codec;

        NestedLists()
        {
            codec = Codecs.list(Codecs.lazy(() -> asElement(codec)));
        }

        @SuppressWarnings("unchecked")
        private static WireCodec<Object> asElement(WireCodec<?> codec)
        {
            return (WireCodec<Object>) codec;
        }

        // `depth` lists each holding the next, around an empty one
        static byte[] encoded(int depth)
        {
            ByteBuffer bytes = ByteBuffer.allocate(8 * (depth + 1));
            for (int i = 0; i < depth; i++) {
                bytes.putLong(1);
            }
            return bytes.putLong(0).array();
        }
    }

    @Test
    void lazyIndirectionCountsTowardNestingDepth()
    {
        WireCodec<List<Object>> codec = new NestedLists().codec;

        assertEquals(List.of(List.of(List.of())), wire.decode(codec, NestedLists.encoded(2)));

        WireProtocol shallow = new WireProtocol(
                WireConfig.builder().withMaxNestingDepth(4).build(), NullObservabilitySink.INSTANCE);
        assertEquals(1, shallow.decode(codec, NestedLists.encoded(4)).size());
        WireDecodeException e = assertThrows(WireDecodeException.class,
                () -> shallow.decode(codec, NestedLists.encoded(5)));
        assertEquals(WireErrorKind.NESTING_TOO_DEEP, e.kind());
    }

    @Test
    void hostileSelfReferenceFailsInsteadOfOverflowingTheStack()
    {
        WireCodec<List<Object>> codec = new NestedLists().codec;

        WireDecodeException e = assertThrows(WireDecodeException.class,
                () -> wire.decode(codec, NestedLists.encoded(200_000)));
        assertEquals(WireErrorKind.NESTING_TOO_DEEP, e.kind());
        assertTrue(e.path().startsWith("List<List"), e.path());
    }
}
