package com.questrail.protowire.api;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class WireExceptionTest {

    @Test
    void pathJoinsFieldsWithDotsAndIndicesDirectly() {
        WireDecodeException e = new WireDecodeException(WireErrorKind.INVALID_TEXT, "bad text");
        e.within("sku").within("[3]").within("lines").within("Order");

        assertEquals("Order.lines[3].sku", e.path());
        assertEquals("bad text (at Order.lines[3].sku)", e.getMessage());
    }

    @Test
    void topLevelFailureHasNoPath() {
        WireEncodeException e = new WireEncodeException(WireErrorKind.IO, "closed");

        assertEquals("", e.path());
        assertEquals("closed", e.getMessage());
    }

    @Test
    void onlyUnknownVariantCarriesAVariant() {
        assertEquals(7L, WireDecodeException.unknownVariant(7, "Shape").variant().getAsLong());
        assertTrue(WireDecodeException.endOfStream(4, 2).variant().isEmpty());
        assertEquals(WireErrorKind.END_OF_STREAM, WireDecodeException.endOfStream(4, 2).kind());
    }

    @Test
    void resultFoldsEitherSide() {
        WireResult<Integer, String> ok = WireResult.ok(2);
        WireResult<Integer, String> err = WireResult.err("no");

        assertTrue(ok.isOk());
        assertFalse(err.isOk());
        assertEquals("2", ok.fold(i -> Integer.toString(i), s -> s));
        assertEquals("no", err.fold(i -> Integer.toString(i), s -> s));
    }
}
