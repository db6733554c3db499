package com.questrail.protowire.codegen;

import com.questrail.protowire.WireProtocol;
import com.questrail.protowire.api.WireCodec;
import com.questrail.protowire.api.WireDecodeException;
import com.questrail.protowire.api.WireErrorKind;
import com.questrail.protowire.codec.Codecs;
import com.questrail.protowire.fixtures.Appointment;
import com.questrail.protowire.fixtures.AppointmentWireCodec;
import com.questrail.protowire.fixtures.CalendarDay;
import com.questrail.protowire.fixtures.CalendarDayWireCodec;
import com.questrail.protowire.fixtures.CalendarDay_FieldsWireCodec;
import com.questrail.protowire.fixtures.Endpoint;
import com.questrail.protowire.fixtures.EndpointWireCodec;
import com.questrail.protowire.fixtures.Suit;
import com.questrail.protowire.fixtures.SuitWireCodec;
import com.questrail.protowire.fixtures.Version;
import com.questrail.protowire.fixtures.VersionWireCodec;
import org.junit.jupiter.api.Test;

import java.net.URISyntaxException;
import java.time.DateTimeException;
import java.time.LocalDate;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Types encoded through a proxy: {@code via} a proxy type, or as their text.
 */
final class GeneratedProxyCodecsTest
{
    private final WireProtocol wire = new WireProtocol();

    @Test
    void viaTypeHasExactlyTheProxyEncoding()
    {
        CalendarDay leapDay = new CalendarDay(LocalDate.of(2024, 2, 29));
        byte[] bytes = wire.encode(CalendarDayWireCodec.INSTANCE, leapDay);

        assertArrayEquals(new byte[] { 0, 0, 0x07, (byte) 0xE8, 0, 0, 0, 2, 0, 0, 0, 29 }, bytes);
        assertArrayEquals(wire.encode(CalendarDay_FieldsWireCodec.INSTANCE, new CalendarDay.Fields(2024, 2, 29)), bytes);
        assertEquals(leapDay, wire.decode(CalendarDayWireCodec.INSTANCE, bytes));
        assertEquals(12, CalendarDayWireCodec.INSTANCE.minEncodedSize());
        assertEquals("CalendarDay", CalendarDayWireCodec.INSTANCE.typeName());
    }

    @Test
    void rejectedProxyIsACustomError()
    {
        byte[] bytes = wire.encode(CalendarDay_FieldsWireCodec.INSTANCE, new CalendarDay.Fields(2023, 2, 29));

        WireDecodeException e = assertThrows(WireDecodeException.class,
                () -> wire.decode(CalendarDayWireCodec.INSTANCE, bytes));
        assertEquals(WireErrorKind.CUSTOM, e.kind());
        assertInstanceOf(DateTimeException.class, e.getCause());
        assertEquals("CalendarDay", e.path());
    }

    @Test
    void proxyFailuresKeepTheirKind()
    {
        WireDecodeException e = assertThrows(WireDecodeException.class,
                () -> wire.decode(CalendarDayWireCodec.INSTANCE, new byte[] { 0, 0, 0x07, (byte) 0xE8, 0, 0 }));
        assertEquals(WireErrorKind.END_OF_STREAM, e.kind());
    }

    @Test
    void asStringTypeIsItsText()
    {
        byte[] bytes = wire.encode(VersionWireCodec.INSTANCE, new Version(1, 12));

        assertArrayEquals(wire.encode(Codecs.string(), "1.12"), bytes);
        assertEquals(new Version(1, 12), wire.decode(VersionWireCodec.INSTANCE, bytes));
        assertEquals(8, VersionWireCodec.INSTANCE.minEncodedSize());
    }

    @Test
    void unparsableTextIsACustomError()
    {
        WireDecodeException e = assertThrows(WireDecodeException.class,
                () -> wire.decode(VersionWireCodec.INSTANCE, wire.encode(Codecs.string(), "1.x")));
        assertEquals(WireErrorKind.CUSTOM, e.kind());
        assertInstanceOf(NumberFormatException.class, e.getCause());
    }

    @Test
    void checkedParseFailuresAreCustomErrors() throws URISyntaxException
    {
        Endpoint endpoint = Endpoint.fromString("tcp://example.org:7000/feed");
        assertEquals(endpoint, wire.decode(EndpointWireCodec.INSTANCE, wire.encode(EndpointWireCodec.INSTANCE, endpoint)));

        WireDecodeException e = assertThrows(WireDecodeException.class,
                () -> wire.decode(EndpointWireCodec.INSTANCE, wire.encode(Codecs.string(), "not a uri")));
        assertEquals(WireErrorKind.CUSTOM, e.kind());
        assertInstanceOf(URISyntaxException.class, e.getCause());
    }

    @Test
    void enumAsStringUsesConstantNames()
    {
        assertArrayEquals(wire.encode(Codecs.string(), "SPADES"), wire.encode(SuitWireCodec.INSTANCE, Suit.SPADES));
        assertEquals(Suit.HEARTS, wire.decode(SuitWireCodec.INSTANCE, wire.encode(Codecs.string(), "HEARTS")));

        WireDecodeException e = assertThrows(WireDecodeException.class,
                () -> wire.decode(SuitWireCodec.INSTANCE, wire.encode(Codecs.string(), "JOKER")));
        assertEquals(WireErrorKind.CUSTOM, e.kind());
    }

    @Test
    void proxyTypesWorkAsComponents() throws URISyntaxException
    {
        Appointment appointment = new Appointment(
                new CalendarDay(LocalDate.of(2025, 6, 1)),
                Endpoint.fromString("udp://10.0.0.1:53"),
                List.of(Suit.HEARTS, Suit.SPADES),
                new Version(2, 0));

        assertEquals(appointment, wire.decode(AppointmentWireCodec.INSTANCE,
                wire.encode(AppointmentWireCodec.INSTANCE, appointment)));
        assertEquals(12 + 8 + 8 + 8, AppointmentWireCodec.INSTANCE.minEncodedSize());

        byte[] bytes = wire.encode(AppointmentWireCodec.INSTANCE, new Appointment(
                new CalendarDay(LocalDate.of(2025, 6, 1)), appointment.where(), List.of(), new Version(2, 0)));
        byte[] badMonth = bytes.clone();
        badMonth[7] = 13;
        WireDecodeException e = assertThrows(WireDecodeException.class,
                () -> wire.decode(AppointmentWireCodec.INSTANCE, badMonth));
        assertEquals(WireErrorKind.CUSTOM, e.kind());
        assertEquals("Appointment.day", e.path());
    }

    @Test
    void handWrittenConversionsShareTheContract()
    {
        WireCodec<LocalDate> epochDay = Codecs.via("EpochDay", Codecs.int64(), LocalDate::toEpochDay, LocalDate::ofEpochDay);

        LocalDate day = LocalDate.of(1970, 1, 3);
        assertArrayEquals(new byte[] { 0, 0, 0, 0, 0, 0, 0, 2 }, wire.encode(epochDay, day));
        assertEquals(day, wire.decode(epochDay, new byte[] { 0, 0, 0, 0, 0, 0, 0, 2 }));

        WireCodec<Long> positive = Codecs.via("Positive", Codecs.int64(), value -> value, value -> {
            if (value <= 0) {
                throw new WireDecodeException(WireErrorKind.OVERSIZED_REQUEST, "not positive: " + value);
            }
            return value;
        });
        WireDecodeException e = assertThrows(WireDecodeException.class,
                () -> wire.decode(positive, new byte[8]));
        assertEquals(WireErrorKind.OVERSIZED_REQUEST, e.kind());
    }
}
