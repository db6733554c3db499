package com.questrail.protowire.fixtures;

import com.questrail.protowire.codegen.WireType;

import java.time.LocalDate;

/** A date sent as its year, month and day numbers. */
@WireType(via = CalendarDay.Fields.class)
public final class CalendarDay
{
    @WireType
    public record Fields(int year, int month, int day) {}

    private final LocalDate date;

    public CalendarDay(LocalDate date)
    {
        this.date = date;
    }

    public LocalDate date()
    {
        return date;
    }

    Fields toWire()
    {
        return new Fields(date.getYear(), date.getMonthValue(), date.getDayOfMonth());
    }

    // throws DateTimeException for days that do not exist
    static CalendarDay fromWire(Fields fields)
    {
        return new CalendarDay(LocalDate.of(fields.year(), fields.month(), fields.day()));
    }

    @Override
    public boolean equals(Object o)
    {
        return o instanceof CalendarDay && ((CalendarDay) o).date.equals(date);
    }

    @Override
    public int hashCode()
    {
        return date.hashCode();
    }

    @Override
    public String toString()
    {
        return date.toString();
    }
}
