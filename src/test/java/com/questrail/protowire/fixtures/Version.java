package com.questrail.protowire.fixtures;

import com.questrail.protowire.codegen.WireType;

/** {@code major.minor}, sent as text. */
@WireType(asString = true)
public record Version(int major, int minor)
{
    public static Version parse(String text)
    {
        int dot = text.indexOf('.');
        if (dot < 0) {
            throw new IllegalArgumentException("not a version: " + text);
        }
        return new Version(Integer.parseInt(text.substring(0, dot)), Integer.parseInt(text.substring(dot + 1)));
    }

    @Override
    public String toString()
    {
        return major + "." + minor;
    }
}
