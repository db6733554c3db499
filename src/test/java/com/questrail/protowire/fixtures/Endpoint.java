package com.questrail.protowire.fixtures;

import com.questrail.protowire.codegen.WireType;

import java.net.URI;
import java.net.URISyntaxException;

@WireType(asString = true)
public final class Endpoint
{
    private final URI uri;

    private Endpoint(URI uri)
    {
        this.uri = uri;
    }

    public static Endpoint fromString(String text) throws URISyntaxException
    {
        return new Endpoint(new URI(text));
    }

    @Override
    public boolean equals(Object o)
    {
        return o instanceof Endpoint && ((Endpoint) o).uri.equals(uri);
    }

    @Override
    public int hashCode()
    {
        return uri.hashCode();
    }

    @Override
    public String toString()
    {
        return uri.toString();
    }
}
