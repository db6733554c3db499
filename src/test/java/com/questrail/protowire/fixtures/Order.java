package com.questrail.protowire.fixtures;

import com.questrail.protowire.codegen.WireType;

import java.util.List;

@WireType
public record Order(String id, List<Order.Line> lines)
{
    @WireType
    public record Line(String sku, int quantity) {}
}
