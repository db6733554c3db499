package com.questrail.protowire.codec.impl;

import com.questrail.protowire.api.WireDecodeException;
import com.questrail.protowire.api.WireEncodeException;
import com.questrail.protowire.api.WireErrorKind;
import com.questrail.protowire.budget.DecodeBudget;
import com.questrail.protowire.codec.LengthPrefixedCodec;
import com.questrail.protowire.internal.async.Futures;
import com.questrail.protowire.transport.WireReader;
import com.questrail.protowire.transport.WireWriter;

import java.nio.ByteBuffer;
import java.nio.CharBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;

/**
 * Text: a Length Field giving the UTF-8 byte count, then the bytes.
 *
 * <p>Both directions are strict. Invalid UTF-8 fails decoding with
 * {@link WireErrorKind#INVALID_TEXT} and the partially decoded string is
 * dropped; a string with an unpaired surrogate cannot be encoded.</p>
 */
public final class TextCodec implements LengthPrefixedCodec<String>
{
    public static final TextCodec UNBOUNDED = new TextCodec(LengthPrefix.UNBOUNDED);

    private final LengthPrefix prefix;

    private TextCodec(LengthPrefix prefix)
    {
        this.prefix = prefix;
    }

    @Override
    public TextCodec withMaxLength(long max)
    {
        return new TextCodec(LengthPrefix.forMax(max));
    }

    @Override
    public CompletableFuture<Void> write(String value, WireWriter out)
    {
        return Futures.call(() -> {
            byte[] utf8 = encodeStrict(Objects.requireNonNull(value, "string"));
            return prefix.write(utf8.length, out, typeName())
                    .thenCompose(v -> out.writeAll(utf8));
        });
    }

    @Override
    public CompletableFuture<String> read(WireReader in, DecodeBudget budget)
    {
        return Futures.call(() -> prefix.read(in, typeName())
                .thenCompose(length -> in.readExact(budget.reserve(length, 1, typeName())))
                .thenApply(TextCodec::decodeStrict));
    }

    @Override
    public int minEncodedSize()
    {
        return prefix.width();
    }

    @Override
    public String typeName()
    {
        return "string";
    }

    private static byte[] encodeStrict(String value)
    {
        try {
            ByteBuffer buf = StandardCharsets.UTF_8.newEncoder()
                    .onMalformedInput(CodingErrorAction.REPORT)
                    .onUnmappableCharacter(CodingErrorAction.REPORT)
                    .encode(CharBuffer.wrap(value));
            byte[] out = new byte[buf.remaining()];
            buf.get(out);
            return out;
        }
        catch (CharacterCodingException e) {
            throw new WireEncodeException(WireErrorKind.INVALID_TEXT,
                    "string is not valid Unicode (unpaired surrogate)", e);
        }
    }

    private static String decodeStrict(byte[] utf8)
    {
        try {
            return StandardCharsets.UTF_8.newDecoder()
                    .onMalformedInput(CodingErrorAction.REPORT)
                    .onUnmappableCharacter(CodingErrorAction.REPORT)
                    .decode(ByteBuffer.wrap(utf8))
                    .toString();
        }
        catch (CharacterCodingException e) {
            throw new WireDecodeException(WireErrorKind.INVALID_TEXT,
                    "text payload of " + utf8.length + " bytes is not valid UTF-8", e);
        }
    }
}
