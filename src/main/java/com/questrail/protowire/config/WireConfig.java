package com.questrail.protowire.config;

/**
 * Limits applied to every top-level decode.
 *
 * <p>The byte budget of a decode is the smaller of {@code maxDecodeBytes} and
 * the number of bytes the reader reports as remaining. For streams that cannot
 * report it, {@code maxDecodeBytes} is the only cap on how much a Length Field
 * may make the decoder accept.</p>
 *
 * @param maxDecodeBytes  upper bound of the allocation budget, in bytes
 * @param maxNestingDepth deepest permitted nesting of generated composite values
 */
public record WireConfig(
    long maxDecodeBytes,
    int maxNestingDepth
) {
    public static final long DEFAULT_MAX_DECODE_BYTES = 64L * 1024 * 1024;
    public static final int DEFAULT_MAX_NESTING_DEPTH = 128;

    public WireConfig {
        if (maxDecodeBytes < 0) {
            throw new IllegalArgumentException("maxDecodeBytes must be non-negative");
        }
        if (maxNestingDepth <= 0) {
            throw new IllegalArgumentException("maxNestingDepth must be positive");
        }
    }

    public static WireConfig defaults() {
        return new WireConfig(DEFAULT_MAX_DECODE_BYTES, DEFAULT_MAX_NESTING_DEPTH);
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private long maxDecodeBytes = DEFAULT_MAX_DECODE_BYTES;
        private int maxNestingDepth = DEFAULT_MAX_NESTING_DEPTH;

        public Builder withMaxDecodeBytes(long maxDecodeBytes) {
            this.maxDecodeBytes = maxDecodeBytes;
            return this;
        }

        public Builder withMaxNestingDepth(int maxNestingDepth) {
            this.maxNestingDepth = maxNestingDepth;
            return this;
        }

        public WireConfig build() {
            return new WireConfig(maxDecodeBytes, maxNestingDepth);
        }
    }
}
