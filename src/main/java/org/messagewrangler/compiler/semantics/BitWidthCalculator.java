package org.messagewrangler.compiler.semantics;

import java.util.Collection;

/**
 * Chooses the smallest of 8, 16, 32 and 64 bits that can encode a set of enum values.
 * Non-negative values are measured as unsigned magnitudes, negative values as signed.
 * Open enums start at 32 bits, since values outside the declared set must also fit.
 */
public final class BitWidthCalculator {

    public static final int OPEN_ENUM_DEFAULT_WIDTH = 32;

    private BitWidthCalculator() {}

    public static int widthFor(Collection<Long> values, boolean open) {
        int width = open ? OPEN_ENUM_DEFAULT_WIDTH : 8;
        for (long value : values) {
            width = Math.max(width, requiredWidth(value));
        }
        return width;
    }

    static int requiredWidth(long value) {
        if (value >= 0) {
            if (value <= 0xFFL) return 8;
            if (value <= 0xFFFFL) return 16;
            if (value <= 0xFFFF_FFFFL) return 32;
            return 64;
        }
        if (value >= Byte.MIN_VALUE) return 8;
        if (value >= Short.MIN_VALUE) return 16;
        if (value >= Integer.MIN_VALUE) return 32;
        return 64;
    }
}
