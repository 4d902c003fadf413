package com.exprtree.jackson;

import com.fasterxml.jackson.core.JsonGenerator;

import java.io.IOException;
import java.math.BigDecimal;

/**
 * Writes float literal values like JavaScript formats numbers.
 * Integral values below 1e21 are written without a decimal point or exponent,
 * others keep their decimal representation.
 */
final class ExprNumberSerializer {

    private static final double MAX_SAFE_INTEGER = 9007199254740992.0;
    private static final double MAX_PLAIN_INTEGER = 1e21;

    private ExprNumberSerializer() {
    }

    static void writeFloat(JsonGenerator gen, double d) throws IOException {
        if (Double.isNaN(d)) {
            gen.writeString("NaN");
        } else if (Double.isInfinite(d)) {
            gen.writeString(d > 0 ? "Infinity" : "-Infinity");
        } else if (d != Math.floor(d) || isNegativeZero(d) || Math.abs(d) >= MAX_PLAIN_INTEGER) {
            gen.writeNumber(d);
        } else if (Math.abs(d) <= MAX_SAFE_INTEGER) {
            gen.writeNumber((long) d);
        } else {
            // Beyond 2^53 print the shortest decimal digits padded with zeros, as JavaScript does
            gen.writeNumber(new BigDecimal(Double.toString(d)).toBigIntegerExact());
        }
    }

    private static boolean isNegativeZero(double d) {
        return d == 0.0 && Double.doubleToRawLongBits(d) != 0L;
    }
}
