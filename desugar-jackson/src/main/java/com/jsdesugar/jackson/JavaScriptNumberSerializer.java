package com.jsdesugar.jackson;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.databind.JsonSerializer;
import com.fasterxml.jackson.databind.SerializerProvider;

import java.io.IOException;
import java.math.BigInteger;

/**
 * Writes literal values the way JavaScript prints numbers: integral doubles lose
 * their fraction, non-finite values become null. Non-numeric literal values pass through.
 */
public class JavaScriptNumberSerializer extends JsonSerializer<Object> {

    // 2^53, the largest double that still maps onto an exact long for every integer below it
    private static final double MAX_SAFE_INTEGER = 9007199254740992.0;

    // JavaScript switches to exponent notation from here on
    private static final double EXPONENT_THRESHOLD = 1e21;

    @Override
    public void serialize(Object value, JsonGenerator gen, SerializerProvider serializers) throws IOException {
        if (value == null) {
            gen.writeNull();
        } else if (value instanceof Double d) {
            writeDouble(d, gen);
        } else if (value instanceof Float f) {
            writeDouble(f.doubleValue(), gen);
        } else if (value instanceof Long || value instanceof Integer || value instanceof Short) {
            gen.writeNumber(((Number) value).longValue());
        } else if (value instanceof BigInteger bi) {
            gen.writeNumber(bi);
        } else if (value instanceof Number n) {
            writeDouble(n.doubleValue(), gen);
        } else if (value instanceof Boolean b) {
            gen.writeBoolean(b);
        } else if (value instanceof String s) {
            gen.writeString(s);
        } else {
            gen.writeObject(value);
        }
    }

    private static void writeDouble(double d, JsonGenerator gen) throws IOException {
        if (Double.isInfinite(d) || Double.isNaN(d)) {
            gen.writeNull();
        } else if (d == Math.floor(d) && Math.abs(d) <= MAX_SAFE_INTEGER) {
            gen.writeNumber((long) d);
        } else if (d == Math.floor(d) && Math.abs(d) < EXPONENT_THRESHOLD) {
            // %.0f rounds the way JavaScript prints large integers (72057594037927940)
            gen.writeNumber(new BigInteger(String.format("%.0f", d)));
        } else {
            gen.writeNumber(d);
        }
    }
}
