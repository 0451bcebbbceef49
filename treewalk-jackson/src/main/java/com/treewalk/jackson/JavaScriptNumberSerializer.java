package com.treewalk.jackson;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.databind.JsonSerializer;
import com.fasterxml.jackson.databind.SerializerProvider;

import java.io.IOException;
import java.math.BigDecimal;
import java.math.BigInteger;

/**
 * Writes a literal's value the way JavaScript prints numbers: integral doubles without a
 * decimal point, NaN and the infinities as null. Bigint values are written as decimal strings
 * since JSON numbers cannot hold them exactly.
 */
public class JavaScriptNumberSerializer extends JsonSerializer<Object> {

    // 2^53, the largest double below which every integer is exact
    private static final double MAX_SAFE = 9007199254740992.0;

    @Override
    public void serialize(Object value, JsonGenerator gen, SerializerProvider serializers) throws IOException {
        if (value == null) {
            gen.writeNull();
        } else if (value instanceof Double d) {
            writeDouble(d, gen);
        } else if (value instanceof BigInteger big) {
            gen.writeString(big.toString());
        } else if (value instanceof Boolean b) {
            gen.writeBoolean(b);
        } else if (value instanceof String s) {
            gen.writeString(s);
        } else {
            gen.writeObject(value);
        }
    }

    private static void writeDouble(double d, JsonGenerator gen) throws IOException {
        if (Double.isNaN(d) || Double.isInfinite(d)) {
            gen.writeNull();
        } else if (d == Math.rint(d) && Math.abs(d) <= MAX_SAFE) {
            gen.writeNumber((long) d);
        } else if (d == Math.rint(d) && Math.abs(d) < 1e21) {
            gen.writeNumber(new BigDecimal(d).toBigInteger());
        } else {
            gen.writeNumber(d);
        }
    }
}
