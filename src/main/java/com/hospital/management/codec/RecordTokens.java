package com.hospital.management.codec;

import com.hospital.management.exception.RecordFormatException;
import org.apache.commons.lang3.StringUtils;

final class RecordTokens {

    private RecordTokens() {
    }

    /**
     * Integer ids tolerate surrounding whitespace, which is how a stray newline left in front
     * of the id by the previous record is absorbed.
     */
    static int parseId(String field, String token) {
        try {
            return Integer.parseInt(StringUtils.strip(token));
        } catch (NumberFormatException e) {
            throw new RecordFormatException(field, token, e);
        }
    }

    static String take(StringBuilder buffer) {
        String value = buffer.toString();
        buffer.setLength(0);
        return value;
    }

    static void appendFields(StringBuilder out, Object... values) {
        for (Object value : values) {
            out.append(value).append(RecordCodec.FIELD_SEPARATOR);
        }
    }
}
