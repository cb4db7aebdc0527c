package com.hospital.management.codec;

import java.util.Map;

/**
 * Converts between the text of one records file and its keyed in-memory collection.
 * Implementations do not escape separators: a ';' or '\n' inside a value shifts every field after it.
 *
 * @param <V> record type stored under its integer id
 */
public interface RecordCodec<V> {

    char FIELD_SEPARATOR = ';';
    char RECORD_TERMINATOR = '\n';

    /**
     * Decode a whole file. The returned map iterates in file order.
     *
     * @throws com.hospital.management.exception.RecordFormatException if an id token is not an integer
     */
    Map<Integer, V> decode(String text);

    /**
     * Encode a whole collection in its iteration order.
     */
    String encode(Map<Integer, V> records);
}
