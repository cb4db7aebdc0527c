package com.hospital.management.service;

import org.apache.commons.lang3.StringUtils;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * How two time tokens are ordered when checking for overlapping appointments.
 */
public enum TimeComparison {

    /**
     * Plain string order. "9:00" sorts after "10:00"; kept because existing files were booked this way.
     */
    LEXICOGRAPHIC {
        @Override
        public int compare(String a, String b) {
            return a.compareTo(b);
        }
    },

    /**
     * "H:MM" / "HH:MM" compared as minutes since midnight. Tokens that do not parse fall back to string order.
     */
    PARSED {
        @Override
        public int compare(String a, String b) {
            int left = minutes(a);
            int right = minutes(b);
            if (left < 0 || right < 0) {
                return a.compareTo(b);
            }
            return Integer.compare(left, right);
        }
    };

    private static final Pattern CLOCK = Pattern.compile("(\\d{1,2}):(\\d{2})");

    public abstract int compare(String a, String b);

    /**
     * True when {@code time} lies in [from, to).
     */
    public boolean within(String time, String from, String to) {
        return compare(time, from) >= 0 && compare(time, to) < 0;
    }

    static int minutes(String token) {
        Matcher m = CLOCK.matcher(StringUtils.strip(token));
        if (!m.matches()) {
            return -1;
        }
        int hours = Integer.parseInt(m.group(1));
        int mins = Integer.parseInt(m.group(2));
        if (hours > 23 || mins > 59) {
            return -1;
        }
        return hours * 60 + mins;
    }
}
