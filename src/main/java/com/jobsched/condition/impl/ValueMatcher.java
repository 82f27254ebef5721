package com.jobsched.condition.impl;

import java.util.Objects;

/**
 * Loose equality shared by the equality and membership conditions:
 * numbers compare by value, everything else by its string form.
 */
final class ValueMatcher {

    private ValueMatcher() {
    }

    static boolean matches(Object actual, Object expected) {
        if (actual == null || expected == null) {
            return actual == expected;
        }
        if (Objects.equals(actual, expected)) {
            return true;
        }
        if (actual instanceof Number a && expected instanceof Number e) {
            return a.doubleValue() == e.doubleValue();
        }
        return String.valueOf(actual).equals(String.valueOf(expected));
    }
}
