package com.vidnyan.eaf.domain.model;

import java.util.Optional;

/**
 * Numerical suffixes of conventional IDs such as "a12" or "ts3".
 */
final class IdNumbers {

    private IdNumbers() {
    }

    static Optional<Long> suffix(String id) {
        int i = id.length();
        while (i > 0 && Character.isDigit(id.charAt(i - 1))) {
            i--;
        }
        if (i == id.length() || id.length() - i > 18) {
            return Optional.empty();
        }
        return Optional.of(Long.parseLong(id.substring(i)));
    }
}
