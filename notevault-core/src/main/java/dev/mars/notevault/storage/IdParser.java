/*
 * Copyright 2026 Mark Andrew Ray-Smith
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package dev.mars.notevault.storage;

import java.util.OptionalLong;
import java.util.regex.Pattern;

/**
 * Parses caller-supplied note ids.
 * <p>
 * Accepts decimal digits only, with surrounding whitespace trimmed. Signs, blanks
 * and values that overflow {@code long} are rejected.
 */
public final class IdParser {

    private static final Pattern DIGITS = Pattern.compile("\\d+");

    private IdParser() {
    }

    /**
     * @param raw the id as received, may be null
     * @return the parsed id, or empty if {@code raw} is not a non-negative integer
     */
    public static OptionalLong parse(String raw) {
        if (raw == null) {
            return OptionalLong.empty();
        }
        String trimmed = raw.strip();
        if (!DIGITS.matcher(trimmed).matches()) {
            return OptionalLong.empty();
        }
        try {
            return OptionalLong.of(Long.parseLong(trimmed));
        } catch (NumberFormatException e) {
            return OptionalLong.empty();
        }
    }
}
