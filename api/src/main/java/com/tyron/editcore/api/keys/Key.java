package com.tyron.editcore.api.keys;

import java.util.Objects;

/**
 * A logical key: either a single character or one of the {@link NamedKey}s.
 */
public interface Key {

    String getId();

    static Key character(int codePoint) {
        return new Char(codePoint);
    }

    static Key named(NamedKey key) {
        return new Named(key);
    }

    record Char(int codePoint) implements Key {
        public Char {
            if (!Character.isValidCodePoint(codePoint)) {
                throw new IllegalArgumentException("Not a valid code point: " + codePoint);
            }
        }

        @Override
        public String getId() {
            return new String(Character.toChars(codePoint));
        }
    }

    record Named(NamedKey key) implements Key {
        public Named {
            Objects.requireNonNull(key, "key");
        }

        @Override
        public String getId() {
            return key.getId();
        }
    }
}
