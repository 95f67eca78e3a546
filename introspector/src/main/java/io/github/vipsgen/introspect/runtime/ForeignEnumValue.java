package io.github.vipsgen.introspect.runtime;

import org.jspecify.annotations.Nullable;

/** A raw enum entry as the foreign runtime declares it. Name and nick may be missing. */
public final class ForeignEnumValue {

    private final @Nullable String name;
    private final @Nullable String nick;
    private final int value;

    public ForeignEnumValue(@Nullable String name, @Nullable String nick, int value) {
        this.name = name;
        this.nick = nick;
        this.value = value;
    }

    public @Nullable String getName() {
        return name;
    }

    public @Nullable String getNick() {
        return nick;
    }

    public int getValue() {
        return value;
    }
}
