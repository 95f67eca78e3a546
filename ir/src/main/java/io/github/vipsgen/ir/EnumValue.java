package io.github.vipsgen.ir;

import static java.util.Objects.requireNonNull;

import org.jspecify.annotations.Nullable;

public final class EnumValue {

    private final String symbolicName;
    private final String nick;
    private final int value;

    public EnumValue(String symbolicName, String nick, int value) {
        this.symbolicName = requireNonNull(symbolicName, "symbolicName");
        this.nick = requireNonNull(nick, "nick");
        this.value = value;
    }

    public String getSymbolicName() {
        return symbolicName;
    }

    public String getNick() {
        return nick;
    }

    public int getValue() {
        return value;
    }

    @Override
    public boolean equals(@Nullable Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof EnumValue)) {
            return false;
        }
        EnumValue that = (EnumValue) o;
        return value == that.value && symbolicName.equals(that.symbolicName) && nick.equals(that.nick);
    }

    @Override
    public int hashCode() {
        return 31 * (31 * symbolicName.hashCode() + nick.hashCode()) + value;
    }

    @Override
    public String toString() {
        return symbolicName + "=" + value + " (" + nick + ")";
    }
}
