package com.fleet.moderation.resolve;

import java.util.regex.Pattern;

/**
 * A parsed target argument: an {@code @handle}, a numeric id, or nothing (use the
 * reply context). Bare usernames without {@code @} are rejected because they too
 * easily match the wrong account.
 */
public final class TargetSpec {

    private static final Pattern NUMERIC = Pattern.compile("-?\\d{1,19}");

    public enum Kind { NONE, HANDLE, NUMERIC }

    private static final TargetSpec NONE = new TargetSpec(Kind.NONE, null, 0L);

    private final Kind kind;
    private final String handle;
    private final long id;

    private TargetSpec(Kind kind, String handle, long id) {
        this.kind = kind;
        this.handle = handle;
        this.id = id;
    }

    /**
     * Parses a raw argument.
     *
     * @param raw the argument, null or blank for "no argument"
     * @throws InvalidTargetException for bare usernames, lone {@code @} or out-of-range ids
     */
    public static TargetSpec parse(String raw) {
        if (raw == null || raw.isBlank()) {
            return NONE;
        }
        String value = raw.trim();
        if (value.startsWith("@")) {
            if (value.length() == 1) {
                throw new InvalidTargetException("empty handle");
            }
            return new TargetSpec(Kind.HANDLE, value, 0L);
        }
        if (NUMERIC.matcher(value).matches()) {
            try {
                long id = Long.parseLong(value);
                if (id == 0) {
                    throw new InvalidTargetException("id 0 is not addressable");
                }
                return new TargetSpec(Kind.NUMERIC, null, id);
            } catch (NumberFormatException e) {
                throw new InvalidTargetException("id out of range: " + value, e);
            }
        }
        throw new InvalidTargetException(
                "bare usernames are not accepted, use @handle or a numeric id: " + value);
    }

    public static TargetSpec none() {
        return NONE;
    }

    public Kind kind() {
        return kind;
    }

    public String handle() {
        return handle;
    }

    public long id() {
        return id;
    }

    public boolean isPresent() {
        return kind != Kind.NONE;
    }

    @Override
    public String toString() {
        return switch (kind) {
            case HANDLE -> handle;
            case NUMERIC -> String.valueOf(id);
            case NONE -> "<reply>";
        };
    }
}
