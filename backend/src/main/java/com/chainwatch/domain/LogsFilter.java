package com.chainwatch.domain;

import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/**
 * Filter for logsSubscribe: all transactions (excluding votes), all including votes, or those mentioning one address.
 */
public final class LogsFilter {

    public enum Kind {
        ALL,
        ALL_WITH_VOTES,
        MENTIONS
    }

    private static final LogsFilter ALL = new LogsFilter(Kind.ALL, null);
    private static final LogsFilter ALL_WITH_VOTES = new LogsFilter(Kind.ALL_WITH_VOTES, null);

    private final Kind kind;
    private final String mentions;

    private LogsFilter(Kind kind, String mentions) {
        this.kind = kind;
        this.mentions = mentions;
    }

    public static LogsFilter all() {
        return ALL;
    }

    public static LogsFilter allWithVotes() {
        return ALL_WITH_VOTES;
    }

    public static LogsFilter mentions(String address) {
        if (address == null || address.isBlank()) {
            throw new IllegalArgumentException("mentions address is required");
        }
        return new LogsFilter(Kind.MENTIONS, address.trim());
    }

    /**
     * Parses a configured or requested filter name ("all", "allWithVotes", "mentions").
     * A missing name means "mentions" when an address is given, otherwise "all".
     *
     * @throws IllegalArgumentException for unknown names or "mentions" without an address
     */
    public static LogsFilter parse(String name, String address) {
        boolean hasAddress = address != null && !address.isBlank();
        if (name == null || name.isBlank()) {
            return hasAddress ? mentions(address) : all();
        }
        return switch (name.trim().toLowerCase(Locale.ROOT)) {
            case "all" -> all();
            case "allwithvotes", "all_with_votes" -> allWithVotes();
            case "mentions" -> mentions(address);
            default -> throw new IllegalArgumentException("Unknown logs filter: " + name);
        };
    }

    public Kind getKind() {
        return kind;
    }

    public String getMentions() {
        return mentions;
    }

    /**
     * First logsSubscribe parameter: "all", "allWithVotes" or {"mentions": [address]}.
     */
    public Object toRpcParam() {
        return switch (kind) {
            case ALL -> "all";
            case ALL_WITH_VOTES -> "allWithVotes";
            case MENTIONS -> Map.of("mentions", List.of(mentions));
        };
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof LogsFilter other)) return false;
        return kind == other.kind && Objects.equals(mentions, other.mentions);
    }

    @Override
    public int hashCode() {
        return Objects.hash(kind, mentions);
    }

    @Override
    public String toString() {
        return kind == Kind.MENTIONS ? "mentions:" + mentions : kind.name().toLowerCase();
    }
}
