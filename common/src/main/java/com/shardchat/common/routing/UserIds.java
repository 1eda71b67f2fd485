package com.shardchat.common.routing;

/**
 * Parsing of application-level user identifiers.
 * <p>
 * User ids are signed 64-bit decimal integers. Anything else is rejected up front so that a
 * malformed id can never be silently routed to some shard.
 */
public final class UserIds {

    private UserIds() {
    }

    /**
     * Parses the identifier.
     *
     * @throws IllegalArgumentException if the id is null, blank or not a decimal integer
     */
    public static long parse(String userId) {
        if (userId == null || userId.isBlank()) {
            throw new IllegalArgumentException("User id must be provided");
        }
        try {
            return Long.parseLong(userId.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid user id: " + userId, e);
        }
    }

    /**
     * Canonical textual form, so that "007" and "7" address the same user everywhere.
     */
    public static String normalize(String userId) {
        return Long.toString(parse(userId));
    }
}
