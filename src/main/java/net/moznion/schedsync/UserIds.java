package net.moznion.schedsync;

import java.util.regex.Pattern;

import net.moznion.schedsync.exception.InvalidUserIdException;

/**
 * User ids end up in entry ids and in {@code --user=} command flags, so only a safe subset of
 * characters is accepted.
 */
public final class UserIds {
    private static final Pattern VALID_USER_ID = Pattern.compile("^[A-Za-z0-9_-]+$");

    private UserIds() {
    }

    public static String validate(final String userId) {
        if (userId == null || userId.isEmpty()) {
            throw new InvalidUserIdException("user_id cannot be empty");
        }
        if (userId.startsWith("-")) {
            throw new InvalidUserIdException("Invalid user_id: must not start with a hyphen");
        }
        if (!VALID_USER_ID.matcher(userId).matches()) {
            throw new InvalidUserIdException("Invalid user_id: " + userId);
        }
        return userId;
    }

    public static boolean isValid(final String userId) {
        try {
            validate(userId);
            return true;
        } catch (InvalidUserIdException e) {
            return false;
        }
    }
}
