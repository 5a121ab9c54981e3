package net.moznion.schedsync;

import lombok.Builder;
import lombok.Value;

/**
 * Values a scheduler entry gets when its job definition leaves them unset.
 */
@Value
@Builder
public class EntryDefaults {
    public static final String DEFAULT_ENVIRONMENT = "cloud";
    public static final String DEFAULT_STATUS = "active";
    public static final String USER_ID_SEPARATOR = "--";

    public static final EntryDefaults STANDARD = EntryDefaults.builder().build();

    @Builder.Default
    String environment = DEFAULT_ENVIRONMENT;

    @Builder.Default
    String status = DEFAULT_STATUS;

    public static String perUserId(final String name, final String userId) {
        return name + USER_ID_SEPARATOR + userId;
    }
}
