package net.moznion.schedsync.expansion;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Set;

import net.moznion.schedsync.UserProfile;

import lombok.Value;

/**
 * The user a multi-user job is being instantiated for.
 */
@Value
public class ExpansionContext {
    String userId;
    UserProfile user;
    Set<String> multiUserJobNames;

    public ExpansionContext(final String userId, final UserProfile user, final Set<String> multiUserJobNames) {
        this.userId = userId;
        this.user = user == null ? UserProfile.EMPTY : user;
        this.multiUserJobNames = multiUserJobNames == null
                                 ? Collections.emptySet()
                                 : Collections.unmodifiableSet(new LinkedHashSet<>(multiUserJobNames));
    }
}
