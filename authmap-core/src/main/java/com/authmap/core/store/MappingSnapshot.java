package com.authmap.core.store;

import com.authmap.core.model.MappingKeys;
import com.authmap.core.model.RoleMapping;
import com.authmap.core.model.UserMapping;
import java.time.Instant;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;

/**
 * Immutable, fully-built lookup tables:
 *   normalized user ARN -> user, normalized role ARN -> role, account ids.
 *
 * Built completely before it is published; never patched afterwards.
 */
public record MappingSnapshot(
        Map<String, UserMapping> users, Map<String, RoleMapping> roles, Set<String> accounts, Instant loadedAt) {

    private static final MappingSnapshot EMPTY = new MappingSnapshot(Map.of(), Map.of(), Set.of(), Instant.EPOCH);

    public static MappingSnapshot empty() {
        return EMPTY;
    }

    /** Later entries win when two normalize to the same key. Accounts are kept verbatim. */
    public static MappingSnapshot build(
            Collection<UserMapping> users, Collection<RoleMapping> roles, Collection<String> accounts, Instant loadedAt) {
        Map<String, UserMapping> userIndex = new LinkedHashMap<>();
        for (UserMapping user : users) {
            userIndex.put(MappingKeys.normalize(user.userArn()), user);
        }
        Map<String, RoleMapping> roleIndex = new LinkedHashMap<>();
        for (RoleMapping role : roles) {
            roleIndex.put(MappingKeys.normalize(role.roleArn()), role);
        }
        Set<String> accountSet = new LinkedHashSet<>(accounts);
        return new MappingSnapshot(
                Collections.unmodifiableMap(userIndex),
                Collections.unmodifiableMap(roleIndex),
                Collections.unmodifiableSet(accountSet),
                loadedAt);
    }

    public int userCount() {
        return users.size();
    }

    public int roleCount() {
        return roles.size();
    }

    public int accountCount() {
        return accounts.size();
    }
}
