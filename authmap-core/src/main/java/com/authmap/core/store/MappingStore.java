package com.authmap.core.store;

import com.authmap.core.model.MappingKeys;
import com.authmap.core.model.RoleMapping;
import com.authmap.core.model.UserMapping;
import java.time.Clock;
import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicReference;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Process-wide holder of the current {@link MappingSnapshot}.
 * Readers are wait-free via a single AtomicReference swap; the new snapshot is built before the swap.
 */
public class MappingStore implements IdentityMappingLookup {
    private static final Logger log = LoggerFactory.getLogger(MappingStore.class);

    private final AtomicReference<MappingSnapshot> ref = new AtomicReference<>(MappingSnapshot.empty());
    private final Clock clock;

    public MappingStore() {
        this(Clock.systemUTC());
    }

    public MappingStore(Clock clock) {
        this.clock = clock;
    }

    /** Returns the current immutable snapshot. Use it when several reads must agree. */
    public MappingSnapshot snapshot() {
        return ref.get();
    }

    /** Replaces the whole snapshot. The only mutation entry point. */
    public void replace(Collection<UserMapping> users, Collection<RoleMapping> roles, Collection<String> accounts) {
        MappingSnapshot next = MappingSnapshot.build(users, roles, accounts, clock.instant());
        ref.set(next);
        log.info(
                "Mapping snapshot replaced: users={} roles={} accounts={}",
                next.userCount(),
                next.roleCount(),
                next.accountCount());
    }

    public void clear() {
        replace(List.of(), List.of(), List.of());
    }

    @Override
    public UserMapping userMapping(String userArn) {
        UserMapping user = (userArn == null) ? null : ref.get().users().get(MappingKeys.normalize(userArn));
        if (user == null) {
            throw new UserNotFoundException();
        }
        return user;
    }

    @Override
    public RoleMapping roleMapping(String roleArn) {
        RoleMapping role = (roleArn == null) ? null : ref.get().roles().get(MappingKeys.normalize(roleArn));
        if (role == null) {
            throw new RoleNotFoundException();
        }
        return role;
    }

    @Override
    public boolean accountRecognized(String accountId) {
        return accountId != null && ref.get().accounts().contains(accountId);
    }

    @Override
    public Optional<UserMapping> findUser(String userArn) {
        if (userArn == null) return Optional.empty();
        return Optional.ofNullable(ref.get().users().get(MappingKeys.normalize(userArn)));
    }

    @Override
    public Optional<RoleMapping> findRole(String roleArn) {
        if (roleArn == null) return Optional.empty();
        return Optional.ofNullable(ref.get().roles().get(MappingKeys.normalize(roleArn)));
    }
}
