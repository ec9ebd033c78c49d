package com.authmap.core.store;

import com.authmap.core.model.RoleMapping;
import com.authmap.core.model.UserMapping;
import java.util.Optional;

/**
 * Read side used by the authentication path. User and role keys match case-insensitively; account
 * ids match exactly. A {@code null} key is always a miss.
 */
public interface IdentityMappingLookup {

    /** @throws UserNotFoundException when no mapping exists for {@code userArn} */
    UserMapping userMapping(String userArn);

    /** @throws RoleNotFoundException when no mapping exists for {@code roleArn} */
    RoleMapping roleMapping(String roleArn);

    boolean accountRecognized(String accountId);

    Optional<UserMapping> findUser(String userArn);

    Optional<RoleMapping> findRole(String roleArn);
}
