package com.authmap.core.parse;

import com.authmap.core.model.RoleMapping;
import com.authmap.core.model.UserMapping;
import java.util.List;
import java.util.Optional;

/**
 * Output of {@link MappingDocumentParser}: whatever parsed cleanly plus the per-field failures.
 * The lists are usable even when {@link #failure()} is present.
 */
public record ParsedMappings(
        List<UserMapping> users,
        List<RoleMapping> roles,
        List<String> accounts,
        List<FieldParseException> errors) {

    public ParsedMappings {
        users = List.copyOf(users);
        roles = List.copyOf(roles);
        accounts = List.copyOf(accounts);
        errors = List.copyOf(errors);
    }

    public static ParsedMappings empty() {
        return new ParsedMappings(List.of(), List.of(), List.of(), List.of());
    }

    public boolean hasErrors() {
        return !errors.isEmpty();
    }

    public Optional<MappingParseException> failure() {
        return errors.isEmpty() ? Optional.empty() : Optional.of(new MappingParseException(errors));
    }
}
