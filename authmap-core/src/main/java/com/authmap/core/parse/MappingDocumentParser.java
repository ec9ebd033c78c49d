package com.authmap.core.parse;

import com.authmap.core.model.RoleMapping;
import com.authmap.core.model.UserMapping;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.function.Function;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Turns the raw text fields of the mapping document into typed lists.
 *
 * <p>Each field is parsed on its own: a malformed {@code mapAccounts} never hides valid
 * {@code mapUsers}/{@code mapRoles}. Absent or blank fields yield empty lists. Failures are returned
 * in {@link ParsedMappings#errors()}, never thrown.
 */
public class MappingDocumentParser {
    private static final Logger log = LoggerFactory.getLogger(MappingDocumentParser.class);

    public static final String USERS_FIELD = "mapUsers";
    public static final String ROLES_FIELD = "mapRoles";
    public static final String ACCOUNTS_FIELD = "mapAccounts";

    private static final TypeReference<List<UserMapping>> USER_LIST = new TypeReference<>() {};
    private static final TypeReference<List<RoleMapping>> ROLE_LIST = new TypeReference<>() {};
    private static final TypeReference<List<String>> STRING_LIST = new TypeReference<>() {};

    private final ObjectMapper yaml;
    private final ObjectMapper json;

    public MappingDocumentParser() {
        this(new ObjectMapper(new YAMLFactory()), new ObjectMapper());
    }

    public MappingDocumentParser(ObjectMapper yaml, ObjectMapper json) {
        this.yaml = yaml;
        this.json = json;
    }

    public ParsedMappings parse(Map<String, String> data) {
        if (data == null || data.isEmpty()) {
            return ParsedMappings.empty();
        }
        List<FieldParseException> errors = new ArrayList<>();

        List<UserMapping> users =
                parseField(data, USERS_FIELD, USER_LIST, UserMapping::userArn, "userarn", errors);
        List<RoleMapping> roles =
                parseField(data, ROLES_FIELD, ROLE_LIST, RoleMapping::roleArn, "rolearn", errors);
        List<String> accounts =
                parseField(data, ACCOUNTS_FIELD, STRING_LIST, Function.identity(), "account id", errors);

        if (!errors.isEmpty()) {
            log.warn("Mapping document parsed with {} error(s); keeping entries that parsed: {}", errors.size(), errors);
        }
        return new ParsedMappings(users, roles, accounts, errors);
    }

    private <T> List<T> parseField(
            Map<String, String> data,
            String field,
            TypeReference<List<T>> type,
            Function<T, String> keyOf,
            String keyName,
            List<FieldParseException> errors) {
        String text = data.get(field);
        if (text == null || text.isBlank()) {
            return List.of();
        }

        List<T> raw;
        try {
            raw = mapperFor(field, text).readValue(text, type);
        } catch (JsonProcessingException ex) {
            errors.add(new FieldParseException(field, ex.getOriginalMessage(), ex));
            return List.of();
        }
        if (raw == null) {
            return List.of();
        }

        List<T> valid = new ArrayList<>(raw.size());
        for (int i = 0; i < raw.size(); i++) {
            T entry = raw.get(i);
            if (entry == null) continue;
            String key = keyOf.apply(entry);
            if (key == null || key.isBlank()) {
                errors.add(new FieldParseException(field, "entry " + i + " has no " + keyName));
                continue;
            }
            valid.add(entry);
        }
        return valid;
    }

    // User/role JSON text is read as-is; accounts and everything else go through the YAML parser.
    private ObjectMapper mapperFor(String field, String text) {
        if (ACCOUNTS_FIELD.equals(field)) return yaml;
        String t = text.stripLeading();
        return (t.startsWith("[") || t.startsWith("{")) ? json : yaml;
    }
}
