package com.authmap.core.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Maps an IAM user ARN to a cluster username and groups. Field names follow the
 * {@code mapUsers} entry format.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record UserMapping(
        @JsonProperty("userarn") String userArn,
        @JsonProperty("username") String username,
        @JsonProperty("groups") List<String> groups) {

    public UserMapping {
        groups = (groups == null) ? List.of() : Collections.unmodifiableList(new ArrayList<>(groups));
    }
}
