package com.authmap.watch.spi;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * The watched key/value document: its name plus raw text fields (e.g. {@code mapUsers}).
 */
public record ConfigResource(String name, Map<String, String> data) {
    public ConfigResource {
        data = (data == null) ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(data));
    }
}
