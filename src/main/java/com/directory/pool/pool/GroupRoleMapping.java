package com.directory.pool.pool;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Mapping from directory groups to roles, parsed from a string such as
 * {@code "admin=root,dev"}.
 *
 * <p>Fields are separated by {@code ,}; a field of the form {@code group=role} maps the
 * group to the role, a bare field maps to itself. Blank fields are skipped and
 * surrounding whitespace is trimmed. When a field holds more than one {@code =},
 * only the first two tokens are used.</p>
 */
public final class GroupRoleMapping {

    private static final String FIELD_SEPARATOR = ",";
    private static final String VALUE_SEPARATOR = "=";

    private static final GroupRoleMapping EMPTY = new GroupRoleMapping(Map.of());

    private final Map<String, String> mapping;

    private GroupRoleMapping(Map<String, String> mapping) {
        this.mapping = mapping;
    }

    public static GroupRoleMapping empty() {
        return EMPTY;
    }

    public static GroupRoleMapping parse(String value) {
        if (value == null || value.isBlank()) {
            return EMPTY;
        }

        Map<String, String> parsed = new LinkedHashMap<>();
        for (String field : value.split(FIELD_SEPARATOR)) {
            String trimmed = field.trim();
            if (trimmed.isEmpty()) {
                continue;
            }
            String[] parts = trimmed.split(VALUE_SEPARATOR, -1);
            if (parts.length == 1) {
                parsed.put(trimmed, trimmed);
            } else {
                parsed.put(parts[0].trim(), parts[1].trim());
            }
        }
        return new GroupRoleMapping(Collections.unmodifiableMap(parsed));
    }

    public Optional<String> roleFor(String group) {
        return Optional.ofNullable(mapping.get(group));
    }

    public Map<String, String> asMap() {
        return mapping;
    }

    public int size() {
        return mapping.size();
    }

    @Override
    public String toString() {
        return "GroupRoleMapping" + mapping;
    }
}
