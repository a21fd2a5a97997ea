package com.contact.resolution.rest.security;

import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * API keys accepted by the admin API and the role each one carries.
 *
 * <p>Populated from MicroProfile Config by the CDI producer:</p>
 * <pre>
 * contact-resolution.security.enabled=true
 * contact-resolution.security.api-key-header=X-API-Key
 * contact-resolution.security.operator-keys=cr-op-1,cr-op-2
 * contact-resolution.security.viewer-keys=cr-view-1
 * </pre>
 * A key listed under both roles gets the higher one.
 */
public class SecurityConfig {

    public static final String DEFAULT_HEADER = "X-API-Key";

    private final boolean enabled;
    private final String apiKeyHeader;
    private final Map<String, SecurityRole> roleByKey;

    private SecurityConfig(Builder builder) {
        this.enabled = builder.enabled;
        this.apiKeyHeader = builder.apiKeyHeader;
        this.roleByKey = Collections.unmodifiableMap(new HashMap<>(builder.roleByKey));
    }

    public boolean isEnabled() {
        return enabled;
    }

    public String getApiKeyHeader() {
        return apiKeyHeader;
    }

    /**
     * Returns the role for a key, or null if the key is unknown or blank.
     */
    public SecurityRole getRoleForKey(String apiKey) {
        if (apiKey == null || apiKey.isBlank()) {
            return null;
        }
        return roleByKey.get(apiKey.trim());
    }

    public int keyCount() {
        return roleByKey.size();
    }

    /**
     * Configuration that lets every request through unauthenticated.
     */
    public static SecurityConfig disabled() {
        return builder().enabled(false).build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private boolean enabled = true;
        private String apiKeyHeader = DEFAULT_HEADER;
        private final Map<String, SecurityRole> roleByKey = new HashMap<>();

        public Builder enabled(boolean enabled) {
            this.enabled = enabled;
            return this;
        }

        public Builder apiKeyHeader(String apiKeyHeader) {
            if (apiKeyHeader == null || apiKeyHeader.isBlank()) {
                throw new IllegalArgumentException("apiKeyHeader must not be null or blank");
            }
            this.apiKeyHeader = apiKeyHeader;
            return this;
        }

        public Builder addKey(String key, SecurityRole role) {
            if (key == null || key.isBlank()) {
                throw new IllegalArgumentException("API key must not be null or blank");
            }
            if (role == null) {
                throw new IllegalArgumentException("Security role must not be null");
            }
            roleByKey.merge(key.trim(), role, (held, offered) -> held.hasPermission(offered) ? held : offered);
            return this;
        }

        /**
         * Adds every non-blank key in the list with the same role.
         */
        public Builder addKeys(List<String> keys, SecurityRole role) {
            if (keys != null) {
                keys.stream().filter(k -> k != null && !k.isBlank()).forEach(k -> addKey(k, role));
            }
            return this;
        }

        public SecurityConfig build() {
            return new SecurityConfig(this);
        }
    }

    @Override
    public String toString() {
        return "SecurityConfig{enabled=" + enabled + ", apiKeyHeader='" + apiKeyHeader
                + "', keyCount=" + roleByKey.size() + '}';
    }
}
