package tech.idvault.platform.user;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Optional;

/**
 * The two roles a user can hold. Stored by enum name, exposed as the lower-case value.
 */
public enum Role {

    USER("user"),
    ADMIN("admin");

    private final String value;

    Role(String value) {
        this.value = value;
    }

    @JsonValue
    public String value() {
        return value;
    }

    /**
     * Resolve a role from its external value ("user" or "admin").
     * Anything else, including null and differently-cased input, is unknown.
     */
    public static Optional<Role> fromValue(String value) {
        if (value == null) {
            return Optional.empty();
        }
        for (Role role : values()) {
            if (role.value.equals(value)) {
                return Optional.of(role);
            }
        }
        return Optional.empty();
    }
}
