package ru.tigran.chatanalytics.model;

/**
 * Actor class scope for KPI queries.
 * INTERNAL keeps only users listed in the internal users table, EXTERNAL excludes them,
 * ALL applies no membership predicate.
 */
public enum UserType {
    ALL("all"),
    INTERNAL("internal"),
    EXTERNAL("external");

    private final String value;

    UserType(String value) {
        this.value = value;
    }

    public String getValue() {
        return value;
    }

    /**
     * Get UserType enum by its wire token (case-insensitive). Null or blank means ALL.
     * @param value the string value ("all", "internal", "external")
     * @return UserType enum or throws IllegalArgumentException if not found
     */
    public static UserType fromValue(String value) {
        if (value == null || value.isBlank()) {
            return ALL;
        }
        for (UserType userType : UserType.values()) {
            if (userType.value.equalsIgnoreCase(value.trim())) {
                return userType;
            }
        }
        throw new IllegalArgumentException("Invalid user_type: " + value);
    }
}
