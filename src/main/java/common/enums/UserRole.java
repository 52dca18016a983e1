package common.enums;

public enum UserRole {
    ADMIN,
    TEACHER,
    STUDENT;

    /**
     * Case-insensitive lookup; returns null for unknown or blank names.
     */
    public static UserRole fromName(String name) {
        if (name == null || name.isBlank()) {
            return null;
        }
        for (UserRole role : values()) {
            if (role.name().equalsIgnoreCase(name.trim())) {
                return role;
            }
        }
        return null;
    }
}
