package com.familygraph.model;

public record Person(
    String id,
    String name,
    String gender,        // male, female, unknown
    String dateOfBirth,
    String dateOfDeath,
    String photoPath,
    String notes,
    double x,
    double y
) {
    public static final String UNKNOWN_GENDER = "unknown";

    public Person {
        if (gender == null || gender.isBlank()) {
            gender = UNKNOWN_GENDER;
        }
    }

    public Person withPosition(double x, double y) {
        return new Person(id, name, gender, dateOfBirth, dateOfDeath, photoPath, notes, x, y);
    }

    public String displayName() {
        return name == null || name.isBlank() ? "Unknown" : name.trim();
    }

    public String lifespan() {
        boolean hasBirth = dateOfBirth != null && !dateOfBirth.isBlank();
        boolean hasDeath = dateOfDeath != null && !dateOfDeath.isBlank();
        if (!hasBirth && !hasDeath) {
            return "";
        }
        if (!hasDeath) {
            return "b. " + dateOfBirth;
        }
        if (!hasBirth) {
            return "d. " + dateOfDeath;
        }
        return dateOfBirth + " - " + dateOfDeath;
    }
}
