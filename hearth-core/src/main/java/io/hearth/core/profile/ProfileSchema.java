package io.hearth.core.profile;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Declares every caregiver profile field, in display order. Validators, the extractor, the stores and
 * completion math all read the field set from here.
 */
public final class ProfileSchema {
    public static final String UPDATE_PROFILE_TOOL = "update_caregiver_profile";

    private static final List<FieldDescriptor> FIELDS = List.of(
        critical("location", FieldKind.STRING, "Geographic location (city, state, or general area)"),
        critical("languages", FieldKind.STRING_LIST, "Languages spoken"),
        critical("careTypes", FieldKind.STRING_LIST,
            "Types of care provided (e.g., infant care, toddler care, after-school care)"),
        critical("hourlyRate", FieldKind.STRING, "Hourly rate with currency (e.g., $25/hour)"),
        high("qualifications", FieldKind.STRING_LIST, "Certifications, degrees, training (e.g., CPR, First Aid, CDA)"),
        high("startDate", FieldKind.STRING, "Availability start date"),
        high("generalAvailability", FieldKind.STRING, "Free-form schedule description"),
        high("yearsOfExperience", FieldKind.NUMBER_MAP,
            "Years of experience breakdown by care type (e.g., {\"infant\": 5, \"toddler\": 3})"),
        high("weeklyHours", FieldKind.STRING, "Desired hours per week"),
        optional("preferredAgeGroups", FieldKind.STRING_LIST, "Preferred age ranges"),
        optional("responsibilities", FieldKind.STRING_LIST, "Specific duties willing to do"),
        optional("commuteDistance", FieldKind.STRING, "Maximum commute distance"),
        optional("commuteType", FieldKind.STRING, "Transportation method"),
        optional("willDriveChildren", FieldKind.STRING, "Willing to drive children (Yes/No/Maybe)"),
        optional("accessibilityNeeds", FieldKind.STRING, "Any accessibility requirements"),
        optional("dietaryPreferences", FieldKind.STRING_LIST, "Dietary restrictions/preferences"),
        optional("additionalChildRate", FieldKind.STRING, "Rate for additional children"),
        optional("payrollRequired", FieldKind.STRING, "Payroll service needed"),
        optional("benefitsRequired", FieldKind.STRING_LIST, "Desired benefits"),
        optional("profilePictureUrl", FieldKind.STRING, "Profile photo URL")
    );

    private static final Map<String, FieldDescriptor> BY_NAME = FIELDS.stream()
        .collect(Collectors.toMap(FieldDescriptor::name, Function.identity(), (a, b) -> a, LinkedHashMap::new));

    private ProfileSchema() {
    }

    public static List<FieldDescriptor> listFields() {
        return FIELDS;
    }

    public static Optional<FieldDescriptor> find(String name) {
        return Optional.ofNullable(name == null ? null : BY_NAME.get(name));
    }

    public static boolean contains(String name) {
        return name != null && BY_NAME.containsKey(name);
    }

    public static int totalFields() {
        return FIELDS.size();
    }

    public static int indexOf(String name) {
        for (int i = 0; i < FIELDS.size(); i++) {
            if (FIELDS.get(i).name().equals(name)) {
                return i;
            }
        }
        return -1;
    }

    public static List<FieldDescriptor> fieldsWithPriority(FieldPriority priority) {
        return FIELDS.stream().filter(field -> field.priority() == priority).toList();
    }

    /**
     * Function-calling definition offered to the model so it can report extracted fields out of band.
     */
    public static Map<String, Object> toolDefinition() {
        Map<String, Object> properties = new LinkedHashMap<>();
        for (FieldDescriptor field : FIELDS) {
            properties.put(field.name(), propertySchema(field));
        }
        return Map.of(
            "type", "function",
            "function", Map.of(
                "name", UPDATE_PROFILE_TOOL,
                "description", "Extract and update caregiver profile information from the conversation. "
                    + "Call this whenever the user provides information that should be stored in their profile.",
                "parameters", Map.of(
                    "type", "object",
                    "properties", properties
                )
            )
        );
    }

    /**
     * JSON schema of the reply envelope used when the model answers with a single JSON object.
     */
    public static Map<String, Object> replyEnvelopeSchema() {
        Map<String, Object> properties = new LinkedHashMap<>();
        for (FieldDescriptor field : FIELDS) {
            properties.put(field.name(), propertySchema(field));
        }
        return Map.of(
            "type", "object",
            "properties", Map.of(
                "message", Map.of("type", "string"),
                "extractedData", Map.of("type", "object", "properties", properties)
            ),
            "required", List.of("message")
        );
    }

    private static Map<String, Object> propertySchema(FieldDescriptor field) {
        Map<String, Object> schema = new LinkedHashMap<>();
        switch (field.kind()) {
            case STRING -> schema.put("type", "string");
            case STRING_LIST -> {
                schema.put("type", "array");
                schema.put("items", Map.of("type", "string"));
            }
            case NUMBER_MAP -> {
                schema.put("type", "object");
                schema.put("additionalProperties", Map.of("type", "number"));
            }
        }
        schema.put("description", field.description());
        return schema;
    }

    private static FieldDescriptor critical(String name, FieldKind kind, String description) {
        return new FieldDescriptor(name, kind, FieldPriority.CRITICAL, description);
    }

    private static FieldDescriptor high(String name, FieldKind kind, String description) {
        return new FieldDescriptor(name, kind, FieldPriority.HIGH, description);
    }

    private static FieldDescriptor optional(String name, FieldKind kind, String description) {
        return new FieldDescriptor(name, kind, FieldPriority.OPTIONAL, description);
    }
}
