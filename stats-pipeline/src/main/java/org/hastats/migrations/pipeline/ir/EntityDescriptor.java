package org.hastats.migrations.pipeline.ir;

import java.util.Locale;

import lombok.Builder;

/**
 * One monitored entity as described by the source's metadata tables.
 *
 * Built fresh for every metadata page and never persisted. The optional descriptive
 * fields come from a best-effort attributes join; {@link #friendlyName()} is always
 * resolved (falling back to a name derived from the external id).
 */
@Builder(toBuilder = true)
public record EntityDescriptor(
    int entityKey,
    String externalId,
    String domain,
    String unit,
    String source,
    String friendlyName,
    String deviceClass,
    String stateClass
) {

    public static final String TIMESTAMP_STATE_CLASS = "timestamp";

    /**
     * Resolve the derived fields of a descriptor from raw metadata columns.
     *
     * @param sourceName the name column of the metadata table, used when no attributes row carries one
     */
    public static EntityDescriptor fromMetadata(int entityKey,
                                                String externalId,
                                                String unit,
                                                String source,
                                                String sourceName,
                                                String attributeFriendlyName,
                                                String deviceClass,
                                                String stateClass) {
        String friendlyName = firstNonBlank(attributeFriendlyName, sourceName);
        return new EntityDescriptor(
            entityKey,
            externalId,
            domainOf(externalId),
            blankToNull(unit),
            blankToNull(source),
            friendlyName != null ? friendlyName : defaultFriendlyName(externalId),
            blankToNull(deviceClass),
            blankToNull(stateClass)
        );
    }

    /** The namespace before the first dot, e.g. {@code sensor} for {@code sensor.kitchen}. */
    public static String domainOf(String externalId) {
        if (externalId == null) {
            return "";
        }
        int dot = externalId.indexOf('.');
        return dot < 0 ? "" : externalId.substring(0, dot).toLowerCase(Locale.ROOT);
    }

    /** The part after the first dot, or the whole id when it has no domain. */
    public static String objectIdOf(String externalId) {
        int dot = externalId.indexOf('.');
        return dot < 0 ? externalId : externalId.substring(dot + 1);
    }

    public static String defaultFriendlyName(String externalId) {
        return objectIdOf(externalId).replace('_', ' ');
    }

    public String objectId() {
        return objectIdOf(externalId);
    }

    public boolean isTimestampOnly() {
        return TIMESTAMP_STATE_CLASS.equals(stateClass);
    }

    private static String firstNonBlank(String first, String second) {
        if (first != null && !first.isBlank()) {
            return first;
        }
        return blankToNull(second);
    }

    private static String blankToNull(String value) {
        return value == null || value.isBlank() ? null : value;
    }
}
