/* (C)2026 */
package com.ammann.clinicalkpi.enumeration;

import java.util.Locale;
import java.util.Set;

/**
 * Invasive device categories tracked for utilization KPIs.
 */
public enum DeviceType {
    VENTILATION("ventilation", Set.of("ventilation", "ventilador", "vm")),
    CENTRAL_LINE("catheter", Set.of("cvc", "catheter")),
    URINARY_CATHETER("urinaryCatheter", Set.of("foley", "urinary_catheter")),
    ARTERIAL_LINE("arterialLine", Set.of("art", "art_line", "arterial", "art.")),
    OTHER("other", Set.of());

    private final String key;
    private final Set<String> aliases;

    DeviceType(String key, Set<String> aliases) {
        this.key = key;
        this.aliases = aliases;
    }

    /** Key used for this device in output documents. */
    public String getKey() {
        return key;
    }

    /**
     * Maps a free-text device type from a usage record to a category.
     *
     * @param rawType device type as recorded, may be null
     * @return matching category, {@link #OTHER} when nothing matches
     */
    public static DeviceType fromRaw(String rawType) {
        if (rawType == null) {
            return OTHER;
        }
        String normalized = rawType.trim().toLowerCase(Locale.ROOT);
        for (DeviceType type : values()) {
            if (type.aliases.contains(normalized)) {
                return type;
            }
        }
        return OTHER;
    }
}
