package net.myaioutfit.domain.wardrobe;

import java.util.Locale;
import java.util.Optional;

/**
 * Background-removal processing status persisted on a wardrobe item.
 */
public enum ProcessingStatus {
    PENDING,
    PROCESSING,
    COMPLETED,
    FAILED;

    /** Value stored in {@code wardrobe_items.bg_removal_status}. */
    public String dbValue() {
        return name().toLowerCase(Locale.ROOT);
    }

    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED;
    }

    public static Optional<ProcessingStatus> fromDbValue(String value) {
        if (value == null || value.isBlank()) {
            return Optional.empty();
        }
        try {
            return Optional.of(valueOf(value.trim().toUpperCase(Locale.ROOT)));
        } catch (IllegalArgumentException ex) {
            return Optional.empty();
        }
    }
}
