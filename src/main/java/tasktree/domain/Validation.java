package tasktree.domain;

import java.util.Collection;

/**
 * Shared argument guards for the domain and service layers.
 *
 * <p>Every guard throws {@link IllegalArgumentException} with a message that names
 * the offending field, so the API layer can hand it back to the client verbatim.
 */
public final class Validation {

    private Validation() {
        // utility class
    }

    /**
     * Ensures the input is not null and contains a non-whitespace character.
     *
     * @param input value to check
     * @param label field name used in the error message
     * @throws IllegalArgumentException if the input is null or blank
     */
    public static void validateNotBlank(final String input, final String label) {
        if (input == null || input.isBlank()) {
            throw new IllegalArgumentException(label + " must not be null or blank");
        }
    }

    /**
     * Validates the input is not blank and returns it trimmed.
     *
     * @param input value to check
     * @param label field name used in the error message
     * @return the trimmed value
     * @throws IllegalArgumentException if the input is null or blank
     */
    public static String validateTrimmed(final String input, final String label) {
        validateNotBlank(input, label);
        return input.trim();
    }

    /**
     * @param value value to check
     * @param label field name used in the error message
     * @param <T> value type
     * @return the value itself
     * @throws IllegalArgumentException if the value is null
     */
    public static <T> T validateNotNull(final T value, final String label) {
        if (value == null) {
            throw new IllegalArgumentException(label + " must not be null");
        }
        return value;
    }

    /**
     * Rejects collections that contain null or blank entries.
     *
     * @param values collection to check (null is treated as empty)
     * @param label field name used in the error message
     * @throws IllegalArgumentException if any entry is null or blank
     */
    public static void validateNoBlankEntries(final Collection<String> values, final String label) {
        if (values == null) {
            return;
        }
        for (final String value : values) {
            if (value == null || value.isBlank()) {
                throw new IllegalArgumentException(label + " must not contain null or blank entries");
            }
        }
    }
}
