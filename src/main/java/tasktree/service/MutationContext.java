package tasktree.service;

import tasktree.domain.Validation;

/**
 * Caller context handed explicitly to every tree mutation.
 *
 * @param ownerId     teacher performing the change (required)
 * @param activeScope room currently selected by the caller, used as the default
 *                    visibility of new items (nullable)
 */
public record MutationContext(String ownerId, String activeScope) {

    public MutationContext {
        ownerId = Validation.validateTrimmed(ownerId, "ownerId");
        activeScope = activeScope == null || activeScope.isBlank() ? null : activeScope.trim();
    }

    public static MutationContext of(final String ownerId) {
        return new MutationContext(ownerId, null);
    }
}
