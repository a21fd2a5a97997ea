package com.contact.resolution.source;

import com.contact.resolution.core.model.EntityMetadata;
import com.contact.resolution.core.model.SourceEdit;

import java.util.List;
import java.util.Optional;

/**
 * The slow, external system that owns contact-to-entity mappings.
 *
 * <p>Calls may be slow or fail; failures surface as {@link SystemOfRecordException}.
 * Callers bound each call with their own timeout.</p>
 */
public interface SystemOfRecord {

    /**
     * @param normalizedPhone a normalized phone number, e.g. {@code +13365185544}
     * @return the canonical id, or empty if the source has no entity for it
     */
    Optional<String> lookupByPhone(String normalizedPhone);

    /**
     * @param normalizedEmail a trimmed, lower-cased email address
     * @return the canonical id, or empty if the source has no entity for it
     */
    Optional<String> lookupByEmail(String normalizedEmail);

    /**
     * Returns descriptive data for an entity; {@link EntityMetadata#empty()} if it has none.
     */
    EntityMetadata getEntityMetadata(String canonicalId);

    /**
     * Returns the most recently edited entities, newest first.
     */
    List<SourceEdit> recentlyEdited(int limit);

    /**
     * Short name used in logs and health details.
     */
    default String getName() {
        return getClass().getSimpleName();
    }
}
