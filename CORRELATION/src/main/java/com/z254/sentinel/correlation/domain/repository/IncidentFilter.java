package com.z254.sentinel.correlation.domain.repository;

import com.z254.sentinel.correlation.domain.model.Incident;
import lombok.Builder;
import lombok.Value;

/**
 * Candidate query filter. Null fields do not constrain the query.
 */
@Value
@Builder
public class IncidentFilter {

    /** Match incidents from this source... */
    String source;

    /** ...or in this category. When both are set an incident matching either is kept. */
    String category;

    /** Incident to leave out of the result */
    String excludeId;

    /** Include resolved incidents */
    @Builder.Default
    boolean includeResolved = true;

    /** Maximum number of incidents returned */
    @Builder.Default
    int limit = 500;

    public boolean matches(Incident incident) {
        if (excludeId != null && excludeId.equals(incident.getId())) {
            return false;
        }
        if (!includeResolved && incident.isResolved()) {
            return false;
        }
        if (source == null && category == null) {
            return true;
        }
        return (source != null && source.equals(incident.getSource()))
                || (category != null && category.equals(incident.getCategory()));
    }

    public static IncidentFilter unrestricted(int limit) {
        return IncidentFilter.builder().limit(limit).build();
    }
}
