package com.civilworks.carbon.service.enrichment;

import com.civilworks.carbon.model.MaterialProfile;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * First-hit keyword classification of contract text against the material reference table.
 *
 * <p>Rows are consulted in table order, skipping the generic row, and the first row with any
 * keyword occurring as a substring of the lower-cased text is returned. Table order is the
 * priority: a row for "steel sheet piling" has to sit above a row for "steel".
 * When nothing matches the generic row is returned, or empty if the table has none.
 */
@Component
public class MaterialMatcher {

    public Optional<MaterialProfile> match(String text, List<MaterialProfile> materials) {
        String haystack = text == null ? "" : text.toLowerCase(Locale.ROOT);
        for (MaterialProfile m : materials) {
            if (m.isGeneric()) continue;
            for (String keyword : m.getKeywords()) {
                if (!keyword.isEmpty() && haystack.contains(keyword)) {
                    return Optional.of(m);
                }
            }
        }
        return materials.stream().filter(MaterialProfile::isGeneric).findFirst();
    }
}
