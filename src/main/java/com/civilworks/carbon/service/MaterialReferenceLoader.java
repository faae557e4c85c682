package com.civilworks.carbon.service;

import com.civilworks.carbon.config.AppProperties;
import com.civilworks.carbon.model.MaterialProfile;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.io.ClassPathResource;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Loads the material reference table, preserving row order.
 *
 * <p>The table configured under {@code app.screening.material-reference-path} wins; otherwise
 * the bundled {@value #BUNDLED} is read from the classpath.
 */
@Service
public class MaterialReferenceLoader {
    private static final Logger log = LoggerFactory.getLogger(MaterialReferenceLoader.class);
    static final String BUNDLED = "reference/material_reference.csv";

    private final AppProperties appProperties;
    private final TableStore tableStore;

    public MaterialReferenceLoader(AppProperties appProperties, TableStore tableStore) {
        this.appProperties = appProperties;
        this.tableStore = tableStore;
    }

    public List<MaterialProfile> load() {
        String configured = appProperties.getScreening().getMaterialReferencePath();
        List<Map<String, String>> rows;
        if (configured != null && !configured.isBlank()) {
            rows = tableStore.readRows(Path.of(configured));
            log.info("Material reference loaded from {}", configured);
        } else {
            ClassPathResource resource = new ClassPathResource(BUNDLED);
            if (!resource.exists()) {
                throw new MissingInputException("classpath:" + BUNDLED);
            }
            try (InputStream in = resource.getInputStream()) {
                rows = tableStore.parseRows(in.readAllBytes(), "classpath:" + BUNDLED);
            } catch (IOException e) {
                throw new UncheckedIOException("Failed to read classpath:" + BUNDLED, e);
            }
        }

        List<MaterialProfile> materials = new ArrayList<>(rows.size());
        for (Map<String, String> row : rows) {
            materials.add(MaterialProfile.fromRow(row));
        }
        long generic = materials.stream().filter(MaterialProfile::isGeneric).count();
        if (generic != 1) {
            log.warn("Material reference should contain exactly one {} row, found {}", MaterialProfile.GENERIC_ID, generic);
        }
        return materials;
    }
}
