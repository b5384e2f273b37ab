package com.example.nl2cmd.dao;

import com.example.nl2cmd.config.Nl2CmdProperties;
import com.example.nl2cmd.model.ProblemCategory;
import com.example.nl2cmd.util.JsonResources;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.core.io.ResourceLoader;
import org.springframework.stereotype.Repository;

import java.io.IOException;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

@Slf4j
@Repository
public class JsonProblemCatalogDao implements ProblemCatalogDao {

    private final List<ProblemCategory> categories;

    @Autowired
    public JsonProblemCatalogDao(ResourceLoader resourceLoader, Nl2CmdProperties properties) {
        this(load(resourceLoader, properties.getDataset().getProblems()));
    }

    private JsonProblemCatalogDao(List<ProblemCategory> categories) {
        this.categories = categories.stream().filter(Objects::nonNull).toList();
    }

    public static JsonProblemCatalogDao of(List<ProblemCategory> categories) {
        return new JsonProblemCatalogDao(categories);
    }

    @Override
    public List<ProblemCategory> findAll() {
        return categories;
    }

    private static List<ProblemCategory> load(ResourceLoader loader, String location) {
        Optional<CatalogBundle> bundle;
        try {
            bundle = JsonResources.read(loader, location, CatalogBundle.class);
        } catch (IOException ex) {
            log.warn("Failed to load problem catalog from {}: {}", location, ex.getMessage());
            return List.of();
        }
        List<ProblemCategory> categories = bundle
                .map(b -> b.categories)
                .orElse(null);
        if (categories == null || categories.isEmpty()) {
            log.warn("Problem catalog {} is missing or empty; diagnosis will be disabled", location);
            return List.of();
        }
        log.info("Loaded {} problem categories from {}", categories.size(), location);
        return categories;
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    static class CatalogBundle {
        public List<ProblemCategory> categories;
    }
}
