package com.arborstatics.common.catalogue;

import com.arborstatics.common.exception.CatalogueLoadException;
import com.arborstatics.common.exception.UnknownProfileException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;

/**
 * Read-only, insertion-ordered lookup table of profiles keyed by id.
 *
 * <p>Instances are built once and passed to whoever needs them; there is no
 * static registry. Safe to share across threads.
 */
public abstract class ProfileCatalogue<T> {

    private static final Logger log = LoggerFactory.getLogger(ProfileCatalogue.class);

    private final String name;
    private final Map<String, T> byId;

    protected ProfileCatalogue(String name, List<T> profiles, Function<T, String> idOf) {
        this.name = name;
        Map<String, T> map = new LinkedHashMap<>();
        for (T profile : profiles) {
            String id = idOf.apply(profile);
            if (id == null || id.isBlank()) {
                throw new CatalogueLoadException(name, "Profile without id: " + profile);
            }
            if (map.putIfAbsent(id, profile) != null) {
                throw new CatalogueLoadException(name, "Duplicate profile id '" + id + "'");
            }
        }
        this.byId = Collections.unmodifiableMap(map);
    }

    public T get(String id) {
        T profile = id == null ? null : byId.get(id);
        if (profile == null) {
            throw new UnknownProfileException(name, id);
        }
        return profile;
    }

    public Optional<T> find(String id) {
        return id == null ? Optional.empty() : Optional.ofNullable(byId.get(id));
    }

    public Collection<T> all() {
        return byId.values();
    }

    public int size() {
        return byId.size();
    }

    public String name() {
        return name;
    }

    static <T> List<T> readList(ObjectMapper mapper,
                                String catalogue,
                                String resourcePath,
                                TypeReference<List<T>> type) {
        ClassLoader loader = ProfileCatalogue.class.getClassLoader();
        try (InputStream in = loader.getResourceAsStream(resourcePath)) {
            if (in == null) {
                throw new CatalogueLoadException(catalogue, "Resource not found: " + resourcePath);
            }
            List<T> profiles = mapper.readValue(in, type);
            log.info("[{}] Loaded {} profiles from {}", catalogue, profiles.size(), resourcePath);
            return profiles;
        } catch (IOException e) {
            throw new CatalogueLoadException(catalogue, "Failed to read " + resourcePath, e);
        }
    }
}
