package com.arborstatics.common.catalogue;

import com.arborstatics.common.model.WindProfile;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.util.List;

/**
 * Australian wind region and exposure presets (regions A-D, urban and open).
 */
public final class WindCatalogue extends ProfileCatalogue<WindProfile> {

    public static final String DEFAULT_RESOURCE = "catalogue/wind.json";

    private static final String NAME = "WindCatalogue";

    public WindCatalogue(List<WindProfile> profiles) {
        super(NAME, profiles, WindProfile::id);
    }

    public static WindCatalogue load(ObjectMapper mapper) {
        return load(mapper, DEFAULT_RESOURCE);
    }

    public static WindCatalogue load(ObjectMapper mapper, String resourcePath) {
        return new WindCatalogue(readList(mapper, NAME, resourcePath, new TypeReference<List<WindProfile>>() {}));
    }
}
