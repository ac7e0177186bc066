package com.arborstatics.common.catalogue;

import com.arborstatics.common.exception.CatalogueLoadException;
import com.arborstatics.common.model.SpeciesProfile;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.util.List;

/**
 * Species-group presets. Strength values follow published green timber
 * properties; drag coefficients follow wind-tunnel studies.
 */
public final class SpeciesCatalogue extends ProfileCatalogue<SpeciesProfile> {

    public static final String DEFAULT_RESOURCE = "catalogue/species.json";
    public static final String GENERIC_EUCALYPT_ID = "euc_typical";

    private static final String NAME = "SpeciesCatalogue";

    public SpeciesCatalogue(List<SpeciesProfile> profiles) {
        super(NAME, profiles, SpeciesProfile::id);
        for (SpeciesProfile p : profiles) {
            if (!(p.greenBendingStrength() > 0.0)) {
                throw new CatalogueLoadException(NAME, "Non-positive bending strength for " + p.id());
            }
            if (p.defaultFullness() < 0.0 || p.defaultFullness() > 1.0) {
                throw new CatalogueLoadException(NAME, "Default fullness outside [0, 1] for " + p.id());
            }
        }
    }

    public static SpeciesCatalogue load(ObjectMapper mapper) {
        return load(mapper, DEFAULT_RESOURCE);
    }

    public static SpeciesCatalogue load(ObjectMapper mapper, String resourcePath) {
        return new SpeciesCatalogue(readList(mapper, NAME, resourcePath, new TypeReference<List<SpeciesProfile>>() {}));
    }
}
