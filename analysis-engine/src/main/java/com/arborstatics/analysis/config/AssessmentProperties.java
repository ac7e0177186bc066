package com.arborstatics.analysis.config;

import com.arborstatics.common.catalogue.SpeciesCatalogue;
import com.arborstatics.common.catalogue.WindCatalogue;
import com.arborstatics.common.threshold.SolverSettings;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Type-safe binding of the {@code arbor.*} keys in application.yml.
 */
@ConfigurationProperties(prefix = "arbor")
public class AssessmentProperties {

    private Solver solver = new Solver();
    private Catalogue catalogue = new Catalogue();

    public Solver getSolver() {
        return solver;
    }

    public void setSolver(Solver solver) {
        this.solver = solver;
    }

    public Catalogue getCatalogue() {
        return catalogue;
    }

    public void setCatalogue(Catalogue catalogue) {
        this.catalogue = catalogue;
    }

    /**
     * Residual-wall bisection settings.
     */
    public static class Solver {
        private int maxIterations = SolverSettings.DEFAULT.maxIterations();
        private double tolerance = SolverSettings.DEFAULT.tolerance();
        private double lowerResidualPercent = SolverSettings.DEFAULT.lowerResidualPercent();
        private double upperResidualPercent = SolverSettings.DEFAULT.upperResidualPercent();

        public SolverSettings toSettings() {
            return new SolverSettings(maxIterations, tolerance, lowerResidualPercent, upperResidualPercent);
        }

        public int getMaxIterations() {
            return maxIterations;
        }

        public void setMaxIterations(int maxIterations) {
            this.maxIterations = maxIterations;
        }

        public double getTolerance() {
            return tolerance;
        }

        public void setTolerance(double tolerance) {
            this.tolerance = tolerance;
        }

        public double getLowerResidualPercent() {
            return lowerResidualPercent;
        }

        public void setLowerResidualPercent(double lowerResidualPercent) {
            this.lowerResidualPercent = lowerResidualPercent;
        }

        public double getUpperResidualPercent() {
            return upperResidualPercent;
        }

        public void setUpperResidualPercent(double upperResidualPercent) {
            this.upperResidualPercent = upperResidualPercent;
        }
    }

    /**
     * Classpath locations of the catalogue JSON files.
     */
    public static class Catalogue {
        private String species = SpeciesCatalogue.DEFAULT_RESOURCE;
        private String wind = WindCatalogue.DEFAULT_RESOURCE;

        public String getSpecies() {
            return species;
        }

        public void setSpecies(String species) {
            this.species = species;
        }

        public String getWind() {
            return wind;
        }

        public void setWind(String wind) {
            this.wind = wind;
        }
    }
}
