package com.costsentinel.core.config;

/**
 * Typed, immutable tuning parameters for the detection engine.
 *
 * <p>
 * Values are resolved from environment variables with sensible defaults, so
 * the embedding service can be tuned through its deployment environment
 * without code changes.
 * </p>
 *
 * <h3>Construction</h3>
 * <p>
 * Use {@link #fromEnvironment()} for production, {@link #defaults()} or the
 * {@link Builder} for programmatic / test scenarios. The builder validates
 * inputs at {@link Builder#build()} time.
 * </p>
 *
 * @since 1.0.0
 */
public final class DetectionConfig {

    // ---------------------------------------------------------------
    // Thresholds and data volume
    // ---------------------------------------------------------------
    private final double defaultThreshold;
    private final int minDataPoints;
    private final int minContextDataPoints;
    private final int minDistancePoints;
    private final int minDecompositionPoints;

    // ---------------------------------------------------------------
    // Density clustering
    // ---------------------------------------------------------------
    private final int densityMinNeighborsFloor;
    private final double densityMinNeighborsFraction;
    private final double densityRadiusFactor;

    // ---------------------------------------------------------------
    // Isolation forest
    // ---------------------------------------------------------------
    private final int isolationTrees;
    private final int isolationSampleSize;
    private final long isolationSeed;

    // ---------------------------------------------------------------
    // Decomposition
    // ---------------------------------------------------------------
    private final double seasonalityThreshold;

    // ---------------------------------------------------------------
    // Partitioning and taxonomy
    // ---------------------------------------------------------------
    private final boolean partitionByEntity;
    private final String taxonomyPath;

    private DetectionConfig(Builder b) {
        this.defaultThreshold = b.defaultThreshold;
        this.minDataPoints = b.minDataPoints;
        this.minContextDataPoints = b.minContextDataPoints;
        this.minDistancePoints = b.minDistancePoints;
        this.minDecompositionPoints = b.minDecompositionPoints;
        this.densityMinNeighborsFloor = b.densityMinNeighborsFloor;
        this.densityMinNeighborsFraction = b.densityMinNeighborsFraction;
        this.densityRadiusFactor = b.densityRadiusFactor;
        this.isolationTrees = b.isolationTrees;
        this.isolationSampleSize = b.isolationSampleSize;
        this.isolationSeed = b.isolationSeed;
        this.seasonalityThreshold = b.seasonalityThreshold;
        this.partitionByEntity = b.partitionByEntity;
        this.taxonomyPath = b.taxonomyPath;
    }

    // ---------------------------------------------------------------
    // Factories
    // ---------------------------------------------------------------

    /**
     * @return configuration with every default applied
     */
    public static DetectionConfig defaults() {
        return new Builder().build();
    }

    /**
     * Build a {@link DetectionConfig} from environment variables.
     *
     * @return fully populated configuration
     * @throws IllegalStateException    if an env-var value cannot be parsed
     * @throws IllegalArgumentException if a validated field is out of range
     */
    public static DetectionConfig fromEnvironment() {
        try {
            return new Builder()
                    .defaultThreshold(parseDoubleEnv("COST_SENTINEL_DEFAULT_THRESHOLD", "2.0"))
                    .minDataPoints(parseIntEnv("COST_SENTINEL_MIN_DATA_POINTS", "5"))
                    .minContextDataPoints(parseIntEnv("COST_SENTINEL_MIN_CONTEXT_DATA_POINTS", "7"))
                    .minDistancePoints(parseIntEnv("COST_SENTINEL_MIN_DISTANCE_POINTS", "10"))
                    .minDecompositionPoints(parseIntEnv("COST_SENTINEL_MIN_DECOMPOSITION_POINTS", "14"))
                    .densityMinNeighborsFloor(parseIntEnv("COST_SENTINEL_DENSITY_MIN_NEIGHBORS", "3"))
                    .densityMinNeighborsFraction(parseDoubleEnv("COST_SENTINEL_DENSITY_NEIGHBOR_FRACTION", "0.05"))
                    .densityRadiusFactor(parseDoubleEnv("COST_SENTINEL_DENSITY_RADIUS_FACTOR", "0.5"))
                    .isolationTrees(parseIntEnv("COST_SENTINEL_ISOLATION_TREES", "100"))
                    .isolationSampleSize(parseIntEnv("COST_SENTINEL_ISOLATION_SAMPLE_SIZE", "256"))
                    .isolationSeed(parseLongEnv("COST_SENTINEL_ISOLATION_SEED", "42"))
                    .seasonalityThreshold(parseDoubleEnv("COST_SENTINEL_SEASONALITY_THRESHOLD", "0.3"))
                    .partitionByEntity(Boolean.parseBoolean(env("COST_SENTINEL_PARTITION_BY_ENTITY", "false")))
                    .taxonomyPath(env(TaxonomyLoader.ENV_TAXONOMY_PATH, ""))
                    .build();
        } catch (NumberFormatException e) {
            throw new IllegalStateException(
                    "Failed to parse numeric environment variable: " + e.getMessage(), e);
        }
    }

    /**
     * Minimum neighbour count for density clustering over {@code n} points:
     * {@code max(floor, fraction × n)}.
     *
     * @param n number of points being clustered
     * @return minimum neighbours a point needs to be a cluster core
     */
    public int densityMinNeighbors(int n) {
        return Math.max(densityMinNeighborsFloor, (int) (densityMinNeighborsFraction * n));
    }

    /**
     * @param contextRequested whether root-cause / context analysis is requested
     * @return the minimum series length for the run
     */
    public int requiredDataPoints(boolean contextRequested) {
        return contextRequested ? Math.max(minDataPoints, minContextDataPoints) : minDataPoints;
    }

    // ---------------------------------------------------------------
    // Getters
    // ---------------------------------------------------------------

    public double getDefaultThreshold() {
        return defaultThreshold;
    }

    public int getMinDataPoints() {
        return minDataPoints;
    }

    public int getMinContextDataPoints() {
        return minContextDataPoints;
    }

    public int getMinDistancePoints() {
        return minDistancePoints;
    }

    public int getMinDecompositionPoints() {
        return minDecompositionPoints;
    }

    public int getDensityMinNeighborsFloor() {
        return densityMinNeighborsFloor;
    }

    public double getDensityMinNeighborsFraction() {
        return densityMinNeighborsFraction;
    }

    public double getDensityRadiusFactor() {
        return densityRadiusFactor;
    }

    public int getIsolationTrees() {
        return isolationTrees;
    }

    public int getIsolationSampleSize() {
        return isolationSampleSize;
    }

    public long getIsolationSeed() {
        return isolationSeed;
    }

    public double getSeasonalityThreshold() {
        return seasonalityThreshold;
    }

    public boolean isPartitionByEntity() {
        return partitionByEntity;
    }

    public String getTaxonomyPath() {
        return taxonomyPath;
    }

    // ---------------------------------------------------------------
    // Builder
    // ---------------------------------------------------------------

    /**
     * Fluent builder for {@link DetectionConfig}.
     *
     * <p>
     * The {@link #build()} method validates that all values are within legal
     * ranges (positive threshold, ascending minimum point counts, fractions
     * in [0, 1], at least one isolation tree).
     * </p>
     */
    public static class Builder {
        private double defaultThreshold = 2.0;
        private int minDataPoints = 5;
        private int minContextDataPoints = 7;
        private int minDistancePoints = 10;
        private int minDecompositionPoints = 14;
        private int densityMinNeighborsFloor = 3;
        private double densityMinNeighborsFraction = 0.05;
        private double densityRadiusFactor = 0.5;
        private int isolationTrees = 100;
        private int isolationSampleSize = 256;
        private long isolationSeed = 42L;
        private double seasonalityThreshold = 0.3;
        private boolean partitionByEntity;
        private String taxonomyPath = "";

        public Builder defaultThreshold(double v) {
            this.defaultThreshold = v;
            return this;
        }

        public Builder minDataPoints(int v) {
            this.minDataPoints = v;
            return this;
        }

        public Builder minContextDataPoints(int v) {
            this.minContextDataPoints = v;
            return this;
        }

        public Builder minDistancePoints(int v) {
            this.minDistancePoints = v;
            return this;
        }

        public Builder minDecompositionPoints(int v) {
            this.minDecompositionPoints = v;
            return this;
        }

        public Builder densityMinNeighborsFloor(int v) {
            this.densityMinNeighborsFloor = v;
            return this;
        }

        public Builder densityMinNeighborsFraction(double v) {
            this.densityMinNeighborsFraction = v;
            return this;
        }

        public Builder densityRadiusFactor(double v) {
            this.densityRadiusFactor = v;
            return this;
        }

        public Builder isolationTrees(int v) {
            this.isolationTrees = v;
            return this;
        }

        public Builder isolationSampleSize(int v) {
            this.isolationSampleSize = v;
            return this;
        }

        public Builder isolationSeed(long v) {
            this.isolationSeed = v;
            return this;
        }

        public Builder seasonalityThreshold(double v) {
            this.seasonalityThreshold = v;
            return this;
        }

        public Builder partitionByEntity(boolean v) {
            this.partitionByEntity = v;
            return this;
        }

        public Builder taxonomyPath(String v) {
            this.taxonomyPath = v;
            return this;
        }

        /**
         * Build and validate the configuration.
         *
         * @return a validated {@link DetectionConfig}
         * @throws IllegalArgumentException if any value is invalid
         */
        public DetectionConfig build() {
            if (!(defaultThreshold > 0)) {
                throw new IllegalArgumentException("defaultThreshold must be > 0, got: " + defaultThreshold);
            }
            if (minDataPoints < 2) {
                throw new IllegalArgumentException("minDataPoints must be >= 2, got: " + minDataPoints);
            }
            if (minContextDataPoints < minDataPoints) {
                throw new IllegalArgumentException("minContextDataPoints must be >= minDataPoints ("
                        + minDataPoints + "), got: " + minContextDataPoints);
            }
            if (minDistancePoints < minDataPoints) {
                throw new IllegalArgumentException("minDistancePoints must be >= minDataPoints ("
                        + minDataPoints + "), got: " + minDistancePoints);
            }
            if (minDecompositionPoints < minDistancePoints) {
                throw new IllegalArgumentException("minDecompositionPoints must be >= minDistancePoints ("
                        + minDistancePoints + "), got: " + minDecompositionPoints);
            }
            if (densityMinNeighborsFloor < 1) {
                throw new IllegalArgumentException(
                        "densityMinNeighborsFloor must be >= 1, got: " + densityMinNeighborsFloor);
            }
            requireFraction(densityMinNeighborsFraction, "densityMinNeighborsFraction");
            if (!(densityRadiusFactor > 0)) {
                throw new IllegalArgumentException("densityRadiusFactor must be > 0, got: " + densityRadiusFactor);
            }
            if (isolationTrees < 1) {
                throw new IllegalArgumentException("isolationTrees must be >= 1, got: " + isolationTrees);
            }
            if (isolationSampleSize < 2) {
                throw new IllegalArgumentException(
                        "isolationSampleSize must be >= 2, got: " + isolationSampleSize);
            }
            requireFraction(seasonalityThreshold, "seasonalityThreshold");
            if (taxonomyPath == null) {
                taxonomyPath = "";
            }
            return new DetectionConfig(this);
        }

        private static void requireFraction(double value, String name) {
            if (!(value >= 0 && value <= 1)) {
                throw new IllegalArgumentException(name + " must be in [0, 1], got: " + value);
            }
        }
    }

    // ---------------------------------------------------------------
    // Internal
    // ---------------------------------------------------------------

    private static String env(String name, String defaultValue) {
        String value = System.getenv(name);
        return (value != null && !value.isBlank()) ? value : defaultValue;
    }

    private static int parseIntEnv(String name, String defaultValue) {
        return Integer.parseInt(env(name, defaultValue));
    }

    private static long parseLongEnv(String name, String defaultValue) {
        return Long.parseLong(env(name, defaultValue));
    }

    private static double parseDoubleEnv(String name, String defaultValue) {
        return Double.parseDouble(env(name, defaultValue));
    }

    @Override
    public String toString() {
        return "DetectionConfig{" +
                "defaultThreshold=" + defaultThreshold +
                ", minDataPoints=" + minDataPoints +
                ", minContextDataPoints=" + minContextDataPoints +
                ", minDistancePoints=" + minDistancePoints +
                ", minDecompositionPoints=" + minDecompositionPoints +
                ", densityMinNeighborsFloor=" + densityMinNeighborsFloor +
                ", densityMinNeighborsFraction=" + densityMinNeighborsFraction +
                ", densityRadiusFactor=" + densityRadiusFactor +
                ", isolationTrees=" + isolationTrees +
                ", isolationSampleSize=" + isolationSampleSize +
                ", isolationSeed=" + isolationSeed +
                ", seasonalityThreshold=" + seasonalityThreshold +
                ", partitionByEntity=" + partitionByEntity +
                ", taxonomyPath='" + taxonomyPath + '\'' +
                '}';
    }
}
