package io.github.manjago.evolver.config;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigException;
import com.typesafe.config.ConfigFactory;
import io.github.manjago.evolver.ending.EndingCriterionType;
import io.github.manjago.evolver.selection.SelectionType;

import java.nio.file.Path;

/**
 * Configuration for the genetic algorithm.
 *
 * Loads from HOCON files using typesafe-config.
 * Default values are in reference.conf.
 */
public record EvolutionConfig(
    // Population
    int populationSize,

    // Mutation
    double mutationProbability,

    // Ending
    EndingCriterionType endingCriterion,
    double maxEndScore,       // only used by MAX_SCORE

    // Selection
    SelectionType selectionType,
    int tournamentSize,       // only used by TOURNAMENT

    // Chromosomes
    int minChromosomeSize,
    int maxChromosomeSize,

    // Random
    long randomSeed           // 0 = shared process-wide source
) {

    /**
     * Load default configuration.
     */
    public static EvolutionConfig defaults() {
        return fromConfig(ConfigFactory.load());
    }

    /**
     * Load configuration from a specific file.
     */
    public static EvolutionConfig fromFile(Path configFile) {
        Config fileConfig = ConfigFactory.parseFile(configFile.toFile());
        Config merged = fileConfig.withFallback(ConfigFactory.load());
        return fromConfig(merged);
    }

    /**
     * Load from Config object.
     *
     * @throws EvolutionConfigException if a criterion or selection type is unknown
     */
    public static EvolutionConfig fromConfig(Config config) {
        Config c = config.getConfig("evolver");

        try {
            return new EvolutionConfig(
                c.getInt("population.size"),
                c.getDouble("mutation.probability"),
                c.getEnum(EndingCriterionType.class, "ending.criterion"),
                c.getDouble("ending.max-score"),
                c.getEnum(SelectionType.class, "selection.type"),
                c.getInt("selection.tournament-size"),
                c.getInt("chromosome.min-size"),
                c.getInt("chromosome.max-size"),
                c.getLong("random.seed")
            );
        } catch (ConfigException.BadValue e) {
            throw new EvolutionConfigException("Invalid configuration: " + e.getMessage(), e);
        }
    }

    /**
     * Check the configuration before a run.
     *
     * @throws EvolutionConfigException describing the first problem found
     */
    public void validate() {
        if (endingCriterion == null) {
            throw new EvolutionConfigException("Unknown ending criterion");
        }
        if (selectionType == null) {
            throw new EvolutionConfigException("Unknown selection type");
        }
        if (populationSize < 2) {
            throw new EvolutionConfigException("Population size must be at least 2: " + populationSize);
        }
        if (!(mutationProbability >= 0.0 && mutationProbability <= 1.0)) {
            throw new EvolutionConfigException("Mutation probability must be in [0, 1]: " + mutationProbability);
        }
        if (minChromosomeSize < 1) {
            throw new EvolutionConfigException("Minimum chromosome size must be at least 1: " + minChromosomeSize);
        }
        if (minChromosomeSize > maxChromosomeSize) {
            throw new EvolutionConfigException(String.format(
                "Minimum chromosome size (%d) exceeds maximum (%d)", minChromosomeSize, maxChromosomeSize));
        }
        if (selectionType == SelectionType.TOURNAMENT) {
            if (tournamentSize < 1) {
                throw new EvolutionConfigException("Tournament size must be at least 1: " + tournamentSize);
            }
            if (tournamentSize > populationSize) {
                throw new EvolutionConfigException(String.format(
                    "The tournament size (%d) cannot be greater than the population size (%d)",
                    tournamentSize, populationSize));
            }
        }
    }

    /**
     * Builder for programmatic configuration.
     */
    public static Builder builder() {
        return new Builder();
    }

    /**
     * Builder pre-filled with this configuration.
     */
    public Builder toBuilder() {
        return new Builder()
                .populationSize(populationSize)
                .mutationProbability(mutationProbability)
                .endingCriterion(endingCriterion)
                .maxEndScore(maxEndScore)
                .selectionType(selectionType)
                .tournamentSize(tournamentSize)
                .chromosomeSize(minChromosomeSize, maxChromosomeSize)
                .randomSeed(randomSeed);
    }

    public static class Builder {
        private int populationSize = 100;
        private double mutationProbability = 0.01;
        private EndingCriterionType endingCriterion = EndingCriterionType.BEST_SCORE;
        private double maxEndScore = 0.0;
        private SelectionType selectionType = SelectionType.TOURNAMENT;
        private int tournamentSize = 10;
        private int minChromosomeSize = 1;
        private int maxChromosomeSize = 100;
        private long randomSeed = 0;

        public Builder populationSize(int size) { this.populationSize = size; return this; }
        public Builder mutationProbability(double probability) { this.mutationProbability = probability; return this; }
        public Builder endingCriterion(EndingCriterionType criterion) { this.endingCriterion = criterion; return this; }
        public Builder maxEndScore(double score) { this.maxEndScore = score; return this; }
        public Builder selectionType(SelectionType type) { this.selectionType = type; return this; }
        public Builder tournamentSize(int size) { this.tournamentSize = size; return this; }
        public Builder randomSeed(long seed) { this.randomSeed = seed; return this; }

        /**
         * Shortcut for MAX_SCORE with its threshold.
         */
        public Builder maxScore(double threshold) {
            this.endingCriterion = EndingCriterionType.MAX_SCORE;
            this.maxEndScore = threshold;
            return this;
        }

        /**
         * Shortcut for TOURNAMENT with its size.
         */
        public Builder tournament(int size) {
            this.selectionType = SelectionType.TOURNAMENT;
            this.tournamentSize = size;
            return this;
        }

        /**
         * Inclusive length range of generated chromosomes. Use min == max for a constant length.
         */
        public Builder chromosomeSize(int min, int max) {
            this.minChromosomeSize = min;
            this.maxChromosomeSize = max;
            return this;
        }

        public EvolutionConfig build() {
            return new EvolutionConfig(
                populationSize, mutationProbability, endingCriterion, maxEndScore,
                selectionType, tournamentSize, minChromosomeSize, maxChromosomeSize, randomSeed
            );
        }
    }

    @Override
    public String toString() {
        return String.format("""
            EvolutionConfig:
              population.size:           %,d
              mutation.probability:      %.4f (%.2f%%)
              ending.criterion:          %s
              ending.max-score:          %s
              selection.type:            %s
              selection.tournament-size: %s
              chromosome.size:           %d..%d
              random.seed:               %s
            """,
            populationSize,
            mutationProbability, mutationProbability * 100,
            endingCriterion,
            endingCriterion == EndingCriterionType.MAX_SCORE ? String.valueOf(maxEndScore) : "n/a",
            selectionType,
            selectionType == SelectionType.TOURNAMENT ? String.valueOf(tournamentSize) : "n/a",
            minChromosomeSize, maxChromosomeSize,
            randomSeed == 0 ? "shared" : String.valueOf(randomSeed)
        );
    }
}
