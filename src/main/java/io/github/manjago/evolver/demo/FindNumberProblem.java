package io.github.manjago.evolver.demo;

import io.github.manjago.evolver.core.Chromosome;
import io.github.manjago.evolver.core.EvoRng;
import io.github.manjago.evolver.core.GeneticProblem;
import org.jetbrains.annotations.NotNull;

import java.util.ArrayList;
import java.util.List;

/**
 * Find a number, digit by digit.
 *
 * A chromosome is a sequence of digits 0-9, e.g. {1, 6, 3} is 163.
 * The score counts digits matching the target at the same position and
 * subtracts 1 for every digit too many or too few, so the target itself
 * is the only chromosome scoring {@link #maxScore()}.
 */
public class FindNumberProblem implements GeneticProblem<Integer> {

    private final List<Integer> target;
    private final EvoRng rng;

    public FindNumberProblem(@NotNull String targetNumber, @NotNull EvoRng rng) {
        this(digitsOf(targetNumber), rng);
    }

    public FindNumberProblem(@NotNull List<Integer> targetDigits, @NotNull EvoRng rng) {
        if (targetDigits.isEmpty()) {
            throw new IllegalArgumentException("Target must have at least one digit");
        }
        this.target = List.copyOf(targetDigits);
        this.rng = rng;
    }

    /**
     * Split a decimal number into digits: "163" -> [1, 6, 3].
     */
    public static List<Integer> digitsOf(@NotNull String number) {
        List<Integer> digits = new ArrayList<>(number.length());
        for (char c : number.toCharArray()) {
            if (c < '0' || c > '9') {
                throw new IllegalArgumentException("Not a decimal number: " + number);
            }
            digits.add(c - '0');
        }
        return digits;
    }

    public List<Integer> getTarget() {
        return target;
    }

    /**
     * Score of the target itself: one point per digit.
     */
    public double maxScore() {
        return target.size();
    }

    @Override
    public Integer randomGene() {
        return rng.nextInt(0, 9);
    }

    @Override
    public double score(Chromosome<Integer> chromosome) {
        double score = 0.0;
        for (int i = 0; i < chromosome.length(); i++) {
            if (i >= target.size()) {
                score -= 1.0;
            } else if (chromosome.gene(i).equals(target.get(i))) {
                score += 1.0;
            }
        }
        if (chromosome.length() < target.size()) {
            score -= target.size() - chromosome.length();
        }
        return score;
    }

    @Override
    public String print(Chromosome<Integer> chromosome) {
        StringBuilder sb = new StringBuilder(chromosome.length());
        for (Integer digit : chromosome.genes()) {
            sb.append(digit);
        }
        return sb.toString();
    }
}
