package io.github.manjago.evolver.demo;

import io.github.manjago.evolver.core.Chromosome;
import io.github.manjago.evolver.core.EvoRng;
import io.github.manjago.evolver.core.GeneticProblem;
import org.jetbrains.annotations.NotNull;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Symbolic regression: find a function matching sampled values.
 *
 * A chromosome is an expression such as {@code 3 * x - 8.5}: operands at
 * even positions, operators at odd positions, evaluated strictly left to
 * right without precedence. The score is {@code 100 / (squaredError + 1)}
 * over the sample points, so a perfect fit scores 100. Invalid expressions
 * get the smallest positive score so roulette wheel selection keeps working.
 */
public class RegressionProblem implements GeneticProblem<Token> {

    /** Score of an expression that does not alternate operands and operators. */
    public static final double INVALID_SCORE = Double.MIN_NORMAL;

    /** Score of a perfect fit. */
    public static final double PERFECT_SCORE = 100.0;

    private static final Token.Type[] TYPES = Token.Type.values();

    private final double[] inputs;
    private final double[] outputs;
    private final EvoRng rng;

    /**
     * @param inputs sample abscissas (avoid 0, division by x would blow up)
     * @param outputs expected value at each abscissa
     */
    public RegressionProblem(double @NotNull [] inputs, double @NotNull [] outputs, @NotNull EvoRng rng) {
        if (inputs.length != outputs.length) {
            throw new IllegalArgumentException("inputs and outputs differ in length");
        }
        this.inputs = inputs.clone();
        this.outputs = outputs.clone();
        this.rng = rng;
    }

    /**
     * Sample a target expression at x in [-5, 5] with step 0.1 (skipping 0),
     * adding uniform noise in [-noise, noise].
     */
    public static RegressionProblem sampling(@NotNull Chromosome<Token> target, double noise, @NotNull EvoRng rng) {
        List<Double> xs = new ArrayList<>();
        for (int i = -50; i <= 50; i++) {
            if (i != 0) {
                xs.add(i / 10.0);
            }
        }
        double[] inputs = new double[xs.size()];
        double[] outputs = new double[xs.size()];
        for (int i = 0; i < inputs.length; i++) {
            inputs[i] = xs.get(i);
            outputs[i] = evaluate(target, inputs[i]) + (noise > 0 ? rng.nextDouble(-noise, noise) : 0.0);
        }
        return new RegressionProblem(inputs, outputs, rng);
    }

    // ========== Expressions ==========

    /**
     * Parse a space separated expression: "3 * x - 8.5".
     */
    public static Chromosome<Token> parse(@NotNull String expression) {
        List<Token> tokens = new ArrayList<>();
        for (String part : expression.trim().split("\\s+")) {
            tokens.add(Token.parse(part));
        }
        return Chromosome.of(tokens);
    }

    public static String format(@NotNull Chromosome<Token> expression) {
        return expression.genes().stream()
                .map(Token::toString)
                .collect(Collectors.joining(" "));
    }

    /**
     * An expression is valid when operands and operators alternate,
     * starting with an operand.
     */
    public static boolean isValid(@NotNull Chromosome<Token> expression) {
        for (int i = 0; i < expression.length(); i++) {
            boolean operand = expression.gene(i).type().isOperand();
            if ((i % 2 == 0) != operand) {
                return false;
            }
        }
        return expression.length() > 0;
    }

    /**
     * Evaluate left to right. Invalid expressions evaluate to 0.
     * A trailing operator is ignored.
     */
    public static double evaluate(@NotNull Chromosome<Token> expression, double x) {
        if (!isValid(expression)) {
            return 0.0;
        }

        double result = expression.gene(0).operand(x);
        for (int i = 2; i < expression.length(); i += 2) {
            double operand = expression.gene(i).operand(x);
            switch (expression.gene(i - 1).type()) {
                case ADD -> result += operand;
                case SUB -> result -= operand;
                case MUL -> result *= operand;
                case DIV -> result /= operand;
                default -> throw new IllegalStateException("Operator expected at " + (i - 1));
            }
        }
        return result;
    }

    // ========== GeneticProblem ==========

    @Override
    public Token randomGene() {
        Token.Type type = TYPES[rng.nextInt(TYPES.length)];
        return switch (type) {
            case NUMBER -> Token.number(rng.nextDouble(0.0, 100.0));
            case INPUT -> Token.input();
            default -> Token.operator(type);
        };
    }

    @Override
    public double score(Chromosome<Token> chromosome) {
        if (!isValid(chromosome)) {
            return INVALID_SCORE;
        }

        double error = 0.0;
        for (int i = 0; i < inputs.length; i++) {
            double diff = evaluate(chromosome, inputs[i]) - outputs[i];
            error += diff * diff;
        }

        double score = PERFECT_SCORE / (error + 1.0);
        // NaN comes from inf - inf or 0/0 during evaluation
        return Double.isNaN(score) ? INVALID_SCORE : score;
    }

    @Override
    public String print(Chromosome<Token> chromosome) {
        return format(chromosome);
    }
}
