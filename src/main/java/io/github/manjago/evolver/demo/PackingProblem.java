package io.github.manjago.evolver.demo;

import io.github.manjago.evolver.core.Chromosome;
import io.github.manjago.evolver.core.EvoRng;
import io.github.manjago.evolver.core.GeneticProblem;
import org.jetbrains.annotations.NotNull;

import java.util.ArrayList;
import java.util.List;

/**
 * Pack rectangles into the smallest bounding box without overlaps.
 *
 * Gene i is the top-left corner of rectangle i inside an
 * {@value #AREA_WIDTH}x{@value #AREA_HEIGHT} area. Chromosomes should have
 * exactly {@link #rectangleCount()} genes; extra genes are ignored and
 * missing ones leave their rectangles out.
 *
 * Score: {@code 10000 - (bboxWidth + bboxHeight) - 10 * collisions}.
 */
public class PackingProblem implements GeneticProblem<PackingProblem.Position> {

    public static final int AREA_WIDTH = 800;
    public static final int AREA_HEIGHT = 500;

    private static final double BASE_SCORE = 10_000.0;
    private static final double COLLISION_PENALTY = 10.0;

    public record Position(int x, int y) {
        @Override
        public String toString() {
            return "(" + x + "," + y + ")";
        }
    }

    public record Size(int width, int height) {}

    public record BoundingBox(int minX, int minY, int maxX, int maxY) {
        public int width() { return maxX - minX; }
        public int height() { return maxY - minY; }
    }

    private final List<Size> rectangles;
    private final EvoRng rng;

    public PackingProblem(@NotNull List<Size> rectangles, @NotNull EvoRng rng) {
        if (rectangles.isEmpty()) {
            throw new IllegalArgumentException("Nothing to pack");
        }
        this.rectangles = List.copyOf(rectangles);
        this.rng = rng;
    }

    /**
     * Random cluster of 50-100 rectangles with sides of 10-60.
     */
    public static PackingProblem randomCluster(@NotNull EvoRng rng) {
        int count = rng.nextInt(50, 100);
        List<Size> sizes = new ArrayList<>(count);
        for (int i = 0; i < count; i++) {
            sizes.add(new Size(rng.nextInt(10, 60), rng.nextInt(10, 60)));
        }
        return new PackingProblem(sizes, rng);
    }

    public int rectangleCount() {
        return rectangles.size();
    }

    public List<Size> getRectangles() {
        return rectangles;
    }

    public BoundingBox boundingBox(@NotNull Chromosome<Position> chromosome) {
        int minX = AREA_WIDTH, minY = AREA_HEIGHT, maxX = 0, maxY = 0;
        int n = placed(chromosome);
        for (int i = 0; i < n; i++) {
            Position p = chromosome.gene(i);
            Size s = rectangles.get(i);
            minX = Math.min(minX, p.x());
            minY = Math.min(minY, p.y());
            maxX = Math.max(maxX, p.x() + s.width());
            maxY = Math.max(maxY, p.y() + s.height());
        }
        return new BoundingBox(minX, minY, maxX, maxY);
    }

    /**
     * Number of overlapping rectangle pairs.
     */
    public int collisions(@NotNull Chromosome<Position> chromosome) {
        int collisions = 0;
        int n = placed(chromosome);
        for (int i = 0; i < n - 1; i++) {
            Position a = chromosome.gene(i);
            Size sa = rectangles.get(i);
            for (int j = i + 1; j < n; j++) {
                Position b = chromosome.gene(j);
                Size sb = rectangles.get(j);
                if (a.x() < b.x() + sb.width()
                        && a.x() + sa.width() > b.x()
                        && a.y() < b.y() + sb.height()
                        && a.y() + sa.height() > b.y()) {
                    collisions++;
                }
            }
        }
        return collisions;
    }

    private int placed(Chromosome<Position> chromosome) {
        return Math.min(chromosome.length(), rectangles.size());
    }

    @Override
    public Position randomGene() {
        return new Position(rng.nextInt(0, AREA_WIDTH), rng.nextInt(0, AREA_HEIGHT));
    }

    @Override
    public double score(Chromosome<Position> chromosome) {
        BoundingBox bb = boundingBox(chromosome);
        return BASE_SCORE - (bb.width() + bb.height()) - COLLISION_PENALTY * collisions(chromosome);
    }

    @Override
    public String print(Chromosome<Position> chromosome) {
        BoundingBox bb = boundingBox(chromosome);
        return String.format("bbox %dx%d, %d collisions", bb.width(), bb.height(), collisions(chromosome));
    }
}
