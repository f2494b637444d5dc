package by.greenmobile.lotmassing.entity;

import lombok.Value;

import java.util.Comparator;

/**
 * Оценённый вариант формы (строка журнала оптимизатора).
 */
@Value
public class ShapeCandidate {

    /**
     * Порядок выбора: score по убыванию, затем shape_ratio и orientation по возрастанию.
     * Не зависит от порядка перебора.
     */
    public static final Comparator<ShapeCandidate> RANKING = Comparator
            .comparingDouble(ShapeCandidate::getScore).reversed()
            .thenComparingDouble(c -> c.getVariant().getShapeRatio())
            .thenComparingDouble(c -> c.getVariant().getOrientation());

    ShapeVariant variant;
    int floorCount;
    double grossFloorArea;
    double objectiveValue;
    /** -Infinity для невыбираемых вариантов. */
    double score;
    TerminationReason terminationReason;

    public boolean isSelectable() {
        return score > Double.NEGATIVE_INFINITY;
    }
}
