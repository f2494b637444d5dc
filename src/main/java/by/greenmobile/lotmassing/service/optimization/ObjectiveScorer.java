package by.greenmobile.lotmassing.service.optimization;

import by.greenmobile.lotmassing.entity.FloorRecord;
import by.greenmobile.lotmassing.entity.FloorStack;
import by.greenmobile.lotmassing.entity.LotGeometry;
import by.greenmobile.lotmassing.entity.Objective;
import by.greenmobile.lotmassing.entity.ParameterSet;
import by.greenmobile.lotmassing.service.engine.FloorAreaModel;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

/**
 * Значение целевой функции для стека и выбираемый score.
 *
 * score = -Infinity для невыбираемых вариантов:
 * - пустой стек;
 * - maximize_far_within_height и FAR выше max_far.
 * Покрытие (coverage) только отчётное, в score не штрафуется.
 */
@Component
@RequiredArgsConstructor
public class ObjectiveScorer {

    /** Шаг квантования score: шум поворота маски не должен решать ничьи. */
    static final double SCORE_RESOLUTION = 1e-6;

    private static final double FAR_EPS = 1e-9;

    private final FloorAreaModel areaModel;

    public double objectiveValue(FloorStack stack, LotGeometry lot, ParameterSet p) {
        switch (p.getOptimizationObjective()) {
            case MAXIMIZE_UNITS:
                return areaModel.unitsIn(stack, p);
            case MAXIMIZE_EFFICIENCY: {
                double gross = stack.getGrossFloorArea();
                if (gross <= 0) return 0.0;
                double usable = stack.getFloors().stream().mapToDouble(FloorRecord::getUsableArea).sum();
                return usable / gross;
            }
            case MAXIMIZE_FAR_WITHIN_HEIGHT:
            default:
                return stack.getGrossFloorArea() / lot.area();
        }
    }

    public double score(FloorStack stack, LotGeometry lot, ParameterSet p) {
        if (stack.isEmpty()) return Double.NEGATIVE_INFINITY;

        if (p.getOptimizationObjective() == Objective.MAXIMIZE_FAR_WITHIN_HEIGHT) {
            double far = stack.getGrossFloorArea() / lot.area();
            if (far > p.getMaxFar() + FAR_EPS) return Double.NEGATIVE_INFINITY;
        }
        return quantize(objectiveValue(stack, lot, p));
    }

    static double quantize(double v) {
        return Math.round(v / SCORE_RESOLUTION) * SCORE_RESOLUTION;
    }
}
