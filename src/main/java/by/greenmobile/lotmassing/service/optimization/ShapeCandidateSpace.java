package by.greenmobile.lotmassing.service.optimization;

import by.greenmobile.lotmassing.entity.ModelingMode;
import by.greenmobile.lotmassing.entity.ParameterSet;
import by.greenmobile.lotmassing.entity.ShapeVariant;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Пространство вариантов формы.
 *
 * basic    -> [ORTHOGONAL]
 * advanced -> shape_ratio_steps x orientation_steps (L-формы). Ортогональная форма сюда не входит:
 *             её всегда даёт базовый стек.
 */
@Component
public class ShapeCandidateSpace {

    public List<ShapeVariant> enumerate(ParameterSet p) {
        if (p.getModelingMode() != ModelingMode.ADVANCED) {
            return List.of(ShapeVariant.ORTHOGONAL);
        }

        Set<ShapeVariant> out = new LinkedHashSet<>();
        for (Double ratio : safe(p.getShapeRatioSteps())) {
            for (Double orientation : safe(p.getOrientationSteps())) {
                out.add(ShapeVariant.lShape(ratio, normalize(orientation)));
            }
        }
        return new ArrayList<>(out);
    }

    /** Угол в диапазон [0, 360). */
    static double normalize(double degrees) {
        double d = degrees % 360.0;
        return d < 0 ? d + 360.0 : d;
    }

    private static List<Double> safe(List<Double> values) {
        return values == null ? List.of() : values;
    }
}
