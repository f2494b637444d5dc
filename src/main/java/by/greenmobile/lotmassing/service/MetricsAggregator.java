package by.greenmobile.lotmassing.service;

import by.greenmobile.lotmassing.entity.FloorRecord;
import by.greenmobile.lotmassing.entity.FloorStack;
import by.greenmobile.lotmassing.entity.LotGeometry;
import by.greenmobile.lotmassing.entity.ParameterSet;
import by.greenmobile.lotmassing.entity.ParkingPlan;
import by.greenmobile.lotmassing.entity.SummaryMetrics;
import by.greenmobile.lotmassing.service.engine.FloorAreaModel;
import by.greenmobile.lotmassing.service.geometry.FaceOffsetGeometry;
import by.greenmobile.lotmassing.service.optimization.ObjectiveScorer;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Сводка по готовому стеку: GFA, FAR, покрытие, квартиры, парковка, соответствие нормативам.
 * Чистая свёртка, без отказов.
 */
@Service
@RequiredArgsConstructor
public class MetricsAggregator {

    /** Допуск проверки нормативов (0.1%). */
    static final double COMPLIANCE_TOLERANCE = 1.001;

    private final FloorAreaModel areaModel;
    private final ObjectiveScorer scorer;
    private final FaceOffsetGeometry geometry;

    public SummaryMetrics summarize(FloorStack stack, ParkingPlan parking, LotGeometry lot, ParameterSet p) {
        double lotArea = lot.area();
        double gfa = stack.getGrossFloorArea();
        double parkingInFar = parking.isIncludedInFar() ? parking.getAreaProvided() : 0.0;
        double farArea = gfa + parkingInFar;
        double far = farArea / lotArea;

        FloorRecord ground = stack.getGroundFloor();
        double coverage = ground != null ? ground.getFootprintArea() / lotArea : 0.0;

        double usable = stack.getFloors().stream().mapToDouble(FloorRecord::getUsableArea).sum();
        double efficiency = gfa > 0 ? usable / gfa : 0.0;
        double height = stack.getTotalHeight();

        Double slenderness = null;
        if (ground != null) {
            double width = geometry.minimumWidth(ground.getFootprint());
            if (width > 0) slenderness = height / width;
        }

        List<String> violations = new ArrayList<>();
        if (height > p.getMaxHeight() * COMPLIANCE_TOLERANCE) {
            violations.add(String.format(Locale.US, "height %.2f > max_height %.2f", height, p.getMaxHeight()));
        }
        if (far > p.getMaxFar() * COMPLIANCE_TOLERANCE) {
            violations.add(String.format(Locale.US, "FAR %.3f > max_far %.3f", far, p.getMaxFar()));
        }
        if (coverage > p.getMaxLotCoverage() * COMPLIANCE_TOLERANCE) {
            violations.add(String.format(Locale.US, "coverage %.3f > max_lot_coverage %.3f", coverage, p.getMaxLotCoverage()));
        }

        return SummaryMetrics.builder()
                .floorCount(stack.getFloorCount())
                .totalHeight(height)
                .grossFloorArea(gfa)
                .farArea(farArea)
                .achievedFar(far)
                .coverage(coverage)
                .unitCount(areaModel.unitsIn(stack, p))
                .usableArea(usable)
                .efficiency(efficiency)
                .meetsTargetEfficiency(gfa > 0 && efficiency >= p.getTargetEfficiency())
                .slenderness(slenderness)
                .parkingStallsRequired(parking.getStallsRequired())
                .parkingStallsProvided(parking.getStallsProvided())
                .parkingAreaRequired(parking.getAreaRequired())
                .parkingAreaProvided(parking.getAreaProvided())
                .parkingLevelsUsed(parking.getLevelsUsed())
                .parkingShortfall(parking.isShortfall())
                .objective(p.getOptimizationObjective())
                .objectiveValue(scorer.objectiveValue(stack, lot, p))
                .compliant(violations.isEmpty())
                .violations(List.copyOf(violations))
                .build();
    }
}
