package by.greenmobile.lotmassing.service.validation;

import by.greenmobile.lotmassing.entity.ParameterSet;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Проверка согласованности набора параметров до начала расчёта.
 * Все нарушения собираются в одно сообщение.
 */
@Component
public class ParameterSetValidator {

    public void validate(String lotId, ParameterSet p) {
        List<String> errors = new ArrayList<>();

        positive(errors, "max_height", p.getMaxHeight());
        positive(errors, "gf_floor_height", p.getGfFloorHeight());
        positive(errors, "uf_floor_height", p.getUfFloorHeight());
        nonNegative(errors, "max_far", p.getMaxFar());
        nonNegative(errors, "max_lot_coverage", p.getMaxLotCoverage());

        nonNegative(errors, "min_front_setback", p.getMinFrontSetback());
        nonNegative(errors, "min_back_setback", p.getMinBackSetback());
        nonNegative(errors, "min_side_setback", p.getMinSideSetback());
        nonNegative(errors, "back_setback_percent", p.getBackSetbackPercent());
        if (p.getMinSetbackStartFloor() < 1) {
            errors.add("min_setback_start_floor must be >= 1");
        }

        nonNegative(errors, "min_floor_area", p.getMinFloorArea());
        nonNegative(errors, "min_unit_area", p.getMinUnitArea());
        positive(errors, "target_unit_area", p.getTargetUnitArea());
        nonNegative(errors, "min_unit_width", p.getMinUnitWidth());
        nonNegative(errors, "min_patios_dimension", p.getMinPatiosDimension());
        nonNegative(errors, "access_width", p.getAccessWidth());
        if (p.getCoreAreaFraction() < 0 || p.getCoreAreaFraction() >= 1) {
            errors.add("core_area_fraction must be in [0, 1)");
        }

        nonNegative(errors, "parking_ratio_residential", p.getParkingRatioResidential());
        nonNegative(errors, "parking_ratio_commercial", p.getParkingRatioCommercial());
        positive(errors, "commercial_area_for_parking_ratio", p.getCommercialAreaForParkingRatio());
        nonNegative(errors, "commercial_area", p.getCommercialArea());
        positive(errors, "parking_area_per_slot", p.getParkingAreaPerSlot());
        nonNegative(errors, "ramp_area_per_floor_fraction", p.getRampAreaPerFloorFraction());
        positive(errors, "parking_floor_height", p.getParkingFloorHeight());
        if (p.getParkingLevelsAllowed() < 0) {
            errors.add("parking_levels_allowed must be >= 0");
        }
        if (p.isParkingRequired() && p.getParkingType() == null) {
            errors.add("parking_type is required when parking_required is set");
        }

        if (p.getModelingMode() == null) errors.add("modeling_mode is required");
        if (p.getOptimizationObjective() == null) errors.add("optimization_objective is required");
        if (p.getMaxFloorCount() < 1) errors.add("max_floor_count must be >= 1");
        if (p.getShapeRatioSteps() != null) {
            for (Double r : p.getShapeRatioSteps()) {
                if (r == null || !(r > 0 && r < 1)) {
                    errors.add("shape_ratio_steps values must be in (0, 1), got " + r);
                }
            }
        }
        if (p.getOrientationSteps() != null) {
            for (Double o : p.getOrientationSteps()) {
                if (o == null || !Double.isFinite(o)) {
                    errors.add("orientation_steps values must be finite, got " + o);
                }
            }
        }

        if (!errors.isEmpty()) {
            throw new InvalidLotException(lotId, "invalid parameters: " + String.join("; ", errors));
        }
    }

    private static void positive(List<String> errors, String name, double v) {
        if (!(v > 0) || !Double.isFinite(v)) errors.add(name + " must be > 0");
    }

    private static void nonNegative(List<String> errors, String name, double v) {
        if (!(v >= 0) || !Double.isFinite(v)) errors.add(name + " must be >= 0");
    }
}
