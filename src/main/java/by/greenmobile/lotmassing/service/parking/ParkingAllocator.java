package by.greenmobile.lotmassing.service.parking;

import by.greenmobile.lotmassing.entity.FloorRecord;
import by.greenmobile.lotmassing.entity.FloorStack;
import by.greenmobile.lotmassing.entity.LotGeometry;
import by.greenmobile.lotmassing.entity.ParameterSet;
import by.greenmobile.lotmassing.entity.ParkingLevel;
import by.greenmobile.lotmassing.entity.ParkingPlan;
import by.greenmobile.lotmassing.entity.ParkingType;
import by.greenmobile.lotmassing.service.engine.FloorAreaModel;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Парковка для стека этажей.
 *
 * мест   = ceil(квартиры * ratio_res + (commercial_area / commercial_area_for_parking_ratio) * ratio_com)
 * площадь = мест * parking_area_per_slot * (1 + ramp_area_per_floor_fraction)
 *
 * Вместимость уровня:
 * - underground: площадь участка, до parking_levels_allowed уровней;
 * - surface: участок минус пятно первого этажа, один уровень.
 * Если не помещается, ставится shortfall. Число уровней сверх разрешённого не увеличивается.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class ParkingAllocator {

    private static final double EPS = 1e-9;

    private final FloorAreaModel areaModel;

    public ParkingPlan allocate(FloorStack stack, LotGeometry lot, ParameterSet p) {
        if (!p.isParkingRequired()) {
            return ParkingPlan.none(p.getParkingType());
        }

        int units = areaModel.unitsIn(stack, p);
        double demand = units * p.getParkingRatioResidential()
                + (p.getCommercialArea() / p.getCommercialAreaForParkingRatio()) * p.getParkingRatioCommercial();
        int stallsRequired = (int) Math.ceil(demand - EPS);
        if (stallsRequired <= 0) {
            return ParkingPlan.builder()
                    .levels(List.of())
                    .parkingType(p.getParkingType())
                    .includedInFar(p.isIncludeParkingInFar())
                    .build();
        }

        double areaPerStall = p.getParkingAreaPerSlot() * (1.0 + p.getRampAreaPerFloorFraction());
        double areaRequired = stallsRequired * areaPerStall;

        double capacity = levelCapacity(stack, lot, p.getParkingType());
        int levelsAllowed = p.getParkingType() == ParkingType.SURFACE
                ? Math.min(1, p.getParkingLevelsAllowed())
                : p.getParkingLevelsAllowed();

        int levelsNeeded = capacity > EPS ? (int) Math.ceil(areaRequired / capacity - EPS) : Integer.MAX_VALUE;
        int levelsUsed = Math.min(levelsNeeded, levelsAllowed);

        List<ParkingLevel> levels = new ArrayList<>();
        double remaining = areaRequired;
        for (int i = 1; i <= levelsUsed && remaining > EPS && capacity > EPS; i++) {
            double area = Math.min(capacity, remaining);
            levels.add(level(p, i, area));
            remaining -= area;
        }

        double areaProvided = areaRequired - Math.max(0.0, remaining);
        boolean shortfall = remaining > EPS;
        int stallsProvided = Math.min(stallsRequired, (int) Math.floor(areaProvided / areaPerStall + EPS));

        if (shortfall) {
            log.warn("PARKING {}: shortfall {} of {} stalls ({} levels of {} allowed, capacity {} m2/level)",
                    lot.getLotId(), stallsRequired - stallsProvided, stallsRequired,
                    levels.size(), levelsAllowed, Math.round(capacity));
        }

        return ParkingPlan.builder()
                .stallsRequired(stallsRequired)
                .stallsProvided(stallsProvided)
                .areaRequired(areaRequired)
                .areaProvided(areaProvided)
                .levelsUsed(levels.size())
                .levels(List.copyOf(levels))
                .parkingType(p.getParkingType())
                .shortfall(shortfall)
                .includedInFar(p.isIncludeParkingInFar())
                .build();
    }

    private double levelCapacity(FloorStack stack, LotGeometry lot, ParkingType type) {
        if (type == ParkingType.SURFACE) {
            FloorRecord ground = stack.getGroundFloor();
            double built = ground != null ? ground.getFootprintArea() : 0.0;
            return Math.max(0.0, lot.area() - built);
        }
        return lot.area();
    }

    private ParkingLevel level(ParameterSet p, int i, double area) {
        if (p.getParkingType() == ParkingType.SURFACE) {
            return new ParkingLevel(0, "Surface parking", 0.0, 0.0, area);
        }
        double h = p.getParkingFloorHeight();
        return new ParkingLevel(-i, "Parking -" + i, -i * h, h, area);
    }
}
