package by.greenmobile.lotmassing.entity;

import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * Результат распределения парковки.
 * shortfall = требуемая площадь не поместилась в разрешённые уровни (стек не пересчитывается).
 */
@Value
@Builder
public class ParkingPlan {

    int stallsRequired;
    int stallsProvided;

    double areaRequired;
    double areaProvided;

    int levelsUsed;
    List<ParkingLevel> levels;

    ParkingType parkingType;
    boolean shortfall;
    /** Площадь парковки учитывается в FAR. */
    boolean includedInFar;

    public static ParkingPlan none(ParkingType type) {
        return ParkingPlan.builder()
                .levels(List.of())
                .parkingType(type)
                .build();
    }
}
