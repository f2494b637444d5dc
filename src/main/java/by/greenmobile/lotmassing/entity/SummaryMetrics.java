package by.greenmobile.lotmassing.entity;

import lombok.Builder;
import lombok.Value;

import java.util.List;

/** Сводные показатели одного стека этажей. */
@Value
@Builder
public class SummaryMetrics {

    int floorCount;
    double totalHeight;

    double grossFloorArea;
    /** GFA + площадь парковки, если include_parking_in_far. */
    double farArea;
    double achievedFar;
    double coverage;

    int unitCount;
    double usableArea;
    double efficiency;
    boolean meetsTargetEfficiency;

    /** Высота / минимальная ширина пятна первого этажа; null для пустого стека. */
    Double slenderness;

    int parkingStallsRequired;
    int parkingStallsProvided;
    double parkingAreaRequired;
    double parkingAreaProvided;
    int parkingLevelsUsed;
    boolean parkingShortfall;

    Objective objective;
    double objectiveValue;

    boolean compliant;
    List<String> violations;
}
