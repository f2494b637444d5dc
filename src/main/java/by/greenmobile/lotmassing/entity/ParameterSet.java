package by.greenmobile.lotmassing.entity;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.List;

/**
 * Полный набор параметров для расчёта одного участка.
 *
 * Получается слиянием: значения по умолчанию (massing.defaults) -> проектные -> по участку.
 * Неизменяем: один экземпляр читают параллельные потоки перебора форм.
 * Изменённая копия получается только через toBuilder().
 *
 * Единицы:
 * - длины и высоты: м
 * - площади: м²
 * - доли: 0..1
 * - углы: градусы
 */
@Value
@Builder(toBuilder = true)
@Jacksonized
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class ParameterSet {

    // ===== ЗОНИРОВАНИЕ =====

    /** Код зоны (информационно, в расчёте не участвует). */
    String zoneCode;

    // ===== НОРМАТИВЫ =====

    double maxHeight;
    double maxFar;
    double maxLotCoverage;

    /** Высота первого (наземного) этажа. */
    double gfFloorHeight;
    /** Высота типового этажа. */
    double ufFloorHeight;

    double minFrontSetback;
    double minBackSetback;
    double minSideSetback;

    /** С какого этажа (1 = первый) задний отступ растёт с высотой. */
    int minSetbackStartFloor;
    /** Доля высоты под этажом, добавляемая к заднему отступу. */
    double backSetbackPercent;

    /** Зарезервировано: не проверяется. */
    Double slendernessRatio;

    // ===== АРХИТЕКТУРНЫЕ =====

    double minFloorArea;
    double minUnitArea;
    double targetUnitArea;
    double minUnitWidth;
    double minPatiosDimension;
    double coreAreaFraction;
    double accessWidth;
    double targetEfficiency;

    /** Зарезервировано: не проверяется. */
    Integer numUnitsTarget;

    // ===== ПАРКОВКА =====

    boolean parkingRequired;
    double parkingRatioResidential;
    double parkingRatioCommercial;
    /** Площадь коммерции (м²), на которую приходится parking_ratio_commercial мест. */
    double commercialAreaForParkingRatio;
    /** Площадь коммерческих помещений участка, м². */
    double commercialArea;
    ParkingType parkingType;
    double parkingAreaPerSlot;
    int parkingLevelsAllowed;
    double rampAreaPerFloorFraction;
    double parkingFloorHeight;
    boolean includeParkingInFar;

    /** Зарезервировано: не проверяется. */
    Double maxParkingRatio;

    // ===== СТРАТЕГИЯ =====

    ModelingMode modelingMode;
    Objective optimizationObjective;
    List<Double> shapeRatioSteps;
    List<Double> orientationSteps;
    /** Страховочный предел числа этажей. */
    int maxFloorCount;
    /** Останавливать наращивание этажей при достижении max_far. */
    boolean stackWithinFar;

    public static class ParameterSetBuilder {

        public ParameterSetBuilder shapeRatioSteps(List<Double> shapeRatioSteps) {
            this.shapeRatioSteps = shapeRatioSteps == null ? null : List.copyOf(shapeRatioSteps);
            return this;
        }

        public ParameterSetBuilder orientationSteps(List<Double> orientationSteps) {
            this.orientationSteps = orientationSteps == null ? null : List.copyOf(orientationSteps);
            return this;
        }
    }
}
