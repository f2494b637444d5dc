package by.greenmobile.lotmassing.config;

import by.greenmobile.lotmassing.entity.ModelingMode;
import by.greenmobile.lotmassing.entity.Objective;
import by.greenmobile.lotmassing.entity.ParameterSet;
import by.greenmobile.lotmassing.entity.ParkingType;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.ArrayList;
import java.util.List;

/**
 * Значения параметров по умолчанию (нижний слой слияния).
 *
 * Разбиты по секциям как во входных файлах: zoning / normative / architectural / parking / strategy.
 * Значения в полях совпадают с application.yml, чтобы объект был пригоден и без контекста Spring (тесты).
 */
@Data
@ConfigurationProperties(prefix = "massing.defaults")
public class MassingProperties {

    private Zoning zoning = new Zoning();
    private Normative normative = new Normative();
    private Architectural architectural = new Architectural();
    private Parking parking = new Parking();
    private Strategy strategy = new Strategy();

    @Data
    public static class Zoning {
        private String zoneCode = "default";
    }

    @Data
    public static class Normative {
        private double maxHeight = 60.0;
        private double maxFar = 2.0;
        private double maxLotCoverage = 0.6;
        private double gfFloorHeight = 4.0;
        private double ufFloorHeight = 3.0;
        private double minFrontSetback = 5.0;
        private double minBackSetback = 3.0;
        private double minSideSetback = 1.5;
        private int minSetbackStartFloor = 3;
        private double backSetbackPercent = 0.20;
        private Double slendernessRatio;
    }

    @Data
    public static class Architectural {
        private double minFloorArea = 50.0;
        private double minUnitArea = 30.0;
        private double targetUnitArea = 60.0;
        private double minUnitWidth = 3.0;
        private double minPatiosDimension = 4.0;
        private double coreAreaFraction = 0.15;
        private double accessWidth = 1.2;
        private double targetEfficiency = 0.8;
        private Integer numUnitsTarget;
    }

    @Data
    public static class Parking {
        private boolean required = true;
        private double ratioResidential = 1.0;
        private double ratioCommercial = 0.5;
        private double commercialAreaForParkingRatio = 100.0;
        private double commercialArea = 0.0;
        private ParkingType type = ParkingType.UNDERGROUND;
        private double areaPerSlot = 25.0;
        private int levelsAllowed = 2;
        private double rampAreaPerFloorFraction = 0.10;
        private double floorHeight = 3.0;
        private boolean includeParkingInFar = false;
        private Double maxParkingRatio;
    }

    @Data
    public static class Strategy {
        private ModelingMode modelingMode = ModelingMode.ADVANCED;
        private Objective optimizationObjective = Objective.MAXIMIZE_FAR_WITHIN_HEIGHT;
        private List<Double> shapeRatioSteps = new ArrayList<>(List.of(0.3, 0.5, 0.7));
        private List<Double> orientationSteps = new ArrayList<>(List.of(0.0, 90.0, 180.0, 270.0));
        private int maxFloorCount = 200;
        private boolean stackWithinFar = false;
    }

    public ParameterSet toParameterSet() {
        return ParameterSet.builder()
                .zoneCode(zoning.getZoneCode())
                // нормативы
                .maxHeight(normative.getMaxHeight())
                .maxFar(normative.getMaxFar())
                .maxLotCoverage(normative.getMaxLotCoverage())
                .gfFloorHeight(normative.getGfFloorHeight())
                .ufFloorHeight(normative.getUfFloorHeight())
                .minFrontSetback(normative.getMinFrontSetback())
                .minBackSetback(normative.getMinBackSetback())
                .minSideSetback(normative.getMinSideSetback())
                .minSetbackStartFloor(normative.getMinSetbackStartFloor())
                .backSetbackPercent(normative.getBackSetbackPercent())
                .slendernessRatio(normative.getSlendernessRatio())
                // архитектура
                .minFloorArea(architectural.getMinFloorArea())
                .minUnitArea(architectural.getMinUnitArea())
                .targetUnitArea(architectural.getTargetUnitArea())
                .minUnitWidth(architectural.getMinUnitWidth())
                .minPatiosDimension(architectural.getMinPatiosDimension())
                .coreAreaFraction(architectural.getCoreAreaFraction())
                .accessWidth(architectural.getAccessWidth())
                .targetEfficiency(architectural.getTargetEfficiency())
                .numUnitsTarget(architectural.getNumUnitsTarget())
                // парковка
                .parkingRequired(parking.isRequired())
                .parkingRatioResidential(parking.getRatioResidential())
                .parkingRatioCommercial(parking.getRatioCommercial())
                .commercialAreaForParkingRatio(parking.getCommercialAreaForParkingRatio())
                .commercialArea(parking.getCommercialArea())
                .parkingType(parking.getType())
                .parkingAreaPerSlot(parking.getAreaPerSlot())
                .parkingLevelsAllowed(parking.getLevelsAllowed())
                .rampAreaPerFloorFraction(parking.getRampAreaPerFloorFraction())
                .parkingFloorHeight(parking.getFloorHeight())
                .includeParkingInFar(parking.isIncludeParkingInFar())
                .maxParkingRatio(parking.getMaxParkingRatio())
                // стратегия
                .modelingMode(strategy.getModelingMode())
                .optimizationObjective(strategy.getOptimizationObjective())
                .shapeRatioSteps(List.copyOf(strategy.getShapeRatioSteps()))
                .orientationSteps(List.copyOf(strategy.getOrientationSteps()))
                .maxFloorCount(strategy.getMaxFloorCount())
                .stackWithinFar(strategy.isStackWithinFar())
                .build();
    }
}
