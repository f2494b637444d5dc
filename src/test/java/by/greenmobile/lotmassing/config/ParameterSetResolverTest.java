package by.greenmobile.lotmassing.config;

import by.greenmobile.lotmassing.entity.ModelingMode;
import by.greenmobile.lotmassing.entity.Objective;
import by.greenmobile.lotmassing.entity.ParameterSet;
import by.greenmobile.lotmassing.entity.ParkingType;
import by.greenmobile.lotmassing.service.validation.InvalidLotException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ParameterSetResolverTest {

    private final ParameterSetResolver resolver = new ParameterSetResolver(new MassingProperties(), new ObjectMapper());

    @Test
    void noLayersGiveDefaults() {
        ParameterSet p = resolver.resolve("L");

        assertThat(p).isEqualTo(new MassingProperties().toParameterSet());
        assertThat(p.getMaxHeight()).isEqualTo(60.0);
        assertThat(p.getModelingMode()).isEqualTo(ModelingMode.ADVANCED);
        assertThat(p.getShapeRatioSteps()).containsExactly(0.3, 0.5, 0.7);
    }

    @Test
    void lotLayerWinsOverProjectLayer() {
        Map<String, Object> project = Map.of("max_height", 45.0, "max_far", 3.0);
        Map<String, Object> lot = Map.of("max_height", 30.0);

        ParameterSet p = resolver.resolve("L", project, lot);

        assertThat(p.getMaxHeight()).isEqualTo(30.0);
        assertThat(p.getMaxFar()).isEqualTo(3.0);
        assertThat(p.getMinFrontSetback()).isEqualTo(5.0);
    }

    @Test
    void acceptsSectionedLayers() {
        Map<String, Object> layer = Map.of(
                "parking", Map.of("parking_type", "surface", "parking_levels_allowed", 1),
                "strategy", Map.of("optimization_objective", "maximize_units",
                        "orientation_steps", List.of(0, 180)));

        ParameterSet p = resolver.resolve("L", layer);

        assertThat(p.getParkingType()).isEqualTo(ParkingType.SURFACE);
        assertThat(p.getParkingLevelsAllowed()).isEqualTo(1);
        assertThat(p.getOptimizationObjective()).isEqualTo(Objective.MAXIMIZE_UNITS);
        assertThat(p.getOrientationSteps()).containsExactly(0.0, 180.0);
    }

    @Test
    void acceptsNormativeFieldNames() {
        Map<String, Object> layer = Map.of(
                "min_front_setback", 6.0,
                "min_side_setback", 2.0,
                "min_setback_start_floor", 4,
                "max_lot_coverage", 0.5,
                "access_width", 1.5);

        ParameterSet p = resolver.resolve("L", layer);

        assertThat(p.getMinFrontSetback()).isEqualTo(6.0);
        assertThat(p.getMinSideSetback()).isEqualTo(2.0);
        assertThat(p.getMinSetbackStartFloor()).isEqualTo(4);
        assertThat(p.getMaxLotCoverage()).isEqualTo(0.5);
        assertThat(p.getAccessWidth()).isEqualTo(1.5);
    }

    @Test
    void acceptsConfigurationFileLayout() {
        Map<String, Object> layer = Map.of(
                "zoning_parameters", Map.of("numlote", "LOTE_PADRAO", "codigo", "ZG_001"),
                "normative_parameters", Map.of("max_height", 45.0, "min_setback_start_floor", 4),
                "parking_parameters", Map.of("parking_type", "subsolo", "parking_calculation_type", "per_unit"),
                "modeling_strategy", Map.of(
                        "h3_resolution", 10,
                        "modeling_mode", "basic",
                        "grid_search_parameters", Map.of("shape_ratio_steps", List.of(0.4))));

        ParameterSet p = resolver.resolve("L", layer);

        assertThat(p.getZoneCode()).isEqualTo("ZG_001");
        assertThat(p.getMaxHeight()).isEqualTo(45.0);
        assertThat(p.getMinSetbackStartFloor()).isEqualTo(4);
        assertThat(p.getParkingType()).isEqualTo(ParkingType.UNDERGROUND);
        assertThat(p.getModelingMode()).isEqualTo(ModelingMode.BASIC);
        assertThat(p.getShapeRatioSteps()).containsExactly(0.4);
    }

    @Test
    void stepListsAreCopied() {
        List<Double> ratios = new ArrayList<>(List.of(0.3, 0.5));
        ParameterSet p = resolver.defaults().toBuilder().shapeRatioSteps(ratios).build();

        ratios.add(0.9);

        assertThat(p.getShapeRatioSteps()).containsExactly(0.3, 0.5);
        assertThatThrownBy(() -> p.getShapeRatioSteps().add(0.7))
                .isInstanceOf(UnsupportedOperationException.class);
    }

    @Test
    void unknownKeyIsInputError() {
        assertThatThrownBy(() -> resolver.resolve("L-9", Map.of("max_heigth", 10)))
                .isInstanceOf(InvalidLotException.class)
                .hasMessageContaining("L-9")
                .hasMessageContaining("max_heigth");
    }

    @Test
    void badEnumIsInputError() {
        assertThatThrownBy(() -> resolver.resolve("L", Map.of("modeling_mode", "expert")))
                .isInstanceOf(InvalidLotException.class);
    }
}
