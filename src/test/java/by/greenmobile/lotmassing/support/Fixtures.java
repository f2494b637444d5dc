package by.greenmobile.lotmassing.support;

import by.greenmobile.lotmassing.config.MassingProperties;
import by.greenmobile.lotmassing.config.ParameterSetResolver;
import by.greenmobile.lotmassing.dto.FaceSpec;
import by.greenmobile.lotmassing.dto.LotRequest;
import by.greenmobile.lotmassing.entity.LotGeometry;
import by.greenmobile.lotmassing.entity.ParameterSet;
import by.greenmobile.lotmassing.service.MassingFacade;
import by.greenmobile.lotmassing.service.MetricsAggregator;
import by.greenmobile.lotmassing.service.engine.FloorAreaModel;
import by.greenmobile.lotmassing.service.engine.FloorStackBuilder;
import by.greenmobile.lotmassing.service.engine.FootprintGenerator;
import by.greenmobile.lotmassing.service.engine.SetbackEngine;
import by.greenmobile.lotmassing.service.geometry.FaceOffsetGeometry;
import by.greenmobile.lotmassing.service.optimization.GridSearchOptimizer;
import by.greenmobile.lotmassing.service.optimization.ObjectiveScorer;
import by.greenmobile.lotmassing.service.optimization.ShapeCandidateSpace;
import by.greenmobile.lotmassing.service.parking.ParkingAllocator;
import by.greenmobile.lotmassing.service.validation.LotGeometryFactory;
import by.greenmobile.lotmassing.service.validation.ParameterSetValidator;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.util.List;

/**
 * Общие данные для тестов: прямоугольный участок и собранный без Spring движок.
 */
public final class Fixtures {

    private Fixtures() {
    }

    public static final LotGeometryFactory GEOMETRY_FACTORY = new LotGeometryFactory();

    /** Параметры по умолчанию (как в application.yml). */
    public static ParameterSet defaults() {
        return new MassingProperties().toParameterSet();
    }

    /** Пример 1: участок 25x50, max_height 45, рост заднего отступа с 4-го этажа. */
    public static ParameterSet example1() {
        return defaults().toBuilder()
                .maxHeight(45.0)
                .minSetbackStartFloor(4)
                .build();
    }

    public static LotRequest rectangleRequest(String lotId, double width, double depth) {
        double[][] ring = {{0, 0}, {width, 0}, {width, depth}, {0, depth}, {0, 0}};
        return LotRequest.builder()
                .lotId(lotId)
                .ring(ring)
                .faces(rectangleFaces(width, depth))
                .build();
    }

    /** Прямоугольник: задняя грань y=0, фронт y=depth, боковые x=0 и x=width. */
    public static List<FaceSpec> rectangleFaces(double width, double depth) {
        return List.of(
                new FaceSpec("back", new double[]{0, 0}, new double[]{width, 0}),
                new FaceSpec("side", new double[]{width, 0}, new double[]{width, depth}),
                new FaceSpec("front", new double[]{width, depth}, new double[]{0, depth}),
                new FaceSpec("side", new double[]{0, depth}, new double[]{0, 0}));
    }

    public static LotGeometry rectangleLot(String lotId, double width, double depth) {
        return GEOMETRY_FACTORY.fromRequest(rectangleRequest(lotId, width, depth));
    }

    public static Engine engine() {
        return new Engine();
    }

    /** Ручная сборка бинов, как их связал бы Spring. */
    public static final class Engine {
        public final FaceOffsetGeometry geometry = new FaceOffsetGeometry();
        public final FloorAreaModel areaModel = new FloorAreaModel();
        public final SetbackEngine setbackEngine = new SetbackEngine();
        public final FootprintGenerator footprintGenerator = new FootprintGenerator(geometry, areaModel);
        public final FloorStackBuilder stackBuilder = new FloorStackBuilder(setbackEngine, footprintGenerator);
        public final ShapeCandidateSpace candidateSpace = new ShapeCandidateSpace();
        public final ObjectiveScorer scorer = new ObjectiveScorer(areaModel);
        public final GridSearchOptimizer optimizer = new GridSearchOptimizer(stackBuilder, candidateSpace, scorer);
        public final ParkingAllocator parkingAllocator = new ParkingAllocator(areaModel);
        public final MetricsAggregator metricsAggregator = new MetricsAggregator(areaModel, scorer, geometry);
        public final ObjectMapper objectMapper = new ObjectMapper();
        public final ParameterSetResolver resolver = new ParameterSetResolver(new MassingProperties(), objectMapper);
        public final ParameterSetValidator validator = new ParameterSetValidator();
        public final MassingFacade facade = new MassingFacade(resolver, validator, GEOMETRY_FACTORY,
                stackBuilder, optimizer, parkingAllocator, metricsAggregator);

        private Engine() {
        }
    }
}
