package by.greenmobile.lotmassing.service;

import by.greenmobile.lotmassing.config.ParameterSetResolver;
import by.greenmobile.lotmassing.dto.LotRequest;
import by.greenmobile.lotmassing.entity.FloorStack;
import by.greenmobile.lotmassing.entity.LotGeometry;
import by.greenmobile.lotmassing.entity.LotResult;
import by.greenmobile.lotmassing.entity.LotStatus;
import by.greenmobile.lotmassing.entity.ParameterSet;
import by.greenmobile.lotmassing.entity.ParkingPlan;
import by.greenmobile.lotmassing.entity.SummaryMetrics;
import by.greenmobile.lotmassing.service.engine.FloorStackBuilder;
import by.greenmobile.lotmassing.service.optimization.GridSearchOptimizer;
import by.greenmobile.lotmassing.service.optimization.SearchResult;
import by.greenmobile.lotmassing.service.parking.ParkingAllocator;
import by.greenmobile.lotmassing.service.validation.InvalidLotException;
import by.greenmobile.lotmassing.service.validation.LotGeometryFactory;
import by.greenmobile.lotmassing.service.validation.ParameterSetValidator;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.CancellationException;
import java.util.function.BooleanSupplier;

/**
 * Единая точка расчёта одного участка:
 * - параметры (слияние слоёв) и геометрия с проверкой;
 * - базовый стек (ортогональная форма) -> парковка -> сводка;
 * - перебор форм -> лучший стек -> парковка -> сводка.
 *
 * Ошибки входных данных дают FAILED только для этого участка.
 * Непригодный участок (первый этаж не помещается) даёт INFEASIBLE с пустым стеком.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class MassingFacade {

    public static final String MDC_LOT = "lot";

    private final ParameterSetResolver parameterResolver;
    private final ParameterSetValidator parameterValidator;
    private final LotGeometryFactory geometryFactory;
    private final FloorStackBuilder stackBuilder;
    private final GridSearchOptimizer optimizer;
    private final ParkingAllocator parkingAllocator;
    private final MetricsAggregator metricsAggregator;

    /** Расчёт по входным данным участка с проектным слоем параметров. */
    public LotResult evaluate(LotRequest request, Map<String, Object> projectParameters, BooleanSupplier cancelled) {
        String lotId = request.getLotId() != null ? request.getLotId() : "<unnamed>";
        MDC.put(MDC_LOT, lotId);
        try {
            ParameterSet params = parameterResolver.resolve(lotId, projectParameters, request.getParameters());
            LotGeometry lot = geometryFactory.fromRequest(request);
            return evaluate(lot, params, cancelled);
        } catch (InvalidLotException e) {
            log.warn("LOT {}: invalid input: {}", lotId, e.getMessage());
            return LotResult.failed(lotId, e.getMessage());
        } finally {
            MDC.remove(MDC_LOT);
        }
    }

    public LotResult evaluate(LotGeometry lot, ParameterSet params) {
        return evaluate(lot, params, () -> false);
    }

    /**
     * Расчёт по готовой геометрии и параметрам.
     *
     * @throws CancellationException если пакет отменён во время перебора форм
     */
    public LotResult evaluate(LotGeometry lot, ParameterSet params, BooleanSupplier cancelled) {
        String lotId = lot.getLotId();
        String previous = MDC.get(MDC_LOT);
        MDC.put(MDC_LOT, lotId);
        long t0 = System.nanoTime();
        try {
            parameterValidator.validate(lotId, params);

            FloorStack baseline = stackBuilder.buildBaseline(lot, params);
            if (baseline.isEmpty()) {
                log.info("LOT {}: infeasible, ground floor does not fit ({})", lotId, baseline.getTerminationReason());
                ParkingPlan noParking = ParkingPlan.none(params.getParkingType());
                return LotResult.builder()
                        .lotId(lotId)
                        .status(LotStatus.INFEASIBLE)
                        .message("ground floor footprint rejected")
                        .parameters(params)
                        .lotArea(lot.area())
                        .lotPolygon(lot.getPolygon())
                        .baseline(baseline)
                        .baselineParking(noParking)
                        .baselineMetrics(metricsAggregator.summarize(baseline, noParking, lot, params))
                        .candidates(List.of())
                        .build();
            }

            ParkingPlan baselineParking = parkingAllocator.allocate(baseline, lot, params);
            SummaryMetrics baselineMetrics = metricsAggregator.summarize(baseline, baselineParking, lot, params);

            SearchResult search = optimizer.search(lot, params, cancelled);

            LotResult.LotResultBuilder result = LotResult.builder()
                    .lotId(lotId)
                    .status(LotStatus.OK)
                    .parameters(params)
                    .lotArea(lot.area())
                    .lotPolygon(lot.getPolygon())
                    .baseline(baseline)
                    .baselineParking(baselineParking)
                    .baselineMetrics(baselineMetrics)
                    .candidates(search.getCandidates());

            if (search.isExhausted()) {
                result.message("no selectable shape candidate, baseline only");
            } else {
                FloorStack best = search.getBestStack();
                ParkingPlan bestParking = parkingAllocator.allocate(best, lot, params);
                result.bestVariant(search.getBest().getVariant())
                        .best(best)
                        .bestParking(bestParking)
                        .bestMetrics(metricsAggregator.summarize(best, bestParking, lot, params));
            }

            log.info("LOT {}: baseline floors={}, FAR={}, best={}, {} ms",
                    lotId, baseline.getFloorCount(), fmt(baselineMetrics.getAchievedFar()),
                    search.isExhausted() ? "none" : search.getBest().getVariant(),
                    (System.nanoTime() - t0) / 1_000_000);
            return result.build();
        } finally {
            if (previous != null) MDC.put(MDC_LOT, previous);
            else MDC.remove(MDC_LOT);
        }
    }

    private static String fmt(double v) {
        return String.format(Locale.US, "%.3f", v);
    }
}
