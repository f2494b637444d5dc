package by.greenmobile.lotmassing.service.optimization;

import by.greenmobile.lotmassing.entity.FloorStack;
import by.greenmobile.lotmassing.entity.LotGeometry;
import by.greenmobile.lotmassing.entity.ParameterSet;
import by.greenmobile.lotmassing.entity.ShapeCandidate;
import by.greenmobile.lotmassing.entity.ShapeVariant;
import by.greenmobile.lotmassing.service.engine.FloorStackBuilder;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.util.Comparator;
import java.util.List;
import java.util.concurrent.CancellationException;
import java.util.function.BooleanSupplier;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Перебор вариантов формы: для каждого строится полный стек этажей, считается score,
 * выбирается лучший по ShapeCandidate.RANKING.
 *
 * ВАЖНО:
 * - варианты независимы (читают только LotGeometry и ParameterSet), поэтому считаются параллельно;
 * - выбор не зависит от порядка перебора: ничьи решаются по shape_ratio, затем orientation;
 * - отмена проверяется между вариантами, посчитанный вариант не прерывается.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class GridSearchOptimizer {

    private final FloorStackBuilder stackBuilder;
    private final ShapeCandidateSpace candidateSpace;
    private final ObjectiveScorer scorer;

    @Value("${massing.search.parallel:true}")
    private boolean parallel = true;

    public SearchResult search(LotGeometry lot, ParameterSet p) {
        return search(lot, p, candidateSpace.enumerate(p), () -> false);
    }

    public SearchResult search(LotGeometry lot, ParameterSet p, BooleanSupplier cancelled) {
        return search(lot, p, candidateSpace.enumerate(p), cancelled);
    }

    public SearchResult search(LotGeometry lot, ParameterSet p, List<ShapeVariant> variants, BooleanSupplier cancelled) {
        log.info("SEARCH {}: candidates={}, objective={}, parallel={}",
                lot.getLotId(), variants.size(), p.getOptimizationObjective(), parallel);

        Stream<ShapeVariant> stream = parallel ? variants.parallelStream() : variants.stream();
        // после отмены оставшиеся варианты не считаются, посчитанные отбрасываются
        List<Evaluated> evaluated = stream
                .filter(v -> !cancelled.getAsBoolean())
                .map(v -> evaluate(lot, p, v))
                .collect(Collectors.toList());

        if (cancelled.getAsBoolean()) {
            throw new CancellationException("search cancelled for lot " + lot.getLotId());
        }

        Comparator<Evaluated> ranking = Comparator.comparing(e -> e.candidate, ShapeCandidate.RANKING);
        List<Evaluated> ranked = evaluated.stream().sorted(ranking).collect(Collectors.toList());
        List<ShapeCandidate> journal = ranked.stream().map(e -> e.candidate).collect(Collectors.toList());

        Evaluated best = ranked.stream().filter(e -> e.candidate.isSelectable()).findFirst().orElse(null);
        if (best == null) {
            log.warn("SEARCH {}: no selectable candidate among {}", lot.getLotId(), variants.size());
            return new SearchResult(null, null, List.copyOf(journal));
        }

        log.info("SEARCH {}: best={} score={} floors={}",
                lot.getLotId(), best.candidate.getVariant(), best.candidate.getScore(), best.candidate.getFloorCount());
        return new SearchResult(best.candidate, best.stack, List.copyOf(journal));
    }

    private Evaluated evaluate(LotGeometry lot, ParameterSet p, ShapeVariant variant) {
        FloorStack stack = stackBuilder.build(lot, p, variant);
        ShapeCandidate candidate = new ShapeCandidate(
                variant,
                stack.getFloorCount(),
                stack.getGrossFloorArea(),
                scorer.objectiveValue(stack, lot, p),
                scorer.score(stack, lot, p),
                stack.getTerminationReason()
        );
        return new Evaluated(candidate, stack);
    }

    void setParallel(boolean parallel) {
        this.parallel = parallel;
    }

    private static class Evaluated {
        final ShapeCandidate candidate;
        final FloorStack stack;

        Evaluated(ShapeCandidate candidate, FloorStack stack) {
            this.candidate = candidate;
            this.stack = stack;
        }
    }
}
