package by.greenmobile.lotmassing.service.optimization;

import by.greenmobile.lotmassing.entity.FloorStack;
import by.greenmobile.lotmassing.entity.ShapeCandidate;
import lombok.Value;

import java.util.List;
import java.util.Optional;

/**
 * Итог перебора: лучший вариант (если есть выбираемый) и журнал всех кандидатов в порядке ранжирования.
 */
@Value
public class SearchResult {

    ShapeCandidate best;
    FloorStack bestStack;
    List<ShapeCandidate> candidates;

    public Optional<ShapeCandidate> best() {
        return Optional.ofNullable(best);
    }

    public boolean isExhausted() {
        return best == null;
    }
}
