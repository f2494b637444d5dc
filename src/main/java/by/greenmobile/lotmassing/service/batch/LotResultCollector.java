package by.greenmobile.lotmassing.service.batch;

import by.greenmobile.lotmassing.entity.LotResult;
import lombok.extern.slf4j.Slf4j;

import java.util.List;
import java.util.Optional;
import java.util.TreeMap;

/**
 * Сборщик результатов пакета. Запись сериализована, не более одной записи на позицию участка
 * во входном списке (id участков в пакете могут повторяться).
 */
@Slf4j
public class LotResultCollector {

    private final TreeMap<Integer, LotResult> results = new TreeMap<>();

    /** @return false, если результат для этой позиции уже зафиксирован (повтор игнорируется) */
    public synchronized boolean commit(int position, LotResult result) {
        if (results.containsKey(position)) {
            log.warn("COLLECT: duplicate result for lot #{} ({}) ignored", position, result.getLotId());
            return false;
        }
        results.put(position, result);
        return true;
    }

    public synchronized Optional<LotResult> get(int position) {
        return Optional.ofNullable(results.get(position));
    }

    public synchronized int size() {
        return results.size();
    }

    /** Зафиксированные результаты в порядке позиций. */
    public synchronized List<LotResult> snapshot() {
        return List.copyOf(results.values());
    }
}
