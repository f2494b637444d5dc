package by.greenmobile.lotmassing.config;

import by.greenmobile.lotmassing.entity.ParameterSet;
import by.greenmobile.lotmassing.service.validation.InvalidLotException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectReader;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/**
 * Слияние параметров: defaults (massing.defaults) -> проект -> участок.
 *
 * Слои задаются картами в snake_case. Допускается как плоская форма ("max_height": 50),
 * так и секционная ("normative": {"max_height": 50}), в том числе с именами секций
 * исходного конфигурационного файла ("normative_parameters", "modeling_strategy" с вложенной
 * "grid_search_parameters"). Неизвестный ключ = ошибка входных данных.
 *
 * Идентификационные поля зонирования и ключи, не влияющие на расчёт (h3_resolution и т.п.),
 * пропускаются; "codigo" читается как zone_code.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class ParameterSetResolver {

    static final Set<String> SECTIONS = Set.of(
            "zoning", "normative", "architectural", "parking", "strategy",
            "zoning_parameters", "normative_parameters", "architectural_parameters", "parking_parameters",
            "modeling_strategy", "grid_search_parameters");

    static final Map<String, String> KEY_ALIASES = Map.of("codigo", "zone_code");

    static final Set<String> IGNORED_KEYS = Set.of(
            "numlote", "zot", "nome", "obs", "ga", "conceito", "id_quarterirao",
            "h3_resolution", "parking_calculation_type");

    private static final TypeReference<Map<String, Object>> MAP_TYPE = new TypeReference<>() {};

    private final MassingProperties properties;
    private final ObjectMapper objectMapper;

    public ParameterSet defaults() {
        return properties.toParameterSet();
    }

    @SafeVarargs
    public final ParameterSet resolve(String lotId, Map<String, Object>... layers) {
        Map<String, Object> merged = objectMapper.convertValue(defaults(), MAP_TYPE);

        for (Map<String, Object> layer : layers) {
            if (layer == null || layer.isEmpty()) continue;
            merged.putAll(flatten(layer));
        }

        ObjectReader reader = objectMapper.readerFor(ParameterSet.class)
                .with(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
        try {
            JsonNode tree = objectMapper.valueToTree(merged);
            ParameterSet resolved = reader.readValue(tree);
            log.debug("PARAMS resolved for lot {}: {}", lotId, resolved);
            return resolved;
        } catch (IOException | IllegalArgumentException e) {
            throw new InvalidLotException(lotId, "cannot resolve parameters: " + e.getMessage(), e);
        }
    }

    private Map<String, Object> flatten(Map<?, ?> layer) {
        Map<String, Object> flat = new LinkedHashMap<>();
        for (Map.Entry<?, ?> e : layer.entrySet()) {
            String key = String.valueOf(e.getKey());
            if (SECTIONS.contains(key) && e.getValue() instanceof Map<?, ?> section) {
                flat.putAll(flatten(section));
            } else if (IGNORED_KEYS.contains(key)) {
                log.debug("PARAMS: informational key {} skipped", key);
            } else {
                flat.put(KEY_ALIASES.getOrDefault(key, key), e.getValue());
            }
        }
        return flat;
    }
}
