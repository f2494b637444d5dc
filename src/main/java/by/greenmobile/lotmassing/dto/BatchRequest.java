package by.greenmobile.lotmassing.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;
import java.util.Map;

/** Пакет участков с общими (проектными) переопределениями параметров. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class BatchRequest {
    private Map<String, Object> projectParameters;
    private List<LotRequest> lots;
}
