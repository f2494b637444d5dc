package by.greenmobile.lotmassing.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;
import java.util.Map;

/**
 * Входные данные одного участка.
 *
 * ring: замкнутый контур [[x, y], ...], первая точка = последней.
 * parameters: переопределения параметров для этого участка (snake_case, плоско или по секциям).
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class LotRequest {
    private String lotId;
    private double[][] ring;
    private List<FaceSpec> faces;
    private Map<String, Object> parameters;
}
