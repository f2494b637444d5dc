package by.greenmobile.lotmassing.dto;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Грань границы во входных данных: роль + две точки [x, y]. */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class FaceSpec {
    private String role;
    private double[] from;
    private double[] to;
}
