package by.greenmobile.lotmassing.entity;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Роль грани границы участка. Определяет, какой отступ к ней применяется.
 */
public enum FaceRole {
    @JsonProperty("front") FRONT,
    @JsonProperty("back") BACK,
    @JsonProperty("side") SIDE;

    /** Разбор кода роли из входных данных ("front" / "back" / "side", регистр не важен). */
    public static FaceRole fromCode(String code) {
        if (code == null) {
            throw new IllegalArgumentException("face role is missing");
        }
        for (FaceRole r : values()) {
            if (r.name().equalsIgnoreCase(code.trim())) return r;
        }
        throw new IllegalArgumentException("unknown face role: " + code);
    }
}
