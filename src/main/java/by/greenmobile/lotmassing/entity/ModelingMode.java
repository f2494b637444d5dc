package by.greenmobile.lotmassing.entity;

import com.fasterxml.jackson.annotation.JsonProperty;

public enum ModelingMode {
    /** Только ортогональная форма. */
    @JsonProperty("basic") BASIC,
    /** Сетка L-образных форм (shape_ratio x orientation). */
    @JsonProperty("advanced") ADVANCED
}
