package by.greenmobile.lotmassing.entity;

import com.fasterxml.jackson.annotation.JsonProperty;

/** Целевая функция оптимизатора формы. */
public enum Objective {
    /** Максимум FAR при соблюдении высоты; варианты с FAR выше max_far не выбираются. */
    @JsonProperty("maximize_far_within_height") MAXIMIZE_FAR_WITHIN_HEIGHT,
    /** Максимум числа квартир. */
    @JsonProperty("maximize_units") MAXIMIZE_UNITS,
    /** Максимум эффективности (полезная / общая площадь). */
    @JsonProperty("maximize_efficiency") MAXIMIZE_EFFICIENCY
}
