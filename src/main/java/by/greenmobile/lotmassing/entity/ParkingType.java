package by.greenmobile.lotmassing.entity;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonProperty;

public enum ParkingType {
    /** Подземные уровни, площадь уровня = площадь участка. */
    @JsonProperty("underground") @JsonAlias({"subsolo", "subterraneo"}) UNDERGROUND,
    /** Открытая стоянка на свободной от застройки части участка, один уровень. */
    @JsonProperty("surface") SURFACE
}
