package by.greenmobile.lotmassing.entity;

import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.Value;

import java.util.List;

/** Упорядоченный (снизу вверх) набор этажей + причина остановки. */
@Value
public class FloorStack {

    List<FloorRecord> floors;
    TerminationReason terminationReason;
    ShapeVariant variant;

    @JsonIgnore
    public boolean isEmpty() {
        return floors.isEmpty();
    }

    public int getFloorCount() {
        return floors.size();
    }

    public double getGrossFloorArea() {
        return floors.stream().mapToDouble(FloorRecord::getFootprintArea).sum();
    }

    public double getTotalHeight() {
        return floors.isEmpty() ? 0.0 : floors.get(floors.size() - 1).getTopElevation();
    }

    @JsonIgnore
    public FloorRecord getGroundFloor() {
        return floors.isEmpty() ? null : floors.get(0);
    }
}
