package by.greenmobile.lotmassing.entity;

import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.Builder;
import lombok.Value;
import org.locationtech.jts.geom.Polygon;
import org.locationtech.jts.io.WKTWriter;

import java.util.List;

/**
 * Итог по участку: базовый стек (без маски) и лучший вариант формы.
 * best* = null, если оптимизатор не нашёл выбираемого варианта.
 */
@Value
@Builder
public class LotResult {

    String lotId;
    LotStatus status;
    String message;

    ParameterSet parameters;
    double lotArea;

    @JsonIgnore
    Polygon lotPolygon;

    FloorStack baseline;
    ParkingPlan baselineParking;
    SummaryMetrics baselineMetrics;

    ShapeVariant bestVariant;
    FloorStack best;
    ParkingPlan bestParking;
    SummaryMetrics bestMetrics;

    List<ShapeCandidate> candidates;

    public String getLotWkt() {
        return lotPolygon == null ? null : new WKTWriter().write(lotPolygon);
    }

    public static LotResult failed(String lotId, String message) {
        return LotResult.builder()
                .lotId(lotId)
                .status(LotStatus.FAILED)
                .message(message)
                .candidates(List.of())
                .build();
    }

    public static LotResult cancelled(String lotId) {
        return LotResult.builder()
                .lotId(lotId)
                .status(LotStatus.CANCELLED)
                .message("batch cancelled before this lot was committed")
                .candidates(List.of())
                .build();
    }
}
