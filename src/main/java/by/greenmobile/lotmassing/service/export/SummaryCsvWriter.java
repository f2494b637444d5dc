package by.greenmobile.lotmassing.service.export;

import by.greenmobile.lotmassing.entity.LotResult;
import by.greenmobile.lotmassing.entity.SummaryMetrics;
import com.opencsv.CSVWriter;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.StringWriter;
import java.util.List;
import java.util.Locale;

/**
 * Сводная таблица по участкам (CSV, одна строка на участок).
 * Кавычки только там, где поле содержит разделитель, кавычку или перевод строки.
 */
@Component
public class SummaryCsvWriter {

    static final String[] COLUMNS = {
            "lot_id", "status",
            "baseline_floors", "baseline_gfa", "baseline_far", "baseline_units",
            "parking_stalls_required", "parking_stalls_provided",
            "parking_area_required", "parking_area_provided", "parking_shortfall",
            "best_shape", "best_floors", "best_gfa", "best_far", "best_units",
            "objective", "best_objective_value", "message"};

    static final String HEADER = String.join(",", COLUMNS);

    public String write(List<LotResult> results) {
        StringWriter sw = new StringWriter();
        try (CSVWriter out = new CSVWriter(sw, CSVWriter.DEFAULT_SEPARATOR, CSVWriter.DEFAULT_QUOTE_CHARACTER,
                CSVWriter.DEFAULT_ESCAPE_CHARACTER, "\n")) {
            out.writeNext(COLUMNS, false);
            for (LotResult r : results) {
                out.writeNext(row(r), false);
            }
        } catch (IOException e) {
            throw new IllegalStateException("CSV summary failed", e);
        }
        return sw.toString();
    }

    private String[] row(LotResult r) {
        SummaryMetrics b = r.getBaselineMetrics();
        SummaryMetrics best = r.getBestMetrics();
        return new String[]{
                r.getLotId(),
                r.getStatus().name(),
                b != null ? String.valueOf(b.getFloorCount()) : "",
                b != null ? num(b.getGrossFloorArea()) : "",
                b != null ? num(b.getAchievedFar()) : "",
                b != null ? String.valueOf(b.getUnitCount()) : "",
                b != null ? String.valueOf(b.getParkingStallsRequired()) : "",
                b != null ? String.valueOf(b.getParkingStallsProvided()) : "",
                b != null ? num(b.getParkingAreaRequired()) : "",
                b != null ? num(b.getParkingAreaProvided()) : "",
                b != null ? String.valueOf(b.isParkingShortfall()) : "",
                r.getBestVariant() != null ? r.getBestVariant().getId() : "",
                best != null ? String.valueOf(best.getFloorCount()) : "",
                best != null ? num(best.getGrossFloorArea()) : "",
                best != null ? num(best.getAchievedFar()) : "",
                best != null ? String.valueOf(best.getUnitCount()) : "",
                r.getParameters() != null && r.getParameters().getOptimizationObjective() != null
                        ? r.getParameters().getOptimizationObjective().name().toLowerCase(Locale.ROOT) : "",
                best != null ? num(best.getObjectiveValue()) : "",
                r.getMessage()};
    }

    private static String num(double v) {
        return String.format(Locale.US, "%.3f", v);
    }
}
