package by.greenmobile.lotmassing.service.report;

import by.greenmobile.lotmassing.entity.FloorRecord;
import by.greenmobile.lotmassing.entity.FloorStack;
import by.greenmobile.lotmassing.entity.LotResult;
import by.greenmobile.lotmassing.entity.ParameterSet;
import by.greenmobile.lotmassing.entity.ParkingLevel;
import by.greenmobile.lotmassing.entity.ParkingPlan;
import by.greenmobile.lotmassing.entity.ShapeCandidate;
import by.greenmobile.lotmassing.entity.SummaryMetrics;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.pdmodel.PDPage;
import org.apache.pdfbox.pdmodel.PDPageContentStream;
import org.apache.pdfbox.pdmodel.common.PDRectangle;
import org.apache.pdfbox.pdmodel.font.PDFont;
import org.apache.pdfbox.pdmodel.font.PDType1Font;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.util.Locale;

/**
 * PDF-отчёт по участку: сводка, параметры, этажи, журнал вариантов формы.
 *
 * Шрифты стандартные (Helvetica), поэтому весь текст отчёта латиницей.
 */
@Service
public class PdfReportService {

    private static final float M = 50f;
    private static final float W = PDRectangle.A4.getWidth();
    private static final float H = PDRectangle.A4.getHeight();
    private static final float MAX_WIDTH = W - 2 * M;

    private final PDFont font = PDType1Font.HELVETICA;
    private final PDFont fontBold = PDType1Font.HELVETICA_BOLD;

    /** Сколько строк журнала вариантов печатать. */
    @Value("${massing.report.maxCandidates:24}")
    private int maxCandidates = 24;

    public byte[] buildLotReport(LotResult r) throws IOException {
        try (PDDocument doc = new PDDocument()) {
            Cursor c = new Cursor(doc);
            writeHeader(c, "MASSING REPORT: " + r.getLotId());
            writeSummaryPage(c, r);

            if (r.getParameters() != null) {
                c.newPage();
                writeHeader(c, "PARAMETERS");
                writeParametersPage(c, r.getParameters());
            }

            c.newPage();
            writeHeader(c, "FLOORS");
            writeFloorsPage(c, "Baseline (orthogonal)", r.getBaseline(), r.getBaselineParking());
            if (r.getBest() != null) {
                writeFloorsPage(c, "Best shape " + r.getBestVariant().getId(), r.getBest(), r.getBestParking());
            }

            if (r.getCandidates() != null && !r.getCandidates().isEmpty()) {
                c.newPage();
                writeHeader(c, "SHAPE SEARCH");
                writeCandidatesPage(c, r);
            }

            c.newPage();
            writeHeader(c, "NOTES");
            writeNotesPage(c);

            c.close();

            ByteArrayOutputStream out = new ByteArrayOutputStream();
            doc.save(out);
            return out.toByteArray();
        }
    }

    private void writeSummaryPage(Cursor c, LotResult r) throws IOException {
        float y = c.y;

        y = h2(c, y, "Lot");
        y = kv(c, y, "Lot id", r.getLotId());
        y = kv(c, y, "Status", r.getStatus().name());
        y = kv(c, y, "Lot area", fmt(r.getLotArea()) + " m2");
        if (r.getMessage() != null) {
            y = paragraph(c, y, "Note: " + r.getMessage());
        }

        c.y = y;
        writeMetrics(c, "Baseline (orthogonal)", r.getBaselineMetrics());
        if (r.getBestMetrics() != null) {
            writeMetrics(c, "Best shape " + r.getBestVariant().getId(), r.getBestMetrics());
        } else {
            c.y = paragraph(c, c.y - 6, "Best shape: none (no selectable candidate).");
        }
    }

    private void writeMetrics(Cursor c, String title, SummaryMetrics m) throws IOException {
        if (m == null) return;
        float y = c.y - 6;

        y = h2(c, y, title);
        y = kv(c, y, "Floors", String.valueOf(m.getFloorCount()));
        y = kv(c, y, "Total height", fmt(m.getTotalHeight()) + " m");
        y = kv(c, y, "Gross floor area", fmt(m.getGrossFloorArea()) + " m2");
        y = kv(c, y, "FAR achieved", fmt(m.getAchievedFar()));
        y = kv(c, y, "Coverage", fmt(m.getCoverage()));
        y = kv(c, y, "Units (estimate)", String.valueOf(m.getUnitCount()));
        y = kv(c, y, "Efficiency", fmt(m.getEfficiency()) + (m.isMeetsTargetEfficiency() ? " (meets target)" : ""));
        y = kv(c, y, "Slenderness", m.getSlenderness() != null ? fmt(m.getSlenderness()) : "-");
        y = kv(c, y, "Parking stalls req / prov", m.getParkingStallsRequired() + " / " + m.getParkingStallsProvided()
                + (m.isParkingShortfall() ? " (SHORTFALL)" : ""));
        y = kv(c, y, "Parking area req / prov",
                fmt(m.getParkingAreaRequired()) + " / " + fmt(m.getParkingAreaProvided()) + " m2");
        y = kv(c, y, "Objective " + (m.getObjective() != null ? m.getObjective().name().toLowerCase(Locale.ROOT) : ""),
                fmt(m.getObjectiveValue()));
        y = kv(c, y, "Compliant", m.isCompliant() ? "yes" : "no");
        for (String v : m.getViolations()) {
            y = codeLine(c, y, "- " + v);
        }

        c.y = y;
    }

    private void writeParametersPage(Cursor c, ParameterSet p) throws IOException {
        float y = c.y;

        y = h2(c, y, "Normative");
        y = kv(c, y, "max_height", fmt(p.getMaxHeight()) + " m");
        y = kv(c, y, "max_far", fmt(p.getMaxFar()));
        y = kv(c, y, "max_lot_coverage", fmt(p.getMaxLotCoverage()));
        y = kv(c, y, "gf / uf floor height", fmt(p.getGfFloorHeight()) + " / " + fmt(p.getUfFloorHeight()) + " m");
        y = kv(c, y, "front / back / side setback",
                fmt(p.getMinFrontSetback()) + " / " + fmt(p.getMinBackSetback()) + " / " + fmt(p.getMinSideSetback()) + " m");
        y = kv(c, y, "back setback from floor", p.getMinSetbackStartFloor() + " at " + fmt(p.getBackSetbackPercent()));

        y -= 8;
        y = h2(c, y, "Architectural");
        y = kv(c, y, "min_floor_area", fmt(p.getMinFloorArea()) + " m2");
        y = kv(c, y, "min / target unit area", fmt(p.getMinUnitArea()) + " / " + fmt(p.getTargetUnitArea()) + " m2");
        y = kv(c, y, "min_unit_width", fmt(p.getMinUnitWidth()) + " m");
        y = kv(c, y, "min_patios_dimension", fmt(p.getMinPatiosDimension()) + " m");
        y = kv(c, y, "core_area_fraction", fmt(p.getCoreAreaFraction()));
        y = kv(c, y, "access_width", fmt(p.getAccessWidth()) + " m");

        y -= 8;
        y = h2(c, y, "Parking");
        y = kv(c, y, "required", String.valueOf(p.isParkingRequired()));
        y = kv(c, y, "type / levels allowed", p.getParkingType() + " / " + p.getParkingLevelsAllowed());
        y = kv(c, y, "ratio res / com", fmt(p.getParkingRatioResidential()) + " / " + fmt(p.getParkingRatioCommercial()));
        y = kv(c, y, "area per slot (+ramp)", fmt(p.getParkingAreaPerSlot()) + " (+" + fmt(p.getRampAreaPerFloorFraction()) + ")");
        y = kv(c, y, "include in FAR", String.valueOf(p.isIncludeParkingInFar()));

        y -= 8;
        y = h2(c, y, "Strategy");
        y = kv(c, y, "modeling_mode", String.valueOf(p.getModelingMode()));
        y = kv(c, y, "objective", String.valueOf(p.getOptimizationObjective()));
        y = kv(c, y, "shape_ratio_steps", String.valueOf(p.getShapeRatioSteps()));
        y = kv(c, y, "orientation_steps", String.valueOf(p.getOrientationSteps()));

        c.y = y;
    }

    private void writeFloorsPage(Cursor c, String title, FloorStack stack, ParkingPlan parking) throws IOException {
        float y = c.y;

        y = h2(c, y, title + (stack != null ? " - stop: " + stack.getTerminationReason() : ""));
        if (stack == null || stack.isEmpty()) {
            y = paragraph(c, y, "No floors.");
            c.y = y;
            return;
        }

        for (FloorRecord f : stack.getFloors()) {
            y = codeLine(c, y, String.format(Locale.US,
                    "%-9s z=%6.2f h=%4.2f area=%8.2f usable=%8.2f back=%5.2f%s",
                    f.getLabel(), f.getBaseElevation(), f.getFloorHeight(), f.getFootprintArea(),
                    f.getUsableArea(), f.getBackSetback(), f.isHasSetback() ? "" : " (no setback)"));
        }
        if (parking != null) {
            for (ParkingLevel l : parking.getLevels()) {
                y = codeLine(c, y, String.format(Locale.US, "%-15s z=%6.2f area=%8.2f",
                        l.getLabel(), l.getBaseElevation(), l.getArea()));
            }
        }

        c.y = y - 8;
    }

    private void writeCandidatesPage(Cursor c, LotResult r) throws IOException {
        float y = c.y;

        y = h2(c, y, "Candidates (ranked)");
        int n = 0;
        for (ShapeCandidate cand : r.getCandidates()) {
            if (n++ >= maxCandidates) {
                y = paragraph(c, y, "... " + (r.getCandidates().size() - maxCandidates) + " more");
                break;
            }
            y = codeLine(c, y, String.format(Locale.US, "%-14s floors=%3d gfa=%9.2f value=%9.3f %s",
                    cand.getVariant().getId(), cand.getFloorCount(), cand.getGrossFloorArea(),
                    cand.getObjectiveValue(), cand.isSelectable() ? "" : "(not selectable)"));
        }

        c.y = y;
    }

    private void writeNotesPage(Cursor c) throws IOException {
        float y = c.y;

        y = h2(c, y, "Limitations");
        y = paragraph(c, y,
                "1) Footprints are derived from boundary faces by per-role inward offsets. "
                        + "The back setback grows with the height below each floor from the configured start floor.");
        y = paragraph(c, y,
                "2) Units are an estimate: usable area (footprint minus core and access corridor) divided by the target unit area.");
        y = paragraph(c, y,
                "3) Parking shortfall is reported, never compensated by extra levels.");
        y = paragraph(c, y,
                "4) Under maximize_far_within_height a shape whose FAR exceeds max_far is not selectable.");

        c.y = y;
    }

    // ===== Drawing helpers =====

    private void writeHeader(Cursor c, String title) throws IOException {
        float y = H - 70;
        text(c, fontBold, 18, M, y, title);
        text(c, font, 10, W - 160, y + 4, "Date: " + LocalDate.now().format(DateTimeFormatter.ofPattern("dd.MM.yyyy")));
        c.y = H - 105;
    }

    private float h2(Cursor c, float y, String t) throws IOException {
        y = c.ensureSpace(y, 28);
        text(c, fontBold, 13, M, y, t);
        return y - 18;
    }

    private float kv(Cursor c, float y, String key, String value) throws IOException {
        y = c.ensureSpace(y, 18);
        text(c, font, 11, M, y, key + ":");
        text(c, fontBold, 11, M + 220, y, value);
        return y - 16;
    }

    private float paragraph(Cursor c, float y, String text) throws IOException {
        return wrappedText(c, y, text, font, 11, 16, 0);
    }

    private float codeLine(Cursor c, float y, String text) throws IOException {
        y = c.ensureSpace(y, 14);
        text(c, PDType1Font.COURIER, 9, M + 14, y, text);
        return y - 12;
    }

    private float wrappedText(Cursor c, float y, String text, PDFont f, int size, float leading, float indent) throws IOException {
        y = c.ensureSpace(y, leading + 6);

        String[] words = text.split("\\s+");
        StringBuilder line = new StringBuilder();

        float x0 = M + indent;
        float maxW = MAX_WIDTH - indent;

        for (String word : words) {
            String test = (line.length() == 0) ? word : (line + " " + word);
            float tw = f.getStringWidth(test) / 1000f * size;

            if (tw > maxW && line.length() > 0) {
                y = c.ensureSpace(y, leading);
                text(c, f, size, x0, y, line.toString());
                y -= leading;
                line = new StringBuilder(word);
            } else {
                if (line.length() > 0) line.append(" ");
                line.append(word);
            }
        }

        if (line.length() > 0) {
            y = c.ensureSpace(y, leading);
            text(c, f, size, x0, y, line.toString());
            y -= leading;
        }

        return y - 4;
    }

    private void text(Cursor c, PDFont f, int size, float x, float y, String t) throws IOException {
        c.cs.beginText();
        c.cs.setFont(f, size);
        c.cs.newLineAtOffset(x, y);
        c.cs.showText(t);
        c.cs.endText();
    }

    private static String fmt(double v) {
        return String.format(Locale.US, "%.3f", v);
    }

    // ===== Cursor / pagination =====

    private static class Cursor {
        final PDDocument doc;
        PDPage page;
        PDPageContentStream cs;
        float y;

        Cursor(PDDocument doc) throws IOException {
            this.doc = doc;
            newPage();
        }

        void newPage() throws IOException {
            if (cs != null) cs.close();
            page = new PDPage(PDRectangle.A4);
            doc.addPage(page);
            cs = new PDPageContentStream(doc, page);
            y = H - 105;
        }

        void close() throws IOException {
            if (cs != null) {
                cs.close();
                cs = null;
            }
        }

        float ensureSpace(float currentY, float needed) throws IOException {
            if (currentY - needed < M) {
                newPage();
                return H - 105;
            }
            return currentY;
        }
    }
}
