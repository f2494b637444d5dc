package by.greenmobile.lotmassing.service.engine;

import by.greenmobile.lotmassing.entity.FloorRecord;
import by.greenmobile.lotmassing.entity.FloorStack;
import by.greenmobile.lotmassing.entity.LotGeometry;
import by.greenmobile.lotmassing.entity.ParameterSet;
import by.greenmobile.lotmassing.entity.SetbackOffsets;
import by.greenmobile.lotmassing.entity.ShapeVariant;
import by.greenmobile.lotmassing.entity.TerminationReason;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Наращивание этажей снизу вверх для одного варианта формы.
 *
 * Остановка:
 * - следующий этаж превысил бы max_height (этаж не добавляется);
 * - пятно отклонено (стек заканчивается на предыдущем этаже);
 * - следующий этаж вывел бы сумму площадей за max_far (только при stack_within_far);
 * - достигнут max_floor_count.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class FloorStackBuilder {

    private static final double HEIGHT_EPS = 1e-9;
    private static final double AREA_TOLERANCE = 1e-6;

    private final SetbackEngine setbackEngine;
    private final FootprintGenerator footprintGenerator;

    /** Базовый стек: ортогональная форма, без метки варианта на этажах. */
    public FloorStack buildBaseline(LotGeometry lot, ParameterSet p) {
        return build(lot, p, ShapeVariant.ORTHOGONAL, false);
    }

    /** Стек для варианта оптимизатора: этажи помечены вариантом. */
    public FloorStack build(LotGeometry lot, ParameterSet p, ShapeVariant variant) {
        return build(lot, p, variant, true);
    }

    private FloorStack build(LotGeometry lot, ParameterSet p, ShapeVariant variant, boolean tagVariant) {
        List<FloorRecord> floors = new ArrayList<>();
        double base = 0.0;
        double gfa = 0.0;
        double farCapArea = p.getMaxFar() * lot.area();
        TerminationReason reason = TerminationReason.MAX_FLOORS;

        for (int floor = 1; floor <= p.getMaxFloorCount(); floor++) {
            double h = floor == 1 ? p.getGfFloorHeight() : p.getUfFloorHeight();
            if (base + h > p.getMaxHeight() + HEIGHT_EPS) {
                reason = TerminationReason.HEIGHT_CAP;
                break;
            }

            SetbackOffsets offsets = setbackEngine.offsets(p, floor, base);
            FootprintResult fp = footprintGenerator.generate(lot, p, offsets, variant);
            if (!fp.isAccepted()) {
                reason = floor == 1 ? TerminationReason.GROUND_FLOOR_REJECTED : TerminationReason.FOOTPRINT_REJECTED;
                log.debug("STACK {} [{}]: floor {} rejected: {} ({})",
                        lot.getLotId(), variant, floor, fp.getRejection(), fp.getDetail());
                break;
            }

            if (p.isStackWithinFar() && gfa + fp.getArea() > farCapArea + AREA_TOLERANCE) {
                reason = TerminationReason.FAR_CAP;
                break;
            }

            floors.add(FloorRecord.builder()
                    .floorIndex(floor)
                    .label(FloorRecord.labelFor(floor))
                    .baseElevation(base)
                    .floorHeight(h)
                    .footprint(fp.getFootprint())
                    .footprintArea(fp.getArea())
                    .coreArea(fp.getCoreArea())
                    .circulationArea(fp.getCirculationArea())
                    .usableArea(fp.getUsableArea())
                    .frontSetback(offsets.getFront())
                    .backSetback(offsets.getBack())
                    .sideSetback(offsets.getSide())
                    .hasSetback(fp.isHasSetback())
                    .verticalSetback(offsets.getBack() > p.getMinBackSetback())
                    .variant(tagVariant ? variant : null)
                    .build());

            base += h;
            gfa += fp.getArea();
        }

        log.debug("STACK {} [{}]: floors={}, height={}, reason={}",
                lot.getLotId(), variant, floors.size(), base, reason);
        return new FloorStack(List.copyOf(floors), reason, variant);
    }
}
