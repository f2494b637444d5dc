package by.greenmobile.lotmassing.service.engine;

import by.greenmobile.lotmassing.entity.ParameterSet;
import by.greenmobile.lotmassing.entity.SetbackOffsets;
import org.springframework.stereotype.Component;

/**
 * Отступы для этажа.
 *
 * Передний и боковые отступы постоянны. Задний, начиная с min_setback_start_floor,
 * равен max(min_back_setback, back_setback_percent * высота под этажом).
 */
@Component
public class SetbackEngine {

    /**
     * @param floorIndex  номер этажа, 1 = первый
     * @param heightBelow суммарная высота этажей под этим этажом, м
     */
    public SetbackOffsets offsets(ParameterSet p, int floorIndex, double heightBelow) {
        double back = p.getMinBackSetback();
        if (floorIndex >= p.getMinSetbackStartFloor()) {
            back = Math.max(back, p.getBackSetbackPercent() * heightBelow);
        }
        return new SetbackOffsets(p.getMinFrontSetback(), back, p.getMinSideSetback());
    }
}
