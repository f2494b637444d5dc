package by.greenmobile.lotmassing.entity;

import lombok.Value;

/** Отступы (м) для одного этажа по ролям граней. */
@Value
public class SetbackOffsets {
    double front;
    double back;
    double side;

    public double of(FaceRole role) {
        switch (role) {
            case FRONT: return front;
            case BACK: return back;
            default: return side;
        }
    }

    public boolean anyPositive() {
        return front > 0 || back > 0 || side > 0;
    }

    /** Минимальные нормативные отступы (без роста по высоте). */
    public static SetbackOffsets minimums(ParameterSet p) {
        return new SetbackOffsets(p.getMinFrontSetback(), p.getMinBackSetback(), p.getMinSideSetback());
    }
}
