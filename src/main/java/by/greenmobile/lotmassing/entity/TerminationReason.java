package by.greenmobile.lotmassing.entity;

/** Почему остановилось наращивание этажей. */
public enum TerminationReason {
    /** Следующий этаж превысил бы max_height. */
    HEIGHT_CAP,
    /** Первый этаж не прошёл проверки пятна: участок непригоден. */
    GROUND_FLOOR_REJECTED,
    /** Пятно очередного этажа не прошло проверки. */
    FOOTPRINT_REJECTED,
    /** Достигнут max_far (только при stack_within_far). */
    FAR_CAP,
    /** Достигнут страховочный предел max_floor_count. */
    MAX_FLOORS
}
