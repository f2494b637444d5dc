package by.greenmobile.lotmassing.service.engine;

/** Почему пятно этажа отклонено. Проверки идут в этом порядке. */
public enum RejectionReason {
    EMPTY,
    BELOW_MIN_AREA,
    TOO_NARROW,
    PATIO_TOO_SMALL,
    CORE_DOES_NOT_FIT
}
