package by.greenmobile.lotmassing.entity;

public enum LotStatus {
    /** Есть хотя бы один этаж. */
    OK,
    /** Первый этаж не проходит проверки: массы нет. */
    INFEASIBLE,
    /** Ошибка входных данных или расчёта. */
    FAILED,
    /** Пакет отменён до фиксации результата. */
    CANCELLED
}
