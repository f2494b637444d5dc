package by.greenmobile.lotmassing.controller;

import by.greenmobile.lotmassing.entity.LotResult;
import lombok.Value;

import java.util.List;

/** Последний расчёт (участок или пакет), хранимый в сессии для выгрузок. */
@Value
public class SessionResults {

    public static final String ATTRIBUTE = "LAST_RESULTS";

    List<LotResult> results;

    public boolean isEmpty() {
        return results == null || results.isEmpty();
    }
}
