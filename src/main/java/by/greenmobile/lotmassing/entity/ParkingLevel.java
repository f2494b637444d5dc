package by.greenmobile.lotmassing.entity;

import lombok.Value;

/** Уровень парковки. Подземные уровни: индекс -1, -2, ... */
@Value
public class ParkingLevel {
    int levelIndex;
    String label;
    double baseElevation;
    double levelHeight;
    double area;
}
