package by.greenmobile.lotmassing.service.validation;

import lombok.Getter;

/**
 * Некорректные входные данные участка (геометрия, грани или параметры).
 * Участок помечается FAILED, остальные участки пакета продолжают считаться.
 */
@Getter
public class InvalidLotException extends RuntimeException {

    private final String lotId;

    public InvalidLotException(String lotId, String message) {
        super("lot " + lotId + ": " + message);
        this.lotId = lotId;
    }

    public InvalidLotException(String lotId, String message, Throwable cause) {
        super("lot " + lotId + ": " + message, cause);
        this.lotId = lotId;
    }
}
