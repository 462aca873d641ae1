package com.rpgcore.intents;

/**
 * JSON от классификатора или рассказчика не удалось разобрать
 */
public class IntentParseException extends Exception {

    public IntentParseException(String message) {
        super(message);
    }

    public IntentParseException(String message, Throwable cause) {
        super(message, cause);
    }
}
