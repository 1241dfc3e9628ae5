package dev.autoresume.exception;

/** Invalid answer at the selection prompt. Always re-prompted, never fatal. */
public class SelectionException extends RuntimeException {

    public SelectionException(String message) {
        super(message);
    }
}
