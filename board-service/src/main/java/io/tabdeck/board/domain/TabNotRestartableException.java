package io.tabdeck.board.domain;

public class TabNotRestartableException extends RuntimeException {

    private final int index;

    public TabNotRestartableException(int index) {
        super("tab index " + index + " is not restartable");
        this.index = index;
    }

    public int index() {
        return index;
    }
}
