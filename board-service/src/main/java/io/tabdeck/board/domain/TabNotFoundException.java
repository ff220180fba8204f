package io.tabdeck.board.domain;

public class TabNotFoundException extends RuntimeException {

    private final int index;

    public TabNotFoundException(int index) {
        super("tab index " + index + " is out of range");
        this.index = index;
    }

    public int index() {
        return index;
    }
}
