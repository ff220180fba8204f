package io.tabdeck.board.app;

public record ErrorResponse(String error) {
}
