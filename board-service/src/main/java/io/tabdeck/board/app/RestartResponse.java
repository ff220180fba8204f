package io.tabdeck.board.app;

import com.fasterxml.jackson.annotation.JsonInclude;
import io.tabdeck.status.StatusState;

@JsonInclude(JsonInclude.Include.ALWAYS)
public record RestartResponse(StatusState status, String message) {

    public static RestartResponse restarting() {
        return new RestartResponse(StatusState.RESTARTING, null);
    }
}
