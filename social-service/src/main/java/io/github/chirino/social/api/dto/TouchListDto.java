package io.github.chirino.social.api.dto;

import java.util.List;

public class TouchListDto {

    private List<ProfileDto> inTouch;
    private List<IncomingTouchRequestDto> incoming;

    public List<ProfileDto> getInTouch() {
        return inTouch;
    }

    public void setInTouch(List<ProfileDto> inTouch) {
        this.inTouch = inTouch;
    }

    public List<IncomingTouchRequestDto> getIncoming() {
        return incoming;
    }

    public void setIncoming(List<IncomingTouchRequestDto> incoming) {
        this.incoming = incoming;
    }
}
