package io.github.chirino.social.api.dto;

import java.util.List;

/** Everything the caller's social views need, gathered in one call. */
public class SnapshotDto {

    private String actorId;
    private String username;
    private TouchListDto touch;
    private List<DirectChannelDto> chats;
    private HushListDto hush;

    public String getActorId() {
        return actorId;
    }

    public void setActorId(String actorId) {
        this.actorId = actorId;
    }

    public String getUsername() {
        return username;
    }

    public void setUsername(String username) {
        this.username = username;
    }

    public TouchListDto getTouch() {
        return touch;
    }

    public void setTouch(TouchListDto touch) {
        this.touch = touch;
    }

    public List<DirectChannelDto> getChats() {
        return chats;
    }

    public void setChats(List<DirectChannelDto> chats) {
        this.chats = chats;
    }

    public HushListDto getHush() {
        return hush;
    }

    public void setHush(HushListDto hush) {
        this.hush = hush;
    }
}
