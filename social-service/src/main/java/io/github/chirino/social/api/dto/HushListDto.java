package io.github.chirino.social.api.dto;

import java.util.List;

public class HushListDto {

    private List<HushChatDto> chats;
    private List<HushInviteDto> invitesForMe;
    private List<HushJoinRequestDto> requestsForMe;

    public List<HushChatDto> getChats() {
        return chats;
    }

    public void setChats(List<HushChatDto> chats) {
        this.chats = chats;
    }

    public List<HushInviteDto> getInvitesForMe() {
        return invitesForMe;
    }

    public void setInvitesForMe(List<HushInviteDto> invitesForMe) {
        this.invitesForMe = invitesForMe;
    }

    public List<HushJoinRequestDto> getRequestsForMe() {
        return requestsForMe;
    }

    public void setRequestsForMe(List<HushJoinRequestDto> requestsForMe) {
        this.requestsForMe = requestsForMe;
    }
}
