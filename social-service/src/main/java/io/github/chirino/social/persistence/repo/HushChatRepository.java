package io.github.chirino.social.persistence.repo;

import io.github.chirino.social.model.HushChatStatus;
import io.github.chirino.social.persistence.entity.HushChatEntity;
import io.quarkus.hibernate.orm.panache.PanacheRepositoryBase;
import io.quarkus.panache.common.Sort;
import jakarta.enterprise.context.ApplicationScoped;
import java.time.OffsetDateTime;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

@ApplicationScoped
public class HushChatRepository implements PanacheRepositoryBase<HushChatEntity, UUID> {

    public Optional<HushChatEntity> findChat(UUID id) {
        return find("id = ?1", id).firstResultOptional();
    }

    public HushChatEntity createChat(UUID createdBy) {
        HushChatEntity chat = new HushChatEntity();
        chat.setId(UUID.randomUUID());
        chat.setCreatedBy(createdBy);
        chat.setStatus(HushChatStatus.OPEN);
        chat.setCreatedAt(OffsetDateTime.now());
        persist(chat);
        return chat;
    }

    /** Closed chats are kept but drop out of every listing. */
    public List<HushChatEntity> listOpen() {
        return list("status = ?1", Sort.descending("createdAt"), HushChatStatus.OPEN);
    }

    public int closeChat(UUID id) {
        return update(
                "status = ?1 WHERE id = ?2 AND status = ?3",
                HushChatStatus.CLOSED,
                id,
                HushChatStatus.OPEN);
    }
}
