package io.github.chirino.social.persistence.repo;

import io.github.chirino.social.persistence.entity.HushMessageEntity;
import io.quarkus.hibernate.orm.panache.PanacheRepositoryBase;
import io.quarkus.panache.common.Sort;
import jakarta.enterprise.context.ApplicationScoped;
import java.time.OffsetDateTime;
import java.util.List;
import java.util.UUID;

@ApplicationScoped
public class HushMessageRepository implements PanacheRepositoryBase<HushMessageEntity, UUID> {

    public HushMessageEntity append(UUID chatId, UUID userId, String content) {
        HushMessageEntity message = new HushMessageEntity();
        message.setId(UUID.randomUUID());
        message.setChatId(chatId);
        message.setUserId(userId);
        message.setContent(content);
        message.setCreatedAt(OffsetDateTime.now());
        persist(message);
        return message;
    }

    public List<HushMessageEntity> listEarliest(UUID chatId, int limit) {
        return find("chatId = ?1", Sort.ascending("createdAt", "id"), chatId)
                .page(0, limit)
                .list();
    }
}
