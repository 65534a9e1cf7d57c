package io.github.chirino.social.persistence.repo;

import io.github.chirino.social.persistence.entity.DirectMessageEntity;
import io.quarkus.hibernate.orm.panache.PanacheRepositoryBase;
import io.quarkus.panache.common.Sort;
import jakarta.enterprise.context.ApplicationScoped;
import java.time.OffsetDateTime;
import java.util.List;
import java.util.UUID;

@ApplicationScoped
public class DirectMessageRepository implements PanacheRepositoryBase<DirectMessageEntity, Long> {

    public DirectMessageEntity append(UUID channelId, UUID senderId, String content) {
        DirectMessageEntity message = new DirectMessageEntity();
        message.setChannelId(channelId);
        message.setSenderId(senderId);
        message.setContent(content);
        message.setCreatedAt(OffsetDateTime.now());
        persist(message);
        return message;
    }

    public List<DirectMessageEntity> listEarliest(UUID channelId, int limit) {
        return find("channelId = ?1", Sort.ascending("createdAt", "id"), channelId)
                .page(0, limit)
                .list();
    }

    public long deleteForChannel(UUID channelId) {
        return delete("channelId = ?1", channelId);
    }
}
