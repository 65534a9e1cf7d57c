package io.github.chirino.social.persistence.repo;

import io.github.chirino.social.persistence.entity.ProfileEntity;
import io.quarkus.hibernate.orm.panache.PanacheRepositoryBase;
import io.quarkus.panache.common.Sort;
import jakarta.enterprise.context.ApplicationScoped;
import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

@ApplicationScoped
public class ProfileRepository implements PanacheRepositoryBase<ProfileEntity, UUID> {

    public Optional<ProfileEntity> findProfile(UUID id) {
        return find("id = ?1", id).firstResultOptional();
    }

    public Optional<ProfileEntity> findByUsername(String username) {
        return find("username = ?1", username).firstResultOptional();
    }

    public Optional<ProfileEntity> findByUsernameIgnoreCase(String username) {
        return find("lower(username) = lower(?1)", Sort.ascending("username"), username)
                .firstResultOptional();
    }

    public List<ProfileEntity> listByIds(Collection<UUID> ids) {
        if (ids.isEmpty()) {
            return List.of();
        }
        return list("id in ?1", ids);
    }

    public List<ProfileEntity> listByUsernames(Collection<String> usernames) {
        if (usernames.isEmpty()) {
            return List.of();
        }
        return list("username in ?1", Sort.ascending("username"), usernames);
    }
}
