package tech.idvault.platform.user;

import io.quarkus.mongodb.panache.PanacheMongoRepositoryBase;
import io.quarkus.panache.common.Page;
import io.quarkus.panache.common.Sort;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Typed;
import org.bson.Document;

import java.util.List;
import java.util.Optional;

/**
 * MongoDB implementation of UserRepository.
 * Package-private to prevent direct injection - use UserRepository interface.
 */
@ApplicationScoped
@Typed(UserRepository.class)
class MongoUserRepository implements PanacheMongoRepositoryBase<User, String>, UserRepository {

    @Override
    public Optional<User> findByEmailLookupKey(String emailLookupKey) {
        return find("emailLookupKey", emailLookupKey).firstResultOptional();
    }

    @Override
    public List<User> findPageNewestFirst(int pageIndex, int pageSize) {
        return findAll(Sort.descending("createdAt"))
            .page(Page.of(pageIndex, pageSize))
            .list();
    }

    @Override
    public long countByRole(Role role) {
        return count("role", role.name());
    }

    @Override
    public boolean existsByEmailLookupKeyExcluding(String emailLookupKey, String excludedUserId) {
        Document query = new Document("emailLookupKey", emailLookupKey)
            .append("_id", new Document("$ne", excludedUserId));
        return count(query) > 0;
    }

    // Delegate to Panache methods via interface
    @Override
    public Optional<User> findByIdOptional(String id) {
        return PanacheMongoRepositoryBase.super.findByIdOptional(id);
    }

    @Override
    public long count() {
        return PanacheMongoRepositoryBase.super.count();
    }

    @Override
    public void persist(User user) {
        PanacheMongoRepositoryBase.super.persist(user);
    }

    @Override
    public void update(User user) {
        PanacheMongoRepositoryBase.super.update(user);
    }

    @Override
    public boolean deleteById(String id) {
        return PanacheMongoRepositoryBase.super.deleteById(id);
    }
}
