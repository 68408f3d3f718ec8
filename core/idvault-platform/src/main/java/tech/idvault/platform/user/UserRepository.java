package tech.idvault.platform.user;

import java.util.List;
import java.util.Optional;

/**
 * Repository interface for User entities.
 * Exposes only approved data access methods - Panache internals are hidden.
 */
public interface UserRepository {

    // Read operations - single entity
    Optional<User> findByIdOptional(String id);
    Optional<User> findByEmailLookupKey(String emailLookupKey);

    // Read operations - lists and counts
    List<User> findPageNewestFirst(int pageIndex, int pageSize);
    long count();
    long countByRole(Role role);
    boolean existsByEmailLookupKeyExcluding(String emailLookupKey, String excludedUserId);

    // Write operations
    void persist(User user);
    void update(User user);
    boolean deleteById(String id);
}
