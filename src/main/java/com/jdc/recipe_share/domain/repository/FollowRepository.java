package com.jdc.recipe_share.domain.repository;

import com.jdc.recipe_share.domain.entity.Follow;
import com.jdc.recipe_share.domain.entity.User;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.Collection;
import java.util.Optional;
import java.util.Set;

@Repository
public interface FollowRepository extends JpaRepository<Follow, Long> {

    Optional<Follow> findByUserIdAndAuthorId(Long userId, Long authorId);

    boolean existsByUserIdAndAuthorId(Long userId, Long authorId);

    @Query("SELECT f.author.id FROM Follow f WHERE f.user.id = :userId AND f.author.id IN :authorIds")
    Set<Long> findAuthorIdsByUserIdAndAuthorIdIn(@Param("userId") Long userId,
                                                 @Param("authorIds") Collection<Long> authorIds);

    @Query(value = "SELECT f.author FROM Follow f WHERE f.user.id = :userId ORDER BY f.author.id",
            countQuery = "SELECT COUNT(f) FROM Follow f WHERE f.user.id = :userId")
    Page<User> findAuthorsByUserId(@Param("userId") Long userId, Pageable pageable);
}
