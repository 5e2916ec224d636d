package com.behavior_ml_retraining.repository;

import com.behavior_ml_retraining.entity.UserBehavior;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.Collection;
import java.util.List;

@Repository
public interface UserBehaviorRepository extends JpaRepository<UserBehavior, Long> {

    long countByCreatedAtAfter(Instant since);

    List<UserBehavior> findAllByOrderByCreatedAtDescIdDesc(Pageable pageable);

    List<UserBehavior> findByCreatedAtAfterOrderByCreatedAtDescIdDesc(Instant since, Pageable pageable);

    @Query("SELECT ub FROM UserBehavior ub WHERE ub.userId IN :userIds ORDER BY ub.userId, ub.createdAt, ub.id")
    List<UserBehavior> findHistoryForUsers(@Param("userIds") Collection<Long> userIds);

    List<UserBehavior> findByUserIdOrderByCreatedAtAscIdAsc(Long userId);
}
