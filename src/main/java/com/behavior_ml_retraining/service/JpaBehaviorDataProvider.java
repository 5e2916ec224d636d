package com.behavior_ml_retraining.service;

import com.behavior_ml_retraining.dto.behavior.BehaviorRecord;
import com.behavior_ml_retraining.entity.UserBehavior;
import com.behavior_ml_retraining.enumeration.BehaviorActionEnum;
import com.behavior_ml_retraining.repository.UserBehaviorRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Reads behavior events through Spring Data and joins every event with the user's activity
 * recorded at or before its timestamp (purchases, cart additions, views, mean session duration).
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class JpaBehaviorDataProvider implements DataProvider {

    static final int USER_ID_CHUNK = 500;

    private final UserBehaviorRepository userBehaviorRepository;

    @Override
    @Transactional(readOnly = true)
    public long countNewSamplesSince(Instant since) {
        return userBehaviorRepository.countByCreatedAtAfter(since);
    }

    @Override
    @Transactional(readOnly = true)
    public List<BehaviorRecord> loadTrainingExtract(int limit) {
        if (limit <= 0) {
            return List.of();
        }
        List<UserBehavior> events = userBehaviorRepository.findAllByOrderByCreatedAtDescIdDesc(PageRequest.of(0, limit));
        List<BehaviorRecord> records = withCumulativeActivity(events);
        log.info("📥 Loaded {} training samples", records.size());
        return records;
    }

    @Override
    @Transactional(readOnly = true)
    public List<BehaviorRecord> loadValidationWindow(Instant since, int limit) {
        if (limit <= 0) {
            return List.of();
        }
        List<UserBehavior> events = userBehaviorRepository
                .findByCreatedAtAfterOrderByCreatedAtDescIdDesc(since, PageRequest.of(0, limit));
        return withCumulativeActivity(events);
    }

    @Override
    @Transactional(readOnly = true)
    public Optional<BehaviorRecord> loadUserProfile(long userId) {
        List<UserBehavior> history = userBehaviorRepository.findByUserIdOrderByCreatedAtAscIdAsc(userId);
        if (history.isEmpty()) {
            return Optional.empty();
        }
        Map<Long, BehaviorRecord> byEvent = accumulate(history);
        return Optional.ofNullable(byEvent.get(history.get(history.size() - 1).getId()));
    }

    private List<BehaviorRecord> withCumulativeActivity(List<UserBehavior> events) {
        if (events.isEmpty()) {
            return List.of();
        }
        List<Long> userIds = events.stream()
                .map(UserBehavior::getUserId)
                .distinct()
                .toList();

        List<UserBehavior> history = new ArrayList<>();
        for (int from = 0; from < userIds.size(); from += USER_ID_CHUNK) {
            List<Long> chunk = userIds.subList(from, Math.min(from + USER_ID_CHUNK, userIds.size()));
            history.addAll(userBehaviorRepository.findHistoryForUsers(chunk));
        }

        Map<Long, BehaviorRecord> byEvent = accumulate(history);
        List<BehaviorRecord> records = new ArrayList<>(events.size());
        for (UserBehavior event : events) {
            BehaviorRecord record = byEvent.get(event.getId());
            if (record != null) {
                records.add(record);
            }
        }
        return records;
    }

    /**
     * Walks each user's history in time order; events sharing a timestamp all see each other.
     * Expects {@code history} ordered by user, then creation time.
     */
    static Map<Long, BehaviorRecord> accumulate(List<UserBehavior> history) {
        Map<Long, BehaviorRecord> byEvent = new HashMap<>();
        Map<Long, Activity> activityByUser = new HashMap<>();

        int i = 0;
        while (i < history.size()) {
            UserBehavior first = history.get(i);
            int end = i;
            while (end < history.size()
                    && Objects.equals(history.get(end).getUserId(), first.getUserId())
                    && Objects.equals(history.get(end).getCreatedAt(), first.getCreatedAt())) {
                end++;
            }

            Activity activity = activityByUser.computeIfAbsent(first.getUserId(), id -> new Activity());
            for (int j = i; j < end; j++) {
                activity.add(history.get(j));
            }
            for (int j = i; j < end; j++) {
                UserBehavior event = history.get(j);
                byEvent.put(event.getId(), activity.snapshot(event));
            }
            i = end;
        }
        return byEvent;
    }

    private static final class Activity {
        private long purchases;
        private long cartAdds;
        private long views;
        private double sessionSum;
        private long sessionCount;

        void add(UserBehavior event) {
            Optional<BehaviorActionEnum> action = BehaviorActionEnum.fromValue(event.getAction());
            if (action.isPresent()) {
                switch (action.get()) {
                    case PURCHASE -> purchases++;
                    case CART_ADD -> cartAdds++;
                    case VIEW -> views++;
                }
            }
            if (event.getSessionDuration() != null) {
                sessionSum += event.getSessionDuration();
                sessionCount++;
            }
        }

        BehaviorRecord snapshot(UserBehavior event) {
            return BehaviorRecord.builder()
                    .userId(event.getUserId())
                    .action(event.getAction())
                    .sessionDuration(event.getSessionDuration())
                    .productId(event.getProductId())
                    .createdAt(event.getCreatedAt())
                    .purchaseCount(purchases)
                    .cartAdds(cartAdds)
                    .pageViews(views)
                    .avgSessionDuration(sessionCount > 0 ? sessionSum / sessionCount : null)
                    .build();
        }
    }
}
