package com.behavior_ml_retraining.entity;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

@Entity
@Table(name = "user_behaviors", indexes = {
        @Index(name = "idx_user_behaviors_user_id", columnList = "user_id"),
        @Index(name = "idx_user_behaviors_created_at", columnList = "created_at")
})
@Data
@Builder
@AllArgsConstructor
@NoArgsConstructor
public class UserBehavior {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "user_id", nullable = false)
    private Long userId;

    @Column(name = "product_id")
    private Long productId;

    @Column(nullable = false, length = 50)
    private String action; // view, cart_add, purchase

    @Column(name = "session_duration")
    private Double sessionDuration;

    @Builder.Default
    @Column(name = "page_views", nullable = false)
    private Integer pageViews = 1;

    @Column(name = "created_at", nullable = false)
    private Instant createdAt;
}
