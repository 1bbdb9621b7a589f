package com.boundplan.entity;

import jakarta.persistence.*;
import lombok.*;
import org.hibernate.annotations.CreationTimestamp;
import org.hibernate.annotations.UpdateTimestamp;

import java.time.OffsetDateTime;

@Entity
@Table(name = "bound_plan_session")
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class BoundPlanSession {

    @Id
    @Column(name = "session_id", length = 100)
    private String sessionId;

    @Column(name = "strategy", length = 50, nullable = false)
    private String strategy;

    @Column(name = "state_json", nullable = false, columnDefinition = "TEXT")
    private String stateJson;

    @Column(name = "bound_plan_spec", columnDefinition = "TEXT")
    private String boundPlanSpec;

    @Column(name = "plan_readiness", length = 30)
    private String planReadiness;

    @Column(name = "revision", nullable = false)
    private long revision;

    @CreationTimestamp
    @Column(name = "created_at", nullable = false, updatable = false)
    private OffsetDateTime createdAt;

    @UpdateTimestamp
    @Column(name = "updated_at", nullable = false)
    private OffsetDateTime updatedAt;
}
