package com.tradecycle.backend.model;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import jakarta.persistence.Version;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

@Entity
@Table(name = "cycle_leases")
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CycleLease {

    @Id
    @Column(name = "resource_id", length = 64)
    private String resourceId;

    @Column(nullable = false, length = 64)
    private String owner;

    @Column(name = "acquired_at", nullable = false)
    private Instant acquiredAt;

    @Column(name = "expires_at", nullable = false)
    private Instant expiresAt;

    @Version
    private Long version;
}
