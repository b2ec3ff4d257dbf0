package com.tradecycle.backend.repository;

import com.tradecycle.backend.model.CycleLease;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;

public interface CycleLeaseRepository extends JpaRepository<CycleLease, String> {

    @Modifying
    @Transactional
    @Query("update CycleLease l set l.owner = :owner, l.acquiredAt = :now, l.expiresAt = :expiresAt, "
            + "l.version = l.version + 1 where l.resourceId = :resourceId and l.expiresAt < :now")
    int takeOverExpired(@Param("resourceId") String resourceId,
                        @Param("owner") String owner,
                        @Param("now") Instant now,
                        @Param("expiresAt") Instant expiresAt);

    @Modifying
    @Transactional
    @Query("delete from CycleLease l where l.resourceId = :resourceId and l.owner = :owner")
    int deleteByResourceIdAndOwner(@Param("resourceId") String resourceId, @Param("owner") String owner);
}
