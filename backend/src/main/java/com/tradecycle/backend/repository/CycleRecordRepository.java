package com.tradecycle.backend.repository;

import com.tradecycle.backend.model.CycleRecordEntity;
import com.tradecycle.backend.trading.model.CycleStatus;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.Collection;
import java.util.List;
import java.util.Optional;

public interface CycleRecordRepository extends JpaRepository<CycleRecordEntity, String> {

    List<CycleRecordEntity> findAllByOrderByStartedAtDesc(Pageable pageable);

    Optional<CycleRecordEntity> findFirstByStatusInOrderByStartedAtDesc(Collection<CycleStatus> statuses);
}
