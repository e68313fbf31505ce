package com.tradeguard.risk;

import com.tradeguard.entity.RiskStateEntity;
import com.tradeguard.mapper.RiskStateMapper;
import com.tradeguard.repository.jpa.RiskStateJpaRepository;
import java.time.Clock;
import java.util.Optional;
import org.mapstruct.factory.Mappers;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Persists the single risk_state row so the kill switch and the day's P&L survive a restart.
 * Called on every kill-switch transition and with each ledger snapshot.
 */
@Service
public class RiskStatePersistenceService {

    private static final Logger log = LoggerFactory.getLogger(RiskStatePersistenceService.class);

    private final RiskStateJpaRepository riskStateJpaRepository;
    private final Clock clock;
    private final RiskStateMapper riskStateMapper = Mappers.getMapper(RiskStateMapper.class);

    public RiskStatePersistenceService(RiskStateJpaRepository riskStateJpaRepository, Clock clock) {
        this.riskStateJpaRepository = riskStateJpaRepository;
        this.clock = clock;
    }

    public void save(RiskStateSnapshot snapshot) {
        RiskStateEntity entity = riskStateMapper.toEntity(snapshot);
        entity.setUpdatedAt(clock.instant());
        riskStateJpaRepository.save(entity);
        log.debug("Risk state persisted: {} daily realized {}", snapshot.getKillSwitchState(), snapshot.getDailyRealizedPnl());
    }

    public Optional<RiskStateSnapshot> load() {
        return riskStateJpaRepository.findById(RiskStateEntity.SINGLETON_ID).map(riskStateMapper::toSnapshot);
    }
}
