package com.tradeguard.support;

import static org.mockito.Mockito.mock;

import com.tradeguard.anomaly.AnomalyMonitor;
import com.tradeguard.audit.AuditLog;
import com.tradeguard.config.EvGateProperties;
import com.tradeguard.config.FeeScheduleProperties;
import com.tradeguard.config.KillSwitchProperties;
import com.tradeguard.config.LedgerProperties;
import com.tradeguard.config.PipelineProperties;
import com.tradeguard.config.SimulatorProperties;
import com.tradeguard.config.StrategyProfileProperties;
import com.tradeguard.domain.enums.ConfirmationAction;
import com.tradeguard.domain.enums.OrderSide;
import com.tradeguard.domain.model.MarketContext;
import com.tradeguard.domain.model.TradeIntent;
import com.tradeguard.ev.EvGate;
import com.tradeguard.event.EventPublisherHelper;
import com.tradeguard.fee.FeeTaxModel;
import com.tradeguard.ledger.FxRateProvider;
import com.tradeguard.ledger.FxRateService;
import com.tradeguard.ledger.PositionLedger;
import com.tradeguard.marketdata.InMemoryMarketContextProvider;
import com.tradeguard.oms.FillProcessor;
import com.tradeguard.oms.IntentValidator;
import com.tradeguard.oms.OrderCancellationService;
import com.tradeguard.oms.OrderLifecycleRecorder;
import com.tradeguard.oms.OrderRegistry;
import com.tradeguard.oms.SymbolSequencer;
import com.tradeguard.oms.TradeIntentPipeline;
import com.tradeguard.recovery.EngineReadiness;
import com.tradeguard.recovery.LedgerSnapshotService;
import com.tradeguard.recovery.StartupRecoveryService;
import com.tradeguard.repository.jpa.FillJpaRepository;
import com.tradeguard.repository.jpa.OrderJpaRepository;
import com.tradeguard.risk.KillSwitchService;
import com.tradeguard.risk.OperatorConfirmation;
import com.tradeguard.risk.OperatorConfirmationVerifier;
import com.tradeguard.risk.RiskEngine;
import com.tradeguard.risk.RiskLimits;
import com.tradeguard.risk.RiskStateHolder;
import com.tradeguard.risk.RiskStatePersistenceService;
import com.tradeguard.simulator.PaperExecutionSimulator;
import java.math.BigDecimal;
import java.util.List;

/**
 * One engine process wired by hand: real audit, ledger, risk, EV gate, pipeline and paper
 * venue over an {@link InMemoryAuditStore}. Persistence outside the audit log, events and the
 * anomaly monitor are mocks. Two harnesses over the same store model a restart.
 *
 * <p>Fees and slippage are zero so fills land exactly at the reference price, and every intent
 * carries a 200 bps edge against a 0.5 minimum EV.
 */
public class EngineHarness {

    public static final String ALICE_SECRET = "alice-secret";
    public static final String BOB_SECRET = "bob-secret";

    public final MutableClock clock;
    public final AuditLog auditLog;
    public final RiskStatePersistenceService riskStatePersistenceService;
    public final LedgerSnapshotService ledgerSnapshotService = mock(LedgerSnapshotService.class);
    public final EventPublisherHelper eventPublisherHelper = mock(EventPublisherHelper.class);
    public final AnomalyMonitor anomalyMonitor = mock(AnomalyMonitor.class);
    public final InMemoryMarketContextProvider marketContextProvider;
    public final PositionLedger ledger;
    public final RiskStateHolder holder = new RiskStateHolder();
    public final KillSwitchService killSwitchService;
    public final RiskEngine riskEngine;
    public final FillProcessor fillProcessor;
    public final PaperExecutionSimulator simulator;
    public final OrderCancellationService orderCancellationService;
    public final EngineReadiness readiness = new EngineReadiness();
    public final TradeIntentPipeline pipeline;
    public final StartupRecoveryService recovery;

    public EngineHarness(
            InMemoryAuditStore auditStore,
            MutableClock clock,
            RiskLimits limits,
            RiskStatePersistenceService riskStatePersistenceService) {
        this.clock = clock;
        this.riskStatePersistenceService = riskStatePersistenceService;
        auditLog = auditStore.newAuditLog(clock);

        FeeScheduleProperties fees = new FeeScheduleProperties();
        fees.setDefaultMakerBps(BigDecimal.ZERO);
        fees.setDefaultTakerBps(BigDecimal.ZERO);
        FeeTaxModel feeTaxModel = new FeeTaxModel(fees);

        KillSwitchProperties killSwitchProperties = new KillSwitchProperties();
        killSwitchProperties.getOperators().put("alice", ALICE_SECRET);
        killSwitchProperties.getOperators().put("bob", BOB_SECRET);
        killSwitchProperties.setCancelDeadlineMs(200);

        FxRateService fxRateService = new FxRateService(new LedgerProperties(), (FxRateProvider) null, clock);
        ledger = new PositionLedger(fxRateService);
        marketContextProvider = new InMemoryMarketContextProvider(eventPublisherHelper);
        StrategyProfileProperties strategyProfiles = new StrategyProfileProperties();

        killSwitchService = new KillSwitchService(
                holder,
                riskStatePersistenceService,
                new OperatorConfirmationVerifier(killSwitchProperties),
                auditLog,
                eventPublisherHelper,
                clock);
        riskEngine = new RiskEngine(
                limits, holder, killSwitchService, ledger, fxRateService, strategyProfiles, eventPublisherHelper, clock);

        OrderJpaRepository orderJpaRepository = mock(OrderJpaRepository.class);
        FillJpaRepository fillJpaRepository = mock(FillJpaRepository.class);
        PipelineProperties pipelineProperties = new PipelineProperties();
        OrderRegistry orderRegistry = new OrderRegistry(orderJpaRepository, fillJpaRepository, pipelineProperties);
        OrderLifecycleRecorder recorder =
                new OrderLifecycleRecorder(auditLog, orderJpaRepository, eventPublisherHelper, clock);
        fillProcessor = new FillProcessor(
                auditLog, fillJpaRepository, ledger, fxRateService, marketContextProvider, riskEngine, anomalyMonitor);

        SimulatorProperties simulatorProperties = new SimulatorProperties();
        simulatorProperties.setBaseSlippageBps(BigDecimal.ZERO);
        simulatorProperties.setVolatilitySlippageBps(BigDecimal.ZERO);
        simulatorProperties.setImpactSlippageBps(BigDecimal.ZERO);
        simulator = new PaperExecutionSimulator(
                simulatorProperties, marketContextProvider, feeTaxModel, orderRegistry, recorder, fillProcessor, clock);
        orderCancellationService =
                new OrderCancellationService(simulator, auditLog, anomalyMonitor, killSwitchProperties);

        EvGateProperties evProperties = new EvGateProperties();
        evProperties.setMinimumEv(new BigDecimal("0.5"));
        evProperties.setLatencyBpsPer100Ms(BigDecimal.ZERO);
        evProperties.setSlippageBaseBps(BigDecimal.ZERO);
        evProperties.setSlippageVolatilityBps(BigDecimal.ZERO);
        evProperties.setSlippageImpactBps(BigDecimal.ZERO);
        evProperties.setSlippageMultiplier(BigDecimal.ONE);
        EvGate evGate = new EvGate(evProperties, strategyProfiles, (context, spreadBps) -> BigDecimal.ONE, clock);

        pipeline = new TradeIntentPipeline(
                readiness,
                new IntentValidator(strategyProfiles),
                new SymbolSequencer(Runnable::run),
                marketContextProvider,
                evGate,
                feeTaxModel,
                riskEngine,
                killSwitchService,
                simulator,
                orderRegistry,
                fxRateService,
                auditLog,
                eventPublisherHelper,
                pipelineProperties);

        recovery = new StartupRecoveryService(
                auditLog,
                riskStatePersistenceService,
                holder,
                killSwitchService,
                riskEngine,
                ledgerSnapshotService,
                ledger,
                fillProcessor,
                anomalyMonitor,
                readiness,
                clock);
    }

    public void quote(String symbol, String last) {
        BigDecimal price = new BigDecimal(last);
        marketContextProvider.update(MarketContext.builder()
                .symbol(symbol)
                .bid(price.subtract(new BigDecimal("0.1")))
                .ask(price.add(new BigDecimal("0.1")))
                .last(price)
                .bookDepth(new BigDecimal("10"))
                .observedAt(clock.instant())
                .build());
    }

    public TradeIntent intent(String intentId, OrderSide side, String quantity, String price) {
        return TradeIntent.builder()
                .intentId(intentId)
                .strategyId("momentum")
                .symbol("BTCUSDT")
                .side(side)
                .quantity(new BigDecimal(quantity))
                .referencePrice(new BigDecimal(price))
                .venue("paper")
                .expectedEdgeBps(new BigDecimal("200"))
                .timestamp(clock.instant())
                .build();
    }

    public static List<OperatorConfirmation> confirmations(ConfirmationAction action, String nonce) {
        return List.of(
                OperatorConfirmation.builder()
                        .operatorId("alice")
                        .token(OperatorConfirmationVerifier.token(ALICE_SECRET, action, nonce))
                        .build(),
                OperatorConfirmation.builder()
                        .operatorId("bob")
                        .token(OperatorConfirmationVerifier.token(BOB_SECRET, action, nonce))
                        .build());
    }
}
