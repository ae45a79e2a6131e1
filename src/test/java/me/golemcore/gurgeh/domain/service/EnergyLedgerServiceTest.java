package me.golemcore.gurgeh.domain.service;

import me.golemcore.gurgeh.domain.model.EnergyLedger;
import me.golemcore.gurgeh.domain.model.EnergyTransaction;
import me.golemcore.gurgeh.domain.model.LlmUsage;
import me.golemcore.gurgeh.domain.model.ModelClass;
import me.golemcore.gurgeh.testsupport.SandboxFixture;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class EnergyLedgerServiceTest {

    private static final double DELTA = 1e-9;
    private static final String LEDGER_PATH = "/income/balance.json";

    @TempDir
    Path tempDir;

    private SandboxFixture fixture;
    private EnergyLedgerService service;

    @BeforeEach
    void setUp() {
        fixture = SandboxFixture.create(tempDir);
        service = newService();
    }

    private EnergyLedgerService newService() {
        return new EnergyLedgerService(fixture.fileService(), fixture.objectMapper(), fixture.properties(),
                fixture.clock());
    }

    @Test
    void shouldCreateLedgerWithInitialBudget() {
        service.initialize();

        assertEquals(50.0, service.getBalance(), DELTA);
        assertTrue(service.hasBudget());
        assertTrue(Files.exists(fixture.physical(LEDGER_PATH)));
        assertTrue(fixture.readPhysical(LEDGER_PATH).contains("\"balance_usd\""));
    }

    @Test
    void shouldChargePrimaryRate() {
        service.initialize();

        double cost = service.recordUsage(1, LlmUsage.of(1_000_000, 100_000), ModelClass.PRIMARY);

        assertEquals(5.0 + 2.5, cost, DELTA);
        assertEquals(42.5, service.getBalance(), DELTA);
    }

    @Test
    void shouldChargeDelegateRate() {
        service.initialize();

        double cost = service.recordUsage(3, LlmUsage.of(1_000_000, 1_000_000), ModelClass.DELEGATE,
                EnergyTransaction.TransactionType.DELEGATION);

        assertEquals(4.8, cost, DELTA);
        EnergyLedger ledger = service.getLedger();
        assertEquals(1, ledger.getTransactions().size());
        assertEquals(EnergyTransaction.TransactionType.DELEGATION, ledger.getTransactions().get(0).getType());
        assertEquals(3, ledger.getTransactions().get(0).getAwakening());
        assertEquals(SandboxFixture.FIXED_NOW, ledger.getTransactions().get(0).getTimestamp());
    }

    @Test
    void shouldClampBalanceAtZero() {
        fixture.properties().getEconomics().setInitialBudgetUsd(1.0);
        service.initialize();

        service.recordUsage(1, LlmUsage.of(0, 1_000_000), ModelClass.PRIMARY);

        assertEquals(0.0, service.getBalance(), DELTA);
        assertFalse(service.hasBudget());
        assertEquals(25.0, service.getLedger().getTotalSpentUsd(), DELTA);
    }

    @Test
    void shouldTreatMissingUsageAsFree() {
        service.initialize();

        double cost = service.recordUsage(1, null, ModelClass.PRIMARY);

        assertEquals(0.0, cost, DELTA);
        assertEquals(50.0, service.getBalance(), DELTA);
    }

    @Test
    void shouldReloadPersistedLedger() {
        service.initialize();
        service.recordUsage(1, LlmUsage.of(200_000, 0), ModelClass.PRIMARY);

        EnergyLedgerService reloaded = newService();
        reloaded.initialize();

        assertEquals(49.0, reloaded.getBalance(), DELTA);
        assertEquals(1, reloaded.getLedger().getTransactions().size());
    }

    @Test
    void shouldRecomputeBalanceOnLoad() {
        fixture.writePhysical(LEDGER_PATH, """
                {"balance_usd": 999.0, "initial_budget_usd": 10.0,
                 "total_earned_usd": 2.0, "total_spent_usd": 3.0}
                """);

        service.initialize();

        assertEquals(9.0, service.getBalance(), DELTA);
        assertTrue(service.getLedger().getTransactions().isEmpty());
    }

    @Test
    void shouldStartFreshOnCorruptLedger() {
        fixture.writePhysical(LEDGER_PATH, "{not json");

        service.initialize();

        assertEquals(50.0, service.getBalance(), DELTA);
    }

    @Test
    void shouldCapTransactionHistory() {
        fixture.properties().getEconomics().setTransactionHistoryLimit(3);
        service.initialize();

        for (int i = 1; i <= 5; i++) {
            service.recordUsage(i, LlmUsage.of(1000, 100), ModelClass.PRIMARY);
        }

        EnergyLedger ledger = service.getLedger();
        assertEquals(3, ledger.getTransactions().size());
        assertEquals(3, ledger.getTransactions().get(0).getAwakening());
        assertEquals(5, ledger.getTransactions().get(2).getAwakening());
    }

    @Test
    void shouldReturnDetachedSnapshot() {
        service.initialize();

        EnergyLedger snapshot = service.getLedger();
        snapshot.setBalanceUsd(0);
        snapshot.getTransactions().add(EnergyTransaction.builder().cost(1.0).build());

        assertEquals(50.0, service.getBalance(), DELTA);
        assertTrue(service.getLedger().getTransactions().isEmpty());
    }

    @Test
    void shouldInitializeLazily() {
        assertEquals(50.0, service.getBalance(), DELTA);
    }
}
