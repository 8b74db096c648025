package com.premiergroup.ad_optimizer.engine;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

class CampaignBudgetLedgerTest {

    private static BigDecimal bd(String value) {
        return new BigDecimal(value);
    }

    @Test
    @DisplayName("grants the full increase while headroom remains")
    void grantsWithinHeadroom() {
        CampaignBudgetLedger ledger = new CampaignBudgetLedger(id -> bd("500"));

        assertEquals(0, bd("20").compareTo(ledger.reserve("c-1", bd("1000"), bd("20"))));
        assertEquals(0, bd("520").compareTo(ledger.committed("c-1")));
    }

    @Test
    @DisplayName("second winner of the same campaign only gets what is left")
    void sharedHeadroom() {
        CampaignBudgetLedger ledger = new CampaignBudgetLedger(id -> bd("900"));

        BigDecimal first = ledger.reserve("c-1", bd("930"), bd("20"));
        BigDecimal second = ledger.reserve("c-1", bd("930"), bd("20"));
        BigDecimal third = ledger.reserve("c-1", bd("930"), bd("20"));

        assertEquals(0, bd("20").compareTo(first));
        assertEquals(0, bd("10").compareTo(second));
        assertEquals(0, BigDecimal.ZERO.compareTo(third));
    }

    @Test
    @DisplayName("campaigns are tracked independently and loaded once")
    void loadsOncePerCampaign() {
        AtomicInteger loads = new AtomicInteger();
        CampaignBudgetLedger ledger = new CampaignBudgetLedger(id -> {
            loads.incrementAndGet();
            return BigDecimal.ZERO;
        });

        ledger.reserve("c-1", bd("100"), bd("10"));
        ledger.reserve("c-1", bd("100"), bd("10"));
        ledger.reserve("c-2", bd("100"), bd("10"));

        assertEquals(2, loads.get());
        assertEquals(0, bd("20").compareTo(ledger.committed("c-1")));
        assertEquals(0, bd("10").compareTo(ledger.committed("c-2")));
    }

    @Test
    @DisplayName("released headroom becomes available to the next winner")
    void releaseReturnsHeadroom() {
        CampaignBudgetLedger ledger = new CampaignBudgetLedger(id -> bd("900"));

        BigDecimal first = ledger.reserve("c-1", bd("930"), bd("20"));
        ledger.release("c-1", first);
        BigDecimal second = ledger.reserve("c-1", bd("930"), bd("30"));

        assertEquals(0, bd("30").compareTo(second));
        assertEquals(0, bd("930").compareTo(ledger.committed("c-1")));
    }

    @Test
    void releaseOfUnknownCampaignIsIgnored() {
        CampaignBudgetLedger ledger = new CampaignBudgetLedger(id -> bd("100"));

        ledger.release("c-1", bd("20"));

        assertEquals(0, BigDecimal.ZERO.compareTo(ledger.committed("c-1")));
        assertEquals(0, bd("20").compareTo(ledger.reserve("c-1", bd("1000"), bd("20"))));
    }

    @Test
    void nonPositiveRequestGrantsNothing() {
        CampaignBudgetLedger ledger = new CampaignBudgetLedger(id -> BigDecimal.ZERO);
        assertEquals(0, BigDecimal.ZERO.compareTo(ledger.reserve("c-1", bd("100"), BigDecimal.ZERO)));
    }

    @Test
    @DisplayName("concurrent reservations never exceed the campaign total")
    void concurrentReservations() {
        CampaignBudgetLedger ledger = new CampaignBudgetLedger(id -> bd("0"));
        ExecutorService pool = Executors.newFixedThreadPool(8);
        try {
            List<CompletableFuture<BigDecimal>> grants = new ArrayList<>();
            for (int i = 0; i < 200; i++) {
                grants.add(CompletableFuture.supplyAsync(() -> ledger.reserve("c-1", bd("1000"), bd("7")), pool));
            }
            BigDecimal total = grants.stream().map(CompletableFuture::join).reduce(BigDecimal.ZERO, BigDecimal::add);

            assertEquals(0, bd("1000").compareTo(total));
            assertEquals(0, bd("1000").compareTo(ledger.committed("c-1")));
        } finally {
            pool.shutdownNow();
        }
    }
}
