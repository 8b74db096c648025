package com.premiergroup.ad_optimizer.config;

import com.premiergroup.ad_optimizer.dto.OptimizationConfig;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.time.Clock;
import java.time.Duration;

@Configuration(proxyBeanMethods = false)
public class OptimizationConfiguration {

    @Value("${optimization.target-cpa:50}")
    private double targetCpa;

    @Value("${optimization.target-roas:2.0}")
    private double targetRoas;

    @Value("${optimization.max-budget-increase-percent:20}")
    private double maxBudgetIncreasePercent;

    @Value("${optimization.min-data-days:3}")
    private int minDataDays;

    @Value("${optimization.auto-execute:false}")
    private boolean autoExecute;

    @Value("${optimization.dry-run:true}")
    private boolean dryRun;

    @Value("${optimization.lookback-days:7}")
    private int lookbackDays;

    @Value("${optimization.parallelism:4}")
    private int parallelism;

    @Value("${optimization.entity-timeout:30s}")
    private Duration entityTimeout;

    /**
     * Defaults for scheduled cycles and the base that HTTP overrides are applied to. Fails at startup when
     * the configured values are unusable.
     */
    @Bean
    public OptimizationConfig defaultOptimizationConfig() {
        return OptimizationConfig.builder()
                .targetCPA(targetCpa)
                .targetROAS(targetRoas)
                .maxBudgetIncreasePercent(maxBudgetIncreasePercent)
                .minDataDays(minDataDays)
                .autoExecute(autoExecute)
                .dryRun(dryRun)
                .lookbackDays(lookbackDays)
                .build()
                .validate();
    }

    @Bean
    public CycleSettings cycleSettings() {
        return new CycleSettings(parallelism, entityTimeout);
    }

    @Bean(name = "optimizationExecutor")
    public ThreadPoolTaskExecutor optimizationExecutor(CycleSettings cycleSettings) {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(cycleSettings.parallelism());
        executor.setMaxPoolSize(cycleSettings.parallelism());
        executor.setThreadNamePrefix("optimizer-");
        executor.setWaitForTasksToCompleteOnShutdown(true);
        return executor;
    }

    @Bean
    public Clock clock() {
        return Clock.systemDefaultZone();
    }
}
