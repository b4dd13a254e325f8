package ch.battleship.battleshiparena.config;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

/**
 * Configuration for parallel battle execution.
 *
 * <p>Provides the {@code battleExecutor} used by
 * {@link ch.battleship.battleshiparena.service.BattleService#runBatch} to play the battles of a batch
 * concurrently. Each battle owns all of its state, so no further synchronization is needed.
 */
@Configuration
public class ExecutorConfig {

    /**
     * Creates the battle thread pool.
     *
     * <p>Configuration:
     * <ul>
     *   <li>Pool size: {@code arena.batch.pool-size} threads (default 4)</li>
     *   <li>Thread name prefix: "battle-worker-" for easier debugging</li>
     * </ul>
     *
     * @param poolSize number of worker threads
     * @return configured executor
     */
    @Bean(name = "battleExecutor")
    public ThreadPoolTaskExecutor battleExecutor(@Value("${arena.batch.pool-size:4}") int poolSize) {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(poolSize);
        executor.setMaxPoolSize(poolSize);
        executor.setThreadNamePrefix("battle-worker-");
        executor.initialize();
        return executor;
    }
}
