package io.github.clawcombat.server;

import io.github.clawcombat.ai.AIStrategist;
import io.github.clawcombat.battle.BattleRandom;
import io.github.clawcombat.battle.BattleState;
import io.github.clawcombat.battle.BattleStateBuilder;
import io.github.clawcombat.battle.SeededBattleRandom;
import io.github.clawcombat.battle.TurnResolver;
import io.github.clawcombat.battle.codec.BattleCodec;
import io.github.clawcombat.battle.codec.BattleJsonCodec;
import io.github.clawcombat.data.MoveDatabase;
import io.github.clawcombat.matchmaking.FightQuota;
import io.github.clawcombat.matchmaking.InMemoryQueueStore;
import io.github.clawcombat.matchmaking.MatchPair;
import io.github.clawcombat.matchmaking.MatchmakingQueue;
import io.github.clawcombat.matchmaking.QueueStore;
import io.github.clawcombat.server.battle.BattleService;
import io.github.clawcombat.server.battle.InMemoryAgentDirectory;
import io.github.clawcombat.server.config.ArenaConfig;
import io.github.clawcombat.server.storage.BattleStore;
import io.github.clawcombat.server.storage.DatabaseManager;
import io.github.clawcombat.server.storage.InMemoryBattleStore;
import io.github.clawcombat.server.storage.JdbcBattleStore;
import io.github.clawcombat.server.storage.JdbcQueueStore;
import io.github.clawcombat.server.storage.KryoBattleCodec;
import io.github.clawcombat.utils.GameLogger;

import java.io.IOException;
import java.nio.file.Paths;
import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * Wires the arena together and runs the periodic matchmaking pass and turn timeout sweep.
 */
public class ArenaLauncher {
    private static final int SCHEDULER_POOL_SIZE = 2;

    private final ArenaConfig config;
    private final DatabaseManager database;
    private final InMemoryAgentDirectory agents;
    private final MatchmakingQueue queue;
    private final BattleService battleService;
    private final Clock clock;
    private ScheduledExecutorService scheduler;
    private volatile boolean running;

    public ArenaLauncher(ArenaConfig config) {
        this(config, MoveDatabase.loadDefault(), FightQuota.UNLIMITED, Clock.systemUTC());
    }

    public ArenaLauncher(ArenaConfig config, MoveDatabase moves, FightQuota quota, Clock clock) {
        config.validate();
        this.config = config;
        this.clock = clock;
        this.agents = new InMemoryAgentDirectory();

        BattleCodec codec = config.usesKryoCodec() ? new KryoBattleCodec() : new BattleJsonCodec();
        QueueStore queueStore;
        BattleStore battleStore;
        if (config.usesJdbcBattleStore()) {
            this.database = new DatabaseManager(config.getDatabaseUrl(), config.getDatabaseUser(),
                config.getDatabasePassword());
            queueStore = new JdbcQueueStore(database);
            battleStore = new JdbcBattleStore(database, codec);
        } else {
            this.database = null;
            queueStore = new InMemoryQueueStore();
            battleStore = new InMemoryBattleStore(codec);
        }
        GameLogger.info("Battle store: " + config.getBattleStore() + ", state codec: " + codec.getName());

        this.queue = new MatchmakingQueue(queueStore, config.buildRangePolicy(), quota,
            battleStore::findActiveBattleFor, clock);

        long seed = config.getRngSeed() != 0 ? config.getRngSeed() : System.nanoTime();
        BattleRandom rng = new SeededBattleRandom(seed);
        this.battleService = new BattleService(battleStore, agents, new BattleStateBuilder(moves),
            new TurnResolver(moves), new AIStrategist(moves, config.getDifficulty()), rng, clock,
            config.getTurnTimeoutMs(), config.getMaxConsecutiveTimeouts());
    }

    public synchronized void start() {
        if (running) {
            return;
        }
        scheduler = Executors.newScheduledThreadPool(SCHEDULER_POOL_SIZE, r -> {
            Thread thread = new Thread(r, "Arena-Scheduler");
            thread.setDaemon(true);
            return thread;
        });
        scheduler.scheduleAtFixedRate(() -> {
            try {
                runMatchmakingPass();
            } catch (Exception e) {
                GameLogger.error("Scheduled matchmaking pass failed: " + e.getMessage());
            }
        }, config.getMatchmakingIntervalMs(), config.getMatchmakingIntervalMs(), TimeUnit.MILLISECONDS);
        scheduler.scheduleAtFixedRate(() -> {
            try {
                runTimeoutSweep();
            } catch (Exception e) {
                GameLogger.error("Scheduled timeout sweep failed: " + e.getMessage());
            }
        }, config.getTimeoutSweepIntervalMs(), config.getTimeoutSweepIntervalMs(), TimeUnit.MILLISECONDS);
        running = true;
        GameLogger.info("Arena started");
    }

    /**
     * Pairs waiting agents and starts their battles. A pair whose battle cannot be created is released: agents with a
     * known profile go back to the queue, unknown ones are dropped.
     */
    public List<String> runMatchmakingPass() {
        List<MatchPair> pairs = queue.processQueue();
        if (pairs.isEmpty()) {
            return List.of();
        }
        List<String> started = new ArrayList<>();
        int failed = 0;
        for (MatchPair pair : pairs) {
            Optional<BattleState> battle;
            try {
                battle = battleService.createBattle(pair);
            } catch (RuntimeException e) {
                GameLogger.error("Failed to start battle for " + pair, e);
                battle = Optional.empty();
            }
            if (battle.isPresent()) {
                queue.confirmMatch(pair);
                started.add(battle.get().getBattleId());
            } else {
                failed++;
                queue.releaseMatch(pair, agentId -> agents.findAgent(agentId).isPresent());
            }
        }
        GameLogger.info("Matchmaking pass paired " + pairs.size() + " and started " + started.size() + " battles");
        if (failed > 0) {
            GameLogger.error(failed + " matched pair(s) could not start a battle");
        }
        return started;
    }

    public int runTimeoutSweep() {
        int advanced = battleService.checkTimeouts(clock.millis());
        if (advanced > 0) {
            GameLogger.info("Timeout sweep advanced " + advanced + " battles");
        }
        return advanced;
    }

    public synchronized void shutdown() {
        running = false;
        if (scheduler != null) {
            scheduler.shutdown();
            try {
                if (!scheduler.awaitTermination(5, TimeUnit.SECONDS)) {
                    scheduler.shutdownNow();
                }
            } catch (InterruptedException e) {
                scheduler.shutdownNow();
                Thread.currentThread().interrupt();
            }
            scheduler = null;
        }
        if (database != null) {
            database.dispose();
        }
        GameLogger.info("Arena shutdown completed");
    }

    public boolean isRunning() {
        return running;
    }

    public MatchmakingQueue getQueue() {
        return queue;
    }

    public BattleService getBattleService() {
        return battleService;
    }

    public InMemoryAgentDirectory getAgents() {
        return agents;
    }

    public static void main(String[] args) {
        try {
            ArenaConfig config = args.length > 0 ? ArenaConfig.load(Paths.get(args[0])) : ArenaConfig.loadDefault();
            config.validate();
            if (config.getLogFile() != null && !config.getLogFile().isEmpty()) {
                GameLogger.setLogFile(config.getLogFile());
            }
            GameLogger.info("Arena configuration loaded: " + config);

            ArenaLauncher launcher = new ArenaLauncher(config);
            launcher.start();
            Runtime.getRuntime().addShutdownHook(new Thread(() -> {
                GameLogger.info("Shutting down arena...");
                launcher.shutdown();
                GameLogger.close();
            }));
            Thread.currentThread().join();
        } catch (IOException | IllegalArgumentException e) {
            GameLogger.error("Failed to start arena: " + e.getMessage());
            System.exit(1);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }
}
