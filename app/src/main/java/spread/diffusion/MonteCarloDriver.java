package spread.diffusion;

import org.apache.log4j.Logger;

import java.util.ArrayList;
import java.util.List;
import java.util.Random;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Supplier;

/**
 * Monte Carlo 試行を逐次または固定サイズのスレッドプールで実行し、活性化ノード数の平均を返す。
 * <p>
 * 全試行のシードはマスター乱数から事前に生成するため、スレッド数に関係なく同じ結果になる。
 */
public final class MonteCarloDriver {
    final static Logger logger = Logger.getLogger(MonteCarloDriver.class);

    /**
     * 1回の試行。ワーカーごとに1つ生成され、そのワーカーの試行間で使い回される。
     * 実装は呼び出しごとに内部状態を完全に初期化すること。
     */
    public interface Trial {
        /**
         * 試行を1回実行する。
         *
         * @param random この試行専用の乱数ジェネレータ
         * @return 試行終了時の活性化ノード数
         */
        int run(Random random);
    }

    private final int workers; // 並列実行時のワーカースレッド数

    public MonteCarloDriver(int workers) {
        if (workers < 1) {
            throw new IllegalArgumentException("workers must be at least 1, but was " + workers);
        }
        this.workers = workers;
    }

    public int getWorkers() {
        return workers;
    }

    /**
     * マスター乱数を seed で初期化し、ちょうど rounds 回進めて各試行のシードを生成する。
     *
     * @param rounds 試行回数
     * @param seed   マスターシード
     * @return 試行インデックス順のシード列
     */
    public static long[] deriveTrialSeeds(int rounds, long seed) {
        Random master = new Random(seed);
        long[] trialSeeds = new long[Math.max(rounds, 0)];
        for (int i = 0; i < trialSeeds.length; i++) {
            trialSeeds[i] = master.nextLong();
        }
        return trialSeeds;
    }

    /**
     * Monte Carlo シミュレーションを実行する。
     *
     * @param trials   試行オブジェクトの生成元（ワーカーごとに1回呼ばれる）
     * @param rounds   試行回数（0 以下なら 0.0 を返す）
     * @param seed     マスターシード
     * @param parallel 並列実行するかどうか
     * @return 活性化ノード数の平均
     */
    public double run(Supplier<? extends Trial> trials, int rounds, long seed, boolean parallel) {
        if (rounds <= 0) {
            return 0.0;
        }

        final long[] trialSeeds = deriveTrialSeeds(rounds, seed);
        final int numThreads = parallel ? Math.min(workers, rounds) : 1;
        long start = System.currentTimeMillis();

        long total;
        if (numThreads == 1) {
            Trial trial = trials.get();
            total = 0;
            for (int i = 0; i < rounds; i++) {
                total += trial.run(new Random(trialSeeds[i]));
            }
        } else {
            total = runParallel(trials, trialSeeds, numThreads);
        }

        if (logger.isDebugEnabled()) {
            double elapsed = (System.currentTimeMillis() - start) / 1000.0;
            logger.debug("Ran " + rounds + " trials (" + (parallel ? "parallel" : "sequential") + ", threads="
                    + numThreads + ") in " + elapsed + " seconds");
        }
        return (double) total / rounds;
    }

    /**
     * ワーカー t がインデックス t, t+T, t+2T, ... の試行を担当する。
     */
    private static long runParallel(Supplier<? extends Trial> trials, long[] trialSeeds, int numThreads) {
        final int rounds = trialSeeds.length;
        List<Callable<Long>> tasks = new ArrayList<>(numThreads);
        for (int t = 0; t < numThreads; t++) {
            final int tid = t;
            tasks.add(() -> {
                Trial trial = trials.get();
                long localSum = 0;
                for (int i = tid; i < rounds; i += numThreads) {
                    localSum += trial.run(new Random(trialSeeds[i]));
                }
                return localSum;
            });
        }

        ExecutorService service = Executors.newFixedThreadPool(numThreads, new WorkerThreadFactory());
        try {
            long total = 0;
            for (Future<Long> result : service.invokeAll(tasks)) {
                total += result.get();
            }
            return total;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Interrupted while waiting for Monte Carlo workers", e);
        } catch (ExecutionException e) {
            throw new IllegalStateException("Monte Carlo trial failed", e.getCause());
        } finally {
            service.shutdownNow();
        }
    }

    private static final class WorkerThreadFactory implements ThreadFactory {
        private final AtomicInteger count = new AtomicInteger();

        @Override
        public Thread newThread(Runnable r) {
            Thread thread = new Thread(r, "diffusion-worker-" + count.getAndIncrement());
            thread.setDaemon(true);
            return thread;
        }
    }
}
