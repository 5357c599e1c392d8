package spread.diffusion;

import it.unimi.dsi.fastutil.ints.IntOpenHashSet;
import it.unimi.dsi.fastutil.ints.IntSet;

import java.util.List;
import java.util.Random;

/**
 * ステップ単位で進む拡散の1試行。
 * Monte Carlo 実行では活性化数だけを使い、単発実行では最終集合と各ステップの新規活性化ノードも取り出す。
 */
public abstract class DiffusionTrial implements MonteCarloDriver.Trial {

    @Override
    public final int run(Random random) {
        return run(random, 0, null);
    }

    /**
     * 試行を1回実行する。作業用配列は毎回初期化される。
     *
     * @param random   この試行専用の乱数ジェネレータ
     * @param maxSteps 最大ステップ数（0 以下ならモデル既定の上限）
     * @param history  各ステップの新規活性化ノードの記録先（null なら記録しない）
     * @return 試行終了時の活性化ノード数
     */
    public abstract int run(Random random, int maxSteps, List<IntSet> history);

    /**
     * 直前の {@link #run} で最終的に数えられたノード集合。
     */
    public abstract IntSet result();

    /**
     * nodes[from, to) を集合として history に追加する。
     */
    protected static void record(List<IntSet> history, int[] nodes, int from, int to) {
        if (history != null) {
            history.add(toSet(nodes, from, to));
        }
    }

    protected static IntSet toSet(int[] nodes, int from, int to) {
        IntSet set = new IntOpenHashSet(Math.max(to - from, 0));
        for (int i = from; i < to; i++) {
            set.add(nodes[i]);
        }
        return set;
    }
}
