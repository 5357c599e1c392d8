package spread.diffusion;

import it.unimi.dsi.fastutil.ints.IntSet;
import it.unimi.dsi.fastutil.ints.IntSets;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * 単発の拡散シミュレーションの結果。
 */
public final class DiffusionResult {
    public final IntSet activated; // 最終的に数えられたノード（SIR では回復ノード）
    public final List<IntSet> steps; // steps[0] は種ノード、以降は新規活性化ノードがあったステップのみ

    DiffusionResult(IntSet activated, List<IntSet> steps) {
        this.activated = IntSets.unmodifiable(activated);
        List<IntSet> view = new ArrayList<>(steps.size());
        for (IntSet step : steps) {
            view.add(IntSets.unmodifiable(step));
        }
        this.steps = Collections.unmodifiableList(view);
    }

    public int size() {
        return activated.size();
    }

    @Override
    public String toString() {
        return "DiffusionResult{activated=" + activated.size() + ", steps=" + steps.size() + "}";
    }
}
