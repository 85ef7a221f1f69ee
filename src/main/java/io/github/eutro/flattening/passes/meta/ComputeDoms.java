package io.github.eutro.flattening.passes.meta;

import io.github.eutro.flattening.ext.CommonExts;
import io.github.eutro.flattening.ext.Ext;
import io.github.eutro.flattening.ext.MetadataState;
import io.github.eutro.flattening.passes.InPlaceIRPass;
import io.github.eutro.flattening.ssa.BasicBlock;
import io.github.eutro.flattening.ssa.Control;
import io.github.eutro.flattening.ssa.Function;
import io.github.eutro.flattening.util.GraphWalker;

import java.util.HashSet;
import java.util.List;
import java.util.Set;

/*
 Thomas Lengauer and Robert Endre Tarjan. A fast algorithm for finding dominators in a flow-graph.
 ACM Transactions on Programming Languages and Systems, 1(1):121-141, July 1979.
*/

/**
 * Computes the {@link CommonExts#IDOM immediate dominator} of every block reachable from the entry.
 * <p>
 * Unlike most passes this does not reorder or remove blocks; unreachable blocks simply get no dominator.
 */
public class ComputeDoms implements InPlaceIRPass<Function> {
    public static final ComputeDoms INSTANCE = new ComputeDoms();

    @Override
    public void runInPlace(Function func) {
        for (BasicBlock block : func.blocks) {
            block.removeExt(CommonExts.IDOM);
        }
        List<BasicBlock> order = GraphWalker.blockWalker(func).preOrder().toList();

        class Runner {
            int n = order.size();
            final int[][] succ = new int[n + 1][];
            final int[] dom = new int[n + 1];
            final int[] parent = new int[n + 1];
            final int[] ancestor = new int[n + 1];
            final int[] child = new int[n + 1];
            final int[] vertex = new int[n + 1];
            final int[] label = new int[n + 1];
            final int[] semi = new int[n + 1];
            final int[] size = new int[n + 1];
            @SuppressWarnings("unchecked")
            final Set<Integer>[] pred = new Set[n + 1];
            @SuppressWarnings("unchecked")
            final Set<Integer>[] bucket = new Set[n + 1];

            void dfs(int v) {
                semi[v] = ++n;
                vertex[n] = label[v] = v;
                ancestor[v] = child[v] = 0;
                size[v] = 1;
                for (int w : succ[v]) {
                    if (semi[w] == 0) {
                        parent[w] = v;
                        dfs(w);
                    }
                    pred[w].add(v);
                }
            }

            void compress(int v) {
                if (ancestor[ancestor[v]] != 0) {
                    compress(ancestor[v]);
                    if (semi[label[ancestor[v]]] < semi[label[v]]) {
                        label[v] = label[ancestor[v]];
                    }
                    ancestor[v] = ancestor[ancestor[v]];
                }
            }

            int eval(int v) {
                if (ancestor[v] == 0) {
                    return label[v];
                }
                compress(v);
                return semi[label[ancestor[v]]] >= semi[label[v]]
                        ? label[v]
                        : label[ancestor[v]];
            }

            void link(int v, int w) {
                int s = w;
                while (semi[label[w]] < semi[label[child[s]]]) {
                    if (size[s] + size[child[child[s]]] >= 2 * size[child[s]]) {
                        ancestor[child[s]] = s;
                        child[s] = child[child[s]];
                    } else {
                        size[child[s]] = size[s];
                        s = ancestor[s] = child[s];
                    }
                }
                label[s] = label[w];
                size[v] += size[w];
                if (size[v] < 2 * size[w]) {
                    int t = s;
                    s = child[v];
                    child[v] = t;
                }
                while (s != 0) {
                    ancestor[s] = v;
                    s = child[s];
                }
            }

            void run() {
                Ext<Integer> indexExt = Ext.create(Integer.class, "domIndex");
                for (int i = 0; i < n; i++) {
                    order.get(i).attachExt(indexExt, i + 1);
                }
                for (BasicBlock block : order) {
                    int i = block.getExtOrThrow(indexExt);
                    Control br = block.getControl();
                    succ[i] = new int[br.targets.size()];
                    for (int j = 0; j < succ[i].length; j++) {
                        succ[i][j] = br.targets.get(j).getExtOrThrow(indexExt);
                    }
                }

                for (int v = 1; v <= n; ++v) {
                    pred[v] = new HashSet<>();
                    bucket[v] = new HashSet<>();
                    semi[v] = 0;
                }
                n = 0;
                dfs(1);
                size[0] = label[0] = semi[0] = 0;
                int u, w;
                for (int i = n; i >= 2; i--) {
                    w = vertex[i];
                    for (int v : pred[w]) {
                        u = eval(v);
                        if (semi[u] < semi[w]) {
                            semi[w] = semi[u];
                        }
                    }
                    bucket[vertex[semi[w]]].add(w);
                    link(parent[w], w);
                    for (int v : bucket[parent[w]]) {
                        u = eval(v);
                        dom[v] = semi[u] < semi[v] ? u : parent[w];
                    }
                    bucket[parent[w]].clear();
                }
                for (int i = 2; i <= n; ++i) {
                    w = vertex[i];
                    if (dom[w] != vertex[semi[w]]) {
                        dom[w] = dom[dom[w]];
                    }
                }
                dom[1] = 0;

                for (int i = 1; i < order.size(); i++) {
                    order.get(i).attachExt(CommonExts.IDOM, order.get(dom[i + 1] - 1));
                }
                for (BasicBlock block : order) {
                    block.removeExt(indexExt);
                }
            }
        }
        new Runner().run();

        func.getExtOrThrow(CommonExts.METADATA_STATE).validate(MetadataState.DOMS);
    }

    /**
     * Check whether {@code a} dominates {@code b}, using computed {@link CommonExts#IDOM}s.
     * Every block dominates itself.
     *
     * @param a The candidate dominator.
     * @param b The dominated block.
     * @return Whether every path from the entry to {@code b} passes through {@code a}.
     */
    public static boolean dominates(BasicBlock a, BasicBlock b) {
        for (BasicBlock cur = b; cur != null; cur = cur.getNullable(CommonExts.IDOM)) {
            if (cur == a) return true;
        }
        return false;
    }
}
