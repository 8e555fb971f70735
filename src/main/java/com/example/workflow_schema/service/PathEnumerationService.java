package com.example.workflow_schema.service;

import com.example.workflow_schema.config.ExtractionOptions;
import com.example.workflow_schema.graph.FlowEdge;
import com.example.workflow_schema.graph.FlowGraph;
import com.example.workflow_schema.graph.FlowNode;
import com.example.workflow_schema.graph.ReferenceMapping;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.Iterator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.NoSuchElementException;
import java.util.Set;

/**
 * Enumerates complete execution paths (sequences of ActionIds) through a flow graph.
 *
 * <p>Exclusive gateways fan out into separate paths. Parallel splits run every branch up to
 * the matching join, then emit every ordering of one sub-path choice per branch. Inclusive
 * splits emit every non-empty subset of branches, in branch order. Three bounds keep the
 * walk finite: a per-path visit count (each node at most {@code maxLoopIterations} times),
 * a stop set that halts a branch at its own join, and {@code maxPaths} on combinations and
 * on the final result. Two more bound the work: a walk deeper than {@code maxDepth} nodes
 * closes its path there, and once {@code maxExpansions} nodes have been entered forks only
 * follow their first outgoing flow.
 *
 * <p>Visit counts are copied on every step, so sibling branches never see each other's visits.
 */
@Service
public class PathEnumerationService {

    private static final Logger log = LoggerFactory.getLogger(PathEnumerationService.class);

    private enum GatewayType { PARALLEL, INCLUSIVE }

    private final JoinMatcherService joinMatcher;

    public PathEnumerationService(JoinMatcherService joinMatcher) {
        this.joinMatcher = joinMatcher;
    }

    /* ===================== Public API ===================== */

    public List<List<String>> findAllPaths(ReferenceMapping refs) {
        return findAllPaths(refs, new ExtractionOptions());
    }

    /**
     * Walks from every Start node in node order and returns the distinct paths in first-seen
     * order, at most {@code opt.getMaxPaths()} of them.
     */
    public List<List<String>> findAllPaths(ReferenceMapping refs, ExtractionOptions opt) {
        Traversal t = new Traversal(refs, opt);

        List<List<String>> all = new ArrayList<>();
        for (String startId : t.g.startNodeIds()) {
            all.addAll(dfs(t, startId, Collections.emptyList(), Collections.emptyMap(), Collections.emptySet()));
        }

        Set<List<String>> unique = new LinkedHashSet<>(all);
        List<List<String>> out = new ArrayList<>(Math.min(unique.size(), opt.getMaxPaths()));
        for (List<String> p : unique) {
            if (out.size() >= opt.getMaxPaths()) break;
            out.add(List.copyOf(p));
        }

        if (unique.size() > out.size() || t.truncations > 0) {
            log.warn("Path enumeration hit the cap of {} ({} unique paths found, {} fork(s) truncated)",
                    opt.getMaxPaths(), unique.size(), t.truncations);
        }
        if (t.depthCuts > 0 || t.overBudget()) {
            log.warn("Path enumeration cut short: {} path(s) closed at depth {}, {} of {} node visits used",
                    t.depthCuts, opt.getMaxDepth(), t.expansions, opt.getMaxExpansions());
        }
        log.debug("Enumerated {} raw path(s), {} unique, kept {}", all.size(), unique.size(), out.size());
        return out;
    }

    /* ===================== DFS ===================== */

    private List<List<String>> dfs(Traversal t, String currentId, List<String> path,
                                   Map<String, Integer> visitCount, Set<String> stopAt) {
        // inside a parallel/inclusive branch: stop at that branch's join
        if (stopAt.contains(currentId)) return single(path);

        int cnt = visitCount.getOrDefault(currentId, 0);
        if (cnt >= t.opt.getMaxLoopIterations()) return single(path);

        FlowNode cur = t.g.node(currentId);
        if (cur == null) return single(path);

        if (t.depth >= t.opt.getMaxDepth()) {
            t.depthCuts++;
            return single(path);
        }

        Map<String, Integer> visits = new HashMap<>(visitCount);
        visits.put(currentId, cnt + 1);

        t.expansions++;
        t.depth++;
        try {
            return visit(t, currentId, cur, path, visits, stopAt);
        } finally {
            t.depth--;
        }
    }

    private List<List<String>> visit(Traversal t, String currentId, FlowNode cur, List<String> path,
                                     Map<String, Integer> visits, Set<String> stopAt) {
        return switch (cur.getKind()) {
            case END -> cur.hasLabel()
                    ? single(append(path, t.refs.actionIdOf(currentId)))
                    : single(path);
            case START -> cur.hasLabel()
                    ? visitAction(t, currentId, append(path, t.refs.actionIdOf(currentId)), visits, stopAt)
                    : goOutgoing(t, currentId, path, visits, stopAt);
            case ACTIVITY -> visitAction(t, currentId,
                    cur.hasLabel() ? append(path, t.refs.actionIdOf(currentId)) : path, visits, stopAt);
            case EXCLUSIVE_GATEWAY -> goOutgoing(t, currentId, path, visits, stopAt);
            case PARALLEL_GATEWAY -> handleGateway(t, currentId, GatewayType.PARALLEL, path, visits, stopAt);
            case INCLUSIVE_GATEWAY -> handleGateway(t, currentId, GatewayType.INCLUSIVE, path, visits, stopAt);
            case UNKNOWN -> single(path);
        };
    }

    private List<List<String>> visitAction(Traversal t, String currentId, List<String> path,
                                           Map<String, Integer> visits, Set<String> stopAt) {
        if (t.g.outgoing(currentId).isEmpty()) return single(path);
        return goOutgoing(t, currentId, path, visits, stopAt);
    }

    /**
     * Alternatives in flow order, without repeats. Stops early once {@code maxPaths} distinct
     * paths are collected: callers only ever keep that many from the front.
     */
    private List<List<String>> goOutgoing(Traversal t, String nodeId, List<String> path,
                                          Map<String, Integer> visits, Set<String> stopAt) {
        List<FlowEdge> outs = t.g.outgoing(nodeId);
        int max = t.opt.getMaxPaths();
        Set<List<String>> all = new LinkedHashSet<>();
        for (int i = 0; i < outs.size(); i++) {
            if (i > 0 && (all.size() >= max || t.overBudget())) {
                t.truncations++;
                break;
            }
            all.addAll(dfs(t, outs.get(i).getTargetId(), path, visits, stopAt));
        }
        return new ArrayList<>(all);
    }

    /* ===================== Fork → Join (AND / OR) ===================== */

    private List<List<String>> handleGateway(Traversal t, String forkId, GatewayType type, List<String> path,
                                             Map<String, Integer> visits, Set<String> stopAt) {
        List<FlowEdge> outs = t.g.outgoing(forkId);
        if (outs.isEmpty()) return single(path);

        // join: synchronisation already happened, each branch stopped here
        if (t.g.isJoin(forkId) && !t.g.isSplit(forkId)) {
            return goOutgoing(t, forkId, path, visits, stopAt);
        }

        String joinId = joinMatcher.findMatchingJoin(t.g, forkId);
        Set<String> branchStop = joinId != null ? Collections.singleton(joinId) : Collections.emptySet();

        List<List<List<String>>> branchPaths = new ArrayList<>(outs.size());
        for (FlowEdge e : outs) {
            branchPaths.add(dfs(t, e.getTargetId(), Collections.emptyList(), visits, branchStop));
        }

        List<List<String>> all = (type == GatewayType.PARALLEL)
                ? interleaveAll(t, joinId, branchPaths, path, visits, stopAt)
                : combineSubsets(t, joinId, branchPaths, path, visits, stopAt);

        int max = t.opt.getMaxPaths();
        if (all.size() > max) {
            t.truncations++;
            return new ArrayList<>(all.subList(0, max));
        }
        return all;
    }

    /** One sub-path per branch, in every relative order, each continued from the join. */
    private List<List<String>> interleaveAll(Traversal t, String joinId, List<List<List<String>>> branchPaths,
                                             List<String> path, Map<String, Integer> visits, Set<String> stopAt) {
        int max = t.opt.getMaxPaths();
        List<List<String>> all = new ArrayList<>();

        Iterator<List<List<String>>> combos = new CartesianProduct<>(branchPaths, max);
        while (combos.hasNext() && all.size() < max && !spent(t, all)) {
            List<List<String>> seqs = new ArrayList<>();
            for (List<String> seq : combos.next()) {
                if (!seq.isEmpty()) seqs.add(seq);
            }
            if (seqs.isEmpty()) {
                all.addAll(continueFrom(t, joinId, path, visits, stopAt));
                continue;
            }
            Iterator<int[]> perms = new Permutations(seqs.size());
            while (perms.hasNext() && all.size() < max && !spent(t, all)) {
                List<String> interleaved = new ArrayList<>(path);
                for (int idx : perms.next()) interleaved.addAll(seqs.get(idx));
                all.addAll(continueFrom(t, joinId, interleaved, visits, stopAt));
            }
        }
        return all;
    }

    /** Every non-empty subset of branches (smallest first), concatenated in branch order. */
    private List<List<String>> combineSubsets(Traversal t, String joinId, List<List<List<String>>> branchPaths,
                                              List<String> path, Map<String, Integer> visits, Set<String> stopAt) {
        int max = t.opt.getMaxPaths();
        List<List<String>> all = new ArrayList<>();

        for (int[] subset : computeSelections(branchPaths.size(), max)) {
            List<List<List<String>>> chosen = new ArrayList<>(subset.length);
            for (int i : subset) chosen.add(branchPaths.get(i));

            Iterator<List<List<String>>> combos = new CartesianProduct<>(chosen, Integer.MAX_VALUE);
            while (combos.hasNext() && all.size() < max && !spent(t, all)) {
                List<String> merged = new ArrayList<>(path);
                for (List<String> seq : combos.next()) merged.addAll(seq);
                all.addAll(continueFrom(t, joinId, merged, visits, stopAt));
            }
            if (all.size() >= max || spent(t, all)) break;
        }
        return all;
    }

    /** True once the visit budget is used up and at least one combination was emitted. */
    private static boolean spent(Traversal t, List<List<String>> emitted) {
        return !emitted.isEmpty() && t.overBudget();
    }

    private List<List<String>> continueFrom(Traversal t, String joinId, List<String> path,
                                            Map<String, Integer> visits, Set<String> stopAt) {
        if (joinId == null) return single(path);
        return dfs(t, joinId, path, visits, stopAt);
    }

    /**
     * The first {@code limit} non-empty index subsets of {@code 0..n-1}: by size, then
     * lexicographic within a size. Each subset yields at least one path, so no caller needs more.
     */
    private List<int[]> computeSelections(int n, int limit) {
        List<int[]> selections = new ArrayList<>();
        for (int r = 1; r <= n && selections.size() < limit; r++) {
            collectCombinations(n, r, 0, new int[r], 0, selections, limit);
        }
        return selections;
    }

    private void collectCombinations(int n, int r, int from, int[] buf, int depth, List<int[]> out, int limit) {
        if (out.size() >= limit) return;
        if (depth == r) {
            out.add(buf.clone());
            return;
        }
        for (int i = from; i <= n - (r - depth) && out.size() < limit; i++) {
            buf[depth] = i;
            collectCombinations(n, r, i + 1, buf, depth + 1, out, limit);
        }
    }

    /* ===================== Small helpers ===================== */

    private static List<List<String>> single(List<String> path) {
        List<List<String>> out = new ArrayList<>(1);
        out.add(path);
        return out;
    }

    private static List<String> append(List<String> path, String id) {
        List<String> next = new ArrayList<>(path.size() + 1);
        next.addAll(path);
        next.add(id);
        return next;
    }

    /** Per-call state; never shared between records. */
    private static final class Traversal {
        final FlowGraph g;
        final ReferenceMapping refs;
        final ExtractionOptions opt;
        int truncations = 0;
        int depthCuts = 0;
        int depth = 0;
        long expansions = 0;

        Traversal(ReferenceMapping refs, ExtractionOptions opt) {
            this.g = refs.getGraph();
            this.refs = refs;
            this.opt = opt;
        }

        boolean overBudget() {
            return expansions >= opt.getMaxExpansions();
        }
    }

    /**
     * Lazy Cartesian product, last position varying fastest, stopping after {@code limit} tuples.
     * Empty when any factor is empty.
     */
    static final class CartesianProduct<T> implements Iterator<List<T>> {
        private final List<List<T>> factors;
        private final int[] idx;
        private final int limit;
        private int emitted = 0;
        private boolean exhausted;

        CartesianProduct(List<List<T>> factors, int limit) {
            this.factors = factors;
            this.idx = new int[factors.size()];
            this.limit = limit;
            boolean anyEmpty = false;
            for (List<T> f : factors) anyEmpty |= f.isEmpty();
            this.exhausted = anyEmpty;
        }

        @Override
        public boolean hasNext() {
            return !exhausted && emitted < limit;
        }

        @Override
        public List<T> next() {
            if (!hasNext()) throw new NoSuchElementException();
            List<T> tuple = new ArrayList<>(idx.length);
            for (int i = 0; i < idx.length; i++) tuple.add(factors.get(i).get(idx[i]));
            emitted++;
            advance();
            return tuple;
        }

        private void advance() {
            for (int i = idx.length - 1; i >= 0; i--) {
                if (++idx[i] < factors.get(i).size()) return;
                idx[i] = 0;
            }
            exhausted = true;
        }
    }

    /** Lazy permutations of {@code 0..n-1} in lexicographic order. */
    static final class Permutations implements Iterator<int[]> {
        private int[] current;

        Permutations(int n) {
            current = new int[n];
            for (int i = 0; i < n; i++) current[i] = i;
        }

        @Override
        public boolean hasNext() {
            return current != null;
        }

        @Override
        public int[] next() {
            if (current == null) throw new NoSuchElementException();
            int[] result = current.clone();
            current = successor(current);
            return result;
        }

        private static int[] successor(int[] p) {
            int[] a = p.clone();
            int i = a.length - 2;
            while (i >= 0 && a[i] >= a[i + 1]) i--;
            if (i < 0) return null;
            int j = a.length - 1;
            while (a[j] <= a[i]) j--;
            swap(a, i, j);
            for (int l = i + 1, r = a.length - 1; l < r; l++, r--) swap(a, l, r);
            return a;
        }

        private static void swap(int[] a, int i, int j) {
            int tmp = a[i];
            a[i] = a[j];
            a[j] = tmp;
        }
    }
}
