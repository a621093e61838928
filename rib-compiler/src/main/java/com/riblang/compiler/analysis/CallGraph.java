package com.riblang.compiler.analysis;

import com.riblang.compiler.ast.Span;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * 用户函数之间的调用图，用于检测（直接或相互）递归
 *
 * <p>节点和边都按插入顺序保存，报告结果与源码顺序一致。</p>
 */
final class CallGraph {

    /** 一条调用边 */
    static final class Edge {
        final String caller;
        final String callee;
        final Span span;

        Edge(String caller, String callee, Span span) {
            this.caller = caller;
            this.callee = callee;
            this.span = span;
        }
    }

    /** 一个递归环：环上的函数（按发现顺序）及首条环内调用的位置 */
    static final class Cycle {
        final List<String> members;
        final Span span;

        Cycle(List<String> members, Span span) {
            this.members = members;
            this.span = span;
        }
    }

    private final Map<String, List<Edge>> edges = new LinkedHashMap<String, List<Edge>>();

    void addNode(String name) {
        if (!edges.containsKey(name)) {
            edges.put(name, new ArrayList<Edge>());
        }
    }

    void addEdge(String caller, String callee, Span span) {
        addNode(caller);
        addNode(callee);
        edges.get(caller).add(new Edge(caller, callee, span));
    }

    /**
     * 找出所有递归环（Tarjan 强连通分量：大小大于 1，或带自环的单节点）
     */
    List<Cycle> findCycles() {
        Tarjan tarjan = new Tarjan();
        for (String node : edges.keySet()) {
            if (!tarjan.index.containsKey(node)) {
                tarjan.connect(node);
            }
        }
        List<Cycle> cycles = new ArrayList<Cycle>();
        for (List<String> component : tarjan.components) {
            Set<String> members = new HashSet<String>(component);
            Edge first = firstInternalEdge(members);
            if (first != null) {
                cycles.add(new Cycle(orderBySource(members), first.span));
            }
        }
        return cycles;
    }

    private Edge firstInternalEdge(Set<String> component) {
        Edge first = null;
        for (String member : component) {
            for (Edge edge : edges.get(member)) {
                if (component.contains(edge.callee)
                        && (first == null || edge.span.getStart() < first.span.getStart())) {
                    first = edge;
                }
            }
        }
        return first;
    }

    private List<String> orderBySource(Set<String> component) {
        List<String> ordered = new ArrayList<String>();
        for (String node : edges.keySet()) {
            if (component.contains(node)) {
                ordered.add(node);
            }
        }
        return ordered;
    }

    /**
     * 显式工作栈的 Tarjan 算法，调用链再长也不占用 Java 栈
     */
    private final class Tarjan {
        final Map<String, Integer> index = new HashMap<String, Integer>();
        final Map<String, Integer> lowLink = new HashMap<String, Integer>();
        final Deque<String> stack = new ArrayDeque<String>();
        final Set<String> onStack = new HashSet<String>();
        final List<List<String>> components = new ArrayList<List<String>>();
        int counter;

        /** 工作栈帧：节点及下一条待访问出边的下标 */
        private final class Visit {
            final String node;
            int next;

            Visit(String node) {
                this.node = node;
            }
        }

        void connect(String root) {
            Deque<Visit> work = new ArrayDeque<Visit>();
            work.push(enter(root));
            while (!work.isEmpty()) {
                Visit visit = work.peek();
                List<Edge> out = edges.get(visit.node);
                if (visit.next < out.size()) {
                    String callee = out.get(visit.next++).callee;
                    if (!index.containsKey(callee)) {
                        work.push(enter(callee));
                    } else if (onStack.contains(callee)) {
                        lower(visit.node, index.get(callee));
                    }
                    continue;
                }
                work.pop();
                if (!work.isEmpty()) {
                    lower(work.peek().node, lowLink.get(visit.node));
                }
                if (lowLink.get(visit.node).equals(index.get(visit.node))) {
                    List<String> component = new ArrayList<String>();
                    String member;
                    do {
                        member = stack.pop();
                        onStack.remove(member);
                        component.add(member);
                    } while (!member.equals(visit.node));
                    components.add(component);
                }
            }
        }

        private Visit enter(String node) {
            index.put(node, counter);
            lowLink.put(node, counter);
            counter++;
            stack.push(node);
            onStack.add(node);
            return new Visit(node);
        }

        private void lower(String node, int value) {
            lowLink.put(node, Math.min(lowLink.get(node), value));
        }
    }
}
