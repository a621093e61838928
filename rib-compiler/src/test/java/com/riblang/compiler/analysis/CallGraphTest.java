package com.riblang.compiler.analysis;

import com.riblang.compiler.ast.Span;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * 调用图环检测测试
 */
class CallGraphTest {

    private static Span at(int offset) {
        return new Span(offset, offset + 1, "<test>");
    }

    @Test
    @DisplayName("无环调用图没有递归")
    void testAcyclic() {
        CallGraph graph = new CallGraph();
        graph.addEdge("a", "b", at(1));
        graph.addEdge("b", "c", at(2));
        graph.addEdge("a", "c", at(3));
        assertTrue(graph.findCycles().isEmpty());
    }

    @Test
    @DisplayName("自环与相互递归分别成环，成员按声明顺序排列")
    void testCycles() {
        CallGraph graph = new CallGraph();
        graph.addNode("main");
        graph.addNode("even");
        graph.addNode("odd");
        graph.addEdge("main", "even", at(1));
        graph.addEdge("even", "odd", at(20));
        graph.addEdge("odd", "even", at(10));
        graph.addEdge("loop", "loop", at(30));

        List<CallGraph.Cycle> cycles = graph.findCycles();
        assertEquals(2, cycles.size());
        CallGraph.Cycle mutual = cycles.get(0).members.size() == 2 ? cycles.get(0) : cycles.get(1);
        CallGraph.Cycle self = mutual == cycles.get(0) ? cycles.get(1) : cycles.get(0);
        assertEquals(Arrays.asList("even", "odd"), mutual.members);
        assertEquals(10, mutual.span.getStart());
        assertEquals(Arrays.asList("loop"), self.members);
    }

    @Test
    @DisplayName("很长的调用链不耗尽 Java 栈")
    void testLongChain() {
        CallGraph graph = new CallGraph();
        int length = 100000;
        for (int i = 0; i < length; i++) {
            graph.addEdge("f" + i, "f" + (i + 1), at(i));
        }
        assertTrue(assertDoesNotThrow(graph::findCycles).isEmpty());

        graph.addEdge("f" + length, "f0", at(length));
        List<CallGraph.Cycle> cycles = graph.findCycles();
        assertEquals(1, cycles.size());
        assertEquals(length + 1, cycles.get(0).members.size());
        assertEquals("f0", cycles.get(0).members.get(0));
    }
}
