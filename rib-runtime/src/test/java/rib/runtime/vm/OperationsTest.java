package rib.runtime.vm;

import com.riblang.ir.bytecode.Opcode;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import rib.runtime.RibAsn;
import rib.runtime.RibCommunity;
import rib.runtime.RibExternal;
import rib.runtime.RibInt;
import rib.runtime.RibList;
import rib.runtime.RibRecord;
import rib.runtime.RibString;
import rib.runtime.RibUnit;
import rib.runtime.RibValue;

import static org.junit.jupiter.api.Assertions.*;

class OperationsTest {

    @Nested
    @DisplayName("比较")
    class CompareTests {

        @Test
        @DisplayName("Asn 按数值比较")
        void testAsnOrdering() {
            assertTrue(Operations.ordered(Opcode.LT, RibAsn.of(64512), RibAsn.of(4200000000L)));
            assertTrue(Operations.ordered(Opcode.GE, RibInt.of(3), RibInt.of(3)));
        }

        @Test
        @DisplayName("跨类型比较失败")
        void testMixedOrdering() {
            assertThrows(ClassCastException.class, () -> Operations.compare(RibInt.of(1), RibAsn.of(1)));
        }
    }

    @Nested
    @DisplayName("类型符合性")
    class ConformanceTests {

        @Test
        @DisplayName("列表逐个检查元素")
        void testList() {
            RibValue communities = RibList.of(RibCommunity.of(65000, 1), RibCommunity.of(65000, 2));
            assertTrue(Operations.conforms(communities, "List<Community>"));
            assertFalse(Operations.conforms(communities, "List<Int>"));
            assertTrue(Operations.conforms(RibList.EMPTY, "List<List<Int>>"));
            assertFalse(Operations.conforms(RibInt.of(1), "List<Int>"));
        }

        @Test
        @DisplayName("匿名记录、外部类型与 Unit")
        void testOtherTypes() {
            RibRecord record = new RibRecord(null, new String[]{"a"}, new RibValue[]{RibInt.of(1)});
            assertTrue(Operations.conforms(record, "{a: Int}"));
            assertTrue(Operations.conforms(RibExternal.of("Route", new Object()), "Route"));
            assertFalse(Operations.conforms(RibExternal.of("Peer", new Object()), "Route"));
            assertTrue(Operations.conforms(RibUnit.UNIT, "Unit"));
            assertFalse(Operations.conforms(RibString.of("x"), "Int"));
            assertFalse(Operations.conforms(null, "Int"));
        }
    }
}
