package com.riblang.compiler.host;

import com.riblang.compiler.analysis.types.EnumType;
import com.riblang.compiler.analysis.types.ExternalType;
import com.riblang.compiler.analysis.types.ListType;
import com.riblang.compiler.analysis.types.RecordType;
import com.riblang.compiler.analysis.types.RibTypes;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.Arrays;

import static org.junit.jupiter.api.Assertions.*;

/**
 * 外部类型表登记与解析测试
 */
class ExternalTypeTableTest {

    @Nested
    @DisplayName("登记与查询")
    class LookupTests {

        private final ExternalTypeTable table = ExternalTypeTable.builder()
                // 引用先于登记：解析在 build() 时进行
                .type("Route")
                    .field("origin", "Origin")
                    .field("communities", "List<Community>")
                    .method("has_community", "Bool", "Community")
                    .done()
                .enumType("Origin", "Igp", "Egp", "Incomplete")
                .record("PeerInfo")
                    .field("asn", "Asn")
                    .field("address", "IpAddr")
                    .done()
                .enumType("Verdict")
                    .variant("Keep")
                    .variant("Tag", "String", "Int")
                    .done()
                .function("is_bogon", "Bool", "Prefix")
                .build();

        @Test
        @DisplayName("外部类型、枚举与记录")
        void testTypes() {
            assertTrue(table.findType("Route") instanceof ExternalType);
            EnumType origin = (EnumType) table.findType("Origin");
            assertEquals(3, origin.getVariants().size());
            assertEquals(2, origin.findVariant("Incomplete").getTag());

            RecordType peer = (RecordType) table.findType("PeerInfo");
            assertEquals("PeerInfo", peer.getName());
            assertEquals(RibTypes.ASN, peer.getField("asn").getType());

            EnumType verdict = (EnumType) table.findType("Verdict");
            assertEquals(2, verdict.findVariant("Tag").getPayload().size());
            assertNull(table.findType("Missing"));
        }

        @Test
        @DisplayName("字段、方法与函数签名")
        void testMembers() {
            ExternalMember origin = table.findField("Route", "origin");
            assertEquals(ExternalMember.Kind.FIELD, origin.getKind());
            assertSame(table.findType("Origin"), origin.getReturnType());
            assertEquals(new ListType(RibTypes.COMMUNITY), table.findField("Route", "communities").getReturnType());

            ExternalMember method = table.findMethod("Route", "has_community");
            assertEquals("Route.has_community", method.getSymbol());
            assertEquals(2, method.getHostArity());
            assertNull(table.findField("Route", "has_community"));

            ExternalMember function = table.findFunction("is_bogon");
            assertEquals("is_bogon", function.getSymbol());
            assertEquals(1, function.getHostArity());
            assertEquals(RibTypes.BOOL, function.getReturnType());
        }

        @Test
        @DisplayName("全部类型名")
        void testTypeNames() {
            assertEquals(4, table.getTypeNames().size());
            assertTrue(table.getTypeNames().containsAll(Arrays.asList("Route", "Origin", "PeerInfo", "Verdict")));
        }
    }

    @Nested
    @DisplayName("登记错误")
    class RegistrationErrorTests {

        @Test
        @DisplayName("与内置类型同名")
        void testBuiltinName() {
            assertThrows(ExternalTypeTable.RegistrationException.class,
                    () -> ExternalTypeTable.builder().type("Prefix"));
        }

        @Test
        @DisplayName("重复的类型、成员与函数")
        void testDuplicates() {
            assertThrows(ExternalTypeTable.RegistrationException.class,
                    () -> ExternalTypeTable.builder().type("Route").done().enumType("Route", "A"));
            assertThrows(ExternalTypeTable.RegistrationException.class,
                    () -> ExternalTypeTable.builder().type("Route").field("x", "Int").method("x", "Int"));
            assertThrows(ExternalTypeTable.RegistrationException.class,
                    () -> ExternalTypeTable.builder().function("f", "Int").function("f", "Bool"));
            assertThrows(ExternalTypeTable.RegistrationException.class,
                    () -> ExternalTypeTable.builder().enumType("E", "A", "A"));
        }

        @Test
        @DisplayName("签名引用未登记的类型")
        void testUnknownType() {
            ExternalTypeTable.RegistrationException e = assertThrows(ExternalTypeTable.RegistrationException.class,
                    () -> ExternalTypeTable.builder().type("Route").field("foo", "Nope").done().build());
            assertEquals("Unknown type 'Nope' in Route.foo", e.getMessage());
        }

        @Test
        @DisplayName("递归的记录类型")
        void testRecursiveRecord() {
            ExternalTypeTable.RegistrationException e = assertThrows(ExternalTypeTable.RegistrationException.class,
                    () -> ExternalTypeTable.builder().record("Node").field("next", "List<Node>").done().build());
            assertEquals("Recursive type 'Node'", e.getMessage());
        }

        @Test
        @DisplayName("构建后不可再登记")
        void testFrozen() {
            ExternalTypeTable.Builder builder = ExternalTypeTable.builder();
            builder.build();
            assertThrows(ExternalTypeTable.RegistrationException.class, () -> builder.type("Late"));
            assertThrows(ExternalTypeTable.RegistrationException.class, () -> builder.function("late", "Int"));
        }
    }
}
