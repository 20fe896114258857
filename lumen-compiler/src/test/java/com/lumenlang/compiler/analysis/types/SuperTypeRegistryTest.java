package com.lumenlang.compiler.analysis.types;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.Arrays;

import static org.assertj.core.api.Assertions.*;

@DisplayName("SuperTypeRegistry 子类型判断")
class SuperTypeRegistryTest {

    private SuperTypeRegistry registry;

    @BeforeEach
    void setUp() {
        registry = new SuperTypeRegistry();
    }

    @Nested
    @DisplayName("按类名")
    class ByName {

        @Test
        @DisplayName("内置继承关系")
        void builtinHierarchy() {
            assertThat(registry.isSubtype("Int", "Number")).isTrue();
            assertThat(registry.isSubtype("Int", "Comparable")).isTrue();
            assertThat(registry.isSubtype("String", "Any")).isTrue();
            assertThat(registry.isSubtype("Nothing", "String")).isTrue();
            assertThat(registry.isSubtype("Number", "Int")).isFalse();
        }

        @Test
        @DisplayName("用户类可多次追加超类型")
        void registerAppends() {
            registry.registerClass("Base");
            registry.registerClass("Derived", new ClassLumenType("Base", false));
            registry.registerClass("Derived", new ClassLumenType("Marker", false));

            assertThat(registry.getSuperTypes("Derived")).hasSize(2);
            assertThat(registry.isSubtype("Derived", "Base")).isTrue();
            assertThat(registry.isSubtype("Derived", "Marker")).isTrue();
            assertThat(registry.getSuperTypes("Unknown")).isEmpty();
        }
    }

    @Nested
    @DisplayName("函数类型")
    class Functions {

        @Test
        @DisplayName("参数逆变、返回值协变")
        void variance() {
            FunctionLumenType takesAnyReturnsInt = LumenTypes.function(LumenTypes.INT, LumenTypes.ANY);
            FunctionLumenType takesIntReturnsAny = LumenTypes.function(LumenTypes.ANY, LumenTypes.INT);

            assertThat(registry.isSubtype(takesAnyReturnsInt, takesIntReturnsAny)).isTrue();
            assertThat(registry.isSubtype(takesIntReturnsAny, takesAnyReturnsInt)).isFalse();
        }

        @Test
        @DisplayName("suspend 标记必须一致")
        void suspendMustMatch() {
            FunctionLumenType plain = LumenTypes.function(LumenTypes.UNIT, LumenTypes.INT);
            FunctionLumenType suspending = LumenTypes.suspendFunction(LumenTypes.UNIT, LumenTypes.INT);

            assertThat(registry.isSubtype(plain, suspending)).isFalse();
            assertThat(registry.isSubtype(suspending, plain)).isFalse();
        }

        @Test
        @DisplayName("类通过超类型实现函数类型")
        void classImplementsFunction() {
            FunctionLumenType intToString = LumenTypes.function(LumenTypes.STRING, LumenTypes.INT);
            registry.registerClass("Formatter", intToString);
            registry.registerClass("HexFormatter", new ClassLumenType("Formatter", false));

            assertThat(registry.isSubtype(new ClassLumenType("HexFormatter", false), intToString)).isTrue();
            assertThat(registry.isSubtype(new ClassLumenType("HexFormatter", false),
                    LumenTypes.function(LumenTypes.STRING, LumenTypes.STRING))).isFalse();
        }
    }

    @Nested
    @DisplayName("其他类型")
    class Others {

        @Test
        @DisplayName("同名类比较类型实参，* 接受任意实参")
        void typeArguments() {
            ClassLumenType listOfInt = LumenTypes.listOf(LumenTypes.INT);
            ClassLumenType listOfString = LumenTypes.listOf(LumenTypes.STRING);
            ClassLumenType listOfStar = new ClassLumenType("List",
                    Arrays.asList(LumenTypeArgument.wildcard()), false);

            assertThat(registry.isSubtype(listOfInt, listOfString)).isFalse();
            assertThat(registry.isSubtype(listOfInt, listOfStar)).isTrue();
        }

        @Test
        @DisplayName("可空类型不是非空类型的子类型")
        void nullability() {
            assertThat(registry.isSubtype(LumenTypes.nullable(LumenTypes.INT), LumenTypes.INT)).isFalse();
            assertThat(registry.isSubtype(LumenTypes.INT, LumenTypes.nullable(LumenTypes.INT))).isTrue();
        }

        @Test
        @DisplayName("类型参数按上界、交集按任一成员判断")
        void typeParameterAndIntersection() {
            TypeParameterType t = new TypeParameterType("T", LumenTypes.STRING, false);
            IntersectionLumenType both = new IntersectionLumenType(
                    Arrays.<LumenType>asList(LumenTypes.INT, LumenTypes.STRING));

            assertThat(registry.isSubtype(t, new ClassLumenType("Comparable", false))).isTrue();
            assertThat(registry.isSubtype(both, LumenTypes.STRING)).isTrue();
            assertThat(registry.isSubtype(both, LumenTypes.BOOLEAN)).isFalse();
        }
    }
}
