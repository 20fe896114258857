package com.lumenlang.ir.lowering;

import com.lumenlang.compiler.analysis.types.ClassLumenType;
import com.lumenlang.compiler.analysis.types.IntersectionLumenType;
import com.lumenlang.compiler.analysis.types.LumenType;
import com.lumenlang.compiler.analysis.types.LumenTypes;
import com.lumenlang.compiler.ast.SourceLocation;
import com.lumenlang.compiler.resolve.ResolvedArgument;
import com.lumenlang.ir.declarations.*;
import com.lumenlang.ir.expressions.*;
import com.lumenlang.ir.types.IrType;
import com.lumenlang.ir.types.IrTypePredicates;
import com.lumenlang.ir.util.IrRenderer;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.Arrays;

import static org.assertj.core.api.Assertions.*;

@DisplayName("实参挂起转换")
class SuspendConversionTest {

    private LoweringFixture fx;
    private AdapterSynthesizer synthesizer;
    private IrSimpleFunction host;

    @BeforeEach
    void setUp() {
        fx = new LoweringFixture();
        synthesizer = new AdapterSynthesizer(fx.context);
        host = fx.function("host", fx.builtIns.unitType());
    }

    /** host 的一个参数的读取表达式，作为待转换的实参 */
    private IrGetValue argumentOf(String name, IrType type) {
        return IrGetValue.of(40, 50, fx.parameter(host, name, type));
    }

    private static ResolvedArgument resolved(LumenType type) {
        return new ResolvedArgument(SourceLocation.ofOffsets(40, 50), type);
    }

    private static IrSimpleFunction adapterOf(IrExpression result) {
        return (IrSimpleFunction) ((IrBlock) result).getStatements().get(0);
    }

    @Nested
    @DisplayName("生成适配")
    class Converts {

        @Test
        @DisplayName("内置函数类型实参：调用 Function1.invoke，期望返回 Unit 时为裸调用")
        void builtinFunctionArgument() {
            IrGetValue argument = argumentOf("fn",
                    fx.functionType(fx.builtIns.unitType(), fx.builtIns.intType()));

            IrExpression result = synthesizer.synthesizeForArgument(argument,
                    resolved(LumenTypes.function(LumenTypes.UNIT, LumenTypes.INT)),
                    LumenTypes.suspendFunction(LumenTypes.UNIT, LumenTypes.INT));

            assertThat(result).isInstanceOf(IrBlock.class);
            IrBlock block = (IrBlock) result;
            assertThat(block.getOrigin()).isEqualTo(IrStatementOrigin.SUSPEND_CONVERSION);
            assertThat(IrTypePredicates.isSuspendFunction(block.getType())).isTrue();
            assertThat(IrRenderer.render(result)).isEqualTo(
                    "{ local suspend fun Function1<Int, Unit>.suspendConversion(p0: Int): Unit "
                            + "{ callee.invoke(p0) }; fn::suspendConversion }");

            IrFunctionReference reference = (IrFunctionReference) block.getStatements().get(1);
            assertThat(reference.getExtensionReceiver()).isSameAs(argument);
            assertThat(reference.getOrigin()).isEqualTo(IrStatementOrigin.SUSPEND_CONVERSION);
            assertThat(reference.getStartOffset()).isEqualTo(40);
        }

        @Test
        @DisplayName("适配函数的声明属性")
        void adapterDeclaration() {
            IrGetValue argument = argumentOf("fn",
                    fx.functionType(fx.builtIns.stringType(), fx.builtIns.intType()));

            IrSimpleFunction adapter = adapterOf(synthesizer.synthesizeForArgument(argument,
                    resolved(LumenTypes.function(LumenTypes.STRING, LumenTypes.INT)),
                    LumenTypes.suspendFunction(LumenTypes.STRING, LumenTypes.INT)));

            assertThat(adapter.getName()).isEqualTo("suspendConversion");
            assertThat(adapter.getOrigin()).isEqualTo(IrDeclarationOrigin.ADAPTER_FOR_SUSPEND_CONVERSION);
            assertThat(adapter.getVisibility()).isEqualTo(IrVisibility.LOCAL);
            assertThat(adapter.getModifiers()).containsExactly(IrModifier.SUSPEND);
            assertThat(adapter.getParent()).isSameAs(fx.file);
            IrValueParameter callee = adapter.getExtensionReceiverParameter();
            assertThat(callee.getName()).isEqualTo("callee");
            assertThat(callee.getType()).isEqualTo(argument.getType());
            assertThat(callee.getOrigin()).isEqualTo(IrDeclarationOrigin.ADAPTER_PARAMETER_FOR_SUSPEND_CONVERSION);
            assertThat(adapter.getBody().getStatements().get(0)).isInstanceOf(IrReturn.class);
            assertThat(IrRenderer.render(adapter.getBody())).isEqualTo("{ return callee.invoke(p0) }");
        }

        @Test
        @DisplayName("实现了函数类型的类：调用其 operator invoke")
        void contributedInvoke() {
            IrClass action = fx.userClass("Action");
            IrSimpleFunction invoke = fx.member(action, "invoke", fx.builtIns.unitType(), IrModifier.OPERATOR);
            fx.parameter(invoke, "x", fx.builtIns.intType());
            fx.registry.registerClass("Action", LumenTypes.function(LumenTypes.UNIT, LumenTypes.INT));
            IrGetValue argument = argumentOf("action", action.getDefaultType());

            IrExpression result = synthesizer.synthesizeForArgument(argument,
                    resolved(new ClassLumenType("Action", false)),
                    LumenTypes.suspendFunction(LumenTypes.UNIT, LumenTypes.INT));

            IrCall call = (IrCall) adapterOf(result).getBody().getStatements().get(0);
            assertThat(call.getSymbol()).isSameAs(invoke.getSymbol());
            assertThat(IrRenderer.render(call)).isEqualTo("callee.invoke(p0)");
        }

        @Test
        @DisplayName("没有 operator 修饰的 invoke 不算实现")
        void nonOperatorInvokeIgnored() {
            IrClass action = fx.userClass("Action");
            IrSimpleFunction invoke = fx.member(action, "invoke", fx.builtIns.unitType());
            fx.parameter(invoke, "x", fx.builtIns.intType());
            fx.registry.registerClass("Action", LumenTypes.function(LumenTypes.UNIT, LumenTypes.INT));
            IrGetValue argument = argumentOf("action", action.getDefaultType());

            IrExpression result = synthesizer.synthesizeForArgument(argument,
                    resolved(new ClassLumenType("Action", false)),
                    LumenTypes.suspendFunction(LumenTypes.UNIT, LumenTypes.INT));

            assertThat(result).isSameAs(argument);
        }

        @Test
        @DisplayName("同元数的 invoke 重载按参数类型选取")
        void invokeOverloadChosenByParameterType() {
            IrClass action = fx.userClass("Action");
            IrSimpleFunction invokeInt = fx.member(action, "invoke", fx.builtIns.unitType(), IrModifier.OPERATOR);
            fx.parameter(invokeInt, "x", fx.builtIns.intType());
            IrSimpleFunction invokeString = fx.member(action, "invoke", fx.builtIns.unitType(), IrModifier.OPERATOR);
            fx.parameter(invokeString, "s", fx.builtIns.stringType());
            fx.registry.registerClass("Action",
                    LumenTypes.function(LumenTypes.UNIT, LumenTypes.INT),
                    LumenTypes.function(LumenTypes.UNIT, LumenTypes.STRING));
            IrGetValue argument = argumentOf("action", action.getDefaultType());

            IrSimpleFunction adapter = adapterOf(synthesizer.synthesizeForArgument(argument,
                    resolved(new ClassLumenType("Action", false)),
                    LumenTypes.suspendFunction(LumenTypes.UNIT, LumenTypes.STRING)));

            IrCall call = (IrCall) adapter.getBody().getStatements().get(0);
            assertThat(call.getSymbol()).isSameAs(invokeString.getSymbol());
            assertThat(adapter.getValueParameters().get(0).getType()).isEqualTo(fx.builtIns.stringType());
        }

        @Test
        @DisplayName("invoke 返回类型不一致时不生成适配")
        void invokeReturnTypeMismatch() {
            IrClass action = fx.userClass("Action");
            IrSimpleFunction invoke = fx.member(action, "invoke", fx.builtIns.stringType(), IrModifier.OPERATOR);
            fx.parameter(invoke, "x", fx.builtIns.intType());
            fx.registry.registerClass("Action", LumenTypes.function(LumenTypes.UNIT, LumenTypes.INT));
            IrGetValue argument = argumentOf("action", action.getDefaultType());

            IrExpression result = synthesizer.synthesizeForArgument(argument,
                    resolved(new ClassLumenType("Action", false)),
                    LumenTypes.suspendFunction(LumenTypes.UNIT, LumenTypes.INT));

            assertThat(result).isSameAs(argument);
            assertThat(fx.symbolTable.getDeclaredFunctionCount()).isZero();
        }
    }

    @Nested
    @DisplayName("原样返回")
    class Unchanged {

        private IrGetValue argument;

        @BeforeEach
        void declare() {
            argument = argumentOf("fn", fx.functionType(fx.builtIns.unitType(), fx.builtIns.intType()));
        }

        private IrExpression convert(LumenType argumentType, LumenType expected) {
            return synthesizer.synthesizeForArgument(argument, resolved(argumentType), expected);
        }

        @Test
        @DisplayName("期望类型不是挂起函数类型")
        void expectedNotSuspend() {
            assertThat(convert(LumenTypes.function(LumenTypes.UNIT, LumenTypes.INT),
                    LumenTypes.function(LumenTypes.UNIT, LumenTypes.INT))).isSameAs(argument);
        }

        @Test
        @DisplayName("实参已经是挂起函数")
        void argumentAlreadySuspend() {
            assertThat(convert(LumenTypes.suspendFunction(LumenTypes.UNIT, LumenTypes.INT),
                    LumenTypes.suspendFunction(LumenTypes.UNIT, LumenTypes.INT))).isSameAs(argument);
        }

        @Test
        @DisplayName("没有期望类型")
        void noExpectedType() {
            assertThat(convert(LumenTypes.function(LumenTypes.UNIT, LumenTypes.INT), null)).isSameAs(argument);
        }

        @Test
        @DisplayName("交集类型实参")
        void intersection() {
            LumenType intersection = new IntersectionLumenType(Arrays.<LumenType>asList(
                    LumenTypes.function(LumenTypes.UNIT, LumenTypes.INT), new ClassLumenType("Marker", false)));
            assertThat(convert(intersection, LumenTypes.suspendFunction(LumenTypes.UNIT, LumenTypes.INT)))
                    .isSameAs(argument);
        }

        @Test
        @DisplayName("没有实现函数类型的类")
        void unrelatedClass() {
            assertThat(convert(new ClassLumenType("Plain", false),
                    LumenTypes.suspendFunction(LumenTypes.UNIT, LumenTypes.INT))).isSameAs(argument);
        }

        @Test
        @DisplayName("元数不同的函数类型")
        void arityMismatch() {
            assertThat(convert(LumenTypes.function(LumenTypes.UNIT, LumenTypes.INT, LumenTypes.INT),
                    LumenTypes.suspendFunction(LumenTypes.UNIT, LumenTypes.INT))).isSameAs(argument);
        }

        @Test
        @DisplayName("关闭挂起转换")
        void disabled() {
            fx.settings.setSuspendConversionEnabled(false);
            assertThat(convert(LumenTypes.function(LumenTypes.UNIT, LumenTypes.INT),
                    LumenTypes.suspendFunction(LumenTypes.UNIT, LumenTypes.INT))).isSameAs(argument);
        }

        @Test
        @DisplayName("已经转换过的块不再包装")
        void idempotent() {
            LumenType expected = LumenTypes.suspendFunction(LumenTypes.UNIT, LumenTypes.INT);
            IrExpression once = convert(LumenTypes.function(LumenTypes.UNIT, LumenTypes.INT), expected);

            IrExpression twice = synthesizer.synthesizeForArgument(once,
                    resolved(LumenTypes.function(LumenTypes.UNIT, LumenTypes.INT)), expected);

            assertThat(twice).isSameAs(once);
            assertThat(fx.symbolTable.getDeclaredFunctionCount()).isEqualTo(1);
        }

        @Test
        @DisplayName("可调用引用的适配块同样不再包装")
        void adaptedReferenceBlockUntouched() {
            IrBlock adapted = new IrBlock(40, 50, argument.getType(), IrStatementOrigin.ADAPTED_FUNCTION_REFERENCE);

            IrExpression result = synthesizer.synthesizeForArgument(adapted,
                    resolved(LumenTypes.function(LumenTypes.UNIT, LumenTypes.INT)),
                    LumenTypes.suspendFunction(LumenTypes.UNIT, LumenTypes.INT));

            assertThat(result).isSameAs(adapted);
            assertThat(fx.symbolTable.getDeclaredFunctionCount()).isZero();
        }
    }
}
